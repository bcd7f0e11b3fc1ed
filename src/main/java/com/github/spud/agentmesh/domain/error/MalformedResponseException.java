package com.github.spud.agentmesh.domain.error;

import lombok.Getter;

/**
 * The backend answered with something that is not a valid protocol document or event. The raw
 * payload is kept for diagnosis.
 */
@Getter
public class MalformedResponseException extends AgentMeshException {

  private final String rawPayload;

  public MalformedResponseException(String message, String rawPayload) {
    super(ErrorKind.MALFORMED_RESPONSE, message);
    this.rawPayload = rawPayload;
  }

  public MalformedResponseException(String message, String rawPayload, Throwable cause) {
    super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    this.rawPayload = rawPayload;
  }
}
