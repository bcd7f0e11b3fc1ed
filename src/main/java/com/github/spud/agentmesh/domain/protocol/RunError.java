package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.error.MalformedResponseException;
import com.github.spud.agentmesh.domain.error.RunFailedException;
import lombok.Value;

/**
 * Classification and human-readable reason attached to a failed Run.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunError {

  ErrorKind kind;

  String reason;

  /**
   * Offending payload, only for {@link ErrorKind#MALFORMED_RESPONSE}.
   */
  String raw;

  @JsonCreator
  public RunError(@JsonProperty("kind") ErrorKind kind, @JsonProperty("reason") String reason,
    @JsonProperty("raw") String raw) {
    this.kind = kind != null ? kind : ErrorKind.AGENT_FAILED;
    this.reason = reason != null ? reason : "unknown error";
    this.raw = raw;
  }

  public static RunError of(ErrorKind kind, String reason) {
    return new RunError(kind, reason, null);
  }

  public static RunError from(Throwable error) {
    String reason = error.getMessage() != null ? error.getMessage()
      : error.getClass().getSimpleName();
    if (error instanceof MalformedResponseException malformed) {
      return new RunError(ErrorKind.MALFORMED_RESPONSE, reason, malformed.getRawPayload());
    }
    return new RunError(AgentMeshException.kindOf(error), reason, null);
  }

  public AgentMeshException toException(String runId) {
    if (kind == ErrorKind.MALFORMED_RESPONSE) {
      return new MalformedResponseException(reason, raw);
    }
    return new RunFailedException(runId, kind, reason);
  }
}
