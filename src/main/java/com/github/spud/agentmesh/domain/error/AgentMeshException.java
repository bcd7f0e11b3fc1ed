package com.github.spud.agentmesh.domain.error;

import lombok.Getter;

/**
 * Base type of every failure surfaced by the registry, router and orchestration engine.
 */
@Getter
public class AgentMeshException extends RuntimeException {

  private final ErrorKind kind;

  public AgentMeshException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public AgentMeshException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Classification of an arbitrary throwable, {@link ErrorKind#AGENT_FAILED} when unknown.
   */
  public static ErrorKind kindOf(Throwable error) {
    if (error instanceof AgentMeshException meshException) {
      return meshException.getKind();
    }
    return ErrorKind.AGENT_FAILED;
  }
}
