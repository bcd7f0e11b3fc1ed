package com.github.spud.agentmesh.domain.error;

import lombok.Getter;

/**
 * A Run reached the failed state. The kind is the classification the Run carried.
 */
@Getter
public class RunFailedException extends AgentMeshException {

  private final String runId;

  public RunFailedException(String runId, ErrorKind kind, String reason) {
    super(kind, reason);
    this.runId = runId;
  }
}
