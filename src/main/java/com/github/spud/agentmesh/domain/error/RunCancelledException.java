package com.github.spud.agentmesh.domain.error;

public class RunCancelledException extends AgentMeshException {

  public RunCancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }
}
