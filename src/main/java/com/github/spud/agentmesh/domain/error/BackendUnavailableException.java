package com.github.spud.agentmesh.domain.error;

public class BackendUnavailableException extends AgentMeshException {

  public BackendUnavailableException(String message) {
    super(ErrorKind.BACKEND_UNAVAILABLE, message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
  }
}
