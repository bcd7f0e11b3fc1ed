package com.github.spud.agentmesh.domain.orchestration;

public enum SessionStatus {
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
