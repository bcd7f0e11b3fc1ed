package com.github.spud.agentmesh.domain.error;

import java.time.Duration;
import lombok.Getter;

@Getter
public class RunTimeoutException extends AgentMeshException {

  private final Duration deadline;

  public RunTimeoutException(String agentName, Duration deadline) {
    super(ErrorKind.TIMEOUT, "Call to " + agentName + " exceeded its deadline of " + deadline);
    this.deadline = deadline;
  }
}
