package com.github.spud.agentmesh.domain.error;

import lombok.Getter;

@Getter
public class AgentNotFoundException extends AgentMeshException {

  private final String agentName;

  public AgentNotFoundException(String agentName) {
    super(ErrorKind.AGENT_NOT_FOUND, "Agent not found: " + agentName);
    this.agentName = agentName;
  }
}
