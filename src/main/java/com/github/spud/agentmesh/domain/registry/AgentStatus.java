package com.github.spud.agentmesh.domain.registry;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Last observed health of an agent.
 */
public enum AgentStatus {
  REGISTERED,
  ONLINE,
  OFFLINE,
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
