package com.github.spud.agentmesh.domain.registry;

public enum AgentKind {
  /**
   * In-process capability.
   */
  LOCAL,
  /**
   * Agent reached over the HTTP run protocol.
   */
  REMOTE
}
