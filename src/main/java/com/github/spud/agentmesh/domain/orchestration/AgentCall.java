package com.github.spud.agentmesh.domain.orchestration;

import lombok.Value;

/**
 * One delegation request found in an orchestrator's reply.
 */
@Value
public class AgentCall {

  String agentName;

  String task;
}
