package com.github.spud.agentmesh.domain.orchestration;

public enum WorkflowEventType {
  SESSION_STARTED,
  ROUND_STARTED,
  TURN_COMPLETED,
  THOUGHT_RELAYED,
  MESSAGE_RELAYED,
  CALL_COMPLETED,
  BRANCH_COMPLETED,
  STAGE_COMPLETED,
  SYNTHESIS_COMPLETED,
  SESSION_FINISHED
}
