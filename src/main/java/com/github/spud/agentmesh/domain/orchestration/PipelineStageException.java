package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.error.AgentMeshException;
import lombok.Getter;

/**
 * A pipeline stopped at this stage. Reports the stage error's kind.
 */
@Getter
public class PipelineStageException extends AgentMeshException {

  private final int stageIndex;

  private final String agentName;

  public PipelineStageException(int stageIndex, String agentName, Throwable cause) {
    super(AgentMeshException.kindOf(cause),
      "Pipeline stage " + stageIndex + " (" + agentName + ") failed: " + cause.getMessage(),
      cause);
    this.stageIndex = stageIndex;
    this.agentName = agentName;
  }
}
