package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.error.AgentMeshException;
import lombok.Getter;

/**
 * A fail-fast fan-out stopped because of this branch. Reports the branch error's kind.
 */
@Getter
public class BranchFailedException extends AgentMeshException {

  private final int branchIndex;

  private final String agentName;

  public BranchFailedException(int branchIndex, String agentName, Throwable cause) {
    super(AgentMeshException.kindOf(cause),
      "Branch " + branchIndex + " (" + agentName + ") failed: " + cause.getMessage(), cause);
    this.branchIndex = branchIndex;
    this.agentName = agentName;
  }
}
