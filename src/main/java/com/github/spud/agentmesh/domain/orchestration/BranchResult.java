package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.protocol.RunError;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;
import lombok.Value;

/**
 * Outcome of one fan-out branch: either the agent's result or its error.
 */
@Value
public class BranchResult {

  int index;

  Branch branch;

  RunOutcome outcome;

  RunError error;

  public static BranchResult success(int index, Branch branch, RunOutcome outcome) {
    return new BranchResult(index, branch, outcome, null);
  }

  public static BranchResult failure(int index, Branch branch, RunError error) {
    return new BranchResult(index, branch, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
