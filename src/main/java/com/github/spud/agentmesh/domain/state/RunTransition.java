package com.github.spud.agentmesh.domain.state;

/**
 * Triggers of the Run state machine
 */
public enum RunTransition {
  /**
   * Backend started producing output
   */
  START(RunState.IN_PROGRESS),

  /**
   * Output fully assembled
   */
  COMPLETE(RunState.COMPLETED),

  /**
   * Backend failure, timeout or cancellation
   */
  FAIL(RunState.FAILED);

  private final RunState target;

  RunTransition(RunState target) {
    this.target = target;
  }

  /**
   * State reached when the machine accepts this trigger.
   */
  public RunState target() {
    return target;
  }
}
