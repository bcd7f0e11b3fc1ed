package com.github.spud.agentmesh.domain.orchestration;

public enum FanOutPolicy {
  /**
   * The first failing branch cancels the others and fails the whole fan-out.
   */
  FAIL_FAST,
  /**
   * Every branch runs; failures are reported per branch.
   */
  BEST_EFFORT
}
