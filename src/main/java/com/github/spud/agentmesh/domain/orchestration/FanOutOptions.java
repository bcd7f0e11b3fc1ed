package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.router.CallOptions;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FanOutOptions {

  @Builder.Default
  FanOutPolicy policy = FanOutPolicy.FAIL_FAST;

  /**
   * Concurrency limit, the configured default when null.
   */
  Integer concurrency;

  /**
   * Agent that merges the successful branch outputs, none when null.
   */
  String synthesizer;

  @Builder.Default
  CallOptions callOptions = CallOptions.defaults();

  public static FanOutOptions failFast() {
    return FanOutOptions.builder().policy(FanOutPolicy.FAIL_FAST).build();
  }

  public static FanOutOptions bestEffort() {
    return FanOutOptions.builder().policy(FanOutPolicy.BEST_EFFORT).build();
  }
}
