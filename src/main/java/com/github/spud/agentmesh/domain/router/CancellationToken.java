package com.github.spud.agentmesh.domain.router;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Caller-held switch that aborts an in-flight call. Cancelling twice is harmless.
 */
public final class CancellationToken {

  private final Sinks.One<Boolean> signal = Sinks.one();

  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
    signal.tryEmitValue(Boolean.TRUE);
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Emits once the token is cancelled.
   */
  public Mono<Boolean> whenCancelled() {
    return signal.asMono();
  }
}
