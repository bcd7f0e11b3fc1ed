package com.github.spud.agentmesh.domain.router;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call overrides. A null timeout means the configured router default.
 */
@Value
@Builder(toBuilder = true)
public class CallOptions {

  Duration timeout;

  @Builder.Default
  CancellationToken cancellationToken = new CancellationToken();

  public static CallOptions defaults() {
    return CallOptions.builder().build();
  }

  public static CallOptions withTimeout(Duration timeout) {
    return CallOptions.builder().timeout(timeout).build();
  }

  public static CallOptions withToken(CancellationToken token) {
    return CallOptions.builder().cancellationToken(token).build();
  }
}
