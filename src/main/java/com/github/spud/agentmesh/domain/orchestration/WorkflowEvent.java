package com.github.spud.agentmesh.domain.orchestration;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Progress notification of a fan-out, pipeline or debate.
 */
@Value
@Builder
public class WorkflowEvent {

  String sessionId;

  /**
   * {@code fan-out}, {@code pipeline} or {@code debate}.
   */
  String workflow;

  WorkflowEventType type;

  String agentName;

  Integer round;

  Integer index;

  String detail;

  @Builder.Default
  Instant timestamp = Instant.now();
}
