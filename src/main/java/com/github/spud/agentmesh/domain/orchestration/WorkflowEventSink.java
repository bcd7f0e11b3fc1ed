package com.github.spud.agentmesh.domain.orchestration;

/**
 * Receiver of workflow progress, e.g. a transcript store or a dashboard feed.
 */
@FunctionalInterface
public interface WorkflowEventSink {

  void publish(WorkflowEvent event);
}
