package com.github.spud.agentmesh.domain.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingWorkflowEventSink implements WorkflowEventSink {

  @Override
  public void publish(WorkflowEvent event) {
    log.info("[{} {}] {} agent={} round={} index={} {}", event.getWorkflow(),
      event.getSessionId(), event.getType(), event.getAgentName(), event.getRound(),
      event.getIndex(), event.getDetail() != null ? event.getDetail() : "");
  }
}
