package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Outcome of every stage in order; {@link #output} is the last stage's output.
 */
@Value
public class PipelineResult {

  String sessionId;

  List<RunOutcome> stages;

  List<Message> output;

  PipelineResult append(RunOutcome outcome) {
    List<RunOutcome> next = new ArrayList<>(stages);
    next.add(outcome);
    return new PipelineResult(sessionId, List.copyOf(next), outcome.getOutput());
  }
}
