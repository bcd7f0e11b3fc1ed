package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.spud.agentmesh.domain.message.Message;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a sync call: final Run snapshot, output messages, elapsed time and transport.
 */
@Value
@Builder
public class RunOutcome {

  Run run;

  List<Message> output;

  long elapsedMs;

  Transport transport;

  @JsonIgnore
  public String text() {
    return Message.text(output);
  }
}
