package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.state.RunState;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable snapshot of one invocation of an agent. Every state transition produces a new
 * snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Run {

  String id;

  String agentName;

  List<Message> input;

  RunMode mode;

  RunState state;

  Instant createdAt;

  Instant finishedAt;

  List<Message> output;

  RunError error;

  /**
   * The snapshot without its message lists, as carried in event payloads.
   */
  public Run summary() {
    return toBuilder().input(null).output(null).build();
  }

  @JsonIgnore
  public boolean isTerminal() {
    return RunState.isFinal(state);
  }
}
