package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.router.CallOptions;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class DebateRequest {

  @NonNull
  String topic;

  /**
   * Speaking order within each round.
   */
  @Singular
  List<String> participants;

  @Builder.Default
  int rounds = 1;

  /**
   * Number of most recent transcript entries a speaker sees, all of them when null.
   */
  Integer contextWindow;

  /**
   * Agent that turns the full transcript into a verdict, none when null.
   */
  String synthesizer;

  /**
   * Drive each turn as a stream call and relay thoughts and messages while it runs.
   */
  boolean streaming;

  @Builder.Default
  CallOptions callOptions = CallOptions.defaults();
}
