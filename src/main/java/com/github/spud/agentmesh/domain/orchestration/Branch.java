package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.message.Message;
import java.util.List;
import lombok.Value;

/**
 * One fan-out request: which agent to call with which input.
 */
@Value
public class Branch {

  String agentName;

  List<Message> input;

  public static Branch of(String agentName, List<Message> input) {
    return new Branch(agentName, List.copyOf(input));
  }

  public static Branch of(String agentName, String prompt) {
    return new Branch(agentName, List.of(Message.user(prompt)));
  }
}
