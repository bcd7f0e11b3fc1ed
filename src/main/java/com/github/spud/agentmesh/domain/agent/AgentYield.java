package com.github.spud.agentmesh.domain.agent;

import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.message.Part;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One step of a local agent's output: a thought, a message part, the end of the current message
 * or a whole message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AgentYield {

  public enum Kind {
    THOUGHT,
    PART,
    END_MESSAGE,
    MESSAGE
  }

  Kind kind;

  Map<String, Object> generic;

  Part part;

  Message message;

  public static AgentYield thought(String thought) {
    return generic(Map.of("thought", thought));
  }

  public static AgentYield generic(Map<String, Object> generic) {
    return new AgentYield(Kind.THOUGHT, Map.copyOf(generic), null, null);
  }

  public static AgentYield part(String content) {
    return part(Part.text(content));
  }

  public static AgentYield part(Part part) {
    return new AgentYield(Kind.PART, null, part, null);
  }

  public static AgentYield endMessage() {
    return new AgentYield(Kind.END_MESSAGE, null, null, null);
  }

  public static AgentYield message(Message message) {
    return new AgentYield(Kind.MESSAGE, null, null, message);
  }

  public static AgentYield message(String content) {
    return message(Message.agent(content));
  }
}
