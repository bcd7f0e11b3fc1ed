package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.message.Message;
import lombok.Value;

/**
 * One completed debate turn.
 */
@Value
public class TranscriptEntry {

  int round;

  String speaker;

  Message message;

  /**
   * The entry as seen by later speakers.
   */
  public Message asContext() {
    return Message.agent(speaker + " (round " + round + "): " + message.text());
  }
}
