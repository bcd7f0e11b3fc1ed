package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire types of streamed Run events.
 */
public enum RunEventType {
  RUN_CREATED("run.created"),
  RUN_IN_PROGRESS("run.in-progress"),
  GENERIC("generic"),
  MESSAGE_PART("message.part"),
  MESSAGE_COMPLETED("message.completed"),
  RUN_COMPLETED("run.completed"),
  RUN_FAILED("run.failed");

  private final String wireName;

  RunEventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static RunEventType fromWire(String value) {
    for (RunEventType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown run event type: " + value);
  }

  public boolean isTerminal() {
    return this == RUN_COMPLETED || this == RUN_FAILED;
  }
}
