package com.github.spud.agentmesh.domain.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who produced a message.
 */
public enum MessageRole {
  USER("user"),
  AGENT("agent");

  private final String wireName;

  MessageRole(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static MessageRole fromWire(String value) {
    if (value == null) {
      return USER;
    }
    for (MessageRole role : values()) {
      if (role.wireName.equalsIgnoreCase(value)) {
        return role;
      }
    }
    // peers may qualify the role, e.g. "agent/researcher"
    return value.toLowerCase().startsWith("agent") ? AGENT : USER;
  }
}
