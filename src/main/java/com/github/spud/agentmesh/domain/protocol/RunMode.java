package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunMode {
  SYNC,
  STREAM;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static RunMode fromWire(String value) {
    if (value == null || value.isBlank()) {
      return SYNC;
    }
    return valueOf(value.trim().toUpperCase());
  }
}
