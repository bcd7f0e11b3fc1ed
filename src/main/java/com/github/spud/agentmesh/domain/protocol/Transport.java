package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which backend path served a call.
 */
public enum Transport {
  LOCAL,
  HTTP;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
