package com.github.spud.agentmesh.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Run lifecycle states
 * <pre>
 * CREATED → IN_PROGRESS → COMPLETED
 *                       → FAILED
 * CREATED → FAILED
 * </pre>
 */
public enum RunState {
  /**
   * Accepted, no backend work yet
   */
  CREATED("created"),

  /**
   * Backend is producing output
   */
  IN_PROGRESS("in-progress"),

  /**
   * Terminal success
   */
  COMPLETED("completed"),

  /**
   * Terminal failure
   */
  FAILED("failed");

  private final String wireName;

  RunState(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static RunState fromWire(String value) {
    for (RunState state : values()) {
      if (state.wireName.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown run state: " + value);
  }

  public boolean isTerminal() {
    return isFinal(this);
  }

  public static boolean isFinal(RunState state) {
    return state == COMPLETED || state == FAILED;
  }
}
