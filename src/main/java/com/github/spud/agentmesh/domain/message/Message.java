package com.github.spud.agentmesh.domain.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable, ordered sequence of {@link Part}s with a role tag. A message always has at least
 * one part.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Message {

  private final MessageRole role;

  private final List<Part> parts;

  @JsonCreator
  public Message(@JsonProperty("role") MessageRole role,
    @JsonProperty("parts") List<Part> parts) {
    if (parts == null || parts.isEmpty()) {
      throw new IllegalArgumentException("A message requires at least one part");
    }
    this.role = role != null ? role : MessageRole.USER;
    this.parts = List.copyOf(parts);
  }

  public static Message user(String content) {
    return new Message(MessageRole.USER, List.of(Part.text(content)));
  }

  public static Message agent(String content) {
    return new Message(MessageRole.AGENT, List.of(Part.text(content)));
  }

  public static Message of(MessageRole role, List<Part> parts) {
    return new Message(role, new ArrayList<>(parts));
  }

  /**
   * Concatenated content of all parts.
   */
  @JsonIgnore
  public String text() {
    return parts.stream().map(Part::getContent).collect(Collectors.joining());
  }

  /**
   * Concatenated text of a message sequence, one message per line.
   */
  public static String text(List<Message> messages) {
    return messages.stream().map(Message::text).collect(Collectors.joining("\n"));
  }
}
