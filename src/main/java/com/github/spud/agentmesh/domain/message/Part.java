package com.github.spud.agentmesh.domain.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import lombok.Value;

/**
 * A typed content fragment of a {@link Message}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Part {

  public static final String TEXT_PLAIN = "text/plain";

  String content;

  @JsonProperty("mime_type")
  String mimeType;

  @JsonCreator
  public Part(@JsonProperty("content") String content,
    @JsonProperty("mime_type") String mimeType) {
    this.content = Objects.requireNonNullElse(content, "");
    this.mimeType = mimeType != null ? mimeType : TEXT_PLAIN;
  }

  public static Part text(String content) {
    return new Part(content, TEXT_PLAIN);
  }
}
