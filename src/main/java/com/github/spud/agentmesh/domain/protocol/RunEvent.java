package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.message.Part;
import com.github.spud.agentmesh.util.JsonUtils;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One streamed event of a Run. Sequence numbers start at 0 and increase by one.
 */
@Value
@Builder
@Jacksonized
public class RunEvent {

  String runId;

  long sequence;

  RunEventType type;

  JsonNode payload;

  @JsonIgnore
  public boolean isTerminal() {
    return type != null && type.isTerminal();
  }

  public Run run() {
    return field("run", Run.class);
  }

  public Part part() {
    return field("part", Part.class);
  }

  public Message message() {
    return field("message", Message.class);
  }

  public RunError error() {
    return field("error", RunError.class);
  }

  public int messageIndex() {
    JsonNode node = payload != null ? payload.get("messageIndex") : null;
    return node != null && node.canConvertToInt() ? node.asInt() : -1;
  }

  public JsonNode generic() {
    return payload != null ? payload.get("generic") : null;
  }

  public List<Message> output() {
    JsonNode node = payload != null ? payload.get("output") : null;
    if (node == null || node.isNull()) {
      return List.of();
    }
    return JsonUtils.objectMapper().convertValue(node, new TypeReference<List<Message>>() {
    });
  }

  private <T> T field(String name, Class<T> type) {
    JsonNode node = payload != null ? payload.get(name) : null;
    if (node == null || node.isNull()) {
      return null;
    }
    return JsonUtils.treeToValue(node, type);
  }
}
