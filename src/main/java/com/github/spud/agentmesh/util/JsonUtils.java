package com.github.spud.agentmesh.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.concurrent.Callable;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared Jackson access for event payloads and wire documents. Failures surface as
 * {@link JsonParseException}, an {@link IllegalArgumentException}.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .registerModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JsonUtils() {
  }

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return parse(() -> objectMapper.readTree(json));
  }

  public static String toJson(Object obj) {
    return parse(() -> objectMapper.writeValueAsString(obj));
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return parse(() -> objectMapper.readValue(json, clazz));
  }

  /**
   * Converts a value into a tree node; used to build event payloads.
   */
  public static JsonNode toTree(Object value) {
    return objectMapper.valueToTree(value);
  }

  /**
   * Converts a tree node back into a typed value.
   */
  public static <T> T treeToValue(JsonNode node, Class<T> clazz) {
    return parse(() -> objectMapper.treeToValue(node, clazz));
  }

  public static ObjectNode objectNode() {
    return objectMapper.createObjectNode();
  }

  private static <T> T parse(Callable<T> parser) {
    try {
      return parser.call();
    } catch (Exception e) {
      throw new JsonParseException(e);
    }
  }

}
