package com.github.spud.agentmesh.domain.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.error.DiscoveryFailedException;
import com.github.spud.agentmesh.domain.message.Part;
import com.github.spud.agentmesh.util.JsonUtils;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * HTTP side of the registry: fetches well-known metadata documents and pings remote hosts.
 */
@Slf4j
@Component
public class AgentDiscoveryClient {

  public static final String WELL_KNOWN_PATH = "/.well-known/agent.json";

  public static final String PING_PATH = "/ping";

  private final WebClient webClient;

  private final Duration timeout;

  public AgentDiscoveryClient(WebClient agentMeshWebClient, AgentMeshProperties properties) {
    this.webClient = agentMeshWebClient;
    this.timeout = properties.getHttp().getMetadataTimeout();
  }

  /**
   * Fetches the metadata document of a host and turns it into remote descriptors.
   */
  public Mono<List<AgentDescriptor>> fetch(URI endpoint) {
    return Mono.defer(() -> {
      long start = System.nanoTime();
      return webClient.get()
        .uri(resolve(endpoint, WELL_KNOWN_PATH))
        .retrieve()
        .bodyToMono(String.class)
        .timeout(timeout)
        .switchIfEmpty(Mono.error(() ->
          new DiscoveryFailedException(endpoint.toString(), "empty metadata document")))
        .map(body -> parse(endpoint, body, (System.nanoTime() - start) / 1_000_000))
        .onErrorMap(e -> !(e instanceof DiscoveryFailedException),
          e -> new DiscoveryFailedException(endpoint.toString(), describe(e), e));
    });
  }

  /**
   * Round-trip latency of {@code GET /ping} in milliseconds.
   */
  public Mono<Long> ping(URI endpoint) {
    return Mono.defer(() -> {
      long start = System.nanoTime();
      return webClient.get()
        .uri(resolve(endpoint, PING_PATH))
        .retrieve()
        .toBodilessEntity()
        .timeout(timeout)
        .map(response -> (System.nanoTime() - start) / 1_000_000);
    });
  }

  List<AgentDescriptor> parse(URI endpoint, String body, long latencyMs) {
    JsonNode document;
    try {
      document = JsonUtils.readTree(body);
    } catch (IllegalArgumentException e) {
      throw new DiscoveryFailedException(endpoint.toString(), "metadata is not JSON", e);
    }
    if (document == null || !document.isObject()) {
      throw new DiscoveryFailedException(endpoint.toString(), "metadata is not a JSON object");
    }

    List<JsonNode> entries = new ArrayList<>();
    JsonNode agents = document.get("agents");
    if (agents != null && agents.isArray()) {
      agents.forEach(entries::add);
    } else {
      entries.add(document);
    }

    Instant now = Instant.now();
    List<AgentDescriptor> descriptors = new ArrayList<>();
    for (JsonNode entry : entries) {
      descriptors.add(toDescriptor(endpoint, entry, latencyMs, now));
    }
    log.debug("Metadata of {} lists {} agents", endpoint, descriptors.size());
    return descriptors;
  }

  private AgentDescriptor toDescriptor(URI endpoint, JsonNode entry, long latencyMs,
    Instant now) {
    JsonNode name = entry.get("name");
    if (name == null || !name.isTextual() || name.asText().isBlank()) {
      throw new DiscoveryFailedException(endpoint.toString(), "metadata lacks a name");
    }
    JsonNode capabilities = entry.get("capabilities");
    if (capabilities == null || !capabilities.isArray()) {
      throw new DiscoveryFailedException(endpoint.toString(),
        "metadata of " + name.asText() + " lacks capabilities");
    }
    Set<String> capabilitySet = new LinkedHashSet<>();
    capabilities.forEach(node -> capabilitySet.add(node.asText()));

    return AgentDescriptor.builder()
      .name(name.asText())
      .kind(AgentKind.REMOTE)
      .description(entry.path("description").asText(""))
      .capabilities(Set.copyOf(capabilitySet))
      .inputContentTypes(contentTypes(entry.get("input_content_types")))
      .outputContentTypes(contentTypes(entry.get("output_content_types")))
      .endpoint(endpoint)
      .remoteAgentName(name.asText())
      .discoveredAt(now)
      .status(AgentStatus.ONLINE)
      .latencyMs(latencyMs)
      .lastSeen(now)
      .build();
  }

  private static List<String> contentTypes(JsonNode node) {
    if (node == null || !node.isArray() || node.isEmpty()) {
      return List.of(Part.TEXT_PLAIN);
    }
    List<String> types = new ArrayList<>();
    node.forEach(type -> types.add(type.asText()));
    return List.copyOf(types);
  }

  /**
   * Appends an absolute path to a host base address.
   */
  public static URI resolve(URI endpoint, String path) {
    String base = endpoint.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static String describe(Throwable e) {
    if (e instanceof WebClientResponseException responseException) {
      return "HTTP " + responseException.getStatusCode().value();
    }
    if (e instanceof TimeoutException) {
      return "timed out";
    }
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
