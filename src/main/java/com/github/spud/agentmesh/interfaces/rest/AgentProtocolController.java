package com.github.spud.agentmesh.interfaces.rest;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.error.AgentNotFoundException;
import com.github.spud.agentmesh.domain.message.Part;
import com.github.spud.agentmesh.domain.protocol.AgentMetadata;
import com.github.spud.agentmesh.domain.protocol.Run;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.RunEvents;
import com.github.spud.agentmesh.domain.protocol.RunExecutor;
import com.github.spud.agentmesh.domain.protocol.RunMode;
import com.github.spud.agentmesh.domain.protocol.RunRequest;
import com.github.spud.agentmesh.domain.protocol.RunResponse;
import com.github.spud.agentmesh.domain.protocol.RunStore;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import com.github.spud.agentmesh.domain.registry.AgentRegistry;
import com.github.spud.agentmesh.util.JsonUtils;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Protocol server: exposes the locally registered agents over HTTP. Sync runs answer with JSON,
 * stream runs with Server-Sent Events.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AgentProtocolController {

  public static final String RUN_ID_HEADER = "Run-ID";

  private final AgentRegistry registry;

  private final RunExecutor runExecutor;

  private final RunStore runStore;

  private final AgentMeshProperties properties;

  /**
   * Metadata of the single hosted agent, or of the host listing all agents.
   */
  @GetMapping("/.well-known/agent.json")
  public Mono<AgentMetadata> wellKnown() {
    return localAgents().collectList().map(agents -> {
      if (agents.size() == 1) {
        return agents.get(0).toMetadata();
      }
      Set<String> capabilities = new LinkedHashSet<>();
      Set<String> inputTypes = new LinkedHashSet<>();
      Set<String> outputTypes = new LinkedHashSet<>();
      for (AgentDescriptor agent : agents) {
        capabilities.addAll(agent.getCapabilities());
        inputTypes.addAll(agent.getInputContentTypes());
        outputTypes.addAll(agent.getOutputContentTypes());
      }
      return AgentMetadata.builder()
        .name(properties.getHost().getName())
        .description(properties.getHost().getDescription())
        .capabilities(capabilities)
        .inputContentTypes(inputTypes.isEmpty() ? List.of(Part.TEXT_PLAIN)
          : List.copyOf(inputTypes))
        .outputContentTypes(outputTypes.isEmpty() ? List.of(Part.TEXT_PLAIN)
          : List.copyOf(outputTypes))
        .agents(agents.stream().map(AgentDescriptor::toMetadata).toList())
        .build();
    });
  }

  @GetMapping("/agents")
  public Flux<AgentMetadata> listAgents() {
    return localAgents().map(AgentDescriptor::toMetadata);
  }

  @GetMapping("/agents/{name}")
  public Mono<AgentMetadata> getAgent(@PathVariable String name) {
    return Mono.fromCallable(() -> localAgent(name).toMetadata());
  }

  @GetMapping("/ping")
  public Map<String, Object> ping() {
    return Map.of("status", "ok", "timestamp", Instant.now());
  }

  /**
   * Starts a Run. Streams when {@code mode} is {@code stream} or the client only accepts
   * {@code text/event-stream}.
   */
  @PostMapping("/runs")
  public Mono<ResponseEntity<Object>> createRun(@Valid @RequestBody RunRequest request,
    @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    return Mono.fromCallable(() -> localAgent(request.getAgentName()))
      .flatMap(agent -> {
        String runId = UUID.randomUUID().toString();
        boolean stream = request.getMode() == RunMode.STREAM || acceptsOnlyEventStream(accept);
        log.info("Run {} requested for agent {} ({})", runId, agent.getName(),
          stream ? "stream" : "sync");
        if (stream) {
          return Mono.just(streamResponse(runId, agent, request));
        }
        return syncResponse(runId, agent, request);
      });
  }

  @GetMapping("/runs/{runId}")
  public Mono<ResponseEntity<Run>> getRun(@PathVariable String runId) {
    return Mono.just(runStore.find(runId)
      .map(ResponseEntity::ok)
      .orElseGet(() -> ResponseEntity.notFound().build()));
  }

  private Mono<ResponseEntity<Object>> syncResponse(String runId, AgentDescriptor agent,
    RunRequest request) {
    Flux<RunEvent> events = runExecutor.execute(runId, agent.getName(), agent.getCapability(),
      request.getInput(), RunMode.SYNC);
    return RunEvents.finalRun(events)
      .map(run -> ResponseEntity.ok()
        .header(RUN_ID_HEADER, runId)
        .contentType(MediaType.APPLICATION_JSON)
        .body((Object) RunResponse.fromRun(run)));
  }

  private ResponseEntity<Object> streamResponse(String runId, AgentDescriptor agent,
    RunRequest request) {
    Flux<ServerSentEvent<String>> events = runExecutor
      .execute(runId, agent.getName(), agent.getCapability(), request.getInput(),
        RunMode.STREAM)
      .map(event -> ServerSentEvent.<String>builder()
        .id(Long.toString(event.getSequence()))
        .event(event.getType().wireName())
        .data(JsonUtils.toJson(event))
        .build());
    return ResponseEntity.ok()
      .header(RUN_ID_HEADER, runId)
      .contentType(MediaType.TEXT_EVENT_STREAM)
      .body(events);
  }

  private Flux<AgentDescriptor> localAgents() {
    return registry.list().filter(AgentDescriptor::isLocal);
  }

  private AgentDescriptor localAgent(String name) {
    AgentDescriptor descriptor = registry.lookup(name);
    if (!descriptor.isLocal() || descriptor.getCapability() == null) {
      throw new AgentNotFoundException(name);
    }
    return descriptor;
  }

  private static boolean acceptsOnlyEventStream(String accept) {
    if (accept == null || accept.isBlank()) {
      return false;
    }
    List<MediaType> types = MediaType.parseMediaTypes(accept);
    return !types.isEmpty() && types.stream()
      .allMatch(type -> type.isCompatibleWith(MediaType.TEXT_EVENT_STREAM)
        && !type.isWildcardType());
  }
}
