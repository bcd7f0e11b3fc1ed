package com.github.spud.agentmesh.domain.registry;

import com.github.spud.agentmesh.domain.error.AgentNotFoundException;
import java.net.URI;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Name to backend mapping shared by the router, the protocol server and the orchestration
 * engine. Entries are immutable and replaced whole; only discovery and probing touch the
 * network, and never while updating the map.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRegistry {

  private final Map<String, AgentDescriptor> agents = new ConcurrentHashMap<>();

  private final AgentDiscoveryClient discoveryClient;

  /**
   * Inserts or replaces the entry with the descriptor's name.
   */
  public void register(AgentDescriptor descriptor) {
    AgentDescriptor previous = agents.put(descriptor.getName(), descriptor);
    if (previous == null) {
      log.info("Registered {} agent {}", descriptor.getKind(), descriptor.getName());
    } else {
      log.info("Replaced {} agent {} with {} entry", previous.getKind(), descriptor.getName(),
        descriptor.getKind());
    }
  }

  public void unregister(String name) {
    if (agents.remove(name) != null) {
      log.info("Unregistered agent {}", name);
    }
  }

  /**
   * @throws AgentNotFoundException when no agent has that name
   */
  public AgentDescriptor lookup(String name) {
    AgentDescriptor descriptor = name != null ? agents.get(name) : null;
    if (descriptor == null) {
      throw new AgentNotFoundException(name);
    }
    return descriptor;
  }

  /**
   * Entries present at the time of the call, ordered by name. Re-subscribing replays the same
   * snapshot.
   */
  public Flux<AgentDescriptor> list() {
    List<AgentDescriptor> snapshot = agents.values().stream()
      .sorted(Comparator.comparing(AgentDescriptor::getName))
      .toList();
    return Flux.fromIterable(snapshot);
  }

  /**
   * Entries advertising the capability, ordered by name.
   */
  public Flux<AgentDescriptor> find(String capability) {
    return list().filter(descriptor -> descriptor.hasCapability(capability));
  }

  /**
   * Fetches the host's metadata and registers every agent it describes.
   */
  public Mono<List<AgentDescriptor>> discover(URI endpoint) {
    return discoveryClient.fetch(endpoint)
      .doOnNext(descriptors -> descriptors.forEach(this::register))
      .doOnSuccess(descriptors -> log.info("Discovered {} agents at {}",
        descriptors != null ? descriptors.size() : 0, endpoint))
      .doOnError(e -> log.warn("Discovery of {} failed: {}", endpoint, e.getMessage()));
  }

  /**
   * Checks reachability of an agent and records status, latency and last-seen time. Local agents
   * are always online.
   */
  public Mono<AgentDescriptor> probe(String name) {
    return Mono.fromCallable(() -> lookup(name))
      .flatMap(descriptor -> check(descriptor)
        .map(updated -> replaceIfUnchanged(descriptor, updated)));
  }

  private Mono<AgentDescriptor> check(AgentDescriptor descriptor) {
    if (descriptor.isLocal()) {
      return Mono.just(descriptor.toBuilder()
        .status(AgentStatus.ONLINE)
        .lastSeen(Instant.now())
        .build());
    }
    return discoveryClient.ping(descriptor.getEndpoint())
      .map(latency -> descriptor.toBuilder()
        .status(AgentStatus.ONLINE)
        .latencyMs(latency)
        .lastSeen(Instant.now())
        .build())
      .onErrorResume(e -> {
        log.warn("Probe of agent {} at {} failed: {}", descriptor.getName(),
          descriptor.getEndpoint(), e.getMessage());
        AgentStatus status = e instanceof WebClientResponseException
          ? AgentStatus.ERROR : AgentStatus.OFFLINE;
        return Mono.just(descriptor.toBuilder().status(status).build());
      });
  }

  /**
   * Stores the probe result unless the entry was replaced while probing.
   */
  private AgentDescriptor replaceIfUnchanged(AgentDescriptor expected, AgentDescriptor updated) {
    agents.computeIfPresent(expected.getName(),
      (name, current) -> current == expected ? updated : current);
    return updated;
  }
}
