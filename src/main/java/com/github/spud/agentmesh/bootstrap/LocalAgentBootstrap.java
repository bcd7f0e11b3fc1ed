package com.github.spud.agentmesh.bootstrap;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.agent.ChatClientCapability;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import com.github.spud.agentmesh.domain.registry.AgentRegistry;
import java.net.URI;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Registers the configured local agents and discovers the configured remote hosts once the
 * application is ready.
 */
@Slf4j
@Component
public class LocalAgentBootstrap {

  public static final String ECHO_AGENT = "echo";

  private final AgentRegistry registry;

  private final AgentMeshProperties properties;

  private final ObjectProvider<ChatClient.Builder> chatClientBuilder;

  public LocalAgentBootstrap(AgentRegistry registry, AgentMeshProperties properties,
    ObjectProvider<ChatClient.Builder> chatClientBuilder) {
    this.registry = registry;
    this.properties = properties;
    this.chatClientBuilder = chatClientBuilder;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    registerLocalAgents();
    discoverEndpoints();
  }

  void registerLocalAgents() {
    if (properties.getAgents().isEchoEnabled()) {
      registry.register(AgentDescriptor.local(ECHO_AGENT, "Replies with its input",
        Set.of("echo"), AgentCapability.of(Message::text)));
    }

    for (AgentMeshProperties.Persona persona : properties.getAgents().getPersonas()) {
      if (!StringUtils.hasText(persona.getName())) {
        log.warn("Skipping persona without a name");
        continue;
      }
      ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
      if (builder == null) {
        log.warn("No chat model configured, persona {} not registered", persona.getName());
        continue;
      }
      registry.register(AgentDescriptor.local(persona.getName(), persona.getDescription(),
        persona.getCapabilities(),
        new ChatClientCapability(persona.getName(), builder.build(), persona.getSystemPrompt())));
    }
  }

  void discoverEndpoints() {
    Flux.fromIterable(properties.getDiscoveryEndpoints())
      .filter(StringUtils::hasText)
      .flatMap(endpoint -> registry.discover(URI.create(endpoint.trim()))
        .onErrorResume(e -> {
          log.warn("Skipping endpoint {}: {}", endpoint, e.getMessage());
          return Mono.empty();
        }))
      .subscribe(
        descriptors -> log.debug("Registered {} discovered agents", descriptors.size()),
        e -> log.error("Startup discovery aborted", e));
  }
}
