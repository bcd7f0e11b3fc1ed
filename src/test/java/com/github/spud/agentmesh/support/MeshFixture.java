package com.github.spud.agentmesh.support;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.agent.AgentYield;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.orchestration.OrchestrationEngine;
import com.github.spud.agentmesh.domain.orchestration.WorkflowEvent;
import com.github.spud.agentmesh.domain.protocol.RunExecutor;
import com.github.spud.agentmesh.domain.protocol.RunStore;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import com.github.spud.agentmesh.domain.registry.AgentDiscoveryClient;
import com.github.spud.agentmesh.domain.registry.AgentRegistry;
import com.github.spud.agentmesh.domain.router.AgentRouter;
import com.github.spud.agentmesh.domain.router.LocalAgentBackend;
import com.github.spud.agentmesh.domain.router.RemoteAgentBackend;
import com.github.spud.agentmesh.domain.state.RunStateMachineDriver;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Wires the mesh without a Spring context.
 */
public class MeshFixture {

  public final AgentMeshProperties properties;

  public final RunStore runStore;

  public final RunExecutor executor;

  public final AgentRegistry registry;

  public final AgentRouter router;

  public final List<WorkflowEvent> workflowEvents = new CopyOnWriteArrayList<>();

  public final OrchestrationEngine engine;

  public MeshFixture() {
    this(new AgentMeshProperties());
  }

  public MeshFixture(AgentMeshProperties properties) {
    this.properties = properties;
    properties.getRouter().setTimeout(Duration.ofSeconds(10));
    properties.getRouter().setInitialBackoff(Duration.ofMillis(10));
    properties.getRouter().setMaxBackoff(Duration.ofMillis(50));
    properties.getHttp().setMetadataTimeout(Duration.ofSeconds(2));

    WebClient webClient = WebClient.create();
    this.runStore = new RunStore(100);
    this.executor = new RunExecutor(new RunStateMachineDriver(new RunStateMachines()), runStore);
    this.registry = new AgentRegistry(new AgentDiscoveryClient(webClient, properties));
    this.router = new AgentRouter(registry, List.of(
      new LocalAgentBackend(executor),
      new RemoteAgentBackend(webClient, properties)), properties);
    this.engine = new OrchestrationEngine(router, List.of(workflowEvents::add), properties);
  }

  public MeshFixture local(String name, AgentCapability capability) {
    registry.register(AgentDescriptor.local(name, name + " agent", Set.of(name), capability));
    return this;
  }

  /**
   * Agent answering {@code prefix + input text} after a delay.
   */
  public static AgentCapability delayed(String prefix, Duration delay) {
    return input -> Mono.delay(delay)
      .map(tick -> AgentYield.message(prefix + Message.text(input)))
      .flux();
  }
}
