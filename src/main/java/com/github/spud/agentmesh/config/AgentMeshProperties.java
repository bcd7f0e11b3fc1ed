package com.github.spud.agentmesh.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime settings of the mesh: host identity, router deadlines and retries, HTTP pool,
 * orchestration limits and the agents to register at startup.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "agent-mesh")
public class AgentMeshProperties {

  private Host host = new Host();

  private Router router = new Router();

  private Http http = new Http();

  private Orchestration orchestration = new Orchestration();

  private Runs runs = new Runs();

  private Agents agents = new Agents();

  /**
   * Base addresses whose well-known metadata is fetched at startup.
   */
  private List<String> discoveryEndpoints = new ArrayList<>();

  @Data
  public static class Host {

    /**
     * Name reported by the well-known document when several agents are hosted.
     */
    private String name = "agent-mesh";

    private String description = "Agent mesh host";
  }

  @Data
  public static class Router {

    /**
     * Default deadline of a single call, overridable per call.
     */
    private Duration timeout = Duration.ofSeconds(300);

    /**
     * Retries of transient remote failures before BACKEND_UNAVAILABLE.
     */
    private int maxRetries = 2;

    private Duration initialBackoff = Duration.ofMillis(200);

    private Duration maxBackoff = Duration.ofSeconds(5);
  }

  @Data
  public static class Http {

    private int maxConnections = 100;

    private Duration maxIdleTime = Duration.ofSeconds(30);

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * Deadline of discovery and probe requests.
     */
    private Duration metadataTimeout = Duration.ofSeconds(10);
  }

  @Data
  public static class Orchestration {

    /**
     * Upper bound of concurrently running fan-out branches.
     */
    private int concurrency = 8;

    /**
     * Orchestrator replies examined for agent calls before a delegation session gives up.
     */
    private int delegationDepth = 3;
  }

  @Data
  public static class Runs {

    /**
     * Number of Run snapshots kept for GET /runs/{id}.
     */
    private int retained = 1000;
  }

  @Data
  public static class Agents {

    private boolean echoEnabled = true;

    private List<Persona> personas = new ArrayList<>();
  }

  @Data
  public static class Persona {

    private String name;

    private String description;

    private Set<String> capabilities = new LinkedHashSet<>();

    private String systemPrompt;
  }
}
