package com.github.spud.agentmesh.domain.protocol;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Last known snapshot of Runs hosted by this process, bounded by
 * {@code agent-mesh.runs.retained}. Oldest Runs are evicted first.
 */
@Slf4j
@Component
public class RunStore {

  private final Map<String, Run> runs = new ConcurrentHashMap<>();

  private final Queue<String> order = new ConcurrentLinkedQueue<>();

  private final int retained;

  public RunStore(AgentMeshProperties properties) {
    this(properties.getRuns().getRetained());
  }

  public RunStore(int retained) {
    this.retained = Math.max(1, retained);
  }

  public void save(Run run) {
    if (runs.put(run.getId(), run) == null) {
      order.add(run.getId());
      while (runs.size() > retained) {
        String evicted = order.poll();
        if (evicted == null) {
          break;
        }
        runs.remove(evicted);
        log.debug("Evicted run {}", evicted);
      }
    }
  }

  public Optional<Run> find(String runId) {
    return Optional.ofNullable(runs.get(runId));
  }

  public int size() {
    return runs.size();
  }
}
