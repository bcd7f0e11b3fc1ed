package com.github.spud.agentmesh.domain.protocol;

import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.state.RunState;
import com.github.spud.agentmesh.domain.state.RunStateMachineDriver;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;

/**
 * Runs a local capability under the Run protocol. Used by the protocol server and by the router
 * for local agents, so both produce the same event sequence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunExecutor {

  private final RunStateMachineDriver driver;

  private final RunStore runStore;

  /**
   * Lazily executes the capability; every subscription is a new Run.
   */
  public Flux<RunEvent> execute(String agentName, AgentCapability capability,
    List<Message> input, RunMode mode) {
    return Flux.defer(() -> execute(UUID.randomUUID().toString(), agentName, capability, input,
      mode));
  }

  /**
   * Executes the capability under a Run id chosen by the caller. Subscribe at most once.
   */
  public Flux<RunEvent> execute(String runId, String agentName, AgentCapability capability,
    List<Message> input, RunMode mode) {
    return Flux.defer(() -> {
      RunLifecycle lifecycle = new RunLifecycle(driver, runStore, Run.builder()
        .id(runId)
        .agentName(agentName)
        .input(List.copyOf(input))
        .mode(mode)
        .state(RunState.CREATED)
        .createdAt(Instant.now())
        .build());

      Flux<RunEvent> body = Flux.defer(() -> capability.run(input))
        .concatMap(lifecycle::accept)
        .concatWith(Flux.defer(lifecycle::complete))
        .onErrorResume(e -> {
          log.warn("Agent {} failed during run {}: {}", agentName,
            lifecycle.getRun().getId(), e.getMessage());
          return lifecycle.fail(RunError.from(e)).flux();
        });

      return lifecycle.open().flux()
        .concatWith(body)
        .doFinally(signal -> {
          if (signal == SignalType.CANCEL) {
            lifecycle.abandon(RunError.of(ErrorKind.CANCELLED, "Consumer cancelled the run"));
          }
          lifecycle.close().subscribe();
        });
    });
  }
}
