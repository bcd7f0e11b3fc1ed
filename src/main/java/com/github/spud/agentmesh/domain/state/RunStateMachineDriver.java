package com.github.spud.agentmesh.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Adapter between Run lifecycles and Spring Statemachine. All operations are reactive so they can
 * run on event-loop threads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunStateMachineDriver {

  private final StateMachineFactory<RunState, RunTransition> stateMachineFactory;

  /**
   * Creates and starts a machine for a new Run.
   */
  public Mono<StateMachine<RunState, RunTransition>> create(String runId) {
    return Mono.defer(() -> {
      StateMachine<RunState, RunTransition> sm = stateMachineFactory.getStateMachine(runId);
      return sm.startReactively().thenReturn(sm);
    });
  }

  public RunState getCurrentState(StateMachine<RunState, RunTransition> sm) {
    return sm.getState().getId();
  }

  /**
   * Sends a trigger and reports whether the machine accepted it.
   */
  public Mono<Boolean> sendEvent(StateMachine<RunState, RunTransition> sm,
    RunTransition transition) {
    return sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(transition).build()))
      .next()
      .map(result -> result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED)
      .defaultIfEmpty(false)
      .doOnNext(accepted -> {
        if (accepted) {
          log.debug("Transition {} accepted, run {} now {}", transition, sm.getId(),
            getCurrentState(sm));
        } else {
          log.warn("Transition {} rejected for run {} in state {}", transition, sm.getId(),
            getCurrentState(sm));
        }
      });
  }

  public Mono<Void> stop(StateMachine<RunState, RunTransition> sm) {
    return sm.stopReactively();
  }
}
