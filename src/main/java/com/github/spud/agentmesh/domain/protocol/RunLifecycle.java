package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.agentmesh.domain.agent.AgentYield;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.message.MessageRole;
import com.github.spud.agentmesh.domain.message.Part;
import com.github.spud.agentmesh.domain.state.RunState;
import com.github.spud.agentmesh.domain.state.RunStateMachineDriver;
import com.github.spud.agentmesh.domain.state.RunTransition;
import com.github.spud.agentmesh.util.JsonUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drives one Run through its state machine and turns each step into a {@link RunEvent}. Event
 * production is not thread-safe: callers serialize it, which a single Reactor pipeline does.
 * {@link #abandon} may run on another thread; only one terminal transition is ever attempted.
 */
@Slf4j
public class RunLifecycle {

  private final RunStateMachineDriver driver;

  private final RunStore runStore;

  private final AtomicLong sequence = new AtomicLong();

  private final List<Message> output = new ArrayList<>();

  private final List<Part> pendingParts = new ArrayList<>();

  private final AtomicBoolean settling = new AtomicBoolean();

  private volatile boolean abandoned;

  private volatile Run run;

  private StateMachine<RunState, RunTransition> stateMachine;

  RunLifecycle(RunStateMachineDriver driver, RunStore runStore, Run run) {
    this.driver = driver;
    this.runStore = runStore;
    this.run = run;
  }

  public Run getRun() {
    return run;
  }

  /**
   * Starts the state machine and emits {@code run.created}.
   */
  public Mono<RunEvent> open() {
    return driver.create(run.getId())
      .map(sm -> {
        this.stateMachine = sm;
        runStore.save(run);
        log.info("Run {} created for agent {} ({})", run.getId(), run.getAgentName(),
          run.getMode().wireName());
        return event(RunEventType.RUN_CREATED, runPayload());
      });
  }

  /**
   * Events for one capability yield, preceded by {@code run.in-progress} on the first call.
   */
  public Flux<RunEvent> accept(AgentYield yield) {
    return Flux.defer(() -> abandoned
      ? Flux.<RunEvent>empty()
      : ensureStarted().concatWith(Flux.defer(() -> Flux.fromIterable(eventsFor(yield)))));
  }

  /**
   * Flushes pending parts and emits {@code run.completed}.
   */
  public Flux<RunEvent> complete() {
    return Flux.defer(() -> {
      if (abandoned) {
        return Flux.empty();
      }
      return ensureStarted()
        .concatWith(Flux.defer(() -> Flux.fromIterable(flushPending())))
        .concatWith(settle(RunTransition.COMPLETE, builder -> builder
          .output(List.copyOf(output))
          .finishedAt(Instant.now()))
          .map(completed -> {
            ObjectNode payload = runPayload();
            payload.set("output", JsonUtils.toTree(completed.getOutput()));
            log.info("Run {} completed with {} messages", completed.getId(), output.size());
            return event(RunEventType.RUN_COMPLETED, payload);
          }));
    });
  }

  /**
   * Emits {@code run.failed}, or nothing when the Run already ended.
   */
  public Mono<RunEvent> fail(RunError error) {
    return Mono.defer(() -> {
      if (stateMachine == null) {
        return Mono.empty();
      }
      return settle(RunTransition.FAIL, builder -> builder
        .error(error)
        .finishedAt(Instant.now()))
        .map(failed -> {
          ObjectNode payload = runPayload();
          payload.set("error", JsonUtils.toTree(error));
          log.info("Run {} failed: {} {}", failed.getId(), error.getKind(), error.getReason());
          return event(RunEventType.RUN_FAILED, payload);
        });
    });
  }

  /**
   * Marks a Run whose consumer went away as failed, without emitting. Later calls to
   * {@link #accept} and {@link #complete} produce nothing.
   */
  public void abandon(RunError error) {
    abandoned = true;
    fail(error).subscribe(
      ignored -> log.debug("Run {} abandoned: {}", run.getId(), error.getReason()),
      e -> log.warn("Could not mark run {} as abandoned", run.getId(), e));
  }

  public Mono<Void> close() {
    if (stateMachine == null) {
      return Mono.empty();
    }
    return driver.stop(stateMachine);
  }

  private Flux<RunEvent> ensureStarted() {
    return Flux.defer(() -> {
      if (run.getState() != RunState.CREATED || settling.get()) {
        return Flux.empty();
      }
      return transition(RunTransition.START, UnaryOperator.identity())
        .map(started -> event(RunEventType.RUN_IN_PROGRESS, runPayload()))
        .flux();
    });
  }

  private List<RunEvent> eventsFor(AgentYield yield) {
    List<RunEvent> events = new ArrayList<>();
    switch (yield.getKind()) {
      case THOUGHT -> {
        ObjectNode payload = JsonUtils.objectNode();
        payload.set("generic", JsonUtils.toTree(yield.getGeneric()));
        events.add(event(RunEventType.GENERIC, payload));
      }
      case PART -> events.add(partEvent(yield.getPart()));
      case END_MESSAGE -> events.addAll(flushPending());
      case MESSAGE -> {
        events.addAll(flushPending());
        for (Part part : yield.getMessage().getParts()) {
          events.add(partEvent(part));
        }
        events.add(messageCompleted(yield.getMessage()));
        pendingParts.clear();
      }
    }
    return events;
  }

  private RunEvent partEvent(Part part) {
    pendingParts.add(part);
    ObjectNode payload = JsonUtils.objectNode();
    payload.put("messageIndex", output.size());
    payload.set("part", JsonUtils.toTree(part));
    return event(RunEventType.MESSAGE_PART, payload);
  }

  private List<RunEvent> flushPending() {
    if (pendingParts.isEmpty()) {
      return List.of();
    }
    Message message = Message.of(MessageRole.AGENT, pendingParts);
    pendingParts.clear();
    return List.of(messageCompleted(message));
  }

  private RunEvent messageCompleted(Message message) {
    ObjectNode payload = JsonUtils.objectNode();
    payload.put("messageIndex", output.size());
    payload.set("message", JsonUtils.toTree(message));
    output.add(message);
    return event(RunEventType.MESSAGE_COMPLETED, payload);
  }

  /**
   * Attempts a terminal transition unless another one was already claimed.
   */
  private Mono<Run> settle(RunTransition trigger, UnaryOperator<Run.RunBuilder> mutator) {
    return Mono.defer(() -> {
      if (!settling.compareAndSet(false, true)) {
        log.debug("Run {} already settling, skipping {}", run.getId(), trigger);
        return Mono.empty();
      }
      return transition(trigger, mutator);
    });
  }

  private Mono<Run> transition(RunTransition trigger, UnaryOperator<Run.RunBuilder> mutator) {
    return driver.sendEvent(stateMachine, trigger)
      .flatMap(accepted -> {
        if (!accepted && abandoned && trigger == RunTransition.START) {
          return Mono.empty();
        }
        if (!accepted) {
          return Mono.error(new IllegalStateException(
            "Run " + run.getId() + " cannot " + trigger + " from " + run.getState()));
        }
        return Mono.justOrEmpty(apply(trigger, mutator));
      });
  }

  private synchronized Run apply(RunTransition trigger, UnaryOperator<Run.RunBuilder> mutator) {
    // a START acknowledged after an abandoning FAIL must not overwrite the failed snapshot
    if (run.isTerminal()) {
      return null;
    }
    Run next = mutator.apply(run.toBuilder().state(trigger.target())).build();
    run = next;
    runStore.save(next);
    return next;
  }

  private ObjectNode runPayload() {
    ObjectNode payload = JsonUtils.objectNode();
    payload.set("run", JsonUtils.toTree(run.summary()));
    return payload;
  }

  private RunEvent event(RunEventType type, ObjectNode payload) {
    RunEvent event = RunEvent.builder()
      .runId(run.getId())
      .sequence(sequence.getAndIncrement())
      .type(type)
      .payload(payload)
      .build();
    log.debug("Run {} event #{} {}", event.getRunId(), event.getSequence(),
      type.wireName());
    return event;
  }
}
