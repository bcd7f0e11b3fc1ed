package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.error.MalformedResponseException;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.state.RunState;
import com.github.spud.agentmesh.util.JsonUtils;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operators over Run event streams.
 */
@Slf4j
public final class RunEvents {

  private RunEvents() {
  }

  /**
   * Final Run snapshot of an event stream, with its output. The stream must end in a terminal
   * event.
   */
  public static Mono<Run> finalRun(Flux<RunEvent> events) {
    return events
      .filter(RunEvent::isTerminal)
      .next()
      .switchIfEmpty(Mono.error(() -> new MalformedResponseException(
        "Event stream ended without a terminal event", null)))
      .map(RunEvents::toRun);
  }

  /**
   * Run snapshot carried by a terminal event, with its output or error.
   */
  public static Run toRun(RunEvent terminal) {
    Run run = terminal.run();
    Run.RunBuilder builder = run != null ? run.toBuilder()
      : Run.builder().id(terminal.getRunId()).finishedAt(Instant.now());
    if (terminal.getType() == RunEventType.RUN_COMPLETED) {
      return builder.state(RunState.COMPLETED).output(terminal.output()).build();
    }
    RunError error = terminal.error();
    return builder.state(RunState.FAILED)
      .output(List.of())
      .error(error != null ? error : RunError.of(ErrorKind.AGENT_FAILED, "Run failed"))
      .build();
  }

  /**
   * Validates an incoming event stream and guarantees it ends with exactly one terminal event.
   * <p>
   * Sequence numbers must start at 0 and increase by one. A gap, an unreadable event, an
   * upstream error or a disconnect after the first event become a synthesized
   * {@code run.failed} with the next sequence number. Errors before the first event are
   * propagated so the caller may retry. Anything after the terminal event is discarded.
   *
   * @param failureKind classifies upstream errors that are not already classified
   */
  public static Flux<RunEvent> guard(Flux<RunEvent> events,
    Function<Throwable, RunError> failureKind) {
    return Flux.defer(() -> {
      AtomicLong expected = new AtomicLong();
      AtomicBoolean terminated = new AtomicBoolean();
      AtomicReference<RunEvent> last = new AtomicReference<>();
      AtomicReference<Run> lastRun = new AtomicReference<>();

      Flux<RunEvent> validated = events
        .concatMap(event -> {
          long sequence = expected.get();
          if (event.getSequence() != sequence || event.getType() == null
            || (sequence == 0 && event.getType() != RunEventType.RUN_CREATED)) {
            return Flux.error(new MalformedResponseException(
              "Unexpected event #" + event.getSequence() + " " + event.getType()
                + ", expected #" + sequence, JsonUtils.toJson(event)));
          }
          Run snapshot = event.run();
          if (snapshot != null) {
            lastRun.set(snapshot);
          }
          expected.incrementAndGet();
          last.set(event);
          if (event.isTerminal()) {
            terminated.set(true);
          }
          return Flux.just(event);
        })
        .takeUntil(RunEvent::isTerminal);

      return validated
        .onErrorResume(e -> last.get() != null, e -> {
          RunError error = e instanceof AgentMeshException
            ? RunError.from(e) : failureKind.apply(e);
          log.warn("Event stream of run {} broke after event #{}: {}",
            last.get().getRunId(), last.get().getSequence(), error.getReason());
          terminated.set(true);
          return Flux.just(synthesizeFailure(last.get().getRunId(), lastRun.get(), expected.get(),
            error));
        })
        .concatWith(Flux.defer(() -> {
          if (terminated.get()) {
            return Flux.empty();
          }
          if (last.get() == null) {
            return Flux.error(new MalformedResponseException(
              "Event stream closed before any event", null));
          }
          return Flux.just(synthesizeFailure(last.get().getRunId(), lastRun.get(),
            expected.get(), RunError.of(ErrorKind.BACKEND_UNAVAILABLE,
              "Event stream closed before a terminal event")));
        }));
    });
  }

  /**
   * A {@code run.failed} event continuing a stream that already delivered events.
   *
   * @param lastRun last Run snapshot seen on the stream, may be null
   */
  public static RunEvent synthesizeFailure(String runId, Run lastRun, long sequence,
    RunError error) {
    Run.RunBuilder failed = lastRun != null ? lastRun.toBuilder() : Run.builder().id(runId);
    ObjectNode payload = JsonUtils.objectNode();
    payload.set("run", JsonUtils.toTree(failed
      .state(RunState.FAILED)
      .error(error)
      .finishedAt(Instant.now())
      .build()
      .summary()));
    payload.set("error", JsonUtils.toTree(error));
    return RunEvent.builder()
      .runId(runId)
      .sequence(sequence)
      .type(RunEventType.RUN_FAILED)
      .payload(payload)
      .build();
  }

  /**
   * Output messages of a completed stream, in order.
   */
  public static Mono<List<Message>> output(Flux<RunEvent> events) {
    return finalRun(events).map(run -> run.getOutput() != null ? run.getOutput() : List.of());
  }
}
