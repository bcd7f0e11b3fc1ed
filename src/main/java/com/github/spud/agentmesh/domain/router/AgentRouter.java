package com.github.spud.agentmesh.domain.router;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.BackendUnavailableException;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.error.RunCancelledException;
import com.github.spud.agentmesh.domain.error.RunTimeoutException;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.Run;
import com.github.spud.agentmesh.domain.protocol.RunError;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.RunEvents;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import com.github.spud.agentmesh.domain.registry.AgentRegistry;
import com.github.spud.agentmesh.domain.state.RunState;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Uniform dispatch by agent name. Sync calls resolve to a {@link RunOutcome}; streams are lazy
 * single-pass event sequences whose last element is always {@code run.completed} or
 * {@code run.failed}.
 */
@Slf4j
@Component
public class AgentRouter {

  private final AgentRegistry registry;

  private final List<AgentBackend> backends;

  private final Duration defaultTimeout;

  public AgentRouter(AgentRegistry registry, List<AgentBackend> backends,
    AgentMeshProperties properties) {
    this.registry = registry;
    this.backends = List.copyOf(backends);
    this.defaultTimeout = properties.getRouter().getTimeout();
  }

  public Mono<RunOutcome> call(String agentName, List<Message> input) {
    return call(agentName, input, CallOptions.defaults());
  }

  /**
   * Invokes an agent and waits, without blocking, for its final result. A failed Run surfaces
   * as an {@link AgentMeshException} carrying the Run's classification.
   */
  public Mono<RunOutcome> call(String agentName, List<Message> input, CallOptions options) {
    return Mono.defer(() -> {
      long start = System.nanoTime();
      AgentDescriptor descriptor = registry.lookup(agentName);
      AgentBackend backend = backendFor(descriptor);
      Duration deadline = deadline(options);
      CancellationToken token = options.getCancellationToken();
      log.info("Calling agent {} via {} (deadline {})", agentName,
        backend.transport().wireName(), deadline);

      return backend.call(descriptor, input)
        .timeout(deadline, Mono.error(() -> new RunTimeoutException(agentName, deadline)))
        .takeUntilOther(token.whenCancelled())
        .switchIfEmpty(Mono.error(() -> new RunCancelledException(
          "Call to " + agentName + " was cancelled")))
        .flatMap(run -> toOutcome(agentName, deadline, run, backend, start))
        .doOnSuccess(outcome -> log.info("Agent {} answered in {} ms", agentName,
          outcome.getElapsedMs()))
        .doOnError(e -> log.warn("Call to agent {} failed: {}", agentName, e.getMessage()));
    });
  }

  public Flux<RunEvent> stream(String agentName, List<Message> input) {
    return stream(agentName, input, CallOptions.defaults());
  }

  /**
   * Invokes an agent incrementally. Errors before the first event (unknown agent, unreachable
   * backend, deadline) are signalled as errors; later failures become a {@code run.failed}
   * event. Cancelling the token completes the stream.
   */
  public Flux<RunEvent> stream(String agentName, List<Message> input, CallOptions options) {
    return Flux.defer(() -> {
      AgentDescriptor descriptor = registry.lookup(agentName);
      AgentBackend backend = backendFor(descriptor);
      Duration deadline = deadline(options);
      log.info("Streaming agent {} via {} (deadline {})", agentName,
        backend.transport().wireName(), deadline);

      AtomicBoolean expired = new AtomicBoolean();
      Flux<RunEvent> bounded = backend.stream(descriptor, input)
        .takeUntilOther(Mono.delay(deadline).doOnNext(tick -> expired.set(true)))
        .concatWith(Flux.defer(() -> expired.get()
          ? Flux.error(new RunTimeoutException(agentName, deadline))
          : Flux.empty()));

      return RunEvents.guard(bounded, AgentRouter::classifyStreamError)
        .takeUntilOther(options.getCancellationToken().whenCancelled())
        .doOnNext(event -> {
          if (event.isTerminal()) {
            log.info("Agent {} stream ended with {}", agentName, event.getType().wireName());
          }
        });
    });
  }

  private AgentBackend backendFor(AgentDescriptor descriptor) {
    return backends.stream()
      .filter(backend -> backend.supports(descriptor))
      .findFirst()
      .orElseThrow(() -> new BackendUnavailableException(
        "No backend can reach agent " + descriptor.getName()));
  }

  private Duration deadline(CallOptions options) {
    Duration timeout = options.getTimeout();
    return timeout != null && !timeout.isZero() && !timeout.isNegative()
      ? timeout : defaultTimeout;
  }

  private static Mono<RunOutcome> toOutcome(String agentName, Duration deadline, Run run,
    AgentBackend backend, long start) {
    if (run.getState() != RunState.COMPLETED) {
      return Mono.error(toFailure(agentName, deadline, run));
    }
    return Mono.just(RunOutcome.builder()
      .run(run)
      .output(run.getOutput() != null ? run.getOutput() : List.of())
      .elapsedMs((System.nanoTime() - start) / 1_000_000)
      .transport(backend.transport())
      .build());
  }

  private static AgentMeshException toFailure(String agentName, Duration deadline, Run run) {
    RunError error = run.getError() != null ? run.getError()
      : RunError.of(ErrorKind.MALFORMED_RESPONSE, "Run ended in state " + run.getState());
    if (error.getKind() == ErrorKind.TIMEOUT) {
      return new RunTimeoutException(agentName, deadline);
    }
    if (error.getKind() == ErrorKind.CANCELLED) {
      return new RunCancelledException(error.getReason());
    }
    return error.toException(run.getId());
  }

  static RunError classifyStreamError(Throwable e) {
    if (e instanceof DecodingException || e instanceof IllegalArgumentException) {
      return new RunError(ErrorKind.MALFORMED_RESPONSE, e.getMessage(), null);
    }
    return RunError.of(ErrorKind.BACKEND_UNAVAILABLE,
      e.getMessage() != null ? e.getMessage() : "Event stream broke");
  }
}
