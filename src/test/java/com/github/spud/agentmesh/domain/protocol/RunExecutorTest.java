package com.github.spud.agentmesh.domain.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.agent.AgentYield;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.state.RunState;
import com.github.spud.agentmesh.domain.state.RunStateMachineDriver;
import com.github.spud.agentmesh.support.RunStateMachines;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Hooks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class RunExecutorTest {

  private final RunStore runStore = new RunStore(100);

  private final RunExecutor executor = new RunExecutor(
    new RunStateMachineDriver(new RunStateMachines()), runStore);

  private final List<Message> input = List.of(Message.user("hello"));

  @Test
  void streamIsGapFreeAndEndsWithOneTerminalEvent() {
    AgentCapability capability = in -> Flux.just(
      AgentYield.thought("planning"),
      AgentYield.part("Hel"),
      AgentYield.part("lo"),
      AgentYield.endMessage());

    List<RunEvent> events = executor.execute("greeter", capability, input, RunMode.STREAM)
      .collectList()
      .block();

    assertThat(events).extracting(RunEvent::getType).containsExactly(
      RunEventType.RUN_CREATED,
      RunEventType.RUN_IN_PROGRESS,
      RunEventType.GENERIC,
      RunEventType.MESSAGE_PART,
      RunEventType.MESSAGE_PART,
      RunEventType.MESSAGE_COMPLETED,
      RunEventType.RUN_COMPLETED);
    assertThat(events).extracting(RunEvent::getSequence)
      .containsExactlyElementsOf(LongStream.range(0, events.size()).boxed().toList());
    assertThat(events).extracting(RunEvent::getRunId).containsOnly(events.get(0).getRunId());
    assertThat(events.get(2).generic().get("thought").asText()).isEqualTo("planning");
    assertThat(events.get(5).message().text()).isEqualTo("Hello");
    assertThat(events.get(6).output()).extracting(Message::text).containsExactly("Hello");
  }

  @Test
  void wholeMessagesAreSplitIntoPartsAndIndexed() {
    AgentCapability capability = in -> Flux.just(
      AgentYield.message("first"),
      AgentYield.message("second"));

    List<RunEvent> events = executor.execute("twice", capability, input, RunMode.STREAM)
      .collectList()
      .block();

    List<RunEvent> completed = events.stream()
      .filter(event -> event.getType() == RunEventType.MESSAGE_COMPLETED)
      .toList();
    assertThat(completed).extracting(RunEvent::messageIndex).containsExactly(0, 1);
    assertThat(completed).extracting(event -> event.message().text())
      .containsExactly("first", "second");
  }

  @Test
  void pendingPartsAreFinalizedAtCompletion() {
    AgentCapability capability = in -> Flux.just(AgentYield.part("unterminated"));

    Run run = RunEvents.finalRun(executor.execute("lazy", capability, input, RunMode.SYNC))
      .block();

    assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
    assertThat(run.getOutput()).extracting(Message::text).containsExactly("unterminated");
  }

  @Test
  void agentWithoutOutputStillCompletes() {
    List<RunEvent> events = executor.execute("silent", in -> Flux.empty(), input,
      RunMode.STREAM).collectList().block();

    assertThat(events).extracting(RunEvent::getType).containsExactly(
      RunEventType.RUN_CREATED, RunEventType.RUN_IN_PROGRESS, RunEventType.RUN_COMPLETED);
    assertThat(events.get(2).output()).isEmpty();
  }

  @Test
  void capabilityErrorFailsTheRun() {
    AgentCapability capability = in -> Flux.concat(
      Flux.just(AgentYield.part("partial")),
      Flux.error(new IllegalStateException("model crashed")));

    List<RunEvent> events = executor.execute("fragile", capability, input, RunMode.STREAM)
      .collectList()
      .block();

    RunEvent last = events.get(events.size() - 1);
    assertThat(last.getType()).isEqualTo(RunEventType.RUN_FAILED);
    assertThat(last.error().getKind()).isEqualTo(ErrorKind.AGENT_FAILED);
    assertThat(last.error().getReason()).isEqualTo("model crashed");
    assertThat(events).filteredOn(RunEvent::isTerminal).hasSize(1);
  }

  @Test
  void immediateFailureSkipsInProgress() {
    List<RunEvent> events = executor.execute("broken",
        in -> Flux.error(new IllegalStateException("no backend")), input, RunMode.STREAM)
      .collectList()
      .block();

    assertThat(events).extracting(RunEvent::getType)
      .containsExactly(RunEventType.RUN_CREATED, RunEventType.RUN_FAILED);
  }

  @Test
  void syncAndStreamProduceTheSameOutput() {
    AgentCapability capability = AgentCapability.streaming(in -> Flux.just("a", "b", "c"));

    Run sync = RunEvents.finalRun(executor.execute("abc", capability, input, RunMode.SYNC))
      .block();
    List<RunEvent> stream = executor.execute("abc", capability, input, RunMode.STREAM)
      .collectList()
      .block();

    String streamed = stream.stream()
      .filter(event -> event.getType() == RunEventType.MESSAGE_PART)
      .map(event -> event.part().getContent())
      .collect(Collectors.joining());
    assertThat(sync.getState()).isEqualTo(RunState.COMPLETED);
    assertThat(Message.text(sync.getOutput())).isEqualTo("abc").isEqualTo(streamed);
    assertThat(stream.get(stream.size() - 1).output()).isEqualTo(sync.getOutput());
  }

  @Test
  void completedRunIsKeptInTheStore() {
    String runId = "run-stored";
    executor.execute(runId, "echo", AgentCapability.of(Message::text), input, RunMode.SYNC)
      .blockLast();

    assertThat(runStore.find(runId)).hasValueSatisfying(run -> {
      assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
      assertThat(run.getOutput()).extracting(Message::text).containsExactly("hello");
      assertThat(run.getFinishedAt()).isNotNull();
    });
  }

  @Test
  void cancelledConsumerMarksTheRunCancelled() {
    String runId = "run-cancelled";

    StepVerifier.create(executor.execute(runId, "stuck", in -> Flux.never(), input,
        RunMode.STREAM))
      .expectNextMatches(event -> event.getType() == RunEventType.RUN_CREATED)
      .thenCancel()
      .verify(Duration.ofSeconds(5));

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
      assertThat(runStore.find(runId)).hasValueSatisfying(run -> {
        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getError().getKind()).isEqualTo(ErrorKind.CANCELLED);
      }));
  }

  @Test
  void abandonedLifecycleIgnoresLateOutput() {
    RunLifecycle lifecycle = new RunLifecycle(
      new RunStateMachineDriver(new RunStateMachines()), runStore, Run.builder()
      .id("run-abandoned")
      .agentName("late")
      .input(input)
      .mode(RunMode.STREAM)
      .state(RunState.CREATED)
      .createdAt(Instant.now())
      .build());
    lifecycle.open().block();
    lifecycle.accept(AgentYield.part("half")).blockLast();

    lifecycle.abandon(RunError.of(ErrorKind.CANCELLED, "gone"));

    StepVerifier.create(lifecycle.accept(AgentYield.part("late"))).verifyComplete();
    StepVerifier.create(lifecycle.complete()).verifyComplete();
    StepVerifier.create(lifecycle.fail(RunError.of(ErrorKind.AGENT_FAILED, "twice")))
      .verifyComplete();
    assertThat(lifecycle.getRun().getState()).isEqualTo(RunState.FAILED);
    assertThat(lifecycle.getRun().getError().getKind()).isEqualTo(ErrorKind.CANCELLED);
  }

  @Test
  void disposingBusyRunsSettlesEachOnce() {
    RunStore busyStore = new RunStore(1000);
    RunExecutor busyExecutor = new RunExecutor(
      new RunStateMachineDriver(new RunStateMachines()), busyStore);
    AgentCapability chatty = in -> Flux.range(0, 20)
      .map(i -> AgentYield.part("x"))
      .subscribeOn(Schedulers.parallel());
    List<Throwable> dropped = new CopyOnWriteArrayList<>();
    Hooks.onErrorDropped(dropped::add);
    try {
      List<String> runIds = new ArrayList<>();
      for (int i = 0; i < 300; i++) {
        String runId = "busy-" + i;
        runIds.add(runId);
        Disposable run = busyExecutor.execute(runId, "chatty", chatty, input, RunMode.STREAM)
          .subscribe();
        run.dispose();
      }

      await().atMost(Duration.ofSeconds(5)).until(() -> states(busyStore, runIds).stream()
        .allMatch(RunState::isFinal));
      List<RunState> settled = states(busyStore, runIds);

      await().pollDelay(Duration.ofMillis(200)).untilAsserted(() ->
        assertThat(states(busyStore, runIds)).isEqualTo(settled));
      assertThat(runIds.stream().map(busyStore::find).flatMap(Optional::stream)
        .filter(run -> run.getState() == RunState.FAILED))
        .allSatisfy(run -> assertThat(run.getError().getKind()).isEqualTo(ErrorKind.CANCELLED));
      assertThat(dropped).isEmpty();
    } finally {
      Hooks.resetOnErrorDropped();
    }
  }

  private static List<RunState> states(RunStore store, List<String> runIds) {
    return runIds.stream()
      .map(id -> store.find(id).map(Run::getState).orElse(RunState.CREATED))
      .toList();
  }
}
