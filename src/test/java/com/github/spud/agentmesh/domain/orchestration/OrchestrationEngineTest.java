package com.github.spud.agentmesh.domain.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;

import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.agent.AgentYield;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.error.RunCancelledException;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;
import com.github.spud.agentmesh.domain.router.CallOptions;
import com.github.spud.agentmesh.domain.router.CancellationToken;
import com.github.spud.agentmesh.support.MeshFixture;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class OrchestrationEngineTest {

  private final AtomicBoolean slowCancelled = new AtomicBoolean();

  private final AtomicBoolean dozerCancelled = new AtomicBoolean();

  private final AtomicInteger lastStageCalls = new AtomicInteger();

  private final List<Integer> contextSizes = new CopyOnWriteArrayList<>();

  private final List<String> plannerFeedback = new CopyOnWriteArrayList<>();

  private MeshFixture mesh;

  @BeforeEach
  void setUp() {
    mesh = new MeshFixture()
      .local("tortoise", MeshFixture.delayed("tortoise:", Duration.ofMillis(300)))
      .local("hare", MeshFixture.delayed("hare:", Duration.ofMillis(150)))
      .local("cheetah", MeshFixture.delayed("cheetah:", Duration.ofMillis(10)))
      .local("broken", in -> Flux.error(new IllegalStateException("nope")))
      .local("sleeper", sleeper(slowCancelled))
      .local("dozer", sleeper(dozerCancelled))
      .local("echo", AgentCapability.of(Message::text))
      .local("upper", AgentCapability.of(in -> Message.text(in).toUpperCase()))
      .local("exclaim", AgentCapability.of(in -> Message.text(in) + "!"))
      .local("counter", AgentCapability.of(in -> "count " + lastStageCalls.incrementAndGet()))
      .local("pro", speaker("pro"))
      .local("con", speaker("con"))
      .local("mute", MeshFixture.delayed("", Duration.ofSeconds(5)))
      .local("thinker", in -> Flux.concat(
        Flux.just(AgentYield.thought("weighing both sides")),
        Mono.delay(Duration.ofSeconds(1)).map(tick -> AgentYield.message("decided")).flux()))
      .local("planner", AgentCapability.of(this::plan))
      .local("looper", AgentCapability.of(
        in -> "<call_agent>agent: echo task: again</call_agent>"));
  }

  private String plan(List<Message> in) {
    String last = in.get(in.size() - 1).text();
    if (last.contains("Response from")) {
      plannerFeedback.add(last);
      return "final answer";
    }
    return """
      Splitting the work.
      <call_agent>
      agent: Upper
      task: shout this
      </call_agent>
      <call_agent>agent: ghost task: vanish</call_agent>
      """;
  }

  private static AgentCapability sleeper(AtomicBoolean cancelled) {
    return in -> Mono.delay(Duration.ofSeconds(5))
      .map(tick -> AgentYield.message("woke up"))
      .flux()
      .doOnCancel(() -> cancelled.set(true));
  }

  private AgentCapability speaker(String name) {
    return AgentCapability.of(in -> {
      contextSizes.add(in.size());
      return name + " saw " + in.size();
    });
  }

  @Test
  void fanOutKeepsRequestOrderRegardlessOfLatency() {
    FanOutResult result = mesh.engine.fanOut(List.of(
        Branch.of("tortoise", "go"),
        Branch.of("hare", "go"),
        Branch.of("cheetah", "go")),
      FanOutOptions.failFast()).block();

    assertThat(result.isPartialFailure()).isFalse();
    assertThat(result.getResults()).extracting(branch -> branch.getOutcome().text())
      .containsExactly("tortoise:go", "hare:go", "cheetah:go");
    assertThat(result.getResults()).extracting(BranchResult::getIndex).containsExactly(0, 1, 2);
    assertThat(mesh.workflowEvents)
      .filteredOn(event -> event.getType() == WorkflowEventType.BRANCH_COMPLETED)
      .extracting(WorkflowEvent::getIndex)
      .containsExactly(2, 1, 0);
  }

  @Test
  void failFastCancelsSiblingBranches() {
    StepVerifier.create(mesh.engine.fanOut(List.of(
          Branch.of("sleeper", "zzz"),
          Branch.of("broken", "go"),
          Branch.of("dozer", "zzz")),
        FanOutOptions.failFast()))
      .expectErrorSatisfies(e -> {
        assertThat(e).isInstanceOf(BranchFailedException.class);
        BranchFailedException failure = (BranchFailedException) e;
        assertThat(failure.getBranchIndex()).isEqualTo(1);
        assertThat(failure.getAgentName()).isEqualTo("broken");
        assertThat(failure.getKind()).isEqualTo(ErrorKind.AGENT_FAILED);
      })
      .verify(Duration.ofSeconds(3));

    await().atMost(Duration.ofSeconds(2)).untilTrue(slowCancelled);
    await().atMost(Duration.ofSeconds(2)).untilTrue(dozerCancelled);
  }

  @Test
  void bestEffortReportsEveryBranch() {
    FanOutResult result = mesh.engine.fanOut(List.of(
        Branch.of("cheetah", "go"),
        Branch.of("broken", "go"),
        Branch.of("ghost", "go")),
      FanOutOptions.bestEffort()).block();

    assertThat(result.isPartialFailure()).isTrue();
    assertThat(result.getResults()).extracting(BranchResult::isSuccess)
      .containsExactly(true, false, false);
    assertThat(result.getResults().get(0).getOutcome().text()).isEqualTo("cheetah:go");
    assertThat(result.getResults().get(1).getError().getKind()).isEqualTo(ErrorKind.AGENT_FAILED);
    assertThat(result.getResults().get(2).getError().getKind())
      .isEqualTo(ErrorKind.AGENT_NOT_FOUND);
  }

  @Test
  void synthesizerReceivesSuccessfulOutputs() {
    FanOutResult result = mesh.engine.fanOut(List.of(
        Branch.of("hare", "a"),
        Branch.of("broken", "b"),
        Branch.of("cheetah", "c")),
      FanOutOptions.builder()
        .policy(FanOutPolicy.BEST_EFFORT)
        .synthesizer("echo")
        .build()).block();

    assertThat(result.getSynthesis().text())
      .isEqualTo("hare: hare:a\ncheetah: cheetah:c");
    assertThat(mesh.workflowEvents).extracting(WorkflowEvent::getType)
      .contains(WorkflowEventType.SYNTHESIS_COMPLETED);
  }

  @Test
  void pipelineEqualsManualComposition() {
    List<Message> input = List.of(Message.user("hello"));

    PipelineResult result = mesh.engine.pipeline(List.of("upper", "exclaim"), input).block();

    RunOutcome first = mesh.router.call("upper", input).block();
    RunOutcome second = mesh.router.call("exclaim", first.getOutput()).block();
    assertThat(Message.text(result.getOutput())).isEqualTo(second.text()).isEqualTo("HELLO!");
    assertThat(result.getStages()).hasSize(2);
    assertThat(result.getStages().get(0).text()).isEqualTo("HELLO");
  }

  @Test
  void pipelineStopsAtFailingStage() {
    StepVerifier.create(mesh.engine.pipeline(List.of("upper", "broken", "counter"),
        List.of(Message.user("hello"))))
      .expectErrorSatisfies(e -> {
        assertThat(e).isInstanceOf(PipelineStageException.class);
        PipelineStageException failure = (PipelineStageException) e;
        assertThat(failure.getStageIndex()).isEqualTo(1);
        assertThat(failure.getAgentName()).isEqualTo("broken");
        assertThat(failure.getKind()).isEqualTo(ErrorKind.AGENT_FAILED);
      })
      .verify();
    assertThat(lastStageCalls).hasValue(0);
  }

  @Test
  void debateAlternatesSpeakersAndGrowsContext() {
    DebateSession session = mesh.engine.debate(DebateRequest.builder()
      .topic("Tabs or spaces?")
      .participant("pro")
      .participant("con")
      .rounds(2)
      .build()).block();

    assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
    assertThat(session.getTranscript()).extracting(TranscriptEntry::getSpeaker)
      .containsExactly("pro", "con", "pro", "con");
    assertThat(session.getTranscript()).extracting(TranscriptEntry::getRound)
      .containsExactly(1, 1, 2, 2);
    assertThat(contextSizes).containsExactly(1, 2, 3, 4);
    assertThat(session.getVerdict()).isNull();
  }

  @Test
  void contextWindowLimitsVisibleTranscript() {
    mesh.engine.debate(DebateRequest.builder()
      .topic("Tabs or spaces?")
      .participant("pro")
      .participant("con")
      .rounds(2)
      .contextWindow(1)
      .build()).block();

    assertThat(contextSizes).containsExactly(1, 2, 2, 2);
  }

  @Test
  void synthesizerProducesVerdict() {
    DebateSession session = mesh.engine.debate(DebateRequest.builder()
      .topic("Tabs or spaces?")
      .participant("pro")
      .participant("con")
      .synthesizer("echo")
      .build()).block();

    assertThat(session.getVerdict().text())
      .isEqualTo("Tabs or spaces?\npro (round 1): pro saw 1\ncon (round 1): con saw 2");
  }

  @Test
  void cancelledDebateKeepsCompletedTurns() {
    DebateSession session = mesh.engine.openDebate(DebateRequest.builder()
      .topic("Tabs or spaces?")
      .participant("pro")
      .participant("mute")
      .rounds(3)
      .build());

    Disposable running = mesh.engine.debate(session).subscribe();
    await().atMost(Duration.ofSeconds(2))
      .until(() -> session.getTranscript().size() == 1);
    running.dispose();

    assertThat(session.getStatus()).isEqualTo(SessionStatus.CANCELLED);
    assertThat(session.getTranscript()).extracting(TranscriptEntry::getSpeaker)
      .containsExactly("pro");
    assertThat(session.getRound()).isEqualTo(1);
  }

  @Test
  void cancellationTokenStopsDebate() {
    CancellationToken token = new CancellationToken();
    DebateSession session = mesh.engine.openDebate(DebateRequest.builder()
      .topic("Tabs or spaces?")
      .participant("mute")
      .callOptions(CallOptions.withToken(token))
      .build());

    StepVerifier.create(mesh.engine.debate(session))
      .then(token::cancel)
      .expectError()
      .verify(Duration.ofSeconds(3));

    assertThat(session.getStatus()).isEqualTo(SessionStatus.CANCELLED);
    assertThat(session.getTranscript()).isEmpty();
  }

  @Test
  void failingSinkDoesNotBreakWorkflow() {
    OrchestrationEngine engine = new OrchestrationEngine(mesh.router,
      List.of(event -> {
        throw new IllegalStateException("sink down");
      }), mesh.properties);

    PipelineResult result = engine.pipeline(List.of("exclaim"),
      List.of(Message.user("still works"))).block();

    assertThat(Message.text(result.getOutput())).isEqualTo("still works!");
  }

  @Test
  void streamingDebateRelaysThoughtsWhileTurnRuns() {
    DebateSession session = mesh.engine.openDebate(DebateRequest.builder()
      .topic("Ship on Friday?")
      .participant("thinker")
      .streaming(true)
      .build());

    Disposable running = mesh.engine.debate(session).subscribe();
    await().atMost(Duration.ofSeconds(2)).until(() -> mesh.workflowEvents.stream()
      .anyMatch(event -> event.getType() == WorkflowEventType.THOUGHT_RELAYED));

    assertThat(session.getTranscript()).isEmpty();
    assertThat(mesh.workflowEvents)
      .filteredOn(event -> event.getType() == WorkflowEventType.THOUGHT_RELAYED)
      .extracting(WorkflowEvent::getAgentName, WorkflowEvent::getRound, WorkflowEvent::getDetail)
      .containsExactly(tuple("thinker", 1, "weighing both sides"));

    await().atMost(Duration.ofSeconds(3))
      .until(() -> session.getStatus() == SessionStatus.COMPLETED);
    running.dispose();
    assertThat(session.getTranscript()).extracting(entry -> entry.getMessage().text())
      .containsExactly("decided");
    assertThat(mesh.workflowEvents).extracting(WorkflowEvent::getType)
      .containsSubsequence(WorkflowEventType.THOUGHT_RELAYED, WorkflowEventType.MESSAGE_RELAYED,
        WorkflowEventType.TURN_COMPLETED);
    assertThat(mesh.workflowEvents)
      .filteredOn(event -> event.getType() == WorkflowEventType.MESSAGE_RELAYED)
      .extracting(WorkflowEvent::getDetail)
      .containsExactly("decided");
  }

  @Test
  void streamingTurnFailureFailsDebate() {
    DebateSession session = mesh.engine.openDebate(DebateRequest.builder()
      .topic("Ship on Friday?")
      .participant("pro")
      .participant("broken")
      .streaming(true)
      .build());

    StepVerifier.create(mesh.engine.debate(session))
      .expectErrorSatisfies(e -> assertThat(AgentMeshException.kindOf(e))
        .isEqualTo(ErrorKind.AGENT_FAILED))
      .verify(Duration.ofSeconds(3));

    assertThat(session.getStatus()).isEqualTo(SessionStatus.FAILED);
    assertThat(session.getTranscript()).extracting(TranscriptEntry::getSpeaker)
      .containsExactly("pro");
  }

  @Test
  void cancellationTokenStopsStreamingTurn() {
    CancellationToken token = new CancellationToken();
    DebateSession session = mesh.engine.openDebate(DebateRequest.builder()
      .topic("Ship on Friday?")
      .participant("mute")
      .streaming(true)
      .callOptions(CallOptions.withToken(token))
      .build());

    StepVerifier.create(mesh.engine.debate(session))
      .then(token::cancel)
      .expectError(RunCancelledException.class)
      .verify(Duration.ofSeconds(3));

    assertThat(session.getStatus()).isEqualTo(SessionStatus.CANCELLED);
  }

  @Test
  void delegationFeedsAnswersBackToOrchestrator() {
    DelegationResult result = mesh.engine.delegate("planner",
      List.of(Message.user("Write a headline")), 3).block();

    assertThat(result.isCompleted()).isTrue();
    assertThat(result.getAnswer().text()).isEqualTo("final answer");
    assertThat(result.getRounds()).extracting(DelegationRound::getDepth).containsExactly(1, 2);

    List<DelegatedCall> calls = result.getRounds().get(0).getCalls();
    assertThat(calls).extracting(call -> call.getCall().getAgentName())
      .containsExactly("upper", "ghost");
    assertThat(calls.get(0).getAnswer()).isEqualTo("SHOUT THIS");
    assertThat(calls.get(1).getError().getKind()).isEqualTo(ErrorKind.AGENT_NOT_FOUND);

    assertThat(plannerFeedback).singleElement().satisfies(feedback -> assertThat(feedback)
      .contains("Response from upper (task: shout this):\nSHOUT THIS")
      .contains("Response from ghost (task: vanish):\n[Error: AGENT_NOT_FOUND"));
    assertThat(mesh.workflowEvents)
      .filteredOn(event -> event.getType() == WorkflowEventType.CALL_COMPLETED)
      .extracting(WorkflowEvent::getAgentName, WorkflowEvent::getDetail)
      .containsExactlyInAnyOrder(
        tuple("upper", "ok"),
        tuple("ghost", "AGENT_NOT_FOUND"));
  }

  @Test
  void delegationStopsAtMaxDepth() {
    DelegationResult result = mesh.engine.delegate("looper",
      List.of(Message.user("go")), 2).block();

    assertThat(result.isCompleted()).isFalse();
    assertThat(result.getRounds()).hasSize(2);
    assertThat(result.getRounds()).allSatisfy(round -> assertThat(round.getCalls())
      .extracting(DelegatedCall::getAnswer).containsExactly("again"));
    assertThat(result.getAnswer().text()).contains("<call_agent>");
    assertThat(mesh.workflowEvents)
      .filteredOn(event -> event.getType() == WorkflowEventType.SESSION_FINISHED)
      .extracting(WorkflowEvent::getDetail)
      .containsExactly("max depth reached");
  }

  @Test
  void failingOrchestratorFailsDelegation() {
    StepVerifier.create(mesh.engine.delegate("broken", List.of(Message.user("go")), 2))
      .expectErrorSatisfies(e -> assertThat(AgentMeshException.kindOf(e))
        .isEqualTo(ErrorKind.AGENT_FAILED))
      .verify(Duration.ofSeconds(3));
    StepVerifier.create(mesh.engine.delegate("planner", List.of(Message.user("go")), 0))
      .expectError(IllegalArgumentException.class)
      .verify();
  }
}
