package com.github.spud.agentmesh.domain.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.ErrorKind;
import com.github.spud.agentmesh.domain.error.RunCancelledException;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.RunError;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.RunEventType;
import com.github.spud.agentmesh.domain.protocol.RunEvents;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;
import com.github.spud.agentmesh.domain.router.AgentRouter;
import com.github.spud.agentmesh.domain.router.CallOptions;
import com.github.spud.agentmesh.domain.state.RunState;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Higher-order workflows on top of {@link AgentRouter}: parallel fan-out/fan-in, sequential
 * pipelines, multi-round debates and orchestrator-driven delegation.
 */
@Slf4j
@Component
public class OrchestrationEngine {

  private static final String FAN_OUT = "fan-out";

  private static final String PIPELINE = "pipeline";

  private static final String DEBATE = "debate";

  private static final String DELEGATION = "delegation";

  private static final String CONTINUE_PROMPT = "Use these responses to continue. Request more "
    + "agents with <call_agent> blocks, or give your final answer.";

  private final AgentRouter router;

  private final List<WorkflowEventSink> sinks;

  private final int defaultConcurrency;

  private final int defaultDelegationDepth;

  private final AgentCallParser callParser = new AgentCallParser();

  public OrchestrationEngine(AgentRouter router, List<WorkflowEventSink> sinks,
    AgentMeshProperties properties) {
    this.router = router;
    this.sinks = List.copyOf(sinks);
    this.defaultConcurrency = properties.getOrchestration().getConcurrency();
    this.defaultDelegationDepth = properties.getOrchestration().getDelegationDepth();
  }

  // ===== Fan-out / fan-in =====

  /**
   * Runs the branches concurrently and returns their results in request order.
   */
  public Mono<FanOutResult> fanOut(List<Branch> branches, FanOutOptions options) {
    return Mono.defer(() -> {
      String sessionId = UUID.randomUUID().toString();
      int concurrency = options.getConcurrency() != null && options.getConcurrency() > 0
        ? options.getConcurrency() : defaultConcurrency;
      publish(event(sessionId, FAN_OUT, WorkflowEventType.SESSION_STARTED)
        .detail(branches.size() + " branches, " + options.getPolicy()
          + ", concurrency " + concurrency)
        .build());

      return Flux.range(0, branches.size())
        .flatMapSequential(index -> runBranch(sessionId, index, branches.get(index), options),
          Math.max(1, concurrency))
        .collectList()
        .flatMap(results -> {
          boolean partialFailure = results.stream().anyMatch(result -> !result.isSuccess());
          FanOutResult.FanOutResultBuilder result = FanOutResult.builder()
            .sessionId(sessionId)
            .results(List.copyOf(results))
            .partialFailure(partialFailure);
          return synthesizeBranches(sessionId, results, options)
            .map(synthesis -> result.synthesis(synthesis).build())
            .defaultIfEmpty(result.build());
        })
        .doOnSuccess(result -> publish(event(sessionId, FAN_OUT,
          WorkflowEventType.SESSION_FINISHED)
          .detail(result.isPartialFailure() ? "partial failure" : "completed")
          .build()))
        .doOnError(e -> publish(event(sessionId, FAN_OUT, WorkflowEventType.SESSION_FINISHED)
          .detail("failed: " + e.getMessage())
          .build()));
    });
  }

  private Mono<BranchResult> runBranch(String sessionId, int index, Branch branch,
    FanOutOptions options) {
    Mono<BranchResult> call = router.call(branch.getAgentName(), branch.getInput(),
        options.getCallOptions())
      .map(outcome -> BranchResult.success(index, branch, outcome));

    if (options.getPolicy() == FanOutPolicy.BEST_EFFORT) {
      call = call.onErrorResume(e -> {
        log.warn("Fan-out branch {} ({}) failed: {}", index, branch.getAgentName(),
          e.getMessage());
        return Mono.just(BranchResult.failure(index, branch, RunError.from(e)));
      });
    } else {
      call = call.onErrorMap(e -> new BranchFailedException(index, branch.getAgentName(), e));
    }

    return call.doOnNext(result -> publish(event(sessionId, FAN_OUT,
      WorkflowEventType.BRANCH_COMPLETED)
      .agentName(branch.getAgentName())
      .index(index)
      .detail(result.isSuccess() ? "ok" : result.getError().getKind().name())
      .build()));
  }

  private Mono<RunOutcome> synthesizeBranches(String sessionId, List<BranchResult> results,
    FanOutOptions options) {
    if (options.getSynthesizer() == null) {
      return Mono.empty();
    }
    List<Message> input = new ArrayList<>();
    for (BranchResult result : results) {
      if (result.isSuccess()) {
        input.add(Message.agent(result.getBranch().getAgentName() + ": "
          + result.getOutcome().text()));
      }
    }
    if (input.isEmpty()) {
      log.warn("Skipping synthesis of fan-out {}: no branch succeeded", sessionId);
      return Mono.empty();
    }
    return synthesize(sessionId, FAN_OUT, options.getSynthesizer(), input,
      options.getCallOptions());
  }

  // ===== Pipeline =====

  public Mono<PipelineResult> pipeline(List<String> stages, List<Message> input) {
    return pipeline(stages, input, CallOptions.defaults());
  }

  /**
   * Feeds each stage's full output into the next stage. Stops at the first failing stage.
   */
  public Mono<PipelineResult> pipeline(List<String> stages, List<Message> input,
    CallOptions options) {
    if (stages == null || stages.isEmpty()) {
      return Mono.error(new IllegalArgumentException("A pipeline needs at least one stage"));
    }
    return Mono.defer(() -> {
      String sessionId = UUID.randomUUID().toString();
      publish(event(sessionId, PIPELINE, WorkflowEventType.SESSION_STARTED)
        .detail(String.join(" -> ", stages))
        .build());

      Mono<PipelineResult> chain = Mono.just(new PipelineResult(sessionId, List.of(),
        List.copyOf(input)));
      for (int i = 0; i < stages.size(); i++) {
        int stageIndex = i;
        String agentName = stages.get(i);
        chain = chain.flatMap(previous -> router.call(agentName, previous.getOutput(), options)
          .onErrorMap(e -> new PipelineStageException(stageIndex, agentName, e))
          .doOnNext(outcome -> publish(event(sessionId, PIPELINE,
            WorkflowEventType.STAGE_COMPLETED)
            .agentName(agentName)
            .index(stageIndex)
            .build()))
          .map(previous::append));
      }
      return chain
        .doOnSuccess(result -> publish(event(sessionId, PIPELINE,
          WorkflowEventType.SESSION_FINISHED).detail("completed").build()))
        .doOnError(e -> publish(event(sessionId, PIPELINE, WorkflowEventType.SESSION_FINISHED)
          .detail("failed: " + e.getMessage())
          .build()));
    });
  }

  // ===== Debate =====

  /**
   * Opens a debate session without starting it; {@link #debate(DebateSession)} drives it.
   */
  public DebateSession openDebate(DebateRequest request) {
    if (request.getParticipants().isEmpty()) {
      throw new IllegalArgumentException("A debate needs at least one participant");
    }
    if (request.getRounds() < 1) {
      throw new IllegalArgumentException("A debate needs at least one round");
    }
    return new DebateSession(request);
  }

  public Mono<DebateSession> debate(DebateRequest request) {
    return Mono.defer(() -> debate(openDebate(request)));
  }

  /**
   * Runs the rounds; within a round participants speak in order, each seeing the topic and the
   * transcript so far. Cancelling keeps the transcript up to the last completed turn.
   */
  public Mono<DebateSession> debate(DebateSession session) {
    DebateRequest request = session.getRequest();
    return Mono.defer(() -> {
      publish(event(session.getId(), DEBATE, WorkflowEventType.SESSION_STARTED)
        .detail(request.getParticipants() + " x " + request.getRounds() + " rounds")
        .build());

      return Flux.range(1, request.getRounds())
        .concatMap(round -> {
          session.startRound(round);
          publish(event(session.getId(), DEBATE, WorkflowEventType.ROUND_STARTED)
            .round(round)
            .build());
          return Flux.fromIterable(request.getParticipants())
            .concatMap(participant -> turn(session, participant, round));
        })
        .then(Mono.defer(() -> synthesizeVerdict(session)))
        .thenReturn(session);
    })
      .doOnSuccess(done -> finishDebate(session, SessionStatus.COMPLETED, null))
      .doOnError(e -> finishDebate(session,
        AgentMeshException.kindOf(e) == ErrorKind.CANCELLED
          ? SessionStatus.CANCELLED : SessionStatus.FAILED, e.getMessage()))
      .doOnCancel(() -> finishDebate(session, SessionStatus.CANCELLED, "cancelled"));
  }

  private Mono<TranscriptEntry> turn(DebateSession session, String participant, int round) {
    DebateRequest request = session.getRequest();
    return Mono.defer(() -> {
        List<Message> context = session.contextFor(request.getContextWindow());
        return request.isStreaming()
          ? streamTurn(session, participant, round, context)
          : router.call(participant, context, request.getCallOptions()).map(RunOutcome::text);
      })
      .map(text -> new TranscriptEntry(round, participant, Message.agent(text)))
      .doOnNext(entry -> {
        session.append(entry);
        publish(event(session.getId(), DEBATE, WorkflowEventType.TURN_COMPLETED)
          .agentName(participant)
          .round(round)
          .build());
      });
  }

  /**
   * Streams one turn, relaying thoughts and finished messages as they arrive. Resolves to the
   * turn's text once the Run completes.
   */
  private Mono<String> streamTurn(DebateSession session, String participant, int round,
    List<Message> context) {
    return router.stream(participant, context, session.getRequest().getCallOptions())
      .doOnNext(runEvent -> relay(session.getId(), participant, round, runEvent))
      .filter(RunEvent::isTerminal)
      .next()
      .switchIfEmpty(Mono.error(() -> new RunCancelledException(
        "Turn of " + participant + " was cancelled")))
      .map(RunEvents::toRun)
      .flatMap(run -> run.getState() == RunState.COMPLETED
        ? Mono.just(Message.text(run.getOutput()))
        : Mono.error(run.getError().toException(run.getId())));
  }

  private void relay(String sessionId, String participant, int round, RunEvent runEvent) {
    if (runEvent.getType() == RunEventType.GENERIC) {
      JsonNode generic = runEvent.generic();
      JsonNode thought = generic != null ? generic.get("thought") : null;
      publish(event(sessionId, DEBATE, WorkflowEventType.THOUGHT_RELAYED)
        .agentName(participant)
        .round(round)
        .detail(thought != null ? thought.asText() : String.valueOf(generic))
        .build());
    } else if (runEvent.getType() == RunEventType.MESSAGE_COMPLETED) {
      publish(event(sessionId, DEBATE, WorkflowEventType.MESSAGE_RELAYED)
        .agentName(participant)
        .round(round)
        .index(runEvent.messageIndex())
        .detail(runEvent.message().text())
        .build());
    }
  }

  private Mono<Void> synthesizeVerdict(DebateSession session) {
    DebateRequest request = session.getRequest();
    if (request.getSynthesizer() == null) {
      return Mono.empty();
    }
    return synthesize(session.getId(), DEBATE, request.getSynthesizer(),
      session.contextFor(null), request.getCallOptions())
      .doOnNext(outcome -> session.setVerdict(Message.agent(outcome.text())))
      .then();
  }

  private void finishDebate(DebateSession session, SessionStatus status, String detail) {
    if (session.finish(status)) {
      publish(event(session.getId(), DEBATE, WorkflowEventType.SESSION_FINISHED)
        .round(session.getRound())
        .detail(detail != null ? status + ": " + detail : status.name())
        .build());
    }
  }

  // ===== Delegation =====

  public Mono<DelegationResult> delegate(String orchestrator, List<Message> input) {
    return delegate(orchestrator, input, defaultDelegationDepth, CallOptions.defaults());
  }

  public Mono<DelegationResult> delegate(String orchestrator, List<Message> input,
    CallOptions options) {
    return delegate(orchestrator, input, defaultDelegationDepth, options);
  }

  public Mono<DelegationResult> delegate(String orchestrator, List<Message> input,
    int maxDepth) {
    return delegate(orchestrator, input, maxDepth, CallOptions.defaults());
  }

  /**
   * Lets an orchestrator agent delegate work. Its reply is scanned for {@code <call_agent>}
   * blocks; each requested agent is called with its task and the answers are fed back to the
   * orchestrator, up to {@code maxDepth} replies. A reply without calls is the final answer.
   * <p>
   * A failing or unknown delegate is reported to the orchestrator as an error line; only a
   * failure of the orchestrator itself, or cancellation, fails the session.
   */
  public Mono<DelegationResult> delegate(String orchestrator, List<Message> input, int maxDepth,
    CallOptions options) {
    if (maxDepth < 1) {
      return Mono.error(new IllegalArgumentException("Delegation depth must be at least 1"));
    }
    return Mono.defer(() -> {
      String sessionId = UUID.randomUUID().toString();
      publish(event(sessionId, DELEGATION, WorkflowEventType.SESSION_STARTED)
        .agentName(orchestrator)
        .detail("max depth " + maxDepth)
        .build());

      return delegateStep(sessionId, orchestrator, List.copyOf(input), List.of(), 1, maxDepth,
        options)
        .doOnSuccess(result -> publish(event(sessionId, DELEGATION,
          WorkflowEventType.SESSION_FINISHED)
          .agentName(orchestrator)
          .round(result.getRounds().size())
          .detail(result.isCompleted() ? "completed" : "max depth reached")
          .build()))
        .doOnError(e -> publish(event(sessionId, DELEGATION, WorkflowEventType.SESSION_FINISHED)
          .agentName(orchestrator)
          .detail("failed: " + e.getMessage())
          .build()));
    });
  }

  private Mono<DelegationResult> delegateStep(String sessionId, String orchestrator,
    List<Message> conversation, List<DelegationRound> rounds, int depth, int maxDepth,
    CallOptions options) {
    return router.call(orchestrator, conversation, options).flatMap(outcome -> {
      String reply = outcome.text();
      List<AgentCall> calls = callParser.parse(reply);
      if (calls.isEmpty()) {
        return Mono.just(new DelegationResult(sessionId, orchestrator,
          append(rounds, new DelegationRound(depth, reply, List.of())), Message.agent(reply),
          true));
      }
      log.info("Orchestrator {} requested {} calls at depth {}", orchestrator, calls.size(),
        depth);

      return Flux.range(0, calls.size())
        .flatMapSequential(index -> dispatch(sessionId, depth, index, calls.get(index), options),
          Math.max(1, defaultConcurrency))
        .collectList()
        .flatMap(results -> {
          List<DelegationRound> next = append(rounds, new DelegationRound(depth, reply,
            List.copyOf(results)));
          if (depth >= maxDepth) {
            log.warn("Delegation {} reached max depth {} with calls still pending", sessionId,
              maxDepth);
            return Mono.just(new DelegationResult(sessionId, orchestrator, next,
              Message.agent(reply), false));
          }
          List<Message> followUp = new ArrayList<>(conversation);
          followUp.add(Message.agent(reply));
          followUp.add(Message.user(results.stream()
            .map(DelegatedCall::report)
            .collect(Collectors.joining("\n\n")) + "\n\n" + CONTINUE_PROMPT));
          return delegateStep(sessionId, orchestrator, List.copyOf(followUp), next, depth + 1,
            maxDepth, options);
        });
    });
  }

  private Mono<DelegatedCall> dispatch(String sessionId, int depth, int index, AgentCall call,
    CallOptions options) {
    return router.call(call.getAgentName(), List.of(Message.user(call.getTask())), options)
      .map(outcome -> new DelegatedCall(call, outcome.text(), null))
      .onErrorResume(e -> AgentMeshException.kindOf(e) != ErrorKind.CANCELLED, e -> {
        log.warn("Delegated call to {} failed: {}", call.getAgentName(), e.getMessage());
        return Mono.just(new DelegatedCall(call, null, RunError.from(e)));
      })
      .doOnNext(result -> publish(event(sessionId, DELEGATION,
        WorkflowEventType.CALL_COMPLETED)
        .agentName(call.getAgentName())
        .round(depth)
        .index(index)
        .detail(result.isSuccess() ? "ok" : result.getError().getKind().name())
        .build()));
  }

  private static List<DelegationRound> append(List<DelegationRound> rounds,
    DelegationRound round) {
    List<DelegationRound> next = new ArrayList<>(rounds);
    next.add(round);
    return List.copyOf(next);
  }

  // ===== Shared =====

  private Mono<RunOutcome> synthesize(String sessionId, String workflow, String synthesizer,
    List<Message> input, CallOptions options) {
    return router.call(synthesizer, input, options)
      .doOnNext(outcome -> publish(event(sessionId, workflow,
        WorkflowEventType.SYNTHESIS_COMPLETED)
        .agentName(synthesizer)
        .build()));
  }

  private static WorkflowEvent.WorkflowEventBuilder event(String sessionId, String workflow,
    WorkflowEventType type) {
    return WorkflowEvent.builder().sessionId(sessionId).workflow(workflow).type(type);
  }

  private void publish(WorkflowEvent event) {
    for (WorkflowEventSink sink : sinks) {
      try {
        sink.publish(event);
      } catch (RuntimeException e) {
        log.warn("Workflow event sink {} rejected {}: {}", sink.getClass().getSimpleName(),
          event.getType(), e.getMessage());
      }
    }
  }
}
