package com.github.spud.agentmesh.interfaces.rest;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.orchestration.Branch;
import com.github.spud.agentmesh.domain.orchestration.BranchResult;
import com.github.spud.agentmesh.domain.orchestration.DebateRequest;
import com.github.spud.agentmesh.domain.orchestration.DebateSession;
import com.github.spud.agentmesh.domain.orchestration.DelegatedCall;
import com.github.spud.agentmesh.domain.orchestration.DelegationResult;
import com.github.spud.agentmesh.domain.orchestration.FanOutOptions;
import com.github.spud.agentmesh.domain.orchestration.FanOutPolicy;
import com.github.spud.agentmesh.domain.orchestration.FanOutResult;
import com.github.spud.agentmesh.domain.orchestration.OrchestrationEngine;
import com.github.spud.agentmesh.domain.orchestration.PipelineResult;
import com.github.spud.agentmesh.domain.orchestration.TranscriptEntry;
import com.github.spud.agentmesh.domain.protocol.RunError;
import com.github.spud.agentmesh.domain.router.CallOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Runs orchestration workflows over any registered agents, local or remote.
 */
@Slf4j
@RestController
@RequestMapping("/workflows")
@RequiredArgsConstructor
public class WorkflowController {

  private final OrchestrationEngine engine;

  @PostMapping("/fan-out")
  public Mono<FanOutResponse> fanOut(@Valid @RequestBody FanOutRequest request) {
    List<Branch> branches = request.getBranches().stream()
      .map(branch -> Branch.of(branch.getAgentName(), branch.getInput()))
      .toList();
    FanOutOptions options = FanOutOptions.builder()
      .policy(request.getPolicy() != null ? request.getPolicy() : FanOutPolicy.FAIL_FAST)
      .concurrency(request.getConcurrency())
      .synthesizer(request.getSynthesizer())
      .callOptions(callOptions(request.getTimeoutMs()))
      .build();
    return engine.fanOut(branches, options).map(FanOutResponse::fromResult);
  }

  @PostMapping("/pipeline")
  public Mono<PipelineResponse> pipeline(@Valid @RequestBody PipelineRequest request) {
    return engine.pipeline(request.getStages(), request.getInput(),
        callOptions(request.getTimeoutMs()))
      .map(PipelineResponse::fromResult);
  }

  @PostMapping("/debate")
  public Mono<DebateResponse> debate(@Valid @RequestBody DebateBody request) {
    DebateRequest debate = DebateRequest.builder()
      .topic(request.getTopic())
      .participants(request.getParticipants())
      .rounds(request.getRounds())
      .contextWindow(request.getContextWindow())
      .synthesizer(request.getSynthesizer())
      .streaming(request.isStreaming())
      .callOptions(callOptions(request.getTimeoutMs()))
      .build();
    return engine.debate(debate).map(DebateResponse::fromSession);
  }

  @PostMapping("/delegate")
  public Mono<DelegateResponse> delegate(@Valid @RequestBody DelegateRequest request) {
    Mono<DelegationResult> result = request.getMaxDepth() != null
      ? engine.delegate(request.getOrchestrator(), request.getInput(), request.getMaxDepth(),
        callOptions(request.getTimeoutMs()))
      : engine.delegate(request.getOrchestrator(), request.getInput(),
        callOptions(request.getTimeoutMs()));
    return result.map(DelegateResponse::fromResult);
  }

  private static CallOptions callOptions(Long timeoutMs) {
    return timeoutMs != null && timeoutMs > 0
      ? CallOptions.withTimeout(Duration.ofMillis(timeoutMs)) : CallOptions.defaults();
  }

  // ===== Request/Response DTOs =====

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class BranchBody {

    @NotBlank
    private String agentName;

    @NotEmpty
    private List<Message> input;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class FanOutRequest {

    @NotEmpty
    @Valid
    private List<BranchBody> branches;

    private FanOutPolicy policy;

    private Integer concurrency;

    private String synthesizer;

    private Long timeoutMs;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class BranchOutcome {

    private int index;
    private String agentName;
    private List<Message> output;
    private RunError error;

    static BranchOutcome fromResult(BranchResult result) {
      BranchOutcome outcome = new BranchOutcome();
      outcome.setIndex(result.getIndex());
      outcome.setAgentName(result.getBranch().getAgentName());
      outcome.setOutput(result.isSuccess() ? result.getOutcome().getOutput() : null);
      outcome.setError(result.getError());
      return outcome;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class FanOutResponse {

    private String sessionId;
    private boolean partialFailure;
    private List<BranchOutcome> results;
    private List<Message> synthesis;

    static FanOutResponse fromResult(FanOutResult result) {
      FanOutResponse response = new FanOutResponse();
      response.setSessionId(result.getSessionId());
      response.setPartialFailure(result.isPartialFailure());
      response.setResults(result.getResults().stream().map(BranchOutcome::fromResult).toList());
      response.setSynthesis(result.getSynthesis() != null
        ? result.getSynthesis().getOutput() : null);
      return response;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class PipelineRequest {

    @NotEmpty
    private List<String> stages;

    @NotEmpty
    private List<Message> input;

    private Long timeoutMs;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class PipelineResponse {

    private String sessionId;
    private int stages;
    private List<Message> output;

    static PipelineResponse fromResult(PipelineResult result) {
      PipelineResponse response = new PipelineResponse();
      response.setSessionId(result.getSessionId());
      response.setStages(result.getStages().size());
      response.setOutput(result.getOutput());
      return response;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DebateBody {

    @NotBlank
    private String topic;

    @NotEmpty
    private List<String> participants;

    @Min(1)
    private int rounds = 1;

    private Integer contextWindow;

    private String synthesizer;

    private boolean streaming;

    private Long timeoutMs;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DebateResponse {

    private String sessionId;
    private String status;
    private List<TranscriptLine> transcript;
    private String verdict;

    static DebateResponse fromSession(DebateSession session) {
      DebateResponse response = new DebateResponse();
      response.setSessionId(session.getId());
      response.setStatus(session.getStatus().name());
      response.setTranscript(session.getTranscript().stream()
        .map(TranscriptLine::fromEntry)
        .toList());
      response.setVerdict(session.getVerdict() != null ? session.getVerdict().text() : null);
      return response;
    }
  }

  @Data
  public static class TranscriptLine {

    private int round;
    private String speaker;
    private String text;

    static TranscriptLine fromEntry(TranscriptEntry entry) {
      TranscriptLine line = new TranscriptLine();
      line.setRound(entry.getRound());
      line.setSpeaker(entry.getSpeaker());
      line.setText(entry.getMessage().text());
      return line;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DelegateRequest {

    @NotBlank
    private String orchestrator;

    @NotEmpty
    private List<Message> input;

    @Min(1)
    private Integer maxDepth;

    private Long timeoutMs;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class CallLine {

    private int depth;
    private String agentName;
    private String task;
    private String answer;
    private RunError error;

    static CallLine fromCall(int depth, DelegatedCall call) {
      CallLine line = new CallLine();
      line.setDepth(depth);
      line.setAgentName(call.getCall().getAgentName());
      line.setTask(call.getCall().getTask());
      line.setAnswer(call.getAnswer());
      line.setError(call.getError());
      return line;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class DelegateResponse {

    private String sessionId;
    private boolean completed;
    private int depth;
    private List<CallLine> calls;
    private String answer;

    static DelegateResponse fromResult(DelegationResult result) {
      DelegateResponse response = new DelegateResponse();
      response.setSessionId(result.getSessionId());
      response.setCompleted(result.isCompleted());
      response.setDepth(result.getRounds().size());
      response.setCalls(result.getRounds().stream()
        .flatMap(round -> round.getCalls().stream()
          .map(call -> CallLine.fromCall(round.getDepth(), call)))
        .toList());
      response.setAnswer(result.getAnswer().text());
      return response;
    }
  }
}
