package com.github.spud.agentmesh.domain.orchestration;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import com.github.spud.agentmesh.domain.protocol.RunOutcome;

/**
 * Branch results in request order, plus the synthesis when a synthesizer was configured.
 */
@Value
@Builder
public class FanOutResult {

  String sessionId;

  List<BranchResult> results;

  boolean partialFailure;

  RunOutcome synthesis;
}
