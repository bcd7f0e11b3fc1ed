package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.message.Message;
import java.util.List;
import lombok.Value;

/**
 * Outcome of a delegation session. {@link #completed} is false when the depth limit was reached
 * while the orchestrator still requested calls; {@link #answer} is then its last reply.
 */
@Value
public class DelegationResult {

  String sessionId;

  String orchestrator;

  List<DelegationRound> rounds;

  Message answer;

  boolean completed;
}
