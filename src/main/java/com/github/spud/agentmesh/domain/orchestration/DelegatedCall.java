package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.protocol.RunError;
import lombok.Value;

/**
 * A dispatched delegation request with either the agent's answer or its error.
 */
@Value
public class DelegatedCall {

  AgentCall call;

  String answer;

  RunError error;

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * How the result is reported back to the orchestrator.
   */
  public String report() {
    String header = "Response from " + call.getAgentName() + " (task: " + call.getTask() + "):\n";
    return isSuccess() ? header + answer
      : header + "[Error: " + error.getKind() + " " + error.getReason() + "]";
  }
}
