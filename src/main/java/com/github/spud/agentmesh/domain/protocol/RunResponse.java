package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.state.RunState;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sync-mode answer of {@code POST /runs}: the Run observed opaquely.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResponse {

  private String runId;

  private RunState status;

  private List<Message> output;

  private RunError error;

  public static RunResponse fromRun(Run run) {
    return RunResponse.builder()
      .runId(run.getId())
      .status(run.getState())
      .output(run.getOutput() != null ? run.getOutput() : List.of())
      .error(run.getError())
      .build();
  }
}
