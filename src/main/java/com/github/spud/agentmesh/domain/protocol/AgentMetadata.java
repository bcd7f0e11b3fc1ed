package com.github.spud.agentmesh.domain.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Well-known metadata document describing an agent, or a host with several agents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentMetadata {

  private String name;

  private String description;

  private Set<String> capabilities;

  private List<String> inputContentTypes;

  private List<String> outputContentTypes;

  /**
   * Hosted agents, present only on multi-agent host documents.
   */
  private List<AgentMetadata> agents;
}
