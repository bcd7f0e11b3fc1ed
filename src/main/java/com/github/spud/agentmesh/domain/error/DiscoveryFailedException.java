package com.github.spud.agentmesh.domain.error;

import lombok.Getter;

@Getter
public class DiscoveryFailedException extends AgentMeshException {

  private final String endpoint;

  public DiscoveryFailedException(String endpoint, String reason) {
    super(ErrorKind.DISCOVERY_FAILED, "Discovery failed for " + endpoint + ": " + reason);
    this.endpoint = endpoint;
  }

  public DiscoveryFailedException(String endpoint, String reason, Throwable cause) {
    super(ErrorKind.DISCOVERY_FAILED, "Discovery failed for " + endpoint + ": " + reason, cause);
    this.endpoint = endpoint;
  }
}
