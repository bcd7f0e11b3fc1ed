package com.github.spud.agentmesh.domain.error;

/**
 * Classification carried by every failed Run and every {@link AgentMeshException}.
 */
public enum ErrorKind {

  /**
   * No descriptor for the requested agent name. Never retried.
   */
  AGENT_NOT_FOUND,

  /**
   * Metadata document unreachable or malformed during discovery.
   */
  DISCOVERY_FAILED,

  /**
   * Transient network failure reaching a remote backend, after retries.
   */
  BACKEND_UNAVAILABLE,

  /**
   * Call deadline exceeded; in-flight work was cancelled.
   */
  TIMEOUT,

  /**
   * Backend output does not conform to the protocol shape.
   */
  MALFORMED_RESPONSE,

  /**
   * Cancelled by the caller or by a failing sibling branch.
   */
  CANCELLED,

  /**
   * The agent itself reported a failure.
   */
  AGENT_FAILED
}
