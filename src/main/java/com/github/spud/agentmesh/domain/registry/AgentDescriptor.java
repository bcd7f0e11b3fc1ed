package com.github.spud.agentmesh.domain.registry;

import com.github.spud.agentmesh.domain.agent.AgentCapability;
import com.github.spud.agentmesh.domain.message.Part;
import com.github.spud.agentmesh.domain.protocol.AgentMetadata;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable registry entry. The name is the sole identity; replacing an entry replaces the whole
 * descriptor.
 */
@Value
@Builder(toBuilder = true)
public class AgentDescriptor {

  @NonNull
  String name;

  @NonNull
  AgentKind kind;

  @Builder.Default
  Set<String> capabilities = Set.of();

  String description;

  @Builder.Default
  List<String> inputContentTypes = List.of(Part.TEXT_PLAIN);

  @Builder.Default
  List<String> outputContentTypes = List.of(Part.TEXT_PLAIN);

  /**
   * Base address of the hosting server, remote agents only.
   */
  URI endpoint;

  /**
   * Agent name on the remote host, defaults to {@link #name}.
   */
  String remoteAgentName;

  Instant discoveredAt;

  @Builder.Default
  AgentStatus status = AgentStatus.REGISTERED;

  Long latencyMs;

  Instant lastSeen;

  /**
   * In-process behaviour, local agents only.
   */
  AgentCapability capability;

  public static AgentDescriptor local(String name, String description,
    Set<String> capabilities, AgentCapability capability) {
    return AgentDescriptor.builder()
      .name(name)
      .kind(AgentKind.LOCAL)
      .description(description)
      .capabilities(Set.copyOf(capabilities))
      .status(AgentStatus.ONLINE)
      .capability(capability)
      .build();
  }

  public boolean isLocal() {
    return kind == AgentKind.LOCAL;
  }

  public boolean hasCapability(String capabilityName) {
    return capabilityName != null && capabilities.contains(capabilityName);
  }

  public String targetName() {
    return remoteAgentName != null ? remoteAgentName : name;
  }

  public AgentMetadata toMetadata() {
    return AgentMetadata.builder()
      .name(name)
      .description(description != null ? description : "")
      .capabilities(capabilities)
      .inputContentTypes(inputContentTypes)
      .outputContentTypes(outputContentTypes)
      .build();
  }
}
