package com.github.spud.agentmesh.domain.router;

import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.Run;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.RunEvents;
import com.github.spud.agentmesh.domain.protocol.RunExecutor;
import com.github.spud.agentmesh.domain.protocol.RunMode;
import com.github.spud.agentmesh.domain.protocol.Transport;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs in-process capabilities through the same executor the protocol server uses.
 */
@Component
@RequiredArgsConstructor
public class LocalAgentBackend implements AgentBackend {

  private final RunExecutor runExecutor;

  @Override
  public boolean supports(AgentDescriptor descriptor) {
    return descriptor.isLocal() && descriptor.getCapability() != null;
  }

  @Override
  public Transport transport() {
    return Transport.LOCAL;
  }

  @Override
  public Mono<Run> call(AgentDescriptor descriptor, List<Message> input) {
    return RunEvents.finalRun(runExecutor.execute(descriptor.getName(),
      descriptor.getCapability(), input, RunMode.SYNC));
  }

  @Override
  public Flux<RunEvent> stream(AgentDescriptor descriptor, List<Message> input) {
    return runExecutor.execute(descriptor.getName(), descriptor.getCapability(), input,
      RunMode.STREAM);
  }
}
