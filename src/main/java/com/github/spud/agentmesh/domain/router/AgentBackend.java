package com.github.spud.agentmesh.domain.router;

import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.Run;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.Transport;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import java.util.List;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A way of reaching an agent. Deadlines, cancellation and stream validation are applied by
 * {@link AgentRouter} on top.
 */
public interface AgentBackend {

  boolean supports(AgentDescriptor descriptor);

  Transport transport();

  /**
   * Final Run snapshot of a sync invocation. A failed Run is a value, not an error.
   */
  Mono<Run> call(AgentDescriptor descriptor, List<Message> input);

  Flux<RunEvent> stream(AgentDescriptor descriptor, List<Message> input);
}
