package com.github.spud.agentmesh.domain.agent;

import com.github.spud.agentmesh.domain.message.Message;
import java.util.List;
import java.util.function.Function;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * In-process agent behaviour: given the input messages, produce output incrementally.
 */
@FunctionalInterface
public interface AgentCapability {

  Flux<AgentYield> run(List<Message> input);

  /**
   * Adapts a blocking function; it runs on the bounded elastic scheduler.
   */
  static AgentCapability of(Function<List<Message>, String> handler) {
    return input -> Mono.fromCallable(() -> handler.apply(input))
      .subscribeOn(Schedulers.boundedElastic())
      .map(AgentYield::message)
      .flux();
  }

  /**
   * Adapts a token stream; every token becomes a part of a single output message.
   */
  static AgentCapability streaming(Function<List<Message>, Flux<String>> tokens) {
    return input -> Flux.defer(() -> tokens.apply(input))
      .map(AgentYield::part)
      .concatWith(Mono.just(AgentYield.endMessage()));
  }
}
