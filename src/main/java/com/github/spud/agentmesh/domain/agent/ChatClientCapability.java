package com.github.spud.agentmesh.domain.agent;

import com.github.spud.agentmesh.domain.message.Message;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persona agent backed by a Spring AI chat model. The persona is the system prompt; every input
 * message is forwarded as user content and the model response is streamed as parts.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatClientCapability implements AgentCapability {

  private final String agentName;

  private final ChatClient chatClient;

  private final String systemPrompt;

  @Override
  public Flux<AgentYield> run(List<Message> input) {
    return Flux.defer(() -> {
      Prompt prompt = new Prompt(toPromptMessages(input));
      log.debug("Agent {} prompting model with {} messages", agentName,
        prompt.getInstructions().size());
      Flux<AgentYield> parts = chatClient.prompt(prompt)
        .stream()
        .content()
        .filter(StringUtils::hasLength)
        .map(AgentYield::part);
      return Flux.concat(
        Mono.just(AgentYield.thought(agentName + " is thinking")),
        parts,
        Mono.just(AgentYield.endMessage()));
    });
  }

  private List<org.springframework.ai.chat.messages.Message> toPromptMessages(
    List<Message> input) {
    List<org.springframework.ai.chat.messages.Message> messages = new ArrayList<>();
    if (StringUtils.hasText(systemPrompt)) {
      messages.add(new SystemMessage(systemPrompt));
    }
    for (Message message : input) {
      messages.add(new UserMessage(message.text()));
    }
    return messages;
  }
}
