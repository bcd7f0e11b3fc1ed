package com.github.spud.agentmesh.domain.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts delegation requests from an orchestrator's reply. A request has the form:
 * <pre>
 * &lt;call_agent&gt;
 * agent: researcher
 * task: find three sources on the topic
 * &lt;/call_agent&gt;
 * </pre>
 * Agent names are matched case-insensitively and returned in lower case.
 */
@Slf4j
public class AgentCallParser {

  private static final Pattern CALL_PATTERN = Pattern.compile(
    "<call_agent>\\s*agent:\\s*([\\w-]+)\\s*task:\\s*(.*?)\\s*</call_agent>",
    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  /**
   * Requests in the order they appear; empty when the reply is final.
   */
  public List<AgentCall> parse(String reply) {
    if (reply == null || reply.isBlank()) {
      return List.of();
    }
    List<AgentCall> calls = new ArrayList<>();
    Matcher matcher = CALL_PATTERN.matcher(reply);
    while (matcher.find()) {
      calls.add(new AgentCall(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2)));
    }
    log.debug("Found {} agent calls in reply (length={})", calls.size(), reply.length());
    return List.copyOf(calls);
  }
}
