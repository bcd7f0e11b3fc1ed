package com.github.spud.agentmesh.domain.orchestration;

import com.github.spud.agentmesh.domain.message.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;

/**
 * State of one debate. Only the engine driving it mutates it; readers get copies.
 */
public class DebateSession {

  @Getter
  private final String id = UUID.randomUUID().toString();

  @Getter
  private final DebateRequest request;

  private final List<TranscriptEntry> transcript = new ArrayList<>();

  private volatile int round;

  private volatile SessionStatus status = SessionStatus.RUNNING;

  private volatile Message verdict;

  DebateSession(DebateRequest request) {
    this.request = request;
  }

  public String getTopic() {
    return request.getTopic();
  }

  public List<String> getParticipants() {
    return request.getParticipants();
  }

  public synchronized List<TranscriptEntry> getTranscript() {
    return List.copyOf(transcript);
  }

  public int getRound() {
    return round;
  }

  public SessionStatus getStatus() {
    return status;
  }

  public Message getVerdict() {
    return verdict;
  }

  void startRound(int round) {
    this.round = round;
  }

  synchronized void append(TranscriptEntry entry) {
    if (status == SessionStatus.RUNNING) {
      transcript.add(entry);
    }
  }

  void setVerdict(Message verdict) {
    this.verdict = verdict;
  }

  /**
   * Moves to a terminal status; the first terminal status wins.
   */
  synchronized boolean finish(SessionStatus terminal) {
    if (status.isTerminal()) {
      return false;
    }
    status = terminal;
    return true;
  }

  /**
   * Input of the next speaker: the topic followed by the visible transcript.
   */
  synchronized List<Message> contextFor(Integer window) {
    List<Message> input = new ArrayList<>();
    input.add(Message.user(request.getTopic()));
    int from = window != null && window >= 0
      ? Math.max(0, transcript.size() - window) : 0;
    for (TranscriptEntry entry : transcript.subList(from, transcript.size())) {
      input.add(entry.asContext());
    }
    return input;
  }
}
