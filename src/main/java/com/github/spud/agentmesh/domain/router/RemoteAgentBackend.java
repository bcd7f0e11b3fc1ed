package com.github.spud.agentmesh.domain.router;

import com.github.spud.agentmesh.config.AgentMeshProperties;
import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.AgentNotFoundException;
import com.github.spud.agentmesh.domain.error.BackendUnavailableException;
import com.github.spud.agentmesh.domain.error.MalformedResponseException;
import com.github.spud.agentmesh.domain.message.Message;
import com.github.spud.agentmesh.domain.protocol.Run;
import com.github.spud.agentmesh.domain.protocol.RunEvent;
import com.github.spud.agentmesh.domain.protocol.RunMode;
import com.github.spud.agentmesh.domain.protocol.RunRequest;
import com.github.spud.agentmesh.domain.protocol.RunResponse;
import com.github.spud.agentmesh.domain.protocol.Transport;
import com.github.spud.agentmesh.domain.registry.AgentDescriptor;
import com.github.spud.agentmesh.domain.registry.AgentDiscoveryClient;
import com.github.spud.agentmesh.util.JsonUtils;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Client side of the HTTP run protocol. Transient failures are retried with exponential backoff
 * as long as nothing has been delivered to the caller.
 */
@Slf4j
@Component
public class RemoteAgentBackend implements AgentBackend {

  public static final String RUNS_PATH = "/runs";

  private static final Set<Integer> TRANSIENT_STATUS = Set.of(502, 503, 504);

  private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
    new ParameterizedTypeReference<>() {
    };

  private final WebClient webClient;

  private final AgentMeshProperties.Router settings;

  public RemoteAgentBackend(WebClient agentMeshWebClient, AgentMeshProperties properties) {
    this.webClient = agentMeshWebClient;
    this.settings = properties.getRouter();
  }

  @Override
  public boolean supports(AgentDescriptor descriptor) {
    return !descriptor.isLocal() && descriptor.getEndpoint() != null;
  }

  @Override
  public Transport transport() {
    return Transport.HTTP;
  }

  @Override
  public Mono<Run> call(AgentDescriptor descriptor, List<Message> input) {
    RunRequest request = request(descriptor, input, RunMode.SYNC);
    return webClient.post()
      .uri(runsUri(descriptor.getEndpoint()))
      .contentType(MediaType.APPLICATION_JSON)
      .accept(MediaType.APPLICATION_JSON)
      .bodyValue(request)
      .retrieve()
      .onStatus(HttpStatusCode::is4xxClientError, response -> clientError(descriptor, response))
      .bodyToMono(String.class)
      .switchIfEmpty(Mono.error(() ->
        new MalformedResponseException("Empty run response from " + descriptor.getName(), "")))
      .map(body -> toRun(descriptor, input, body))
      .retryWhen(retrySpec(descriptor, new AtomicBoolean()))
      .onErrorMap(e -> !(e instanceof AgentMeshException), e -> unavailable(descriptor, e));
  }

  @Override
  public Flux<RunEvent> stream(AgentDescriptor descriptor, List<Message> input) {
    return Flux.defer(() -> {
      AtomicBoolean delivered = new AtomicBoolean();
      RunRequest request = request(descriptor, input, RunMode.STREAM);
      return webClient.post()
        .uri(runsUri(descriptor.getEndpoint()))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(request)
        .retrieve()
        .onStatus(HttpStatusCode::is4xxClientError, response -> clientError(descriptor, response))
        .bodyToFlux(SSE_TYPE)
        .filter(sse -> sse.data() != null && !sse.data().isBlank())
        .map(sse -> parseEvent(sse.data()))
        .doOnNext(event -> delivered.set(true))
        .retryWhen(retrySpec(descriptor, delivered))
        .onErrorMap(e -> !delivered.get() && !(e instanceof AgentMeshException),
          e -> unavailable(descriptor, e));
    });
  }

  private Retry retrySpec(AgentDescriptor descriptor, AtomicBoolean delivered) {
    return Retry.backoff(settings.getMaxRetries(), settings.getInitialBackoff())
      .maxBackoff(settings.getMaxBackoff())
      .filter(e -> !delivered.get() && isTransient(e))
      .doBeforeRetry(signal -> log.warn("Retrying agent {} after attempt {}: {}",
        descriptor.getName(), signal.totalRetries() + 1, signal.failure().getMessage()))
      .onRetryExhaustedThrow((backoff, signal) -> new BackendUnavailableException(
        "Agent " + descriptor.getName() + " unavailable after "
          + (signal.totalRetries() + 1) + " attempts", signal.failure()));
  }

  static boolean isTransient(Throwable e) {
    if (e instanceof WebClientResponseException responseException) {
      return TRANSIENT_STATUS.contains(responseException.getStatusCode().value());
    }
    return e instanceof WebClientRequestException;
  }

  private Mono<? extends Throwable> clientError(AgentDescriptor descriptor,
    ClientResponse response) {
    int status = response.statusCode().value();
    if (status == 404) {
      return response.releaseBody().then(Mono.just(new AgentNotFoundException(
        descriptor.getName())));
    }
    return response.bodyToMono(String.class)
      .defaultIfEmpty("")
      .map(body -> new MalformedResponseException(
        "Agent host rejected the run request with HTTP " + status, body));
  }

  private AgentMeshException unavailable(AgentDescriptor descriptor, Throwable e) {
    if (e instanceof WebClientException) {
      return new BackendUnavailableException(
        "Agent " + descriptor.getName() + " unavailable: " + e.getMessage(), e);
    }
    return new MalformedResponseException(
      "Unreadable response from " + descriptor.getName() + ": " + e.getMessage(), null, e);
  }

  private Run toRun(AgentDescriptor descriptor, List<Message> input, String body) {
    RunResponse response;
    try {
      response = JsonUtils.fromJson(body, RunResponse.class);
    } catch (IllegalArgumentException e) {
      throw new MalformedResponseException("Run response is not valid JSON", body, e);
    }
    if (response == null || response.getRunId() == null || response.getStatus() == null) {
      throw new MalformedResponseException("Run response lacks run_id or status", body);
    }
    if (!response.getStatus().isTerminal()) {
      throw new MalformedResponseException(
        "Sync run response is not terminal: " + response.getStatus().wireName(), body);
    }
    return Run.builder()
      .id(response.getRunId())
      .agentName(descriptor.getName())
      .input(input)
      .mode(RunMode.SYNC)
      .state(response.getStatus())
      .finishedAt(Instant.now())
      .output(response.getOutput() != null ? response.getOutput() : List.of())
      .error(response.getError())
      .build();
  }

  static RunEvent parseEvent(String data) {
    try {
      RunEvent event = JsonUtils.fromJson(data, RunEvent.class);
      if (event.getRunId() == null || event.getType() == null) {
        throw new MalformedResponseException("Event lacks runId or type", data);
      }
      return event;
    } catch (IllegalArgumentException e) {
      throw new MalformedResponseException("Unreadable run event", data, e);
    }
  }

  private static RunRequest request(AgentDescriptor descriptor, List<Message> input,
    RunMode mode) {
    return RunRequest.builder()
      .agentName(descriptor.targetName())
      .input(input)
      .mode(mode)
      .build();
  }

  private static URI runsUri(URI endpoint) {
    return AgentDiscoveryClient.resolve(endpoint, RUNS_PATH);
  }
}
