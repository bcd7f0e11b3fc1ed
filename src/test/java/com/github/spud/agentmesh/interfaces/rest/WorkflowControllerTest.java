package com.github.spud.agentmesh.interfaces.rest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class WorkflowControllerTest {

  @Autowired
  private WebTestClient webTestClient;

  @Test
  void shouldFanOutWithBestEffort() {
    String body = """
      {
        "branches": [
          {"agent_name": "echo", "input": [{"role": "user", "parts": [{"content": "one"}]}]},
          {"agent_name": "ghost", "input": [{"role": "user", "parts": [{"content": "two"}]}]}
        ],
        "policy": "BEST_EFFORT"
      }
      """;

    webTestClient.post()
      .uri("/workflows/fan-out")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.partial_failure").isEqualTo(true)
      .jsonPath("$.results[0].output[0].parts[0].content").isEqualTo("one")
      .jsonPath("$.results[1].error.kind").isEqualTo("AGENT_NOT_FOUND");
  }

  @Test
  void shouldReportFailingBranchWhenFailingFast() {
    String body = """
      {
        "branches": [
          {"agent_name": "ghost", "input": [{"role": "user", "parts": [{"content": "two"}]}]}
        ]
      }
      """;

    webTestClient.post()
      .uri("/workflows/fan-out")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isNotFound()
      .expectBody()
      .jsonPath("$.code").isEqualTo("AGENT_NOT_FOUND")
      .jsonPath("$.details.branchIndex").isEqualTo(0);
  }

  @Test
  void shouldRunPipeline() {
    String body = """
      {
        "stages": ["echo", "echo"],
        "input": [{"role": "user", "parts": [{"content": "relay"}]}]
      }
      """;

    webTestClient.post()
      .uri("/workflows/pipeline")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.stages").isEqualTo(2)
      .jsonPath("$.output[0].parts[0].content").isEqualTo("relay");
  }

  @Test
  void shouldRunDebate() {
    String body = """
      {
        "topic": "Is echo a good debater?",
        "participants": ["echo", "echo"],
        "rounds": 2,
        "context_window": 1
      }
      """;

    webTestClient.post()
      .uri("/workflows/debate")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("COMPLETED")
      .jsonPath("$.transcript.length()").isEqualTo(4)
      .jsonPath("$.transcript[3].round").isEqualTo(2);
  }

  @Test
  void shouldRunStreamingDebate() {
    String body = """
      {
        "topic": "Should echo stream?",
        "participants": ["echo"],
        "streaming": true
      }
      """;

    webTestClient.post()
      .uri("/workflows/debate")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("COMPLETED")
      .jsonPath("$.transcript[0].text").isEqualTo("Should echo stream?");
  }

  @Test
  void shouldDelegateUntilDepthLimit() {
    String body = """
      {
        "orchestrator": "echo",
        "input": [{"role": "user", "parts": [{"content": "<call_agent>agent: ECHO task: ping</call_agent>"}]}],
        "max_depth": 2
      }
      """;

    webTestClient.post()
      .uri("/workflows/delegate")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.completed").isEqualTo(false)
      .jsonPath("$.depth").isEqualTo(2)
      .jsonPath("$.calls[0].agent_name").isEqualTo("echo")
      .jsonPath("$.calls[0].answer").isEqualTo("ping");
  }

  @Test
  void shouldReturnFinalAnswerWithoutCalls() {
    webTestClient.post()
      .uri("/workflows/delegate")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"orchestrator\": \"echo\", "
        + "\"input\": [{\"role\": \"user\", \"parts\": [{\"content\": \"done\"}]}]}")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.completed").isEqualTo(true)
      .jsonPath("$.calls.length()").isEqualTo(0)
      .jsonPath("$.answer").isEqualTo("done");
  }

  @Test
  void shouldRejectDebateWithoutParticipants() {
    webTestClient.post()
      .uri("/workflows/debate")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"topic\": \"silence\", \"participants\": []}")
      .exchange()
      .expectStatus().isBadRequest();
  }
}
