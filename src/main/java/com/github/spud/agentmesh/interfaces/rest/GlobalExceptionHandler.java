package com.github.spud.agentmesh.interfaces.rest;

import com.github.spud.agentmesh.domain.error.AgentMeshException;
import com.github.spud.agentmesh.domain.error.AgentNotFoundException;
import com.github.spud.agentmesh.domain.error.MalformedResponseException;
import com.github.spud.agentmesh.domain.orchestration.BranchFailedException;
import com.github.spud.agentmesh.domain.orchestration.PipelineStageException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(AgentNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleAgentNotFound(AgentNotFoundException e) {
    ErrorResponse error = ErrorResponse.builder()
      .code("AGENT_NOT_FOUND")
      .message(e.getMessage())
      .timestamp(OffsetDateTime.now())
      .details(Map.of("agentName", String.valueOf(e.getAgentName())))
      .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(AgentMeshException.class)
  public ResponseEntity<ErrorResponse> handleAgentMesh(AgentMeshException e) {
    Map<String, Object> details = new HashMap<>();
    if (e instanceof PipelineStageException stage) {
      details.put("stageIndex", stage.getStageIndex());
      details.put("agentName", stage.getAgentName());
    } else if (e instanceof BranchFailedException branch) {
      details.put("branchIndex", branch.getBranchIndex());
      details.put("agentName", branch.getAgentName());
    } else if (e instanceof MalformedResponseException malformed
      && malformed.getRawPayload() != null) {
      details.put("raw", malformed.getRawPayload());
    }

    ErrorResponse error = ErrorResponse.builder()
      .code(e.getKind().name())
      .message(e.getMessage())
      .timestamp(OffsetDateTime.now())
      .details(details.isEmpty() ? null : details)
      .build();
    return ResponseEntity.status(statusOf(e)).body(error);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
      .code("VALIDATION_ERROR")
      .message("Request validation failed")
      .timestamp(OffsetDateTime.now())
      .details(Map.of("fieldErrors", fieldErrors))
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    ErrorResponse error = ErrorResponse.builder()
      .code("INVALID_REQUEST")
      .message(e.getReason() != null ? e.getReason() : "Malformed request")
      .timestamp(OffsetDateTime.now())
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    ErrorResponse error = ErrorResponse.builder()
      .code("INVALID_ARGUMENT")
      .message(e.getMessage())
      .timestamp(OffsetDateTime.now())
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
      .code("INTERNAL_ERROR")
      .message("An unexpected error occurred")
      .timestamp(OffsetDateTime.now())
      .details(createDetailsMap(e))
      .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  private static HttpStatus statusOf(AgentMeshException e) {
    return switch (e.getKind()) {
      case AGENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case DISCOVERY_FAILED, BACKEND_UNAVAILABLE, MALFORMED_RESPONSE -> HttpStatus.BAD_GATEWAY;
      case CANCELLED -> HttpStatus.CONFLICT;
      case AGENT_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private Map<String, Object> createDetailsMap(Exception e) {
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    details.put("message", e.getMessage());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return details;
  }
}
