package com.github.spud.sample.ai.dispatcher.interfaces.rest;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.AllCandidatesFailedException;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.NoCandidateException;
import com.github.spud.sample.ai.dispatcher.domain.registry.DuplicateAgentException;
import com.github.spud.sample.ai.dispatcher.domain.registry.UnknownAgentException;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionBusyException;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionNotFoundException;
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

  @ExceptionHandler(DuplicateAgentException.class)
  public ResponseEntity<ErrorResponse> handleDuplicateAgent(DuplicateAgentException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(toErrorResponse(e));
  }

  @ExceptionHandler(UnknownAgentException.class)
  public ResponseEntity<ErrorResponse> handleUnknownAgent(UnknownAgentException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(toErrorResponse(e));
  }

  @ExceptionHandler(NoCandidateException.class)
  public ResponseEntity<ErrorResponse> handleNoCandidate(NoCandidateException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(toErrorResponse(e));
  }

  @ExceptionHandler(AllCandidatesFailedException.class)
  public ResponseEntity<ErrorResponse> handleAllCandidatesFailed(AllCandidatesFailedException e) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(toErrorResponse(e));
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(toErrorResponse(e));
  }

  @ExceptionHandler(SessionBusyException.class)
  public ResponseEntity<ErrorResponse> handleSessionBusy(SessionBusyException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(toErrorResponse(e));
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
        .code("INVALID_ARGUMENT")
        .message(e.getReason())
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

  /**
   * 派发失败的统一错误体，SSE 的 error 事件也使用它
   */
  static ErrorResponse toErrorResponse(DispatchException e) {
    Map<String, Object> details = null;
    if (e instanceof AllCandidatesFailedException) {
      DispatchResult result = ((AllCandidatesFailedException) e).getResult();
      details = new HashMap<>();
      details.put("requestId", result.getRequestId());
      details.put("sessionId", result.getSessionId());
      details.put("attempts", result.getAttempts());
    } else if (e instanceof NoCandidateException) {
      details = Map.of("requestId", ((NoCandidateException) e).getRequestId());
    }
    return ErrorResponse.builder()
        .code(e.getCode())
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .details(details)
        .build();
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
