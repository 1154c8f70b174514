package com.github.spud.sample.ai.dispatcher.interfaces.rest;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchRequest;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchRouter;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchUpdate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 任务派发 API
 */
@Slf4j
@RestController
@RequestMapping("/dispatch/tasks")
@RequiredArgsConstructor
public class DispatchController {

  private final DispatchRouter router;

  /**
   * 派发任务并等待最终结果
   */
  @PostMapping
  public Mono<DispatchResult> submit(@Valid @RequestBody SubmitTaskRequest request) {
    log.info("Received dispatch request: sessionId={}, payload={}", request.getSessionId(),
      StringUtils.truncate(request.getPayload(), 100));
    // QUEUE 策略下获取会话租约会阻塞
    return router.submit(request.toDispatchRequest())
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 流式派发：chunk 事件若干，最后一个 result 事件；失败时以 error 事件结束
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<Object>> stream(@Valid @RequestBody SubmitTaskRequest request) {
    log.info("Received streaming dispatch request: sessionId={}, payload={}",
      request.getSessionId(), StringUtils.truncate(request.getPayload(), 100));
    return router.stream(request.toDispatchRequest())
      .map(this::toEvent)
      .onErrorResume(DispatchException.class, e -> Flux.just(ServerSentEvent.builder()
        .event("error")
        .data((Object) GlobalExceptionHandler.toErrorResponse(e))
        .build()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  private ServerSentEvent<Object> toEvent(DispatchUpdate update) {
    return ServerSentEvent.builder()
      .event(update.isResult() ? "result" : "chunk")
      .data((Object) update)
      .build();
  }

  // ===== DTOs =====

  @Data
  public static class SubmitTaskRequest {

    @NotBlank
    private String payload;
    private Set<String> requiredCapabilities = new LinkedHashSet<>();
    private Set<String> preferredCapabilities = new LinkedHashSet<>();
    private String sessionId;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    DispatchRequest toDispatchRequest() {
      DispatchRequest.DispatchRequestBuilder builder = DispatchRequest.builder()
        .payload(payload)
        .sessionId(sessionId);
      if (requiredCapabilities != null) {
        builder.requiredCapabilities(requiredCapabilities);
      }
      if (preferredCapabilities != null) {
        builder.preferredCapabilities(preferredCapabilities);
      }
      if (metadata != null) {
        builder.metadata(metadata);
      }
      return builder.build();
    }
  }
}
