package com.github.spud.sample.ai.dispatcher.interfaces.rest;

import com.github.spud.sample.ai.dispatcher.domain.session.ConversationSessionStore;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionNotFoundException;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionSnapshot;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 会话 API
 */
@RestController
@RequestMapping("/dispatch/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final ConversationSessionStore sessionStore;

  /**
   * 显式创建会话；不指定 sessionId 时自动生成
   */
  @PostMapping
  public Mono<ResponseEntity<SessionSnapshot>> create(
    @RequestBody(required = false) CreateSessionRequest request
  ) {
    return Mono.fromCallable(() -> {
      String sessionId = request != null ? request.getSessionId() : null;
      return ResponseEntity.status(HttpStatus.CREATED).body(sessionStore.getOrCreate(sessionId));
    });
  }

  @GetMapping("/{sessionId}")
  public Mono<SessionSnapshot> get(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> sessionStore.find(sessionId)
      .orElseThrow(() -> new SessionNotFoundException(sessionId)));
  }

  @DeleteMapping("/{sessionId}")
  public Mono<ResponseEntity<Void>> close(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> {
      sessionStore.close(sessionId);
      return ResponseEntity.noContent().build();
    });
  }

  // ===== DTOs =====

  @Data
  public static class CreateSessionRequest {

    private String sessionId;
  }
}
