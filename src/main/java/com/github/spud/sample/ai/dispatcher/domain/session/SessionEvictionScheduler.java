package com.github.spud.sample.ai.dispatcher.domain.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理空闲会话
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionEvictionScheduler {

  private final ConversationSessionStore sessionStore;

  @Scheduled(fixedDelayString = "${dispatcher.session.eviction-interval-ms:60000}")
  public void evict() {
    int evicted = sessionStore.evictIdle();
    log.debug("Session eviction sweep finished: evicted={}", evicted);
  }
}
