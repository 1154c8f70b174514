package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * 一次多轮对话，由 {@link ConversationSessionStore} 持有
 * <p>
 * history 只追加；钉住的 Agent 仅在新的赢家产生时被替换
 */
public class ConversationSession {

  private final String sessionId;
  private final Instant createdAt;
  private final List<DispatchResult> history = new ArrayList<>();

  /**
   * 轮次许可，同一时刻只允许一个派发
   */
  private final Semaphore turnPermit = new Semaphore(1);

  private String pinnedAgentId;
  private Instant lastActivityAt;

  /**
   * 持有租约或正在排队的派发数，非 0 时不可清理；只在 store 的 map 锁内修改
   */
  private int retainCount;

  ConversationSession(String sessionId, Instant createdAt) {
    this.sessionId = sessionId;
    this.createdAt = createdAt;
    this.lastActivityAt = createdAt;
  }

  public String getSessionId() {
    return sessionId;
  }

  public synchronized String getPinnedAgentId() {
    return pinnedAgentId;
  }

  public synchronized void pin(String agentId, Instant at) {
    this.pinnedAgentId = agentId;
    this.lastActivityAt = at;
  }

  public synchronized void append(DispatchResult result, Instant at) {
    history.add(result);
    this.lastActivityAt = at;
  }

  public synchronized void touch(Instant at) {
    this.lastActivityAt = at;
  }

  public synchronized Instant getLastActivityAt() {
    return lastActivityAt;
  }

  public synchronized SessionSnapshot snapshot() {
    return SessionSnapshot.builder()
      .sessionId(sessionId)
      .pinnedAgentId(pinnedAgentId)
      .history(List.copyOf(history))
      .createdAt(createdAt)
      .lastActivityAt(lastActivityAt)
      .build();
  }

  Semaphore turnPermit() {
    return turnPermit;
  }

  void retain() {
    retainCount++;
  }

  void release() {
    retainCount--;
  }

  boolean isRetained() {
    return retainCount > 0;
  }
}
