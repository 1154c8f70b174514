package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次派发对会话的独占租约
 * <p>
 * 租约存活期间会话不会被清理或关闭；close 幂等
 */
public class SessionLease implements AutoCloseable {

  private final ConversationSession session;
  private final Clock clock;
  private final Runnable onClose;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  SessionLease(ConversationSession session, Clock clock, Runnable onClose) {
    this.session = session;
    this.clock = clock;
    this.onClose = onClose;
  }

  public String sessionId() {
    return session.getSessionId();
  }

  public String pinnedAgentId() {
    return session.getPinnedAgentId();
  }

  public SessionSnapshot snapshot() {
    return session.snapshot();
  }

  public void pin(String agentId) {
    session.pin(agentId, clock.instant());
  }

  public void append(DispatchResult result) {
    session.append(result, clock.instant());
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onClose.run();
    }
  }
}
