package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.application.config.DispatcherProperties;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 进程内会话存储
 * <p>
 * 租约计数与清理判断都在 ConcurrentHashMap 的同一个 key 锁内完成，清理不会与进行中的派发竞争
 */
@Slf4j
@Component
public class InMemoryConversationSessionStore implements ConversationSessionStore {

  private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();

  private final DispatcherProperties properties;
  private final Clock clock;

  public InMemoryConversationSessionStore(DispatcherProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public SessionSnapshot getOrCreate(String sessionId) {
    String id = resolveId(sessionId);
    return sessions.computeIfAbsent(id, this::create).snapshot();
  }

  @Override
  public Optional<SessionSnapshot> find(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.get(sessionId)).map(ConversationSession::snapshot);
  }

  @Override
  public void pin(String sessionId, String agentId) {
    require(sessionId).pin(agentId, clock.instant());
  }

  @Override
  public void append(String sessionId, DispatchResult result) {
    require(sessionId).append(result, clock.instant());
  }

  @Override
  public void close(String sessionId) {
    if (sessionId == null) {
      throw new SessionNotFoundException(null);
    }
    AtomicBoolean found = new AtomicBoolean(false);
    AtomicBoolean busy = new AtomicBoolean(false);
    sessions.computeIfPresent(sessionId, (key, s) -> {
      found.set(true);
      if (s.isRetained()) {
        busy.set(true);
        return s;
      }
      return null;
    });
    if (!found.get()) {
      throw new SessionNotFoundException(sessionId);
    }
    if (busy.get()) {
      log.warn("Refused to close session with a turn in flight: sessionId={}", sessionId);
      throw new SessionBusyException(sessionId);
    }
    log.info("Closed session: sessionId={}", sessionId);
  }

  @Override
  public SessionLease open(String sessionId) {
    String id = resolveId(sessionId);
    ConversationSession session = sessions.compute(id, (key, existing) -> {
      ConversationSession s = existing != null ? existing : create(key);
      s.retain();
      return s;
    });

    boolean acquired;
    try {
      acquired = acquireTurn(session);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      unretain(session);
      throw new SessionBusyException(id, e);
    }
    if (!acquired) {
      unretain(session);
      log.warn("Rejected concurrent turn: sessionId={}, policy={}", id,
        properties.getSession().getConcurrentTurnPolicy());
      throw new SessionBusyException(id);
    }

    session.touch(clock.instant());
    log.debug("Opened session lease: sessionId={}", id);
    return new SessionLease(session, clock, () -> {
      session.touch(clock.instant());
      session.turnPermit().release();
      unretain(session);
      log.debug("Released session lease: sessionId={}", id);
    });
  }

  @Override
  public int evictIdle() {
    Instant cutoff = clock.instant().minus(properties.getSession().getIdleTimeout());
    int evicted = 0;
    for (String id : sessions.keySet()) {
      AtomicBoolean removed = new AtomicBoolean(false);
      sessions.computeIfPresent(id, (key, s) -> {
        if (s.isRetained() || !s.getLastActivityAt().isBefore(cutoff)) {
          return s;
        }
        removed.set(true);
        return null;
      });
      if (removed.get()) {
        evicted++;
        log.debug("Evicted idle session: sessionId={}", id);
      }
    }
    if (evicted > 0) {
      log.info("Evicted {} idle sessions, remaining={}", evicted, sessions.size());
    }
    return evicted;
  }

  @Override
  public int size() {
    return sessions.size();
  }

  private boolean acquireTurn(ConversationSession session) throws InterruptedException {
    DispatcherProperties.Session config = properties.getSession();
    if (config.getConcurrentTurnPolicy() == ConcurrentTurnPolicy.QUEUE) {
      return session.turnPermit()
        .tryAcquire(config.getQueueTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
    return session.turnPermit().tryAcquire();
  }

  /**
   * 只释放仍在 map 中的同一个会话实例
   */
  private void unretain(ConversationSession session) {
    sessions.computeIfPresent(session.getSessionId(), (key, s) -> {
      if (s == session) {
        s.release();
      }
      return s;
    });
  }

  private ConversationSession create(String sessionId) {
    log.info("Created session: sessionId={}", sessionId);
    return new ConversationSession(sessionId, clock.instant());
  }

  private ConversationSession require(String sessionId) {
    ConversationSession session = sessionId != null ? sessions.get(sessionId) : null;
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    return session;
  }

  private String resolveId(String sessionId) {
    return sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
  }
}
