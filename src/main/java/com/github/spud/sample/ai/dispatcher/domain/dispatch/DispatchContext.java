package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.matcher.CandidateRanking;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionLease;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 单次派发的运行时上下文，只在一次派发内存活
 */
@Data
@Builder
public class DispatchContext {

  private String requestId;

  private DispatchRequest request;

  /**
   * 是否向调用方转发增量分片
   */
  private boolean streaming;

  /**
   * 本次派发持有的会话租约
   */
  private SessionLease lease;

  @Builder.Default
  private CandidateRanking candidates = CandidateRanking.empty();

  @Builder.Default
  private List<DispatchAttempt> attempts = new ArrayList<>();

  private Instant startTime;

  public String getSessionId() {
    return lease != null ? lease.sessionId() : null;
  }

  public int nextAttemptNumber() {
    return attempts.size() + 1;
  }

  public void recordAttempt(DispatchAttempt attempt) {
    attempts.add(attempt);
  }
}
