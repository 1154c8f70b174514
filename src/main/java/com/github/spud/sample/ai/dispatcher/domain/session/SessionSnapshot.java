package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 会话某一时刻的不可变视图
 */
@Value
@Builder
public class SessionSnapshot {

  private String sessionId;

  /**
   * 上一轮的处理者，新会话为空
   */
  private String pinnedAgentId;

  private List<DispatchResult> history;

  private Instant createdAt;

  private Instant lastActivityAt;

  public int turnCount() {
    return history.size();
  }
}
