package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * 审计轨迹中的一条尝试记录
 */
@Value
@Builder
public class DispatchAttempt {

  private String agentId;

  /**
   * 从 1 开始的尝试序号
   */
  private int attempt;

  private AttemptOutcome outcome;

  /**
   * 失败原因（成功时为空）
   */
  private String detail;

  private Instant startedAt;

  private long durationMs;
}
