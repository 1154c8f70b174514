package com.github.spud.sample.ai.dispatcher.domain.session;

/**
 * 同一会话出现并发轮次时的处理方式
 */
public enum ConcurrentTurnPolicy {
  /**
   * 后到的轮次立即失败（调用方错误）
   */
  REJECT,
  /**
   * 后到的轮次排队等待，最长等待 queue-timeout
   */
  QUEUE
}
