package com.github.spud.sample.ai.dispatcher.domain.state;

/**
 * 单次派发的状态
 */
public enum DispatchState {
  IDLE,
  /**
   * 解析会话钉住的 Agent 并排序候选
   */
  SELECTING,
  /**
   * 依次尝试候选
   */
  ATTEMPTING,
  COMPLETED,
  NO_CANDIDATE,
  EXHAUSTED,
  CANCELLED;

  public static boolean isFinal(DispatchState state) {
    return state == COMPLETED || state == NO_CANDIDATE || state == EXHAUSTED
      || state == CANCELLED;
  }
}
