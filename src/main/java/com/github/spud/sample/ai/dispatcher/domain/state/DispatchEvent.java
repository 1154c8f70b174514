package com.github.spud.sample.ai.dispatcher.domain.state;

/**
 * 派发状态机事件
 */
public enum DispatchEvent {
  START,
  CANDIDATES_READY,
  NO_CANDIDATES,
  /**
   * 当前候选失败，继续下一个（ATTEMPTING 内部转换）
   */
  ATTEMPT_FAILED,
  ATTEMPT_SUCCEEDED,
  EXHAUSTED,
  /**
   * 调用方取消
   */
  CANCEL
}
