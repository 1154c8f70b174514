package com.github.spud.sample.ai.dispatcher.domain.registry;

/**
 * Agent 健康状态
 * <pre>
 * UNKNOWN → HEALTHY ⇄ DEGRADED
 *         → UNREACHABLE
 * </pre>
 * 只由健康检查结果或派发结果驱动变更
 */
public enum AgentHealth {
  /**
   * 刚注册，尚未观察到任何结果
   */
  UNKNOWN(0),

  /**
   * 最近一次观察成功
   */
  HEALTHY(0),

  /**
   * 最近一次观察超时或协议异常
   */
  DEGRADED(1),

  /**
   * 传输层不可达
   */
  UNREACHABLE(2);

  private final int tier;

  AgentHealth(int tier) {
    this.tier = tier;
  }

  /**
   * 排序层级，数值越小越优先
   */
  public int tier() {
    return tier;
  }

  /**
   * 是否可以作为常规候选（非兜底）
   */
  public boolean isDispatchable() {
    return this != UNREACHABLE;
  }
}
