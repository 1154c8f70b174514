package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;

/**
 * 单次尝试的结果及其对 Agent 健康状态的影响
 */
public enum AttemptOutcome {
  SUCCESS(AgentHealth.HEALTHY),
  TIMEOUT(AgentHealth.DEGRADED),
  UNREACHABLE(AgentHealth.UNREACHABLE),
  /**
   * Agent 明确拒绝，不影响健康状态
   */
  DECLINED(null),
  /**
   * 响应格式错误或流在完成标记前结束
   */
  PROTOCOL_ERROR(AgentHealth.DEGRADED);

  private final AgentHealth healthEffect;

  AttemptOutcome(AgentHealth healthEffect) {
    this.healthEffect = healthEffect;
  }

  /**
   * @return 需要写回注册中心的健康状态，null 表示不变
   */
  public AgentHealth healthEffect() {
    return healthEffect;
  }
}
