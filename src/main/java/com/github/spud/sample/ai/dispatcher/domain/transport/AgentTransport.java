package com.github.spud.sample.ai.dispatcher.domain.transport;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 派发核心与 Agent 执行之间唯一的边界
 * <p>
 * 具体协议（HTTP、RPC、进程内调用）属于实现细节
 */
public interface AgentTransport {

  /**
   * 向 Agent 发送任务
   * <p>
   * 正常情况下以一个 {@code last = true} 的分片结束；拒绝以 {@link AgentDeclinedException} 结束；
   * 传输失败以 {@link AgentTransportException} 结束。取消订阅必须中止底层调用
   */
  Flux<AgentChunk> send(AgentDescriptor agent, AgentInvocation invocation);

  /**
   * 探测 Agent 健康状态，供健康检查使用
   */
  Mono<AgentHealth> probe(AgentDescriptor agent);
}
