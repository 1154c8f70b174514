package com.github.spud.sample.ai.dispatcher.domain.health;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentRegistry;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransport;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 可选的周期性健康检查，结果通过 {@link AgentRegistry#updateHealthIfPresent} 写回
 * <p>
 * 观察时间取探测开始时刻，晚于它的派发结果不会被覆盖
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatcher.health-check", name = "enabled", havingValue = "true")
public class AgentHealthChecker {

  private final AgentRegistry registry;
  private final AgentTransport transport;
  private final Clock clock;

  /**
   * 运行在调度线程上，可以阻塞
   */
  @Scheduled(fixedDelayString = "${dispatcher.health-check.interval-ms:30000}")
  public void checkAll() {
    List<ProbeResult> results = probeAll().collectList().block();
    long unhealthy = results == null ? 0 : results.stream()
      .filter(r -> r.getHealth() != AgentHealth.HEALTHY)
      .count();
    log.debug("Health check sweep finished: agents={}, unhealthy={}",
      results == null ? 0 : results.size(), unhealthy);
  }

  /**
   * 并发探测注册表中的全部 Agent
   */
  public Flux<ProbeResult> probeAll() {
    return Flux.fromIterable(registry.list())
      .flatMap(this::probe);
  }

  private Mono<ProbeResult> probe(AgentDescriptor agent) {
    Instant observedAt = clock.instant();
    return transport.probe(agent)
      .defaultIfEmpty(AgentHealth.UNREACHABLE)
      .map(health -> new ProbeResult(agent.getId(), health,
        registry.updateHealthIfPresent(agent.getId(), health, observedAt)));
  }

  @Value
  public static class ProbeResult {

    String agentId;

    AgentHealth health;

    /**
     * 是否真正改变了注册表
     */
    boolean applied;
  }
}
