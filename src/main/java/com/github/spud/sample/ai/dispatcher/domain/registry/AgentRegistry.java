package com.github.spud.sample.ai.dispatcher.domain.registry;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Agent 注册中心，派发候选的唯一事实来源
 * <p>
 * 读-复制-更新：写操作在监视器上串行，每次发布一份新的不可变 Map；读操作（快照、查询）无锁读取当前引用
 */
@Slf4j
@Component
public class AgentRegistry {

  private final Clock clock;

  /**
   * 当前发布的不可变视图（注册顺序）
   */
  private volatile Map<String, AgentDescriptor> agents = Collections.emptyMap();

  private long nextRegistrationOrder = 1;

  public AgentRegistry(Clock clock) {
    this.clock = clock;
  }

  /**
   * 注册 Agent，健康状态强制为 UNKNOWN
   *
   * @throws DuplicateAgentException id 已存在
   */
  public AgentDescriptor register(AgentDescriptor descriptor) {
    if (descriptor == null || descriptor.getId() == null || descriptor.getId().isBlank()) {
      throw new IllegalArgumentException("Agent id must not be blank");
    }
    synchronized (this) {
      if (agents.containsKey(descriptor.getId())) {
        throw new DuplicateAgentException(descriptor.getId());
      }
      Instant now = clock.instant();
      String name = descriptor.displayName();
      AgentCard card = descriptor.getCard() != null
        ? descriptor.getCard().withDefaults(name, descriptor.getDescription())
        : AgentCard.defaultFor(name, descriptor.getDescription());
      AgentDescriptor registered = descriptor.toBuilder()
        .name(name)
        .card(card)
        .capabilities(AgentDescriptor.normalizeTags(descriptor.getCapabilities()))
        .health(AgentHealth.UNKNOWN)
        .healthUpdatedAt(now)
        .registrationOrder(nextRegistrationOrder++)
        .registeredAt(now)
        .build();

      Map<String, AgentDescriptor> next = new LinkedHashMap<>(agents);
      next.put(registered.getId(), registered);
      agents = Collections.unmodifiableMap(next);

      log.info("Registered agent: id={}, capabilities={}, endpoint={}", registered.getId(),
        registered.getCapabilities(), registered.getEndpointRef());
      return registered;
    }
  }

  /**
   * 注销 Agent；已持有描述符的进行中派发不受影响，新派发不会再选中它
   *
   * @throws UnknownAgentException id 不存在
   */
  public AgentDescriptor deregister(String agentId) {
    synchronized (this) {
      AgentDescriptor existing = agents.get(agentId);
      if (existing == null) {
        throw new UnknownAgentException(agentId);
      }
      Map<String, AgentDescriptor> next = new LinkedHashMap<>(agents);
      next.remove(agentId);
      agents = Collections.unmodifiableMap(next);

      log.info("Deregistered agent: id={}", agentId);
      return existing;
    }
  }

  /**
   * 以当前时间作为观察时间更新健康状态
   *
   * @throws UnknownAgentException id 不存在
   */
  public AgentDescriptor updateHealth(String agentId, AgentHealth health) {
    return updateHealth(agentId, health, clock.instant());
  }

  /**
   * 更新健康状态；观察时间早于最近一次变更的更新被忽略（乱序的过期结果）
   *
   * @return 更新后的描述符（被忽略时返回当前描述符）
   * @throws UnknownAgentException id 不存在
   */
  public AgentDescriptor updateHealth(String agentId, AgentHealth health, Instant observedAt) {
    return applyHealth(agentId, health, observedAt)
      .orElseThrow(() -> new UnknownAgentException(agentId));
  }

  /**
   * 派发结果回写使用：Agent 已被注销时静默跳过
   *
   * @return 是否真正应用了变更
   */
  public boolean updateHealthIfPresent(String agentId, AgentHealth health, Instant observedAt) {
    AgentDescriptor before = agents.get(agentId);
    Optional<AgentDescriptor> after = applyHealth(agentId, health, observedAt);
    if (after.isEmpty()) {
      log.debug("Skipping health update for deregistered agent: id={}, health={}", agentId,
        health);
      return false;
    }
    return before == null || after.get() != before;
  }

  private Optional<AgentDescriptor> applyHealth(String agentId, AgentHealth health,
    Instant observedAt) {
    if (health == null) {
      throw new IllegalArgumentException("Health must not be null");
    }
    synchronized (this) {
      AgentDescriptor existing = agents.get(agentId);
      if (existing == null) {
        return Optional.empty();
      }
      if (existing.getHealthUpdatedAt() != null
        && observedAt.isBefore(existing.getHealthUpdatedAt())) {
        log.debug("Ignoring stale health update: id={}, health={}, observedAt={}, current={}@{}",
          agentId, health, observedAt, existing.getHealth(), existing.getHealthUpdatedAt());
        return Optional.of(existing);
      }

      AgentDescriptor updated = existing.withHealth(health, observedAt);
      Map<String, AgentDescriptor> next = new LinkedHashMap<>(agents);
      next.put(agentId, updated);
      agents = Collections.unmodifiableMap(next);

      if (existing.getHealth() != health) {
        if (health == AgentHealth.DEGRADED || health == AgentHealth.UNREACHABLE) {
          log.warn("Agent health changed: id={}, {} -> {}", agentId, existing.getHealth(), health);
        } else {
          log.info("Agent health changed: id={}, {} -> {}", agentId, existing.getHealth(), health);
        }
      }
      return Optional.of(updated);
    }
  }

  /**
   * 获取一致的时间点快照
   */
  public RegistrySnapshot snapshot() {
    return new RegistrySnapshot(agents);
  }

  public Optional<AgentDescriptor> find(String agentId) {
    return Optional.ofNullable(agents.get(agentId));
  }

  public boolean contains(String agentId) {
    return agents.containsKey(agentId);
  }

  /**
   * 获取所有 Agent（注册顺序）
   */
  public List<AgentDescriptor> list() {
    return List.copyOf(agents.values());
  }

  public int size() {
    return agents.size();
  }
}
