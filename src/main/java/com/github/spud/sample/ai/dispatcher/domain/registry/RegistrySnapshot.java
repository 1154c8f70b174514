package com.github.spud.sample.ai.dispatcher.domain.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 注册表某一时刻的只读视图，按注册顺序排列
 * <p>
 * 快照与注册表后续的注册/注销/健康变更互不影响，保证一次派发决策基于一致的集合
 */
public final class RegistrySnapshot {

  private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Collections.emptyMap());

  private final Map<String, AgentDescriptor> agents;

  RegistrySnapshot(Map<String, AgentDescriptor> agents) {
    this.agents = agents;
  }

  public static RegistrySnapshot empty() {
    return EMPTY;
  }

  /**
   * 由任意描述符集合构造快照（测试与自定义 matcher 使用），按 registrationOrder 排序
   */
  public static RegistrySnapshot of(List<AgentDescriptor> descriptors) {
    List<AgentDescriptor> sorted = new ArrayList<>(descriptors);
    sorted.sort((a, b) -> Long.compare(a.getRegistrationOrder(), b.getRegistrationOrder()));
    Map<String, AgentDescriptor> map = new LinkedHashMap<>();
    for (AgentDescriptor descriptor : sorted) {
      map.put(descriptor.getId(), descriptor);
    }
    return new RegistrySnapshot(Collections.unmodifiableMap(map));
  }

  public List<AgentDescriptor> agents() {
    return List.copyOf(agents.values());
  }

  public Optional<AgentDescriptor> find(String agentId) {
    return Optional.ofNullable(agents.get(agentId));
  }

  public boolean contains(String agentId) {
    return agents.containsKey(agentId);
  }

  public int size() {
    return agents.size();
  }

  public boolean isEmpty() {
    return agents.isEmpty();
  }
}
