package com.github.spud.sample.ai.dispatcher.domain.registry;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * 已注册 Agent 的元数据（不可变）
 * <p>
 * 健康状态变更通过 {@link #withHealth(AgentHealth, Instant)} 生成新实例，由 {@link AgentRegistry} 原子替换
 */
@Value
@Builder(toBuilder = true)
public class AgentDescriptor {

  /**
   * 全局唯一 ID
   */
  private String id;

  /**
   * 展示名称，缺省为 id
   */
  private String name;

  private String description;

  /**
   * 声明的能力标签（小写、去空白、保持声明顺序）
   */
  @Builder.Default
  private Set<String> capabilities = Collections.emptySet();

  /**
   * 传输层使用的端点引用
   */
  private String endpointRef;

  /**
   * 展示卡片，注册时补全缺省标题与副标题
   */
  private AgentCard card;

  @Builder.Default
  private AgentHealth health = AgentHealth.UNKNOWN;

  /**
   * 最近一次健康状态变更的观察时间
   */
  private Instant healthUpdatedAt;

  /**
   * 注册序号，用于确定性的平局裁决
   */
  private long registrationOrder;

  private Instant registeredAt;

  public AgentDescriptor withHealth(AgentHealth newHealth, Instant observedAt) {
    return toBuilder().health(newHealth).healthUpdatedAt(observedAt).build();
  }

  public boolean declaresAll(Collection<String> tags) {
    return capabilities.containsAll(tags);
  }

  public String displayName() {
    return name != null && !name.isBlank() ? name : id;
  }

  /**
   * 规范化能力标签：trim + 小写，丢弃空值
   */
  public static Set<String> normalizeTags(Collection<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String tag : tags) {
      if (tag != null && !tag.isBlank()) {
        normalized.add(tag.trim().toLowerCase(Locale.ROOT));
      }
    }
    return Collections.unmodifiableSet(normalized);
  }
}
