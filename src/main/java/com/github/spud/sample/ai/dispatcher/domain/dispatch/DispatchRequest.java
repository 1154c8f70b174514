package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 调用方提交的任务请求，提交后不可变
 */
@Value
@Builder(toBuilder = true)
public class DispatchRequest {

  /**
   * 任务内容，对 Router 不透明（仅 Matcher 可能检查）
   */
  private String payload;

  /**
   * 必须具备的能力，候选需声明其超集
   */
  @Singular
  private Set<String> requiredCapabilities;

  /**
   * 排序提示，不参与过滤
   */
  @Singular
  private Set<String> preferredCapabilities;

  /**
   * 关联已有会话；为空时创建新会话
   */
  private String sessionId;

  /**
   * 透传给 Agent 的扩展元数据
   */
  @Singular("metadataEntry")
  private Map<String, Object> metadata;

  public Set<String> normalizedRequiredCapabilities() {
    return AgentDescriptor.normalizeTags(requiredCapabilities);
  }

  public Set<String> normalizedPreferredCapabilities() {
    return AgentDescriptor.normalizeTags(preferredCapabilities);
  }
}
