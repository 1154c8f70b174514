package com.github.spud.sample.ai.dispatcher.domain.matcher;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchRequest;
import com.github.spud.sample.ai.dispatcher.domain.registry.RegistrySnapshot;

/**
 * 能力匹配策略 - 决定一个请求可以交给哪些 Agent 以及先后顺序
 * <p>
 * 实现可以是静态标签匹配、向量相似度，或调用外部分类服务；Router 只依赖返回的排序
 */
public interface CapabilityMatcher {

  /**
   * 对快照中的 Agent 排序（最优在前）
   * <ul>
   *   <li>请求声明 requiredCapabilities 时，未声明其全部标签的 Agent 必须先被排除</li>
   *   <li>排除后为空时返回空排序，而不是抛出异常</li>
   *   <li>相同输入必须得到相同输出，平局按注册顺序裁决</li>
   * </ul>
   */
  CandidateRanking rank(DispatchRequest request, RegistrySnapshot snapshot);
}
