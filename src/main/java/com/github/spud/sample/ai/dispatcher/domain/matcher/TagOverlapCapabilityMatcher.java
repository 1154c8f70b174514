package com.github.spud.sample.ai.dispatcher.domain.matcher;

import com.github.spud.sample.ai.dispatcher.application.config.DispatcherProperties;
import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchRequest;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.RegistrySnapshot;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 默认匹配策略：能力标签交集计分
 * <p>
 * 请求标签 = required ∪ preferred ∪ payload 中恰好等于某个已声明能力的词
 * <p>
 * 排序键：健康层级（HEALTHY/UNKNOWN &lt; DEGRADED &lt; UNREACHABLE）→ 交集大小降序 → 声明能力数降序 → 注册顺序
 * <p>
 * 交集相同时能力更广的 Agent 优先，例如只要求 math 时 {math, code} 排在 {math} 之前
 */
@Slf4j
@Component
public class TagOverlapCapabilityMatcher implements CapabilityMatcher {

  private static final Pattern WORD_SPLITTER = Pattern.compile("[^\\p{L}\\p{N}_-]+");

  private static final Comparator<Scored> ORDER = Comparator
    .comparingInt((Scored s) -> s.agent.getHealth().tier())
    .thenComparing(Comparator.comparingInt((Scored s) -> s.score).reversed())
    .thenComparing(
      Comparator.comparingInt((Scored s) -> s.agent.getCapabilities().size()).reversed())
    .thenComparingLong(s -> s.agent.getRegistrationOrder());

  private final DispatcherProperties properties;

  public TagOverlapCapabilityMatcher(DispatcherProperties properties) {
    this.properties = properties;
  }

  @Override
  public CandidateRanking rank(DispatchRequest request, RegistrySnapshot snapshot) {
    if (snapshot.isEmpty()) {
      return CandidateRanking.empty();
    }

    Set<String> required = request.normalizedRequiredCapabilities();
    Set<String> requestTags = requestTags(request, snapshot);

    UnreachablePolicy unreachablePolicy = properties.getMatcher().getUnreachablePolicy();
    double minConfidence = properties.getMatcher().getMinConfidence();

    List<Scored> scored = new ArrayList<>();
    for (AgentDescriptor agent : snapshot.agents()) {
      // 1. 必需能力过滤
      if (!agent.declaresAll(required)) {
        continue;
      }
      // 2. 不可达策略
      if (!agent.getHealth().isDispatchable()
        && unreachablePolicy == UnreachablePolicy.EXCLUDE) {
        continue;
      }
      // 3. 计分
      int score = overlap(agent.getCapabilities(), requestTags);
      double confidence = requestTags.isEmpty() ? 1.0 : (double) score / requestTags.size();
      if (confidence < minConfidence) {
        continue;
      }
      scored.add(new Scored(agent, score, confidence));
    }

    scored.sort(ORDER);

    List<RankedCandidate> candidates = new ArrayList<>(scored.size());
    for (Scored s : scored) {
      candidates.add(RankedCandidate.builder()
        .agentId(s.agent.getId())
        .score(s.score)
        .confidence(s.confidence)
        .build());
    }

    CandidateRanking ranking = CandidateRanking.of(candidates);
    log.debug("Ranked candidates: required={}, requestTags={}, ranking={}", required, requestTags,
      ranking);
    return ranking;
  }

  /**
   * 汇总请求标签；payload 词仅在与快照中某个已声明能力相同时计入
   */
  private Set<String> requestTags(DispatchRequest request, RegistrySnapshot snapshot) {
    Set<String> tags = new LinkedHashSet<>(request.normalizedRequiredCapabilities());
    tags.addAll(request.normalizedPreferredCapabilities());

    String payload = request.getPayload();
    if (payload != null && !payload.isBlank()) {
      Set<String> declared = new HashSet<>();
      for (AgentDescriptor agent : snapshot.agents()) {
        declared.addAll(agent.getCapabilities());
      }
      for (String word : WORD_SPLITTER.split(payload.toLowerCase(Locale.ROOT))) {
        if (!word.isEmpty() && declared.contains(word)) {
          tags.add(word);
        }
      }
    }
    return tags;
  }

  private int overlap(Set<String> capabilities, Set<String> requestTags) {
    int count = 0;
    for (String tag : requestTags) {
      if (capabilities.contains(tag)) {
        count++;
      }
    }
    return count;
  }

  private static final class Scored {

    private final AgentDescriptor agent;
    private final int score;
    private final double confidence;

    private Scored(AgentDescriptor agent, int score, double confidence) {
      this.agent = agent;
      this.score = score;
      this.confidence = confidence;
    }
  }
}
