package com.github.spud.sample.ai.dispatcher.domain.matcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered, best-first candidate list produced by a {@link CapabilityMatcher}.
 */
public final class CandidateRanking {

  private static final CandidateRanking EMPTY = new CandidateRanking(Collections.emptyList());

  private final List<RankedCandidate> candidates;

  private CandidateRanking(List<RankedCandidate> candidates) {
    this.candidates = candidates;
  }

  public static CandidateRanking empty() {
    return EMPTY;
  }

  public static CandidateRanking of(List<RankedCandidate> candidates) {
    return candidates.isEmpty() ? EMPTY : new CandidateRanking(List.copyOf(candidates));
  }

  public List<RankedCandidate> candidates() {
    return candidates;
  }

  public List<String> agentIds() {
    return candidates.stream().map(RankedCandidate::getAgentId).collect(Collectors.toList());
  }

  public Optional<RankedCandidate> find(String agentId) {
    return candidates.stream().filter(c -> c.getAgentId().equals(agentId)).findFirst();
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  public int size() {
    return candidates.size();
  }

  /**
   * Moves the given candidate to the front, removing any later duplicate.
   */
  public CandidateRanking withFirst(RankedCandidate first) {
    List<RankedCandidate> merged = new ArrayList<>(candidates.size() + 1);
    merged.add(first);
    for (RankedCandidate candidate : candidates) {
      if (!candidate.getAgentId().equals(first.getAgentId())) {
        merged.add(candidate);
      }
    }
    return new CandidateRanking(List.copyOf(merged));
  }

  @Override
  public String toString() {
    return candidates.stream()
      .map(c -> c.getAgentId() + "(" + c.getScore() + ")")
      .collect(Collectors.joining(", ", "[", "]"));
  }
}
