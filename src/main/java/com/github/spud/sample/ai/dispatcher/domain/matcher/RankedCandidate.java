package com.github.spud.sample.ai.dispatcher.domain.matcher;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a ranking. Score and confidence are optional hints; strategies that only produce
 * an ordering leave them at zero.
 */
@Value
@Builder(toBuilder = true)
public class RankedCandidate {

  private String agentId;

  private int score;

  /**
   * Matcher confidence in [0, 1]
   */
  private double confidence;

  /**
   * Placed first because the session was pinned to it
   */
  private boolean pinned;

  public static RankedCandidate of(String agentId) {
    return RankedCandidate.builder().agentId(agentId).build();
  }
}
