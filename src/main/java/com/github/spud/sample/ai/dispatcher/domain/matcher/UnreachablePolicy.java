package com.github.spud.sample.ai.dispatcher.domain.matcher;

/**
 * How UNREACHABLE agents take part in a ranking
 */
public enum UnreachablePolicy {
  /**
   * Ranked after every reachable candidate, tried only once all of those failed
   */
  LAST_RESORT,

  /**
   * Never ranked
   */
  EXCLUDE
}
