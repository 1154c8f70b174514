package com.github.spud.sample.ai.dispatcher.domain.transport;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * What the router hands to the transport for one attempt
 */
@Value
@Builder
public class AgentInvocation {

  private String requestId;

  private String sessionId;

  private String payload;

  private Map<String, Object> metadata;

  /**
   * Ask the agent for incremental chunks instead of a single reply
   */
  private boolean streaming;

  /**
   * 1-based attempt number within the dispatch
   */
  private int attempt;
}
