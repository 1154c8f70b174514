package com.github.spud.sample.ai.dispatcher.domain.transport;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated agent reply: the concatenated chunk text plus the state of the completion chunk
 */
@Value
@Builder
public class AgentResponse {

  private AgentTaskState state;

  private String text;

  private int chunkCount;
}
