package com.github.spud.sample.ai.dispatcher.domain.transport;

import lombok.Builder;
import lombok.Value;

/**
 * One piece of an agent reply. A reply is complete once a chunk with {@code last = true}
 * arrives; a non-streaming reply is a single last chunk.
 */
@Value
@Builder
public class AgentChunk {

  private String text;

  /**
   * Completion marker
   */
  private boolean last;

  /**
   * Only meaningful on the last chunk
   */
  @Builder.Default
  private AgentTaskState state = AgentTaskState.COMPLETED;

  public static AgentChunk partial(String text) {
    return AgentChunk.builder().text(text).build();
  }

  public static AgentChunk complete(String text) {
    return AgentChunk.builder().text(text).last(true).build();
  }

  public static AgentChunk complete(String text, AgentTaskState state) {
    return AgentChunk.builder().text(text).last(true).state(state).build();
  }
}
