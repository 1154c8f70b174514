package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.transport.AgentChunk;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentResponse;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTaskState;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransportException;

/**
 * 聚合单次尝试收到的分片；只在一次尝试的串行信号中使用
 */
class ResponseCollector {

  private final StringBuilder text = new StringBuilder();
  private int chunkCount;
  private AgentTaskState state;
  private boolean completed;

  void accept(AgentChunk chunk) {
    if (completed) {
      return;
    }
    chunkCount++;
    if (chunk.getText() != null) {
      text.append(chunk.getText());
    }
    if (chunk.isLast()) {
      completed = true;
      state = chunk.getState() != null ? chunk.getState() : AgentTaskState.COMPLETED;
    }
  }

  /**
   * 流结束但没有完成标记视为协议错误
   */
  void requireCompletion() {
    if (!completed) {
      throw AgentTransportException.protocol(
        "Agent stream ended without a completion marker after " + chunkCount + " chunks");
    }
  }

  AgentResponse toResponse() {
    return AgentResponse.builder()
      .state(state)
      .text(text.toString())
      .chunkCount(chunkCount)
      .build();
  }
}
