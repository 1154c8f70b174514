package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentChunk;
import lombok.Builder;
import lombok.Value;

/**
 * 流式派发向调用方输出的单个元素：若干 CHUNK，最后恰好一个 RESULT
 */
@Value
@Builder
public class DispatchUpdate {

  public enum Type {
    CHUNK,
    RESULT
  }

  private Type type;

  /**
   * 产生该分片的 Agent；RESULT 时为最终处理者
   */
  private String agentId;

  /**
   * 产生该分片的尝试序号，调用方据此丢弃失败尝试已转发的分片
   */
  private int attempt;

  private AgentChunk chunk;

  private DispatchResult result;

  @JsonIgnore
  public boolean isResult() {
    return type == Type.RESULT;
  }

  public static DispatchUpdate chunk(String agentId, int attempt, AgentChunk chunk) {
    return DispatchUpdate.builder()
      .type(Type.CHUNK)
      .agentId(agentId)
      .attempt(attempt)
      .chunk(chunk)
      .build();
  }

  public static DispatchUpdate result(DispatchResult result) {
    return DispatchUpdate.builder()
      .type(Type.RESULT)
      .agentId(result.getAgentId())
      .attempt(result.getAttempts().size())
      .result(result)
      .build();
  }
}
