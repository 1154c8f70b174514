package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentCard;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.state.DispatchState;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentResponse;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 一次派发的最终结果
 * <p>
 * response 与 error 只有一个有值
 */
@Value
@Builder
public class DispatchResult {

  private String requestId;

  private String sessionId;

  /**
   * 最终处理请求的 Agent（全部失败时为空）
   */
  private String agentId;

  /**
   * 最终处理请求的 Agent 的卡片
   */
  private AgentCard agentCard;

  private AgentResponse response;

  private String errorCode;

  private String errorMessage;

  /**
   * 按顺序记录的每一次尝试
   */
  private List<DispatchAttempt> attempts;

  private DispatchState finalState;

  private Instant startTime;

  private Instant endTime;

  public boolean isSuccess() {
    return response != null;
  }

  public long durationMs() {
    return endTime.toEpochMilli() - startTime.toEpochMilli();
  }

  /**
   * 从上下文创建成功结果
   */
  public static DispatchResult success(DispatchContext ctx, AgentDescriptor agent,
    AgentResponse response, DispatchState finalState, Instant end) {
    return DispatchResult.builder()
      .requestId(ctx.getRequestId())
      .sessionId(ctx.getSessionId())
      .agentId(agent.getId())
      .agentCard(agent.getCard())
      .response(response)
      .attempts(List.copyOf(ctx.getAttempts()))
      .finalState(finalState)
      .startTime(ctx.getStartTime())
      .endTime(end)
      .build();
  }

  /**
   * 创建失败结果
   */
  public static DispatchResult failure(DispatchContext ctx, String errorCode, String errorMessage,
    DispatchState finalState, Instant end) {
    return DispatchResult.builder()
      .requestId(ctx.getRequestId())
      .sessionId(ctx.getSessionId())
      .errorCode(errorCode)
      .errorMessage(errorMessage)
      .attempts(List.copyOf(ctx.getAttempts()))
      .finalState(finalState)
      .startTime(ctx.getStartTime())
      .endTime(end)
      .build();
  }
}
