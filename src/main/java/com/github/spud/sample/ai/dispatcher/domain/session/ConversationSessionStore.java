package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchResult;
import java.util.Optional;

/**
 * 会话存储
 * <p>
 * 同一会话的并发轮次由 {@link #open(String)} 串行化；持有租约的会话不会被清理
 */
public interface ConversationSessionStore {

  /**
   * 获取或创建会话；sessionId 为空时生成新 ID，未知的 sessionId 以该 ID 创建
   */
  SessionSnapshot getOrCreate(String sessionId);

  Optional<SessionSnapshot> find(String sessionId);

  /**
   * @throws SessionNotFoundException 会话不存在
   */
  void pin(String sessionId, String agentId);

  /**
   * @throws SessionNotFoundException 会话不存在
   */
  void append(String sessionId, DispatchResult result);

  /**
   * 显式关闭；会话被租用（有进行中或排队的轮次）时拒绝关闭
   *
   * @throws SessionNotFoundException 会话不存在
   * @throws SessionBusyException 会话被租用
   */
  void close(String sessionId);

  /**
   * 为一轮派发获取会话租约（必要时创建会话）
   *
   * @throws SessionBusyException 会话已有进行中的轮次（REJECT 策略或排队超时）
   */
  SessionLease open(String sessionId);

  /**
   * 清理空闲超时且未被租用的会话
   *
   * @return 清理数量
   */
  int evictIdle();

  int size();
}
