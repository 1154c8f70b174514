package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

/**
 * 会话已有进行中的轮次
 */
public class SessionBusyException extends DispatchException {

  public SessionBusyException(String sessionId) {
    super("SESSION_BUSY", "Session already has a dispatch in flight: " + sessionId);
  }

  public SessionBusyException(String sessionId, Throwable cause) {
    super("SESSION_BUSY", "Interrupted while waiting for session turn: " + sessionId, cause);
  }
}
