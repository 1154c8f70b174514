package com.github.spud.sample.ai.dispatcher.domain.session;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

public class SessionNotFoundException extends DispatchException {

  public SessionNotFoundException(String sessionId) {
    super("SESSION_NOT_FOUND", "Session not found: " + sessionId);
  }
}
