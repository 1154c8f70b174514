package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

/**
 * 没有任何 Agent 能处理该请求
 */
public class NoCandidateException extends DispatchException {

  private final String requestId;

  public NoCandidateException(String requestId, String message) {
    super("NO_CANDIDATE", message);
    this.requestId = requestId;
  }

  public String getRequestId() {
    return requestId;
  }
}
