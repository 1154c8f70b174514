package com.github.spud.sample.ai.dispatcher.domain.transport;

/**
 * The agent explicitly refused the task. Health is not affected.
 */
public class AgentDeclinedException extends RuntimeException {

  public AgentDeclinedException(String message) {
    super(message);
  }
}
