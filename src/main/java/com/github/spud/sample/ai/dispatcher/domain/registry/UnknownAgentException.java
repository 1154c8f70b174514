package com.github.spud.sample.ai.dispatcher.domain.registry;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

public class UnknownAgentException extends DispatchException {

  public UnknownAgentException(String agentId) {
    super("UNKNOWN_AGENT", "Agent not registered: " + agentId);
  }
}
