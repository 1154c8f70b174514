package com.github.spud.sample.ai.dispatcher.domain.registry;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

public class DuplicateAgentException extends DispatchException {

  public DuplicateAgentException(String agentId) {
    super("DUPLICATE_AGENT", "Agent already registered: " + agentId);
  }
}
