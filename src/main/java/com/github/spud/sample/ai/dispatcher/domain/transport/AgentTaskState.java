package com.github.spud.sample.ai.dispatcher.domain.transport;

/**
 * Terminal state reported by an agent that accepted a task
 */
public enum AgentTaskState {
  /**
   * Task finished, the response carries the answer
   */
  COMPLETED,

  /**
   * Agent asks the caller a follow-up question; the next turn of the session goes back to it
   */
  INPUT_REQUIRED,

  /**
   * Agent executed the task and reported an error. This is still the agent's answer.
   */
  FAILED
}
