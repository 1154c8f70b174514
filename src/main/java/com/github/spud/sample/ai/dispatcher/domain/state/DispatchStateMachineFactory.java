package com.github.spud.sample.ai.dispatcher.domain.state;

import java.util.EnumSet;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;

/**
 * 派发状态机工厂，每次派发一个实例
 * <pre>
 * 状态流转:
 *   IDLE --(START)--> SELECTING
 *   SELECTING --(CANDIDATES_READY)--> ATTEMPTING
 *   SELECTING --(NO_CANDIDATES)--> NO_CANDIDATE
 *   ATTEMPTING --(ATTEMPT_FAILED)--> ATTEMPTING (内部转换)
 *   ATTEMPTING --(ATTEMPT_SUCCEEDED)--> COMPLETED
 *   ATTEMPTING --(EXHAUSTED)--> EXHAUSTED
 *   ATTEMPTING --(NO_CANDIDATES)--> NO_CANDIDATE (候选在尝试前全部被注销)
 *   IDLE | SELECTING | ATTEMPTING --(CANCEL)--> CANCELLED
 * </pre>
 */
@Component
public class DispatchStateMachineFactory {

  public StateMachine<DispatchState, DispatchEvent> create(String machineId) {
    try {
      return build(machineId);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build dispatch state machine: " + machineId, e);
    }
  }

  private StateMachine<DispatchState, DispatchEvent> build(String machineId) throws Exception {
    StateMachineBuilder.Builder<DispatchState, DispatchEvent> builder = StateMachineBuilder.builder();

    builder.configureConfiguration()
      .withConfiguration()
      .machineId(machineId)
      .autoStartup(false);

    builder.configureStates()
      .withStates()
      .initial(DispatchState.IDLE)
      .states(EnumSet.allOf(DispatchState.class))
      .end(DispatchState.COMPLETED)
      .end(DispatchState.NO_CANDIDATE)
      .end(DispatchState.EXHAUSTED)
      .end(DispatchState.CANCELLED);

    builder.configureTransitions()
      // IDLE -> SELECTING
      .withExternal()
      .source(DispatchState.IDLE).target(DispatchState.SELECTING)
      .event(DispatchEvent.START)
      .and()

      // SELECTING -> ATTEMPTING / NO_CANDIDATE
      .withExternal()
      .source(DispatchState.SELECTING).target(DispatchState.ATTEMPTING)
      .event(DispatchEvent.CANDIDATES_READY)
      .and()
      .withExternal()
      .source(DispatchState.SELECTING).target(DispatchState.NO_CANDIDATE)
      .event(DispatchEvent.NO_CANDIDATES)
      .and()

      // 候选失败后留在 ATTEMPTING
      .withInternal()
      .source(DispatchState.ATTEMPTING)
      .event(DispatchEvent.ATTEMPT_FAILED)
      .and()

      .withExternal()
      .source(DispatchState.ATTEMPTING).target(DispatchState.COMPLETED)
      .event(DispatchEvent.ATTEMPT_SUCCEEDED)
      .and()
      .withExternal()
      .source(DispatchState.ATTEMPTING).target(DispatchState.EXHAUSTED)
      .event(DispatchEvent.EXHAUSTED)
      .and()
      .withExternal()
      .source(DispatchState.ATTEMPTING).target(DispatchState.NO_CANDIDATE)
      .event(DispatchEvent.NO_CANDIDATES)
      .and()

      // 取消
      .withExternal()
      .source(DispatchState.IDLE).target(DispatchState.CANCELLED)
      .event(DispatchEvent.CANCEL)
      .and()
      .withExternal()
      .source(DispatchState.SELECTING).target(DispatchState.CANCELLED)
      .event(DispatchEvent.CANCEL)
      .and()
      .withExternal()
      .source(DispatchState.ATTEMPTING).target(DispatchState.CANCELLED)
      .event(DispatchEvent.CANCEL);

    return builder.build();
  }
}
