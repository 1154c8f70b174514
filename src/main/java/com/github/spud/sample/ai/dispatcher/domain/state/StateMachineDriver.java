package com.github.spud.sample.ai.dispatcher.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - Router 与 StateMachine 的适配层
 * <p>
 * 派发链路运行在 Reactor 的非阻塞线程上，所以这里只暴露响应式 API，不调用 block()
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final DispatchStateMachineFactory stateMachineFactory;

  /**
   * 为一次派发创建并启动状态机实例
   */
  public Mono<StateMachine<DispatchState, DispatchEvent>> start(String machineId) {
    return Mono.defer(() -> {
      StateMachine<DispatchState, DispatchEvent> sm = stateMachineFactory.create(machineId);
      return sm.startReactively().thenReturn(sm);
    });
  }

  /**
   * 获取当前状态
   */
  public DispatchState getCurrentState(StateMachine<DispatchState, DispatchEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件，结果为是否被接受
   */
  public Mono<Boolean> sendEvent(StateMachine<DispatchState, DispatchEvent> sm,
    DispatchEvent event) {
    return Mono.defer(() -> {
      log.debug("Sending event {} to state machine {}, current state: {}", event, sm.getId(),
        getCurrentState(sm));
      return sm.sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
        .next()
        .map(result -> result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED)
        .defaultIfEmpty(false)
        .doOnNext(accepted -> {
          if (accepted) {
            log.debug("Event {} accepted, new state: {}", event, getCurrentState(sm));
          } else {
            log.warn("Event {} rejected in state {}", event, getCurrentState(sm));
          }
        });
    });
  }

  /**
   * 停止状态机
   */
  public Mono<Void> stop(StateMachine<DispatchState, DispatchEvent> sm) {
    return sm.stopReactively();
  }

  /**
   * 判断是否处于终态
   */
  public boolean isInFinalState(StateMachine<DispatchState, DispatchEvent> sm) {
    return DispatchState.isFinal(getCurrentState(sm));
  }
}
