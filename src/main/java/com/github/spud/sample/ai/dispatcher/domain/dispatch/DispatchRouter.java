package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.application.config.DispatcherProperties;
import com.github.spud.sample.ai.dispatcher.domain.matcher.CandidateRanking;
import com.github.spud.sample.ai.dispatcher.domain.matcher.CapabilityMatcher;
import com.github.spud.sample.ai.dispatcher.domain.matcher.RankedCandidate;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentRegistry;
import com.github.spud.sample.ai.dispatcher.domain.registry.RegistrySnapshot;
import com.github.spud.sample.ai.dispatcher.domain.session.ConversationSessionStore;
import com.github.spud.sample.ai.dispatcher.domain.session.SessionLease;
import com.github.spud.sample.ai.dispatcher.domain.state.DispatchEvent;
import com.github.spud.sample.ai.dispatcher.domain.state.DispatchState;
import com.github.spud.sample.ai.dispatcher.domain.state.StateMachineDriver;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentDeclinedException;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentInvocation;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransport;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransportException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 派发路由器 - 派发核心
 * <p>
 * 一次派发：租用会话 → 解析钉住的 Agent 与候选排序 → 按顺序逐个尝试，直到第一个成功。
 * 成功即停止，保证至多一个 Agent 执行同一请求；超时/不可达/协议错误降级健康状态并尝试下一个，拒绝不影响健康状态。
 * <p>
 * 取消订阅会传播到进行中的传输调用，并释放会话租约
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchRouter {

  private final AgentRegistry registry;
  private final CapabilityMatcher matcher;
  private final AgentTransport transport;
  private final ConversationSessionStore sessionStore;
  private final StateMachineDriver stateMachineDriver;
  private final DispatcherProperties properties;
  private final Clock clock;

  /**
   * 提交请求，返回最终结果
   * <p>
   * 失败时以 {@link NoCandidateException} 或 {@link AllCandidatesFailedException} 结束。
   * QUEUE 策略下获取会话租约可能阻塞，调用方应在 boundedElastic 上订阅
   */
  public Mono<DispatchResult> submit(DispatchRequest request) {
    return dispatch(request, false)
      .filter(DispatchUpdate::isResult)
      .map(DispatchUpdate::getResult)
      .last();
  }

  /**
   * 流式提交：先转发各尝试的分片，最后输出恰好一个 RESULT
   */
  public Flux<DispatchUpdate> stream(DispatchRequest request) {
    return dispatch(request, true);
  }

  private Flux<DispatchUpdate> dispatch(DispatchRequest request, boolean streaming) {
    return Flux.defer(() -> {
      if (request == null || request.getPayload() == null) {
        return Flux.error(new IllegalArgumentException("Request payload must not be null"));
      }
      String requestId = UUID.randomUUID().toString();
      return Flux.using(
        () -> sessionStore.open(request.getSessionId()),
        lease -> run(DispatchContext.builder()
          .requestId(requestId)
          .request(request)
          .streaming(streaming)
          .lease(lease)
          .startTime(clock.instant())
          .build()),
        SessionLease::close);
    });
  }

  private Flux<DispatchUpdate> run(DispatchContext ctx) {
    log.info("Dispatch started: requestId={}, sessionId={}, required={}, payload={}",
      ctx.getRequestId(), ctx.getSessionId(), ctx.getRequest().getRequiredCapabilities(),
      StringUtils.truncate(ctx.getRequest().getPayload(), 100));

    return Flux.usingWhen(
      stateMachineDriver.start(ctx.getRequestId()),
      sm -> select(ctx, sm),
      stateMachineDriver::stop,
      (sm, error) -> stateMachineDriver.stop(sm),
      sm -> {
        log.info("Dispatch cancelled: requestId={}, attempts={}", ctx.getRequestId(),
          ctx.getAttempts().size());
        return stateMachineDriver.sendEvent(sm, DispatchEvent.CANCEL)
          .then(stateMachineDriver.stop(sm));
      });
  }

  private Flux<DispatchUpdate> select(DispatchContext ctx,
    StateMachine<DispatchState, DispatchEvent> sm) {
    return stateMachineDriver.sendEvent(sm, DispatchEvent.START)
      .thenMany(Flux.defer(() -> {
        CandidateRanking candidates = resolveCandidates(ctx);
        if (candidates.isEmpty()) {
          return noCandidate(ctx, sm, "No registered agent can serve the request");
        }
        ctx.setCandidates(candidates);
        log.debug("Candidates resolved: requestId={}, candidates={}", ctx.getRequestId(),
          candidates);
        return stateMachineDriver.sendEvent(sm, DispatchEvent.CANDIDATES_READY)
          .thenMany(attempt(ctx, sm, 0));
      }));
  }

  /**
   * 钉住的 Agent 仍在注册表中、不是 UNREACHABLE 且满足必需能力时排在首位，否则按全新请求排序
   */
  private CandidateRanking resolveCandidates(DispatchContext ctx) {
    RegistrySnapshot snapshot = registry.snapshot();
    CandidateRanking ranking = matcher.rank(ctx.getRequest(), snapshot);

    String pinnedAgentId = ctx.getLease().pinnedAgentId();
    if (pinnedAgentId == null) {
      return ranking;
    }

    Optional<AgentDescriptor> pinned = snapshot.find(pinnedAgentId);
    boolean usable = pinned.isPresent()
      && pinned.get().getHealth().isDispatchable()
      && pinned.get().declaresAll(ctx.getRequest().normalizedRequiredCapabilities());
    if (!usable) {
      log.info("Pinned agent not usable, re-selecting: sessionId={}, agentId={}, health={}",
        ctx.getSessionId(), pinnedAgentId,
        pinned.map(AgentDescriptor::getHealth).orElse(null));
      return ranking;
    }

    RankedCandidate first = ranking.find(pinnedAgentId)
      .orElseGet(() -> RankedCandidate.of(pinnedAgentId))
      .toBuilder()
      .pinned(true)
      .build();
    return ranking.withFirst(first);
  }

  private Flux<DispatchUpdate> attempt(DispatchContext ctx,
    StateMachine<DispatchState, DispatchEvent> sm, int index) {
    return Flux.defer(() -> {
      if (index >= ctx.getCandidates().size()) {
        return exhausted(ctx, sm);
      }

      RankedCandidate candidate = ctx.getCandidates().candidates().get(index);
      Optional<AgentDescriptor> current = registry.find(candidate.getAgentId());
      if (current.isEmpty()) {
        log.info("Skipping deregistered candidate: requestId={}, agentId={}", ctx.getRequestId(),
          candidate.getAgentId());
        return attempt(ctx, sm, index + 1);
      }

      AgentDescriptor agent = current.get();
      int attemptNo = ctx.nextAttemptNumber();
      Instant startedAt = clock.instant();
      ResponseCollector collector = new ResponseCollector();
      AtomicReference<Throwable> failure = new AtomicReference<>();

      AgentInvocation invocation = AgentInvocation.builder()
        .requestId(ctx.getRequestId())
        .sessionId(ctx.getSessionId())
        .payload(ctx.getRequest().getPayload())
        .metadata(ctx.getRequest().getMetadata())
        .streaming(ctx.isStreaming())
        .attempt(attemptNo)
        .build();

      log.debug("Attempting agent: requestId={}, agentId={}, attempt={}, pinned={}",
        ctx.getRequestId(), agent.getId(), attemptNo, candidate.isPinned());

      Duration timeout = properties.getRouter().getAttemptTimeout();
      long deadline = System.nanoTime() + timeout.toNanos();

      Flux<DispatchUpdate> chunks = transport.send(agent, invocation)
        // 总时限覆盖整个流，而不是单个分片的间隔
        .timeout(Mono.delay(timeout), chunk -> Mono.delay(remaining(deadline)))
        .takeUntil(chunk -> chunk.isLast())
        .doOnNext(collector::accept)
        .filter(chunk -> ctx.isStreaming())
        .map(chunk -> DispatchUpdate.chunk(agent.getId(), attemptNo, chunk))
        .concatWith(Mono.fromRunnable(collector::requireCompletion))
        .onErrorResume(error -> {
          failure.set(error);
          return Mono.empty();
        });

      return chunks.concatWith(Flux.defer(() -> conclude(ctx, sm, index, agent, attemptNo,
        startedAt, collector, failure.get())));
    });
  }

  private Flux<DispatchUpdate> conclude(DispatchContext ctx,
    StateMachine<DispatchState, DispatchEvent> sm, int index, AgentDescriptor agent,
    int attemptNo, Instant startedAt, ResponseCollector collector, Throwable failure) {
    Instant now = clock.instant();
    long durationMs = Duration.between(startedAt, now).toMillis();

    if (failure == null) {
      ctx.recordAttempt(DispatchAttempt.builder()
        .agentId(agent.getId())
        .attempt(attemptNo)
        .outcome(AttemptOutcome.SUCCESS)
        .startedAt(startedAt)
        .durationMs(durationMs)
        .build());
      // 以尝试开始时间作为观察时间，避免慢成功覆盖期间观察到的故障
      registry.updateHealthIfPresent(agent.getId(), AgentHealth.HEALTHY, startedAt);
      ctx.getLease().pin(agent.getId());

      return stateMachineDriver.sendEvent(sm, DispatchEvent.ATTEMPT_SUCCEEDED)
        .then(Mono.fromCallable(() -> {
          DispatchResult result = DispatchResult.success(ctx, agent,
            collector.toResponse(), stateMachineDriver.getCurrentState(sm), clock.instant());
          ctx.getLease().append(result);
          log.info("Dispatch completed: requestId={}, sessionId={}, agentId={}, attempts={}, "
              + "state={}, durationMs={}", ctx.getRequestId(), ctx.getSessionId(),
            agent.getId(), result.getAttempts().size(), result.getResponse().getState(),
            result.durationMs());
          return DispatchUpdate.result(result);
        }))
        .flux();
    }

    AttemptOutcome outcome = classify(failure, agent.getId());
    ctx.recordAttempt(DispatchAttempt.builder()
      .agentId(agent.getId())
      .attempt(attemptNo)
      .outcome(outcome)
      .detail(describe(failure))
      .startedAt(startedAt)
      .durationMs(durationMs)
      .build());
    if (outcome.healthEffect() != null) {
      registry.updateHealthIfPresent(agent.getId(), outcome.healthEffect(), now);
    }
    log.warn("Attempt failed: requestId={}, agentId={}, attempt={}, outcome={}, detail={}",
      ctx.getRequestId(), agent.getId(), attemptNo, outcome, describe(failure));

    return stateMachineDriver.sendEvent(sm, DispatchEvent.ATTEMPT_FAILED)
      .thenMany(attempt(ctx, sm, index + 1));
  }

  private Flux<DispatchUpdate> exhausted(DispatchContext ctx,
    StateMachine<DispatchState, DispatchEvent> sm) {
    if (ctx.getAttempts().isEmpty()) {
      return noCandidate(ctx, sm, "Every candidate was deregistered before it could be tried");
    }
    return stateMachineDriver.sendEvent(sm, DispatchEvent.EXHAUSTED)
      .then(Mono.fromCallable(() -> {
        DispatchResult result = DispatchResult.failure(ctx, AllCandidatesFailedException.CODE,
          "All " + ctx.getAttempts().size() + " candidates failed",
          stateMachineDriver.getCurrentState(sm), clock.instant());
        ctx.getLease().append(result);
        log.warn("Dispatch failed: requestId={}, sessionId={}, candidates={}, attempts={}",
          ctx.getRequestId(), ctx.getSessionId(), ctx.getCandidates().agentIds(),
          result.getAttempts().size());
        return result;
      }))
      .flatMapMany(result -> Flux.error(new AllCandidatesFailedException(result)));
  }

  private Flux<DispatchUpdate> noCandidate(DispatchContext ctx,
    StateMachine<DispatchState, DispatchEvent> sm, String message) {
    return stateMachineDriver.sendEvent(sm, DispatchEvent.NO_CANDIDATES)
      .thenMany(Flux.defer(() -> {
        log.warn("No candidate: requestId={}, sessionId={}, required={}, reason={}",
          ctx.getRequestId(), ctx.getSessionId(), ctx.getRequest().getRequiredCapabilities(),
          message);
        return Flux.error(new NoCandidateException(ctx.getRequestId(), message));
      }));
  }

  private AttemptOutcome classify(Throwable failure, String agentId) {
    if (failure instanceof TimeoutException) {
      return AttemptOutcome.TIMEOUT;
    }
    if (failure instanceof AgentDeclinedException) {
      return AttemptOutcome.DECLINED;
    }
    if (failure instanceof AgentTransportException) {
      switch (((AgentTransportException) failure).getKind()) {
        case TIMEOUT:
          return AttemptOutcome.TIMEOUT;
        case UNREACHABLE:
          return AttemptOutcome.UNREACHABLE;
        default:
          return AttemptOutcome.PROTOCOL_ERROR;
      }
    }
    log.error("Unexpected transport failure: agentId={}", agentId, failure);
    return AttemptOutcome.PROTOCOL_ERROR;
  }

  private String describe(Throwable failure) {
    if (failure instanceof TimeoutException) {
      return "Attempt exceeded " + properties.getRouter().getAttemptTimeout();
    }
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
  }

  private Duration remaining(long deadlineNanos) {
    return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
  }
}
