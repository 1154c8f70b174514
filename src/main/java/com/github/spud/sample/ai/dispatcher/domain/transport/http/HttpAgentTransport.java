package com.github.spud.sample.ai.dispatcher.domain.transport.http;

import com.github.spud.sample.ai.dispatcher.application.config.DispatcherProperties;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentChunk;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentDeclinedException;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentInvocation;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTaskState;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransport;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransportException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * 基于 HTTP/JSON 的 Agent 传输
 * <pre>
 *   POST {endpoint}/tasks/send             单次响应
 *   POST {endpoint}/tasks/sendSubscribe    SSE 流式响应
 *   GET  {endpoint}/.well-known/agent.json 健康探测
 * </pre>
 * 错误映射：连接失败、502/503 为 UNREACHABLE；读超时、504 为 TIMEOUT；409/422 为拒绝；其余非 2xx 与无法解析的响应为 PROTOCOL
 */
@Slf4j
@Component
public class HttpAgentTransport implements AgentTransport {

  static final String SEND_PATH = "/tasks/send";
  static final String SUBSCRIBE_PATH = "/tasks/sendSubscribe";
  static final String AGENT_CARD_PATH = "/.well-known/agent.json";

  private static final ParameterizedTypeReference<ServerSentEvent<A2aTaskResponse>> EVENT_TYPE =
    new ParameterizedTypeReference<>() {
    };

  private final WebClient webClient;
  private final DispatcherProperties properties;

  public HttpAgentTransport(WebClient.Builder webClientBuilder, DispatcherProperties properties) {
    this.properties = properties;
    DispatcherProperties.Transport config = properties.getTransport();
    HttpClient httpClient = HttpClient.create()
      .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis());
    this.webClient = webClientBuilder
      .clientConnector(new ReactorClientHttpConnector(httpClient))
      .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(config.getMaxInMemorySize()))
      .build();

    log.info("HttpAgentTransport initialized: connectTimeout={}, maxInMemorySize={}",
      config.getConnectTimeout(), config.getMaxInMemorySize());
  }

  @Override
  public Flux<AgentChunk> send(AgentDescriptor agent, AgentInvocation invocation) {
    String baseUrl = baseUrl(agent);
    if (baseUrl == null) {
      return Flux.error(AgentTransportException.unreachable(
        "Agent has no endpoint: " + agent.getId(), null));
    }

    A2aTaskRequest body = A2aTaskRequest.userText(invocation.getRequestId(),
      invocation.getSessionId(), invocation.getPayload(), invocation.getMetadata());

    Flux<AgentChunk> chunks;
    if (invocation.isStreaming()) {
      chunks = webClient.post()
        .uri(baseUrl + SUBSCRIBE_PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(body)
        .retrieve()
        .bodyToFlux(EVENT_TYPE)
        .filter(event -> event.data() != null)
        .map(event -> toChunk(agent, event.data(), true))
        .takeUntil(AgentChunk::isLast);
    } else {
      chunks = webClient.post()
        .uri(baseUrl + SEND_PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(A2aTaskResponse.class)
        .switchIfEmpty(Mono.error(() -> AgentTransportException.protocol(
          "Empty response body from agent " + agent.getId())))
        .map(response -> toChunk(agent, response, false))
        .flux();
    }

    return chunks
      .doOnSubscribe(s -> log.debug("Sending task: agentId={}, requestId={}, attempt={}, "
          + "streaming={}", agent.getId(), invocation.getRequestId(), invocation.getAttempt(),
        invocation.isStreaming()))
      .onErrorMap(error -> translate(agent, error));
  }

  @Override
  public Mono<AgentHealth> probe(AgentDescriptor agent) {
    String baseUrl = baseUrl(agent);
    if (baseUrl == null) {
      return Mono.just(AgentHealth.UNREACHABLE);
    }
    return webClient.get()
      .uri(baseUrl + AGENT_CARD_PATH)
      .retrieve()
      .toBodilessEntity()
      .map(entity -> AgentHealth.HEALTHY)
      .timeout(properties.getHealthCheck().getTimeout())
      .onErrorResume(error -> {
        AgentHealth health = probeFailure(error);
        log.debug("Probe failed: agentId={}, health={}, error={}", agent.getId(), health,
          error.toString());
        return Mono.just(health);
      });
  }

  /**
   * 把一个响应（或 SSE 事件）转换为分片；非流式时必须是终态
   */
  private AgentChunk toChunk(AgentDescriptor agent, A2aTaskResponse response, boolean streaming) {
    String state = response.state();
    if (state == null) {
      throw AgentTransportException.protocol("Agent " + agent.getId() + " returned no task state");
    }
    switch (state) {
      case "completed":
        return AgentChunk.complete(response.text(), AgentTaskState.COMPLETED);
      case "input-required":
        return AgentChunk.complete(response.text(), AgentTaskState.INPUT_REQUIRED);
      case "failed":
        return AgentChunk.complete(response.text(), AgentTaskState.FAILED);
      case "rejected":
      case "declined":
      case "canceled":
        throw new AgentDeclinedException(
          "Agent " + agent.getId() + " declined the task: " + response.text());
      case "submitted":
      case "working":
        if (!streaming) {
          throw AgentTransportException.protocol(
            "Agent " + agent.getId() + " returned non-terminal state: " + state);
        }
        if (response.isLast()) {
          throw AgentTransportException.protocol(
            "Agent " + agent.getId() + " ended the stream in non-terminal state: " + state);
        }
        return AgentChunk.partial(response.text());
      default:
        throw AgentTransportException.protocol(
          "Agent " + agent.getId() + " returned unknown task state: " + state);
    }
  }

  private Throwable translate(AgentDescriptor agent, Throwable error) {
    if (error instanceof AgentTransportException || error instanceof AgentDeclinedException) {
      return error;
    }
    if (error instanceof WebClientResponseException) {
      WebClientResponseException e = (WebClientResponseException) error;
      int status = e.getStatusCode().value();
      String message = "Agent " + agent.getId() + " answered HTTP " + status;
      if (status == 502 || status == 503) {
        return AgentTransportException.unreachable(message, e);
      }
      if (status == 504) {
        return AgentTransportException.timeout(message, e);
      }
      if (status == 409 || status == 422) {
        return new AgentDeclinedException(message + ": " + e.getResponseBodyAsString());
      }
      return AgentTransportException.protocol(message, e);
    }
    if (error instanceof WebClientRequestException) {
      if (isTimeout(error)) {
        return AgentTransportException.timeout("Agent " + agent.getId() + " timed out", error);
      }
      return AgentTransportException.unreachable(
        "Agent " + agent.getId() + " unreachable: " + error.getMessage(), error);
    }
    if (isTimeout(error)) {
      return AgentTransportException.timeout("Agent " + agent.getId() + " timed out", error);
    }
    if (error instanceof CodecException) {
      return AgentTransportException.protocol(
        "Malformed response from agent " + agent.getId() + ": " + error.getMessage(), error);
    }
    return AgentTransportException.protocol(
      "Transport failure for agent " + agent.getId() + ": " + error.getMessage(), error);
  }

  private AgentHealth probeFailure(Throwable error) {
    if (error instanceof WebClientResponseException) {
      int status = ((WebClientResponseException) error).getStatusCode().value();
      return status == 502 || status == 503 ? AgentHealth.UNREACHABLE : AgentHealth.DEGRADED;
    }
    if (isTimeout(error)) {
      return AgentHealth.DEGRADED;
    }
    return AgentHealth.UNREACHABLE;
  }

  private boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof ReadTimeoutException || t instanceof TimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  private String baseUrl(AgentDescriptor agent) {
    String endpoint = agent.getEndpointRef();
    if (endpoint == null || endpoint.isBlank()) {
      return null;
    }
    return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
  }
}
