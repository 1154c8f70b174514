package com.github.spud.sample.ai.dispatcher.domain.transport.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.dispatcher.application.config.DispatcherProperties;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentChunk;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentDeclinedException;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentInvocation;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTaskState;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransportException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP 传输测试：使用 MockWebServer 模拟 Agent 端点
 */
class HttpAgentTransportTest {

  private MockWebServer server;
  private HttpAgentTransport transport;
  private AgentDescriptor agent;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();

    DispatcherProperties properties = new DispatcherProperties();
    properties.getTransport().setConnectTimeout(Duration.ofSeconds(1));
    properties.getHealthCheck().setTimeout(Duration.ofSeconds(1));
    transport = new HttpAgentTransport(WebClient.builder(), properties);

    agent = AgentDescriptor.builder()
      .id("math")
      .capabilities(Set.of("math"))
      .endpointRef(server.url("/agents/math/").toString())
      .build();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void shouldSendTaskAndMapCompletedResponse() throws Exception {
    server.enqueue(json(200, """
      {
        "id": "req-1",
        "status": { "state": "completed" },
        "artifacts": [ { "parts": [ { "type": "text", "text": "4" } ] } ]
      }
      """));

    List<AgentChunk> chunks = transport.send(agent, invocation(false)).collectList().block();

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).isLast()).isTrue();
    assertThat(chunks.get(0).getText()).isEqualTo("4");
    assertThat(chunks.get(0).getState()).isEqualTo(AgentTaskState.COMPLETED);

    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getMethod()).isEqualTo("POST");
    assertThat(recorded.getPath()).isEqualTo("/agents/math/tasks/send");
    String body = recorded.getBody().readUtf8();
    assertThat(body).contains("\"id\":\"req-1\"", "\"sessionId\":\"s-1\"", "\"text\":\"2+2\"",
      "\"role\":\"user\"", "\"channel\":\"test\"");
  }

  @Test
  void shouldUseStatusMessageWhenAgentAsksForInput() {
    server.enqueue(json(200, """
      {
        "status": {
          "state": "input-required",
          "message": { "role": "agent", "parts": [ { "type": "text", "text": "Which base?" } ] }
        }
      }
      """));

    AgentChunk chunk = transport.send(agent, invocation(false)).blockLast();

    assertThat(chunk.getState()).isEqualTo(AgentTaskState.INPUT_REQUIRED);
    assertThat(chunk.getText()).isEqualTo("Which base?");
  }

  @Test
  void shouldMapFailedStateToAnswer() {
    server.enqueue(json(200, """
      { "status": { "state": "failed" }, "artifacts": [ { "parts": [ { "text": "bad input" } ] } ] }
      """));

    AgentChunk chunk = transport.send(agent, invocation(false)).blockLast();

    assertThat(chunk.getState()).isEqualTo(AgentTaskState.FAILED);
    assertThat(chunk.getText()).isEqualTo("bad input");
  }

  @Test
  void shouldMapRejectedStateToDecline() {
    server.enqueue(json(200, "{ \"status\": { \"state\": \"rejected\" } }"));

    assertThatThrownBy(() -> transport.send(agent, invocation(false)).blockLast())
      .isInstanceOf(AgentDeclinedException.class);
  }

  @Test
  void shouldMapConflictStatusToDecline() {
    server.enqueue(new MockResponse().setResponseCode(409).setBody("busy with something else"));

    assertThatThrownBy(() -> transport.send(agent, invocation(false)).blockLast())
      .isInstanceOf(AgentDeclinedException.class)
      .hasMessageContaining("409");
  }

  @Test
  void shouldMapServiceUnavailableToUnreachable() {
    server.enqueue(new MockResponse().setResponseCode(503));

    assertKind(AgentTransportException.Kind.UNREACHABLE);
  }

  @Test
  void shouldMapGatewayTimeoutToTimeout() {
    server.enqueue(new MockResponse().setResponseCode(504));

    assertKind(AgentTransportException.Kind.TIMEOUT);
  }

  @Test
  void shouldMapOtherServerErrorsToProtocol() {
    server.enqueue(new MockResponse().setResponseCode(500));

    assertKind(AgentTransportException.Kind.PROTOCOL);
  }

  @Test
  void shouldMapMalformedBodyToProtocol() {
    server.enqueue(json(200, "{ not json"));

    assertKind(AgentTransportException.Kind.PROTOCOL);
  }

  @Test
  void shouldRejectNonTerminalStateWithoutStreaming() {
    server.enqueue(json(200, "{ \"status\": { \"state\": \"working\" } }"));

    assertKind(AgentTransportException.Kind.PROTOCOL);
  }

  @Test
  void shouldMapConnectionFailureToUnreachable() throws IOException {
    MockWebServer stopped = new MockWebServer();
    stopped.start();
    String endpoint = stopped.url("/").toString();
    stopped.shutdown();
    AgentDescriptor offline = agent.toBuilder().endpointRef(endpoint).build();

    assertThatThrownBy(() -> transport.send(offline, invocation(false)).blockLast())
      .isInstanceOfSatisfying(AgentTransportException.class,
        e -> assertThat(e.getKind()).isEqualTo(AgentTransportException.Kind.UNREACHABLE));
  }

  @Test
  void shouldStreamServerSentEventsUntilFinalEvent() throws Exception {
    server.enqueue(new MockResponse()
      .setHeader("Content-Type", "text/event-stream")
      .setBody("data:{\"status\":{\"state\":\"working\"},"
        + "\"artifacts\":[{\"parts\":[{\"type\":\"text\",\"text\":\"forty\"}]}]}\n\n"
        + "data:{\"status\":{\"state\":\"working\"},"
        + "\"artifacts\":[{\"parts\":[{\"type\":\"text\",\"text\":\"-\"}]}]}\n\n"
        + "data:{\"status\":{\"state\":\"completed\"},\"final\":true,"
        + "\"artifacts\":[{\"parts\":[{\"type\":\"text\",\"text\":\"two\"}]}]}\n\n"));

    List<AgentChunk> chunks = transport.send(agent, invocation(true)).collectList().block();

    assertThat(chunks).extracting(AgentChunk::getText).containsExactly("forty", "-", "two");
    assertThat(chunks).extracting(AgentChunk::isLast).containsExactly(false, false, true);
    assertThat(server.takeRequest().getPath()).isEqualTo("/agents/math/tasks/sendSubscribe");
  }

  @Test
  void shouldProbeAgentCard() throws Exception {
    server.enqueue(json(200, "{ \"name\": \"Math Agent\" }"));

    assertThat(transport.probe(agent).block()).isEqualTo(AgentHealth.HEALTHY);
    assertThat(server.takeRequest().getPath()).isEqualTo("/agents/math/.well-known/agent.json");
  }

  @Test
  void shouldMapProbeFailures() {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThat(transport.probe(agent).block()).isEqualTo(AgentHealth.UNREACHABLE);
    assertThat(transport.probe(agent).block()).isEqualTo(AgentHealth.DEGRADED);
    assertThat(transport.probe(agent.toBuilder().endpointRef(null).build()).block())
      .isEqualTo(AgentHealth.UNREACHABLE);
  }

  private void assertKind(AgentTransportException.Kind kind) {
    assertThatThrownBy(() -> transport.send(agent, invocation(false)).blockLast())
      .isInstanceOfSatisfying(AgentTransportException.class,
        e -> assertThat(e.getKind()).isEqualTo(kind));
  }

  private AgentInvocation invocation(boolean streaming) {
    return AgentInvocation.builder()
      .requestId("req-1")
      .sessionId("s-1")
      .payload("2+2")
      .metadata(Map.of("channel", "test"))
      .streaming(streaming)
      .attempt(1)
      .build();
  }

  private MockResponse json(int status, String body) {
    return new MockResponse()
      .setResponseCode(status)
      .setHeader("Content-Type", "application/json")
      .setBody(body);
  }
}
