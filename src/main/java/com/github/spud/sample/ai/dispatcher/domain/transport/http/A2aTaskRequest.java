package com.github.spud.sample.ai.dispatcher.domain.transport.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * tasks/send 与 tasks/sendSubscribe 的请求体
 * <pre>
 * { "id": "...", "sessionId": "...",
 *   "message": { "role": "user", "content": { "type": "text", "text": "..." } },
 *   "metadata": { ... } }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class A2aTaskRequest {

  private String id;

  private String sessionId;

  private Message message;

  private Map<String, Object> metadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Message {

    private String role;

    private Part content;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Part {

    private String type;

    private String text;
  }

  public static A2aTaskRequest userText(String id, String sessionId, String text,
    Map<String, Object> metadata) {
    return A2aTaskRequest.builder()
      .id(id)
      .sessionId(sessionId)
      .message(Message.builder()
        .role("user")
        .content(Part.builder().type("text").text(text).build())
        .build())
      .metadata(metadata == null || metadata.isEmpty() ? null : metadata)
      .build();
  }
}
