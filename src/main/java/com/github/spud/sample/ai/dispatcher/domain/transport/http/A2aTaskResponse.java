package com.github.spud.sample.ai.dispatcher.domain.transport.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 的任务响应；流式时每个事件一条，最后一条带 {@code "final": true}
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class A2aTaskResponse {

  private String id;

  private Status status;

  private List<Artifact> artifacts;

  @JsonProperty("final")
  private boolean last;

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Status {

    /**
     * submitted | working | completed | input-required | failed | rejected | canceled
     */
    private String state;

    private Message message;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Message {

    private String role;

    private Part content;

    private List<Part> parts;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Artifact {

    private String name;

    private List<Part> parts;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Part {

    private String type;

    private String text;
  }

  /**
   * 拼接文本：优先取 artifacts，其次取状态消息（例如 input-required 的追问）
   */
  public String text() {
    StringBuilder sb = new StringBuilder();
    if (artifacts != null) {
      for (Artifact artifact : artifacts) {
        appendParts(sb, artifact.getParts());
      }
    }
    if (sb.length() == 0 && status != null && status.getMessage() != null) {
      Message message = status.getMessage();
      if (message.getContent() != null) {
        appendPart(sb, message.getContent());
      }
      appendParts(sb, message.getParts());
    }
    return sb.toString();
  }

  public String state() {
    return status != null ? status.getState() : null;
  }

  private static void appendParts(StringBuilder sb, List<Part> parts) {
    if (parts == null) {
      return;
    }
    for (Part part : parts) {
      appendPart(sb, part);
    }
  }

  private static void appendPart(StringBuilder sb, Part part) {
    if (part.getText() != null && (part.getType() == null || "text".equals(part.getType()))) {
      sb.append(part.getText());
    }
  }
}
