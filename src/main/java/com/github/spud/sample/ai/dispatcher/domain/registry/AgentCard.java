package com.github.spud.sample.ai.dispatcher.domain.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 注册时提交的展示卡片，派发成功后随结果返回给调用方
 * <pre>
 * {"header": {"title": ..., "subtitle": ...},
 *  "sections": [{"header": ..., "items": [{"title": ...}]}]}
 * </pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentCard {

  private Header header;

  @Builder.Default
  private List<Section> sections = Collections.emptyList();

  /**
   * 缺省标题为 Agent 名称，缺省副标题为描述
   */
  public static AgentCard defaultFor(String title, String subtitle) {
    return AgentCard.builder()
      .header(Header.builder().title(title).subtitle(subtitle).build())
      .build();
  }

  /**
   * 补全缺失的标题/副标题，sections 为空时置为空列表
   */
  public AgentCard withDefaults(String title, String subtitle) {
    Header current = header != null ? header : Header.builder().build();
    return toBuilder()
      .header(current.toBuilder()
        .title(current.getTitle() != null ? current.getTitle() : title)
        .subtitle(current.getSubtitle() != null ? current.getSubtitle() : subtitle)
        .build())
      .sections(sections != null ? List.copyOf(sections) : Collections.emptyList())
      .build();
  }

  @Data
  @Builder(toBuilder = true)
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Header {

    private String title;

    private String subtitle;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Section {

    private String header;

    @Builder.Default
    private List<Item> items = Collections.emptyList();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Item {

    private String title;
  }
}
