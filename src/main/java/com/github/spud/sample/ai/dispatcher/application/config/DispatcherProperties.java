package com.github.spud.sample.ai.dispatcher.application.config;

import com.github.spud.sample.ai.dispatcher.domain.matcher.UnreachablePolicy;
import com.github.spud.sample.ai.dispatcher.domain.session.ConcurrentTurnPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 派发器配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

  private Router router = new Router();

  private Matcher matcher = new Matcher();

  private Session session = new Session();

  private HealthCheck healthCheck = new HealthCheck();

  private Transport transport = new Transport();

  /**
   * 启动时静态注册的 Agent
   */
  private List<AgentDefinition> agents = new ArrayList<>();

  @Data
  public static class Router {

    /**
     * 单次尝试的总时限（流式响应包含所有分片）
     */
    private Duration attemptTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Matcher {

    /**
     * UNREACHABLE Agent 的参与方式
     */
    private UnreachablePolicy unreachablePolicy = UnreachablePolicy.LAST_RESORT;

    /**
     * 低于该置信度的候选被丢弃，0 表示关闭
     */
    private double minConfidence = 0.0;
  }

  @Data
  public static class Session {

    /**
     * 空闲超过该时长的会话可被清理
     */
    private Duration idleTimeout = Duration.ofMinutes(30);

    /**
     * 清理任务执行间隔（毫秒）
     */
    private long evictionIntervalMs = 60_000;

    /**
     * 同一会话并发轮次的处理策略
     */
    private ConcurrentTurnPolicy concurrentTurnPolicy = ConcurrentTurnPolicy.REJECT;

    /**
     * QUEUE 策略下的最长等待时间
     */
    private Duration queueTimeout = Duration.ofSeconds(10);
  }

  @Data
  public static class HealthCheck {

    private boolean enabled = false;

    /**
     * 探测间隔（毫秒）
     */
    private long intervalMs = 30_000;

    /**
     * 单个 Agent 探测超时
     */
    private Duration timeout = Duration.ofSeconds(5);
  }

  @Data
  public static class Transport {

    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * 单个响应体的最大缓冲字节数
     */
    private int maxInMemorySize = 4 * 1024 * 1024;
  }

  @Data
  public static class AgentDefinition {

    private String id;

    private String name;

    private String description;

    private String endpoint;

    private Set<String> capabilities = new LinkedHashSet<>();
  }
}
