package com.github.spud.sample.ai.dispatcher;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.dispatcher.domain.dispatch.DispatchRouter;
import com.github.spud.sample.ai.dispatcher.domain.health.AgentHealthChecker;
import com.github.spud.sample.ai.dispatcher.domain.transport.AgentTransport;
import com.github.spud.sample.ai.dispatcher.domain.transport.http.HttpAgentTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * 集成测试 - 完整 Spring 上下文，test profile 下不配置任何 Agent
 */
@SpringBootTest
@ActiveProfiles("test")
class DispatcherApplicationTests {

  @Autowired
  private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(DispatchRouter.class)).isNotNull();
    assertThat(context.getBean(AgentTransport.class)).isInstanceOf(HttpAgentTransport.class);
    // 健康探测默认关闭
    assertThat(context.getBeanNamesForType(AgentHealthChecker.class)).isEmpty();
  }
}
