package com.github.spud.sample.ai.dispatcher.application.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatcherConfig {

  /**
   * 健康状态时间戳与会话空闲判断使用的时钟，测试中可替换
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
