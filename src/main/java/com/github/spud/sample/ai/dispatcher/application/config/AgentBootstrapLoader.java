package com.github.spud.sample.ai.dispatcher.application.config;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentRegistry;
import com.github.spud.sample.ai.dispatcher.domain.registry.DuplicateAgentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时注册 dispatcher.agents 中静态配置的 Agent
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentBootstrapLoader implements ApplicationRunner {

  private final DispatcherProperties properties;
  private final AgentRegistry registry;

  @Override
  public void run(ApplicationArguments args) {
    int registered = 0;
    for (DispatcherProperties.AgentDefinition definition : properties.getAgents()) {
      try {
        registry.register(AgentDescriptor.builder()
          .id(definition.getId())
          .name(definition.getName())
          .description(definition.getDescription())
          .endpointRef(definition.getEndpoint())
          .capabilities(definition.getCapabilities())
          .build());
        registered++;
      } catch (DuplicateAgentException | IllegalArgumentException e) {
        log.warn("Skipping static agent definition: id={}, reason={}", definition.getId(),
          e.getMessage());
      }
    }
    log.info("Bootstrapped {} of {} configured agents", registered, properties.getAgents().size());
  }
}
