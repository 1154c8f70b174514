package com.github.spud.sample.ai.dispatcher.application.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentRegistry;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class AgentBootstrapLoaderTest {

  @Test
  void shouldRegisterConfiguredAgentsAndSkipInvalidOnes() {
    DispatcherProperties properties = new DispatcherProperties();
    properties.getAgents().add(definition("math", "http://localhost:9001", "math"));
    properties.getAgents().add(definition("math", "http://localhost:9002", "math"));
    properties.getAgents().add(definition(null, "http://localhost:9003", "code"));
    properties.getAgents().add(definition("code", "http://localhost:9004", "Code", "python"));
    AgentRegistry registry = new AgentRegistry(Clock.systemUTC());

    new AgentBootstrapLoader(properties, registry).run(new DefaultApplicationArguments());

    assertThat(registry.list()).extracting(AgentDescriptor::getId).containsExactly("math", "code");
    AgentDescriptor code = registry.find("code").orElseThrow();
    assertThat(code.getEndpointRef()).isEqualTo("http://localhost:9004");
    assertThat(code.getCapabilities()).containsExactly("code", "python");
    assertThat(code.getHealth()).isEqualTo(AgentHealth.UNKNOWN);
    assertThat(registry.find("math").orElseThrow().getEndpointRef())
      .isEqualTo("http://localhost:9001");
  }

  private DispatcherProperties.AgentDefinition definition(String id, String endpoint,
    String... capabilities) {
    DispatcherProperties.AgentDefinition definition = new DispatcherProperties.AgentDefinition();
    definition.setId(id);
    definition.setEndpoint(endpoint);
    definition.setCapabilities(new LinkedHashSet<>(List.of(capabilities)));
    return definition;
  }
}
