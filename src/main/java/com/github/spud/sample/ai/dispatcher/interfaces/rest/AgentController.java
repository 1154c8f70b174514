package com.github.spud.sample.ai.dispatcher.interfaces.rest;

import com.github.spud.sample.ai.dispatcher.domain.registry.AgentCard;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentDescriptor;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentHealth;
import com.github.spud.sample.ai.dispatcher.domain.registry.AgentRegistry;
import com.github.spud.sample.ai.dispatcher.domain.registry.UnknownAgentException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Agent 注册管理 API
 */
@Slf4j
@RestController
@RequestMapping("/dispatch/agents")
@RequiredArgsConstructor
public class AgentController {

  private final AgentRegistry registry;

  /**
   * 注册 Agent
   */
  @PostMapping
  public Mono<ResponseEntity<AgentDescriptor>> register(
    @Valid @RequestBody RegisterAgentRequest request
  ) {
    return Mono.fromCallable(() -> {
      AgentDescriptor registered = registry.register(AgentDescriptor.builder()
        .id(request.getId())
        .name(request.getName())
        .description(request.getDescription())
        .endpointRef(request.getEndpoint())
        .capabilities(request.getCapabilities())
        .card(request.getCard())
        .build());
      return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    });
  }

  @GetMapping
  public Mono<List<AgentDescriptor>> list() {
    return Mono.fromCallable(registry::list);
  }

  @GetMapping("/{agentId}")
  public Mono<AgentDescriptor> get(@PathVariable String agentId) {
    return Mono.fromCallable(() -> registry.find(agentId)
      .orElseThrow(() -> new UnknownAgentException(agentId)));
  }

  /**
   * 注销 Agent；进行中的派发不受影响
   */
  @DeleteMapping("/{agentId}")
  public Mono<ResponseEntity<Void>> deregister(@PathVariable String agentId) {
    return Mono.fromCallable(() -> {
      registry.deregister(agentId);
      return ResponseEntity.noContent().build();
    });
  }

  /**
   * 外部健康检查回写
   */
  @PutMapping("/{agentId}/health")
  public Mono<AgentDescriptor> updateHealth(
    @PathVariable String agentId,
    @Valid @RequestBody UpdateHealthRequest request
  ) {
    return Mono.fromCallable(() -> {
      log.info("External health update: agentId={}, health={}", agentId, request.getHealth());
      return registry.updateHealth(agentId, request.getHealth());
    });
  }

  // ===== DTOs =====

  @Data
  public static class RegisterAgentRequest {

    @NotBlank
    private String id;
    private String name;
    private String description;
    private String endpoint;
    private Set<String> capabilities = new LinkedHashSet<>();
    private AgentCard card;
  }

  @Data
  public static class UpdateHealthRequest {

    @NotNull
    private AgentHealth health;
  }
}
