package com.github.spud.sample.ai.dispatcher.domain.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.dispatcher.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentRegistryTest {

  private MutableClock clock;
  private AgentRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    registry = new AgentRegistry(clock);
  }

  @Test
  void shouldRegisterWithUnknownHealthAndNormalizedCapabilities() {
    AgentDescriptor registered = registry.register(AgentDescriptor.builder()
      .id("math")
      .capabilities(Set.of(" Math ", "ALGEBRA"))
      .health(AgentHealth.HEALTHY)
      .endpointRef("http://localhost:9001")
      .build());

    assertThat(registered.getHealth()).isEqualTo(AgentHealth.UNKNOWN);
    assertThat(registered.getCapabilities()).containsExactlyInAnyOrder("math", "algebra");
    assertThat(registered.getName()).isEqualTo("math");
    assertThat(registered.getRegistrationOrder()).isEqualTo(1);
    assertThat(registered.getRegisteredAt()).isEqualTo(clock.instant());
    assertThat(registry.find("math")).contains(registered);
  }

  @Test
  void shouldFillCardDefaultsFromNameAndDescription() {
    AgentDescriptor bare = registry.register(AgentDescriptor.builder()
      .id("math")
      .description("Solves arithmetic")
      .build());

    assertThat(bare.getCard().getHeader().getTitle()).isEqualTo("math");
    assertThat(bare.getCard().getHeader().getSubtitle()).isEqualTo("Solves arithmetic");
    assertThat(bare.getCard().getSections()).isEmpty();

    AgentCard card = AgentCard.builder()
      .header(AgentCard.Header.builder().title("Calculator").build())
      .sections(List.of(AgentCard.Section.builder()
        .header("Skills")
        .items(List.of(AgentCard.Item.builder().title("Addition").build()))
        .build()))
      .build();
    AgentDescriptor carded = registry.register(AgentDescriptor.builder()
      .id("calc")
      .name("Calc Agent")
      .description("Adds numbers")
      .card(card)
      .build());

    assertThat(carded.getCard().getHeader().getTitle()).isEqualTo("Calculator");
    assertThat(carded.getCard().getHeader().getSubtitle()).isEqualTo("Adds numbers");
    assertThat(carded.getCard().getSections()).extracting(AgentCard.Section::getHeader)
      .containsExactly("Skills");
  }

  @Test
  void shouldRejectDuplicateId() {
    registry.register(agent("a"));

    assertThatThrownBy(() -> registry.register(agent("a")))
      .isInstanceOf(DuplicateAgentException.class)
      .hasMessageContaining("a");
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void shouldRejectBlankId() {
    assertThatThrownBy(() -> registry.register(agent(" ")))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldFailOnUnknownAgent() {
    assertThatThrownBy(() -> registry.deregister("ghost"))
      .isInstanceOf(UnknownAgentException.class);
    assertThatThrownBy(() -> registry.updateHealth("ghost", AgentHealth.HEALTHY))
      .isInstanceOf(UnknownAgentException.class);
    assertThat(registry.updateHealthIfPresent("ghost", AgentHealth.HEALTHY, clock.instant()))
      .isFalse();
  }

  @Test
  void shouldListInRegistrationOrder() {
    registry.register(agent("c"));
    registry.register(agent("a"));
    registry.register(agent("b"));
    registry.deregister("a");
    registry.register(agent("a"));

    assertThat(registry.list()).extracting(AgentDescriptor::getId)
      .containsExactly("c", "b", "a");
  }

  @Test
  void shouldIgnoreStaleHealthUpdate() {
    registry.register(agent("a"));
    Instant early = clock.instant();
    clock.advance(Duration.ofSeconds(5));
    registry.updateHealth("a", AgentHealth.UNREACHABLE);

    boolean applied = registry.updateHealthIfPresent("a", AgentHealth.HEALTHY, early);

    assertThat(applied).isFalse();
    assertThat(registry.find("a").orElseThrow().getHealth()).isEqualTo(AgentHealth.UNREACHABLE);
  }

  @Test
  void shouldApplyNewerHealthUpdate() {
    registry.register(agent("a"));
    clock.advance(Duration.ofSeconds(1));

    AgentDescriptor updated = registry.updateHealth("a", AgentHealth.DEGRADED);

    assertThat(updated.getHealth()).isEqualTo(AgentHealth.DEGRADED);
    assertThat(updated.getHealthUpdatedAt()).isEqualTo(clock.instant());
  }

  @Test
  void snapshotShouldNotObserveLaterChanges() {
    registry.register(agent("a"));
    RegistrySnapshot snapshot = registry.snapshot();

    registry.register(agent("b"));
    registry.updateHealth("a", AgentHealth.UNREACHABLE);
    registry.deregister("a");

    assertThat(snapshot.size()).isEqualTo(1);
    assertThat(snapshot.find("a").orElseThrow().getHealth()).isEqualTo(AgentHealth.UNKNOWN);
    assertThat(snapshot.contains("b")).isFalse();
  }

  @Test
  void concurrentRegistrationsShouldAllLand() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        String id = "agent-" + i;
        futures.add(CompletableFuture.runAsync(() -> {
          registry.register(agent(id));
          registry.snapshot().agents();
        }, executor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertThat(registry.size()).isEqualTo(200);
    assertThat(registry.list()).extracting(AgentDescriptor::getRegistrationOrder)
      .doesNotHaveDuplicates()
      .isSorted();
  }

  private AgentDescriptor agent(String id) {
    return AgentDescriptor.builder()
      .id(id)
      .capabilities(Set.of("math"))
      .build();
  }
}
