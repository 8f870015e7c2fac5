/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package fr.aneo.seisflow.gc;

import fr.aneo.seisflow.domain.ConsumerInfo;
import fr.aneo.seisflow.domain.broker.ConsumerRegistry;
import fr.aneo.seisflow.domain.broker.InMemoryBroker;
import fr.aneo.seisflow.domain.exception.BrokerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GarbageCollectorTest {

  private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  private Clock clock;
  private InMemoryBroker broker;

  @BeforeEach
  void setUp() {
    clock = mock(Clock.class);
    broker = new InMemoryBroker("jobs", clock);
    broker.createGroup("fetch");

    // A last read at START, B 40 minutes later; collection runs at START + 45m
    register("A", START);
    register("B", START.plus(Duration.ofMinutes(40)));
    when(clock.instant()).thenReturn(START.plus(Duration.ofMinutes(45)));
  }

  @Test
  @DisplayName("Should remove only consumers idle longer than the threshold")
  void should_remove_idle_consumers() {
    // given
    var collector = new GarbageCollector(broker, new GarbageCollectorConfig("jobs", "fetch", Duration.ofMinutes(30), false));

    // when
    var report = collector.collect();

    // then
    assertThat(report.removed()).containsExactly("A");
    assertThat(report.retained()).containsExactly("B");
    assertThat(broker.consumers("jobs", "fetch")).extracting(ConsumerInfo::name).containsExactly("B");
  }

  @Test
  @DisplayName("Should remove nothing on a second run")
  void should_be_noop_when_run_twice() {
    // given
    var collector = new GarbageCollector(broker, new GarbageCollectorConfig("jobs", "fetch", Duration.ofMinutes(30), false));
    collector.collect();

    // when
    var report = collector.collect();

    // then
    assertThat(report.removed()).isEmpty();
    assertThat(report.retained()).containsExactly("B");
  }

  @Test
  @DisplayName("Should only report idle consumers on a dry run")
  void should_not_remove_on_dry_run() {
    // given
    var collector = new GarbageCollector(broker, new GarbageCollectorConfig("jobs", "fetch", Duration.ofMinutes(30), true));

    // when
    var report = collector.collect();

    // then
    assertThat(report.idle()).containsExactly("A");
    assertThat(report.removed()).isEmpty();
    assertThat(broker.consumers("jobs", "fetch")).extracting(ConsumerInfo::name).containsExactlyInAnyOrder("A", "B");
  }

  @Test
  @DisplayName("Should fail the run when a removal fails")
  void should_fail_on_removal_error() {
    // given
    var registry = mock(ConsumerRegistry.class);
    when(registry.consumers("jobs", "fetch")).thenReturn(List.of(
      new ConsumerInfo("A", 0, Duration.ofMinutes(45)),
      new ConsumerInfo("C", 0, Duration.ofMinutes(50))));
    doThrow(new BrokerException("connection reset")).when(registry).remove("jobs", "fetch", "A");
    var collector = new GarbageCollector(registry, GarbageCollectorConfig.defaults());

    // when / then
    assertThatThrownBy(collector::collect)
      .isInstanceOf(BrokerException.class)
      .hasMessage("connection reset");
    verify(registry, never()).remove(eq("jobs"), eq("fetch"), eq("C"));
  }

  @Test
  @DisplayName("Should fail the run when the group does not exist")
  void should_fail_on_unknown_group() {
    // given
    var collector = new GarbageCollector(broker, new GarbageCollectorConfig("jobs", "other", null, false));

    // when / then
    assertThatThrownBy(collector::collect).isInstanceOf(BrokerException.class);
  }

  @Test
  @DisplayName("Should keep consumers idle exactly for the threshold")
  void should_keep_consumer_at_threshold() {
    // given
    var registry = mock(ConsumerRegistry.class);
    when(registry.consumers("jobs", "fetch")).thenReturn(List.of(new ConsumerInfo("A", 0, Duration.ofMinutes(30))));
    var collector = new GarbageCollector(registry, GarbageCollectorConfig.defaults());

    // when
    var report = collector.collect();

    // then
    assertThat(report.retained()).containsExactly("A");
    verify(registry, never()).remove(anyString(), anyString(), anyString());
  }

  private void register(String consumer, Instant at) {
    when(clock.instant()).thenReturn(at);
    try (var subscription = broker.subscribe("fetch", consumer)) {
      subscription.read(Duration.ZERO);
    }
  }
}
