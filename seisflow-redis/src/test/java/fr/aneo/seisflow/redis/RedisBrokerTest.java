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

package fr.aneo.seisflow.redis;

import fr.aneo.seisflow.domain.ConsumerInfo;
import fr.aneo.seisflow.domain.PartLabel;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.exception.BrokerException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.codec.ByteArrayCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

@Testcontainers(disabledWithoutDocker = true)
class RedisBrokerTest {

  @Container
  private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
    .withExposedPorts(6379);

  private RedisBroker broker;
  private String stream;

  @BeforeEach
  void setUp() {
    stream = "jobs-" + UUID.randomUUID();
    broker = RedisBroker.connect(RedisConfig.forAddress(REDIS.getHost() + ":" + REDIS.getMappedPort(6379)), stream);
  }

  @AfterEach
  void tearDown() {
    broker.close();
  }

  @Test
  @DisplayName("Should deliver a published task to one consumer of the group and delete it on request")
  void should_publish_read_and_delete_tasks() {
    // given
    broker.createGroup("fetch");
    broker.createGroup("fetch");
    var pid = ProcessId.random();
    broker.publish(TaskMessage.unpublished(pid, new PartLabel(0, 1), new byte[]{1, 2, 3}));

    // when
    List<TaskMessage> read;
    List<TaskMessage> again;
    try (var consumer = broker.subscribe("fetch", "consumer-1")) {
      read = consumer.read(Duration.ofSeconds(1));
      broker.delete(read.stream().map(TaskMessage::id).toList());
      again = consumer.read(Duration.ofMillis(100));
    }

    // then
    assertThat(read).singleElement().satisfies(message -> {
      assertThat(message.pid()).isEqualTo(pid);
      assertThat(message.task()).containsExactly(1, 2, 3);
    });
    assertThat(again).isEmpty();
    assertThat(broker.consumers(stream, "fetch")).extracting(ConsumerInfo::name).containsExactly("consumer-1");
  }

  @Test
  @DisplayName("Should keep the header, the log and the error counter of a process")
  void should_store_process_results() {
    // given
    var pid = ProcessId.random();
    broker.putHeader(pid, new byte[]{9});

    // when
    broker.append(pid, new ResultEntry.Part(new PartLabel(0, 2), new byte[]{1}));
    broker.append(pid, new ResultEntry.Failure("boom"));
    broker.expire(pid, Duration.ofMinutes(10));

    // then
    assertThat(broker.header(pid)).hasValueSatisfying(header -> assertThat(header).containsExactly(9));
    var summary = broker.summary(pid);
    assertThat(summary.entries()).isEqualTo(2);
    assertThat(summary.errors()).isEqualTo(1);
    try (var cursor = broker.tail(pid)) {
      assertThat(cursor.next(Duration.ofMillis(100))).hasSize(2);
      assertThat(cursor.next(Duration.ofMillis(100))).isEmpty();
    }
  }

  @Test
  @DisplayName("Should return empty from a blocking read longer than the configured command timeout")
  void should_outlast_command_timeout_on_idle_stream() {
    // given
    var address = REDIS.getHost() + ":" + REDIS.getMappedPort(6379);
    var config = new RedisConfig(address, null, false, Duration.ofMillis(500)).withReadBlock(Duration.ofSeconds(1));

    // when
    List<TaskMessage> read;
    try (var slow = RedisBroker.connect(config, stream)) {
      slow.createGroup("fetch");
      try (var consumer = slow.subscribe("fetch", "consumer-1")) {
        read = consumer.read(Duration.ofSeconds(1));
      }
    }

    // then
    assertThat(read).isEmpty();
  }

  @Test
  @DisplayName("Should remove a consumer from its group")
  void should_remove_consumer() {
    // given
    broker.createGroup("fetch");
    try (var consumer = broker.subscribe("fetch", "consumer-1")) {
      consumer.read(Duration.ZERO);
    }

    // when
    broker.remove(stream, "fetch", "consumer-1");

    // then
    assertThat(broker.consumers(stream, "fetch")).isEmpty();
  }

  @Test
  @DisplayName("Should leave the error counter untouched when a failure cannot be logged")
  void should_not_count_unlogged_failure() {
    // given
    var pid = ProcessId.random();
    var client = RedisClient.create(RedisConfig.forAddress(REDIS.getHost() + ":" + REDIS.getMappedPort(6379)).toRedisURI());
    try (var connection = client.connect(ByteArrayCodec.INSTANCE)) {
      var raw = connection.sync();
      raw.set(RedisKeys.log(pid), new byte[]{0});

      // when
      var thrown = catchThrowable(() -> broker.append(pid, new ResultEntry.Failure("boom")));

      // then
      assertThat(thrown).isInstanceOf(BrokerException.class);
      assertThat(raw.exists(RedisKeys.errors(pid))).isZero();
    } finally {
      client.shutdown();
    }
  }

  @Test
  @DisplayName("Should report a missing group as a broker failure")
  void should_fail_on_missing_group() {
    assertThatThrownBy(() -> broker.consumers(stream, "missing")).isInstanceOf(BrokerException.class);
  }
}
