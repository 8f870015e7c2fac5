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

import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.broker.TaskConsumer;
import io.lettuce.core.Consumer;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.api.StatefulRedisConnection;

import java.time.Duration;
import java.util.List;

import static fr.aneo.seisflow.redis.RedisBroker.call;
import static fr.aneo.seisflow.redis.RedisKeys.text;
import static java.util.Objects.requireNonNull;

/**
 * Consumer-group reader owning a dedicated connection for its blocking {@code XREADGROUP} calls.
 */
final class RedisTaskConsumer implements TaskConsumer {

  private final StatefulRedisConnection<byte[], byte[]> connection;
  private final byte[] stream;
  private final Consumer<byte[]> consumer;

  RedisTaskConsumer(StatefulRedisConnection<byte[], byte[]> connection, byte[] stream, Consumer<byte[]> consumer) {
    this.connection = connection;
    this.stream = stream;
    this.consumer = consumer;
  }

  @Override
  public List<TaskMessage> read(Duration block) {
    requireNonNull(block, "block cannot be null");
    // BLOCK 0 waits forever on Redis: a zero wait is a plain read.
    var args = block.isZero() ? XReadArgs.Builder.count(1) : XReadArgs.Builder.block(block).count(1);
    args.noack(true);

    var messages = call("XREADGROUP " + text(consumer.getGroup()) + " " + text(consumer.getName()),
      () -> connection.sync().xreadgroup(consumer, args, XReadArgs.StreamOffset.lastConsumed(stream)));
    if (messages == null) return List.of();
    return messages.stream().map(StreamEntries::taskOf).toList();
  }

  @Override
  public void close() {
    connection.close();
  }
}
