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

import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.broker.ResultCursor;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.api.StatefulRedisConnection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static fr.aneo.seisflow.redis.RedisBroker.call;
import static java.util.Objects.requireNonNull;

/**
 * Reads a result stream from its first entry with {@code XREAD}, remembering the last id seen.
 */
final class RedisResultCursor implements ResultCursor {

  private final StatefulRedisConnection<byte[], byte[]> connection;
  private final ProcessId pid;
  private String lastId = "0-0";

  RedisResultCursor(StatefulRedisConnection<byte[], byte[]> connection, ProcessId pid) {
    this.connection = connection;
    this.pid = pid;
  }

  @Override
  public List<ResultEntry> next(Duration block) {
    requireNonNull(block, "block cannot be null");
    var args = block.isZero() ? new XReadArgs() : XReadArgs.Builder.block(block);
    var offset = XReadArgs.StreamOffset.from(RedisKeys.log(pid), lastId);

    var messages = call("XREAD " + pid.asString(), () -> connection.sync().xread(args, offset));
    if (messages == null || messages.isEmpty()) return List.of();

    var entries = new ArrayList<ResultEntry>(messages.size());
    for (var message : messages) {
      entries.add(StreamEntries.resultOf(message));
      lastId = message.getId();
    }
    return entries;
  }

  @Override
  public void close() {
    connection.close();
  }
}
