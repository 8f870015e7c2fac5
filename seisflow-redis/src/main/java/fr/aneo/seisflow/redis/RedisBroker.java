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
import fr.aneo.seisflow.domain.LogSummary;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.broker.ConsumerRegistry;
import fr.aneo.seisflow.domain.broker.ResultCursor;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.broker.TaskConsumer;
import fr.aneo.seisflow.domain.broker.TaskQueue;
import fr.aneo.seisflow.domain.exception.BrokerException;
import io.lettuce.core.Consumer;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.XGroupCreateArgs;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static fr.aneo.seisflow.redis.RedisKeys.bytes;
import static fr.aneo.seisflow.redis.RedisKeys.text;
import static java.util.Objects.requireNonNull;

/**
 * Redis implementation of the task queue, the result store and the consumer registry.
 * <p>
 * The task queue is a Redis stream read through a consumer group with {@code NOACK}, one entry at a time.
 * Each process owns a result stream named after its pid, a header string and an error counter, all of
 * which expire together.
 *
 * <h2>Connections</h2>
 * <p>
 * Non-blocking commands share one connection. Every {@link TaskConsumer} and every {@link ResultCursor}
 * opens a dedicated connection, because their blocking reads would otherwise stall every other command
 * multiplexed on the shared one.
 *
 * <h2>Errors</h2>
 * <p>
 * Every Lettuce failure is rethrown as a {@link BrokerException} naming the command that failed.
 */
public final class RedisBroker implements TaskQueue, ResultStore, ConsumerRegistry, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RedisBroker.class);

  private final RedisClient client;
  private final byte[] stream;
  private final String streamName;
  private final StatefulRedisConnection<byte[], byte[]> connection;
  private final RedisCommands<byte[], byte[]> commands;

  RedisBroker(RedisClient client, String stream) {
    this.client = requireNonNull(client, "client cannot be null");
    this.streamName = requireNonNull(stream, "stream cannot be null");
    this.stream = bytes(stream);
    this.connection = client.connect(ByteArrayCodec.INSTANCE);
    this.commands = connection.sync();
  }

  /**
   * Connects to the Redis server described by {@code config}.
   *
   * @param config connection settings
   * @param stream name of the task queue stream
   * @return a connected broker; closing it shuts the client down
   * @throws BrokerException if the server cannot be reached
   */
  public static RedisBroker connect(RedisConfig config, String stream) {
    requireNonNull(config, "config cannot be null");
    var client = RedisClient.create(config.toRedisURI());
    try {
      var broker = new RedisBroker(client, stream);
      logger.info("Connected to Redis {} (stream '{}')", config, stream);
      return broker;
    } catch (RedisException e) {
      client.shutdown();
      throw new BrokerException("unable to connect to Redis at " + config.address(), e);
    }
  }

  @Override
  public String publish(TaskMessage message) {
    requireNonNull(message, "message cannot be null");
    return call("XADD " + streamName, () -> commands.xadd(stream, StreamEntries.bodyOf(message)));
  }

  @Override
  public void createGroup(String group) {
    requireNonNull(group, "group cannot be null");
    try {
      commands.xgroupCreate(XReadArgs.StreamOffset.from(stream, "0"), bytes(group), XGroupCreateArgs.Builder.mkstream());
      logger.info("Created consumer group '{}' on stream '{}'", group, streamName);
    } catch (RedisCommandExecutionException e) {
      if (e.getMessage() == null || !e.getMessage().startsWith("BUSYGROUP")) {
        throw new BrokerException("unable to create consumer group '" + group + "' on " + streamName, e);
      }
      logger.debug("Consumer group '{}' already exists on stream '{}'", group, streamName);
    } catch (RedisException e) {
      throw new BrokerException("unable to create consumer group '" + group + "' on " + streamName, e);
    }
  }

  @Override
  public TaskConsumer subscribe(String group, String consumer) {
    requireNonNull(group, "group cannot be null");
    requireNonNull(consumer, "consumer cannot be null");
    var dedicated = call("CONNECT", () -> client.connect(ByteArrayCodec.INSTANCE));
    return new RedisTaskConsumer(dedicated, stream, Consumer.from(bytes(group), bytes(consumer)));
  }

  @Override
  public void delete(Collection<String> ids) {
    requireNonNull(ids, "ids cannot be null");
    if (ids.isEmpty()) return;
    call("XDEL " + streamName, () -> commands.xdel(stream, ids.toArray(String[]::new)));
  }

  @Override
  public void putHeader(ProcessId pid, byte[] header) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(header, "header cannot be null");
    call("SET " + pid.asString() + "/header.json", () -> commands.set(RedisKeys.header(pid), header));
  }

  @Override
  public Optional<byte[]> header(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    return Optional.ofNullable(call("GET " + pid.asString() + "/header.json", () -> commands.get(RedisKeys.header(pid))));
  }

  @Override
  public void append(ProcessId pid, ResultEntry entry) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(entry, "entry cannot be null");
    call("XADD " + pid.asString(), () -> commands.xadd(RedisKeys.log(pid), StreamEntries.bodyOf(entry)));
    // The counter never runs ahead of the log.
    if (entry instanceof ResultEntry.Failure) {
      call("INCR " + pid.asString() + "/errors", () -> commands.incr(RedisKeys.errors(pid)));
    }
  }

  @Override
  public void expire(ProcessId pid, Duration ttl) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(ttl, "ttl cannot be null");
    call("EXPIRE " + pid.asString(), () -> {
      commands.expire(RedisKeys.log(pid), ttl);
      commands.expire(RedisKeys.header(pid), ttl);
      commands.expire(RedisKeys.errors(pid), ttl);
      return null;
    });
  }

  @Override
  public LogSummary summary(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    long entries = call("XLEN " + pid.asString(), () -> commands.xlen(RedisKeys.log(pid)));
    var errors = call("GET " + pid.asString() + "/errors", () -> commands.get(RedisKeys.errors(pid)));
    try {
      return new LogSummary(entries, errors == null ? 0 : Long.parseLong(text(errors)));
    } catch (NumberFormatException e) {
      throw new BrokerException("error counter of " + pid.asString() + " is not a number", e);
    }
  }

  @Override
  public ResultCursor tail(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    var dedicated = call("CONNECT", () -> client.connect(ByteArrayCodec.INSTANCE));
    return new RedisResultCursor(dedicated, pid);
  }

  @Override
  public List<ConsumerInfo> consumers(String stream, String group) {
    requireNonNull(stream, "stream cannot be null");
    requireNonNull(group, "group cannot be null");
    return StreamEntries.consumersOf(call("XINFO CONSUMERS " + stream + " " + group,
      () -> commands.xinfoConsumers(bytes(stream), bytes(group))));
  }

  @Override
  public void remove(String stream, String group, String consumer) {
    requireNonNull(stream, "stream cannot be null");
    requireNonNull(group, "group cannot be null");
    requireNonNull(consumer, "consumer cannot be null");
    call("XGROUP DELCONSUMER " + stream + " " + group + " " + consumer,
      () -> commands.xgroupDelconsumer(bytes(stream), Consumer.from(bytes(group), bytes(consumer))));
  }

  @Override
  public void close() {
    try {
      connection.close();
    } finally {
      client.shutdown();
    }
  }

  static <T> T call(String command, Supplier<T> operation) {
    try {
      return operation.get();
    } catch (RedisException e) {
      throw new BrokerException(command + " failed: " + e.getMessage(), e);
    }
  }
}
