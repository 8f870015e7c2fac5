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
import io.lettuce.core.StreamMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static fr.aneo.seisflow.redis.RedisKeys.bytes;
import static fr.aneo.seisflow.redis.RedisKeys.text;

/**
 * Conversions between domain objects and Redis stream entries.
 * <p>
 * Stream bodies are decoded by iterating their fields: byte-array keys have identity semantics and
 * cannot be looked up in the body map.
 */
final class StreamEntries {

  static final String PID = "pid";
  static final String PART = "part";
  static final String TASK = "task";

  private StreamEntries() {
  }

  static Map<byte[], byte[]> bodyOf(TaskMessage message) {
    var body = new LinkedHashMap<byte[], byte[]>();
    body.put(bytes(PID), bytes(message.pid().asString()));
    body.put(bytes(PART), bytes(message.part().asString()));
    body.put(bytes(TASK), message.task());
    return body;
  }

  static TaskMessage taskOf(StreamMessage<byte[], byte[]> message) {
    String pid = null;
    String part = null;
    byte[] task = null;
    for (var field : message.getBody().entrySet()) {
      switch (text(field.getKey())) {
        case PID -> pid = text(field.getValue());
        case PART -> part = text(field.getValue());
        case TASK -> task = field.getValue();
        default -> {
        }
      }
    }
    if (pid == null || part == null || task == null) {
      throw new BrokerException("task entry " + message.getId() + " lacks one of pid, part, task");
    }
    try {
      return new TaskMessage(message.getId(), ProcessId.from(pid), PartLabel.parse(part), task);
    } catch (IllegalArgumentException e) {
      throw new BrokerException("task entry " + message.getId() + " is malformed", e);
    }
  }

  static Map<byte[], byte[]> bodyOf(ResultEntry entry) {
    if (entry instanceof ResultEntry.Part part) {
      return Map.of(bytes(part.label().asString()), part.body());
    }
    return Map.of(bytes(ResultEntry.ERROR_FIELD), bytes(((ResultEntry.Failure) entry).message()));
  }

  static ResultEntry resultOf(StreamMessage<byte[], byte[]> message) {
    var body = message.getBody();
    if (body.size() != 1) {
      throw new BrokerException("result entry " + message.getId() + " must hold exactly one field, got " + body.size());
    }
    var field = body.entrySet().iterator().next();
    var key = text(field.getKey());
    if (ResultEntry.ERROR_FIELD.equals(key)) {
      return new ResultEntry.Failure(text(field.getValue()));
    }
    try {
      return new ResultEntry.Part(PartLabel.parse(key), field.getValue());
    } catch (IllegalArgumentException e) {
      throw new BrokerException("result entry " + message.getId() + " has an invalid part label", e);
    }
  }

  /**
   * Parses the reply of {@code XINFO CONSUMERS}: one flat key/value list per consumer.
   *
   * @param reply raw command reply
   * @return the consumers
   */
  static List<ConsumerInfo> consumersOf(List<Object> reply) {
    var consumers = new ArrayList<ConsumerInfo>(reply.size());
    for (Object item : reply) {
      if (!(item instanceof List<?> fields)) {
        throw new BrokerException("unexpected XINFO CONSUMERS item: " + item);
      }
      String name = null;
      long pending = 0;
      long idle = 0;
      for (int i = 0; i + 1 < fields.size(); i += 2) {
        var value = fields.get(i + 1);
        switch (String.valueOf(text(fields.get(i)))) {
          case "name" -> name = text(value);
          case "pending" -> pending = asLong(value);
          case "idle" -> idle = asLong(value);
          default -> {
          }
        }
      }
      if (name == null) throw new BrokerException("XINFO CONSUMERS item without name: " + fields);
      consumers.add(new ConsumerInfo(name, pending, Duration.ofMillis(idle)));
    }
    return consumers;
  }

  private static long asLong(Object value) {
    if (value instanceof Number number) return number.longValue();
    try {
      return Long.parseLong(text(value));
    } catch (NumberFormatException e) {
      throw new BrokerException("expected an integer, got " + text(value), e);
    }
  }
}
