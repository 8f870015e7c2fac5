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

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layout of a process in Redis.
 * <ul>
 *   <li>{@code <pid>}: result log stream</li>
 *   <li>{@code <pid>/header.json}: process header</li>
 *   <li>{@code <pid>/errors}: number of failure entries in the log</li>
 * </ul>
 */
final class RedisKeys {

  private RedisKeys() {
  }

  static byte[] log(ProcessId pid) {
    return bytes(pid.asString());
  }

  static byte[] header(ProcessId pid) {
    return bytes(pid.asString() + "/header.json");
  }

  static byte[] errors(ProcessId pid) {
    return bytes(pid.asString() + "/errors");
  }

  static byte[] bytes(String text) {
    return text.getBytes(UTF_8);
  }

  static String text(Object value) {
    if (value == null) return null;
    if (value instanceof byte[] bytes) return new String(bytes, UTF_8);
    if (value instanceof ByteBuffer buffer) return UTF_8.decode(buffer.duplicate()).toString();
    return value.toString();
  }
}
