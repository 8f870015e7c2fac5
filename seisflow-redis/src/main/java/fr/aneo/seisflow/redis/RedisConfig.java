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

import com.google.common.net.HostAndPort;
import io.lettuce.core.RedisURI;

import java.time.Duration;

import static java.time.temporal.ChronoUnit.SECONDS;
import static java.util.Objects.requireNonNull;

/**
 * Connection settings of a Redis server used as broker.
 *
 * <h2>Address formats</h2>
 * <ul>
 *   <li>{@code host:port}, for instance {@code localhost:6379}</li>
 *   <li>a Redis URI, for instance {@code redis://localhost:6379/0} or {@code rediss://cache:6380}</li>
 * </ul>
 * A password or TLS flag given explicitly overrides what the URI says.
 *
 * @param address        server address
 * @param password       password, or {@code null} for none
 * @param secure         whether to connect with TLS
 * @param commandTimeout timeout of every command, blocking reads included; see {@link #withReadBlock(Duration)}
 */
public record RedisConfig(String address, String password, boolean secure, Duration commandTimeout) {

  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.of(60, SECONDS);
  public static final Duration BLOCKING_READ_MARGIN = Duration.of(5, SECONDS);

  public RedisConfig {
    requireNonNull(address, "address cannot be null");
    if (address.isBlank()) throw new IllegalArgumentException("address cannot be blank");
    commandTimeout = commandTimeout == null ? DEFAULT_COMMAND_TIMEOUT : commandTimeout;
    if (commandTimeout.isNegative() || commandTimeout.isZero()) {
      throw new IllegalArgumentException("commandTimeout must be positive");
    }
    if (password != null && password.isEmpty()) password = null;
  }

  /**
   * Creates a plain-text configuration without password.
   *
   * @param address server address
   * @return the configuration
   */
  public static RedisConfig forAddress(String address) {
    return new RedisConfig(address, null, false, DEFAULT_COMMAND_TIMEOUT);
  }

  /**
   * Returns a configuration whose command timeout outlasts blocking reads of {@code block}.
   * <p>
   * Lettuce applies the command timeout to blocking commands as well, so a read blocking for longer than
   * the timeout would fail on an idle stream. The timeout is raised to {@code block} plus
   * {@link #BLOCKING_READ_MARGIN} when it is not already above that.
   *
   * @param block longest blocking read issued on the connection
   * @return this configuration, or a copy with a longer command timeout
   */
  public RedisConfig withReadBlock(Duration block) {
    requireNonNull(block, "block cannot be null");
    if (block.isNegative()) throw new IllegalArgumentException("block cannot be negative");
    var required = block.plus(BLOCKING_READ_MARGIN);
    return commandTimeout.compareTo(required) >= 0 ? this : new RedisConfig(address, password, secure, required);
  }

  /**
   * Builds the Lettuce URI of this configuration.
   *
   * @return the Redis URI
   * @throws IllegalArgumentException if the address cannot be parsed
   */
  public RedisURI toRedisURI() {
    var trimmed = address.trim();
    RedisURI uri;
    if (trimmed.contains("://")) {
      uri = RedisURI.create(trimmed);
    } else {
      var hostAndPort = HostAndPort.fromString(trimmed).withDefaultPort(RedisURI.DEFAULT_REDIS_PORT);
      uri = RedisURI.create(hostAndPort.getHost(), hostAndPort.getPort());
    }
    if (password != null) uri.setPassword(password.toCharArray());
    if (secure) uri.setSsl(true);
    uri.setTimeout(commandTimeout);
    return uri;
  }

  @Override
  public String toString() {
    return "RedisConfig{address=" + address + ", secure=" + secure + ", password=" + (password == null ? "none" : "****") + "}";
  }
}
