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

package fr.aneo.seisflow.api;

import fr.aneo.seisflow.domain.fragments.FragmentListPlanner;

import java.time.Duration;

import static java.time.temporal.ChronoUnit.MINUTES;
import static java.time.temporal.ChronoUnit.SECONDS;

/**
 * Settings of the result API server.
 * <p>
 * {@code null} durations are replaced by their defaults.
 *
 * @param port          listening port, 0 for an ephemeral one
 * @param stream        task queue stream
 * @param taskSize      maximum number of fragments per task
 * @param resultTimeout how long {@code Get} and {@code Stream} wait for missing parts
 * @param processTtl    time to live of a process's keys once scheduled
 */
public record ApiServerConfig(int port, String stream, int taskSize, Duration resultTimeout, Duration processTtl) {

  public static final int DEFAULT_PORT = 8080;
  public static final String DEFAULT_STREAM = "jobs";
  public static final Duration DEFAULT_RESULT_TIMEOUT = Duration.of(60, SECONDS);
  public static final Duration DEFAULT_PROCESS_TTL = Duration.of(10, MINUTES);

  public ApiServerConfig {
    stream = stream == null ? DEFAULT_STREAM : stream;
    resultTimeout = resultTimeout == null ? DEFAULT_RESULT_TIMEOUT : resultTimeout;
    processTtl = processTtl == null ? DEFAULT_PROCESS_TTL : processTtl;

    if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range [0-65535]: " + port);
    if (taskSize < 1) throw new IllegalArgumentException("taskSize must be at least 1, got " + taskSize);
    if (resultTimeout.isNegative() || resultTimeout.isZero()) throw new IllegalArgumentException("resultTimeout must be positive");
    if (processTtl.isNegative() || processTtl.isZero()) throw new IllegalArgumentException("processTtl must be positive");
  }

  public static ApiServerConfig defaults() {
    return new ApiServerConfig(DEFAULT_PORT, null, FragmentListPlanner.DEFAULT_TASK_SIZE, null, null);
  }

  public ApiServerConfig withPort(int port) {
    return new ApiServerConfig(port, stream, taskSize, resultTimeout, processTtl);
  }
}
