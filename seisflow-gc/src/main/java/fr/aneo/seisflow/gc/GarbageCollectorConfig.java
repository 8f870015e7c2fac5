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

import java.time.Duration;

import static java.time.temporal.ChronoUnit.MINUTES;

/**
 * Settings of one garbage collection run.
 *
 * @param stream    task queue stream
 * @param group     consumer group to clean
 * @param threshold idle time above which a consumer is removed
 * @param dryRun    whether to only report what would be removed
 */
public record GarbageCollectorConfig(String stream, String group, Duration threshold, boolean dryRun) {

  public static final String DEFAULT_STREAM = "jobs";
  public static final String DEFAULT_GROUP = "fetch";
  public static final Duration DEFAULT_THRESHOLD = Duration.of(30, MINUTES);

  public GarbageCollectorConfig {
    stream = stream == null ? DEFAULT_STREAM : stream;
    group = group == null ? DEFAULT_GROUP : group;
    threshold = threshold == null ? DEFAULT_THRESHOLD : threshold;

    if (stream.isBlank()) throw new IllegalArgumentException("stream cannot be blank");
    if (group.isBlank()) throw new IllegalArgumentException("group cannot be blank");
    if (threshold.isNegative()) throw new IllegalArgumentException("threshold cannot be negative");
  }

  public static GarbageCollectorConfig defaults() {
    return new GarbageCollectorConfig(null, null, null, false);
  }
}
