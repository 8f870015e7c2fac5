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

package fr.aneo.seisflow.domain;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * A consumer registered in a consumer group, as reported by the broker.
 *
 * @param name    consumer name
 * @param pending number of delivered but unacknowledged messages
 * @param idle    time since the consumer last read from the group
 */
public record ConsumerInfo(String name, long pending, Duration idle) {

  public ConsumerInfo {
    requireNonNull(name, "name cannot be null");
    requireNonNull(idle, "idle cannot be null");
  }

  public boolean idleLongerThan(Duration threshold) {
    return idle.compareTo(threshold) > 0;
  }
}
