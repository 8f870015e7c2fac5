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

/**
 * Counters of a per-process result log.
 *
 * @param entries number of entries, parts and failures together
 * @param errors  number of failure entries
 */
public record LogSummary(long entries, long errors) {

  public static final LogSummary EMPTY = new LogSummary(0, 0);

  public LogSummary {
    if (entries < 0 || errors < 0) throw new IllegalArgumentException("counters cannot be negative");
  }
}
