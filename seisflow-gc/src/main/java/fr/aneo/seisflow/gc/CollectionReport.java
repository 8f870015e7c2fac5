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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a garbage collection run.
 *
 * @param idle     consumers idle longer than the threshold
 * @param retained consumers left in place
 * @param dryRun   whether the idle consumers were only reported
 */
public record CollectionReport(List<String> idle, List<String> retained, boolean dryRun) {

  public CollectionReport {
    idle = List.copyOf(requireNonNull(idle, "idle cannot be null"));
    retained = List.copyOf(requireNonNull(retained, "retained cannot be null"));
  }

  /**
   * Returns the consumers actually removed from the group, none on a dry run.
   *
   * @return the removed consumer names
   */
  public List<String> removed() {
    return dryRun ? List.of() : idle;
  }
}
