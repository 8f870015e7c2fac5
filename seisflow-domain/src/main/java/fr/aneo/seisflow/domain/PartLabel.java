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
 * Position of one task within its process, rendered as {@code "n/m"}.
 * <p>
 * {@code index} is zero-based and strictly lower than {@code total}; {@code total} is the number of
 * tasks of the process and is at least one.
 *
 * @param index zero-based position of the task
 * @param total number of tasks in the process
 */
public record PartLabel(int index, int total) {

  public PartLabel {
    if (total < 1) throw new IllegalArgumentException("total must be at least 1, got " + total);
    if (index < 0 || index >= total) {
      throw new IllegalArgumentException("index must be in [0, " + total + "), got " + index);
    }
  }

  /**
   * Parses a label of the form {@code "n/m"}.
   *
   * @param label the label text
   * @return the parsed label
   * @throws IllegalArgumentException if the text is not a valid label
   */
  public static PartLabel parse(String label) {
    if (label == null) throw new IllegalArgumentException("part label cannot be null");

    int slash = label.indexOf('/');
    if (slash <= 0 || slash == label.length() - 1) {
      throw new IllegalArgumentException("part label must have the form n/m, got '" + label + "'");
    }
    try {
      return new PartLabel(Integer.parseInt(label.substring(0, slash)), Integer.parseInt(label.substring(slash + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("part label must have the form n/m, got '" + label + "'", e);
    }
  }

  public String asString() {
    return index + "/" + total;
  }

  @Override
  public String toString() {
    return asString();
  }
}
