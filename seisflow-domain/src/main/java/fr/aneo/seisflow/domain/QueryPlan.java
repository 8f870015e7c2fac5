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

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The planner's output for one query: an ordered list of task descriptors plus the process header
 * descriptor.
 *
 * @param tasks  serialized task descriptors, in part order
 * @param header serialized process header
 */
public record QueryPlan(List<byte[]> tasks, byte[] header) {

  public QueryPlan {
    requireNonNull(tasks, "tasks cannot be null");
    requireNonNull(header, "header cannot be null");
    if (tasks.isEmpty()) throw new IllegalArgumentException("a plan must contain at least one task");
    tasks = tasks.stream().map(byte[]::clone).toList();
    header = header.clone();
  }

  /**
   * Splits a planner descriptor list whose last element is the process header.
   *
   * @param descriptors task descriptors followed by one header descriptor
   * @return the corresponding plan
   * @throws IllegalArgumentException if fewer than two descriptors are given
   */
  public static QueryPlan fromDescriptors(List<byte[]> descriptors) {
    requireNonNull(descriptors, "descriptors cannot be null");
    if (descriptors.size() < 2) {
      throw new IllegalArgumentException("expected at least one task and a header, got " + descriptors.size() + " descriptors");
    }
    var tasks = new ArrayList<>(descriptors.subList(0, descriptors.size() - 1));
    return new QueryPlan(tasks, descriptors.get(descriptors.size() - 1));
  }

  public int ntasks() {
    return tasks.size();
  }

  @Override
  public List<byte[]> tasks() {
    return tasks.stream().map(byte[]::clone).toList();
  }

  @Override
  public byte[] header() {
    return header.clone();
  }
}
