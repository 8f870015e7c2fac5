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

import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * One task as it travels through the task queue.
 * <p>
 * The broker entry carries three fields: the process id, the part label and the raw task descriptor.
 * {@code id} is the broker-assigned entry id; it is {@code null} for messages that were not read from
 * a broker yet.
 *
 * @param id   broker entry id, or {@code null} before publication
 * @param pid  owning process
 * @param part position of the task within the process
 * @param task raw task descriptor bytes
 */
public record TaskMessage(String id, ProcessId pid, PartLabel part, byte[] task) {

  public TaskMessage {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(part, "part cannot be null");
    requireNonNull(task, "task cannot be null");
    task = task.clone();
  }

  public static TaskMessage unpublished(ProcessId pid, PartLabel part, byte[] task) {
    return new TaskMessage(null, pid, part, task);
  }

  @Override
  public byte[] task() {
    return task.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TaskMessage that)) return false;
    return Objects.equals(id, that.id)
      && pid.equals(that.pid)
      && part.equals(that.part)
      && Arrays.equals(task, that.task);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, pid, part);
    return 31 * result + Arrays.hashCode(task);
  }

  @Override
  public String toString() {
    return "TaskMessage{id=" + id + ", pid=" + pid.asString() + ", part=" + part + ", task=" + task.length + " bytes}";
  }
}
