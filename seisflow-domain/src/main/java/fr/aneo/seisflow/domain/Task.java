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

import static java.util.Objects.requireNonNull;

/**
 * A task reconstructed on the worker side from a {@link TaskMessage}.
 * <p>
 * The raw descriptor bytes are kept alongside the decoded {@link TaskSpec} so that the reassembly
 * library can parse them on its own terms.
 *
 * @param pid  owning process
 * @param part position of the task within the process
 * @param spec decoded task descriptor
 * @param raw  raw task descriptor bytes as received from the broker
 */
public record Task(ProcessId pid, PartLabel part, TaskSpec spec, byte[] raw) {

  public Task {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(part, "part cannot be null");
    requireNonNull(spec, "spec cannot be null");
    requireNonNull(raw, "raw cannot be null");
    if (!spec.pid().equals(pid)) {
      throw new IllegalArgumentException("task descriptor belongs to " + spec.pid().asString() + ", not " + pid.asString());
    }
    raw = raw.clone();
  }

  @Override
  public byte[] raw() {
    return raw.clone();
  }

  @Override
  public String toString() {
    return "Task{pid=" + pid.asString() + ", part=" + part + ", function=" + spec.function() + ", guid=" + spec.guid() + "}";
  }
}
