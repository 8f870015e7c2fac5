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

import fr.aneo.seisflow.domain.exception.MalformedProcessException;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Per-process metadata written once by the scheduler before any task is enqueued.
 * <p>
 * The task count tells readers how many log entries make the process complete; the payload is
 * opaque planner output that is emitted verbatim as the first chunk of the final result.
 *
 * @param pid     owning process
 * @param ntasks  number of tasks, at least one
 * @param payload opaque planner payload
 */
public record ProcessHeader(ProcessId pid, int ntasks, byte[] payload) {

  public ProcessHeader {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(payload, "payload cannot be null");
    if (ntasks < 1) {
      throw new MalformedProcessException("process " + pid.asString() + " declares " + ntasks + " tasks, expected at least 1");
    }
    payload = payload.clone();
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ProcessHeader that)) return false;
    return ntasks == that.ntasks && pid.equals(that.pid) && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * pid.hashCode() + ntasks) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "ProcessHeader{pid=" + pid.asString() + ", ntasks=" + ntasks + ", payload=" + payload.length + " bytes}";
  }
}
