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

import fr.aneo.seisflow.domain.ProcessId;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Progress of a process as seen by a client.
 *
 * @param pid     process id
 * @param state   coarse state of the process
 * @param entries number of log entries written so far
 * @param ntasks  number of parts of the process, 0 while pending
 */
public record ProcessStatus(ProcessId pid, State state, long entries, int ntasks) {

  public enum State {
    /** No header yet: the process is not scheduled, or it expired. */
    PENDING,
    WORKING,
    FINISHED,
    /** At least one part failed. */
    FAILED;

    public String asString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public ProcessStatus {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(state, "state cannot be null");
  }

  public static ProcessStatus pending(ProcessId pid) {
    return new ProcessStatus(pid, State.PENDING, 0, 0);
  }

  /**
   * Returns {@code "<entries>/<ntasks>"}, or an empty string while pending.
   *
   * @return the progress
   */
  public String progress() {
    return state == State.PENDING ? "" : entries + "/" + ntasks;
  }

  /**
   * Returns where the client should look next: the result once finished, the status otherwise.
   *
   * @return the relative location
   */
  public String location() {
    return state == State.FINISHED ? "result/" + pid.asString() : "result/" + pid.asString() + "/status";
  }
}
