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

import com.google.gson.JsonObject;

import static java.util.Objects.requireNonNull;

/**
 * The decoded content of one task descriptor produced by the planner.
 *
 * @param pid         owning process
 * @param function    extraction function the task belongs to
 * @param guid        identifier of the cube
 * @param storage     location of the cube's fragments
 * @param credentials storage credentials
 * @param args        function-specific arguments of this task only
 */
public record TaskSpec(ProcessId pid,
                       String function,
                       String guid,
                       StorageLocation storage,
                       Credentials credentials,
                       JsonObject args) {

  public TaskSpec {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(function, "function cannot be null");
    requireNonNull(guid, "guid cannot be null");
    requireNonNull(storage, "storage cannot be null");
    requireNonNull(credentials, "credentials cannot be null");
    args = args == null ? new JsonObject() : args.deepCopy();
  }

  @Override
  public JsonObject args() {
    return args.deepCopy();
  }
}
