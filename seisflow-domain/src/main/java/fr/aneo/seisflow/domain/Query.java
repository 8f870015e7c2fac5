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
 * A client query before planning.
 * <p>
 * The query names the extraction function, the cube it reads from, where that cube is stored and
 * the function-specific arguments. The process id is absent until the query is submitted; the
 * scheduler stamps it with {@link #withPid(ProcessId)} before handing the query to the planner.
 *
 * @param pid         process id, {@code null} before submission
 * @param function    extraction function, for instance {@code "fragments"}
 * @param guid        identifier of the cube
 * @param storage     location of the cube's fragments
 * @param credentials storage credentials forwarded to every download
 * @param args        function-specific arguments
 */
public record Query(ProcessId pid,
                    String function,
                    String guid,
                    StorageLocation storage,
                    Credentials credentials,
                    JsonObject args) {

  public Query {
    requireNonNull(function, "function cannot be null");
    requireNonNull(guid, "guid cannot be null");
    requireNonNull(storage, "storage cannot be null");
    requireNonNull(credentials, "credentials cannot be null");
    args = args == null ? new JsonObject() : args.deepCopy();
  }

  public Query withPid(ProcessId pid) {
    return new Query(requireNonNull(pid, "pid cannot be null"), function, guid, storage, credentials, args);
  }

  @Override
  public JsonObject args() {
    return args.deepCopy();
  }
}
