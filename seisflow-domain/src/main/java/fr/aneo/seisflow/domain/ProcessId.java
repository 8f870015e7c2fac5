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

import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Immutable identifier of one scheduled query.
 * <p>
 * A process id is a random UUID string created once per query at scheduling time and never reused.
 * It keys the process header, the per-process result log and every task message of the query.
 * <p>
 * ProcessId instances implement proper equality and hash code semantics for use in collections
 * and as map keys.
 */
public final class ProcessId {
  private final String id;

  private ProcessId(String id) {
    this.id = id;
  }

  /**
   * Creates a fresh, random process identifier.
   *
   * @return a new process identifier
   */
  public static ProcessId random() {
    return new ProcessId(UUID.randomUUID().toString());
  }

  /**
   * Wraps an identifier received from a client, a broker message or a stored header.
   *
   * @param id the identifier string
   * @return the corresponding process identifier
   * @throws NullPointerException     if {@code id} is {@code null}
   * @throws IllegalArgumentException if {@code id} is blank or contains a slash
   */
  public static ProcessId from(String id) {
    requireNonNull(id, "id cannot be null");
    if (id.isBlank()) throw new IllegalArgumentException("process id cannot be blank");
    if (id.indexOf('/') >= 0) throw new IllegalArgumentException("process id cannot contain '/': " + id);
    return new ProcessId(id);
  }

  public String asString() {
    return id;
  }

  @Override
  public String toString() {
    return "ProcessId{" +
      "id='" + id + '\'' +
      '}';
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || getClass() != o.getClass()) return false;

    ProcessId processId = (ProcessId) o;
    return Objects.equals(id, processId.id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id);
  }
}
