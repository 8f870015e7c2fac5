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

package fr.aneo.seisflow.domain.broker;

import fr.aneo.seisflow.domain.LogSummary;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-process storage of the header record and of the append-only result log.
 * <p>
 * Writers never coordinate: each part appends exactly one entry, and the store is safe for concurrent
 * appends from any number of workers. Every method throws
 * {@link fr.aneo.seisflow.domain.exception.BrokerException} when the underlying broker fails.
 */
public interface ResultStore {

  /**
   * Stores the header of a process, without expiry.
   *
   * @param pid    owning process
   * @param header serialized header
   */
  void putHeader(ProcessId pid, byte[] header);

  Optional<byte[]> header(ProcessId pid);

  /**
   * Appends one entry to the log of a process.
   *
   * @param pid   owning process
   * @param entry part or failure entry
   */
  void append(ProcessId pid, ResultEntry entry);

  /**
   * Sets the time-to-live of every key of a process: header, log and counters.
   *
   * @param pid owning process
   * @param ttl time after which the keys are removed
   */
  void expire(ProcessId pid, Duration ttl);

  LogSummary summary(ProcessId pid);

  /**
   * Opens a cursor reading the log of a process from its first entry.
   *
   * @param pid owning process
   * @return a cursor owned by the caller
   */
  ResultCursor tail(ProcessId pid);
}
