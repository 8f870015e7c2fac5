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

package fr.aneo.seisflow.domain.exception;

/**
 * Base exception for all SeisFlow pipeline operations.
 * <p>
 * {@code SeisflowException} is the root of the pipeline's exception hierarchy. It is unchecked so that
 * failures can cross worker threads, broker callbacks and gRPC handlers without polluting every
 * signature with {@code throws} clauses. Each subclass names the stage that failed:
 * <ul>
 *   <li>{@link PlanningException}: the query could not be turned into a task plan</li>
 *   <li>{@link SchedulingException}: the plan could not be written to the broker</li>
 *   <li>{@link StorageException}: a fragment could not be read from blob storage</li>
 *   <li>{@link ReassemblyException}: the reassembly library rejected a task or a fragment</li>
 *   <li>{@link BrokerException}: a broker read or write failed</li>
 *   <li>{@link MalformedProcessException}: a stored process header cannot be interpreted</li>
 * </ul>
 */
public class SeisflowException extends RuntimeException {

  /**
   * Creates a new exception with the specified detail message.
   *
   * @param message the detail message describing the error
   */
  public SeisflowException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified detail message and cause.
   *
   * @param message the detail message describing the error
   * @param cause   the underlying cause of this exception
   */
  public SeisflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
