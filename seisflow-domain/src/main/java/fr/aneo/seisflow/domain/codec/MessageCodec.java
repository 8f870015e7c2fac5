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

package fr.aneo.seisflow.domain.codec;

import fr.aneo.seisflow.domain.ProcessHeader;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.TaskSpec;

/**
 * Serialization of the documents exchanged between the API, the planner, the broker and the workers.
 * <p>
 * Implementations must be thread-safe; a single instance is shared by all components of a process.
 */
public interface MessageCodec {

  byte[] encodeQuery(Query query);

  /**
   * Decodes a client query.
   *
   * @param bytes serialized query
   * @return the decoded query
   * @throws IllegalArgumentException if the document is not a valid query
   */
  Query decodeQuery(byte[] bytes);

  byte[] encodeTask(TaskSpec task);

  /**
   * Decodes a task descriptor.
   *
   * @param bytes serialized task descriptor
   * @return the decoded task
   * @throws IllegalArgumentException if the document is not a valid task descriptor
   */
  TaskSpec decodeTask(byte[] bytes);

  byte[] encodeHeader(ProcessHeader header);

  /**
   * Decodes a stored process header.
   *
   * @param bytes serialized header
   * @return the decoded header
   * @throws fr.aneo.seisflow.domain.exception.MalformedProcessException if the header is not usable
   */
  ProcessHeader decodeHeader(byte[] bytes);
}
