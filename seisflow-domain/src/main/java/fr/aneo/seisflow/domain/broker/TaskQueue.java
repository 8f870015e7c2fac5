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

import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.exception.BrokerException;

import java.util.Collection;

/**
 * Append-only queue of task messages consumed through consumer groups.
 * <p>
 * Delivery is at-least-once: consumers read without acknowledgement and delete the entries they read.
 * A consumer that crashes between read and delete may cause a task to be delivered again.
 */
public interface TaskQueue {

  /**
   * Appends a task message.
   *
   * @param message message to publish
   * @return the broker-assigned entry id
   * @throws BrokerException if the write fails
   */
  String publish(TaskMessage message);

  /**
   * Creates a consumer group reading from the start of the queue, creating the queue if needed.
   * Creating a group that already exists is not an error.
   *
   * @param group consumer group name
   * @throws BrokerException if the group cannot be created
   */
  void createGroup(String group);

  /**
   * Registers a consumer in a group.
   *
   * @param group    consumer group name
   * @param consumer consumer name, unique within the group
   * @return a consumer owned by the caller
   */
  TaskConsumer subscribe(String group, String consumer);

  /**
   * Deletes entries from the queue.
   *
   * @param ids broker entry ids
   * @throws BrokerException if the delete fails
   */
  void delete(Collection<String> ids);
}
