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

import fr.aneo.seisflow.domain.ConsumerInfo;

import java.util.List;

/**
 * Broker bookkeeping of the consumers registered in consumer groups.
 */
public interface ConsumerRegistry {

  /**
   * Lists the consumers of a group.
   *
   * @param stream name of the queue
   * @param group  consumer group name
   * @return the registered consumers with their idle time
   * @throws fr.aneo.seisflow.domain.exception.BrokerException if the group cannot be inspected
   */
  List<ConsumerInfo> consumers(String stream, String group);

  /**
   * Removes a consumer from a group.
   *
   * @param stream   name of the queue
   * @param group    consumer group name
   * @param consumer consumer name
   * @throws fr.aneo.seisflow.domain.exception.BrokerException if the removal fails
   */
  void remove(String stream, String group, String consumer);
}
