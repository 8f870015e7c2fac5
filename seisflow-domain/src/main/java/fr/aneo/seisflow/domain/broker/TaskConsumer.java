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

import java.time.Duration;
import java.util.List;

/**
 * A registered member of a consumer group.
 */
public interface TaskConsumer extends AutoCloseable {

  /**
   * Reads the next message delivered to this consumer, waiting up to {@code block}.
   *
   * @param block maximum time to wait for a message
   * @return the delivered messages, empty when the wait timed out
   * @throws fr.aneo.seisflow.domain.exception.BrokerException if the read fails
   */
  List<TaskMessage> read(Duration block);

  @Override
  void close();
}
