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

import fr.aneo.seisflow.domain.ResultEntry;

import java.time.Duration;
import java.util.List;

/**
 * Sequential reader of a per-process result log.
 */
public interface ResultCursor extends AutoCloseable {

  /**
   * Returns the entries appended since the previous call, waiting up to {@code block} for at least one.
   *
   * @param block maximum time to wait
   * @return new entries in log order, empty when the wait timed out
   */
  List<ResultEntry> next(Duration block);

  @Override
  void close();
}
