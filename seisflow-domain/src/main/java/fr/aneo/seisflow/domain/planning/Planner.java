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

package fr.aneo.seisflow.domain.planning;

import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.QueryPlan;
import fr.aneo.seisflow.domain.exception.PlanningException;

/**
 * Turns a query into an ordered list of task descriptors plus a process header.
 * <p>
 * Planners are pure: they perform no I/O and keep no state between calls, so a single instance may be
 * shared by concurrent callers.
 */
@FunctionalInterface
public interface Planner {

  /**
   * Plans a query whose process id has already been assigned.
   *
   * @param query the query to plan
   * @return the task plan
   * @throws PlanningException if the query is invalid or the planner fails
   */
  QueryPlan plan(Query query);
}
