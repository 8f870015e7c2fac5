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

package fr.aneo.seisflow.api;

import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.QueryPlan;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.BrokerException;
import fr.aneo.seisflow.domain.exception.PlanningException;
import fr.aneo.seisflow.domain.exception.SchedulingException;

/**
 * Turns queries into processes: a header in the result store plus one task message per part.
 *
 * <h2>Process identity</h2>
 * <p>
 * Every scheduled query gets a fresh random {@link ProcessId}. Clients use it to poll the status of the
 * process and to retrieve its result; it is never reused.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>planning errors are classified as bad input or internal, see {@link PlanningException}</li>
 *   <li>a failed header write is returned as is and no task is enqueued</li>
 *   <li>a failed task write or a cancellation aborts scheduling; the tasks already enqueued are left
 *       in place and the process expires on its own</li>
 *   <li>nothing is retried</li>
 * </ul>
 */
public interface Scheduler {

  /**
   * Plans a query whose process id is already assigned.
   *
   * @param query the query
   * @return the task descriptors and the process header
   * @throws PlanningException if the query cannot be planned
   */
  QueryPlan makeQuery(Query query);

  /**
   * Writes the process header, enqueues every task and sets the process expiry.
   *
   * @param context cancellation of the scheduling
   * @param pid     process id
   * @param plan    the plan to schedule
   * @throws BrokerException     if the header cannot be written
   * @throws SchedulingException if a task cannot be enqueued or scheduling was cancelled
   */
  void schedule(CancellationContext context, ProcessId pid, QueryPlan plan);

  /**
   * Assigns a new process id to a query, then plans and schedules it.
   *
   * @param query the query; its process id, if any, is replaced
   * @return the new process id
   */
  ProcessId submit(Query query);
}
