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

import fr.aneo.seisflow.domain.PartLabel;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.QueryPlan;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.broker.TaskQueue;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.BrokerException;
import fr.aneo.seisflow.domain.exception.SchedulingException;
import fr.aneo.seisflow.domain.planning.Planner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;

import static java.util.Objects.requireNonNull;

/**
 * {@link Scheduler} writing headers to a {@link ResultStore} and tasks to a {@link TaskQueue}.
 */
public final class DefaultScheduler implements Scheduler {
  private static final Logger logger = LoggerFactory.getLogger(DefaultScheduler.class);

  private final Planner planner;
  private final TaskQueue queue;
  private final ResultStore results;
  private final Duration processTtl;

  public DefaultScheduler(Planner planner, TaskQueue queue, ResultStore results, Duration processTtl) {
    this.planner = requireNonNull(planner, "planner cannot be null");
    this.queue = requireNonNull(queue, "queue cannot be null");
    this.results = requireNonNull(results, "results cannot be null");
    this.processTtl = requireNonNull(processTtl, "processTtl cannot be null");
  }

  @Override
  public QueryPlan makeQuery(Query query) {
    return planner.plan(query);
  }

  @Override
  public void schedule(CancellationContext context, ProcessId pid, QueryPlan plan) {
    requireNonNull(context, "context cannot be null");
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(plan, "plan cannot be null");

    results.putHeader(pid, plan.header());

    int ntasks = plan.ntasks();
    try {
      enqueue(context, pid, plan);
    } catch (SchedulingException e) {
      // The header has no expiry yet; a partially scheduled process must still expire.
      try {
        results.expire(pid, processTtl);
      } catch (BrokerException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }

    try {
      results.expire(pid, processTtl);
    } catch (BrokerException e) {
      throw new SchedulingException("unable to set the expiry of " + pid.asString(), e);
    }
    logger.info("Scheduled process {} with {} tasks", pid.asString(), ntasks);
  }

  private void enqueue(CancellationContext context, ProcessId pid, QueryPlan plan) {
    int ntasks = plan.ntasks();
    for (int i = 0; i < ntasks; i++) {
      if (context.isCancelled()) {
        var cause = context.cause().orElseGet(() -> new CancellationException("operation was cancelled"));
        throw new SchedulingException("scheduling of " + pid.asString() + " cancelled after " + i + " of " + ntasks + " tasks", cause);
      }
      var part = new PartLabel(i, ntasks);
      try {
        queue.publish(TaskMessage.unpublished(pid, part, plan.tasks().get(i)));
      } catch (BrokerException e) {
        throw new SchedulingException("unable to enqueue task " + part + " of " + pid.asString(), e);
      }
    }
  }

  @Override
  public ProcessId submit(Query query) {
    requireNonNull(query, "query cannot be null");
    var pid = ProcessId.random();
    var plan = makeQuery(query.withPid(pid));
    schedule(CancellationContext.create(), pid, plan);
    return pid;
  }
}
