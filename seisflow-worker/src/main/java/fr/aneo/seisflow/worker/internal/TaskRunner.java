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

package fr.aneo.seisflow.worker.internal;

import fr.aneo.seisflow.domain.Task;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.broker.TaskConsumer;
import fr.aneo.seisflow.domain.broker.TaskQueue;
import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.exception.BrokerException;
import fr.aneo.seisflow.domain.exception.ReassemblyContractViolation;
import fr.aneo.seisflow.domain.exception.SeisflowException;
import fr.aneo.seisflow.domain.reassembly.ReassemblyLibrary;
import fr.aneo.seisflow.worker.FetchWorkerConfig;
import fr.aneo.seisflow.worker.storage.BlobStorageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Consumer loop of a fetch worker.
 * <p>
 * The loop reads one task message at a time from the queue, waiting at most one heartbeat per read, and
 * requests deletion of every message it read without waiting for the outcome: a task read by a worker
 * that crashes before finishing it is lost, and the reader of its process eventually times out.
 * <p>
 * Each message gets a fresh {@link PartGatherer} and {@link FetchWorkerPool}. The gatherer runs in the
 * background while the loop feeds the pool; the loop moves on to the next message once every fragment
 * of the current one has been handed to a worker.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>a message that cannot be decoded, initialized or enumerated is logged and dropped</li>
 *   <li>a part whose storage cannot be resolved gets an error entry, like a failed download</li>
 *   <li>a failed read or a failed deletion stops the loop</li>
 *   <li>a {@link ReassemblyContractViolation} raised by a gatherer stops the loop</li>
 * </ul>
 */
public final class TaskRunner implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);

  private final TaskQueue queue;
  private final TaskConsumer consumer;
  private final ResultStore results;
  private final MessageCodec codec;
  private final ReassemblyLibrary library;
  private final BlobStorageRegistry storages;
  private final FetchWorkerConfig config;
  private final Executor workers;
  private final Executor deletions;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private volatile boolean running = true;

  public TaskRunner(TaskQueue queue,
                    TaskConsumer consumer,
                    ResultStore results,
                    MessageCodec codec,
                    ReassemblyLibrary library,
                    BlobStorageRegistry storages,
                    FetchWorkerConfig config,
                    Executor workers,
                    Executor deletions) {
    this.queue = requireNonNull(queue, "queue cannot be null");
    this.consumer = requireNonNull(consumer, "consumer cannot be null");
    this.results = requireNonNull(results, "results cannot be null");
    this.codec = requireNonNull(codec, "codec cannot be null");
    this.library = requireNonNull(library, "library cannot be null");
    this.storages = requireNonNull(storages, "storages cannot be null");
    this.config = requireNonNull(config, "config cannot be null");
    this.workers = requireNonNull(workers, "workers cannot be null");
    this.deletions = requireNonNull(deletions, "deletions cannot be null");
  }

  @Override
  public void run() {
    logger.info("Consumer {} in group {} reading from stream {}", config.consumerId(), config.group(), config.stream());
    try {
      while (running) {
        var messages = consumer.read(config.heartbeat());
        if (messages.isEmpty()) continue;

        delete(messages);
        for (var message : messages) {
          if (!running) break;
          handle(message);
        }
      }
    } catch (BrokerException e) {
      fail(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.info("Consumer loop interrupted");
    } finally {
      running = false;
      consumer.close();
      logger.info("Consumer {} stopped", config.consumerId());
    }
  }

  /**
   * Asks the loop to stop after the current message.
   */
  public void stop() {
    running = false;
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Returns the error that stopped the loop, if any.
   *
   * @return the fatal error
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure.get());
  }

  /**
   * Starts the processing of one task message.
   *
   * @param message message read from the queue
   * @throws InterruptedException if interrupted while handing fragments to the pool
   */
  void handle(TaskMessage message) throws InterruptedException {
    MDC.put("pid", message.pid().asString());
    MDC.put("part", message.part().asString());
    try {
      PartGatherer gatherer;
      try {
        gatherer = PartGatherer.exec(message, codec, library, config.processTtl());
      } catch (SeisflowException e) {
        logger.warn("Dropping bad process: {}", e.getMessage(), e);
        return;
      }

      List<String> ids;
      try {
        ids = gatherer.fragments();
      } catch (SeisflowException | IllegalStateException e) {
        logger.warn("Dropping bad process: {}", e.getMessage(), e);
        gatherer.close();
        return;
      }

      List<FetchJob> jobs;
      try {
        jobs = jobsOf(gatherer.task(), ids);
      } catch (SeisflowException | IllegalArgumentException e) {
        gatherer.fail(results, e);
        return;
      }

      var pool = new FetchWorkerPool(config.jobs(), config.retryPolicy(), gatherer.context());
      pool.start(workers);
      var mdc = MDC.getCopyOfContextMap();
      workers.execute(() -> gather(gatherer, pool, jobs.size(), mdc));

      logger.debug("Scheduling {} fragment downloads", jobs.size());
      try {
        for (var job : jobs) {
          if (!pool.submit(job)) {
            logger.info("Part cancelled after {} of {} downloads were scheduled", job.index(), jobs.size());
            break;
          }
        }
      } finally {
        pool.close();
      }
    } finally {
      MDC.remove("pid");
      MDC.remove("part");
    }
  }

  private List<FetchJob> jobsOf(Task task, List<String> ids) {
    var spec = task.spec();
    var storage = storages.get(spec.storage());

    var jobs = new ArrayList<FetchJob>(ids.size());
    for (int i = 0; i < ids.size(); i++) {
      jobs.add(new FetchJob(i, spec.guid() + "/" + ids.get(i), storage, spec.credentials()));
    }
    return jobs;
  }

  private void gather(PartGatherer gatherer, FetchWorkerPool pool, int nfragments, Map<String, String> mdc) {
    if (mdc != null) MDC.setContextMap(mdc);
    try {
      gatherer.gather(results, nfragments, pool.fragments(), pool.errors());
    } catch (ReassemblyContractViolation e) {
      fail(e);
    } catch (RuntimeException e) {
      logger.error("Unexpected failure while gathering", e);
    } finally {
      MDC.clear();
    }
  }

  private void delete(List<TaskMessage> messages) {
    var ids = messages.stream().map(TaskMessage::id).toList();
    CompletableFuture.runAsync(() -> queue.delete(ids), deletions)
                     .exceptionally(throwable -> {
                       fail(new BrokerException("unable to delete " + ids + " from " + config.stream(), throwable));
                       return null;
                     });
  }

  private void fail(Throwable error) {
    if (failure.compareAndSet(null, error)) {
      logger.error("Fetch worker stopping after fatal error", error);
    }
    running = false;
  }
}
