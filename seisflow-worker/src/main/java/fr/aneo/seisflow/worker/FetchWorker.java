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

package fr.aneo.seisflow.worker;

import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.broker.TaskQueue;
import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.reassembly.ReassemblyLibrary;
import fr.aneo.seisflow.worker.internal.TaskRunner;
import fr.aneo.seisflow.worker.internal.WorkerThreads;
import fr.aneo.seisflow.worker.storage.BlobStorageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * A fetch worker: consumes task messages, downloads their fragments and writes reassembled parts.
 * <p>
 * Any number of fetch workers may run against the same task queue; they join one consumer group and
 * each message is delivered to exactly one of them.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><strong>Construction</strong>: {@link #create(TaskQueue, ResultStore, ReassemblyLibrary, BlobStorageRegistry, FetchWorkerConfig)}</li>
 *   <li><strong>Start</strong>: {@link #start()} creates the consumer group if needed, registers the consumer
 *       and starts the consumer loop on its own thread</li>
 *   <li><strong>Processing</strong>: parts are processed until shutdown or until a fatal error</li>
 *   <li><strong>Shutdown</strong>: {@link #shutdown()} stops the loop after at most one heartbeat</li>
 * </ol>
 *
 * <h2>Fatal errors</h2>
 * <p>
 * A failed read or deletion on the task queue, or a reassembly that cannot pack a complete part, stops
 * the worker. {@link #failure()} then returns the cause and the hosting process is expected to exit
 * with a non-zero status.
 */
public final class FetchWorker {
  private static final Logger logger = LoggerFactory.getLogger(FetchWorker.class);

  private final TaskQueue queue;
  private final ResultStore results;
  private final ReassemblyLibrary library;
  private final BlobStorageRegistry storages;
  private final FetchWorkerConfig config;
  private final ExecutorService workers;
  private final ExecutorService deletions;
  private TaskRunner runner;
  private Thread loop;

  private FetchWorker(TaskQueue queue,
                      ResultStore results,
                      ReassemblyLibrary library,
                      BlobStorageRegistry storages,
                      FetchWorkerConfig config) {
    this.queue = requireNonNull(queue, "queue cannot be null");
    this.results = requireNonNull(results, "results cannot be null");
    this.library = requireNonNull(library, "library cannot be null");
    this.storages = requireNonNull(storages, "storages cannot be null");
    this.config = requireNonNull(config, "config cannot be null");
    this.workers = WorkerThreads.cached("seisflow-fetch");
    this.deletions = WorkerThreads.single("seisflow-delete");
  }

  public static FetchWorker create(TaskQueue queue,
                                   ResultStore results,
                                   ReassemblyLibrary library,
                                   BlobStorageRegistry storages,
                                   FetchWorkerConfig config) {
    return new FetchWorker(queue, results, library, storages, config);
  }

  /**
   * Joins the consumer group and starts consuming.
   *
   * @throws IllegalStateException if the worker was already started
   * @throws fr.aneo.seisflow.domain.exception.BrokerException if the group cannot be created
   */
  public synchronized void start() {
    if (loop != null) throw new IllegalStateException("worker already started");

    queue.createGroup(config.group());
    var consumer = queue.subscribe(config.group(), config.consumerId());
    runner = new TaskRunner(queue, consumer, results, new GsonMessageCodec(), library, storages, config, workers, deletions);

    loop = new Thread(() -> {
      try {
        runner.run();
      } finally {
        deletions.shutdown();
        workers.shutdown();
      }
    }, "seisflow-consumer");
    loop.start();
    logger.info("Fetch worker {} started with {} jobs, {} retries", config.consumerId(), config.jobs(), config.retryPolicy().maxRetries());
  }

  /**
   * Stops consuming. Parts already being gathered run to completion in the background.
   */
  public synchronized void shutdown() {
    if (runner == null) return;
    runner.stop();
    logger.info("Fetch worker {} shutting down", config.consumerId());
  }

  /**
   * Waits for the consumer loop and the in-flight parts to finish.
   *
   * @param timeout maximum wait
   * @return {@code true} if everything finished in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    if (loop != null) {
      loop.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
      if (loop.isAlive()) return false;
    }
    return workers.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
  }

  /**
   * Blocks until the consumer loop stops, because of {@link #shutdown()} or of a fatal error.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public void blockUntilShutdown() throws InterruptedException {
    if (loop != null) loop.join();
  }

  public boolean isRunning() {
    return runner != null && runner.isRunning();
  }

  public Optional<Throwable> failure() {
    return runner == null ? Optional.empty() : runner.failure();
  }

  public FetchWorkerConfig config() {
    return config;
  }
}
