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

import fr.aneo.seisflow.domain.Fragment;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.worker.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Bounded set of workers downloading the fragments of one task part.
 * <p>
 * The pool owns three queues, each sized to the number of workers:
 * <ul>
 *   <li>the job queue, fed by {@link #submit(FetchJob)}</li>
 *   <li>the fragment queue, on which workers publish downloaded bytes</li>
 *   <li>the error queue, on which a worker publishes the failure that made it retire</li>
 * </ul>
 * All workers share the part's {@link CancellationContext}. Once it is cancelled no new download starts,
 * workers holding a job publish a cancellation error and stop, and idle workers exit quietly.
 * The pool knows nothing about parts or reassembly: it only moves bytes.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #start(Executor)} launches the workers</li>
 *   <li>{@link #submit(FetchJob)} is called once per fragment</li>
 *   <li>{@link #close()} tells workers that no more jobs will come; they exit once the queue is drained</li>
 * </ol>
 */
public final class FetchWorkerPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(FetchWorkerPool.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(50);

  private final int jobs;
  private final RetryPolicy retryPolicy;
  private final CancellationContext context;
  private final BlockingQueue<FetchJob> tasks;
  private final BlockingQueue<Fragment> fragments;
  private final BlockingQueue<Throwable> errors;
  private final CountDownLatch terminated;
  private volatile boolean closed;
  private volatile boolean started;

  public FetchWorkerPool(int jobs, RetryPolicy retryPolicy, CancellationContext context) {
    if (jobs < 1) throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
    this.jobs = jobs;
    this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy cannot be null");
    this.context = requireNonNull(context, "context cannot be null");
    this.tasks = new ArrayBlockingQueue<>(jobs);
    this.fragments = new ArrayBlockingQueue<>(jobs);
    this.errors = new ArrayBlockingQueue<>(jobs);
    this.terminated = new CountDownLatch(jobs);
  }

  /**
   * Launches the workers on the given executor.
   *
   * @param executor executor providing at least {@code jobs} concurrent threads
   * @throws IllegalStateException if the pool was already started
   */
  public void start(Executor executor) {
    requireNonNull(executor, "executor cannot be null");
    if (started) throw new IllegalStateException("pool already started");
    started = true;

    var mdc = MDC.getCopyOfContextMap();
    for (int i = 0; i < jobs; i++) {
      executor.execute(() -> {
        if (mdc != null) MDC.setContextMap(mdc);
        try {
          work();
        } finally {
          MDC.clear();
          terminated.countDown();
        }
      });
    }
  }

  /**
   * Hands a job to the workers, waiting for room in the job queue.
   *
   * @param job the download to perform
   * @return {@code true} if the job was accepted, {@code false} if the context was cancelled first
   * @throws InterruptedException  if the calling thread is interrupted while waiting
   * @throws IllegalStateException if the pool was closed
   */
  public boolean submit(FetchJob job) throws InterruptedException {
    requireNonNull(job, "job cannot be null");
    if (closed) throw new IllegalStateException("pool is closed");

    while (!tasks.offer(job, POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
      if (context.isCancelled()) return false;
    }
    return true;
  }

  public BlockingQueue<Fragment> fragments() {
    return fragments;
  }

  public BlockingQueue<Throwable> errors() {
    return errors;
  }

  /**
   * Waits for every worker to exit.
   *
   * @param timeout maximum wait
   * @return {@code true} if every worker exited
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void close() {
    closed = true;
  }

  private void work() {
    try {
      while (true) {
        var job = tasks.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        if (job == null) {
          if (context.isCancelled() || (closed && tasks.isEmpty())) return;
          continue;
        }
        if (context.isCancelled()) {
          publishError(new CancellationException("operation was cancelled"));
          return;
        }

        byte[] chunk;
        try {
          chunk = RetryingFetch.fetch(job, context, retryPolicy);
        } catch (CancellationException e) {
          publishError(e);
          return;
        } catch (RuntimeException e) {
          logger.warn("Download of fragment {} ({}) failed: {}", job.index(), job.fragmentId(), e.getMessage());
          publishError(e);
          return;
        }

        if (!publishFragment(new Fragment(job.index(), chunk))) return;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      publishError(e);
    }
  }

  private boolean publishFragment(Fragment fragment) throws InterruptedException {
    while (!fragments.offer(fragment, POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
      if (context.isCancelled()) return false;
    }
    return true;
  }

  private void publishError(Throwable error) {
    // Each worker publishes at most one error and the queue holds one per worker.
    if (!errors.offer(error)) {
      logger.error("Error queue is full, dropping {}", error.toString());
    }
  }
}
