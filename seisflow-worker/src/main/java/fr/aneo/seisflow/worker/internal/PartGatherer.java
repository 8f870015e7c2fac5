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
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.Task;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.BrokerException;
import fr.aneo.seisflow.domain.exception.ReassemblyContractViolation;
import fr.aneo.seisflow.domain.exception.ReassemblyException;
import fr.aneo.seisflow.domain.reassembly.Reassembler;
import fr.aneo.seisflow.domain.reassembly.ReassemblyLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Reassembles one task part from the fragments downloaded by its {@link FetchWorkerPool} and writes the
 * outcome to the result store.
 *
 * <h2>States</h2>
 * <pre>
 * INIT ──fragments()──▶ ENUMERATED ──gather()──▶ COLLECTING ──▶ COMPLETE
 *                                                     │
 *                                                     └──────▶ FAILED
 * </pre>
 * <ul>
 *   <li><strong>INIT</strong>: the task was decoded and a reassembly handle was created by
 *       {@link #exec(TaskMessage, MessageCodec, ReassemblyLibrary, Duration)}</li>
 *   <li><strong>ENUMERATED</strong>: the fragment ids were listed, which can happen only once</li>
 *   <li><strong>COLLECTING</strong>: fragments are handed to the reassembly as they arrive, in any order.
 *       Errors are checked before fragments on every cycle, and so is cancellation of the part context</li>
 *   <li><strong>FAILED</strong>: an error entry replaces the part in the log and the part context is
 *       cancelled so that sibling downloads stop</li>
 *   <li><strong>COMPLETE</strong>: the packed part is appended to the log under its label</li>
 * </ul>
 * Both terminal states refresh the time to live of the process and release the reassembly handle.
 * A gatherer is used once and is not thread-safe; only {@link #close()} may be called from any thread.
 */
public final class PartGatherer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PartGatherer.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(50);

  public enum State {
    INIT,
    ENUMERATED,
    COLLECTING,
    FAILED,
    COMPLETE
  }

  private final Task task;
  private final Reassembler reassembler;
  private final Duration ttl;
  private final CancellationContext context = CancellationContext.create();
  private final AtomicBoolean released = new AtomicBoolean();
  private volatile State state = State.INIT;

  private PartGatherer(Task task, Reassembler reassembler, Duration ttl) {
    this.task = task;
    this.reassembler = reassembler;
    this.ttl = ttl;
  }

  /**
   * Reconstructs a task from its broker message and creates its reassembly handle.
   *
   * @param message task message read from the queue
   * @param codec   codec of task descriptors
   * @param library reassembly library
   * @param ttl     time to live of the process keys, refreshed on every write
   * @return a gatherer in state {@link State#INIT}
   * @throws ReassemblyException if the task cannot be decoded or is rejected by the library
   */
  public static PartGatherer exec(TaskMessage message, MessageCodec codec, ReassemblyLibrary library, Duration ttl) {
    requireNonNull(message, "message cannot be null");
    requireNonNull(codec, "codec cannot be null");
    requireNonNull(library, "library cannot be null");
    requireNonNull(ttl, "ttl cannot be null");

    Task task;
    try {
      var raw = message.task();
      task = new Task(message.pid(), message.part(), codec.decodeTask(raw), raw);
    } catch (IllegalArgumentException e) {
      throw new ReassemblyException("malformed task " + message.part() + " of " + message.pid().asString(), e);
    }
    return new PartGatherer(task, library.init(task.spec().function(), task.raw()), ttl);
  }

  public Task task() {
    return task;
  }

  public CancellationContext context() {
    return context;
  }

  public State state() {
    return state;
  }

  /**
   * Lists the fragment ids to download, in index order.
   *
   * @return the fragment ids
   * @throws IllegalStateException if the fragments were already enumerated
   */
  public List<String> fragments() {
    if (state != State.INIT) throw new IllegalStateException("fragments can only be enumerated once, state is " + state);
    var fragments = List.copyOf(reassembler.fragments());
    state = State.ENUMERATED;
    return fragments;
  }

  /**
   * Collects {@code nfragments} fragments and writes the outcome of the part, then releases the handle.
   *
   * @param results    result store receiving the part or the failure
   * @param nfragments number of fragments to wait for
   * @param fragments  fragment queue of the part's pool
   * @param errors     error queue of the part's pool
   * @throws ReassemblyContractViolation if every fragment was accepted but the part cannot be packed
   */
  public void gather(ResultStore results,
                     int nfragments,
                     BlockingQueue<Fragment> fragments,
                     BlockingQueue<Throwable> errors) {
    requireNonNull(results, "results cannot be null");
    requireNonNull(fragments, "fragments cannot be null");
    requireNonNull(errors, "errors cannot be null");
    if (state != State.ENUMERATED) throw new IllegalStateException("gather requires enumerated fragments, state is " + state);

    state = State.COLLECTING;
    long startTime = System.nanoTime();
    try {
      int received = 0;
      while (received < nfragments) {
        var error = errors.poll();
        if (error == null && context.isCancelled()) {
          error = context.cause().orElseGet(() -> new CancellationException("operation was cancelled"));
        }
        if (error != null) {
          fail(results, error, errors);
          return;
        }

        var fragment = fragments.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        if (fragment == null) continue;

        try {
          reassembler.add(fragment.index(), fragment.chunk());
        } catch (ReassemblyException e) {
          fail(results, e, errors);
          return;
        }
        received++;
      }

      complete(results);
      logger.info("Part gathered from {} fragments in {} ms", nfragments, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail(results, e, errors);
    } finally {
      close();
    }
  }

  /**
   * Fails the part before its downloads start, for instance when its storage cannot be resolved.
   * <p>
   * The error entry replaces the part in the log, the time to live is refreshed and the handle is released.
   *
   * @param results result store receiving the failure
   * @param cause   reason of the failure
   * @throws IllegalStateException if the part is already being gathered or is terminal
   */
  public void fail(ResultStore results, Throwable cause) {
    requireNonNull(results, "results cannot be null");
    requireNonNull(cause, "cause cannot be null");
    if (state != State.INIT && state != State.ENUMERATED) {
      throw new IllegalStateException("part can only be failed before gathering, state is " + state);
    }
    try {
      markFailed(results, cause);
    } finally {
      close();
    }
  }

  /**
   * Releases the reassembly handle and cancels the part context. Only the first call has an effect.
   */
  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) return;
    try {
      reassembler.close();
    } finally {
      context.cancel();
    }
  }

  private void complete(ResultStore results) {
    byte[] packed;
    try {
      packed = reassembler.pack();
    } catch (RuntimeException e) {
      state = State.FAILED;
      logger.error("Reassembly accepted every fragment but cannot pack the part: {}", e.getMessage(), e);
      throw new ReassemblyContractViolation("cannot pack part " + task.part() + " of " + task.pid().asString(), e);
    }

    state = State.COMPLETE;
    write(results, new ResultEntry.Part(task.part(), packed));
  }

  private void fail(ResultStore results, Throwable cause, BlockingQueue<Throwable> errors) {
    Throwable extra;
    while ((extra = errors.poll()) != null) {
      logger.debug("Discarding additional error: {}", describe(extra));
    }
    markFailed(results, cause);
  }

  private void markFailed(ResultStore results, Throwable cause) {
    state = State.FAILED;
    context.cancel(cause);
    logger.warn("Part failed: {}", describe(cause));
    write(results, ResultEntry.failure(cause));
  }

  private void write(ResultStore results, ResultEntry entry) {
    ProcessId pid = task.pid();
    try {
      results.append(pid, entry);
      results.expire(pid, ttl);
    } catch (BrokerException e) {
      logger.error("Unable to write {} of {} to the result store", task.part(), pid.asString(), e);
    }
  }

  private static String describe(Throwable throwable) {
    return throwable.getMessage() != null ? throwable.getMessage() : throwable.toString();
  }
}
