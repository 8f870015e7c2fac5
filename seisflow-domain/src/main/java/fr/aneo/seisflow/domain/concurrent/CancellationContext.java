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

package fr.aneo.seisflow.domain.concurrent;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Cancellation scope shared by the cooperating threads of one unit of work.
 * <p>
 * A context starts live and can be cancelled once; later calls to {@link #cancel(Throwable)} are
 * ignored and the first cause wins. Every participant polls {@link #isCancelled()} at its suspension
 * points, or waits on {@link #await(Duration)} instead of sleeping so that it wakes up as soon as the
 * scope is cancelled.
 * <p>
 * One context is created per task part; cancelling it stops the fetches of that part only.
 */
public final class CancellationContext {

  private final CompletableFuture<Void> done = new CompletableFuture<>();
  private final AtomicReference<Throwable> cause = new AtomicReference<>();

  private CancellationContext() {
  }

  public static CancellationContext create() {
    return new CancellationContext();
  }

  /**
   * Cancels this context with a generic cause.
   *
   * @return {@code true} if this call cancelled the context
   */
  public boolean cancel() {
    return cancel(new CancellationException("operation was cancelled"));
  }

  /**
   * Cancels this context with the given cause.
   *
   * @param cause why the work is being cancelled
   * @return {@code true} if this call cancelled the context, {@code false} if it was already cancelled
   */
  public boolean cancel(Throwable cause) {
    requireNonNull(cause, "cause cannot be null");
    if (!this.cause.compareAndSet(null, cause)) return false;
    done.complete(null);
    return true;
  }

  public boolean isCancelled() {
    return cause.get() != null;
  }

  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause.get());
  }

  /**
   * Returns a stage that completes once this context is cancelled.
   *
   * @return completion signal of this context
   */
  public CompletionStage<Void> done() {
    return done.minimalCompletionStage();
  }

  /**
   * Throws if this context was cancelled.
   *
   * @throws CancellationException if the context is cancelled
   */
  public void throwIfCancelled() {
    if (isCancelled()) {
      var exception = new CancellationException("operation was cancelled");
      exception.initCause(cause.get());
      throw exception;
    }
  }

  /**
   * Waits until this context is cancelled or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if the context is cancelled
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean await(Duration timeout) throws InterruptedException {
    requireNonNull(timeout, "timeout cannot be null");
    if (isCancelled()) return true;
    try {
      done.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      throw new IllegalStateException("cancellation signal cannot complete exceptionally", e);
    }
  }
}
