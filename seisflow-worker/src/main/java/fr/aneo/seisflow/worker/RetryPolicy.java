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

import java.time.Duration;

import static java.time.temporal.ChronoUnit.MILLIS;
import static java.time.temporal.ChronoUnit.SECONDS;

/**
 * Retry settings of a single fragment download.
 * <p>
 * A fragment is attempted at most {@code maxRetries + 1} times. Waits between attempts grow
 * exponentially from {@code initialBackoff} by {@code backoffMultiplier} and are capped at
 * {@code maxBackoff}. Only transient storage failures are retried.
 *
 * @param maxRetries        number of retries after the first attempt, between 0 and {@link #MAX_RETRIES}
 * @param initialBackoff    wait before the first retry
 * @param maxBackoff        upper bound of any wait
 * @param backoffMultiplier growth factor of consecutive waits, at least 1.0
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff, double backoffMultiplier) {

  /**
   * Hard ceiling on retries, whatever the configuration says.
   */
  public static final int MAX_RETRIES = 10;

  public RetryPolicy {
    initialBackoff = initialBackoff == null ? Duration.of(100, MILLIS) : initialBackoff;
    maxBackoff = maxBackoff == null ? Duration.of(5, SECONDS) : maxBackoff;

    if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
      throw new IllegalArgumentException("maxRetries must be in [0, " + MAX_RETRIES + "], got " + maxRetries);
    }
    if (initialBackoff.isNegative()) {
      throw new IllegalArgumentException("initialBackoff must be positive");
    }
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be greater than initialBackoff");
    }
  }

  public static RetryPolicy none() {
    return withRetries(0);
  }

  public static RetryPolicy withRetries(int maxRetries) {
    return new RetryPolicy(maxRetries, null, null, 2.0);
  }

  /**
   * Returns the wait before the given retry.
   *
   * @param retry one-based retry number
   * @return the capped backoff
   */
  public Duration backoff(int retry) {
    if (retry <= 1) return initialBackoff;

    var multiplier = Math.pow(backoffMultiplier, retry - 1);
    var backoffMillis = (long) (initialBackoff.toMillis() * multiplier);
    var cappedMillis = Math.min(backoffMillis, maxBackoff.toMillis());

    return Duration.ofMillis(cappedMillis);
  }
}
