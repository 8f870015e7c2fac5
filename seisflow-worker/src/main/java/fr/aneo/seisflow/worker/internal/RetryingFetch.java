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

import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.StorageException;
import fr.aneo.seisflow.worker.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Downloads a fragment, retrying transient storage failures with exponential backoff.
 * <p>
 * No attempt starts once the context is cancelled, and backoff waits end as soon as it is.
 */
final class RetryingFetch {
  private static final Logger logger = LoggerFactory.getLogger(RetryingFetch.class);

  private RetryingFetch() {
  }

  static byte[] fetch(FetchJob job, CancellationContext context, RetryPolicy policy) throws InterruptedException {
    requireNonNull(job, "job must not be null");
    requireNonNull(context, "context must not be null");
    requireNonNull(policy, "policy must not be null");

    for (int attempt = 0; ; attempt++) {
      context.throwIfCancelled();
      try {
        return job.storage().get(context, job.credentials(), job.fragmentId());
      } catch (StorageException e) {
        if (!shouldRetry(e, attempt, policy)) throw e;

        var backoff = policy.backoff(attempt + 1);
        logger.warn("Download of {} failed ({}), retrying after backoff. Retry {}/{}, backoff {} ms",
          job.fragmentId(), e.getMessage(), attempt + 1, policy.maxRetries(), backoff.toMillis());
        context.await(backoff);
      }
    }
  }

  private static boolean shouldRetry(StorageException e, int attempt, RetryPolicy policy) {
    if (attempt >= policy.maxRetries()) {
      if (policy.maxRetries() > 0) logger.warn("Max retries exhausted after {} attempts", attempt + 1);
      return false;
    }
    if (e.kind() != StorageException.Kind.INTERNAL) {
      logger.debug("Storage error {} is not retryable", e.kind());
      return false;
    }
    return true;
  }
}
