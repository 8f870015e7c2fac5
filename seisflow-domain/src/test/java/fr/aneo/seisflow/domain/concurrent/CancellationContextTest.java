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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationContextTest {

  @Test
  @DisplayName("Should keep the first cancellation cause")
  void should_keep_first_cause() {
    // given
    var context = CancellationContext.create();
    var first = new IllegalStateException("first");

    // when
    var cancelled = context.cancel(first);
    var cancelledAgain = context.cancel(new IllegalStateException("second"));

    // then
    assertThat(cancelled).isTrue();
    assertThat(cancelledAgain).isFalse();
    assertThat(context.isCancelled()).isTrue();
    assertThat(context.cause()).containsSame(first);
    assertThat(context.done().toCompletableFuture()).isDone();
  }

  @Test
  @DisplayName("Should throw a cancellation exception carrying the cause once cancelled")
  void should_throw_once_cancelled() {
    // given
    var context = CancellationContext.create();
    context.throwIfCancelled();
    var cause = new RuntimeException("boom");

    // when
    context.cancel(cause);

    // then
    assertThatThrownBy(context::throwIfCancelled)
      .isInstanceOf(CancellationException.class)
      .hasCause(cause);
  }

  @Test
  @DisplayName("Should wake up a waiting thread when cancelled")
  void should_wake_up_waiter_on_cancel() throws Exception {
    // given
    var context = CancellationContext.create();
    var woken = new CountDownLatch(1);
    var waiter = new Thread(() -> {
      try {
        if (context.await(Duration.ofSeconds(30))) woken.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();

    // when
    context.cancel();

    // then
    assertThat(woken.await(5, TimeUnit.SECONDS)).isTrue();
    waiter.join(5_000);
  }

  @Test
  @DisplayName("Should time out when nobody cancels")
  void should_time_out_when_not_cancelled() throws InterruptedException {
    assertThat(CancellationContext.create().await(Duration.ofMillis(20))).isFalse();
  }
}
