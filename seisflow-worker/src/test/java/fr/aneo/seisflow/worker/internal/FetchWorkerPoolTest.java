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

import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.Fragment;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.StorageException;
import fr.aneo.seisflow.domain.storage.BlobStorage;
import fr.aneo.seisflow.worker.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FetchWorkerPoolTest {

  private ExecutorService executor;
  private BlobStorage storage;
  private CancellationContext context;

  @BeforeEach
  void setUp() {
    executor = WorkerThreads.cached("test-fetch");
    storage = mock(BlobStorage.class);
    context = CancellationContext.create();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("Should download every submitted fragment")
  void should_download_every_fragment() throws Exception {
    // given
    when(storage.get(any(), any(), anyString())).thenAnswer(invocation -> invocation.getArgument(2, String.class).getBytes(UTF_8));
    var pool = new FetchWorkerPool(2, RetryPolicy.none(), context);
    pool.start(executor);

    // when
    for (int i = 0; i < 5; i++) {
      assertThat(pool.submit(job(i))).isTrue();
    }
    pool.close();

    // then
    var received = new ArrayList<Fragment>();
    for (int i = 0; i < 5; i++) {
      received.add(pool.fragments().poll(5, TimeUnit.SECONDS));
    }
    assertThat(received).extracting(Fragment::index).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
    assertThat(received).allSatisfy(fragment -> assertThat(new String(fragment.chunk(), UTF_8)).isEqualTo("cube/f" + fragment.index()));
    assertThat(pool.awaitTermination(Duration.ofSeconds(5))).isTrue();
    assertThat(pool.errors()).isEmpty();
  }

  @Test
  @DisplayName("Should publish the error of a failed download and retire the worker")
  void should_publish_download_error() throws Exception {
    // given
    when(storage.get(any(), any(), eq("cube/f0"))).thenThrow(new StorageException(StorageException.Kind.NOT_FOUND, "no such fragment: cube/f0"));
    var pool = new FetchWorkerPool(1, RetryPolicy.none(), context);
    pool.start(executor);

    // when
    pool.submit(job(0));
    pool.close();

    // then
    var error = pool.errors().poll(5, TimeUnit.SECONDS);
    assertThat(error).isInstanceOf(StorageException.class).hasMessageContaining("cube/f0");
    assertThat(pool.awaitTermination(Duration.ofSeconds(5))).isTrue();
  }

  @Test
  @DisplayName("Should start no download once the part context is cancelled")
  void should_not_fetch_after_cancellation() throws Exception {
    // given
    var pool = new FetchWorkerPool(2, RetryPolicy.none(), context);
    context.cancel(new StorageException(StorageException.Kind.INTERNAL, "sibling failed"));
    pool.start(executor);

    // when
    pool.submit(job(0));
    pool.submit(job(1));
    pool.close();

    // then
    assertThat(pool.awaitTermination(Duration.ofSeconds(5))).isTrue();
    verify(storage, never()).get(any(), any(), anyString());
    assertThat(pool.fragments()).isEmpty();
    assertThat(pool.errors()).allSatisfy(error -> assertThat(error).isInstanceOf(CancellationException.class));
  }

  @Test
  @DisplayName("Should refuse new jobs once the queue is full and the context is cancelled")
  void should_refuse_jobs_after_cancellation() throws Exception {
    // given
    var pool = new FetchWorkerPool(1, RetryPolicy.none(), context);
    assertThat(pool.submit(job(0))).isTrue();

    // when
    context.cancel();

    // then
    assertThat(pool.submit(job(1))).isFalse();
  }

  @Test
  @DisplayName("Should let idle workers exit quietly when cancelled")
  void should_exit_quietly_when_idle_and_cancelled() throws Exception {
    // given
    var pool = new FetchWorkerPool(3, RetryPolicy.none(), context);
    pool.start(executor);

    // when
    context.cancel();

    // then
    assertThat(pool.awaitTermination(Duration.ofSeconds(5))).isTrue();
    assertThat(pool.errors()).isEmpty();
  }

  @Test
  @DisplayName("Should reject submissions after close")
  void should_reject_submissions_after_close() {
    var pool = new FetchWorkerPool(1, RetryPolicy.none(), context);
    pool.close();

    assertThatThrownBy(() -> pool.submit(job(0))).isInstanceOf(IllegalStateException.class);
  }

  private FetchJob job(int index) {
    return new FetchJob(index, "cube/f" + index, storage, Credentials.ANONYMOUS);
  }
}
