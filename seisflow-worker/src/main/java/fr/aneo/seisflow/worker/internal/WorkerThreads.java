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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories of the fetch worker. Every thread is a named daemon.
 */
public final class WorkerThreads {

  private WorkerThreads() {
  }

  /**
   * Creates an unbounded executor reusing idle threads, for downloads and gatherers.
   *
   * @param prefix thread name prefix
   * @return the executor
   */
  public static ExecutorService cached(String prefix) {
    return Executors.newCachedThreadPool(named(prefix));
  }

  public static ExecutorService single(String name) {
    return Executors.newSingleThreadExecutor(named(name));
  }

  static ThreadFactory named(String prefix) {
    var counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
