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
import java.util.UUID;

import static java.time.temporal.ChronoUnit.MINUTES;
import static java.time.temporal.ChronoUnit.SECONDS;

/**
 * Settings of a fetch worker process.
 *
 * @param stream      name of the task queue stream
 * @param group       consumer group shared by every fetch worker
 * @param consumerId  name of this worker in the group
 * @param jobs        number of concurrent downloads per task part
 * @param retryPolicy retry settings of a single download
 * @param heartbeat   maximum wait of one blocking read on the task queue
 * @param processTtl  time to live of a process's keys, refreshed by every write
 */
public record FetchWorkerConfig(String stream,
                                String group,
                                String consumerId,
                                int jobs,
                                RetryPolicy retryPolicy,
                                Duration heartbeat,
                                Duration processTtl) {

  public static final String DEFAULT_STREAM = "jobs";
  public static final String DEFAULT_GROUP = "fetch";
  public static final int DEFAULT_JOBS = 30;
  public static final Duration DEFAULT_HEARTBEAT = Duration.of(10, SECONDS);
  public static final Duration DEFAULT_PROCESS_TTL = Duration.of(10, MINUTES);

  public FetchWorkerConfig {
    stream = stream == null ? DEFAULT_STREAM : stream;
    group = group == null ? DEFAULT_GROUP : group;
    consumerId = consumerId == null ? "consumer:" + UUID.randomUUID() : consumerId;
    retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    heartbeat = heartbeat == null ? DEFAULT_HEARTBEAT : heartbeat;
    processTtl = processTtl == null ? DEFAULT_PROCESS_TTL : processTtl;

    if (jobs < 1) throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
    if (heartbeat.isNegative() || heartbeat.isZero()) throw new IllegalArgumentException("heartbeat must be positive");
    if (processTtl.isNegative() || processTtl.isZero()) throw new IllegalArgumentException("processTtl must be positive");
  }

  public static FetchWorkerConfig defaults() {
    return new FetchWorkerConfig(null, null, null, DEFAULT_JOBS, null, null, null);
  }

  public FetchWorkerConfig withJobs(int jobs) {
    return new FetchWorkerConfig(stream, group, consumerId, jobs, retryPolicy, heartbeat, processTtl);
  }

  public FetchWorkerConfig withHeartbeat(Duration heartbeat) {
    return new FetchWorkerConfig(stream, group, consumerId, jobs, retryPolicy, heartbeat, processTtl);
  }
}
