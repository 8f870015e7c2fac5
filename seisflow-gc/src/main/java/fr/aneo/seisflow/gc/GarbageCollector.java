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

package fr.aneo.seisflow.gc;

import fr.aneo.seisflow.domain.ConsumerInfo;
import fr.aneo.seisflow.domain.broker.ConsumerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Removes consumers that stopped reading from a consumer group.
 * <p>
 * Every worker registers itself in the group the first time it reads, and the broker keeps the registration
 * after the worker is gone. A consumer idle longer than the threshold is removed; a live worker that was
 * merely idle registers again on its next read. Tasks are read without acknowledgement, so removing a
 * consumer never drops pending work.
 *
 * <h2>Errors</h2>
 * A failure to list or remove a consumer aborts the run with a
 * {@link fr.aneo.seisflow.domain.exception.BrokerException}; consumers removed before the failure stay removed.
 */
public final class GarbageCollector {
  private static final Logger logger = LoggerFactory.getLogger(GarbageCollector.class);

  private final ConsumerRegistry registry;
  private final GarbageCollectorConfig config;

  public GarbageCollector(ConsumerRegistry registry, GarbageCollectorConfig config) {
    this.registry = requireNonNull(registry, "registry cannot be null");
    this.config = requireNonNull(config, "config cannot be null");
  }

  public CollectionReport collect() {
    var idle = new ArrayList<String>();
    var retained = new ArrayList<String>();
    for (ConsumerInfo consumer : registry.consumers(config.stream(), config.group())) {
      if (consumer.idleLongerThan(config.threshold())) {
        idle.add(consumer.name());
      } else {
        retained.add(consumer.name());
      }
    }

    for (String name : idle) {
      logger.info("Removing consumer {} from group {} in stream {}{}", name, config.group(), config.stream(), config.dryRun() ? " (dry run)" : "");
      if (!config.dryRun()) {
        registry.remove(config.stream(), config.group(), name);
      }
    }

    var report = new CollectionReport(idle, retained, config.dryRun());
    logger.info("Garbage collection of {}/{} done: {} removed, {} retained", config.stream(), config.group(), report.removed().size(), retained.size());
    return report;
  }
}
