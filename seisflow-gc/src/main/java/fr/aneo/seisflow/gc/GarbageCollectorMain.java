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

import fr.aneo.seisflow.domain.util.Durations;
import fr.aneo.seisflow.redis.RedisBroker;
import fr.aneo.seisflow.redis.RedisConfig;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command line entry point of the consumer garbage collector, meant to run periodically.
 *
 * <pre>
 * seisflow-gc --redis queue:6379 [--stream jobs] [--group fetch] [--threshold 30m] [--dry-run]
 * </pre>
 */
public final class GarbageCollectorMain {
  private static final Logger logger = LoggerFactory.getLogger(GarbageCollectorMain.class);

  private GarbageCollectorMain() {
  }

  public static void main(String[] args) throws IOException {
    var parser = new OptionParser();
    OptionSpec<String> redis = parser.accepts("redis", "Task queue address, host:port or redis:// URI").withRequiredArg();
    OptionSpec<String> password = parser.accepts("redis-password", "Redis password").withRequiredArg();
    OptionSpec<Void> secure = parser.accepts("secure", "Connect to Redis with TLS");
    OptionSpec<String> stream = parser.accepts("stream", "Stream to garbage collect").withRequiredArg().defaultsTo(GarbageCollectorConfig.DEFAULT_STREAM);
    OptionSpec<String> group = parser.accepts("group", "Consumer group to garbage collect").withRequiredArg().defaultsTo(GarbageCollectorConfig.DEFAULT_GROUP);
    OptionSpec<String> threshold = parser.accepts("threshold", "Idle time before a consumer is removed, e.g. 30m").withRequiredArg().defaultsTo("30m");
    parser.accepts("dry-run", "Only show what would be removed");
    parser.accepts("help", "Show help").forHelp();

    OptionSet options;
    try {
      options = parser.parse(args);
    } catch (OptionException e) {
      System.err.println(e.getMessage());
      parser.printHelpOn(System.err);
      System.exit(2);
      return;
    }
    if (options.has("help")) {
      parser.printHelpOn(System.out);
      return;
    }

    var address = options.has(redis) ? options.valueOf(redis) : System.getenv("REDIS_URL");
    if (address == null || address.isBlank()) {
      System.err.println("Missing required option: --redis");
      parser.printHelpOn(System.err);
      System.exit(2);
      return;
    }
    var redisPassword = options.has(password) ? options.valueOf(password) : System.getenv("REDIS_PASSWORD");

    try {
      var config = new GarbageCollectorConfig(options.valueOf(stream),
                                              options.valueOf(group),
                                              Durations.parse(options.valueOf(threshold)),
                                              options.has("dry-run"));
      try (var broker = RedisBroker.connect(new RedisConfig(address, redisPassword, options.has(secure), null), config.stream())) {
        new GarbageCollector(broker, config).collect();
      }
    } catch (Exception e) {
      logger.error("Garbage collection failed", e);
      System.exit(1);
    }
  }
}
