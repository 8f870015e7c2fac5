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

import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.fragments.FragmentListReassembly;
import fr.aneo.seisflow.domain.util.Durations;
import fr.aneo.seisflow.redis.RedisBroker;
import fr.aneo.seisflow.redis.RedisConfig;
import fr.aneo.seisflow.worker.storage.BlobStorageRegistry;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Command line entry point of a fetch worker.
 *
 * <pre>
 * seisflow-worker --redis cache:6379 --source queue:6379 [--jobs 30] [--retries 0] [--heartbeat 10s]
 * </pre>
 * {@code --redis} and {@code --source} default to the {@code REDIS_URL} environment variable, and
 * {@code --redis-password} to {@code REDIS_PASSWORD}.
 */
public final class FetchWorkerMain {
  private static final Logger logger = LoggerFactory.getLogger(FetchWorkerMain.class);

  private FetchWorkerMain() {
  }

  public static void main(String[] args) throws IOException {
    var parser = new OptionParser();
    OptionSpec<String> redis = parser.accepts("redis", "Result store address, host:port or redis:// URI").withRequiredArg();
    OptionSpec<String> source = parser.accepts("source", "Task queue address, host:port or redis:// URI").withRequiredArg();
    OptionSpec<String> password = parser.accepts("redis-password", "Redis password").withRequiredArg();
    OptionSpec<Void> secure = parser.accepts("secure", "Connect to Redis with TLS");
    OptionSpec<String> stream = parser.accepts("stream", "Task queue stream").withRequiredArg().defaultsTo(FetchWorkerConfig.DEFAULT_STREAM);
    OptionSpec<String> group = parser.accepts("group", "Consumer group").withRequiredArg().defaultsTo(FetchWorkerConfig.DEFAULT_GROUP);
    OptionSpec<String> consumerId = parser.accepts("consumer-id", "Consumer name, random when absent").withRequiredArg();
    OptionSpec<Integer> jobs = parser.accepts("jobs", "Concurrent downloads per part").withRequiredArg().ofType(Integer.class).defaultsTo(FetchWorkerConfig.DEFAULT_JOBS);
    OptionSpec<Integer> retries = parser.accepts("retries", "Retries per fragment download").withRequiredArg().ofType(Integer.class).defaultsTo(0);
    OptionSpec<String> heartbeat = parser.accepts("heartbeat", "Maximum wait of one queue read, e.g. 10s").withRequiredArg().defaultsTo("10s");
    OptionSpec<String> storageRoot = parser.accepts("storage-root", "Directory every file storage endpoint must live in").withRequiredArg();
    OptionSpec<Long> cacheBytes = parser.accepts("cache-bytes", "Fragment cache size in bytes, 0 disables caching").withRequiredArg().ofType(Long.class).defaultsTo(256L * 1024 * 1024);
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

    var resultAddress = valueOrEnv(options, redis, "REDIS_URL");
    var sourceAddress = valueOrEnv(options, source, "REDIS_URL");
    if (resultAddress == null || sourceAddress == null) {
      System.err.println("Missing required option(s): " + (resultAddress == null ? "--redis " : "") + (sourceAddress == null ? "--source" : ""));
      parser.printHelpOn(System.err);
      System.exit(2);
      return;
    }

    try {
      var redisPassword = valueOrEnv(options, password, "REDIS_PASSWORD");
      Duration block = Durations.parse(options.valueOf(heartbeat));
      var config = new FetchWorkerConfig(options.valueOf(stream),
                                         options.valueOf(group),
                                         options.valueOf(consumerId),
                                         options.valueOf(jobs),
                                         RetryPolicy.withRetries(options.valueOf(retries)),
                                         block,
                                         null);
      var root = options.has(storageRoot) ? Path.of(options.valueOf(storageRoot)) : null;

      var sourceConfig = new RedisConfig(sourceAddress, redisPassword, options.has(secure), null).withReadBlock(config.heartbeat());
      var sourceBroker = RedisBroker.connect(sourceConfig, config.stream());
      var resultBroker = sourceAddress.equals(resultAddress)
        ? sourceBroker
        : RedisBroker.connect(new RedisConfig(resultAddress, redisPassword, options.has(secure), null), config.stream());

      var worker = FetchWorker.create(sourceBroker,
                                      resultBroker,
                                      new FragmentListReassembly(new GsonMessageCodec()),
                                      BlobStorageRegistry.withDefaults(root, options.valueOf(cacheBytes)),
                                      config);
      worker.start();

      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        worker.shutdown();
        try {
          if (!worker.awaitTermination(Duration.ofSeconds(30))) {
            logger.warn("In-flight parts did not finish within 30 seconds");
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        sourceBroker.close();
        if (resultBroker != sourceBroker) resultBroker.close();
      }, "seisflow-worker-shutdown"));

      logger.info("Fetch worker started. Waiting for tasks...");
      worker.blockUntilShutdown();

      if (worker.failure().isPresent()) {
        logger.error("Fetch worker stopped after a fatal error", worker.failure().get());
        System.exit(1);
      }
    } catch (Exception e) {
      logger.error("Fetch worker failed to start", e);
      System.exit(1);
    }
  }

  private static String valueOrEnv(OptionSet options, OptionSpec<String> spec, String variable) {
    if (options.has(spec)) return options.valueOf(spec);
    var value = System.getenv(variable);
    return value == null || value.isBlank() ? null : value;
  }
}
