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

package fr.aneo.seisflow.api;

import fr.aneo.seisflow.domain.fragments.FragmentListPlanner;
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
 * Command line entry point of the result API server.
 *
 * <pre>
 * seisflow-api --redis broker:6379 [--port 8080] [--task-size 10] [--result-timeout 60s]
 * </pre>
 * {@code --redis} defaults to the {@code REDIS_URL} environment variable and {@code --redis-password}
 * to {@code REDIS_PASSWORD}.
 */
public final class ApiServerMain {
  private static final Logger logger = LoggerFactory.getLogger(ApiServerMain.class);

  private ApiServerMain() {
  }

  public static void main(String[] args) throws IOException {
    var parser = new OptionParser();
    OptionSpec<String> redis = parser.accepts("redis", "Broker address, host:port or redis:// URI").withRequiredArg();
    OptionSpec<String> password = parser.accepts("redis-password", "Redis password").withRequiredArg();
    OptionSpec<Void> secure = parser.accepts("secure", "Connect to Redis with TLS");
    OptionSpec<Integer> port = parser.accepts("port", "Listening port").withRequiredArg().ofType(Integer.class).defaultsTo(ApiServerConfig.DEFAULT_PORT);
    OptionSpec<String> stream = parser.accepts("stream", "Task queue stream").withRequiredArg().defaultsTo(ApiServerConfig.DEFAULT_STREAM);
    OptionSpec<Integer> taskSize = parser.accepts("task-size", "Maximum number of fragments per task").withRequiredArg().ofType(Integer.class).defaultsTo(FragmentListPlanner.DEFAULT_TASK_SIZE);
    OptionSpec<String> resultTimeout = parser.accepts("result-timeout", "How long Get and Stream wait for missing parts, e.g. 60s").withRequiredArg().defaultsTo("60s");
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
      System.err.println("Missing required option(s): --redis");
      parser.printHelpOn(System.err);
      System.exit(2);
      return;
    }

    try {
      var redisPassword = options.has(password) ? options.valueOf(password) : System.getenv("REDIS_PASSWORD");
      var config = new ApiServerConfig(options.valueOf(port),
                                       options.valueOf(stream),
                                       options.valueOf(taskSize),
                                       Durations.parse(options.valueOf(resultTimeout)),
                                       null);
      var broker = RedisBroker.connect(new RedisConfig(address, redisPassword, options.has(secure), null), config.stream());

      var server = ApiServer.create(broker, broker, config);
      server.start();

      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        try {
          server.shutdown();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } finally {
          broker.close();
        }
      }, "seisflow-api-shutdown"));

      server.blockUntilShutdown();
    } catch (Exception e) {
      logger.error("Result API failed", e);
      System.exit(1);
    }
  }
}
