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

import fr.aneo.seisflow.api.internal.ResultGrpcService;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.broker.TaskQueue;
import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.fragments.FragmentListPlanner;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * gRPC server exposing query submission and result retrieval.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><strong>Construction</strong>: {@link #create(TaskQueue, ResultStore, ApiServerConfig)}</li>
 *   <li><strong>Start</strong>: {@link #start()} binds the port and starts serving</li>
 *   <li><strong>Shutdown</strong>: {@link #shutdown()} stops accepting calls and waits up to 30 seconds
 *       for in-flight calls, then cancels them</li>
 * </ol>
 * Streaming calls hold a server thread while they wait for parts; their wait is bounded by
 * {@link ApiServerConfig#resultTimeout()}.
 */
public final class ApiServer {
  private static final Logger logger = LoggerFactory.getLogger(ApiServer.class);

  private final ApiServerConfig config;
  private final ResultGrpcService service;
  private Server server;

  private ApiServer(ApiServerConfig config, ResultGrpcService service) {
    this.config = config;
    this.service = service;
  }

  public static ApiServer create(TaskQueue queue, ResultStore results, ApiServerConfig config) {
    requireNonNull(queue, "queue cannot be null");
    requireNonNull(results, "results cannot be null");
    requireNonNull(config, "config cannot be null");

    var codec = new GsonMessageCodec();
    var scheduler = new DefaultScheduler(new FragmentListPlanner(codec, config.taskSize()), queue, results, config.processTtl());
    var reader = new ResultReader(results, codec, config.resultTimeout());
    return new ApiServer(config, new ResultGrpcService(scheduler, reader, codec));
  }

  /**
   * Binds the configured port and starts serving.
   *
   * @throws IOException           if the port cannot be bound
   * @throws IllegalStateException if the server was already started
   */
  public synchronized void start() throws IOException {
    if (server != null) throw new IllegalStateException("server already started");

    server = NettyServerBuilder.forAddress(new InetSocketAddress("0.0.0.0", config.port()))
                               .permitKeepAliveWithoutCalls(true)
                               .permitKeepAliveTime(30, SECONDS)
                               .keepAliveTime(30, SECONDS)
                               .keepAliveTimeout(10, SECONDS)
                               .maxInboundMessageSize(8 * 1024 * 1024)
                               .addService(service)
                               .build()
                               .start();
    logger.info("Result API listening on port {}", server.getPort());
  }

  public synchronized void shutdown() throws InterruptedException {
    if (server == null) {
      logger.info("Shutdown requested but server was not running.");
      return;
    }
    logger.info("Shutting down result API...");
    server.shutdown();
    if (!server.awaitTermination(30, SECONDS)) {
      logger.warn("Graceful shutdown timed out. Forcing shutdown...");
      server.shutdownNow();
      server.awaitTermination(5, SECONDS);
    }
    logger.info("Result API stopped.");
  }

  public void blockUntilShutdown() throws InterruptedException {
    if (server != null) server.awaitTermination();
  }

  /**
   * Returns the bound port, which differs from the configured one when it was 0.
   *
   * @return the listening port, or -1 if the server is not started
   */
  public int port() {
    return server == null ? -1 : server.getPort();
  }
}
