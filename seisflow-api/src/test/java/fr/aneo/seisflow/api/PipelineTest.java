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

import com.google.protobuf.ByteString;
import fr.aneo.seisflow.api.grpc.v1.ResultRequest;
import fr.aneo.seisflow.api.grpc.v1.ResultsGrpc;
import fr.aneo.seisflow.api.grpc.v1.SubmitRequest;
import fr.aneo.seisflow.api.testutils.Queries;
import fr.aneo.seisflow.domain.broker.InMemoryBroker;
import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.fragments.FragmentListReassembly;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.worker.FetchWorker;
import fr.aneo.seisflow.worker.FetchWorkerConfig;
import fr.aneo.seisflow.worker.RetryPolicy;
import fr.aneo.seisflow.worker.storage.BlobStorageRegistry;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.msgpack.core.MessagePack;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the whole pipeline in one JVM: the API server and a fetch worker sharing an in-memory broker,
 * fragments read from a temporary directory.
 */
class PipelineTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  @TempDir
  Path root;

  private final GsonMessageCodec codec = new GsonMessageCodec();
  private InMemoryBroker broker;
  private ApiServer server;
  private FetchWorker worker;
  private ManagedChannel channel;
  private ResultsGrpc.ResultsBlockingStub stub;

  @BeforeEach
  void setUp() throws IOException {
    var dir = Files.createDirectories(root.resolve("cube"));
    for (int i = 0; i < 7; i++) {
      Files.write(dir.resolve("f" + i), ("trace-" + i).getBytes(UTF_8));
    }

    broker = new InMemoryBroker("jobs");
    server = ApiServer.create(broker, broker, new ApiServerConfig(0, "jobs", 3, TIMEOUT, null));
    server.start();

    var workerConfig = new FetchWorkerConfig("jobs", "fetch", null, 4, RetryPolicy.none(), Duration.ofMillis(100), null);
    worker = FetchWorker.create(broker, broker, new FragmentListReassembly(codec), BlobStorageRegistry.withDefaults(root, 1024 * 1024), workerConfig);
    worker.start();

    channel = ManagedChannelBuilder.forAddress("localhost", server.port()).usePlaintext().build();
    stub = ResultsGrpc.newBlockingStub(channel).withDeadlineAfter(30, TimeUnit.SECONDS);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    worker.shutdown();
    worker.awaitTermination(TIMEOUT);
    server.shutdown();
  }

  @Test
  @DisplayName("Should finish every part of a query and return them in one document")
  void should_process_query_end_to_end() throws Exception {
    // when
    var pid = submit(7);

    // then
    assertThat(awaitStatus(pid, "finished")).isTrue();
    var status = stub.status(request(pid));
    assertThat(status.getProgress()).isEqualTo("3/3");
    assertThat(status.getLocation()).isEqualTo("result/" + pid.asString());

    var traces = tracesOf(stub.get(request(pid)).getResult().toByteArray());
    assertThat(traces).hasSize(7);
    for (int i = 0; i < 7; i++) {
      assertThat(traces).containsEntry(i, "trace-" + i);
    }
  }

  @Test
  @DisplayName("Should answer status and Get identically once finished")
  void should_be_idempotent_after_completion() throws Exception {
    // given
    var pid = submit(4);
    assertThat(awaitStatus(pid, "finished")).isTrue();

    // when
    var first = stub.get(request(pid)).getResult();
    var second = stub.get(request(pid)).getResult();

    // then
    assertThat(second).isEqualTo(first);
    assertThat(stub.status(request(pid))).isEqualTo(stub.status(request(pid)));
  }

  @Test
  @DisplayName("Should write one entry per task when a fetch fails, and fail Get")
  void should_fail_query_with_missing_fragment() throws Exception {
    // given
    Files.delete(root.resolve("cube").resolve("f4"));

    // when
    var pid = submit(7);

    // then
    assertThat(awaitEntries(pid, 3)).isTrue();
    assertThat(broker.summary(pid).errors()).isEqualTo(1);
    assertThat(stub.status(request(pid)).getStatus()).isEqualTo("failed");
    assertThatThrownBy(() -> stub.get(request(pid)))
      .isInstanceOfSatisfying(StatusRuntimeException.class, e -> assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL));
  }

  private ProcessId submit(int fragments) {
    var query = Queries.fragments(root, fragments);
    var reply = stub.submit(SubmitRequest.newBuilder().setQuery(ByteString.copyFrom(codec.encodeQuery(query))).build());
    return ProcessId.from(reply.getPid());
  }

  private static ResultRequest request(ProcessId pid) {
    return ResultRequest.newBuilder().setPid(pid.asString()).build();
  }

  private boolean awaitStatus(ProcessId pid, String expected) throws InterruptedException {
    long deadline = System.nanoTime() + TIMEOUT.toNanos();
    while (System.nanoTime() < deadline) {
      if (expected.equals(stub.status(request(pid)).getStatus())) return true;
      Thread.sleep(20);
    }
    return false;
  }

  private boolean awaitEntries(ProcessId pid, int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TIMEOUT.toNanos();
    while (System.nanoTime() < deadline) {
      if (broker.summary(pid).entries() == expected) return true;
      Thread.sleep(20);
    }
    return false;
  }

  /**
   * Decodes a result document into fragment index to fragment content.
   */
  private static Map<Integer, String> tracesOf(byte[] result) throws IOException {
    var traces = new HashMap<Integer, String>();
    try (var unpacker = MessagePack.newDefaultUnpacker(result)) {
      assertThat(unpacker.unpackArrayHeader()).isEqualTo(2);
      assertThat(unpacker.unpackMapHeader()).isEqualTo(2);
      assertThat(unpacker.unpackString()).isEqualTo("bundles");
      assertThat(unpacker.unpackInt()).isEqualTo(3);
      assertThat(unpacker.unpackString()).isEqualTo("fragments");
      assertThat(unpacker.unpackInt()).isEqualTo(7);

      int parts = unpacker.unpackArrayHeader();
      for (int p = 0; p < parts; p++) {
        assertThat(unpacker.unpackArrayHeader()).isEqualTo(2);
        int offset = unpacker.unpackInt();
        int n = unpacker.unpackArrayHeader();
        for (int i = 0; i < n; i++) {
          traces.put(offset + i, new String(unpacker.readPayload(unpacker.unpackBinaryHeader()), UTF_8));
        }
      }
    }
    return traces;
  }
}
