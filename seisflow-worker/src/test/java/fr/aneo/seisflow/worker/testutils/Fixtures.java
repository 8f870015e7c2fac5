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

package fr.aneo.seisflow.worker.testutils;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.PartLabel;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.StorageLocation;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.TaskSpec;
import fr.aneo.seisflow.domain.broker.InMemoryBroker;
import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.fragments.FragmentListPlanner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class Fixtures {

  public static final String GUID = "cube";

  private Fixtures() {
  }

  public static JsonObject fragmentArgs(List<String> ids, int offset) {
    var fragments = new JsonArray();
    ids.forEach(fragments::add);
    var args = new JsonObject();
    args.add("fragments", fragments);
    args.addProperty("offset", offset);
    return args;
  }

  public static TaskMessage taskMessage(ProcessId pid, PartLabel part, List<String> ids, Path root) {
    var spec = new TaskSpec(pid, "fragments", GUID, new StorageLocation("file", root.toString()), Credentials.ANONYMOUS, fragmentArgs(ids, 0));
    return new TaskMessage("1-0", pid, part, new GsonMessageCodec().encodeTask(spec));
  }

  /**
   * Writes fragments {@code f0..f(n-1)} under {@code <root>/cube}, fragment {@code fi} holding {@code "chunk-i"}.
   */
  public static void writeFragments(Path root, int n) throws IOException {
    var dir = Files.createDirectories(root.resolve(GUID));
    for (int i = 0; i < n; i++) {
      Files.write(dir.resolve("f" + i), ("chunk-" + i).getBytes(UTF_8));
    }
  }

  /**
   * Plans a {@code fragments} query over {@code f0..f(n-1)} and schedules it on the broker.
   *
   * @return the process id
   */
  public static ProcessId schedule(InMemoryBroker broker, Path root, int n, int taskSize) {
    var ids = new JsonArray();
    for (int i = 0; i < n; i++) ids.add("f" + i);
    var args = new JsonObject();
    args.add("fragments", ids);

    var pid = ProcessId.random();
    var query = new Query(pid, "fragments", GUID, new StorageLocation("file", root.toString()), Credentials.ANONYMOUS, args);
    var plan = new FragmentListPlanner(new GsonMessageCodec(), taskSize).plan(query);

    broker.putHeader(pid, plan.header());
    for (int i = 0; i < plan.ntasks(); i++) {
      broker.publish(TaskMessage.unpublished(pid, new PartLabel(i, plan.ntasks()), plan.tasks().get(i)));
    }
    return pid;
  }

  public static boolean eventually(BooleanSupplier condition, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) return true;
      Thread.sleep(20);
    }
    return condition.getAsBoolean();
  }
}
