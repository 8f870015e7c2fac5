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

import fr.aneo.seisflow.domain.ProcessId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static fr.aneo.seisflow.api.ProcessStatus.State.FAILED;
import static fr.aneo.seisflow.api.ProcessStatus.State.FINISHED;
import static fr.aneo.seisflow.api.ProcessStatus.State.WORKING;
import static org.assertj.core.api.Assertions.assertThat;

class ProcessStatusTest {

  private final ProcessId pid = ProcessId.random();

  @Test
  @DisplayName("Should point pending processes at their status without progress")
  void should_describe_pending_process() {
    // when
    var status = ProcessStatus.pending(pid);

    // then
    assertThat(status.state().asString()).isEqualTo("pending");
    assertThat(status.progress()).isEmpty();
    assertThat(status.location()).isEqualTo("result/" + pid.asString() + "/status");
  }

  @Test
  @DisplayName("Should point finished processes at their result")
  void should_point_finished_process_at_result() {
    // when
    var status = new ProcessStatus(pid, FINISHED, 3, 3);

    // then
    assertThat(status.progress()).isEqualTo("3/3");
    assertThat(status.location()).isEqualTo("result/" + pid.asString());
  }

  @Test
  @DisplayName("Should keep working and failed processes on their status location")
  void should_keep_unfinished_process_on_status() {
    // when
    var working = new ProcessStatus(pid, WORKING, 1, 4);
    var failed = new ProcessStatus(pid, FAILED, 4, 4);

    // then
    assertThat(working.progress()).isEqualTo("1/4");
    assertThat(working.location()).endsWith("/status");
    assertThat(failed.state().asString()).isEqualTo("failed");
    assertThat(failed.location()).endsWith("/status");
  }
}
