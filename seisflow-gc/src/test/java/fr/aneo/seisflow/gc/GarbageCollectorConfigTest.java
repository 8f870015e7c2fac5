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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GarbageCollectorConfigTest {

  @Test
  @DisplayName("Should default to the fetch group of the jobs stream with a 30 minute threshold")
  void should_use_defaults() {
    // when
    var config = GarbageCollectorConfig.defaults();

    // then
    assertThat(config.stream()).isEqualTo("jobs");
    assertThat(config.group()).isEqualTo("fetch");
    assertThat(config.threshold()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.dryRun()).isFalse();
  }

  @Test
  @DisplayName("Should reject a negative threshold and blank names")
  void should_reject_invalid_settings() {
    assertThatThrownBy(() -> new GarbageCollectorConfig(null, null, Duration.ofSeconds(-1), false))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new GarbageCollectorConfig(" ", null, null, false))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new GarbageCollectorConfig(null, "", null, false))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
