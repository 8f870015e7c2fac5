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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiServerConfigTest {

  @Test
  @DisplayName("Should fill defaults for missing settings")
  void should_fill_defaults() {
    // when
    var config = new ApiServerConfig(9000, null, 5, null, null);

    // then
    assertThat(config.stream()).isEqualTo("jobs");
    assertThat(config.resultTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.processTtl()).isEqualTo(Duration.ofMinutes(10));
  }

  @Test
  @DisplayName("Should only change the port when rebinding")
  void should_change_port_only() {
    // given
    var config = ApiServerConfig.defaults();

    // when
    var rebound = config.withPort(0);

    // then
    assertThat(rebound.port()).isZero();
    assertThat(rebound).usingRecursiveComparison().ignoringFields("port").isEqualTo(config);
  }

  @ParameterizedTest(name = "port={0}, taskSize={1}, timeoutMs={2}")
  @CsvSource({
    "-1, 10, 1000",
    "65536, 10, 1000",
    "8080, 0, 1000",
    "8080, 10, 0",
    "8080, 10, -5"
  })
  @DisplayName("Should reject invalid settings")
  void should_reject_invalid_settings(int port, int taskSize, long timeoutMs) {
    assertThatThrownBy(() -> new ApiServerConfig(port, null, taskSize, Duration.ofMillis(timeoutMs), null))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
