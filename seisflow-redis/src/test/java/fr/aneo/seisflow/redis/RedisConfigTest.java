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

package fr.aneo.seisflow.redis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisConfigTest {

  @Test
  @DisplayName("Should build a URI from a host and port address")
  void should_build_uri_from_host_and_port() {
    // when
    var uri = new RedisConfig("cache:6380", "secret", true, Duration.ofSeconds(5)).toRedisURI();

    // then
    assertThat(uri.getHost()).isEqualTo("cache");
    assertThat(uri.getPort()).isEqualTo(6380);
    assertThat(uri.isSsl()).isTrue();
    assertThat(uri.getPassword()).isEqualTo("secret".toCharArray());
    assertThat(uri.getTimeout()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Should default the port and accept Redis URIs")
  void should_default_port_and_accept_uris() {
    assertThat(RedisConfig.forAddress("cache").toRedisURI().getPort()).isEqualTo(6379);
    assertThat(RedisConfig.forAddress("redis://cache:7000/2").toRedisURI().getDatabase()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should raise the command timeout above blocking reads")
  void should_raise_timeout_above_read_block() {
    // given
    var config = RedisConfig.forAddress("cache:6379");

    // when
    var adjusted = config.withReadBlock(Duration.ofSeconds(120));

    // then
    assertThat(adjusted.commandTimeout()).isEqualTo(Duration.ofSeconds(125));
    assertThat(adjusted.toRedisURI().getTimeout()).isEqualTo(Duration.ofSeconds(125));
    assertThat(adjusted.address()).isEqualTo("cache:6379");
  }

  @Test
  @DisplayName("Should keep a command timeout that already outlasts blocking reads")
  void should_keep_sufficient_timeout() {
    // given
    var config = RedisConfig.forAddress("cache:6379");

    // when / then
    assertThat(config.withReadBlock(Duration.ofSeconds(10))).isSameAs(config);
    assertThat(config.withReadBlock(Duration.ofSeconds(55))).isSameAs(config);
    assertThat(config.withReadBlock(Duration.ofSeconds(60)).commandTimeout()).isEqualTo(Duration.ofSeconds(65));
    assertThatThrownBy(() -> config.withReadBlock(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should never print the password")
  void should_mask_password() {
    assertThat(new RedisConfig("cache:6379", "secret", false, null).toString()).doesNotContain("secret");
  }

  @Test
  @DisplayName("Should reject a blank address")
  void should_reject_blank_address() {
    assertThatThrownBy(() -> RedisConfig.forAddress(" ")).isInstanceOf(IllegalArgumentException.class);
  }
}
