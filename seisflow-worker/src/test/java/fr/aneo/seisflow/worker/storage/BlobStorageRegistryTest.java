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

package fr.aneo.seisflow.worker.storage;

import fr.aneo.seisflow.domain.StorageLocation;
import fr.aneo.seisflow.domain.exception.StorageException;
import fr.aneo.seisflow.domain.storage.BlobStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class BlobStorageRegistryTest {

  @TempDir
  Path root;

  @Test
  @DisplayName("Should create one client per storage location")
  void should_share_clients_per_location() {
    // given
    var created = new AtomicInteger();
    var registry = new BlobStorageRegistry(Map.of("file", endpoint -> {
      created.incrementAndGet();
      return mock(BlobStorage.class);
    }));

    // when
    var first = registry.get(new StorageLocation("file", "/a"));
    var second = registry.get(new StorageLocation("file", "/a"));
    var other = registry.get(new StorageLocation("file", "/b"));

    // then
    assertThat(first).isSameAs(second);
    assertThat(other).isNotSameAs(first);
    assertThat(created).hasValue(2);
  }

  @Test
  @DisplayName("Should reject an unsupported storage kind")
  void should_reject_unknown_kind() {
    var registry = BlobStorageRegistry.withDefaults(root, 0);

    assertThatThrownBy(() -> registry.get(new StorageLocation("azure", "account")))
      .isInstanceOf(StorageException.class)
      .hasMessageContaining("unsupported storage kind 'azure'");
  }

  @Test
  @DisplayName("Should refuse file endpoints outside of the allowed root")
  void should_refuse_endpoint_outside_root() {
    var registry = BlobStorageRegistry.withDefaults(root.resolve("data"), 0);

    assertThatThrownBy(() -> registry.get(new StorageLocation("file", root.resolve("elsewhere").toString())))
      .isInstanceOfSatisfying(StorageException.class, e -> assertThat(e.kind()).isEqualTo(StorageException.Kind.PERMISSION_DENIED));
  }

  @Test
  @DisplayName("Should wrap file clients in the fragment cache when caching is enabled")
  void should_cache_file_clients() {
    var registry = BlobStorageRegistry.withDefaults(root, 1024);

    assertThat(registry.get(new StorageLocation("file", root.toString()))).isInstanceOf(CachingBlobStorage.class);
    assertThat(BlobStorageRegistry.withDefaults(root, 0).get(new StorageLocation("file", root.toString()))).isInstanceOf(FileBlobStorage.class);
  }
}
