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

import com.github.benmanes.caffeine.cache.Cache;
import fr.aneo.seisflow.domain.StorageLocation;
import fr.aneo.seisflow.domain.exception.StorageException;
import fr.aneo.seisflow.domain.storage.BlobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Storage clients keyed by storage kind and endpoint.
 * <p>
 * The registry is built once at start-up with one factory per supported kind and handed to the
 * components that download fragments. Clients are created on first use and then shared, since a client
 * for a given {@code kind::endpoint} serves every part reading from it.
 */
public final class BlobStorageRegistry {
  private static final Logger logger = LoggerFactory.getLogger(BlobStorageRegistry.class);

  public static final String FILE = "file";

  private final Map<String, Function<String, BlobStorage>> factories;
  private final Map<String, BlobStorage> clients = new ConcurrentHashMap<>();

  public BlobStorageRegistry(Map<String, Function<String, BlobStorage>> factories) {
    this.factories = Map.copyOf(requireNonNull(factories, "factories cannot be null"));
  }

  /**
   * Creates a registry supporting local file storage behind a shared fragment cache.
   *
   * @param allowedRoot directory every file endpoint must live in, or {@code null} to allow any directory
   * @param cacheBytes  size bound of the fragment cache, 0 to disable caching
   * @return the registry
   */
  public static BlobStorageRegistry withDefaults(Path allowedRoot, long cacheBytes) {
    var root = allowedRoot == null ? null : allowedRoot.toAbsolutePath().normalize();
    Cache<CachingBlobStorage.FragmentKey, byte[]> cache = cacheBytes > 0 ? CachingBlobStorage.newCache(cacheBytes) : null;

    Function<String, BlobStorage> file = endpoint -> {
      var directory = Path.of(endpoint).toAbsolutePath().normalize();
      if (root != null && !directory.startsWith(root)) {
        throw new StorageException(StorageException.Kind.PERMISSION_DENIED, "storage endpoint " + endpoint + " is outside of " + root);
      }
      BlobStorage storage = new FileBlobStorage(directory);
      return cache == null ? storage : new CachingBlobStorage(storage, FILE + "::" + directory, cache);
    };
    return new BlobStorageRegistry(Map.of(FILE, file));
  }

  /**
   * Returns the client of a storage location, creating it on first use.
   *
   * @param location storage kind and endpoint
   * @return the shared client
   * @throws StorageException if the kind is not supported or the endpoint is rejected
   */
  public BlobStorage get(StorageLocation location) {
    requireNonNull(location, "location cannot be null");
    var factory = factories.get(location.kind());
    if (factory == null) {
      throw new StorageException(StorageException.Kind.INTERNAL, "unsupported storage kind '" + location.kind() + "'");
    }
    return clients.computeIfAbsent(location.key(), key -> {
      logger.info("Creating {} storage client for {}", location.kind(), location.endpoint());
      return factory.apply(location.endpoint());
    });
  }
}
