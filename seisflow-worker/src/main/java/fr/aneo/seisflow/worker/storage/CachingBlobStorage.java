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
import com.github.benmanes.caffeine.cache.Caffeine;
import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.storage.BlobStorage;

import static java.util.Objects.requireNonNull;

/**
 * Fragment cache in front of a storage client.
 * <p>
 * Entries are keyed by storage location, credentials and fragment id, so a hit never serves bytes to a
 * caller whose credentials were not used to download them. The cache is bounded by the total size of
 * the cached fragments and may be shared by the clients of several locations.
 */
public final class CachingBlobStorage implements BlobStorage {

  private final BlobStorage delegate;
  private final String location;
  private final Cache<FragmentKey, byte[]> cache;

  public CachingBlobStorage(BlobStorage delegate, String location, Cache<FragmentKey, byte[]> cache) {
    this.delegate = requireNonNull(delegate, "delegate cannot be null");
    this.location = requireNonNull(location, "location cannot be null");
    this.cache = requireNonNull(cache, "cache cannot be null");
  }

  /**
   * Creates a fragment cache holding at most {@code maxBytes} bytes of fragments.
   *
   * @param maxBytes size bound of the cache
   * @return a new, empty cache
   */
  public static Cache<FragmentKey, byte[]> newCache(long maxBytes) {
    if (maxBytes < 0) throw new IllegalArgumentException("maxBytes cannot be negative");
    return Caffeine.newBuilder()
                   .maximumWeight(maxBytes)
                   .weigher((FragmentKey key, byte[] chunk) -> chunk.length)
                   .build();
  }

  @Override
  public byte[] get(CancellationContext context, Credentials credentials, String fragmentId) {
    var key = new FragmentKey(location, credentials.token(), fragmentId);
    var cached = cache.getIfPresent(key);
    if (cached != null) return cached.clone();

    var chunk = delegate.get(context, credentials, fragmentId);
    cache.put(key, chunk.clone());
    return chunk;
  }

  public record FragmentKey(String location, String token, String fragmentId) {
    @Override
    public String toString() {
      return "FragmentKey{location=" + location + ", fragmentId=" + fragmentId + "}";
    }
  }
}
