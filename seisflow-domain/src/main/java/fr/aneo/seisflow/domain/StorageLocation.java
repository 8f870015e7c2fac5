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

package fr.aneo.seisflow.domain;

import static java.util.Objects.requireNonNull;

/**
 * Where the fragments of a cube live: the storage kind selects the client implementation,
 * the endpoint selects the account, container or directory.
 *
 * @param kind     storage kind, for instance {@code "file"}
 * @param endpoint kind-specific endpoint
 */
public record StorageLocation(String kind, String endpoint) {

  public StorageLocation {
    requireNonNull(kind, "kind cannot be null");
    requireNonNull(endpoint, "endpoint cannot be null");
    if (kind.isBlank()) throw new IllegalArgumentException("storage kind cannot be blank");
  }

  /**
   * Returns the key under which a client for this location is cached.
   *
   * @return {@code kind::endpoint}
   */
  public String key() {
    return kind + "::" + endpoint;
  }
}
