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

package fr.aneo.seisflow.domain.storage;

import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.StorageException;

/**
 * Read access to the fragments of stored cubes.
 * <p>
 * Implementations must be safe for concurrent use: one client is shared by every worker of every part
 * that reads from the same storage location.
 */
@FunctionalInterface
public interface BlobStorage {

  /**
   * Downloads one fragment.
   *
   * @param context     cancellation scope of the calling part; implementations should give up early once
   *                    it is cancelled
   * @param credentials credentials of the query
   * @param fragmentId  identifier of the fragment, {@code <guid>/<fragment>}
   * @return the fragment bytes
   * @throws StorageException if the fragment cannot be read
   */
  byte[] get(CancellationContext context, Credentials credentials, String fragmentId);
}
