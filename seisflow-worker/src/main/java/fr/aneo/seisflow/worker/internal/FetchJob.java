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

package fr.aneo.seisflow.worker.internal;

import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.storage.BlobStorage;

import static java.util.Objects.requireNonNull;

/**
 * One fragment download.
 *
 * @param index       position of the fragment in its task's enumeration
 * @param fragmentId  storage identifier, {@code <guid>/<fragment>}
 * @param storage     client of the cube's storage location
 * @param credentials credentials of the query
 */
public record FetchJob(int index, String fragmentId, BlobStorage storage, Credentials credentials) {

  public FetchJob {
    requireNonNull(fragmentId, "fragmentId cannot be null");
    requireNonNull(storage, "storage cannot be null");
    requireNonNull(credentials, "credentials cannot be null");
  }
}
