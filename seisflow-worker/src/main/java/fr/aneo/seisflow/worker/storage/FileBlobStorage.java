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

import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.concurrent.CancellationContext;
import fr.aneo.seisflow.domain.exception.StorageException;
import fr.aneo.seisflow.domain.storage.BlobStorage;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static fr.aneo.seisflow.domain.exception.StorageException.Kind.INTERNAL;
import static fr.aneo.seisflow.domain.exception.StorageException.Kind.NOT_FOUND;
import static fr.aneo.seisflow.domain.exception.StorageException.Kind.PERMISSION_DENIED;
import static java.util.Objects.requireNonNull;

/**
 * Blob storage backed by a local directory: fragment {@code <guid>/<id>} is the file
 * {@code <root>/<guid>/<id>}. Credentials are not checked; access control is left to the file system.
 */
public final class FileBlobStorage implements BlobStorage {

  private final Path root;

  public FileBlobStorage(Path root) {
    this.root = requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public byte[] get(CancellationContext context, Credentials credentials, String fragmentId) {
    requireNonNull(context, "context cannot be null");
    requireNonNull(fragmentId, "fragmentId cannot be null");
    context.throwIfCancelled();

    var path = root.resolve(fragmentId).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new StorageException(PERMISSION_DENIED, "fragment " + fragmentId + " is outside of " + root);
    }
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      throw new StorageException(NOT_FOUND, "no such fragment: " + fragmentId, e);
    } catch (AccessDeniedException e) {
      throw new StorageException(PERMISSION_DENIED, "access denied to fragment: " + fragmentId, e);
    } catch (IOException e) {
      throw new StorageException(INTERNAL, "unable to read fragment " + fragmentId + ": " + e.getMessage(), e);
    }
  }
}
