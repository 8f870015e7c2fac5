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
 * Opaque storage credentials forwarded from the query to every fragment download of its tasks.
 * <p>
 * The token is never printed: {@link #toString()} masks it so that credentials can safely appear in
 * log statements that print whole tasks.
 *
 * @param token the credential token, possibly empty for anonymous storage
 */
public record Credentials(String token) {

  public static final Credentials ANONYMOUS = new Credentials("");

  public Credentials {
    requireNonNull(token, "token cannot be null");
  }

  public boolean isAnonymous() {
    return token.isEmpty();
  }

  @Override
  public String toString() {
    return isAnonymous() ? "Credentials{anonymous}" : "Credentials{****}";
  }
}
