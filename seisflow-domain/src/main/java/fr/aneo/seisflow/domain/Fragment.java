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
 * Bytes downloaded for one fragment, tagged with the fragment's index in its task's enumeration.
 *
 * @param index position assigned at enumeration time
 * @param chunk downloaded bytes
 */
public record Fragment(int index, byte[] chunk) {

  public Fragment {
    requireNonNull(chunk, "chunk cannot be null");
    if (index < 0) throw new IllegalArgumentException("index cannot be negative: " + index);
  }

  @Override
  public String toString() {
    return "Fragment{index=" + index + ", chunk=" + chunk.length + " bytes}";
  }
}
