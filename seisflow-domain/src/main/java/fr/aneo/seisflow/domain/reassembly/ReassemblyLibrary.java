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

package fr.aneo.seisflow.domain.reassembly;

import fr.aneo.seisflow.domain.exception.ReassemblyException;

/**
 * Factory of {@link Reassembler} handles, one per task part.
 */
@FunctionalInterface
public interface ReassemblyLibrary {

  /**
   * Creates a reassembly handle for a task of the given function.
   *
   * @param function extraction function of the task
   * @param task     raw task descriptor bytes
   * @return a fresh handle owned by the caller
   * @throws ReassemblyException if the function is unknown or the descriptor is rejected
   */
  Reassembler init(String function, byte[] task);
}
