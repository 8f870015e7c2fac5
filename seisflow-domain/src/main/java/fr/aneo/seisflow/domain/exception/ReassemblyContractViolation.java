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

package fr.aneo.seisflow.domain.exception;

/**
 * Raised when a part that received every fragment cannot be packed.
 * <p>
 * A pack failure after a complete sequence of accepted fragments means the reassembly library broke
 * its own contract. The worker that observes it stops consuming instead of writing a result.
 */
public class ReassemblyContractViolation extends SeisflowException {

  public ReassemblyContractViolation(String message, Throwable cause) {
    super(message, cause);
  }
}
