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

package fr.aneo.seisflow.api;

import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.exception.SeisflowException;

/**
 * Thrown when the log of a process holds an error entry in place of a part.
 */
public class ResultFailedException extends SeisflowException {

  public ResultFailedException(ProcessId pid, String reason) {
    super("process " + pid.asString() + " failed: " + reason);
  }

  public ResultFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
