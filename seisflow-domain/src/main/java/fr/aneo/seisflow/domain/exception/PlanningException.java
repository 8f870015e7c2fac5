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

import static java.util.Objects.requireNonNull;

/**
 * Raised when a query cannot be planned into tasks.
 * <p>
 * Planning errors are classified so that the transport layer can map them to a response status:
 * a {@link Kind#BAD_INPUT} error is the caller's fault (HTTP 400 analogue), a {@link Kind#INTERNAL}
 * error is a defect or an unavailable dependency (HTTP 500 analogue). Planning errors are never retried.
 */
public class PlanningException extends SeisflowException {

  /**
   * Classification of a planning failure.
   */
  public enum Kind {
    BAD_INPUT(400),
    INTERNAL(500);

    private final int statusHint;

    Kind(int statusHint) {
      this.statusHint = statusHint;
    }

    public int statusHint() {
      return statusHint;
    }
  }

  private final Kind kind;

  private PlanningException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind, "kind cannot be null");
  }

  public static PlanningException badInput(String message) {
    return new PlanningException(Kind.BAD_INPUT, message, null);
  }

  public static PlanningException badInput(String message, Throwable cause) {
    return new PlanningException(Kind.BAD_INPUT, message, cause);
  }

  public static PlanningException internal(String message, Throwable cause) {
    return new PlanningException(Kind.INTERNAL, message, cause);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the HTTP-style status code a caller should see for this error.
   *
   * @return 400 for bad input, 500 otherwise
   */
  public int statusHint() {
    return kind.statusHint();
  }
}
