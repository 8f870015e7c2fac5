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
 * One entry of a per-process result log.
 * <p>
 * A terminal part writes exactly one entry: a {@link Part} holding its packed bytes, or a
 * {@link Failure} holding the reason it could not be produced.
 */
public sealed interface ResultEntry {

  /**
   * Field name used for failure entries in the broker log.
   */
  String ERROR_FIELD = "error";

  static Failure failure(Throwable throwable) {
    String msg = (throwable == null)
      ? "Unknown error"
      : (throwable.getMessage() != null ? throwable.getMessage() : throwable.toString());
    return new Failure(msg);
  }

  record Part(PartLabel label, byte[] body) implements ResultEntry {
    public Part {
      requireNonNull(label, "label cannot be null");
      requireNonNull(body, "body cannot be null");
    }

    @Override
    public String toString() {
      return "Part{label=" + label + ", body=" + body.length + " bytes}";
    }
  }

  record Failure(String message) implements ResultEntry {
    public Failure {
      if (message == null) {
        message = "Unknown error";
      }
    }
  }
}
