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

package fr.aneo.seisflow.domain.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parsing of human-written durations used on command lines, such as {@code 30m}, {@code 10s},
 * {@code 1h30m} or {@code 250ms}. ISO-8601 input ({@code PT30M}) is accepted as well.
 */
public final class Durations {

  private static final Pattern COMPONENT = Pattern.compile("(\\d+)(ms|h|m|s)");

  private Durations() {
  }

  /**
   * Parses a duration.
   *
   * @param text duration text
   * @return the parsed duration
   * @throws IllegalArgumentException if the text is not a valid duration
   */
  public static Duration parse(String text) {
    if (text == null || text.isBlank()) throw new IllegalArgumentException("duration cannot be blank");

    var trimmed = text.trim();
    if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
      try {
        return Duration.parse(trimmed);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("invalid duration: " + text, e);
      }
    }

    var matcher = COMPONENT.matcher(trimmed);
    var total = Duration.ZERO;
    int end = 0;
    while (matcher.find()) {
      if (matcher.start() != end) throw new IllegalArgumentException("invalid duration: " + text);
      long amount = Long.parseLong(matcher.group(1));
      total = total.plus(switch (matcher.group(2)) {
        case "h" -> Duration.ofHours(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "s" -> Duration.ofSeconds(amount);
        default -> Duration.ofMillis(amount);
      });
      end = matcher.end();
    }
    if (end == 0 || end != trimmed.length()) throw new IllegalArgumentException("invalid duration: " + text);
    return total;
  }
}
