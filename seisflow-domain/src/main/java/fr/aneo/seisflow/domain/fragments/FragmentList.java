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

package fr.aneo.seisflow.domain.fragments;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument layout shared by the planner and the reassembly of the {@code fragments} function.
 * <p>
 * A query lists fragment ids under {@code args.fragments}. Each task carries its own slice of that list
 * plus the position of the slice's first id in the query list under {@code args.offset}.
 */
final class FragmentList {

  static final String FUNCTION = "fragments";
  static final String FRAGMENTS = "fragments";
  static final String OFFSET = "offset";

  private FragmentList() {
  }

  /**
   * Reads the fragment ids of an argument object.
   *
   * @param args function arguments
   * @return the fragment ids, possibly empty
   * @throws IllegalArgumentException if {@code fragments} is missing or holds anything but strings
   */
  static List<String> idsOf(JsonObject args) {
    var value = args.get(FRAGMENTS);
    if (value == null || !value.isJsonArray()) {
      throw new IllegalArgumentException("'" + FRAGMENTS + "' must be an array of fragment ids, got: " + value);
    }
    var ids = new ArrayList<String>();
    for (var element : value.getAsJsonArray()) {
      if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString() || element.getAsString().isBlank()) {
        throw new IllegalArgumentException("fragment ids must be non-blank strings, got: " + element);
      }
      ids.add(element.getAsString());
    }
    return ids;
  }

  static int offsetOf(JsonObject args) {
    var value = args.get(OFFSET);
    if (value == null) return 0;
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber() || value.getAsInt() < 0) {
      throw new IllegalArgumentException("'" + OFFSET + "' must be a non-negative integer, got: " + value);
    }
    return value.getAsInt();
  }

  static JsonObject argsOf(List<String> ids, int offset) {
    var fragments = new JsonArray(ids.size());
    ids.forEach(fragments::add);

    var args = new JsonObject();
    args.add(FRAGMENTS, fragments);
    args.addProperty(OFFSET, offset);
    return args;
  }
}
