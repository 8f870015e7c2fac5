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

package fr.aneo.seisflow.domain.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.seisflow.domain.Credentials;
import fr.aneo.seisflow.domain.ProcessHeader;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.StorageLocation;
import fr.aneo.seisflow.domain.TaskSpec;
import fr.aneo.seisflow.domain.exception.MalformedProcessException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static java.util.Objects.requireNonNull;

/**
 * JSON implementation of {@link MessageCodec} backed by Gson.
 * <p>
 * Queries and task descriptors share one layout with snake_case keys:
 * <pre>
 * {
 *   "pid": "6f1c...",
 *   "function": "fragments",
 *   "guid": "cube-guid",
 *   "storage_kind": "file",
 *   "storage_endpoint": "/data/cubes",
 *   "credentials": "token",
 *   "args": { ... }
 * }
 * </pre>
 * The process header is stored as {@code {"pid": ..., "ntasks": m, "payload": "<base64>"}}.
 */
public final class GsonMessageCodec implements MessageCodec {

  private final Gson gson;

  public GsonMessageCodec() {
    this.gson = new GsonBuilder().disableHtmlEscaping().create();
  }

  @Override
  public byte[] encodeQuery(Query query) {
    requireNonNull(query, "query cannot be null");

    var root = new JsonObject();
    if (query.pid() != null) root.addProperty("pid", query.pid().asString());
    writeCommon(root, query.function(), query.guid(), query.storage(), query.credentials(), query.args());
    return toBytes(root);
  }

  @Override
  public Query decodeQuery(byte[] bytes) {
    requireNonNull(bytes, "bytes cannot be null");

    var root = parseObject(bytes, "query");
    try {
      var pid = root.has("pid") ? ProcessId.from(requireString(root, "pid", "query")) : null;
      return new Query(
        pid,
        requireString(root, "function", "query"),
        requireString(root, "guid", "query"),
        storageOf(root, "query"),
        credentialsOf(root, "query"),
        argsOf(root, "query"));
    } catch (IllegalStateException | NullPointerException e) {
      throw new IllegalArgumentException("Malformed JSON structure in query", e);
    }
  }

  @Override
  public byte[] encodeTask(TaskSpec task) {
    requireNonNull(task, "task cannot be null");

    var root = new JsonObject();
    root.addProperty("pid", task.pid().asString());
    writeCommon(root, task.function(), task.guid(), task.storage(), task.credentials(), task.args());
    return toBytes(root);
  }

  @Override
  public TaskSpec decodeTask(byte[] bytes) {
    requireNonNull(bytes, "bytes cannot be null");

    var root = parseObject(bytes, "task");
    try {
      return new TaskSpec(
        ProcessId.from(requireString(root, "pid", "task")),
        requireString(root, "function", "task"),
        requireString(root, "guid", "task"),
        storageOf(root, "task"),
        credentialsOf(root, "task"),
        argsOf(root, "task"));
    } catch (IllegalStateException | NullPointerException e) {
      throw new IllegalArgumentException("Malformed JSON structure in task", e);
    }
  }

  @Override
  public byte[] encodeHeader(ProcessHeader header) {
    requireNonNull(header, "header cannot be null");

    var root = new JsonObject();
    root.addProperty("pid", header.pid().asString());
    root.addProperty("ntasks", header.ntasks());
    root.addProperty("payload", Base64.getEncoder().encodeToString(header.payload()));
    return toBytes(root);
  }

  @Override
  public ProcessHeader decodeHeader(byte[] bytes) {
    requireNonNull(bytes, "bytes cannot be null");

    try {
      var root = parseObject(bytes, "header");
      var ntasks = root.get("ntasks");
      if (ntasks == null || !ntasks.isJsonPrimitive() || !ntasks.getAsJsonPrimitive().isNumber()) {
        throw new MalformedProcessException("Process header must contain a numeric 'ntasks'");
      }
      var payload = root.has("payload") ? Base64.getDecoder().decode(requireString(root, "payload", "header")) : new byte[0];
      return new ProcessHeader(ProcessId.from(requireString(root, "pid", "header")), ntasks.getAsInt(), payload);
    } catch (MalformedProcessException e) {
      throw e;
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new MalformedProcessException("Process header cannot be parsed", e);
    }
  }

  private void writeCommon(JsonObject root,
                           String function,
                           String guid,
                           StorageLocation storage,
                           Credentials credentials,
                           JsonObject args) {
    root.addProperty("function", function);
    root.addProperty("guid", guid);
    root.addProperty("storage_kind", storage.kind());
    root.addProperty("storage_endpoint", storage.endpoint());
    root.addProperty("credentials", credentials.token());
    root.add("args", args);
  }

  private byte[] toBytes(JsonObject root) {
    return gson.toJson(root).getBytes(StandardCharsets.UTF_8);
  }

  private static JsonObject parseObject(byte[] bytes, String what) {
    try {
      JsonElement element = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8));
      if (!element.isJsonObject()) {
        throw new IllegalArgumentException("The " + what + " must be a JSON object");
      }
      return element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON format for " + what, e);
    }
  }

  private static String requireString(JsonObject root, String field, String what) {
    var value = root.get(field);
    if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new IllegalArgumentException("The " + what + " must contain a string '" + field + "', got: " + value);
    }
    return value.getAsString();
  }

  private static StorageLocation storageOf(JsonObject root, String what) {
    var endpoint = root.has("storage_endpoint") ? requireString(root, "storage_endpoint", what) : "";
    return new StorageLocation(requireString(root, "storage_kind", what), endpoint);
  }

  private static Credentials credentialsOf(JsonObject root, String what) {
    return root.has("credentials") ? new Credentials(requireString(root, "credentials", what)) : Credentials.ANONYMOUS;
  }

  private static JsonObject argsOf(JsonObject root, String what) {
    var args = root.get("args");
    if (args == null || args.isJsonNull()) return new JsonObject();
    if (!args.isJsonObject()) {
      throw new IllegalArgumentException("The " + what + " 'args' must be a JSON object, got: " + args);
    }
    return args.getAsJsonObject();
  }
}
