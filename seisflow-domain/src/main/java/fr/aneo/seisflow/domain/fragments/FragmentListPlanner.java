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

import fr.aneo.seisflow.domain.ProcessHeader;
import fr.aneo.seisflow.domain.Query;
import fr.aneo.seisflow.domain.QueryPlan;
import fr.aneo.seisflow.domain.TaskSpec;
import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.exception.PlanningException;
import fr.aneo.seisflow.domain.planning.Planner;
import org.msgpack.core.MessagePack;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Planner of the {@code fragments} function: the query names the fragments to fetch explicitly.
 * <p>
 * The fragment list is split, in order, into tasks of at most {@code taskSize} fragments. The process
 * header payload opens the result document: a MessagePack array of two elements whose first element is
 * the map {@code {"bundles": ntasks, "fragments": nfragments}}. The second element is the array of parts
 * that the result readers append after the payload.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>another function name, a missing or empty fragment list: {@link PlanningException.Kind#BAD_INPUT}</li>
 *   <li>a query without process id, an encoding failure: {@link PlanningException.Kind#INTERNAL}</li>
 * </ul>
 */
public final class FragmentListPlanner implements Planner {

  public static final int DEFAULT_TASK_SIZE = 10;

  private final MessageCodec codec;
  private final int taskSize;

  public FragmentListPlanner(MessageCodec codec, int taskSize) {
    this.codec = requireNonNull(codec, "codec cannot be null");
    if (taskSize < 1) throw new IllegalArgumentException("taskSize must be at least 1, got " + taskSize);
    this.taskSize = taskSize;
  }

  @Override
  public QueryPlan plan(Query query) {
    requireNonNull(query, "query cannot be null");
    if (query.pid() == null) {
      throw PlanningException.internal("query must be assigned a process id before planning", null);
    }
    if (!FragmentList.FUNCTION.equals(query.function())) {
      throw PlanningException.badInput("unsupported function '" + query.function() + "'");
    }

    List<String> ids;
    try {
      ids = FragmentList.idsOf(query.args());
    } catch (IllegalArgumentException e) {
      throw PlanningException.badInput(e.getMessage(), e);
    }
    if (ids.isEmpty()) throw PlanningException.badInput("query selects no fragment");

    try {
      var tasks = new ArrayList<byte[]>();
      for (int offset = 0; offset < ids.size(); offset += taskSize) {
        var slice = ids.subList(offset, Math.min(offset + taskSize, ids.size()));
        var spec = new TaskSpec(query.pid(),
                                query.function(),
                                query.guid(),
                                query.storage(),
                                query.credentials(),
                                FragmentList.argsOf(slice, offset));
        tasks.add(codec.encodeTask(spec));
      }

      var header = new ProcessHeader(query.pid(), tasks.size(), payloadOf(tasks.size(), ids.size()));
      return new QueryPlan(tasks, codec.encodeHeader(header));
    } catch (IOException | RuntimeException e) {
      throw PlanningException.internal("unable to encode the plan of " + query.pid().asString(), e);
    }
  }

  private static byte[] payloadOf(int bundles, int fragments) throws IOException {
    try (var packer = MessagePack.newDefaultBufferPacker()) {
      packer.packArrayHeader(2);
      packer.packMapHeader(2);
      packer.packString("bundles").packInt(bundles);
      packer.packString("fragments").packInt(fragments);
      return packer.toByteArray();
    }
  }
}
