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

package fr.aneo.seisflow.api.internal;

import com.google.protobuf.ByteString;
import fr.aneo.seisflow.api.ProcessNotFoundException;
import fr.aneo.seisflow.api.ProcessStatus;
import fr.aneo.seisflow.api.ResultFailedException;
import fr.aneo.seisflow.api.ResultReader;
import fr.aneo.seisflow.api.ResultTimeoutException;
import fr.aneo.seisflow.api.Scheduler;
import fr.aneo.seisflow.api.grpc.v1.Chunk;
import fr.aneo.seisflow.api.grpc.v1.GetReply;
import fr.aneo.seisflow.api.grpc.v1.ResultRequest;
import fr.aneo.seisflow.api.grpc.v1.ResultsGrpc;
import fr.aneo.seisflow.api.grpc.v1.StatusReply;
import fr.aneo.seisflow.api.grpc.v1.SubmitReply;
import fr.aneo.seisflow.api.grpc.v1.SubmitRequest;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.exception.BrokerException;
import fr.aneo.seisflow.domain.exception.MalformedProcessException;
import fr.aneo.seisflow.domain.exception.PlanningException;
import fr.aneo.seisflow.domain.exception.SchedulingException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static java.util.Objects.requireNonNull;

/**
 * gRPC implementation of the {@code seisflow.v1.Results} service.
 *
 * <h2>Status codes</h2>
 * <table>
 *   <caption>Mapping of failures to gRPC status codes</caption>
 *   <tr><th>Failure</th><th>Code</th></tr>
 *   <tr><td>malformed query or process id, bad-input planning error</td><td>{@code INVALID_ARGUMENT}</td></tr>
 *   <tr><td>no process header</td><td>{@code NOT_FOUND}</td></tr>
 *   <tr><td>{@code Get} on a process that is still working</td><td>{@code FAILED_PRECONDITION}</td></tr>
 *   <tr><td>result not complete before the deadline</td><td>{@code DEADLINE_EXCEEDED}</td></tr>
 *   <tr><td>broker unreachable</td><td>{@code UNAVAILABLE}</td></tr>
 *   <tr><td>error entry, malformed header, internal planning or scheduling error</td><td>{@code INTERNAL}</td></tr>
 * </table>
 */
public class ResultGrpcService extends ResultsGrpc.ResultsImplBase {
  private static final Logger logger = LoggerFactory.getLogger(ResultGrpcService.class);

  private final Scheduler scheduler;
  private final ResultReader reader;
  private final MessageCodec codec;

  public ResultGrpcService(Scheduler scheduler, ResultReader reader, MessageCodec codec) {
    this.scheduler = requireNonNull(scheduler, "scheduler cannot be null");
    this.reader = requireNonNull(reader, "reader cannot be null");
    this.codec = requireNonNull(codec, "codec cannot be null");
  }

  @Override
  public void submit(SubmitRequest request, StreamObserver<SubmitReply> responseObserver) {
    try {
      var query = codec.decodeQuery(request.getQuery().toByteArray());
      var pid = scheduler.submit(query);
      responseObserver.onNext(SubmitReply.newBuilder()
                                         .setPid(pid.asString())
                                         .setLocation(ProcessStatus.pending(pid).location())
                                         .build());
      responseObserver.onCompleted();
    } catch (RuntimeException e) {
      responseObserver.onError(toStatus(e));
    }
  }

  @Override
  public void status(ResultRequest request, StreamObserver<StatusReply> responseObserver) {
    try {
      var status = reader.status(pidOf(request));
      responseObserver.onNext(StatusReply.newBuilder()
                                         .setLocation(status.location())
                                         .setStatus(status.state().asString())
                                         .setProgress(status.progress())
                                         .build());
      responseObserver.onCompleted();
    } catch (RuntimeException e) {
      responseObserver.onError(toStatus(e));
    }
  }

  @Override
  public void get(ResultRequest request, StreamObserver<GetReply> responseObserver) {
    try {
      var pid = pidOf(request);
      MDC.put("pid", pid.asString());
      var status = reader.status(pid);
      switch (status.state()) {
        case PENDING -> throw new ProcessNotFoundException(pid);
        case WORKING -> throw Status.FAILED_PRECONDITION
          .withDescription("process " + pid.asString() + " is not finished (" + status.progress() + ")")
          .asRuntimeException();
        case FAILED, FINISHED -> {
          var result = reader.get(pid);
          responseObserver.onNext(GetReply.newBuilder().setResult(ByteString.copyFrom(result)).build());
          responseObserver.onCompleted();
        }
      }
    } catch (RuntimeException e) {
      responseObserver.onError(toStatus(e));
    } finally {
      MDC.remove("pid");
    }
  }

  @Override
  public void stream(ResultRequest request, StreamObserver<Chunk> responseObserver) {
    try {
      var pid = pidOf(request);
      MDC.put("pid", pid.asString());
      reader.stream(pid, chunk -> responseObserver.onNext(Chunk.newBuilder().setData(ByteString.copyFrom(chunk)).build()));
      responseObserver.onCompleted();
    } catch (RuntimeException e) {
      responseObserver.onError(toStatus(e));
    } finally {
      MDC.remove("pid");
    }
  }

  private static ProcessId pidOf(ResultRequest request) {
    return ProcessId.from(request.getPid());
  }

  static StatusRuntimeException toStatus(RuntimeException e) {
    if (e instanceof StatusRuntimeException status) return status;

    Status status;
    if (e instanceof ProcessNotFoundException) {
      status = Status.NOT_FOUND;
    } else if (e instanceof PlanningException planning) {
      status = planning.kind() == PlanningException.Kind.BAD_INPUT ? Status.INVALID_ARGUMENT : Status.INTERNAL;
    } else if (e instanceof IllegalArgumentException) {
      status = Status.INVALID_ARGUMENT;
    } else if (e instanceof ResultTimeoutException) {
      status = Status.DEADLINE_EXCEEDED;
    } else if (e instanceof BrokerException) {
      status = Status.UNAVAILABLE;
    } else if (e instanceof ResultFailedException || e instanceof MalformedProcessException || e instanceof SchedulingException) {
      status = Status.INTERNAL;
    } else {
      logger.error("Unexpected failure", e);
      return Status.INTERNAL.withDescription("internal error").withCause(e).asRuntimeException();
    }

    if (status.getCode() == Status.Code.INTERNAL) {
      logger.error("Request failed: {}", e.getMessage(), e);
    } else {
      logger.debug("Request rejected with {}: {}", status.getCode(), e.getMessage());
    }
    return status.withDescription(e.getMessage()).withCause(e).asRuntimeException();
  }
}
