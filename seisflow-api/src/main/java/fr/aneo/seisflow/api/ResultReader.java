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

import fr.aneo.seisflow.domain.ProcessHeader;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.broker.ResultStore;
import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.exception.MalformedProcessException;
import org.msgpack.core.MessagePack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Reads the status and the result of processes from the result store.
 *
 * <h2>Result layout</h2>
 * <p>
 * A result is a single MessagePack document made of:
 * <ol>
 *   <li>the payload of the process header, verbatim</li>
 *   <li>an array header of length {@code ntasks}</li>
 *   <li>every part, in the order the workers wrote them</li>
 * </ol>
 *
 * <h2>Status</h2>
 * <ul>
 *   <li>{@code pending}: no header</li>
 *   <li>{@code failed}: at least one error entry</li>
 *   <li>{@code finished}: as many entries as tasks</li>
 *   <li>{@code working}: otherwise</li>
 * </ul>
 * Status is computed from counters only and never reads part bodies.
 *
 * <h2>Deadlines</h2>
 * <p>
 * {@link #get(ProcessId)} and {@link #stream(ProcessId, Consumer)} wait for missing parts for at most
 * the reader's timeout, measured from the start of the call.
 */
public final class ResultReader {
  private static final Logger logger = LoggerFactory.getLogger(ResultReader.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(500);

  private final ResultStore results;
  private final MessageCodec codec;
  private final Duration timeout;

  public ResultReader(ResultStore results, MessageCodec codec, Duration timeout) {
    this.results = requireNonNull(results, "results cannot be null");
    this.codec = requireNonNull(codec, "codec cannot be null");
    this.timeout = requireNonNull(timeout, "timeout cannot be null");
    if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive");
  }

  /**
   * Reports the progress of a process.
   *
   * @param pid process id
   * @return the status
   * @throws MalformedProcessException if the stored header cannot be interpreted
   */
  public ProcessStatus status(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    var body = results.header(pid);
    if (body.isEmpty()) return ProcessStatus.pending(pid);

    var header = codec.decodeHeader(body.get());
    var summary = results.summary(pid);
    ProcessStatus.State state;
    if (summary.errors() > 0) {
      state = ProcessStatus.State.FAILED;
    } else if (summary.entries() >= header.ntasks()) {
      state = ProcessStatus.State.FINISHED;
    } else {
      state = ProcessStatus.State.WORKING;
    }
    return new ProcessStatus(pid, state, summary.entries(), header.ntasks());
  }

  /**
   * Returns the complete result of a process, waiting for missing parts.
   *
   * @param pid process id
   * @return the result document
   * @throws ProcessNotFoundException  if the process has no header
   * @throws ResultFailedException     if a part failed
   * @throws ResultTimeoutException    if the parts did not all arrive in time
   * @throws MalformedProcessException if the stored header cannot be interpreted
   */
  public byte[] get(ProcessId pid) {
    var result = new ByteArrayOutputStream();
    stream(pid, result::writeBytes);
    return result.toByteArray();
  }

  /**
   * Hands the result of a process to a sink, chunk by chunk, as parts arrive.
   * <p>
   * The first chunk is the header payload, the second the array header, then one chunk per part.
   * The method returns once every part was handed to the sink.
   *
   * @param pid  process id
   * @param sink receiver of the chunks
   * @throws ProcessNotFoundException  if the process has no header
   * @throws ResultFailedException     if a part failed; chunks already handed to the sink stay there
   * @throws ResultTimeoutException    if the parts did not all arrive in time
   * @throws MalformedProcessException if the stored header cannot be interpreted
   */
  public void stream(ProcessId pid, Consumer<byte[]> sink) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(sink, "sink cannot be null");

    ProcessHeader header = codec.decodeHeader(results.header(pid).orElseThrow(() -> new ProcessNotFoundException(pid)));
    long deadline = System.nanoTime() + timeout.toNanos();

    sink.accept(header.payload());
    sink.accept(arrayHeader(header.ntasks()));

    int received = 0;
    try (var cursor = results.tail(pid)) {
      while (received < header.ntasks()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          throw new ResultTimeoutException("result of " + pid.asString() + " (" + received + "/" + header.ntasks() + ")", timeout);
        }

        var block = Duration.ofNanos(Math.min(remaining, POLL_INTERVAL.toNanos()));
        for (var entry : cursor.next(block)) {
          if (entry instanceof ResultEntry.Failure failure) {
            logger.warn("Process {} failed: {}", pid.asString(), failure.message());
            throw new ResultFailedException(pid, failure.message());
          }
          sink.accept(((ResultEntry.Part) entry).body());
          received++;
        }
      }
    }
    logger.debug("Read {} parts of {}", received, pid.asString());
  }

  /**
   * Assembles {@code parts} successful chunks behind an array header of length {@code parts}.
   * <p>
   * Failures are checked before successes; the first failure aborts the collection.
   *
   * @param parts     number of chunks to collect
   * @param successes chunks, in the order they are to be written
   * @param failures  failures of the producers
   * @param timeout   deadline of the whole collection
   * @return the array header followed by the chunks
   * @throws ResultFailedException  if a failure arrived first
   * @throws ResultTimeoutException if {@code parts} chunks did not arrive in time
   * @throws InterruptedException   if the calling thread is interrupted while waiting
   */
  public static byte[] collect(int parts,
                               BlockingQueue<byte[]> successes,
                               BlockingQueue<? extends Throwable> failures,
                               Duration timeout) throws InterruptedException {
    requireNonNull(successes, "successes cannot be null");
    requireNonNull(failures, "failures cannot be null");
    requireNonNull(timeout, "timeout cannot be null");
    if (parts < 0) throw new IllegalArgumentException("parts cannot be negative");

    var result = new ByteArrayOutputStream();
    result.writeBytes(arrayHeader(parts));

    long deadline = System.nanoTime() + timeout.toNanos();
    int received = 0;
    while (received < parts) {
      var failure = failures.poll();
      if (failure != null) {
        throw new ResultFailedException(failure.getMessage() != null ? failure.getMessage() : failure.toString(), failure);
      }

      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) throw new ResultTimeoutException("collection (" + received + "/" + parts + ")", timeout);

      var chunk = successes.poll(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(50)), TimeUnit.NANOSECONDS);
      if (chunk == null) continue;
      result.writeBytes(chunk);
      received++;
    }
    return result.toByteArray();
  }

  private static byte[] arrayHeader(int length) {
    try (var packer = MessagePack.newDefaultBufferPacker()) {
      packer.packArrayHeader(length);
      return packer.toByteArray();
    } catch (IOException e) {
      throw new IllegalStateException("unable to encode an array header", e);
    }
  }
}
