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

package fr.aneo.seisflow.domain.broker;

import fr.aneo.seisflow.domain.ConsumerInfo;
import fr.aneo.seisflow.domain.LogSummary;
import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.ResultEntry;
import fr.aneo.seisflow.domain.TaskMessage;
import fr.aneo.seisflow.domain.exception.BrokerException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Single-process broker holding the task queue, the result store and the consumer registry in memory.
 * <p>
 * The broker mirrors the semantics of the Redis implementation closely enough to run the whole
 * pipeline inside one JVM:
 * <ul>
 *   <li>the task queue is one stream whose entries are delivered once per consumer group, without
 *       acknowledgement, and stay until deleted</li>
 *   <li>blocking reads wait on a shared condition signalled by every write</li>
 *   <li>time-to-live is evaluated lazily against the injected {@link Clock}</li>
 *   <li>consumer idle time is measured from the consumer's last read attempt</li>
 * </ul>
 * All state is guarded by a single lock; the broker is safe for concurrent use.
 */
public final class InMemoryBroker implements TaskQueue, ResultStore, ConsumerRegistry {

  private final String stream;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  private final Map<Long, TaskMessage> queue = new LinkedHashMap<>();
  private final Map<String, Group> groups = new LinkedHashMap<>();
  private final Map<ProcessId, ProcessRecord> processes = new LinkedHashMap<>();
  private long sequence;

  public InMemoryBroker(String stream) {
    this(stream, Clock.systemUTC());
  }

  public InMemoryBroker(String stream, Clock clock) {
    this.stream = requireNonNull(stream, "stream cannot be null");
    this.clock = requireNonNull(clock, "clock cannot be null");
  }

  @Override
  public String publish(TaskMessage message) {
    requireNonNull(message, "message cannot be null");
    lock.lock();
    try {
      long seq = ++sequence;
      var id = idOf(seq);
      queue.put(seq, new TaskMessage(id, message.pid(), message.part(), message.task()));
      changed.signalAll();
      return id;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void createGroup(String group) {
    requireNonNull(group, "group cannot be null");
    lock.lock();
    try {
      groups.putIfAbsent(group, new Group());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public TaskConsumer subscribe(String group, String consumer) {
    requireNonNull(group, "group cannot be null");
    requireNonNull(consumer, "consumer cannot be null");
    return new InMemoryTaskConsumer(group, consumer);
  }

  @Override
  public void delete(Collection<String> ids) {
    requireNonNull(ids, "ids cannot be null");
    lock.lock();
    try {
      for (String id : ids) {
        queue.remove(sequenceOf(id));
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the messages currently held by the task queue, in publication order.
   *
   * @return a snapshot of the queue
   */
  public List<TaskMessage> queued() {
    lock.lock();
    try {
      return List.copyOf(queue.values());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void putHeader(ProcessId pid, byte[] header) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(header, "header cannot be null");
    lock.lock();
    try {
      var record = live(pid).orElseGet(() -> processes.computeIfAbsent(pid, p -> new ProcessRecord()));
      record.header = header.clone();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<byte[]> header(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    lock.lock();
    try {
      return live(pid).map(record -> record.header).map(byte[]::clone);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void append(ProcessId pid, ResultEntry entry) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(entry, "entry cannot be null");
    lock.lock();
    try {
      var record = live(pid).orElseGet(() -> processes.computeIfAbsent(pid, p -> new ProcessRecord()));
      record.log.add(entry);
      if (entry instanceof ResultEntry.Failure) record.errors++;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void expire(ProcessId pid, Duration ttl) {
    requireNonNull(pid, "pid cannot be null");
    requireNonNull(ttl, "ttl cannot be null");
    lock.lock();
    try {
      live(pid).ifPresent(record -> record.expiresAt = clock.instant().plus(ttl));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public LogSummary summary(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    lock.lock();
    try {
      return live(pid).map(record -> new LogSummary(record.log.size(), record.errors)).orElse(LogSummary.EMPTY);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the entries currently held by the log of a process.
   *
   * @param pid owning process
   * @return a snapshot of the log
   */
  public List<ResultEntry> log(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    lock.lock();
    try {
      return live(pid).map(record -> List.copyOf(record.log)).orElse(List.of());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ResultCursor tail(ProcessId pid) {
    requireNonNull(pid, "pid cannot be null");
    return new InMemoryResultCursor(pid);
  }

  @Override
  public List<ConsumerInfo> consumers(String stream, String group) {
    lock.lock();
    try {
      var members = groupOf(stream, group).consumers;
      var now = clock.instant();
      var result = new ArrayList<ConsumerInfo>(members.size());
      members.forEach((name, seen) -> result.add(new ConsumerInfo(name, 0, Duration.between(seen, now))));
      return result;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void remove(String stream, String group, String consumer) {
    lock.lock();
    try {
      groupOf(stream, group).consumers.remove(consumer);
    } finally {
      lock.unlock();
    }
  }

  private Group groupOf(String stream, String group) {
    if (!this.stream.equals(stream)) throw new BrokerException("no such stream: " + stream);
    var found = groups.get(group);
    if (found == null) throw new BrokerException("NOGROUP no such consumer group '" + group + "' for stream '" + stream + "'");
    return found;
  }

  private Optional<ProcessRecord> live(ProcessId pid) {
    var record = processes.get(pid);
    if (record == null) return Optional.empty();
    if (record.expiresAt != null && !clock.instant().isBefore(record.expiresAt)) {
      processes.remove(pid);
      return Optional.empty();
    }
    return Optional.of(record);
  }

  private static String idOf(long seq) {
    return seq + "-0";
  }

  private static long sequenceOf(String id) {
    int dash = id.indexOf('-');
    try {
      return Long.parseLong(dash < 0 ? id : id.substring(0, dash));
    } catch (NumberFormatException e) {
      throw new BrokerException("invalid entry id: " + id, e);
    }
  }

  private static final class Group {
    private long lastDelivered;
    private final Map<String, Instant> consumers = new LinkedHashMap<>();
  }

  private static final class ProcessRecord {
    private byte[] header;
    private final List<ResultEntry> log = new ArrayList<>();
    private long errors;
    private Instant expiresAt;
  }

  private final class InMemoryTaskConsumer implements TaskConsumer {
    private final String group;
    private final String name;

    private InMemoryTaskConsumer(String group, String name) {
      this.group = group;
      this.name = name;
    }

    @Override
    public List<TaskMessage> read(Duration block) {
      requireNonNull(block, "block cannot be null");
      lock.lock();
      try {
        var state = groupOf(stream, group);
        state.consumers.put(name, clock.instant());
        long remaining = block.toNanos();
        while (true) {
          for (var entry : queue.entrySet()) {
            if (entry.getKey() > state.lastDelivered) {
              state.lastDelivered = entry.getKey();
              return List.of(entry.getValue());
            }
          }
          if (remaining <= 0) return List.of();
          remaining = changed.awaitNanos(remaining);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BrokerException("interrupted while reading from " + stream, e);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      // Registrations outlive their consumers, exactly as on a real broker.
    }
  }

  private final class InMemoryResultCursor implements ResultCursor {
    private final ProcessId pid;
    private int position;
    private boolean closed;

    private InMemoryResultCursor(ProcessId pid) {
      this.pid = pid;
    }

    @Override
    public List<ResultEntry> next(Duration block) {
      requireNonNull(block, "block cannot be null");
      lock.lock();
      try {
        if (closed) throw new IllegalStateException("cursor is closed");
        long remaining = block.toNanos();
        while (true) {
          var log = live(pid).map(record -> record.log).orElse(List.of());
          if (log.size() > position) {
            var entries = List.copyOf(log.subList(position, log.size()));
            position = log.size();
            return entries;
          }
          if (remaining <= 0) return List.of();
          remaining = changed.awaitNanos(remaining);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BrokerException("interrupted while reading results of " + pid.asString(), e);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      lock.lock();
      try {
        closed = true;
      } finally {
        lock.unlock();
      }
    }
  }
}
