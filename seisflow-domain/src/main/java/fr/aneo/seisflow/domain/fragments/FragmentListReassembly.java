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

import fr.aneo.seisflow.domain.codec.MessageCodec;
import fr.aneo.seisflow.domain.exception.ReassemblyException;
import fr.aneo.seisflow.domain.reassembly.Reassembler;
import fr.aneo.seisflow.domain.reassembly.ReassemblyLibrary;
import org.msgpack.core.MessagePack;

import java.io.IOException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reassembly of the {@code fragments} function.
 * <p>
 * A part is packed as the MessagePack array {@code [offset, [bin, bin, ...]]}: the position of the part's
 * first fragment in the query, followed by the fragment bytes in enumeration order regardless of the
 * order in which they were added.
 */
public final class FragmentListReassembly implements ReassemblyLibrary {

  private final MessageCodec codec;

  public FragmentListReassembly(MessageCodec codec) {
    this.codec = requireNonNull(codec, "codec cannot be null");
  }

  @Override
  public Reassembler init(String function, byte[] task) {
    requireNonNull(task, "task cannot be null");
    if (!FragmentList.FUNCTION.equals(function)) {
      throw new ReassemblyException("no reassembly for function '" + function + "'");
    }
    try {
      var args = codec.decodeTask(task).args();
      return new FragmentListReassembler(FragmentList.idsOf(args), FragmentList.offsetOf(args));
    } catch (IllegalArgumentException e) {
      throw new ReassemblyException("task rejected: " + e.getMessage(), e);
    }
  }

  static final class FragmentListReassembler implements Reassembler {
    private final List<String> ids;
    private final int offset;
    private final byte[][] chunks;
    private int received;
    private boolean released;

    FragmentListReassembler(List<String> ids, int offset) {
      this.ids = List.copyOf(ids);
      this.offset = offset;
      this.chunks = new byte[ids.size()][];
    }

    @Override
    public List<String> fragments() {
      ensureLive();
      return ids;
    }

    @Override
    public void add(int index, byte[] chunk) {
      ensureLive();
      requireNonNull(chunk, "chunk cannot be null");
      if (index < 0 || index >= chunks.length) {
        throw new ReassemblyException("fragment index " + index + " out of range [0, " + chunks.length + ")");
      }
      if (chunks[index] != null) {
        throw new ReassemblyException("fragment " + index + " was already added");
      }
      chunks[index] = chunk.clone();
      received++;
    }

    @Override
    public byte[] pack() {
      ensureLive();
      if (received != chunks.length) {
        throw new ReassemblyException("cannot pack: " + received + " of " + chunks.length + " fragments received");
      }
      try (var packer = MessagePack.newDefaultBufferPacker()) {
        packer.packArrayHeader(2);
        packer.packInt(offset);
        packer.packArrayHeader(chunks.length);
        for (byte[] chunk : chunks) {
          packer.packBinaryHeader(chunk.length);
          packer.writePayload(chunk);
        }
        return packer.toByteArray();
      } catch (IOException e) {
        throw new ReassemblyException("cannot pack part", e);
      }
    }

    @Override
    public void close() {
      if (released) throw new IllegalStateException("reassembly handle already released");
      released = true;
    }

    private void ensureLive() {
      if (released) throw new IllegalStateException("reassembly handle already released");
    }
  }
}
