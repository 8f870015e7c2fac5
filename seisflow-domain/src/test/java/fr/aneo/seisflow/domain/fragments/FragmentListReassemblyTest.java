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

import fr.aneo.seisflow.domain.ProcessId;
import fr.aneo.seisflow.domain.codec.GsonMessageCodec;
import fr.aneo.seisflow.domain.exception.ReassemblyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.msgpack.core.MessagePack;

import java.io.IOException;

import static fr.aneo.seisflow.domain.fragments.FragmentListPlannerTest.query;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FragmentListReassemblyTest {

  private final GsonMessageCodec codec = new GsonMessageCodec();
  private final FragmentListReassembly reassembly = new FragmentListReassembly(codec);
  private byte[] task;

  @BeforeEach
  void setUp() {
    var plan = new FragmentListPlanner(codec, 3).plan(query("fragments", 5).withPid(ProcessId.random()));
    task = plan.tasks().get(1);
  }

  @Test
  @DisplayName("Should enumerate the fragments of the task only")
  void should_enumerate_task_fragments() {
    try (var reassembler = reassembly.init("fragments", task)) {
      assertThat(reassembler.fragments()).containsExactly("f3", "f4");
    }
  }

  @Test
  @DisplayName("Should pack fragments in enumeration order whatever their arrival order")
  void should_pack_in_index_order() throws IOException {
    // given
    var reassembler = reassembly.init("fragments", task);
    reassembler.add(1, new byte[]{4});
    reassembler.add(0, new byte[]{3});

    // when
    var packed = reassembler.pack();
    reassembler.close();

    // then
    try (var unpacker = MessagePack.newDefaultUnpacker(packed)) {
      assertThat(unpacker.unpackArrayHeader()).isEqualTo(2);
      assertThat(unpacker.unpackInt()).isEqualTo(3);
      assertThat(unpacker.unpackArrayHeader()).isEqualTo(2);
      assertThat(unpacker.readPayload(unpacker.unpackBinaryHeader())).containsExactly(3);
      assertThat(unpacker.readPayload(unpacker.unpackBinaryHeader())).containsExactly(4);
    }
  }

  @Test
  @DisplayName("Should reject a fragment added twice or out of range")
  void should_reject_duplicate_and_out_of_range_fragments() {
    try (var reassembler = reassembly.init("fragments", task)) {
      reassembler.add(0, new byte[0]);

      assertThatThrownBy(() -> reassembler.add(0, new byte[0])).isInstanceOf(ReassemblyException.class);
      assertThatThrownBy(() -> reassembler.add(2, new byte[0])).isInstanceOf(ReassemblyException.class);
    }
  }

  @Test
  @DisplayName("Should refuse to pack before every fragment was added")
  void should_refuse_partial_pack() {
    try (var reassembler = reassembly.init("fragments", task)) {
      reassembler.add(0, new byte[0]);

      assertThatThrownBy(reassembler::pack).isInstanceOf(ReassemblyException.class).hasMessageContaining("1 of 2");
    }
  }

  @Test
  @DisplayName("Should reject unknown functions and malformed tasks at init")
  void should_reject_invalid_init() {
    assertThatThrownBy(() -> reassembly.init("slice", task)).isInstanceOf(ReassemblyException.class);
    assertThatThrownBy(() -> reassembly.init("fragments", "{}".getBytes())).isInstanceOf(ReassemblyException.class);
  }

  @Test
  @DisplayName("Should detect a handle released twice")
  void should_detect_double_release() {
    var reassembler = reassembly.init("fragments", task);
    reassembler.close();

    assertThatThrownBy(reassembler::close).isInstanceOf(IllegalStateException.class);
  }
}
