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

package fr.aneo.seisflow.domain.reassembly;

import fr.aneo.seisflow.domain.exception.ReassemblyException;

import java.util.List;

/**
 * Stateful handle accumulating the fragments of one task part.
 * <p>
 * The handle owns resources that must be released exactly once through {@link #close()}, on every
 * exit path. Its methods are called from a single thread.
 *
 * <h2>Contract</h2>
 * <ol>
 *   <li>{@link #fragments()} lists the fragment ids to download; the position of an id in that list is
 *       the index its bytes are added under</li>
 *   <li>{@link #add(int, byte[])} is called exactly once per index, in any order</li>
 *   <li>{@link #pack()} is called only after every index has been added</li>
 * </ol>
 */
public interface Reassembler extends AutoCloseable {

  List<String> fragments();

  /**
   * Hands the bytes of one fragment to the reassembly.
   *
   * @param index position of the fragment in {@link #fragments()}
   * @param chunk downloaded bytes
   * @throws ReassemblyException if the fragment is rejected
   */
  void add(int index, byte[] chunk);

  /**
   * Serializes the reassembled part.
   *
   * @return the packed part
   * @throws ReassemblyException if the part cannot be packed
   */
  byte[] pack();

  @Override
  void close();
}
