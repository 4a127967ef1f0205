/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.datamesh.zarr;

import java.util.List;
import java.util.Optional;

/**
 * Mutable key to bytes mapping backing a chunked array. Keys are {@code /}-separated paths
 * relative to the store root such as {@code hs/.zarray} or {@code hs/0.1}.
 */
public interface ChunkStore {

  /**
   * @throws ChunkNotFoundException when nothing is stored under {@code key}
   */
  byte[] get(String key);

  boolean contains(String key);

  void set(String key, byte[] value);

  void delete(String key);

  /** Entries directly below the store root; sub-groups and arrays end in {@code /}. */
  List<String> keys();

  /** Removes everything in the store. */
  void clear();

  default Optional<byte[]> find(String key) {
    try {
      return Optional.of(get(key));
    } catch (ChunkNotFoundException e) {
      return Optional.empty();
    }
  }
}
