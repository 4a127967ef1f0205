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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

/** Heap-backed chunk store. Values are copied on the way in and out. */
public class InMemoryChunkStore implements ChunkStore {

  private final Map<String, byte[]> map = new ConcurrentSkipListMap<>();

  @Override
  public byte[] get(String key) {
    byte[] b = map.get(normalize(key));
    if (b == null) {
      throw new ChunkNotFoundException(key);
    }
    return Arrays.copyOf(b, b.length);
  }

  @Override
  public boolean contains(String key) {
    return map.containsKey(normalize(key));
  }

  @Override
  public void set(String key, byte[] value) {
    Objects.requireNonNull(value, "value");
    map.put(normalize(key), Arrays.copyOf(value, value.length));
  }

  /** Deletes {@code key} and, when it names a directory, everything below it. */
  @Override
  public void delete(String key) {
    String k = normalize(key);
    if (k.isEmpty()) {
      clear();
      return;
    }
    map.remove(k);
    String prefix = k.endsWith("/") ? k : k + "/";
    map.keySet().removeIf(x -> x.startsWith(prefix));
  }

  @Override
  public List<String> keys() {
    Set<String> out = new LinkedHashSet<>();
    for (String k : map.keySet()) {
      int slash = k.indexOf('/');
      out.add(slash < 0 ? k : k.substring(0, slash + 1));
    }
    return new ArrayList<>(out);
  }

  @Override
  public void clear() {
    map.clear();
  }

  /** Every stored key, full paths, in sorted order. */
  public List<String> allKeys() {
    return new ArrayList<>(map.keySet());
  }

  public int size() {
    return map.size();
  }

  private static String normalize(String key) {
    return key == null ? "" : (key.startsWith("/") ? key.substring(1) : key);
  }
}
