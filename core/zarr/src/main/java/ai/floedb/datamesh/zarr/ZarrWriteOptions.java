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

import java.util.Map;

/**
 * Encoding choices for newly created arrays. {@code chunks} caps the chunk length per dimension
 * name; dimensions not listed are stored as a single chunk.
 */
public record ZarrWriteOptions(Map<String, Integer> chunks, boolean compress) {

  public static final ZarrWriteOptions DEFAULT = new ZarrWriteOptions(Map.of(), true);

  public ZarrWriteOptions {
    chunks = chunks == null ? Map.of() : Map.copyOf(chunks);
    chunks.forEach(
        (dim, n) -> {
          if (n <= 0) {
            throw new IllegalArgumentException("Chunk length for " + dim + " must be positive");
          }
        });
  }

  public static ZarrWriteOptions chunked(Map<String, Integer> chunks) {
    return new ZarrWriteOptions(chunks, true);
  }

  int[] chunksFor(java.util.List<String> dims, int[] shape) {
    int[] out = new int[shape.length];
    for (int i = 0; i < shape.length; i++) {
      int cap = chunks.getOrDefault(dims.get(i), Integer.MAX_VALUE);
      out[i] = Math.max(1, Math.min(shape[i], cap));
    }
    return out;
  }
}
