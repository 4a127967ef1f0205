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

/** Nothing is stored under a key. Distinct from transport or decoding failures. */
public class ChunkNotFoundException extends RuntimeException {
  private final String key;

  public ChunkNotFoundException(String key) {
    super("No chunk stored under " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
