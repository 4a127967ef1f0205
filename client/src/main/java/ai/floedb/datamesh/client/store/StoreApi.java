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

package ai.floedb.datamesh.client.store;

/** Chunk-store endpoints exposed by the gateway. */
public enum StoreApi {
  /** Read-only view of a staged query result, addressed by query hash. */
  QUERY("/zarr/query"),
  /** Read-write view of a datasource. */
  ZARR("/zarr");

  private final String path;

  StoreApi(String path) {
    this.path = path;
  }

  public String path() {
    return path;
  }
}
