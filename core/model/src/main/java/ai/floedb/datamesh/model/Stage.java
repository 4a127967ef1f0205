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

package ai.floedb.datamesh.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service-computed description of what a query would return, obtained without transferring data.
 *
 * <p>{@code qhash} addresses the staged result on the service (the lazy chunk store is keyed by
 * it). {@code size} is the estimated payload in bytes and {@code dlen} the row or element count.
 */
public record Stage(
    Query query,
    String qhash,
    List<String> formats,
    long size,
    long dlen,
    Map<String, Object> coords,
    ContainerKind container) {

  public Stage {
    Objects.requireNonNull(qhash, "qhash");
    Objects.requireNonNull(container, "container");
    formats = formats == null ? List.of() : List.copyOf(formats);
    coords = coords == null ? Map.of() : coords;
  }
}
