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

package ai.floedb.datamesh.client;

import java.time.Duration;
import java.util.Objects;

/**
 * How {@link DatameshConnector#query} delivers a result.
 *
 * @param lazy open datasets over the remote chunk store instead of downloading them
 * @param cacheTimeout maximum age of a local cache entry to reuse; zero disables the cache. The
 *     cache is never used for lazy results.
 */
public record QueryOptions(boolean lazy, Duration cacheTimeout) {

  public static final QueryOptions DEFAULT = new QueryOptions(false, Duration.ZERO);

  public QueryOptions {
    cacheTimeout = Objects.requireNonNullElse(cacheTimeout, Duration.ZERO);
    if (cacheTimeout.isNegative()) {
      throw new IllegalArgumentException("cacheTimeout must not be negative");
    }
  }

  public static QueryOptions lazily() {
    return new QueryOptions(true, Duration.ZERO);
  }

  public static QueryOptions cached(Duration cacheTimeout) {
    return new QueryOptions(false, cacheTimeout);
  }

  public boolean usesCache() {
    return !lazy && !cacheTimeout.isZero();
  }
}
