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

import java.time.Duration;

/**
 * Attempts and read timeout for one kind of chunk-store call. A {@code null} timeout waits
 * indefinitely.
 */
public record OperationPolicy(int retries, Duration timeout) {

  public static final int DEFAULT_RETRIES = 10;

  public OperationPolicy {
    if (retries < 1) {
      throw new IllegalArgumentException("retries must be at least 1");
    }
  }

  public static OperationPolicy of(Duration timeout) {
    return new OperationPolicy(DEFAULT_RETRIES, timeout);
  }
}
