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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Aggregation applied by the service after filtering. */
public record Aggregate(List<Op> operations, Boolean spatial, Boolean temporal) {

  public Aggregate {
    operations =
        operations == null || operations.isEmpty() ? List.of(Op.MEAN) : List.copyOf(operations);
    spatial = Objects.requireNonNullElse(spatial, Boolean.TRUE);
    temporal = Objects.requireNonNullElse(temporal, Boolean.TRUE);
  }

  public static Aggregate of(Op... ops) {
    return new Aggregate(List.of(ops), true, true);
  }

  public enum Op {
    MEAN,
    MIN,
    MAX,
    STD,
    SUM;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Op fromWire(String v) {
      return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
  }
}
