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
import java.util.Locale;

/** Result container kinds served by the datamesh. */
public enum ContainerKind {
  /** Labeled multidimensional array. */
  DATASET("dataset"),
  /** Tabular data with a geometry column. */
  GEO_TABLE("geodataframe"),
  /** Plain tabular data. */
  TABLE("dataframe");

  private final String wireName;

  ContainerKind(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static ContainerKind fromWire(String value) {
    String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (ContainerKind k : values()) {
      if (k.wireName.equals(v)) {
        return k;
      }
    }
    throw new IllegalArgumentException("Unknown container kind: " + value);
  }
}
