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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic axis roles a datasource maps onto concrete field names, keyed on the wire by one
 * letter.
 *
 * <p>{@link #SEASON} and {@link #STATION} share the key {@code s}; {@link #fromKey(String)}
 * resolves it to {@link #STATION}.
 */
public enum CoordinateRole {
  ENSEMBLE("e"),
  RASTER_BAND("b"),
  CATEGORY("c"),
  QUANTILE("q"),
  SEASON("s"),
  MONTH("m"),
  TIME("t"),
  VERTICAL("z"),
  NORTHING("y"),
  EASTING("x"),
  STATION("s"),
  GEOMETRY("g"),
  FREQUENCY("f"),
  DIRECTION("d"),
  OTHER_I("i"),
  OTHER_J("j"),
  OTHER_K("k");

  private static final Map<String, CoordinateRole> BY_PREFIX =
      Map.ofEntries(
          Map.entry("lon", EASTING),
          Map.entry("x", EASTING),
          Map.entry("eas", EASTING),
          Map.entry("lat", NORTHING),
          Map.entry("y", NORTHING),
          Map.entry("nor", NORTHING),
          Map.entry("dep", VERTICAL),
          Map.entry("lev", VERTICAL),
          Map.entry("z", VERTICAL),
          Map.entry("ens", ENSEMBLE),
          Map.entry("tim", TIME),
          Map.entry("ban", RASTER_BAND),
          Map.entry("mon", MONTH),
          Map.entry("sta", STATION),
          Map.entry("sit", STATION),
          Map.entry("fre", FREQUENCY),
          Map.entry("dir", DIRECTION),
          Map.entry("cat", CATEGORY),
          Map.entry("sea", SEASON),
          Map.entry("geo", GEOMETRY));

  private final String key;

  CoordinateRole(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static CoordinateRole fromKey(String key) {
    if ("s".equals(key)) {
      return STATION;
    }
    for (CoordinateRole r : values()) {
      if (r.key.equals(key)) {
        return r;
      }
    }
    throw new IllegalArgumentException("Unknown coordinate key: " + key);
  }

  /** Guesses the role of a field from the first three letters of its name. */
  public static Optional<CoordinateRole> guess(String fieldName) {
    if (fieldName == null || fieldName.isEmpty()) {
      return Optional.empty();
    }
    String lower = fieldName.toLowerCase(Locale.ROOT);
    String prefix = lower.substring(0, Math.min(3, lower.length()));
    return Optional.ofNullable(BY_PREFIX.get(prefix));
  }
}
