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
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * One end of a time filter: either an absolute instant or an offset relative to the time the
 * service evaluates the query.
 */
public final class TimeBound {
  private final Instant instant;
  private final Duration offset;

  private TimeBound(Instant instant, Duration offset) {
    this.instant = instant;
    this.offset = offset;
  }

  public static TimeBound at(Instant instant) {
    return new TimeBound(Objects.requireNonNull(instant, "instant"), null);
  }

  public static TimeBound relative(Duration offset) {
    return new TimeBound(null, Objects.requireNonNull(offset, "offset"));
  }

  @JsonCreator
  public static TimeBound parse(String text) {
    Objects.requireNonNull(text, "text");
    String s = text.trim();
    if (s.startsWith("P") || s.startsWith("-P") || s.startsWith("+P")) {
      return relative(Duration.parse(s));
    }
    try {
      return at(Times.parseInstant(s));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Timestamp format not valid: " + text, e);
    }
  }

  public boolean isRelative() {
    return offset != null;
  }

  /** Absolute instant of this bound, resolving relative bounds against {@code now}. */
  public Instant resolve(Instant now) {
    return instant != null ? instant : now.plus(offset);
  }

  @JsonValue
  @Override
  public String toString() {
    return instant != null ? instant.toString() : offset.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeBound other)) {
      return false;
    }
    return Objects.equals(instant, other.instant) && Objects.equals(offset, other.offset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instant, offset);
  }
}
