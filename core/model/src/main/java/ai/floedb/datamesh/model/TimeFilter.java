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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Temporal subset of a query. {@code times} always holds two entries, start then end; either may
 * be {@code null} for an open bound.
 */
public record TimeFilter(Type type, List<TimeBound> times, String resolution, Resample resample) {

  public TimeFilter {
    type = Objects.requireNonNullElse(type, Type.RANGE);
    Objects.requireNonNull(times, "times");
    if (times.size() != 2) {
      throw new IllegalArgumentException("Time filter needs [start, end], got " + times.size());
    }
    times = Collections.unmodifiableList(new ArrayList<>(times));
    resolution = Objects.requireNonNullElse(resolution, "native");
    resample = Objects.requireNonNullElse(resample, Resample.MEAN);
  }

  public static TimeFilter range(TimeBound start, TimeBound end) {
    List<TimeBound> t = new ArrayList<>(2);
    t.add(start);
    t.add(end);
    return new TimeFilter(Type.RANGE, t, null, null);
  }

  public TimeBound start() {
    return times.get(0);
  }

  public TimeBound end() {
    return times.get(1);
  }

  public enum Type {
    RANGE;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Type fromWire(String v) {
      return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
  }

  public enum Resample {
    MEAN;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Resample fromWire(String v) {
      return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
  }
}
