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

package ai.floedb.datamesh.data;

import ai.floedb.datamesh.model.Times;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CF-convention time coordinates: integer or float offsets with a {@code units} attribute of the
 * form {@code "<unit> since <reference>"}.
 */
public final class TimeAxis {

  public static final String UNITS = "units";
  public static final String EPOCH_SECONDS = "seconds since 1970-01-01 00:00:00";

  private static final Pattern CF_UNITS =
      Pattern.compile("^\\s*(\\w+)\\s+since\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);

  private TimeAxis() {}

  /** Encodes instants as whole seconds since the epoch. */
  public static Variable encode(String dim, List<Instant> times) {
    long[] secs = new long[times.size()];
    for (int i = 0; i < secs.length; i++) {
      secs[i] = times.get(i).getEpochSecond();
    }
    return new Variable(List.of(dim), NdArray.vector(secs), Map.of(UNITS, EPOCH_SECONDS));
  }

  public static boolean isTime(Variable v) {
    Object units = v.attrs().get(UNITS);
    return units instanceof String s && CF_UNITS.matcher(s).matches();
  }

  /** Decoded instants of a one-dimensional time variable, if it carries CF time units. */
  public static Optional<List<Instant>> decode(Variable v) {
    if (!isTime(v) || v.data().rank() != 1) {
      return Optional.empty();
    }
    Matcher m = CF_UNITS.matcher((String) v.attrs().get(UNITS));
    if (!m.matches()) {
      return Optional.empty();
    }
    Duration step = unit(m.group(1));
    Instant ref = Times.parseInstant(m.group(2));
    List<Instant> out = new ArrayList<>(v.data().size());
    for (int i = 0; i < v.data().size(); i++) {
      double offset = v.data().getDouble(i);
      long nanos = Math.round(offset * step.toNanos());
      out.add(ref.plusNanos(nanos));
    }
    return Optional.of(out);
  }

  private static Duration unit(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "days":
      case "day":
        return Duration.ofDays(1);
      case "hours":
      case "hour":
        return Duration.ofHours(1);
      case "minutes":
      case "minute":
        return Duration.ofMinutes(1);
      case "seconds":
      case "second":
        return Duration.ofSeconds(1);
      case "milliseconds":
        return Duration.ofMillis(1);
      default:
        throw new IllegalArgumentException("Unsupported CF time unit: " + name);
    }
  }
}
