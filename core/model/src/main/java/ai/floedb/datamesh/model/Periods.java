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

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ISO-8601 period strings used for rolling forecast and archive horizons.
 *
 * <p>Day, hour, minute and second components are honoured. Year and month components have no
 * fixed length and are rejected.
 */
public final class Periods {

  private static final Pattern PERIOD =
      Pattern.compile(
          "^P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)D)?"
              + "(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?$");

  private Periods() {}

  public static Duration parse(String period) {
    Matcher m = PERIOD.matcher(period == null ? "" : period.trim());
    if (!m.matches() || "P".equals(m.group()) || m.group().endsWith("T")) {
      throw new IllegalArgumentException("Invalid ISO 8601 duration string: " + period);
    }
    if (m.group(1) != null || m.group(2) != null) {
      throw new IllegalArgumentException("Calendar periods are not supported: " + period);
    }
    Duration d = Duration.ZERO;
    if (m.group(3) != null) {
      d = d.plusDays(Long.parseLong(m.group(3)));
    }
    if (m.group(4) != null) {
      d = d.plusHours(Long.parseLong(m.group(4)));
    }
    if (m.group(5) != null) {
      d = d.plusMinutes(Long.parseLong(m.group(5)));
    }
    if (m.group(6) != null) {
      d = d.plusNanos(Math.round(Double.parseDouble(m.group(6)) * 1_000_000_000L));
    }
    return d;
  }
}
