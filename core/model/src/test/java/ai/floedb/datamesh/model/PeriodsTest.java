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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PeriodsTest {

  @Test
  void honoursDayAndTimeParts() {
    assertEquals(Duration.ofDays(7), Periods.parse("P7D"));
    assertEquals(Duration.ofHours(30), Periods.parse("P1DT6H"));
    assertEquals(Duration.ofMinutes(90), Periods.parse("PT1H30M"));
    assertEquals(Duration.ofMillis(1500), Periods.parse("PT1.5S"));
  }

  @Test
  void rejectsCalendarAndMalformedPeriods() {
    assertThrows(IllegalArgumentException.class, () -> Periods.parse("P1Y"));
    assertThrows(IllegalArgumentException.class, () -> Periods.parse("P2M"));
    assertThrows(IllegalArgumentException.class, () -> Periods.parse("P"));
    assertThrows(IllegalArgumentException.class, () -> Periods.parse("P1DT"));
    assertThrows(IllegalArgumentException.class, () -> Periods.parse("7 days"));
  }
}
