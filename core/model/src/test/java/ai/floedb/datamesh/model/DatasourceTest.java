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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatasourceTest {

  private static final String FEATURE =
      """
      {
        "type": "Feature",
        "id": "wave_hindcast",
        "geometry": {"type": "Polygon",
                     "coordinates": [[[160, -50], [180, -50], [180, -30], [160, -30], [160, -50]]]},
        "properties": {
          "name": "Wave hindcast",
          "tstart": "1993-01-01 00:00:00",
          "tend": "2020-12-31T00:00:00Z",
          "pforecast": "P7D",
          "coordinates": {"t": "time", "x": "lon", "y": "lat"},
          "schema": {
            "attrs": {"title": "hindcast"},
            "dims": {"time": 10, "lon": 5, "lat": 4},
            "coords": {"time": {}, "lon": {}, "lat": {}},
            "data_vars": {"hs": {"dims": ["time", "lat", "lon"]}}
          },
          "driver": "onzarr",
          "args": {"urlpath": "gs://bucket/hindcast"},
          "unknown_field": true
        }
      }
      """;

  @Test
  void parsesServiceFeature() throws Exception {
    JsonNode node = DatameshJson.mapper().readTree(FEATURE);
    Datasource ds = Datasource.fromFeature(node);

    assertThat(ds.id()).isEqualTo("wave_hindcast");
    assertThat(ds.tstart()).isEqualTo(Instant.parse("1993-01-01T00:00:00Z"));
    assertThat(ds.forecastPeriod()).contains(Duration.ofDays(7));
    assertThat(ds.coordinate(CoordinateRole.TIME)).contains("time");
    assertThat(ds.roles()).containsEntry(CoordinateRole.EASTING, "lon");
    assertThat(ds.schema().dataVars()).containsKey("hs");
    assertThat(ds.driverArgs()).containsEntry("urlpath", "gs://bucket/hindcast");
    assertThat(ds.bounds())
        .hasValueSatisfying(b -> assertThat(b).containsExactly(160, -50, 180, -30));
    assertThat(ds.missingCoordinates()).isEmpty();
  }

  @Test
  void normalisesAndValidatesIds() {
    assertThat(Datasource.builder("  My-Data_1 ").build().id()).isEqualTo("my-data_1");
    assertThat(Datasource.builder("my-data_1").build().name()).isEqualTo("My data 1");

    assertThatThrownBy(() -> Datasource.builder("ab").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Datasource.builder("has space").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Datasource.builder("x".repeat(81)).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void reportsCoordinatesMissingFromSchema() {
    Datasource ds =
        Datasource.builder("gauges")
            .coordinate(CoordinateRole.TIME, "time")
            .coordinate(CoordinateRole.STATION, "site")
            .schema(
                new DatasourceSchema(null, null, Map.of("time", Map.of()), null))
            .build();

    assertThat(ds.missingCoordinates()).containsExactly("site");
  }

  @Test
  void metadataHidesVariablesUntilDetailed() {
    Datasource ds =
        Datasource.builder("gauges")
            .schema(new DatasourceSchema(null, null, null, Map.of("hs", Map.of())))
            .build();

    assertThat(DatasourceMetadata.summary(ds).variables()).isEmpty();
    assertThat(DatasourceMetadata.detailed(ds).variables())
        .hasValueSatisfying(v -> assertThat(v).containsKey("hs"));
  }
}
