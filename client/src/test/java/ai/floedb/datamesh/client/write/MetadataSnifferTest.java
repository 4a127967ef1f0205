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

package ai.floedb.datamesh.client.write;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.Geometry;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.data.TimeAxis;
import ai.floedb.datamesh.model.CoordinateRole;
import ai.floedb.datamesh.model.Datasource;
import ai.floedb.datamesh.model.DatameshJson;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataSnifferTest {

  private static final Instant NOW = Instant.parse("2026-10-18T00:00:00Z");
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant T1 = Instant.parse("2026-01-02T00:00:00Z");

  private final Datasource blank = Datasource.builder("wave-grid").build();

  private static LabeledDataset grid() {
    return LabeledDataset.builder()
        .coord("time", TimeAxis.encode("time", List.of(T0, T1)))
        .coord("longitude", NdArray.vector(170.0, 175.0, 178.5))
        .coord("latitude", NdArray.vector(-45.0, -40.0))
        .dataVar(
            "hs",
            List.of("time", "latitude", "longitude"),
            NdArray.ofDoubles(new double[12], 2, 2, 3))
        .build();
  }

  @Test
  void datasetPropertiesAreDerivedFromCoordinates() {
    Datasource ds = MetadataSniffer.sniff(blank, grid(), NOW);

    assertThat(ds.coordinates())
        .containsEntry("t", "time")
        .containsEntry("x", "longitude")
        .containsEntry("y", "latitude");
    assertThat(ds.bounds())
        .hasValueSatisfying(b -> assertThat(b).containsExactly(170, -45, 178.5, -40));
    assertThat(ds.tstart()).isEqualTo(T0);
    assertThat(ds.tend()).isEqualTo(T1);
    assertThat(ds.schema().dataVars()).containsKey("hs");
    assertThat(ds.missingCoordinates()).isEmpty();
  }

  @Test
  void explicitPropertiesAreKept() {
    JsonNode box = MetadataSniffer.polygon(new double[] {1, 2, 3, 4});
    Datasource given =
        blank.toBuilder()
            .coordinate(CoordinateRole.TIME, "time")
            .geom(box)
            .tstart(Instant.parse("2000-01-01T00:00:00Z"))
            .pforecast("P7D")
            .build();

    Datasource ds = MetadataSniffer.sniff(given, grid(), NOW);

    assertThat(ds.coordinates()).containsOnlyKeys("t");
    assertThat(ds.geom()).isEqualTo(box);
    assertThat(ds.tstart()).isEqualTo(Instant.parse("2000-01-01T00:00:00Z"));
    assertThat(ds.tend()).isNull();
  }

  @Test
  void tablesWithoutTimeFallBackToDefaults() {
    DataTable table = DataTable.builder().strings("site", "a", "b").doubles("hs", 1, 2).build();

    Datasource ds = MetadataSniffer.sniff(blank, table, NOW);

    assertThat(ds.tstart()).isEqualTo(Instant.EPOCH);
    assertThat(ds.tend()).isEqualTo(NOW);
    assertThat(ds.coordinates()).containsEntry("s", "site");
  }

  @Test
  void tableTimestampColumnBoundsTimes() {
    DataTable table =
        DataTable.builder()
            .timestamps("time", T1, T0)
            .doubles("lon", 1, 2)
            .doubles("lat", 3, 4)
            .build();

    Datasource ds = MetadataSniffer.sniff(blank, table, NOW);

    assertThat(ds.tstart()).isEqualTo(T0);
    assertThat(ds.tend()).isEqualTo(T1);
    assertThat(ds.bounds()).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 3, 2, 4));
  }

  @Test
  void geoTableBoundsComeFromGeometries() {
    GeoTable geo =
        GeoTable.of(
            DataTable.builder().strings("name", "a", "b").build(),
            List.of(Geometry.point(174, -41), Geometry.point(176, -37)));

    Datasource ds = MetadataSniffer.sniff(blank, geo, NOW);

    assertThat(ds.coordinates()).containsEntry("g", GeoTable.DEFAULT_GEOMETRY_COLUMN);
    assertThat(ds.bounds())
        .hasValueSatisfying(b -> assertThat(b).containsExactly(174, -41, 176, -37));
  }

  @Test
  void crsIsRecordedUnlessWgs84() {
    assertThat(MetadataSniffer.withCrs(blank, "EPSG:2193").schema().attrs())
        .containsEntry("crs", 2193);
    assertThat(MetadataSniffer.withCrs(blank, "epsg:4326")).isEqualTo(blank);
    assertThat(MetadataSniffer.withCrs(blank, "+proj=utm +zone=60").schema().attrs())
        .containsEntry("crs", "+proj=utm +zone=60");
  }

  @Test
  void driversFollowContainerKind() {
    assertThat(MetadataSniffer.driverFor(grid())).isEqualTo("onzarr");
    assertThat(MetadataSniffer.driverFor(DataTable.builder().longs("id", 1).build()))
        .isEqualTo("onsql");
  }

  @Test
  void originPointCountsAsMissingGeometry() throws Exception {
    JsonNode origin =
        DatameshJson.mapper().readTree("{\"type\": \"Point\", \"coordinates\": [0, 0]}");
    JsonNode elsewhere =
        DatameshJson.mapper().readTree("{\"type\": \"Point\", \"coordinates\": [174, -41]}");

    assertThat(MetadataSniffer.isMissingGeometry(origin)).isTrue();
    assertThat(MetadataSniffer.isMissingGeometry(null)).isTrue();
    assertThat(MetadataSniffer.isMissingGeometry(elsewhere)).isFalse();
  }
}
