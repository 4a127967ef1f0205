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

import java.time.Instant;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class CatalogTest {

  @Test
  void parsesFeatureCollectionInOrder() throws Exception {
    String json =
        """
        {"type": "FeatureCollection", "features": [
          {"type": "Feature", "id": "bbb", "geometry": null, "properties": {"name": "B"}},
          {"type": "Feature", "id": "aaa", "geometry": {"type": "Point", "coordinates": [1, 2]},
           "properties": {}}
        ]}
        """;

    Catalog catalog = Catalog.fromFeatureCollection(DatameshJson.mapper().readTree(json));

    assertThat(catalog.ids()).containsExactly("bbb", "aaa");
    assertThat(catalog.get("aaa").detail()).isEqualTo(DetailLevel.SUMMARY);
    assertThat(catalog.get("bbb").datasource().bounds()).isEmpty();
    assertThat(catalog).hasSize(2);
    assertThatThrownBy(() -> catalog.get("zzz")).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void searchParamsRenderRangeAndWkt() {
    CatalogSearch search =
        new CatalogSearch(
            "wave",
            TimeFilter.range(TimeBound.at(Instant.parse("2020-01-01T00:00:00Z")), null),
            GeoFilter.bbox(170, -45, 175, -40),
            5);

    Map<String, String> params = search.toParams(Instant.parse("2024-01-01T00:00:00Z"));

    assertThat(params)
        .containsEntry("limit", "5")
        .containsEntry("search", "wave")
        .containsEntry("in_trange", "2020-01-01 00:00:00Z,2500-01-01 00:00:00Z")
        .containsEntry(
            "geom_intersects", "POLYGON ((175 -45, 175 -40, 170 -40, 170 -45, 175 -45))");
    assertThat(CatalogSearch.ALL.toParams(Instant.EPOCH)).isEmpty();
  }

  @Test
  void featureGeometryRendersAsWkt() throws Exception {
    String point =
        "{\"type\": \"Feature\","
            + " \"geometry\": {\"type\": \"Point\", \"coordinates\": [174.5, -41]}}";
    assertThat(GeoJsonWkt.toWkt(DatameshJson.mapper().readTree(point)))
        .isEqualTo("POINT (174.5 -41)");

    String multi =
        "{\"type\": \"MultiPoint\", \"coordinates\": [[1, 2], [3, 4]]}";
    assertThat(GeoJsonWkt.toWkt(DatameshJson.mapper().readTree(multi)))
        .isEqualTo("MULTIPOINT ((1 2), (3 4))");
  }
}
