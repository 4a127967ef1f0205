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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeoTableTest {

  @Test
  void boundsCoverAllGeometries() {
    GeoTable t =
        GeoTable.of(
            DataTable.builder().strings("site", "a", "b").doubles("hs", 1.5, 2.5).build(),
            List.of(Geometry.point(174.0, -41.0), Geometry.point(176.5, -37.0)));

    assertThat(t.rowCount()).isEqualTo(2);
    assertThat(t.crs()).isEqualTo("EPSG:4326");
    assertThat(t.bounds())
        .hasValueSatisfying(b -> assertThat(b).containsExactly(174.0, -41.0, 176.5, -37.0));
    assertThat(t.toSchema().dataVars()).containsOnlyKeys("site", "hs", "geometry");
  }

  @Test
  void envelopeOfBigEndianPolygon() {
    ByteBuffer b = ByteBuffer.allocate(1 + 4 + 4 + 4 + 4 * 16).order(ByteOrder.BIG_ENDIAN);
    b.put((byte) 0).putInt(3).putInt(1).putInt(4);
    b.putDouble(0).putDouble(0);
    b.putDouble(2).putDouble(0);
    b.putDouble(2).putDouble(3);
    b.putDouble(0).putDouble(0);

    assertThat(Geometry.fromWkb(b.array()).envelope()).containsExactly(0.0, 0.0, 2.0, 3.0);
  }

  @Test
  void rowCountsMustAgree() {
    assertThatThrownBy(
            () ->
                GeoTable.of(
                    DataTable.builder().longs("id", 1, 2).build(),
                    List.of(Geometry.point(0, 0))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DataTable.builder().longs("a", 1).longs("b", 1, 2).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
