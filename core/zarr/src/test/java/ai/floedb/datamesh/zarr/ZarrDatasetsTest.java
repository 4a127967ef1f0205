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

package ai.floedb.datamesh.zarr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.data.Variable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ZarrDatasetsTest {

  /** Store that records the keys written through it. */
  static final class RecordingStore extends InMemoryChunkStore {
    final List<String> writes = new ArrayList<>();

    @Override
    public void set(String key, byte[] value) {
      writes.add(key);
      super.set(key, value);
    }
  }

  private static LabeledDataset series(long t0, int n) {
    long[] t = new long[n];
    double[] hs = new double[n * 2];
    for (int i = 0; i < n; i++) {
      t[i] = t0 + i;
      hs[i * 2] = t[i];
      hs[i * 2 + 1] = -t[i];
    }
    return LabeledDataset.builder()
        .coord("time", NdArray.vector(t))
        .coord("site", NdArray.vector(1L, 2L))
        .coord("label", new Variable(List.of("site"), NdArray.vector(10.0, 20.0), null))
        .dataVar("hs", List.of("time", "site"), NdArray.ofDoubles(hs, n, 2))
        .attr("title", "buoys")
        .build();
  }

  @Test
  void roundTripsThroughChunkedArrays() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    LabeledDataset ds = series(0, 7);

    ZarrDatasets.write(ds, store, ZarrWriteOptions.chunked(Map.of("time", 3)));

    assertThat(store.allKeys()).contains(".zmetadata", "hs/.zarray", "hs/0.0", "hs/2.0");
    try (ZarrGroup g = ZarrDatasets.open(store)) {
      assertThat(g.coordNames()).containsExactly("time", "site", "label");
      assertThat(g.dataVarNames()).containsExactly("hs");
      assertThat(g.dims()).containsEntry("time", 7).containsEntry("site", 2);
      assertThat(g.read("hs", "time", 2, 5).data().toDoubles())
          .containsExactly(2, -2, 3, -3, 4, -4);
      assertThat(g.load()).isEqualTo(ds);
      assertThat(g.toSchema().coords()).containsOnlyKeys("time", "site", "label");
    }
  }

  @Test
  void opensFromListingWithoutConsolidatedMetadata() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    LabeledDataset ds = series(100, 4);
    ZarrDatasets.write(ds, store);
    store.delete(".zmetadata");

    assertThat(ZarrDatasets.open(store).load()).isEqualTo(ds);
  }

  @Test
  void missingGroupIsNotFound() {
    assertThatThrownBy(() -> ZarrDatasets.open(new InMemoryChunkStore()))
        .isInstanceOf(ChunkNotFoundException.class);
  }

  @Test
  void regionWriteRewritesOnlyTouchedChunks() {
    RecordingStore store = new RecordingStore();
    ZarrDatasets.write(series(0, 9), store, ZarrWriteOptions.chunked(Map.of("time", 3)));
    store.writes.clear();

    LabeledDataset patch = series(50, 2).alongDim("time");
    ZarrDatasets.writeRegion(store, patch, "time", 4);

    assertThat(store.writes).containsExactlyInAnyOrder("time/1", "hs/1.0");
    LabeledDataset back = ZarrDatasets.open(store).load();
    assertThat(back.require("time").data().toLongs())
        .containsExactly(0, 1, 2, 3, 50, 51, 6, 7, 8);
    assertThat(back.require("hs").data().doubleAt(5, 1)).isEqualTo(-51);
  }

  @Test
  void regionWriteRejectsVariablesOffTheDimension() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    ZarrDatasets.write(series(0, 4), store);

    assertThatThrownBy(() -> ZarrDatasets.writeRegion(store, series(0, 2), "time", 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("site");
    assertThatThrownBy(
            () -> ZarrDatasets.writeRegion(store, series(0, 2).alongDim("time"), "time", 3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void appendGrowsAlongDimension() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    ZarrDatasets.write(series(0, 5), store, ZarrWriteOptions.chunked(Map.of("time", 2)));

    ZarrDatasets.append(store, series(5, 3), "time");

    ZarrGroup g = ZarrDatasets.open(store);
    assertThat(g.dims()).containsEntry("time", 8);
    assertThat(g.coordNames()).contains("label");
    assertThat(g.load()).isEqualTo(series(0, 8));
  }

  @Test
  void appendRequiresEveryVariableAlongDimension() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    ZarrDatasets.write(series(0, 3), store);

    assertThatThrownBy(
            () -> ZarrDatasets.append(store, series(3, 1).dropVars(List.of("hs")), "time"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("hs");
    assertThat(ZarrDatasets.open(store).dims()).containsEntry("time", 3);
  }

  @Test
  void readsFourByteTypesWidened() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    store.set(".zgroup", "{\"zarr_format\": 2}".getBytes(StandardCharsets.UTF_8));
    store.set(
        "x/.zarray",
        ("{\"chunks\": [3], \"compressor\": null, \"dtype\": \"<i4\", \"fill_value\": 0,"
                + " \"filters\": null, \"order\": \"C\", \"shape\": [3], \"zarr_format\": 2}")
            .getBytes(StandardCharsets.UTF_8));
    store.set("x/.zattrs", "{\"_ARRAY_DIMENSIONS\": [\"x\"]}".getBytes(StandardCharsets.UTF_8));
    ByteBuffer b = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
    b.putInt(7).putInt(-1).putInt(3);
    store.set("x/0", b.array());

    ZarrGroup g = ZarrDatasets.open(store);

    assertThat(g.coordNames()).containsExactly("x");
    assertThat(g.read("x").data()).isEqualTo(NdArray.vector(7L, -1L, 3L));
    assertThat(g.toSchema().coords().get("x")).asString().contains("int32");
  }

  @Test
  void closeHookRunsOnce() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    ZarrDatasets.write(series(0, 1), store);
    int[] calls = new int[1];

    ZarrGroup g = ZarrDatasets.open(store, () -> calls[0]++);
    g.close();
    g.close();

    assertThat(calls[0]).isEqualTo(1);
    assertThat(g.isClosed()).isTrue();
  }
}
