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

import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ZipChunkArchivesTest {

  @TempDir Path tmp;

  @Test
  void archiveCarriesEveryKey() throws Exception {
    InMemoryChunkStore store = new InMemoryChunkStore();
    LabeledDataset ds =
        LabeledDataset.builder()
            .coord("lat", NdArray.vector(-41.0, -40.5))
            .dataVar("sst", List.of("lat"), NdArray.vector(14.2, Double.NaN))
            .build();
    ZarrDatasets.write(ds, store);

    Path file = tmp.resolve("ds.zarr.zip");
    ZipChunkArchives.write(store, file);
    InMemoryChunkStore back = ZipChunkArchives.read(file);

    assertThat(back.allKeys()).isEqualTo(store.allKeys());
    assertThat(ZarrDatasets.open(back).load()).isEqualTo(ds);
    assertThat(ZipChunkArchives.unpack(ZipChunkArchives.pack(store)).allKeys())
        .isEqualTo(store.allKeys());
  }

  @Test
  void inMemoryDeleteRemovesDirectories() {
    InMemoryChunkStore store = new InMemoryChunkStore();
    store.set("a/.zarray", new byte[] {1});
    store.set("a/0", new byte[] {2});
    store.set("ab", new byte[] {3});
    store.set(".zgroup", new byte[] {4});

    assertThat(store.keys()).containsExactly(".zgroup", "a/", "ab");
    store.delete("a");
    assertThat(store.allKeys()).containsExactly(".zgroup", "ab");
    store.delete("");
    assertThat(store.size()).isZero();
  }
}
