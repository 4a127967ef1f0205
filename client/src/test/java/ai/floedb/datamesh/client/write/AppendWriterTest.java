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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.datamesh.client.metrics.DatameshMetrics;
import ai.floedb.datamesh.client.session.SessionManager;
import ai.floedb.datamesh.client.transport.ScriptedSender;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.error.DatameshConnectException;
import ai.floedb.datamesh.error.DatameshWriteException;
import ai.floedb.datamesh.model.Datasource;
import ai.floedb.datamesh.model.DatasourceMetadata;
import ai.floedb.datamesh.zarr.InMemoryChunkStore;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class AppendWriterTest {

  private static final String ID = "wave-buoy";

  private final InMemoryChunkStore store = new InMemoryChunkStore();
  private final AtomicReference<DatasourceMetadata> registered = new AtomicReference<>();
  private final AtomicReference<RuntimeException> lookupFailure = new AtomicReference<>();
  private final ScriptedSender sender = new ScriptedSender();
  private final AppendWriter writer =
      new AppendWriter(
          new SessionManager(
              sender.transport(1),
              "http://gw",
              Map.of(),
              true,
              null,
              null,
              DatameshMetrics.inMemory()),
          (id, lease) -> store,
          id -> {
            RuntimeException failure = lookupFailure.get();
            if (failure != null) {
              throw failure;
            }
            return Optional.ofNullable(registered.get());
          });
  private final Datasource template = Datasource.builder(ID).build();

  private static LabeledDataset batch(double[] time, double[] hs) {
    return LabeledDataset.builder()
        .coord("time", NdArray.vector(time))
        .coord("site", NdArray.vector(1L))
        .dataVar("hs", List.of("time", "site"), NdArray.ofDoubles(hs, hs.length, 1))
        .build();
  }

  private static double[] d(double... values) {
    return values;
  }

  private void seed(double[] time, double[] hs) {
    registered.set(writer.write(ID, batch(time, hs), null, false, template));
  }

  private LabeledDataset stored() {
    return ZarrDatasets.open(store).load();
  }

  @Test
  void appendsPastStoredRange() {
    seed(d(0, 1, 2), d(0, 1, 2));

    DatasourceMetadata meta = writer.write(ID, batch(d(3, 4), d(3, 4)), "time", false, template);

    assertThat(stored().require("time").data().toDoubles()).containsExactly(0, 1, 2, 3, 4);
    assertThat(stored().require("hs").data().toDoubles()).containsExactly(0, 1, 2, 3, 4);
    assertThat(meta.id()).isEqualTo(ID);
    assertThat(meta.datasource().schema().coords()).containsKey("time");
    assertThat(sender.requests()).isEmpty();
  }

  @Test
  void overlappingTailIsReplacedThenExtended() {
    seed(d(0, 1, 2, 3), d(0, 0, 0, 0));

    writer.write(ID, batch(d(2, 3, 4, 5), d(9, 9, 9, 9)), "time", false, template);

    assertThat(stored().require("time").data().toDoubles()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(stored().require("hs").data().toDoubles()).containsExactly(0, 0, 9, 9, 9, 9);
  }

  @Test
  void matchingInteriorSectionIsRewrittenInPlace() {
    seed(d(0, 1, 2, 3, 4, 5), d(0, 0, 0, 0, 0, 0));

    writer.write(ID, batch(d(1, 2), d(7, 7)), "time", false, template);

    assertThat(stored().require("time").data().toDoubles()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(stored().require("hs").data().toDoubles()).containsExactly(0, 7, 7, 0, 0, 0);
  }

  @Test
  void interiorMismatchIsRejectedWithoutChanges() {
    seed(d(0, 1, 2, 3, 4, 5), d(0, 1, 2, 3, 4, 5));
    LabeledDataset before = stored();

    assertThatThrownBy(
            () -> writer.write(ID, batch(d(1, 1.5, 2), d(7, 7, 7)), "time", false, template))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessageContaining("inner section");
    assertThat(stored()).isEqualTo(before);
  }

  @Test
  void batchThatWouldShrinkStoredRangeIsRejected() {
    seed(d(0, 1, 2, 3, 4), d(0, 1, 2, 3, 4));
    LabeledDataset before = stored();

    assertThatThrownBy(() -> writer.write(ID, batch(d(1, 3), d(7, 7)), "time", false, template))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessageContaining("smaller than the original");
    assertThat(stored()).isEqualTo(before);
  }

  @Test
  void failedLookupLeavesStoreUntouched() {
    seed(d(0, 1), d(0, 1));
    LabeledDataset before = stored();
    lookupFailure.set(new DatameshConnectException("Datamesh server error: unavailable"));

    assertThatThrownBy(() -> writer.write(ID, batch(d(2), d(2)), "time", false, template))
        .isInstanceOf(DatameshConnectException.class)
        .hasMessage("Datamesh server error: unavailable");
    assertThat(stored()).isEqualTo(before);
  }

  @Test
  void unknownVariablesAreRejectedBeforeWriting() {
    seed(d(0, 1), d(0, 1));
    LabeledDataset extra =
        batch(d(2), d(2)).toBuilder()
            .dataVar("tp", List.of("time"), NdArray.vector(12.0))
            .build();

    assertThatThrownBy(() -> writer.write(ID, extra, "time", false, template))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessage("Variable tp not in existing zarr");
    assertThat(stored().dims()).containsEntry("time", 2);
  }

  @Test
  void appendCoordinatesMustAscend() {
    seed(d(0, 1), d(0, 1));

    assertThatThrownBy(() -> writer.write(ID, batch(d(5, 4), d(0, 0)), "time", false, template))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessageContaining("ascending");
  }

  @Test
  void unknownAppendCoordinateIsRejected() {
    seed(d(0, 1), d(0, 1));

    assertThatThrownBy(() -> writer.write(ID, batch(d(2), d(2)), "depth", false, template))
        .isInstanceOf(DatameshWriteException.class)
        .hasMessageContaining("depth");
  }

  @Test
  void overwriteReplacesStoredData() {
    seed(d(0, 1, 2), d(0, 1, 2));

    writer.write(ID, batch(d(10, 11), d(5, 6)), "time", true, template);

    assertThat(stored()).isEqualTo(batch(d(10, 11), d(5, 6)));
  }

  @Test
  void unregisteredDatasourceIsWrittenFromTemplate() {
    DatasourceMetadata meta =
        writer.write(ID, batch(d(0, 1), d(0, 1)), "time", false, template);

    assertThat(meta.datasource().name()).isEqualTo(template.name());
    assertThat(meta.datasource().schema().dataVars()).containsKey("hs");
    assertThat(stored()).isEqualTo(batch(d(0, 1), d(0, 1)));
  }
}
