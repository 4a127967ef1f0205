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

import ai.floedb.datamesh.client.session.SessionLease;
import ai.floedb.datamesh.client.session.SessionManager;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.data.Variable;
import ai.floedb.datamesh.error.DatameshWriteException;
import ai.floedb.datamesh.model.Datasource;
import ai.floedb.datamesh.model.DatasourceMetadata;
import ai.floedb.datamesh.model.DatasourceSchema;
import ai.floedb.datamesh.zarr.ChunkNotFoundException;
import ai.floedb.datamesh.zarr.ChunkStore;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import ai.floedb.datamesh.zarr.ZarrGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Writes a labeled dataset into a datasource's chunk store, either replacing it or merging it
 * along an append coordinate.
 *
 * <p>Merging works on the index range of the stored coordinate whose values fall within the new
 * batch's value range. That range is overwritten in place with the head of the batch, and the
 * rest of the batch extends the arrays. Both the stored and the new append coordinate must be
 * ascending. Stored arrays never shrink. A batch that replaces an interior section must agree with
 * the stored coordinate values over that section. Every check runs before the first remote
 * mutation.
 */
public final class AppendWriter {

  private static final Logger LOG = Logger.getLogger(AppendWriter.class);

  /** Opens the writable chunk store of a datasource under a session. */
  @FunctionalInterface
  public interface StoreFactory {
    ChunkStore open(String datasourceId, SessionLease lease);
  }

  private final SessionManager sessions;
  private final StoreFactory stores;
  private final Function<String, Optional<DatasourceMetadata>> lookup;

  /**
   * @param lookup current metadata of a datasource, empty only when it does not exist; any other
   *     lookup failure is thrown
   */
  public AppendWriter(
      SessionManager sessions,
      StoreFactory stores,
      Function<String, Optional<DatasourceMetadata>> lookup) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.lookup = Objects.requireNonNull(lookup, "lookup");
  }

  /**
   * Writes {@code data} to {@code datasourceId} within one session, finalised on success.
   *
   * @param appendCoord coordinate to merge along, or {@code null} to replace the stored data
   * @param overwrite clear the store first and ignore {@code appendCoord}
   * @param template metadata used when the datasource is not registered yet
   * @return the datasource metadata with its schema refreshed from what was written
   * @throws DatameshWriteException when the batch cannot be merged consistently
   */
  public DatasourceMetadata write(
      String datasourceId,
      LabeledDataset data,
      String appendCoord,
      boolean overwrite,
      Datasource template) {
    Objects.requireNonNull(datasourceId, "datasourceId");
    Objects.requireNonNull(data, "data");
    return sessions.withSession(
        lease -> {
          ChunkStore store = stores.open(datasourceId, lease);
          Optional<DatasourceMetadata> existing = Optional.empty();
          String append = appendCoord;
          if (overwrite) {
            store.clear();
            append = null;
          } else {
            existing = lookup.apply(datasourceId);
          }
          if (append != null && existing.isPresent()) {
            merge(store, existing.get(), data, append);
            return existing.get().withDatasource(refreshed(existing.get().datasource(), store));
          }
          if (!overwrite) {
            store.clear();
          }
          try {
            ZarrDatasets.write(data, store);
          } catch (IllegalArgumentException e) {
            throw new DatameshWriteException(e.getMessage(), e);
          }
          LOG.debugf("Wrote %s with dims %s", datasourceId, data.dims());
          DatasourceMetadata meta =
              lookup.apply(datasourceId).orElseGet(() -> DatasourceMetadata.detailed(template));
          return meta.withDatasource(
              meta.datasource().toBuilder().schema(data.toSchema()).build());
        });
  }

  private void merge(
      ChunkStore store, DatasourceMetadata existing, LabeledDataset data, String append) {
    DatasourceSchema schema = existing.datasource().schema();
    if (!schema.coords().containsKey(append)) {
      throw new DatameshWriteException("Append coordinate " + append + " not in existing zarr");
    }
    try (ZarrGroup group = ZarrDatasets.open(store)) {
      Variable stored = group.read(append);
      if (stored.dims().size() != 1) {
        throw new DatameshWriteException(
            "Append coordinate " + append + " has more than one dimension");
      }
      String dim = stored.dims().get(0);
      Variable incoming =
          data.variable(append)
              .orElseThrow(
                  () -> new DatameshWriteException("Append coordinate " + append + " not in data"));
      if (!incoming.dims().equals(stored.dims())) {
        throw new DatameshWriteException(
            "Append coordinate " + append + " must vary along " + dim + " only");
      }
      for (String name : allNames(data)) {
        if (!group.hasVariable(name)) {
          throw new DatameshWriteException("Variable " + name + " not in existing zarr");
        }
      }
      double[] have = stored.data().toDoubles();
      double[] add = incoming.data().toDoubles();
      requireAscending(append, have, "stored");
      requireAscending(append, add, "new");
      if (add.length == 0) {
        return;
      }

      int first = -1;
      int last = -1;
      for (int i = 0; i < have.length; i++) {
        if (have[i] >= add[0] && have[i] <= add[add.length - 1]) {
          if (first < 0) {
            first = i;
          }
          last = i;
        }
      }
      int replaced = first < 0 ? 0 : last - first + 1;
      if (replaced > add.length) {
        throw new DatameshWriteException(
            "Cannot append to zarr with a region that would be smaller than the original");
      }

      LabeledDataset section = null;
      if (replaced > 0) {
        List<String> drop = new ArrayList<>(data.coords().keySet());
        drop.remove(append);
        section = data.isel(dim, 0, replaced).dropVars(drop).alongDim(dim);
        if (last + 1 < have.length) {
          NdArray replacing = section.require(append).data().as(NdArray.DType.FLOAT64);
          NdArray current = stored.data().slice(0, first, last + 1).as(NdArray.DType.FLOAT64);
          if (!replacing.equals(current)) {
            throw new DatameshWriteException(
                "Data inconsistency on coordinate "
                    + append
                    + " replacing an inner section of an existing zarr array");
          }
        }
      }

      try {
        if (section != null) {
          ZarrDatasets.writeRegion(store, section, dim, first);
        }
        if (add.length > replaced) {
          ZarrDatasets.append(store, data.isel(dim, replaced, add.length), dim);
        }
      } catch (IllegalArgumentException e) {
        throw new DatameshWriteException(e.getMessage(), e);
      }
      LOG.debugf(
          "Merged %d values of %s: %d replaced from index %d, %d appended",
          add.length, append, replaced, Math.max(first, 0), add.length - replaced);
    } catch (ChunkNotFoundException e) {
      throw new DatameshWriteException(
          "Datasource " + existing.id() + " has no stored data to append to", e);
    }
  }

  private static Datasource refreshed(Datasource datasource, ChunkStore store) {
    try (ZarrGroup group = ZarrDatasets.open(store)) {
      return datasource.toBuilder().schema(group.toSchema()).build();
    }
  }

  private static List<String> allNames(LabeledDataset data) {
    List<String> names = new ArrayList<>(data.coords().keySet());
    names.addAll(data.dataVars().keySet());
    return names;
  }

  private static void requireAscending(String coord, double[] values, String which) {
    for (int i = 1; i < values.length; i++) {
      if (!(values[i] > values[i - 1])) {
        throw new DatameshWriteException(
            "The " + which + " values of append coordinate " + coord + " must be ascending");
      }
    }
  }
}
