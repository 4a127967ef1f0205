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

package ai.floedb.datamesh.client.stage;

import ai.floedb.datamesh.arrow.ArrowTables;
import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.Stage;
import ai.floedb.datamesh.zarr.ZarrDatasets;
import ai.floedb.datamesh.zarr.ZipChunkArchives;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Encodings a staged result can be downloaded in. */
public enum TransferFormat {
  /** Zip archive of a consolidated zarr group, for datasets. */
  ZARR_ZIP("application/x-zarr+zip") {
    @Override
    public boolean supports(ContainerKind kind) {
      return kind == ContainerKind.DATASET;
    }

    @Override
    public DataContainer decode(Path payload) throws IOException {
      return ZarrDatasets.open(ZipChunkArchives.read(payload)).load();
    }
  },
  /** Arrow IPC stream, for tables and geo-tables. */
  ARROW_STREAM(ArrowTables.MEDIA_TYPE) {
    @Override
    public boolean supports(ContainerKind kind) {
      return kind != ContainerKind.DATASET;
    }

    @Override
    public DataContainer decode(Path payload) throws IOException {
      try (InputStream in = Files.newInputStream(payload)) {
        return ArrowTables.read(in);
      }
    }
  };

  private final String mediaType;

  TransferFormat(String mediaType) {
    this.mediaType = mediaType;
  }

  public String mediaType() {
    return mediaType;
  }

  public abstract boolean supports(ContainerKind kind);

  /** Reads a downloaded payload. */
  public abstract DataContainer decode(Path payload) throws IOException;

  public static TransferFormat natural(ContainerKind kind) {
    return kind == ContainerKind.DATASET ? ZARR_ZIP : ARROW_STREAM;
  }

  /**
   * First format offered by the stage that this client can decode for the stage's container. A
   * stage that lists no formats, or none we know, gets the container's natural format.
   */
  public static TransferFormat negotiate(Stage stage) {
    for (String offered : stage.formats()) {
      for (TransferFormat f : values()) {
        if (f.mediaType.equalsIgnoreCase(offered.trim()) && f.supports(stage.container())) {
          return f;
        }
      }
    }
    return natural(stage.container());
  }
}
