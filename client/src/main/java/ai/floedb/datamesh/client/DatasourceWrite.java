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

package ai.floedb.datamesh.client;

import ai.floedb.datamesh.data.DataContainer;
import java.util.Objects;

/**
 * A request to write data and metadata to a datasource.
 *
 * @param data container to store, or {@code null} to only write metadata
 * @param append coordinate (datasets) or index column (tables) to append along; {@code null}
 *     replaces the stored data
 * @param overwrite delete any existing datasource of that id first
 * @param crs coordinate reference system of the data when it is not WGS84, such as {@code
 *     EPSG:2193}
 */
public record DatasourceWrite(
    String id,
    DataContainer data,
    String append,
    boolean overwrite,
    String crs,
    DatasourceUpdate properties) {

  public DatasourceWrite {
    Objects.requireNonNull(id, "id");
    properties = Objects.requireNonNullElse(properties, DatasourceUpdate.NONE);
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public static final class Builder {
    private final String id;
    private DataContainer data;
    private String append;
    private boolean overwrite;
    private String crs;
    private DatasourceUpdate properties;

    private Builder(String id) {
      this.id = id;
    }

    public Builder data(DataContainer data) {
      this.data = data;
      return this;
    }

    public Builder append(String append) {
      this.append = append;
      return this;
    }

    public Builder overwrite(boolean overwrite) {
      this.overwrite = overwrite;
      return this;
    }

    public Builder crs(String crs) {
      this.crs = crs;
      return this;
    }

    public Builder properties(DatasourceUpdate properties) {
      this.properties = properties;
      return this;
    }

    public DatasourceWrite build() {
      return new DatasourceWrite(id, data, append, overwrite, crs, properties);
    }
  }
}
