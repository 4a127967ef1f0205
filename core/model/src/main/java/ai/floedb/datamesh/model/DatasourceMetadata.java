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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a datasource as seen by one lookup, tagged with how much detail the
 * lookup returned. Variables and attributes are only defined for {@link DetailLevel#DETAILED}.
 */
public record DatasourceMetadata(Datasource datasource, DetailLevel detail) {

  public DatasourceMetadata {
    Objects.requireNonNull(datasource, "datasource");
    Objects.requireNonNull(detail, "detail");
  }

  public static DatasourceMetadata summary(Datasource datasource) {
    return new DatasourceMetadata(datasource, DetailLevel.SUMMARY);
  }

  public static DatasourceMetadata detailed(Datasource datasource) {
    return new DatasourceMetadata(datasource, DetailLevel.DETAILED);
  }

  public String id() {
    return datasource.id();
  }

  public boolean isDetailed() {
    return detail == DetailLevel.DETAILED;
  }

  public Optional<Map<String, Object>> variables() {
    return isDetailed() ? Optional.of(datasource.schema().dataVars()) : Optional.empty();
  }

  public Optional<Map<String, Object>> attributes() {
    return isDetailed() ? Optional.of(datasource.schema().attrs()) : Optional.empty();
  }

  public DatasourceMetadata withDatasource(Datasource updated) {
    return new DatasourceMetadata(updated, detail);
  }

  @Override
  public String toString() {
    Datasource d = datasource;
    StringBuilder sb = new StringBuilder();
    sb.append(d.name()).append(" [").append(d.id()).append("]\n");
    sb.append("    Extent: ")
        .append(d.bounds().map(java.util.Arrays::toString).orElse("None"))
        .append('\n');
    sb.append("    Timerange: ").append(d.tstart()).append(" to ").append(d.tend()).append('\n');
    if (isDetailed()) {
      sb.append("    ").append(d.schema().attrs().size()).append(" attributes\n");
      sb.append("    ")
          .append(d.schema().dataVars().size())
          .append(d.coordinates().containsKey("g") ? " properties" : " variables")
          .append('\n');
    }
    return sb.toString();
  }
}
