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

import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.DatasourceSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Table with one geometry column and the coordinate reference system its geometries use. */
public final class GeoTable implements DataContainer {

  public static final String DEFAULT_GEOMETRY_COLUMN = "geometry";
  public static final String DEFAULT_CRS = "EPSG:4326";

  private final DataTable attributes;
  private final String geometryColumn;
  private final List<Geometry> geometries;
  private final String crs;

  public GeoTable(
      DataTable attributes, String geometryColumn, List<Geometry> geometries, String crs) {
    this.attributes = Objects.requireNonNull(attributes, "attributes");
    this.geometryColumn = Objects.requireNonNullElse(geometryColumn, DEFAULT_GEOMETRY_COLUMN);
    this.geometries = List.copyOf(geometries);
    this.crs = Objects.requireNonNullElse(crs, DEFAULT_CRS);
    if (!attributes.columns().isEmpty() && attributes.rowCount() != this.geometries.size()) {
      throw new IllegalArgumentException(
          this.geometries.size() + " geometries for " + attributes.rowCount() + " rows");
    }
    if (attributes.column(this.geometryColumn).isPresent()) {
      throw new IllegalArgumentException(
          "Attribute column clashes with geometry column " + this.geometryColumn);
    }
  }

  public static GeoTable of(DataTable attributes, List<Geometry> geometries) {
    return new GeoTable(attributes, null, geometries, null);
  }

  @Override
  public ContainerKind kind() {
    return ContainerKind.GEO_TABLE;
  }

  public DataTable attributes() {
    return attributes;
  }

  public String geometryColumn() {
    return geometryColumn;
  }

  public List<Geometry> geometries() {
    return geometries;
  }

  public String crs() {
    return crs;
  }

  public int rowCount() {
    return geometries.size();
  }

  /** Envelope of all geometries, empty when there are none with coordinates. */
  public Optional<double[]> bounds() {
    double[] b = {
      Double.POSITIVE_INFINITY,
      Double.POSITIVE_INFINITY,
      Double.NEGATIVE_INFINITY,
      Double.NEGATIVE_INFINITY
    };
    for (Geometry g : geometries) {
      double[] e = g.envelope();
      if (Double.isNaN(e[0])) {
        continue;
      }
      b[0] = Math.min(b[0], e[0]);
      b[1] = Math.min(b[1], e[1]);
      b[2] = Math.max(b[2], e[2]);
      b[3] = Math.max(b[3], e[3]);
    }
    return b[0] > b[2] ? Optional.empty() : Optional.of(b);
  }

  @Override
  public DatasourceSchema toSchema() {
    Map<String, Object> vars = new LinkedHashMap<>(DataTable.describeColumns(attributes.columns()));
    Map<String, Object> geom = new LinkedHashMap<>();
    geom.put("dims", List.of("index"));
    geom.put("attrs", Map.of("crs", crs));
    geom.put("dtype", "geometry");
    vars.put(geometryColumn, geom);
    return new DatasourceSchema(Map.of(), Map.of("index", rowCount()), Map.of(), vars);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GeoTable other)) {
      return false;
    }
    return attributes.equals(other.attributes)
        && geometryColumn.equals(other.geometryColumn)
        && geometries.equals(other.geometries)
        && crs.equals(other.crs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attributes, geometryColumn, geometries, crs);
  }

  @Override
  public String toString() {
    return "GeoTable{rows=" + rowCount() + ", crs=" + crs + ", columns="
        + attributes.columnNames() + "}";
  }
}
