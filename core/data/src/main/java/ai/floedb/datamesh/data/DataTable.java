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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Column-oriented table with typed, nullable columns of equal length. */
public final class DataTable implements DataContainer {

  public enum ColumnType {
    INT64(Long.class, "int64"),
    FLOAT64(Double.class, "float64"),
    STRING(String.class, "object"),
    BOOLEAN(Boolean.class, "bool"),
    TIMESTAMP(Instant.class, "datetime64[ns]");

    private final Class<?> javaType;
    private final String dtypeName;

    ColumnType(Class<?> javaType, String dtypeName) {
      this.javaType = javaType;
      this.dtypeName = dtypeName;
    }

    public Class<?> javaType() {
      return javaType;
    }

    public String dtypeName() {
      return dtypeName;
    }

    public boolean isNumeric() {
      return this == INT64 || this == FLOAT64;
    }
  }

  public record Column(String name, ColumnType type, List<Object> values) {
    public Column {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(values, "values");
      List<Object> copy = new ArrayList<>(values.size());
      for (Object v : values) {
        if (v != null && !type.javaType().isInstance(v)) {
          throw new IllegalArgumentException(
              "Column " + name + " of type " + type + " cannot hold " + v.getClass().getName());
        }
        copy.add(v);
      }
      values = Collections.unmodifiableList(copy);
    }

    /** Numeric view of the column; nulls become NaN. */
    public double[] doubles() {
      double[] out = new double[values.size()];
      for (int i = 0; i < out.length; i++) {
        Object v = values.get(i);
        if (v == null) {
          out[i] = Double.NaN;
        } else if (v instanceof Number n) {
          out[i] = n.doubleValue();
        } else if (v instanceof Instant t) {
          out[i] = t.getEpochSecond();
        } else {
          throw new IllegalStateException("Column " + name + " is not numeric");
        }
      }
      return out;
    }
  }

  private final List<Column> columns;
  private final int rowCount;

  public DataTable(List<Column> columns) {
    this.columns = List.copyOf(columns);
    int rows = -1;
    Map<String, Boolean> seen = new LinkedHashMap<>();
    for (Column c : this.columns) {
      if (seen.put(c.name(), Boolean.TRUE) != null) {
        throw new IllegalArgumentException("Duplicate column " + c.name());
      }
      if (rows >= 0 && c.values().size() != rows) {
        throw new IllegalArgumentException(
            "Column " + c.name() + " has " + c.values().size() + " rows, expected " + rows);
      }
      rows = c.values().size();
    }
    this.rowCount = Math.max(rows, 0);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ContainerKind kind() {
    return ContainerKind.TABLE;
  }

  public List<Column> columns() {
    return columns;
  }

  public List<String> columnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column c : columns) {
      names.add(c.name());
    }
    return names;
  }

  public Optional<Column> column(String name) {
    for (Column c : columns) {
      if (c.name().equals(name)) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  public int rowCount() {
    return rowCount;
  }

  /** Rows concatenated; both tables must have the same columns in the same order. */
  public DataTable append(DataTable other) {
    if (!columnNames().equals(other.columnNames())) {
      throw new IllegalArgumentException("Cannot append tables with different columns");
    }
    List<Column> out = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      Column a = columns.get(i);
      Column b = other.columns.get(i);
      if (a.type() != b.type()) {
        throw new IllegalArgumentException("Column " + a.name() + " changes type");
      }
      List<Object> values = new ArrayList<>(a.values());
      values.addAll(b.values());
      out.add(new Column(a.name(), a.type(), values));
    }
    return new DataTable(out);
  }

  /**
   * Schema block matching what the metadata service derives from a table: one {@code index}
   * dimension, every column a data variable along it.
   */
  @Override
  public DatasourceSchema toSchema() {
    return new DatasourceSchema(
        Map.of(), Map.of("index", rowCount), Map.of(), describeColumns(columns));
  }

  static Map<String, Object> describeColumns(List<Column> columns) {
    Map<String, Object> vars = new LinkedHashMap<>();
    for (Column c : columns) {
      Map<String, Object> field = new LinkedHashMap<>();
      field.put("dims", List.of("index"));
      field.put("attrs", Map.of());
      field.put("dtype", c.type().dtypeName());
      vars.put(c.name(), field);
    }
    return vars;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DataTable other && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "DataTable{rows=" + rowCount + ", columns=" + columnNames() + "}";
  }

  public static final class Builder {
    private final List<Column> columns = new ArrayList<>();

    private Builder() {}

    public Builder column(String name, ColumnType type, List<?> values) {
      columns.add(new Column(name, type, new ArrayList<>(values)));
      return this;
    }

    public Builder longs(String name, long... values) {
      List<Object> v = new ArrayList<>(values.length);
      for (long x : values) {
        v.add(x);
      }
      return column(name, ColumnType.INT64, v);
    }

    public Builder doubles(String name, double... values) {
      List<Object> v = new ArrayList<>(values.length);
      for (double x : values) {
        v.add(x);
      }
      return column(name, ColumnType.FLOAT64, v);
    }

    public Builder strings(String name, String... values) {
      return column(name, ColumnType.STRING, Arrays.asList((Object[]) values));
    }

    public Builder timestamps(String name, Instant... values) {
      return column(name, ColumnType.TIMESTAMP, Arrays.asList((Object[]) values));
    }

    public DataTable build() {
      return new DataTable(columns);
    }
  }
}
