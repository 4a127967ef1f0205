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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Labeled multidimensional dataset: named dimensions, coordinate variables, data variables and
 * global attributes. Dimension lengths are derived from the variables and must agree.
 */
public final class LabeledDataset implements DataContainer {

  private final Map<String, Variable> coords;
  private final Map<String, Variable> dataVars;
  private final Map<String, Object> attrs;
  private final Map<String, Integer> dims;

  private LabeledDataset(
      Map<String, Variable> coords, Map<String, Variable> dataVars, Map<String, Object> attrs) {
    this.coords = Collections.unmodifiableMap(new LinkedHashMap<>(coords));
    this.dataVars = Collections.unmodifiableMap(new LinkedHashMap<>(dataVars));
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    Map<String, Integer> d = new LinkedHashMap<>();
    collectDims(this.coords, d);
    collectDims(this.dataVars, d);
    this.dims = Collections.unmodifiableMap(d);
  }

  private static void collectDims(Map<String, Variable> vars, Map<String, Integer> out) {
    vars.forEach(
        (name, v) -> {
          for (int i = 0; i < v.dims().size(); i++) {
            String dim = v.dims().get(i);
            int len = v.data().length(i);
            Integer prior = out.putIfAbsent(dim, len);
            if (prior != null && prior != len) {
              throw new IllegalArgumentException(
                  "Conflicting sizes for dimension " + dim + ": " + prior + " and " + len
                      + " (variable " + name + ")");
            }
          }
        });
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.coords.putAll(coords);
    b.dataVars.putAll(dataVars);
    b.attrs.putAll(attrs);
    return b;
  }

  @Override
  public ContainerKind kind() {
    return ContainerKind.DATASET;
  }

  public Map<String, Integer> dims() {
    return dims;
  }

  public Map<String, Variable> coords() {
    return coords;
  }

  public Map<String, Variable> dataVars() {
    return dataVars;
  }

  public Map<String, Object> attrs() {
    return attrs;
  }

  /** Coordinate or data variable by name, coordinates first. */
  public Optional<Variable> variable(String name) {
    Variable v = coords.get(name);
    return Optional.ofNullable(v != null ? v : dataVars.get(name));
  }

  public Variable require(String name) {
    return variable(name)
        .orElseThrow(() -> new IllegalArgumentException("No variable named " + name));
  }

  public int length(String dim) {
    Integer n = dims.get(dim);
    if (n == null) {
      throw new IllegalArgumentException("No dimension named " + dim);
    }
    return n;
  }

  /** Positional slice {@code [start, end)} along {@code dim} of every variable that has it. */
  public LabeledDataset isel(String dim, int start, int end) {
    Map<String, Variable> c = new LinkedHashMap<>();
    coords.forEach((k, v) -> c.put(k, v.isel(dim, start, end)));
    Map<String, Variable> d = new LinkedHashMap<>();
    dataVars.forEach((k, v) -> d.put(k, v.isel(dim, start, end)));
    return new LabeledDataset(c, d, attrs);
  }

  public LabeledDataset dropVars(Collection<String> names) {
    return filter(v -> true, names);
  }

  /** Only the coordinates and data variables that vary along {@code dim}. */
  public LabeledDataset alongDim(String dim) {
    return filter(v -> v.hasDim(dim), List.of());
  }

  private LabeledDataset filter(Predicate<Variable> keep, Collection<String> drop) {
    Map<String, Variable> c = new LinkedHashMap<>();
    coords.forEach(
        (k, v) -> {
          if (keep.test(v) && !drop.contains(k)) {
            c.put(k, v);
          }
        });
    Map<String, Variable> d = new LinkedHashMap<>();
    dataVars.forEach(
        (k, v) -> {
          if (keep.test(v) && !drop.contains(k)) {
            d.put(k, v);
          }
        });
    return new LabeledDataset(c, d, attrs);
  }

  /** Schema block in the shape of an xarray {@code to_dict(data=False)}. */
  @Override
  public DatasourceSchema toSchema() {
    return new DatasourceSchema(
        attrs, new LinkedHashMap<>(dims), describe(coords), describe(dataVars));
  }

  private static Map<String, Object> describe(Map<String, Variable> vars) {
    Map<String, Object> out = new LinkedHashMap<>();
    vars.forEach(
        (name, v) -> {
          Map<String, Object> field = new LinkedHashMap<>();
          field.put("dims", new ArrayList<>(v.dims()));
          field.put("attrs", new LinkedHashMap<>(v.attrs()));
          field.put("dtype", v.dtypeName());
          List<Integer> shape = new ArrayList<>();
          for (int n : v.data().shape()) {
            shape.add(n);
          }
          field.put("shape", shape);
          out.put(name, field);
        });
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LabeledDataset other)) {
      return false;
    }
    return coords.equals(other.coords)
        && dataVars.equals(other.dataVars)
        && attrs.equals(other.attrs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(coords, dataVars, attrs);
  }

  @Override
  public String toString() {
    return "LabeledDataset{dims="
        + dims
        + ", coords="
        + coords.keySet()
        + ", dataVars="
        + dataVars.keySet()
        + "}";
  }

  public static final class Builder {
    private final Map<String, Variable> coords = new LinkedHashMap<>();
    private final Map<String, Variable> dataVars = new LinkedHashMap<>();
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    private Builder() {}

    public Builder coord(String name, Variable v) {
      coords.put(name, v);
      return this;
    }

    /** One-dimensional coordinate indexing a dimension of the same name. */
    public Builder coord(String name, NdArray values) {
      return coord(name, Variable.of(name, values));
    }

    public Builder dataVar(String name, Variable v) {
      dataVars.put(name, v);
      return this;
    }

    public Builder dataVar(String name, List<String> dims, NdArray values) {
      return dataVar(name, new Variable(dims, values, null));
    }

    public Builder attr(String key, Object value) {
      attrs.put(key, value);
      return this;
    }

    public Builder attrs(Map<String, Object> values) {
      attrs.putAll(values);
      return this;
    }

    public LabeledDataset build() {
      return new LabeledDataset(coords, dataVars, attrs);
    }
  }
}
