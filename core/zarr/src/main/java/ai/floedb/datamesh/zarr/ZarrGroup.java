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

import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.data.Variable;
import ai.floedb.datamesh.model.ContainerKind;
import ai.floedb.datamesh.model.DatasourceSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lazily loaded dataset over a chunk store. Only metadata is read when the group is opened;
 * variable data is fetched chunk by chunk on demand.
 *
 * <p>Closing the group runs its close hook once. Connectors use the hook to release the session
 * the underlying store depends on.
 */
public final class ZarrGroup implements DataContainer, AutoCloseable {

  private final ChunkStore store;
  private final Map<String, Object> attrs;
  private final Map<String, ZarrArray> arrays;
  private final Set<String> coordNames;
  private final Runnable onClose;
  private final AtomicBoolean closed = new AtomicBoolean();

  ZarrGroup(
      ChunkStore store,
      Map<String, Object> attrs,
      Map<String, ZarrArray> arrays,
      Set<String> coordNames,
      Runnable onClose) {
    this.store = store;
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    this.arrays = Collections.unmodifiableMap(new LinkedHashMap<>(arrays));
    this.coordNames = Collections.unmodifiableSet(new LinkedHashSet<>(coordNames));
    this.onClose = onClose == null ? () -> {} : onClose;
  }

  /** Same group with an additional close hook, run after any existing one. */
  public ZarrGroup onClose(Runnable hook) {
    Runnable prior = onClose;
    return new ZarrGroup(
        store,
        attrs,
        arrays,
        coordNames,
        () -> {
          try {
            prior.run();
          } finally {
            hook.run();
          }
        });
  }

  @Override
  public ContainerKind kind() {
    return ContainerKind.DATASET;
  }

  public ChunkStore store() {
    return store;
  }

  public Map<String, Object> attrs() {
    return attrs;
  }

  public Map<String, Integer> dims() {
    Map<String, Integer> out = new LinkedHashMap<>();
    arrays.values().forEach(
        a -> {
          for (int i = 0; i < a.dims().size(); i++) {
            out.putIfAbsent(a.dims().get(i), a.shape()[i]);
          }
        });
    return out;
  }

  public List<String> coordNames() {
    List<String> out = new ArrayList<>();
    for (String name : arrays.keySet()) {
      if (coordNames.contains(name)) {
        out.add(name);
      }
    }
    return out;
  }

  public List<String> dataVarNames() {
    List<String> out = new ArrayList<>();
    for (String name : arrays.keySet()) {
      if (!coordNames.contains(name)) {
        out.add(name);
      }
    }
    return out;
  }

  Map<String, ZarrArray> arrays() {
    return arrays;
  }

  public boolean hasVariable(String name) {
    return arrays.containsKey(name);
  }

  public ZarrArray array(String name) {
    ZarrArray a = arrays.get(name);
    if (a == null) {
      throw new IllegalArgumentException("No variable named " + name);
    }
    return a;
  }

  /** Reads one whole variable. */
  public Variable read(String name) {
    ZarrArray a = array(name);
    int[] shape = a.shape();
    return new Variable(a.dims(), a.read(store, name, new int[shape.length], shape), a.attrs());
  }

  /** Reads positions {@code [start, end)} of {@code dim}; other dimensions are read whole. */
  public Variable read(String name, String dim, int start, int end) {
    ZarrArray a = array(name);
    int axis = a.dims().indexOf(dim);
    if (axis < 0) {
      return read(name);
    }
    int[] offset = new int[a.shape().length];
    int[] count = a.shape();
    if (start < 0 || end > count[axis] || start > end) {
      throw new IndexOutOfBoundsException(
          "[" + start + ", " + end + ") outside " + dim + " of length " + count[axis]);
    }
    offset[axis] = start;
    count[axis] = end - start;
    NdArray data = a.read(store, name, offset, count);
    return new Variable(a.dims(), data, a.attrs());
  }

  /** Materializes every variable. */
  public LabeledDataset load() {
    LabeledDataset.Builder b = LabeledDataset.builder().attrs(attrs);
    for (String name : arrays.keySet()) {
      if (coordNames.contains(name)) {
        b.coord(name, read(name));
      } else {
        b.dataVar(name, read(name));
      }
    }
    return b.build();
  }

  @Override
  public DatasourceSchema toSchema() {
    Map<String, Object> coords = new LinkedHashMap<>();
    Map<String, Object> vars = new LinkedHashMap<>();
    arrays.forEach(
        (name, a) -> {
          Map<String, Object> field = new LinkedHashMap<>();
          field.put("dims", new ArrayList<>(a.dims()));
          field.put("attrs", new LinkedHashMap<>(a.attrs()));
          field.put("dtype", a.dtypeName());
          List<Integer> shape = new ArrayList<>();
          for (int n : a.shape()) {
            shape.add(n);
          }
          field.put("shape", shape);
          (coordNames.contains(name) ? coords : vars).put(name, field);
        });
    return new DatasourceSchema(attrs, new LinkedHashMap<>(dims()), coords, vars);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onClose.run();
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String toString() {
    return "ZarrGroup{dims=" + dims() + ", coords=" + coordNames() + ", dataVars="
        + dataVarNames() + "}";
  }
}
