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

import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.data.Variable;
import ai.floedb.datamesh.model.DatameshJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Reads and writes labeled datasets as zarr v2 groups in a {@link ChunkStore}, using the same
 * conventions as xarray: {@code _ARRAY_DIMENSIONS} on every array, non-index coordinates listed
 * in a {@code coordinates} attribute, and consolidated metadata in {@code .zmetadata}.
 */
public final class ZarrDatasets {
  private static final Logger LOG = Logger.getLogger(ZarrDatasets.class);

  static final String ZGROUP = ".zgroup";
  static final String ZATTRS = ".zattrs";
  static final String ZARRAY = ".zarray";
  static final String ZMETADATA = ".zmetadata";
  static final String COORDINATES = "coordinates";

  private ZarrDatasets() {}

  public static void write(LabeledDataset ds, ChunkStore store) {
    write(ds, store, ZarrWriteOptions.DEFAULT);
  }

  /**
   * Writes every variable of {@code ds} as a new array. Keys already in the store that the
   * dataset does not produce are left alone; clear the store first for a clean overwrite.
   */
  public static void write(LabeledDataset ds, ChunkStore store, ZarrWriteOptions options) {
    List<String> auxCoords = new ArrayList<>();
    ds.coords()
        .forEach(
            (name, v) -> {
              if (!isIndex(name, v)) {
                auxCoords.add(name);
              }
            });
    String coordAttr = String.join(" ", auxCoords);

    Map<String, ZarrArray> arrays = new LinkedHashMap<>();
    ds.coords().forEach((name, v) -> arrays.put(name, writeArray(store, name, v, null, options)));
    ds.dataVars()
        .forEach(
            (name, v) ->
                arrays.put(
                    name,
                    writeArray(store, name, v, coordAttr.isEmpty() ? null : coordAttr, options)));

    ObjectNode groupAttrs = DatameshJson.mapper().valueToTree(ds.attrs());
    if (ds.dataVars().isEmpty() && !coordAttr.isEmpty()) {
      groupAttrs.put(COORDINATES, coordAttr);
    }
    ObjectNode zgroup = DatameshJson.mapper().createObjectNode().put("zarr_format", 2);
    store.set(ZGROUP, bytes(zgroup));
    store.set(ZATTRS, bytes(groupAttrs));
    consolidate(store, zgroup, groupAttrs, arrays);
    LOG.debugf("Wrote zarr group with %d arrays, dims %s", arrays.size(), ds.dims());
  }

  private static ZarrArray writeArray(
      ChunkStore store, String name, Variable v, String coordAttr, ZarrWriteOptions options) {
    Map<String, Object> attrs = new LinkedHashMap<>(v.attrs());
    if (coordAttr != null) {
      attrs.put(COORDINATES, coordAttr);
    }
    ZarrArray a =
        ZarrArray.create(
            v.dims(),
            v.data(),
            attrs,
            options.chunksFor(v.dims(), v.data().shape()),
            options.compress());
    a.write(store, name, new int[v.data().rank()], v.data());
    store.set(name + "/" + ZARRAY, bytes(a.toZarray()));
    store.set(name + "/" + ZATTRS, bytes(a.toZattrs()));
    return a;
  }

  public static ZarrGroup open(ChunkStore store) {
    return open(store, null);
  }

  /**
   * Opens the group rooted at the store, reading only metadata. Consolidated metadata is used
   * when present, otherwise arrays are discovered from the store listing.
   *
   * @throws ChunkNotFoundException when the store holds no zarr group
   */
  public static ZarrGroup open(ChunkStore store, Runnable onClose) {
    JsonNode groupAttrs;
    Map<String, ZarrArray> arrays = new LinkedHashMap<>();
    Optional<byte[]> consolidated = store.find(ZMETADATA);
    if (consolidated.isPresent()) {
      JsonNode meta = parse(consolidated.get(), ZMETADATA).path("metadata");
      groupAttrs = meta.path(ZATTRS);
      Iterator<String> names = meta.fieldNames();
      while (names.hasNext()) {
        String key = names.next();
        if (key.endsWith("/" + ZARRAY)) {
          String name = key.substring(0, key.length() - ZARRAY.length() - 1);
          arrays.put(name, ZarrArray.fromJson(meta.get(key), meta.get(name + "/" + ZATTRS)));
        }
      }
    } else {
      if (!store.contains(ZGROUP)) {
        throw new ChunkNotFoundException(ZGROUP);
      }
      groupAttrs = store.find(ZATTRS).map(b -> parse(b, ZATTRS)).orElse(null);
      for (String entry : store.keys()) {
        String name = entry.endsWith("/") ? entry.substring(0, entry.length() - 1) : entry;
        if (name.isEmpty() || name.startsWith(".")) {
          continue;
        }
        Optional<byte[]> zarray = store.find(name + "/" + ZARRAY);
        if (zarray.isPresent()) {
          JsonNode zattrs =
              store
                  .find(name + "/" + ZATTRS)
                  .map(b -> parse(b, name + "/" + ZATTRS))
                  .orElse(null);
          arrays.put(name, ZarrArray.fromJson(parse(zarray.get(), name), zattrs));
        }
      }
    }

    Map<String, Object> attrs = new LinkedHashMap<>();
    Set<String> coords = new LinkedHashSet<>();
    if (groupAttrs != null && groupAttrs.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = DatameshJson.mapper().convertValue(groupAttrs, Map.class);
      attrs.putAll(m);
      Object c = attrs.remove(COORDINATES);
      if (c instanceof String s) {
        coords.addAll(splitNames(s));
      }
    }
    Map<String, ZarrArray> cleaned = new LinkedHashMap<>();
    arrays.forEach(
        (name, a) -> {
          Object c = a.attrs().get(COORDINATES);
          if (c instanceof String s) {
            coords.addAll(splitNames(s));
            Map<String, Object> rest = new LinkedHashMap<>(a.attrs());
            rest.remove(COORDINATES);
            a = a.withAttrs(rest);
          }
          if (a.dims().size() == 1 && a.dims().get(0).equals(name)) {
            coords.add(name);
          }
          cleaned.put(name, a);
        });
    coords.retainAll(cleaned.keySet());
    return new ZarrGroup(store, attrs, cleaned, coords, onClose);
  }

  /**
   * Overwrites positions {@code [start, start + n)} of {@code dim} in existing arrays with the
   * variables of {@code part}. Every variable in {@code part} must vary along {@code dim} and
   * already exist with matching extents on the other dimensions. Nothing is written unless all
   * variables pass those checks.
   */
  public static void writeRegion(ChunkStore store, LabeledDataset part, String dim, int start) {
    ZarrGroup group = open(store);
    Map<String, Variable> vars = allVariables(part);
    for (Map.Entry<String, Variable> e : vars.entrySet()) {
      String name = e.getKey();
      Variable v = e.getValue();
      if (!v.hasDim(dim)) {
        throw new IllegalArgumentException(
            "Variable " + name + " does not vary along " + dim + " and cannot be region-written");
      }
      ZarrArray a = existing(group, name, v);
      int axis = a.dims().indexOf(dim);
      if (start < 0 || start + v.data().length(axis) > a.shape()[axis]) {
        throw new IllegalArgumentException(
            "Region [" + start + ", " + (start + v.data().length(axis)) + ") of " + dim
                + " is outside variable " + name + " of length " + a.shape()[axis]);
      }
    }
    for (Map.Entry<String, Variable> e : vars.entrySet()) {
      ZarrArray a = group.array(e.getKey());
      int[] offset = new int[a.shape().length];
      offset[a.dims().indexOf(dim)] = start;
      a.write(store, e.getKey(), offset, e.getValue().data());
    }
    LOG.debugf(
        "Region write of %d variables at %s[%d:]",
        Integer.valueOf(vars.size()),
        dim,
        Integer.valueOf(start));
  }

  /**
   * Extends every array that has {@code dim} by the matching variable of {@code part}. Variables
   * without {@code dim} overwrite their stored values. All arrays along {@code dim} must be
   * supplied so the dimension stays consistent.
   */
  public static void append(ChunkStore store, LabeledDataset part, String dim) {
    ZarrGroup group = open(store);
    Map<String, Variable> vars = allVariables(part);
    for (Map.Entry<String, Variable> e : vars.entrySet()) {
      existing(group, e.getKey(), e.getValue());
    }
    for (Map.Entry<String, ZarrArray> e : group.arrays().entrySet()) {
      if (e.getValue().dims().contains(dim) && !vars.containsKey(e.getKey())) {
        throw new IllegalArgumentException(
            "Variable " + e.getKey() + " varies along " + dim + " but is missing from the append");
      }
    }

    Map<String, ZarrArray> arrays = new LinkedHashMap<>();
    group.arrays().forEach((name, a) -> arrays.put(name, rawAttrs(store, name, a)));
    for (Map.Entry<String, Variable> e : vars.entrySet()) {
      String name = e.getKey();
      NdArray data = e.getValue().data();
      ZarrArray a = group.array(name);
      int axis = a.dims().indexOf(dim);
      int[] offset = new int[a.shape().length];
      if (axis < 0) {
        if (!Arrays.equals(a.shape(), data.shape())) {
          throw new IllegalArgumentException("Variable " + name + " changes shape");
        }
        a.write(store, name, offset, data);
        continue;
      }
      int[] shape = a.shape();
      offset[axis] = shape[axis];
      shape[axis] += data.length(axis);
      ZarrArray grown = a.withShape(shape);
      grown.write(store, name, offset, data);
      store.set(name + "/" + ZARRAY, bytes(grown.toZarray()));
      arrays.put(name, rawAttrs(store, name, grown));
    }
    ObjectNode zgroup = DatameshJson.mapper().createObjectNode().put("zarr_format", 2);
    JsonNode groupAttrs =
        store
            .find(ZATTRS)
            .map(b -> parse(b, ZATTRS))
            .orElseGet(() -> DatameshJson.mapper().createObjectNode());
    consolidate(store, zgroup, groupAttrs, arrays);
    LOG.debugf("Appended %d variables along %s", vars.size(), dim);
  }

  /** Array with its stored attributes, including any {@code coordinates} entry. */
  private static ZarrArray rawAttrs(ChunkStore store, String name, ZarrArray a) {
    JsonNode zattrs = store.find(name + "/" + ZATTRS).map(b -> parse(b, name)).orElse(null);
    return ZarrArray.fromJson(a.toZarray(), zattrs);
  }

  private static ZarrArray existing(ZarrGroup group, String name, Variable v) {
    if (!group.hasVariable(name)) {
      throw new IllegalArgumentException("Variable " + name + " is not in the existing store");
    }
    ZarrArray a = group.array(name);
    if (!a.dims().equals(v.dims())) {
      throw new IllegalArgumentException(
          "Variable " + name + " has dims " + v.dims() + ", store has " + a.dims());
    }
    return a;
  }

  private static Map<String, Variable> allVariables(LabeledDataset ds) {
    Map<String, Variable> out = new LinkedHashMap<>(ds.coords());
    out.putAll(ds.dataVars());
    return out;
  }

  private static void consolidate(
      ChunkStore store, JsonNode zgroup, JsonNode groupAttrs, Map<String, ZarrArray> arrays) {
    ObjectNode root = DatameshJson.mapper().createObjectNode();
    ObjectNode meta = root.putObject("metadata");
    meta.set(ZGROUP, zgroup);
    meta.set(ZATTRS, groupAttrs);
    arrays.forEach(
        (name, a) -> {
          meta.set(name + "/" + ZARRAY, a.toZarray());
          meta.set(name + "/" + ZATTRS, a.toZattrs());
        });
    root.put("zarr_consolidated_format", 1);
    store.set(ZMETADATA, bytes(root));
  }

  private static boolean isIndex(String name, Variable v) {
    return v.dims().size() == 1 && v.dims().get(0).equals(name);
  }

  private static List<String> splitNames(String s) {
    List<String> out = new ArrayList<>();
    for (String part : s.trim().split("\\s+")) {
      if (!part.isEmpty()) {
        out.add(part);
      }
    }
    return out;
  }

  private static byte[] bytes(JsonNode node) {
    try {
      return DatameshJson.mapper().writeValueAsBytes(node);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to encode zarr metadata", e);
    }
  }

  private static JsonNode parse(byte[] raw, String what) {
    try {
      return DatameshJson.mapper().readTree(raw);
    } catch (IOException e) {
      throw new UncheckedIOException("Corrupt zarr metadata in " + what, e);
    }
  }
}
