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

import ai.floedb.datamesh.data.NdArray;
import ai.floedb.datamesh.model.DatameshJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Metadata and chunk codec of one zarr v2 array.
 *
 * <p>Supported: C order, little-endian {@code <f8 <i8 <f4 <i4}, compressor {@code null} or
 * {@code zlib}, no filters. Four-byte types are widened on read and narrowed on write.
 */
public final class ZarrArray {

  static final String ARRAY_DIMENSIONS = "_ARRAY_DIMENSIONS";
  static final String ZLIB = "zlib";

  private final int[] shape;
  private final int[] chunks;
  private final String dtype;
  private final String compressor;
  private final List<String> dims;
  private final Map<String, Object> attrs;
  private final String separator;

  ZarrArray(
      int[] shape,
      int[] chunks,
      String dtype,
      String compressor,
      List<String> dims,
      Map<String, Object> attrs,
      String separator) {
    if (shape.length != chunks.length || shape.length != dims.size()) {
      throw new IllegalArgumentException("shape, chunks and dims disagree in rank");
    }
    elementSize(dtype);
    this.shape = shape.clone();
    this.chunks = chunks.clone();
    this.dtype = dtype;
    this.compressor = compressor;
    this.dims = List.copyOf(dims);
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    this.separator = separator;
  }

  static ZarrArray create(
      List<String> dims, NdArray data, Map<String, Object> attrs, int[] chunks, boolean zlib) {
    String dtype = data.dtype() == NdArray.DType.FLOAT64 ? "<f8" : "<i8";
    return new ZarrArray(data.shape(), chunks, dtype, zlib ? ZLIB : null, dims, attrs, ".");
  }

  static ZarrArray fromJson(JsonNode zarray, JsonNode zattrs) {
    if (zarray.path("zarr_format").asInt(2) != 2) {
      throw new IllegalArgumentException("Only zarr format 2 is supported");
    }
    if (!"C".equals(zarray.path("order").asText("C"))) {
      throw new IllegalArgumentException("Only C-ordered arrays are supported");
    }
    JsonNode filters = zarray.path("filters");
    if (filters.isArray() && !filters.isEmpty()) {
      throw new IllegalArgumentException("Array filters are not supported");
    }
    JsonNode comp = zarray.path("compressor");
    String compressor = comp.isObject() ? comp.path("id").asText() : null;
    if (compressor != null && !ZLIB.equals(compressor)) {
      throw new IllegalArgumentException("Unsupported compressor " + compressor);
    }
    Map<String, Object> attrs = new LinkedHashMap<>();
    List<String> dims = new ArrayList<>();
    if (zattrs != null && zattrs.isObject()) {
      attrs.putAll(DatameshJson.mapper().convertValue(zattrs, Map.class));
      Object d = attrs.remove(ARRAY_DIMENSIONS);
      if (d instanceof List<?> l) {
        for (Object o : l) {
          dims.add(String.valueOf(o));
        }
      }
    }
    int[] shape = ints(zarray.path("shape"));
    if (dims.isEmpty() && shape.length > 0) {
      for (int i = 0; i < shape.length; i++) {
        dims.add("dim_" + i);
      }
    }
    return new ZarrArray(
        shape,
        ints(zarray.path("chunks")),
        zarray.path("dtype").asText(),
        compressor,
        dims,
        attrs,
        zarray.path("dimension_separator").asText("."));
  }

  ObjectNode toZarray() {
    ObjectNode n = DatameshJson.mapper().createObjectNode();
    ArrayNode c = n.putArray("chunks");
    Arrays.stream(chunks).forEach(c::add);
    if (compressor == null) {
      n.putNull("compressor");
    } else {
      n.putObject("compressor").put("id", ZLIB).put("level", 1);
    }
    n.put("dimension_separator", separator);
    n.put("dtype", dtype);
    if (isFloat()) {
      n.put("fill_value", "NaN");
    } else {
      n.putNull("fill_value");
    }
    n.putNull("filters");
    n.put("order", "C");
    ArrayNode s = n.putArray("shape");
    Arrays.stream(shape).forEach(s::add);
    n.put("zarr_format", 2);
    return n;
  }

  ObjectNode toZattrs() {
    ObjectNode n = DatameshJson.mapper().valueToTree(attrs);
    ArrayNode d = n.putArray(ARRAY_DIMENSIONS);
    dims.forEach(d::add);
    return n;
  }

  public int[] shape() {
    return shape.clone();
  }

  public int[] chunks() {
    return chunks.clone();
  }

  public String dtype() {
    return dtype;
  }

  public List<String> dims() {
    return dims;
  }

  public Map<String, Object> attrs() {
    return attrs;
  }

  /** numpy dtype name. */
  public String dtypeName() {
    switch (dtype.substring(1)) {
      case "f8":
        return "float64";
      case "f4":
        return "float32";
      case "i8":
        return "int64";
      default:
        return "int32";
    }
  }

  ZarrArray withShape(int[] newShape) {
    return new ZarrArray(newShape, chunks, dtype, compressor, dims, attrs, separator);
  }

  ZarrArray withAttrs(Map<String, Object> newAttrs) {
    return new ZarrArray(shape, chunks, dtype, compressor, dims, newAttrs, separator);
  }

  boolean isFloat() {
    return dtype.charAt(1) == 'f';
  }

  NdArray.DType memoryType() {
    return isFloat() ? NdArray.DType.FLOAT64 : NdArray.DType.INT64;
  }

  String chunkKey(String name, int[] index) {
    if (index.length == 0) {
      return name + "/0";
    }
    StringBuilder sb = new StringBuilder(name).append('/');
    for (int i = 0; i < index.length; i++) {
      if (i > 0) {
        sb.append(separator);
      }
      sb.append(index[i]);
    }
    return sb.toString();
  }

  /** Reads the hyper-rectangle at {@code offset} of extent {@code count}; absent chunks fill. */
  NdArray read(ChunkStore store, String name, int[] offset, int[] count) {
    NdArray out = NdArray.zeros(memoryType(), count);
    if (isFloat()) {
      out = NdArray.ofDoubles(nans(out.size()), count);
    }
    for (int[] idx : chunksCovering(offset, count)) {
      int[] origin = origin(idx);
      int[] lo = new int[rank()];
      int[] n = new int[rank()];
      intersect(origin, offset, count, lo, n);
      NdArray chunk = store.find(chunkKey(name, idx)).map(this::decode).orElse(null);
      if (chunk == null) {
        continue;
      }
      NdArray part = chunk.region(minus(lo, origin), n);
      out = out.withRegion(minus(lo, offset), part);
    }
    return out;
  }

  /** Writes {@code data} at {@code offset}, rewriting only the chunks it touches. */
  void write(ChunkStore store, String name, int[] offset, NdArray data) {
    NdArray values = data.as(memoryType());
    int[] count = values.shape();
    for (int[] idx : chunksCovering(offset, count)) {
      int[] origin = origin(idx);
      int[] lo = new int[rank()];
      int[] n = new int[rank()];
      intersect(origin, offset, count, lo, n);
      NdArray chunk = null;
      if (!fullyCovered(origin, lo, n)) {
        chunk = store.find(chunkKey(name, idx)).map(this::decode).orElse(null);
      }
      if (chunk == null) {
        chunk = fillChunk();
      }
      chunk = chunk.withRegion(minus(lo, origin), values.region(minus(lo, offset), n));
      store.set(chunkKey(name, idx), encode(chunk));
    }
  }

  private boolean fullyCovered(int[] origin, int[] lo, int[] n) {
    for (int i = 0; i < rank(); i++) {
      int edge = Math.min(origin[i] + chunks[i], shape[i]);
      if (lo[i] != origin[i] || lo[i] + n[i] != edge) {
        return false;
      }
    }
    return true;
  }

  private List<int[]> chunksCovering(int[] offset, int[] count) {
    List<int[]> out = new ArrayList<>();
    int r = rank();
    for (int i = 0; i < r; i++) {
      if (count[i] == 0) {
        return out;
      }
    }
    int[] first = new int[r];
    int[] last = new int[r];
    for (int i = 0; i < r; i++) {
      first[i] = offset[i] / chunks[i];
      last[i] = (offset[i] + count[i] - 1) / chunks[i];
    }
    int[] idx = first.clone();
    while (true) {
      out.add(idx.clone());
      int axis = r - 1;
      while (axis >= 0) {
        if (++idx[axis] <= last[axis]) {
          break;
        }
        idx[axis] = first[axis];
        axis--;
      }
      if (axis < 0) {
        return out;
      }
    }
  }

  private int[] origin(int[] idx) {
    int[] o = new int[idx.length];
    for (int i = 0; i < idx.length; i++) {
      o[i] = idx[i] * chunks[i];
    }
    return o;
  }

  private void intersect(int[] origin, int[] offset, int[] count, int[] lo, int[] n) {
    for (int i = 0; i < rank(); i++) {
      lo[i] = Math.max(origin[i], offset[i]);
      int hi = Math.min(origin[i] + chunks[i], offset[i] + count[i]);
      n[i] = hi - lo[i];
    }
  }

  private static int[] minus(int[] a, int[] b) {
    int[] out = new int[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = a[i] - b[i];
    }
    return out;
  }

  private int rank() {
    return shape.length;
  }

  private NdArray fillChunk() {
    int n = 1;
    for (int c : chunks) {
      n *= c;
    }
    return isFloat() ? NdArray.ofDoubles(nans(n), chunks) : NdArray.zeros(memoryType(), chunks);
  }

  private static double[] nans(int n) {
    double[] d = new double[n];
    Arrays.fill(d, Double.NaN);
    return d;
  }

  byte[] encode(NdArray chunk) {
    int size = elementSize(dtype);
    ByteBuffer b = ByteBuffer.allocate(chunk.size() * size).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < chunk.size(); i++) {
      switch (dtype) {
        case "<f8" -> b.putDouble(chunk.getDouble(i));
        case "<f4" -> b.putFloat((float) chunk.getDouble(i));
        case "<i8" -> b.putLong(chunk.getLong(i));
        default -> b.putInt((int) chunk.getLong(i));
      }
    }
    return compressor == null ? b.array() : deflate(b.array());
  }

  NdArray decode(byte[] raw) {
    byte[] bytes = compressor == null ? raw : inflate(raw);
    int size = elementSize(dtype);
    int n = bytes.length / size;
    int expected = 1;
    for (int c : chunks) {
      expected *= c;
    }
    if (n != expected) {
      throw new IllegalStateException(
          "Chunk holds " + n + " elements, expected " + expected + " for "
              + Arrays.toString(chunks));
    }
    ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    if (isFloat()) {
      double[] d = new double[n];
      for (int i = 0; i < n; i++) {
        d[i] = size == 8 ? b.getDouble() : b.getFloat();
      }
      return NdArray.ofDoubles(d, chunks);
    }
    long[] l = new long[n];
    for (int i = 0; i < n; i++) {
      l[i] = size == 8 ? b.getLong() : b.getInt();
    }
    return NdArray.ofLongs(l, chunks);
  }

  private static int elementSize(String dtype) {
    switch (dtype) {
      case "<f8":
      case "<i8":
        return 8;
      case "<f4":
      case "<i4":
        return 4;
      default:
        throw new IllegalArgumentException("Unsupported zarr dtype " + dtype);
    }
  }

  private static byte[] deflate(byte[] in) {
    Deflater d = new Deflater(1);
    try {
      d.setInput(in);
      d.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream(in.length / 2 + 64);
      byte[] buf = new byte[8192];
      while (!d.finished()) {
        out.write(buf, 0, d.deflate(buf));
      }
      return out.toByteArray();
    } finally {
      d.end();
    }
  }

  private static byte[] inflate(byte[] in) {
    Inflater inf = new Inflater();
    try {
      inf.setInput(in);
      ByteArrayOutputStream out = new ByteArrayOutputStream(in.length * 4);
      byte[] buf = new byte[8192];
      while (!inf.finished()) {
        int n = inf.inflate(buf);
        if (n == 0 && (inf.needsInput() || inf.needsDictionary())) {
          throw new IllegalStateException("Truncated zlib chunk");
        }
        out.write(buf, 0, n);
      }
      return out.toByteArray();
    } catch (DataFormatException e) {
      throw new IllegalStateException("Corrupt zlib chunk", e);
    } finally {
      inf.end();
    }
  }

  private static int[] ints(JsonNode array) {
    int[] out = new int[array.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = array.get(i).asInt();
    }
    return out;
  }
}
