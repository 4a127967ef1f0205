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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Named-axis array plus attributes; a coordinate or data variable of a dataset. */
public record Variable(List<String> dims, NdArray data, Map<String, Object> attrs) {

  public Variable {
    dims = List.copyOf(Objects.requireNonNull(dims, "dims"));
    Objects.requireNonNull(data, "data");
    if (dims.size() != data.rank()) {
      throw new IllegalArgumentException(
          "Variable has " + dims.size() + " dims but data has rank " + data.rank());
    }
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public static Variable of(String dim, NdArray data) {
    return new Variable(List.of(dim), data, null);
  }

  public int axis(String dim) {
    return dims.indexOf(dim);
  }

  public boolean hasDim(String dim) {
    return dims.contains(dim);
  }

  public int length(String dim) {
    int axis = axis(dim);
    if (axis < 0) {
      throw new IllegalArgumentException("Variable has no dimension " + dim);
    }
    return data.length(axis);
  }

  /** Slice along {@code dim}; variables without that dimension are returned unchanged. */
  public Variable isel(String dim, int start, int end) {
    int axis = axis(dim);
    if (axis < 0) {
      return this;
    }
    return new Variable(dims, data.slice(axis, start, end), attrs);
  }

  public Variable withData(NdArray replacement) {
    return new Variable(dims, replacement, attrs);
  }

  public Variable withAttrs(Map<String, Object> replacement) {
    return new Variable(dims, data, replacement);
  }

  /** numpy-style dtype name, as the metadata service records it. */
  public String dtypeName() {
    return data.dtype() == NdArray.DType.FLOAT64 ? "float64" : "int64";
  }
}
