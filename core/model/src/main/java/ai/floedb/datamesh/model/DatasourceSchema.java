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

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema block of a datasource: global attributes, dimension sizes, coordinate fields and data
 * variable fields, each field described by a free-form map (dims, attrs, dtype).
 */
public record DatasourceSchema(
    Map<String, Object> attrs,
    Map<String, Object> dims,
    Map<String, Object> coords,
    @JsonProperty("data_vars") Map<String, Object> dataVars) {

  public static final DatasourceSchema EMPTY = new DatasourceSchema(null, null, null, null);

  public DatasourceSchema {
    attrs = copy(attrs);
    dims = copy(dims);
    coords = copy(coords);
    dataVars = copy(dataVars);
  }

  public boolean isEmpty() {
    return dims.isEmpty() && coords.isEmpty() && dataVars.isEmpty();
  }

  public DatasourceSchema withAttr(String key, Object value) {
    Map<String, Object> a = new LinkedHashMap<>(attrs);
    a.put(key, value);
    return new DatasourceSchema(a, dims, coords, dataVars);
  }

  private static Map<String, Object> copy(Map<String, Object> m) {
    return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
  }
}
