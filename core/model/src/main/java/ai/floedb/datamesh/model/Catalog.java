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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/** Read-only, ordered view of a catalog search result, keyed by datasource id. */
public final class Catalog implements Iterable<DatasourceMetadata> {

  private final Map<String, DatasourceMetadata> entries;

  public Catalog(List<DatasourceMetadata> entries) {
    Map<String, DatasourceMetadata> m = new LinkedHashMap<>();
    for (DatasourceMetadata e : entries) {
      m.put(e.id(), e);
    }
    this.entries = Collections.unmodifiableMap(m);
  }

  /** Parses the GeoJSON feature collection returned by a catalog search. */
  public static Catalog fromFeatureCollection(JsonNode collection) {
    List<DatasourceMetadata> out = new ArrayList<>();
    for (JsonNode feature : collection.path("features")) {
      out.add(DatasourceMetadata.summary(Datasource.fromFeature(feature)));
    }
    return new Catalog(out);
  }

  public List<String> ids() {
    return List.copyOf(entries.keySet());
  }

  public int size() {
    return entries.size();
  }

  public boolean contains(String id) {
    return entries.containsKey(id);
  }

  public DatasourceMetadata get(String id) {
    DatasourceMetadata d = entries.get(id);
    if (d == null) {
      throw new NoSuchElementException("Datasource " + id + " not in catalog");
    }
    return d;
  }

  @Override
  public Iterator<DatasourceMetadata> iterator() {
    return entries.values().iterator();
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder("Datamesh catalog with ").append(size()).append(" datasources:");
    for (DatasourceMetadata d : entries.values()) {
      sb.append("\n ").append(d.datasource().name()).append(" [").append(d.id()).append(']');
    }
    return sb.toString();
  }
}
