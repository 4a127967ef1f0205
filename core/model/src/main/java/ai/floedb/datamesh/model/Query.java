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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative request for a subset or transform of one datasource.
 *
 * <p>Immutable. Its canonical serialization ({@link QueryJson#canonical(Query)}) is stable, so two
 * equal queries always map to the same cache entry.
 */
public record Query(
    String datasource,
    Map<String, Object> parameters,
    String description,
    List<String> variables,
    TimeFilter timefilter,
    GeoFilter geofilter,
    List<CoordSelector> coordfilter,
    String crs,
    Aggregate aggregate,
    ResponseKind response,
    Long limit) {

  public Query {
    Objects.requireNonNull(datasource, "datasource");
    if (datasource.isBlank()) {
      throw new IllegalArgumentException("Query needs a datasource id");
    }
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    variables = variables == null ? null : List.copyOf(variables);
    coordfilter = coordfilter == null ? null : List.copyOf(coordfilter);
    response = Objects.requireNonNullElse(response, ResponseKind.DATA);
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
  }

  public static Query of(String datasource) {
    return builder(datasource).build();
  }

  public static Builder builder(String datasource) {
    return new Builder(datasource);
  }

  public Builder toBuilder() {
    Builder b = new Builder(datasource);
    b.parameters.putAll(parameters);
    b.description = description;
    b.variables = variables == null ? null : new ArrayList<>(variables);
    b.timefilter = timefilter;
    b.geofilter = geofilter;
    b.coordfilter = coordfilter == null ? null : new ArrayList<>(coordfilter);
    b.crs = crs;
    b.aggregate = aggregate;
    b.response = response;
    b.limit = limit;
    return b;
  }

  public static final class Builder {
    private final String datasource;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private String description;
    private List<String> variables;
    private TimeFilter timefilter;
    private GeoFilter geofilter;
    private List<CoordSelector> coordfilter;
    private String crs;
    private Aggregate aggregate;
    private ResponseKind response;
    private Long limit;

    private Builder(String datasource) {
      this.datasource = datasource;
    }

    public Builder parameter(String key, Object value) {
      parameters.put(key, value);
      return this;
    }

    public Builder parameters(Map<String, Object> values) {
      parameters.putAll(values);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder variables(String... names) {
      this.variables = List.of(names);
      return this;
    }

    public Builder variables(List<String> names) {
      this.variables = names;
      return this;
    }

    public Builder timefilter(TimeFilter timefilter) {
      this.timefilter = timefilter;
      return this;
    }

    public Builder geofilter(GeoFilter geofilter) {
      this.geofilter = geofilter;
      return this;
    }

    public Builder coordfilter(CoordSelector selector) {
      if (coordfilter == null) {
        coordfilter = new ArrayList<>();
      }
      coordfilter.add(selector);
      return this;
    }

    public Builder crs(String crs) {
      this.crs = crs;
      return this;
    }

    public Builder crs(int epsg) {
      this.crs = "EPSG:" + epsg;
      return this;
    }

    public Builder aggregate(Aggregate aggregate) {
      this.aggregate = aggregate;
      return this;
    }

    public Builder response(ResponseKind response) {
      this.response = response;
      return this;
    }

    public Builder limit(long limit) {
      this.limit = limit;
      return this;
    }

    public Query build() {
      return new Query(
          datasource,
          parameters,
          description,
          variables,
          timefilter,
          geofilter,
          coordfilter,
          crs,
          aggregate,
          response,
          limit);
    }
  }
}
