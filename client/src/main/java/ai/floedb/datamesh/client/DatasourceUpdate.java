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

package ai.floedb.datamesh.client;

import ai.floedb.datamesh.model.CoordinateRole;
import ai.floedb.datamesh.model.Datasource;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata properties to set on a datasource. Unset ({@code null}) properties are left as they
 * are.
 */
public record DatasourceUpdate(
    String name,
    String description,
    Map<String, Object> parameters,
    JsonNode geom,
    Instant tstart,
    Instant tend,
    String pforecast,
    String parchive,
    List<String> tags,
    List<String> labels,
    Map<String, Object> info,
    Map<String, String> coordinates,
    String details,
    String driver,
    Map<String, Object> driverArgs) {

  public static final DatasourceUpdate NONE = builder().build();

  public static Builder builder() {
    return new Builder();
  }

  public boolean changesDriver() {
    return driver != null || driverArgs != null;
  }

  /**
   * Applies the set properties to {@code b}.
   *
   * @param includeDriver also apply {@code driver} and {@code driverArgs}
   * @return names of the set properties that were not applied
   */
  List<String> applyTo(Datasource.Builder b, boolean includeDriver) {
    List<String> skipped = new ArrayList<>();
    if (name != null) {
      b.name(name);
    }
    if (description != null) {
      b.description(description);
    }
    if (parameters != null) {
      b.parameters(parameters);
    }
    if (geom != null) {
      b.geom(geom);
    }
    if (tstart != null) {
      b.tstart(tstart);
    }
    if (tend != null) {
      b.tend(tend);
    }
    if (pforecast != null) {
      b.pforecast(pforecast);
    }
    if (parchive != null) {
      b.parchive(parchive);
    }
    if (tags != null) {
      b.tags(tags);
    }
    if (labels != null) {
      b.labels(labels);
    }
    if (info != null) {
      b.info(info);
    }
    if (coordinates != null) {
      b.coordinates(coordinates);
    }
    if (details != null) {
      b.details(details);
    }
    if (driver != null) {
      if (includeDriver) {
        b.driver(driver);
      } else {
        skipped.add("driver");
      }
    }
    if (driverArgs != null) {
      if (includeDriver) {
        b.driverArgs(driverArgs);
      } else {
        skipped.add("args");
      }
    }
    return skipped;
  }

  public static final class Builder {
    private String name;
    private String description;
    private Map<String, Object> parameters;
    private JsonNode geom;
    private Instant tstart;
    private Instant tend;
    private String pforecast;
    private String parchive;
    private List<String> tags;
    private List<String> labels;
    private Map<String, Object> info;
    private Map<String, String> coordinates;
    private String details;
    private String driver;
    private Map<String, Object> driverArgs;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder parameters(Map<String, Object> parameters) {
      this.parameters = parameters;
      return this;
    }

    /** GeoJSON geometry of the datasource, in WGS84. */
    public Builder geom(JsonNode geom) {
      this.geom = geom;
      return this;
    }

    public Builder tstart(Instant tstart) {
      this.tstart = tstart;
      return this;
    }

    public Builder tend(Instant tend) {
      this.tend = tend;
      return this;
    }

    public Builder pforecast(String pforecast) {
      this.pforecast = pforecast;
      return this;
    }

    public Builder parchive(String parchive) {
      this.parchive = parchive;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags;
      return this;
    }

    public Builder labels(List<String> labels) {
      this.labels = labels;
      return this;
    }

    public Builder info(Map<String, Object> info) {
      this.info = info;
      return this;
    }

    public Builder coordinate(CoordinateRole role, String field) {
      Map<String, String> c =
          coordinates == null ? new LinkedHashMap<>() : new LinkedHashMap<>(coordinates);
      c.put(role.key(), field);
      this.coordinates = c;
      return this;
    }

    public Builder details(String details) {
      this.details = details;
      return this;
    }

    public Builder driver(String driver) {
      this.driver = driver;
      return this;
    }

    public Builder driverArgs(Map<String, Object> driverArgs) {
      this.driverArgs = driverArgs;
      return this;
    }

    public DatasourceUpdate build() {
      return new DatasourceUpdate(
          name,
          description,
          parameters,
          geom,
          tstart,
          tend,
          pforecast,
          parchive,
          tags,
          labels,
          info,
          coordinates,
          details,
          driver,
          driverArgs);
    }
  }
}
