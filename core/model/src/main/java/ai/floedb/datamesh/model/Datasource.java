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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Metadata record of a named datasource.
 *
 * <p>{@code coordinates} maps one-letter {@link CoordinateRole} keys to field names in the
 * schema. Forecast and archive horizons stay ISO-8601 strings on the wire; see {@link
 * #forecastPeriod()} and {@link #archivePeriod()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Datasource(
    String id,
    String name,
    String description,
    Map<String, Object> parameters,
    JsonNode geom,
    @JsonDeserialize(using = Times.LenientInstantDeserializer.class) Instant tstart,
    @JsonDeserialize(using = Times.LenientInstantDeserializer.class) Instant tend,
    String pforecast,
    String parchive,
    List<String> tags,
    List<String> labels,
    Map<String, Object> info,
    @JsonProperty("schema") DatasourceSchema schema,
    Map<String, String> coordinates,
    String details,
    @JsonDeserialize(using = Times.LenientInstantDeserializer.class) Instant modified,
    @JsonDeserialize(using = Times.LenientInstantDeserializer.class) Instant created,
    @JsonDeserialize(using = Times.LenientInstantDeserializer.class) Instant expires,
    @JsonProperty("args") Map<String, Object> driverArgs,
    String driver) {

  public static final Pattern ID_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

  public Datasource {
    Objects.requireNonNull(id, "id");
    id = id.trim().toLowerCase(Locale.ROOT);
    if (id.length() < 3 || id.length() > 80 || !ID_PATTERN.matcher(id).matches()) {
      throw new IllegalArgumentException(
          "Datasource id must be 3-80 lowercase letters, numbers, dashes or underscores: " + id);
    }
    name = name == null || name.isBlank() ? defaultName(id) : name;
    if (name.length() > 128) {
      throw new IllegalArgumentException("Datasource name longer than 128 characters");
    }
    description = Objects.requireNonNullElse(description, "");
    if (description.length() > 1500) {
      throw new IllegalArgumentException("Datasource description longer than 1500 characters");
    }
    parameters = copy(parameters);
    tags = tags == null ? List.of() : List.copyOf(tags);
    labels = labels == null ? List.of() : List.copyOf(labels);
    info = copy(info);
    schema = Objects.requireNonNullElse(schema, DatasourceSchema.EMPTY);
    coordinates =
        coordinates == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));
    driverArgs = copy(driverArgs);
  }

  /** Builds a datasource from the GeoJSON feature the metadata service returns. */
  public static Datasource fromFeature(JsonNode feature) {
    ObjectNode props =
        feature.path("properties").isObject()
            ? ((ObjectNode) feature.get("properties")).deepCopy()
            : DatameshJson.mapper().createObjectNode();
    if (feature.hasNonNull("id")) {
      props.put("id", feature.get("id").asText());
    }
    if (feature.has("geometry")) {
      props.set("geom", feature.get("geometry"));
    }
    try {
      return DatameshJson.mapper().treeToValue(props, Datasource.class);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Invalid datasource record " + props.path("id"), e);
    }
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  static String defaultName(String id) {
    String spaced = id.replaceAll("[_-]", " ");
    if (spaced.isEmpty()) {
      return spaced;
    }
    return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
  }

  public Optional<String> coordinate(CoordinateRole role) {
    return Optional.ofNullable(coordinates.get(role.key()));
  }

  @JsonIgnore
  public Map<CoordinateRole, String> roles() {
    Map<CoordinateRole, String> out = new EnumMap<>(CoordinateRole.class);
    coordinates.forEach((k, v) -> out.put(CoordinateRole.fromKey(k), v));
    return out;
  }

  @JsonIgnore
  public Optional<Duration> forecastPeriod() {
    return Optional.ofNullable(pforecast).map(Periods::parse);
  }

  @JsonIgnore
  public Optional<Duration> archivePeriod() {
    return Optional.ofNullable(parchive).map(Periods::parse);
  }

  /** Bounding box {@code [xmin, ymin, xmax, ymax]} of the geometry, if there is one. */
  @JsonIgnore
  public Optional<double[]> bounds() {
    return geom == null || geom.isNull() ? Optional.empty() : GeoJsonWkt.bounds(geom);
  }

  /** Mapped coordinate fields that appear neither among the schema coordinates nor variables. */
  public List<String> missingCoordinates() {
    List<String> bad = new ArrayList<>();
    for (String field : coordinates.values()) {
      if (!schema.coords().containsKey(field) && !schema.dataVars().containsKey(field)) {
        bad.add(field);
      }
    }
    return bad;
  }

  private static Map<String, Object> copy(Map<String, Object> m) {
    return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
  }

  public static final class Builder {
    private String id;
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
    private DatasourceSchema schema;
    private Map<String, String> coordinates;
    private String details;
    private Instant modified;
    private Instant created;
    private Instant expires;
    private Map<String, Object> driverArgs;
    private String driver;

    private Builder(String id) {
      this.id = id;
    }

    private Builder(Datasource d) {
      this.id = d.id;
      this.name = d.name;
      this.description = d.description;
      this.parameters = d.parameters;
      this.geom = d.geom;
      this.tstart = d.tstart;
      this.tend = d.tend;
      this.pforecast = d.pforecast;
      this.parchive = d.parchive;
      this.tags = d.tags;
      this.labels = d.labels;
      this.info = d.info;
      this.schema = d.schema;
      this.coordinates = d.coordinates;
      this.details = d.details;
      this.modified = d.modified;
      this.created = d.created;
      this.expires = d.expires;
      this.driverArgs = d.driverArgs;
      this.driver = d.driver;
    }

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

    public Builder schema(DatasourceSchema schema) {
      this.schema = schema;
      return this;
    }

    public Builder coordinates(Map<String, String> coordinates) {
      this.coordinates = coordinates;
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

    public Builder expires(Instant expires) {
      this.expires = expires;
      return this;
    }

    public Builder driverArgs(Map<String, Object> driverArgs) {
      this.driverArgs = driverArgs;
      return this;
    }

    public Builder driver(String driver) {
      this.driver = driver;
      return this;
    }

    public Datasource build() {
      return new Datasource(
          id,
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
          schema,
          coordinates,
          details,
          modified,
          created,
          expires,
          driverArgs,
          driver);
    }
  }
}
