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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Spatial subset of a query.
 *
 * <ul>
 *   <li>{@code bbox}: {@code geom} is {@code [xmin, ymin, xmax, ymax]} in CRS units.
 *   <li>{@code radius}: {@code geom} is {@code [x0, y0, radius]} in CRS units.
 *   <li>{@code feature}: {@code geom} is a GeoJSON feature as a map.
 * </ul>
 *
 * <p>{@code resolution} is the coarsest acceptable spatial resolution, 0 for native.
 */
public record GeoFilter(Type type, Object geom, Double resolution) {

  public GeoFilter {
    type = Objects.requireNonNullElse(type, Type.BBOX);
    Objects.requireNonNull(geom, "geom");
    resolution = Objects.requireNonNullElse(resolution, 0.0);
    switch (type) {
      case BBOX -> requireNumbers(geom, 4, "bbox");
      case RADIUS -> requireNumbers(geom, 3, "radius");
      case FEATURE -> {
        if (!(geom instanceof Map<?, ?>)) {
          throw new IllegalArgumentException("feature geofilter needs a GeoJSON object");
        }
      }
    }
  }

  public static GeoFilter bbox(double xmin, double ymin, double xmax, double ymax) {
    return new GeoFilter(Type.BBOX, List.of(xmin, ymin, xmax, ymax), null);
  }

  public static GeoFilter radius(double x0, double y0, double radius) {
    return new GeoFilter(Type.RADIUS, List.of(x0, y0, radius), null);
  }

  public static GeoFilter feature(Map<String, Object> geojson) {
    return new GeoFilter(Type.FEATURE, geojson, null);
  }

  public GeoFilter withResolution(double res) {
    return new GeoFilter(type, geom, res);
  }

  /** Numeric coordinates of a bbox or radius filter. */
  public double[] numbers() {
    if (type == Type.FEATURE) {
      throw new IllegalStateException("feature geofilter has no numeric geometry");
    }
    List<?> values = (List<?>) geom;
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = ((Number) values.get(i)).doubleValue();
    }
    return out;
  }

  private static void requireNumbers(Object geom, int n, String what) {
    if (!(geom instanceof List<?> l) || l.size() != n) {
      throw new IllegalArgumentException(what + " geofilter needs " + n + " numbers");
    }
    for (Object o : l) {
      if (!(o instanceof Number)) {
        throw new IllegalArgumentException(what + " geofilter needs " + n + " numbers");
      }
    }
  }

  public enum Type {
    FEATURE,
    BBOX,
    RADIUS;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Type fromWire(String v) {
      return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
  }
}
