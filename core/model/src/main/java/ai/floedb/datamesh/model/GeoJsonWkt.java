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
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Minimal GeoJSON helpers: WKT rendering for catalog filters and extent computation. */
public final class GeoJsonWkt {

  private GeoJsonWkt() {}

  /** Renders a geofilter as WKT. Radius filters render as the bounding box of the circle. */
  public static String toWkt(GeoFilter filter) {
    switch (filter.type()) {
      case BBOX:
        return bboxWkt(filter.numbers());
      case RADIUS:
        double[] r = filter.numbers();
        return bboxWkt(new double[] {r[0] - r[2], r[1] - r[2], r[0] + r[2], r[1] + r[2]});
      default:
        return toWkt(DatameshJson.mapper().valueToTree(filter.geom()));
    }
  }

  /** Renders a GeoJSON geometry (or a Feature wrapping one) as WKT. */
  public static String toWkt(JsonNode geojson) {
    JsonNode geom = unwrap(geojson);
    String type = geom.path("type").asText();
    JsonNode c = geom.path("coordinates");
    switch (type) {
      case "Point":
        return "POINT (" + position(c) + ")";
      case "MultiPoint":
        return "MULTIPOINT (" + join(c, n -> "(" + position(n) + ")") + ")";
      case "LineString":
        return "LINESTRING " + ring(c);
      case "MultiLineString":
        return "MULTILINESTRING (" + join(c, GeoJsonWkt::ring) + ")";
      case "Polygon":
        return "POLYGON " + polygon(c);
      case "MultiPolygon":
        return "MULTIPOLYGON (" + join(c, GeoJsonWkt::polygon) + ")";
      default:
        throw new IllegalArgumentException("Unsupported GeoJSON geometry type: " + type);
    }
  }

  public static String bboxWkt(double[] bbox) {
    double x0 = bbox[0];
    double y0 = bbox[1];
    double x1 = bbox[2];
    double y1 = bbox[3];
    return "POLYGON (("
        + num(x1) + " " + num(y0) + ", "
        + num(x1) + " " + num(y1) + ", "
        + num(x0) + " " + num(y1) + ", "
        + num(x0) + " " + num(y0) + ", "
        + num(x1) + " " + num(y0) + "))";
  }

  /** {@code [xmin, ymin, xmax, ymax]} of all positions in the geometry. */
  public static Optional<double[]> bounds(JsonNode geojson) {
    JsonNode geom = unwrap(geojson);
    List<double[]> positions = new ArrayList<>();
    collect(geom.path("coordinates"), positions);
    if (positions.isEmpty()) {
      return Optional.empty();
    }
    double[] b = {
      Double.POSITIVE_INFINITY,
      Double.POSITIVE_INFINITY,
      Double.NEGATIVE_INFINITY,
      Double.NEGATIVE_INFINITY
    };
    for (double[] p : positions) {
      b[0] = Math.min(b[0], p[0]);
      b[1] = Math.min(b[1], p[1]);
      b[2] = Math.max(b[2], p[0]);
      b[3] = Math.max(b[3], p[1]);
    }
    return Optional.of(b);
  }

  private static JsonNode unwrap(JsonNode node) {
    if ("Feature".equals(node.path("type").asText())) {
      return node.path("geometry");
    }
    return node;
  }

  private static void collect(JsonNode c, List<double[]> out) {
    if (!c.isArray() || c.isEmpty()) {
      return;
    }
    if (c.get(0).isNumber()) {
      out.add(new double[] {c.get(0).asDouble(), c.get(1).asDouble()});
      return;
    }
    for (JsonNode n : c) {
      collect(n, out);
    }
  }

  private static String polygon(JsonNode rings) {
    return "(" + join(rings, GeoJsonWkt::ring) + ")";
  }

  private static String ring(JsonNode positions) {
    return "(" + join(positions, GeoJsonWkt::position) + ")";
  }

  private static String position(JsonNode p) {
    return num(p.get(0).asDouble()) + " " + num(p.get(1).asDouble());
  }

  private static String join(JsonNode array, java.util.function.Function<JsonNode, String> f) {
    List<String> parts = new ArrayList<>();
    for (JsonNode n : array) {
      parts.add(f.apply(n));
    }
    return String.join(", ", parts);
  }

  private static String num(double v) {
    return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
  }
}
