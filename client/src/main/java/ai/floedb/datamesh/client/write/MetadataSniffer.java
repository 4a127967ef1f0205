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

package ai.floedb.datamesh.client.write;

import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.LabeledDataset;
import ai.floedb.datamesh.data.TimeAxis;
import ai.floedb.datamesh.data.Variable;
import ai.floedb.datamesh.model.CoordinateRole;
import ai.floedb.datamesh.model.DatameshJson;
import ai.floedb.datamesh.model.Datasource;
import ai.floedb.datamesh.model.DatasourceSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/** Fills in datasource metadata that a write left unset, from the written data. */
public final class MetadataSniffer {

  private static final Logger LOG = Logger.getLogger(MetadataSniffer.class);

  static final Instant DEFAULT_TSTART = Instant.EPOCH;
  private static final Pattern EPSG =
      Pattern.compile("^(?:EPSG:)?(\\d+)$", Pattern.CASE_INSENSITIVE);

  private MetadataSniffer() {}

  /**
   * Derives schema, coordinate roles, bounding-box geometry and time bounds for whichever of them
   * {@code ds} does not set yet.
   */
  public static Datasource sniff(Datasource ds, DataContainer data, Instant now) {
    Datasource.Builder b = ds.toBuilder();
    if (ds.schema().dims().isEmpty()) {
      b.schema(data.toSchema());
    }
    Map<String, String> coords = ds.coordinates();
    if (coords.isEmpty()) {
      Map<String, String> guessed = new LinkedHashMap<>();
      for (String field : indexFields(data)) {
        CoordinateRole.guess(field).ifPresent(r -> guessed.put(r.key(), field));
      }
      coords = guessed;
      b.coordinates(guessed);
    }

    if (isMissingGeometry(ds.geom())) {
      Optional<double[]> box = Optional.empty();
      String x = coords.get(CoordinateRole.EASTING.key());
      String y = coords.get(CoordinateRole.NORTHING.key());
      if (x != null && y != null) {
        Optional<double[]> xs = range(data, x);
        Optional<double[]> ys = range(data, y);
        if (xs.isPresent() && ys.isPresent()) {
          LOG.warn("Setting geometry as a bbox from x and y coordinates");
          box = Optional.of(new double[] {xs.get()[0], ys.get()[0], xs.get()[1], ys.get()[1]});
        }
      }
      if (box.isEmpty() && data instanceof GeoTable) {
        box = ((GeoTable) data).bounds();
      }
      box.ifPresent(bbox -> b.geom(polygon(bbox)));
    }

    String t = coords.get(CoordinateRole.TIME.key());
    Optional<List<Instant>> times = t == null ? Optional.empty() : times(data, t);
    if (ds.tstart() == null) {
      if (times.isPresent() && !times.get().isEmpty()) {
        b.tstart(Collections.min(times.get()));
      } else {
        LOG.warn("Setting tstart to 1970-01-01T00:00:00Z");
        b.tstart(DEFAULT_TSTART);
      }
    }
    if (ds.tend() == null && ds.pforecast() == null) {
      if (times.isPresent() && !times.get().isEmpty()) {
        b.tend(Collections.max(times.get()));
      } else {
        LOG.warn("Setting tend to current time");
        b.tend(now);
      }
    }
    return b.build();
  }

  /**
   * Records a non-WGS84 CRS in the schema attributes. EPSG codes are stored as integers, other
   * definitions verbatim.
   */
  public static Datasource withCrs(Datasource ds, String crs) {
    if (crs == null || crs.isBlank()) {
      return ds;
    }
    Matcher m = EPSG.matcher(crs.trim());
    Object value = crs.trim();
    if (m.matches()) {
      int code = Integer.parseInt(m.group(1));
      if (code == 4326) {
        return ds;
      }
      value = code;
    }
    DatasourceSchema schema = ds.schema().withAttr("crs", value);
    return ds.toBuilder().schema(schema).build();
  }

  /** Storage driver the service uses for a container kind. */
  public static String driverFor(DataContainer data) {
    switch (data.kind()) {
      case DATASET:
        return "onzarr";
      case GEO_TABLE:
        return "postgis";
      default:
        return "onsql";
    }
  }

  public static boolean isMissingGeometry(JsonNode geom) {
    if (geom == null || geom.isNull() || geom.isMissingNode()) {
      return true;
    }
    if ("point".equals(geom.path("type").asText().toLowerCase(Locale.ROOT))) {
      JsonNode c = geom.path("coordinates");
      return c.size() >= 2 && c.get(0).asDouble() == 0 && c.get(1).asDouble() == 0;
    }
    return false;
  }

  private static List<String> indexFields(DataContainer data) {
    if (data instanceof LabeledDataset) {
      return new ArrayList<>(((LabeledDataset) data).coords().keySet());
    }
    if (data instanceof GeoTable) {
      GeoTable g = (GeoTable) data;
      List<String> names = new ArrayList<>(g.attributes().columnNames());
      names.add(g.geometryColumn());
      return names;
    }
    if (data instanceof DataTable) {
      return ((DataTable) data).columnNames();
    }
    return List.of();
  }

  private static Optional<double[]> range(DataContainer data, String field) {
    if (data instanceof LabeledDataset) {
      return ((LabeledDataset) data)
          .variable(field)
          .filter(v -> v.data().size() > 0)
          .map(v -> new double[] {v.data().min(), v.data().max()});
    }
    DataTable table = table(data);
    if (table == null) {
      return Optional.empty();
    }
    return table
        .column(field)
        .filter(c -> c.type().isNumeric())
        .flatMap(
            c -> {
              double lo = Double.POSITIVE_INFINITY;
              double hi = Double.NEGATIVE_INFINITY;
              for (double v : c.doubles()) {
                if (!Double.isNaN(v)) {
                  lo = Math.min(lo, v);
                  hi = Math.max(hi, v);
                }
              }
              return lo > hi ? Optional.empty() : Optional.of(new double[] {lo, hi});
            });
  }

  private static Optional<List<Instant>> times(DataContainer data, String field) {
    if (data instanceof LabeledDataset) {
      Optional<Variable> v = ((LabeledDataset) data).variable(field);
      return v.flatMap(TimeAxis::decode);
    }
    DataTable table = table(data);
    if (table == null) {
      return Optional.empty();
    }
    return table
        .column(field)
        .filter(c -> c.type() == DataTable.ColumnType.TIMESTAMP)
        .map(
            c -> {
              List<Instant> out = new ArrayList<>();
              for (Object o : c.values()) {
                if (o != null) {
                  out.add((Instant) o);
                }
              }
              return out;
            });
  }

  private static DataTable table(DataContainer data) {
    if (data instanceof GeoTable) {
      return ((GeoTable) data).attributes();
    }
    return data instanceof DataTable ? (DataTable) data : null;
  }

  static ObjectNode polygon(double[] bbox) {
    ObjectNode geom = DatameshJson.mapper().createObjectNode();
    geom.put("type", "Polygon");
    ArrayNode ring = geom.putArray("coordinates").addArray();
    double[][] corners = {
      {bbox[2], bbox[1]},
      {bbox[2], bbox[3]},
      {bbox[0], bbox[3]},
      {bbox[0], bbox[1]},
      {bbox[2], bbox[1]}
    };
    for (double[] c : corners) {
      ring.addArray().add(c[0]).add(c[1]);
    }
    return geom;
  }
}
