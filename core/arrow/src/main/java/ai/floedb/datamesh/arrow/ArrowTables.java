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

package ai.floedb.datamesh.arrow;

import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.data.DataTable;
import ai.floedb.datamesh.data.DataTable.Column;
import ai.floedb.datamesh.data.DataTable.ColumnType;
import ai.floedb.datamesh.data.GeoTable;
import ai.floedb.datamesh.data.Geometry;
import ai.floedb.datamesh.model.DatameshJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeStampMicroTZVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Arrow IPC stream codec for tables and geo-tables.
 *
 * <p>Geo-tables carry a GeoParquet-style {@code geo} entry in the schema metadata naming the
 * primary geometry column, its WKB encoding and CRS. The geometry column itself is binary and
 * tagged {@code geoarrow.wkb}.
 */
public final class ArrowTables {

  public static final String MEDIA_TYPE = "application/vnd.apache.arrow.stream";

  static final String GEO_METADATA = "geo";
  static final String EXTENSION_NAME = "ARROW:extension:name";
  static final String GEOARROW_WKB = "geoarrow.wkb";

  private ArrowTables() {}

  public static byte[] toBytes(DataContainer table) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      write(table, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode " + table.kind().wireName(), e);
    }
    return out.toByteArray();
  }

  public static DataContainer fromBytes(byte[] payload) {
    try {
      return read(new ByteArrayInputStream(payload));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode Arrow stream", e);
    }
  }

  /** Writes a {@link DataTable} or {@link GeoTable} as a single-batch Arrow stream. */
  public static void write(DataContainer container, OutputStream out) throws IOException {
    DataTable table;
    GeoTable geo = null;
    if (container instanceof GeoTable g) {
      geo = g;
      table = g.attributes();
    } else if (container instanceof DataTable t) {
      table = t;
    } else {
      throw new IllegalArgumentException(
          "Arrow encoding supports tables only, not " + container.kind().wireName());
    }

    List<Field> fields = new ArrayList<>();
    for (Column c : table.columns()) {
      fields.add(new Field(c.name(), new FieldType(true, arrowType(c.type()), null), List.of()));
    }
    Map<String, String> metadata = null;
    if (geo != null) {
      fields.add(
          new Field(
              geo.geometryColumn(),
              new FieldType(
                  true, ArrowType.Binary.INSTANCE, null, Map.of(EXTENSION_NAME, GEOARROW_WKB)),
              List.of()));
      metadata = Map.of(GEO_METADATA, geoMetadata(geo));
    }
    Schema schema = new Schema(fields, metadata);
    int rows = geo != null ? geo.rowCount() : table.rowCount();

    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
        ArrowStreamWriter writer =
            new ArrowStreamWriter(root, null, Channels.newChannel(out))) {
      root.allocateNew();
      for (Column c : table.columns()) {
        fill(root.getVector(c.name()), c);
      }
      if (geo != null) {
        VarBinaryVector v = (VarBinaryVector) root.getVector(geo.geometryColumn());
        List<Geometry> geoms = geo.geometries();
        for (int i = 0; i < geoms.size(); i++) {
          v.setSafe(i, geoms.get(i).wkb());
        }
      }
      root.setRowCount(rows);
      writer.start();
      writer.writeBatch();
      writer.end();
    }
  }

  /**
   * Reads every batch of an Arrow stream. A stream with {@code geo} schema metadata becomes a
   * {@link GeoTable}; anything else a {@link DataTable}.
   */
  public static DataContainer read(InputStream in) throws IOException {
    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        ArrowStreamReader reader = new ArrowStreamReader(in, allocator)) {
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      Schema schema = root.getSchema();
      GeoColumn geoColumn = parseGeo(schema.getCustomMetadata());

      Map<String, ColumnType> types = new LinkedHashMap<>();
      Map<String, List<Object>> values = new LinkedHashMap<>();
      List<Geometry> geometries = new ArrayList<>();
      for (Field f : schema.getFields()) {
        if (geoColumn != null && f.getName().equals(geoColumn.name())) {
          continue;
        }
        types.put(f.getName(), columnType(f));
        values.put(f.getName(), new ArrayList<>());
      }
      while (reader.loadNextBatch()) {
        int rows = root.getRowCount();
        for (Map.Entry<String, List<Object>> e : values.entrySet()) {
          FieldVector v = root.getVector(e.getKey());
          for (int i = 0; i < rows; i++) {
            e.getValue().add(v.isNull(i) ? null : value(v, i));
          }
        }
        if (geoColumn != null) {
          VarBinaryVector v = (VarBinaryVector) root.getVector(geoColumn.name());
          for (int i = 0; i < rows; i++) {
            if (v.isNull(i)) {
              throw new IllegalArgumentException("Null geometry in row " + geometries.size());
            }
            geometries.add(Geometry.fromWkb(v.get(i)));
          }
        }
      }

      List<Column> columns = new ArrayList<>();
      types.forEach((name, type) -> columns.add(new Column(name, type, values.get(name))));
      DataTable table = new DataTable(columns);
      if (geoColumn == null) {
        return table;
      }
      return new GeoTable(table, geoColumn.name(), geometries, geoColumn.crs());
    }
  }

  private static ArrowType arrowType(ColumnType type) {
    switch (type) {
      case INT64:
        return new ArrowType.Int(64, true);
      case FLOAT64:
        return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
      case STRING:
        return ArrowType.Utf8.INSTANCE;
      case BOOLEAN:
        return ArrowType.Bool.INSTANCE;
      case TIMESTAMP:
        return new ArrowType.Timestamp(TimeUnit.MICROSECOND, "UTC");
      default:
        throw new IllegalArgumentException("Unsupported column type " + type);
    }
  }

  private static ColumnType columnType(Field f) {
    ArrowType t = f.getType();
    switch (t.getTypeID()) {
      case Int:
        return ColumnType.INT64;
      case FloatingPoint:
        return ColumnType.FLOAT64;
      case Utf8:
        return ColumnType.STRING;
      case Bool:
        return ColumnType.BOOLEAN;
      case Timestamp:
        return ColumnType.TIMESTAMP;
      default:
        throw new IllegalArgumentException(
            "Unsupported Arrow type " + t + " in column " + f.getName());
    }
  }

  private static void fill(FieldVector vector, Column c) {
    List<Object> vals = c.values();
    for (int i = 0; i < vals.size(); i++) {
      Object o = vals.get(i);
      if (o == null) {
        // freshly allocated validity buffers start out null
        continue;
      }
      switch (c.type()) {
        case INT64 -> ((BigIntVector) vector).setSafe(i, (Long) o);
        case FLOAT64 -> ((Float8Vector) vector).setSafe(i, (Double) o);
        case STRING ->
            ((VarCharVector) vector).setSafe(i, ((String) o).getBytes(StandardCharsets.UTF_8));
        case BOOLEAN -> ((BitVector) vector).setSafe(i, ((Boolean) o) ? 1 : 0);
        case TIMESTAMP -> ((TimeStampMicroTZVector) vector).setSafe(i, micros((Instant) o));
        default -> throw new IllegalArgumentException("Unsupported column type " + c.type());
      }
    }
  }

  private static Object value(FieldVector v, int i) {
    if (v instanceof BitVector b) {
      return b.get(i) == 1;
    }
    if (v instanceof TimeStampVector ts) {
      ArrowType.Timestamp type = (ArrowType.Timestamp) v.getField().getType();
      return instant(ts.get(i), type.getUnit());
    }
    if (v instanceof BaseIntVector iv) {
      return iv.getValueAsLong(i);
    }
    if (v instanceof Float8Vector f8) {
      return f8.get(i);
    }
    if (v instanceof Float4Vector f4) {
      return (double) f4.get(i);
    }
    if (v instanceof VarCharVector s) {
      return new String(s.get(i), StandardCharsets.UTF_8);
    }
    throw new IllegalArgumentException("Unsupported vector " + v.getClass().getSimpleName());
  }

  private static long micros(Instant t) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, t);
  }

  private static Instant instant(long value, TimeUnit unit) {
    switch (unit) {
      case SECOND:
        return Instant.ofEpochSecond(value);
      case MILLISECOND:
        return Instant.ofEpochMilli(value);
      case MICROSECOND:
        return Instant.EPOCH.plus(value, ChronoUnit.MICROS);
      default:
        return Instant.EPOCH.plusNanos(value);
    }
  }

  private static String geoMetadata(GeoTable geo) {
    ObjectNode root = DatameshJson.mapper().createObjectNode();
    root.put("version", "1.0.0");
    root.put("primary_column", geo.geometryColumn());
    ObjectNode col = root.putObject("columns").putObject(geo.geometryColumn());
    col.put("encoding", "WKB");
    col.put("crs", geo.crs());
    col.putArray("geometry_types");
    return DatameshJson.write(root);
  }

  private record GeoColumn(String name, String crs) {}

  private static GeoColumn parseGeo(Map<String, String> metadata) throws IOException {
    if (metadata == null || !metadata.containsKey(GEO_METADATA)) {
      return null;
    }
    JsonNode geo = DatameshJson.mapper().readTree(metadata.get(GEO_METADATA));
    String primary = geo.path("primary_column").asText(GeoTable.DEFAULT_GEOMETRY_COLUMN);
    JsonNode col = geo.path("columns").path(primary);
    String encoding = col.path("encoding").asText("WKB");
    if (!"WKB".equalsIgnoreCase(encoding)) {
      throw new IllegalArgumentException("Unsupported geometry encoding " + encoding);
    }
    JsonNode crs = col.path("crs");
    String crsText = null;
    if (crs.isTextual()) {
      crsText = crs.asText();
    } else if (crs.path("id").isObject()) {
      JsonNode id = crs.path("id");
      crsText = id.path("authority").asText() + ":" + id.path("code").asText();
    }
    return new GeoColumn(primary, crsText);
  }
}
