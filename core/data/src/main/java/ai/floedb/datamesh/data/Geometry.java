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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Geometry held as ISO WKB bytes. Only the envelope is ever interpreted; the bytes otherwise pass
 * through untouched.
 */
public final class Geometry {

  private static final int POINT = 1;
  private static final int LINESTRING = 2;
  private static final int POLYGON = 3;
  private static final int MULTIPOINT = 4;
  private static final int MULTILINESTRING = 5;
  private static final int MULTIPOLYGON = 6;
  private static final int COLLECTION = 7;

  private final byte[] wkb;

  private Geometry(byte[] wkb) {
    this.wkb = wkb;
  }

  public static Geometry fromWkb(byte[] wkb) {
    return new Geometry(Objects.requireNonNull(wkb, "wkb").clone());
  }

  /** Little-endian 2D point. */
  public static Geometry point(double x, double y) {
    ByteBuffer b = ByteBuffer.allocate(21).order(ByteOrder.LITTLE_ENDIAN);
    b.put((byte) 1).putInt(POINT).putDouble(x).putDouble(y);
    return new Geometry(b.array());
  }

  public byte[] wkb() {
    return wkb.clone();
  }

  /** {@code [xmin, ymin, xmax, ymax]}; NaN for an empty geometry. */
  public double[] envelope() {
    double[] env = {
      Double.POSITIVE_INFINITY,
      Double.POSITIVE_INFINITY,
      Double.NEGATIVE_INFINITY,
      Double.NEGATIVE_INFINITY
    };
    ByteBuffer b = ByteBuffer.wrap(wkb);
    readGeometry(b, env);
    if (env[0] > env[2]) {
      return new double[] {Double.NaN, Double.NaN, Double.NaN, Double.NaN};
    }
    return env;
  }

  private static void readGeometry(ByteBuffer b, double[] env) {
    b.order(b.get() == 0 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
    int type = b.getInt();
    int dims = 2;
    int base = type % 1000;
    if (type / 1000 == 1 || type / 1000 == 2) {
      dims = 3;
    } else if (type / 1000 == 3) {
      dims = 4;
    }
    switch (base) {
      case POINT:
        readPoints(b, 1, dims, env);
        break;
      case LINESTRING:
        readPoints(b, b.getInt(), dims, env);
        break;
      case POLYGON:
        int rings = b.getInt();
        for (int r = 0; r < rings; r++) {
          readPoints(b, b.getInt(), dims, env);
        }
        break;
      case MULTIPOINT:
      case MULTILINESTRING:
      case MULTIPOLYGON:
      case COLLECTION:
        int parts = b.getInt();
        for (int p = 0; p < parts; p++) {
          readGeometry(b, env);
        }
        break;
      default:
        throw new IllegalArgumentException("Unsupported WKB geometry type " + type);
    }
  }

  private static void readPoints(ByteBuffer b, int n, int dims, double[] env) {
    for (int i = 0; i < n; i++) {
      double x = b.getDouble();
      double y = b.getDouble();
      for (int d = 2; d < dims; d++) {
        b.getDouble();
      }
      if (Double.isNaN(x) || Double.isNaN(y)) {
        continue;
      }
      env[0] = Math.min(env[0], x);
      env[1] = Math.min(env[1], y);
      env[2] = Math.max(env[2], x);
      env[3] = Math.max(env[3], y);
    }
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Geometry other && Arrays.equals(wkb, other.wkb));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(wkb);
  }

  @Override
  public String toString() {
    return "Geometry{" + wkb.length + " bytes}";
  }
}
