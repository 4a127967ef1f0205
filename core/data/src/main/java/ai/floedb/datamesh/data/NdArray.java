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

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, C-ordered n-dimensional array of 64-bit floats or integers.
 *
 * <p>Region operations take a start offset and a count per axis and copy; nothing shares the
 * backing storage with the caller.
 */
public final class NdArray {

  public enum DType {
    FLOAT64,
    INT64
  }

  private final DType dtype;
  private final int[] shape;
  private final double[] doubles;
  private final long[] longs;

  private NdArray(DType dtype, int[] shape, double[] doubles, long[] longs) {
    this.dtype = dtype;
    this.shape = shape;
    this.doubles = doubles;
    this.longs = longs;
  }

  public static NdArray ofDoubles(double[] data, int... shape) {
    Objects.requireNonNull(data, "data");
    checkSize(data.length, shape);
    return new NdArray(DType.FLOAT64, shape.clone(), data.clone(), null);
  }

  public static NdArray ofLongs(long[] data, int... shape) {
    Objects.requireNonNull(data, "data");
    checkSize(data.length, shape);
    return new NdArray(DType.INT64, shape.clone(), null, data.clone());
  }

  public static NdArray vector(double... data) {
    return ofDoubles(data, data.length);
  }

  public static NdArray vector(long... data) {
    return ofLongs(data, data.length);
  }

  public static NdArray zeros(DType dtype, int... shape) {
    int n = product(shape, 0, shape.length);
    return dtype == DType.FLOAT64
        ? new NdArray(dtype, shape.clone(), new double[n], null)
        : new NdArray(dtype, shape.clone(), null, new long[n]);
  }

  public DType dtype() {
    return dtype;
  }

  public int rank() {
    return shape.length;
  }

  public int[] shape() {
    return shape.clone();
  }

  public int length(int axis) {
    return shape[axis];
  }

  public int size() {
    return product(shape, 0, shape.length);
  }

  public double getDouble(int flat) {
    return dtype == DType.FLOAT64 ? doubles[flat] : longs[flat];
  }

  public long getLong(int flat) {
    return dtype == DType.INT64 ? longs[flat] : (long) doubles[flat];
  }

  /** Boxed element: {@link Double} or {@link Long} depending on dtype. */
  public Object get(int flat) {
    return dtype == DType.FLOAT64 ? (Object) doubles[flat] : (Object) longs[flat];
  }

  public double doubleAt(int... index) {
    return getDouble(flatIndex(index));
  }

  public double[] toDoubles() {
    if (dtype == DType.FLOAT64) {
      return doubles.clone();
    }
    double[] out = new double[longs.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = longs[i];
    }
    return out;
  }

  public long[] toLongs() {
    if (dtype == DType.INT64) {
      return longs.clone();
    }
    long[] out = new long[doubles.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = (long) doubles[i];
    }
    return out;
  }

  public double min() {
    double m = Double.POSITIVE_INFINITY;
    for (int i = 0; i < size(); i++) {
      double v = getDouble(i);
      if (!Double.isNaN(v)) {
        m = Math.min(m, v);
      }
    }
    return m;
  }

  public double max() {
    double m = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < size(); i++) {
      double v = getDouble(i);
      if (!Double.isNaN(v)) {
        m = Math.max(m, v);
      }
    }
    return m;
  }

  /** Elements {@code [start, end)} along {@code axis}, all of every other axis. */
  public NdArray slice(int axis, int start, int end) {
    if (start < 0 || end > shape[axis] || start > end) {
      throw new IndexOutOfBoundsException(
          "slice [" + start + ", " + end + ") out of axis length " + shape[axis]);
    }
    int[] offset = new int[shape.length];
    int[] count = shape.clone();
    offset[axis] = start;
    count[axis] = end - start;
    return region(offset, count);
  }

  /** Copy of the hyper-rectangle starting at {@code offset} with extent {@code count}. */
  public NdArray region(int[] offset, int[] count) {
    checkRegion(offset, count);
    NdArray out = zeros(dtype, count);
    copyBlock(this, offset, out, new int[rank()], count);
    return out;
  }

  /** Copy of this array with {@code block} written at {@code offset}. */
  public NdArray withRegion(int[] offset, NdArray block) {
    if (block.dtype != dtype) {
      throw new IllegalArgumentException("dtype mismatch: " + dtype + " vs " + block.dtype);
    }
    checkRegion(offset, block.shape);
    NdArray out = copy();
    copyBlock(block, new int[rank()], out, offset, block.shape);
    return out;
  }

  /** Concatenation of {@code a} then {@code b} along {@code axis}. */
  public static NdArray concat(int axis, NdArray a, NdArray b) {
    if (a.dtype != b.dtype || a.rank() != b.rank()) {
      throw new IllegalArgumentException("Cannot concatenate arrays of different dtype or rank");
    }
    for (int i = 0; i < a.rank(); i++) {
      if (i != axis && a.shape[i] != b.shape[i]) {
        throw new IllegalArgumentException("Shapes differ off the concatenation axis");
      }
    }
    int[] shape = a.shape.clone();
    shape[axis] += b.shape[axis];
    NdArray out = zeros(a.dtype, shape);
    copyBlock(a, new int[a.rank()], out, new int[a.rank()], a.shape);
    int[] at = new int[a.rank()];
    at[axis] = a.shape[axis];
    copyBlock(b, new int[b.rank()], out, at, b.shape);
    return out;
  }

  /** Same values widened or narrowed to {@code target}. */
  public NdArray as(DType target) {
    if (target == dtype) {
      return this;
    }
    return target == DType.FLOAT64 ? ofDoubles(toDoubles(), shape) : ofLongs(toLongs(), shape);
  }

  private NdArray copy() {
    return new NdArray(
        dtype,
        shape.clone(),
        doubles == null ? null : doubles.clone(),
        longs == null ? null : longs.clone());
  }

  private int flatIndex(int[] index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException("Expected " + shape.length + " indices");
    }
    int flat = 0;
    for (int i = 0; i < index.length; i++) {
      if (index[i] < 0 || index[i] >= shape[i]) {
        throw new IndexOutOfBoundsException("index " + index[i] + " on axis " + i);
      }
      flat = flat * shape[i] + index[i];
    }
    return flat;
  }

  private void checkRegion(int[] offset, int[] count) {
    if (offset.length != shape.length || count.length != shape.length) {
      throw new IllegalArgumentException("Region rank does not match array rank " + rank());
    }
    for (int i = 0; i < shape.length; i++) {
      if (offset[i] < 0 || count[i] < 0 || offset[i] + count[i] > shape[i]) {
        throw new IndexOutOfBoundsException(
            "Region " + Arrays.toString(offset) + "+" + Arrays.toString(count)
                + " outside " + Arrays.toString(shape));
      }
    }
  }

  private static void copyBlock(NdArray src, int[] srcOff, NdArray dst, int[] dstOff, int[] count) {
    int rank = count.length;
    if (product(count, 0, rank) == 0) {
      return;
    }
    if (rank == 0) {
      copyRun(src, 0, dst, 0, 1);
      return;
    }
    int run = count[rank - 1];
    int[] idx = new int[rank - 1];
    while (true) {
      int s = 0;
      int d = 0;
      for (int i = 0; i < rank - 1; i++) {
        s = s * src.shape[i] + srcOff[i] + idx[i];
        d = d * dst.shape[i] + dstOff[i] + idx[i];
      }
      s = s * src.shape[rank - 1] + srcOff[rank - 1];
      d = d * dst.shape[rank - 1] + dstOff[rank - 1];
      copyRun(src, s, dst, d, run);
      int axis = rank - 2;
      while (axis >= 0) {
        if (++idx[axis] < count[axis]) {
          break;
        }
        idx[axis] = 0;
        axis--;
      }
      if (axis < 0) {
        return;
      }
    }
  }

  private static void copyRun(NdArray src, int s, NdArray dst, int d, int n) {
    if (dst.dtype == DType.FLOAT64) {
      System.arraycopy(src.doubles, s, dst.doubles, d, n);
    } else {
      System.arraycopy(src.longs, s, dst.longs, d, n);
    }
  }

  private static void checkSize(int length, int[] shape) {
    for (int n : shape) {
      if (n < 0) {
        throw new IllegalArgumentException("Negative dimension in " + Arrays.toString(shape));
      }
    }
    if (product(shape, 0, shape.length) != length) {
      throw new IllegalArgumentException(
          length + " elements do not fill shape " + Arrays.toString(shape));
    }
  }

  static int product(int[] shape, int from, int to) {
    int p = 1;
    for (int i = from; i < to; i++) {
      p *= shape[i];
    }
    return p;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NdArray other)) {
      return false;
    }
    return dtype == other.dtype
        && Arrays.equals(shape, other.shape)
        && Arrays.equals(doubles, other.doubles)
        && Arrays.equals(longs, other.longs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        dtype, Arrays.hashCode(shape), Arrays.hashCode(doubles), Arrays.hashCode(longs));
  }

  @Override
  public String toString() {
    String values =
        dtype == DType.FLOAT64 ? Arrays.toString(doubles) : Arrays.toString(longs);
    if (values.length() > 120) {
      values = values.substring(0, 117) + "...";
    }
    return "NdArray{" + dtype + " " + Arrays.toString(shape) + " " + values + "}";
  }
}
