/**
 * (c) Copyright 2013 WibiData, Inc.
 *
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.
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

package org.pilosa.pdk.ingest;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * How a field of the index is laid out: a set field with id or key rows, a set field that also
 * records time, or an integer field holding bit-sliced values within a range.
 */
public final class FieldSpec {
  /** Kind of index field. */
  public enum Type {
    /** Rows of column bits. */
    SET,
    /** Rows of column bits, also recorded per time quantum. */
    TIME,
    /** A bit-sliced integer per column. */
    INT
  }

  private final String mName;
  private final Type mType;
  private final boolean mRowKeys;
  private final long mMin;
  private final long mMax;

  /**
   * Builds a field spec.
   *
   * @param name Field name.
   * @param type Field type.
   * @param rowKeys Whether rows are addressed by key.
   * @param min Minimum value of an integer field.
   * @param max Maximum value of an integer field.
   */
  private FieldSpec(String name, Type type, boolean rowKeys, long min, long max) {
    mName = Preconditions.checkNotNull(name);
    mType = Preconditions.checkNotNull(type);
    mRowKeys = rowKeys;
    mMin = min;
    mMax = max;
  }

  /**
   * Creates the spec of a set field.
   *
   * @param name Field name.
   * @param rowKeys Whether rows are addressed by key rather than id.
   * @param timed Whether set bits also carry a timestamp.
   * @return the spec.
   */
  public static FieldSpec set(String name, boolean rowKeys, boolean timed) {
    return new FieldSpec(name, timed ? Type.TIME : Type.SET, rowKeys, 0L, 0L);
  }

  /**
   * Creates the spec of an integer field.
   *
   * @param name Field name.
   * @param min Smallest storable value.
   * @param max Largest storable value.
   * @return the spec.
   */
  public static FieldSpec integer(String name, long min, long max) {
    Preconditions.checkArgument(min <= max, "Field %s has min %s > max %s.", name, min, max);
    return new FieldSpec(name, Type.INT, false, min, max);
  }

  /** @return the field name. */
  public String getName() {
    return mName;
  }

  /** @return the field type. */
  public Type getType() {
    return mType;
  }

  /** @return whether rows of this field are keys. */
  public boolean hasRowKeys() {
    return mRowKeys;
  }

  /** @return the smallest value of an integer field. */
  public long getMin() {
    return mMin;
  }

  /** @return the largest value of an integer field. */
  public long getMax() {
    return mMax;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FieldSpec)) {
      return false;
    }
    final FieldSpec that = (FieldSpec) other;
    return mName.equals(that.mName)
        && mType == that.mType
        && mRowKeys == that.mRowKeys
        && mMin == that.mMin
        && mMax == that.mMax;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mName, mType, mRowKeys, mMin, mMax);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", mName)
        .add("type", mType)
        .add("rowKeys", mRowKeys)
        .add("min", mMin)
        .add("max", mMax)
        .toString();
  }
}
