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

package org.pilosa.pdk.ingest.mapping;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Mapping metadata of one record field: logical type, nullability and the options of the mapping
 * rule for its type.
 *
 * <ul>
 *   <li>INT and FLOAT fields with a range map to bit-sliced values, otherwise to row ids.</li>
 *   <li>FLOAT values are scaled to integers: <code>round((v - offset) * multiplier)</code>.</li>
 *   <li>STRING values are row keys unless the field is declared to hold row ids.</li>
 *   <li>TIMESTAMP values given as text are parsed with the field's format.</li>
 * </ul>
 */
public final class FieldDescriptor {
  /** Format of textual timestamps when none is declared. */
  public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

  private final String mName;
  private final FieldType mType;
  private final boolean mNullable;
  private final boolean mRowIds;
  private final Long mMin;
  private final Long mMax;
  private final double mMultiplier;
  private final double mOffset;
  private final String mTimeFormat;

  /**
   * Builds a descriptor from a builder.
   *
   * @param builder The builder.
   */
  private FieldDescriptor(Builder builder) {
    mName = builder.mName;
    mType = builder.mType;
    mNullable = builder.mNullable;
    mRowIds = builder.mRowIds;
    mMin = builder.mMin;
    mMax = builder.mMax;
    mMultiplier = builder.mMultiplier;
    mOffset = builder.mOffset;
    mTimeFormat = builder.mTimeFormat;
  }

  /**
   * Starts a descriptor.
   *
   * @param name Field name.
   * @param type Logical type.
   * @return a builder.
   */
  public static Builder builder(String name, FieldType type) {
    return new Builder(name, type);
  }

  /**
   * Creates a nullable descriptor with default options.
   *
   * @param name Field name.
   * @param type Logical type.
   * @return the descriptor.
   */
  public static FieldDescriptor of(String name, FieldType type) {
    return new Builder(name, type).build();
  }

  /** Builds field descriptors. */
  public static final class Builder {
    private final String mName;
    private final FieldType mType;
    private boolean mNullable = true;
    private boolean mRowIds = false;
    private Long mMin = null;
    private Long mMax = null;
    private double mMultiplier = 1.0;
    private double mOffset = 0.0;
    private String mTimeFormat = DEFAULT_TIME_FORMAT;

    /**
     * Starts a builder.
     *
     * @param name Field name.
     * @param type Logical type.
     */
    private Builder(String name, FieldType type) {
      mName = Preconditions.checkNotNull(name);
      mType = Preconditions.checkNotNull(type);
    }

    /**
     * Sets whether the field may be null.
     *
     * @param nullable Nullability.
     * @return this builder.
     */
    public Builder withNullable(boolean nullable) {
      mNullable = nullable;
      return this;
    }

    /**
     * Declares that string values are numeric row ids rather than row keys.
     *
     * @param rowIds Whether values are row ids.
     * @return this builder.
     */
    public Builder withRowIds(boolean rowIds) {
      mRowIds = rowIds;
      return this;
    }

    /**
     * Declares the range of an INT or FLOAT field, making it a bit-sliced field.
     *
     * @param min Smallest value, after scaling.
     * @param max Largest value, after scaling.
     * @return this builder.
     */
    public Builder withRange(long min, long max) {
      mMin = min;
      mMax = max;
      return this;
    }

    /**
     * Sets the scale of a FLOAT field.
     *
     * @param multiplier Factor applied after the offset.
     * @return this builder.
     */
    public Builder withMultiplier(double multiplier) {
      mMultiplier = multiplier;
      return this;
    }

    /**
     * Sets the offset of a FLOAT field.
     *
     * @param offset Value subtracted before scaling.
     * @return this builder.
     */
    public Builder withOffset(double offset) {
      mOffset = offset;
      return this;
    }

    /**
     * Sets the format of textual timestamps, a {@link java.text.SimpleDateFormat} pattern in UTC.
     *
     * @param format The pattern.
     * @return this builder.
     */
    public Builder withTimeFormat(String format) {
      mTimeFormat = Preconditions.checkNotNull(format);
      return this;
    }

    /** @return the descriptor. */
    public FieldDescriptor build() {
      Preconditions.checkArgument((null == mMin) == (null == mMax),
          "Field %s must declare both ends of its range.", mName);
      Preconditions.checkArgument(null == mMin || mMin <= mMax,
          "Field %s has an empty range.", mName);
      Preconditions.checkArgument(
          null == mMin || mType == FieldType.INT || mType == FieldType.FLOAT,
          "Only int and float fields take a range, not %s field %s.", mType, mName);
      Preconditions.checkArgument(!Double.isNaN(mMultiplier) && mMultiplier != 0.0,
          "Field %s has an invalid multiplier.", mName);
      return new FieldDescriptor(this);
    }
  }

  /** @return the field name. */
  public String getName() {
    return mName;
  }

  /** @return the logical type. */
  public FieldType getType() {
    return mType;
  }

  /** @return whether the field may be null. */
  public boolean isNullable() {
    return mNullable;
  }

  /** @return whether string values are row ids. */
  public boolean hasRowIds() {
    return mRowIds;
  }

  /** @return whether the field is bit-sliced. */
  public boolean hasRange() {
    return null != mMin;
  }

  /** @return the smallest value of a ranged field. */
  public long getMin() {
    Preconditions.checkState(hasRange(), "Field %s has no range.", mName);
    return mMin;
  }

  /** @return the largest value of a ranged field. */
  public long getMax() {
    Preconditions.checkState(hasRange(), "Field %s has no range.", mName);
    return mMax;
  }

  /** @return the FLOAT multiplier. */
  public double getMultiplier() {
    return mMultiplier;
  }

  /** @return the FLOAT offset. */
  public double getOffset() {
    return mOffset;
  }

  /** @return the format of textual timestamps. */
  public String getTimeFormat() {
    return mTimeFormat;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof FieldDescriptor)) {
      return false;
    }
    final FieldDescriptor that = (FieldDescriptor) other;
    return mName.equals(that.mName)
        && mType == that.mType
        && mNullable == that.mNullable
        && mRowIds == that.mRowIds
        && Objects.equal(mMin, that.mMin)
        && Objects.equal(mMax, that.mMax)
        && Double.compare(mMultiplier, that.mMultiplier) == 0
        && Double.compare(mOffset, that.mOffset) == 0
        && mTimeFormat.equals(that.mTimeFormat);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mName, mType, mNullable, mRowIds, mMin, mMax, mMultiplier, mOffset);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", mName)
        .add("type", mType)
        .add("nullable", mNullable)
        .add("rowIds", mRowIds ? Boolean.TRUE : null)
        .add("min", mMin)
        .add("max", mMax)
        .toString();
  }
}
