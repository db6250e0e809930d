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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An atomic change destined for the index: set the bit at (row, column) of a field, or store an
 * integer value for a column of a bit-sliced field. Either form may carry a timestamp.
 */
public final class Mutation {
  private final FieldSpec mField;
  private final IndexRef mRow;
  private final IndexRef mColumn;
  private final Long mValue;
  private final Long mTimestamp;

  /**
   * Builds a mutation.
   *
   * @param field Target field.
   * @param row Row reference, null for value mutations.
   * @param column Column reference.
   * @param value Integer value, null for set mutations.
   * @param timestamp Timestamp in milliseconds since the epoch, or null.
   */
  private Mutation(FieldSpec field, IndexRef row, IndexRef column, Long value, Long timestamp) {
    mField = Preconditions.checkNotNull(field);
    mRow = row;
    mColumn = Preconditions.checkNotNull(column);
    mValue = value;
    mTimestamp = timestamp;
  }

  /**
   * Creates a set mutation.
   *
   * @param field Target field; must not be an integer field.
   * @param row Row to set.
   * @param column Column to set.
   * @param timestamp Optional timestamp in milliseconds, or null.
   * @return the mutation.
   */
  public static Mutation set(FieldSpec field, IndexRef row, IndexRef column, Long timestamp) {
    Preconditions.checkArgument(field.getType() != FieldSpec.Type.INT,
        "Field %s holds values, not rows.", field.getName());
    Preconditions.checkNotNull(row);
    Preconditions.checkArgument(row.isKey() == field.hasRowKeys(),
        "Row %s does not match the row space of field %s.", row, field.getName());
    return new Mutation(field, row, column, null, timestamp);
  }

  /**
   * Creates a value mutation.
   *
   * @param field Target integer field.
   * @param column Column to store the value for.
   * @param value The value.
   * @return the mutation.
   */
  public static Mutation value(FieldSpec field, IndexRef column, long value) {
    Preconditions.checkArgument(field.getType() == FieldSpec.Type.INT,
        "Field %s holds rows, not values.", field.getName());
    return new Mutation(field, null, column, value, null);
  }

  /** @return the target field. */
  public FieldSpec getField() {
    return mField;
  }

  /** @return the target field name. */
  public String getFieldName() {
    return mField.getName();
  }

  /** @return the row, or null for value mutations. */
  public IndexRef getRow() {
    return mRow;
  }

  /** @return the column. */
  public IndexRef getColumn() {
    return mColumn;
  }

  /** @return whether this mutation stores a value rather than setting a bit. */
  public boolean isValue() {
    return null != mValue;
  }

  /** @return the value of a value mutation. */
  public long getValue() {
    Preconditions.checkState(isValue(), "Not a value mutation: %s", this);
    return mValue;
  }

  /** @return the timestamp in milliseconds since the epoch, or null. */
  public Long getTimestamp() {
    return mTimestamp;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Mutation)) {
      return false;
    }
    final Mutation that = (Mutation) other;
    return mField.equals(that.mField)
        && Objects.equal(mRow, that.mRow)
        && mColumn.equals(that.mColumn)
        && Objects.equal(mValue, that.mValue)
        && Objects.equal(mTimestamp, that.mTimestamp);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hashCode(mField, mRow, mColumn, mValue, mTimestamp);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(mField.getName());
    if (isValue()) {
      sb.append('[').append(mColumn).append("]=").append(mValue);
    } else {
      sb.append(".row(").append(mRow).append(")<-").append(mColumn);
    }
    if (null != mTimestamp) {
      sb.append('@').append(mTimestamp);
    }
    return sb.toString();
  }
}
