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

package org.pilosa.pdk.ingest.sink;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.batch.Batch;

/**
 * An index held in memory, for tests and dry runs. Bits have set semantics on
 * <code>(field, row, column)</code> and integer values keep the last write.
 */
public final class InMemoryIndexSink implements BatchSink {
  /** Bits of each field: row to columns. */
  private final Map<String, SetMultimap<IndexRef, IndexRef>> mBits = Maps.newTreeMap();

  /** Values of each integer field: column to value. */
  private final Map<String, Map<IndexRef, Long>> mValues = Maps.newTreeMap();

  /** Last definition seen of each field. */
  private final Map<String, FieldSpec> mFields = Maps.newTreeMap();

  private int mAppliedBatches = 0;

  /** @return a new, empty index. */
  public static InMemoryIndexSink create() {
    return new InMemoryIndexSink();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void apply(Batch batch) throws SinkException {
    final FieldSpec field = batch.getField();
    // Validate the whole batch first so that it applies as a unit.
    for (Mutation mutation : batch.getMutations()) {
      if (mutation.isValue()
          && (mutation.getValue() < field.getMin() || mutation.getValue() > field.getMax())) {
        throw new SinkException(String.format("Value %d out of range [%d, %d] for field %s.",
            mutation.getValue(), field.getMin(), field.getMax(), field.getName()), false);
      }
    }
    mFields.put(field.getName(), field);
    for (Mutation mutation : batch.getMutations()) {
      if (mutation.isValue()) {
        Map<IndexRef, Long> values = mValues.get(field.getName());
        if (null == values) {
          values = Maps.newHashMap();
          mValues.put(field.getName(), values);
        }
        values.put(mutation.getColumn(), mutation.getValue());
      } else {
        SetMultimap<IndexRef, IndexRef> bits = mBits.get(field.getName());
        if (null == bits) {
          bits = HashMultimap.create();
          mBits.put(field.getName(), bits);
        }
        bits.put(mutation.getRow(), mutation.getColumn());
      }
    }
    mAppliedBatches++;
  }

  /**
   * Gets the columns set in a row.
   *
   * @param field Field name.
   * @param row The row.
   * @return the columns, possibly empty.
   */
  public synchronized Set<IndexRef> getColumns(String field, IndexRef row) {
    final SetMultimap<IndexRef, IndexRef> bits = mBits.get(field);
    return null == bits ? ImmutableSet.<IndexRef>of() : ImmutableSet.copyOf(bits.get(row));
  }

  /**
   * Gets the rows of a field that have at least one bit.
   *
   * @param field Field name.
   * @return the rows, possibly empty.
   */
  public synchronized Set<IndexRef> getRows(String field) {
    final SetMultimap<IndexRef, IndexRef> bits = mBits.get(field);
    return null == bits ? ImmutableSet.<IndexRef>of() : ImmutableSet.copyOf(bits.keySet());
  }

  /**
   * Gets the value of a column in an integer field.
   *
   * @param field Field name.
   * @param column The column.
   * @return the value, or null if never set.
   */
  public synchronized Long getValue(String field, IndexRef column) {
    final Map<IndexRef, Long> values = mValues.get(field);
    return null == values ? null : values.get(column);
  }

  /** @return the names of every field written to. */
  public synchronized Set<String> getFieldNames() {
    return ImmutableSet.<String>builder()
        .addAll(mBits.keySet())
        .addAll(mValues.keySet())
        .build();
  }

  /**
   * Gets the last definition seen of a field.
   *
   * @param field Field name.
   * @return the definition, or null.
   */
  public synchronized FieldSpec getFieldSpec(String field) {
    return mFields.get(field);
  }

  /** @return the number of batches applied. */
  public synchronized int getAppliedBatchCount() {
    return mAppliedBatches;
  }

  /** @return the total number of bits set, across fields. */
  public synchronized long getBitCount() {
    long count = 0;
    for (SetMultimap<IndexRef, IndexRef> bits : mBits.values()) {
      count += bits.size();
    }
    return count;
  }

  /**
   * Compares the content of two indexes, ignoring how many batches built them.
   *
   * @param other Another index.
   * @return true if both hold the same bits and values.
   */
  public boolean hasSameContentAs(InMemoryIndexSink other) {
    return bitsSnapshot().equals(other.bitsSnapshot())
        && valuesSnapshot().equals(other.valuesSnapshot());
  }

  /** @return a copy of every bit. */
  private synchronized Map<String, ImmutableSetMultimap<IndexRef, IndexRef>> bitsSnapshot() {
    final ImmutableMap.Builder<String, ImmutableSetMultimap<IndexRef, IndexRef>> snapshot =
        ImmutableMap.builder();
    for (Map.Entry<String, SetMultimap<IndexRef, IndexRef>> entry : mBits.entrySet()) {
      snapshot.put(entry.getKey(), ImmutableSetMultimap.copyOf(entry.getValue()));
    }
    return snapshot.build();
  }

  /** @return a copy of every value. */
  private synchronized Map<String, ImmutableMap<IndexRef, Long>> valuesSnapshot() {
    final ImmutableMap.Builder<String, ImmutableMap<IndexRef, Long>> snapshot =
        ImmutableMap.builder();
    for (Map.Entry<String, Map<IndexRef, Long>> entry : mValues.entrySet()) {
      snapshot.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return snapshot.build();
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    // Nothing to release.
  }
}
