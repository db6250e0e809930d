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

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.Record;

/**
 * Translates records into index mutations according to their schema descriptor.
 *
 * <p>Rules, per declared field:</p>
 * <ol>
 *   <li>A null or absent value produces nothing.</li>
 *   <li>A boolean sets row 0 or 1 of its field. When booleans are packed into a field
 *     <i>P</i>, a true value sets the row named after the field in <i>P</i>, and every
 *     non-null value sets that row in <i>P</i><code>-exists</code>.</li>
 *   <li>An integer sets the row of that id, or stores a bit-sliced value when the field has a
 *     range.</li>
 *   <li>A float is scaled to <code>round((v - offset) * multiplier)</code> and then handled as an
 *     integer.</li>
 *   <li>A string sets the row of that key, or of that id when the field holds row ids.</li>
 *   <li>Each element of a string array sets the row of that key.</li>
 *   <li>The timestamp field is attached to every set mutation of the record.</li>
 * </ol>
 *
 * <p>A field whose value cannot be mapped is dropped and counted; the rest of the record is
 * still mapped. Fields of the record that are not declared are ignored.</p>
 *
 * <p>Mappers are stateless apart from counters and may be shared by workers.</p>
 */
public final class RecordMapper {
  private static final Logger LOG = LoggerFactory.getLogger(RecordMapper.class);

  /** Suffix of the existence field of packed booleans. */
  public static final String EXISTS_SUFFIX = "-exists";

  private final IdAssignment mIdAssignment;
  private final IngestMetrics mMetrics;
  private final long mLogRate;
  private final AtomicLong mDroppedFields = new AtomicLong();

  /** Packed boolean fields, with and without time; null when booleans are not packed. */
  private final FieldSpec mPacked;
  private final FieldSpec mPackedExists;
  private final FieldSpec mTimedPacked;
  private final FieldSpec mTimedPackedExists;

  /**
   * Builds a mapper.
   *
   * @param idAssignment Column policy.
   * @param packBools Packed boolean field, or null.
   * @param metrics Run counters.
   * @param logRate Dropped fields between two log statements.
   */
  private RecordMapper(
      IdAssignment idAssignment,
      String packBools,
      IngestMetrics metrics,
      long logRate) {
    mIdAssignment = Preconditions.checkNotNull(idAssignment);
    mMetrics = Preconditions.checkNotNull(metrics);
    Preconditions.checkArgument(logRate > 0, "Log rate must be positive: %s", logRate);
    mLogRate = logRate;
    if (null != packBools) {
      mPacked = FieldSpec.set(packBools, true, false);
      mPackedExists = FieldSpec.set(packBools + EXISTS_SUFFIX, true, false);
      mTimedPacked = FieldSpec.set(packBools, true, true);
      mTimedPackedExists = FieldSpec.set(packBools + EXISTS_SUFFIX, true, true);
    } else {
      mPacked = null;
      mPackedExists = null;
      mTimedPacked = null;
      mTimedPackedExists = null;
    }
  }

  /**
   * Creates a mapper.
   *
   * @param idAssignment Column policy.
   * @param packBools Packed boolean field, or null to map booleans to their own fields.
   * @param metrics Run counters.
   * @param logRate Dropped fields between two log statements.
   * @return the mapper.
   */
  public static RecordMapper create(
      IdAssignment idAssignment,
      String packBools,
      IngestMetrics metrics,
      long logRate) {
    return new RecordMapper(idAssignment, packBools, metrics, logRate);
  }

  /** @return the column policy. */
  public IdAssignment getIdAssignment() {
    return mIdAssignment;
  }

  /**
   * Maps one record.
   *
   * @param descriptor Descriptor of the record type.
   * @param record The record.
   * @return the mutations, all for the same column.
   * @throws MalformedRecordException if the column of the record cannot be derived.
   */
  public List<Mutation> map(SchemaDescriptor descriptor, Record record)
      throws MalformedRecordException {
    final IndexRef column = mIdAssignment.columnFor(descriptor, record);
    final Long timestamp = timestampOf(descriptor, record);
    final boolean timed = descriptor.isTimed();

    final List<Mutation> mutations = Lists.newArrayList();
    for (FieldDescriptor field : descriptor.getFields()) {
      final FieldSpec spec = descriptor.getFieldSpec(field.getName());
      if (null == spec || mIdAssignment.isColumnOnly(field.getName())) {
        continue;
      }
      final Object value = record.get(field.getName());
      try {
        if (null == value) {
          if (!field.isNullable()) {
            throw new MappingException(field.getName(), "null in a non-nullable field");
          }
          continue;
        }
        mapField(field, spec, value, column, timed ? timestamp : null, timed, mutations);
      } catch (MappingException me) {
        drop(me);
      }
    }
    mMetrics.increment(IngestCounter.MUTATIONS_EMITTED, mutations.size());
    return mutations;
  }

  /**
   * Maps the value of one field.
   *
   * @param field The field.
   * @param spec Its index layout.
   * @param value Its non-null value.
   * @param column Column of the record.
   * @param timestamp Timestamp of the record, or null.
   * @param timed Whether set fields of this record type record time.
   * @param mutations Where to add the mutations.
   * @throws MappingException if the value cannot be mapped.
   */
  private void mapField(
      FieldDescriptor field,
      FieldSpec spec,
      Object value,
      IndexRef column,
      Long timestamp,
      boolean timed,
      List<Mutation> mutations) throws MappingException {
    final String name = field.getName();
    switch (field.getType()) {
      case BOOL: {
        final boolean b = FieldValues.toBoolean(name, value);
        if (null == mPacked) {
          mutations.add(Mutation.set(spec, IndexRef.id(b ? 1L : 0L), column, timestamp));
        } else {
          final IndexRef row = IndexRef.key(name);
          if (b) {
            mutations.add(Mutation.set(timed ? mTimedPacked : mPacked, row, column, timestamp));
          }
          mutations.add(Mutation.set(
              timed ? mTimedPackedExists : mPackedExists, row, column, timestamp));
        }
        break;
      }
      case INT:
        mutations.add(integerMutation(field, spec, FieldValues.toLong(name, value), column,
            timestamp));
        break;
      case FLOAT:
        mutations.add(integerMutation(field, spec, scale(field, FieldValues.toDouble(name, value)),
            column, timestamp));
        break;
      case STRING: {
        final String text = FieldValues.toText(name, value);
        mutations.add(Mutation.set(spec, stringRow(field, text), column, timestamp));
        break;
      }
      case STRING_ARRAY:
        for (String element : FieldValues.toStrings(name, value)) {
          if (null != element) {
            mutations.add(Mutation.set(spec, IndexRef.key(element), column, timestamp));
          }
        }
        break;
      default:
        throw new IllegalStateException("No mapping for field type " + field.getType());
    }
  }

  /**
   * Maps an integer to a row id or to a bit-sliced value.
   *
   * @param field The field.
   * @param spec Its index layout.
   * @param value The integer.
   * @param column Column of the record.
   * @param timestamp Timestamp of the record, or null.
   * @return the mutation.
   * @throws MappingException if the value does not fit the field.
   */
  private static Mutation integerMutation(
      FieldDescriptor field,
      FieldSpec spec,
      long value,
      IndexRef column,
      Long timestamp) throws MappingException {
    if (field.hasRange()) {
      if (value < field.getMin() || value > field.getMax()) {
        throw new MappingException(field.getName(), String.format(
            "%d is outside [%d, %d]", value, field.getMin(), field.getMax()));
      }
      return Mutation.value(spec, column, value);
    }
    if (value < 0) {
      throw new MappingException(field.getName(), "negative row id " + value);
    }
    return Mutation.set(spec, IndexRef.id(value), column, timestamp);
  }

  /**
   * Scales a float to an integer.
   *
   * @param field The field.
   * @param value The float.
   * @return <code>round((value - offset) * multiplier)</code>.
   * @throws MappingException if the result is not a finite long.
   */
  private static long scale(FieldDescriptor field, double value) throws MappingException {
    final double scaled = (value - field.getOffset()) * field.getMultiplier();
    if (Double.isNaN(scaled) || Double.isInfinite(scaled)
        || scaled >= Long.MAX_VALUE || scaled <= Long.MIN_VALUE) {
      throw new MappingException(field.getName(), "cannot scale " + value + " to an integer");
    }
    return Math.round(scaled);
  }

  /**
   * Maps a string to its row.
   *
   * @param field The field.
   * @param text The string.
   * @return the row key, or the row id for fields holding row ids.
   * @throws MappingException if a row id does not parse.
   */
  private static IndexRef stringRow(FieldDescriptor field, String text) throws MappingException {
    if (!field.hasRowIds()) {
      return IndexRef.key(text);
    }
    try {
      return IndexRef.id(Long.parseUnsignedLong(text.trim()));
    } catch (NumberFormatException nfe) {
      throw new MappingException(field.getName(), "not a row id: " + text);
    }
  }

  /**
   * Reads the timestamp of a record.
   *
   * @param descriptor Descriptor of the record type.
   * @param record The record.
   * @return the timestamp in milliseconds, or null when absent or unreadable.
   */
  private Long timestampOf(SchemaDescriptor descriptor, Record record) {
    final FieldDescriptor field = descriptor.getTimestampField();
    if (null == field) {
      return null;
    }
    final Object value = record.get(field.getName());
    if (null == value) {
      return null;
    }
    try {
      return FieldValues.toTimestamp(field, value);
    } catch (MappingException me) {
      drop(me);
      return null;
    }
  }

  /**
   * Counts a dropped field, logging every so often.
   *
   * @param me Why the field was dropped.
   */
  private void drop(MappingException me) {
    mMetrics.increment(IngestCounter.FIELDS_DROPPED);
    if (mDroppedFields.getAndIncrement() % mLogRate == 0L) {
      LOG.warn("Dropping field: {}", me.getMessage());
    }
  }
}
