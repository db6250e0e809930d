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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Record;

/**
 * Keys each column by the concatenated canonical bytes of an ordered list of fields.
 *
 * @see ColumnKeyEncoder
 */
public final class PrimaryKeyAssignment extends IdAssignment {
  private final ImmutableList<String> mFields;

  /**
   * Builds the policy.
   *
   * @param fields Primary key fields, in key order.
   */
  private PrimaryKeyAssignment(List<String> fields) {
    Preconditions.checkArgument(!fields.isEmpty(), "A primary key needs at least one field.");
    mFields = ImmutableList.copyOf(fields);
  }

  /**
   * Creates the policy.
   *
   * @param fields Primary key fields, in key order.
   * @return the policy.
   */
  public static PrimaryKeyAssignment create(List<String> fields) {
    return new PrimaryKeyAssignment(fields);
  }

  /** @return the primary key fields. */
  public List<String> getFields() {
    return mFields;
  }

  /** {@inheritDoc} */
  @Override
  public IndexRef columnFor(SchemaDescriptor descriptor, Record record)
      throws MalformedRecordException {
    final ColumnKeyEncoder encoder = ColumnKeyEncoder.create();
    for (String field : mFields) {
      final Object value = record.get(field);
      if (null == value) {
        throw new MalformedRecordException(
            String.format("Primary key field '%s' is missing.", field));
      }
      final FieldDescriptor declared = descriptor.getField(field);
      try {
        append(encoder, field, null == declared ? null : declared.getType(), value);
      } catch (MappingException me) {
        throw new MalformedRecordException("Invalid primary key: " + me.getMessage(), me);
      }
    }
    return IndexRef.key(encoder.toByteArray());
  }

  /**
   * Appends one component, coerced to its declared type when there is one.
   *
   * @param encoder The key being built.
   * @param field Field name.
   * @param type Declared type, or null when the field is not declared.
   * @param value Normalized value.
   * @throws MappingException if the value does not fit a key.
   */
  private static void append(ColumnKeyEncoder encoder, String field, FieldType type, Object value)
      throws MappingException {
    if (null == type) {
      if (value instanceof Long) {
        type = FieldType.INT;
      } else if (value instanceof Double) {
        type = FieldType.FLOAT;
      } else if (value instanceof Boolean) {
        type = FieldType.BOOL;
      } else {
        type = FieldType.STRING;
      }
    }
    switch (type) {
      case INT:
      case TIMESTAMP:
        encoder.append(FieldValues.toLong(field, value));
        break;
      case FLOAT:
        encoder.append(FieldValues.toDouble(field, value));
        break;
      case BOOL:
        encoder.append(FieldValues.toBoolean(field, value));
        break;
      case STRING:
        encoder.append(FieldValues.toText(field, value));
        break;
      default:
        throw new MappingException(field, "a " + type.jsonName() + " cannot be part of a key");
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasColumnKeys() {
    return true;
  }
}
