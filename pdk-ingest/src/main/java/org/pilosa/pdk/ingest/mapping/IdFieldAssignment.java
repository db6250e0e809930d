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

import com.google.common.base.Preconditions;

import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Record;

/**
 * Takes the column id of each record from one of its integer fields. That field is not mapped.
 */
public final class IdFieldAssignment extends IdAssignment {
  private final String mField;

  /**
   * Builds the policy.
   *
   * @param field The id field.
   */
  private IdFieldAssignment(String field) {
    mField = Preconditions.checkNotNull(field);
  }

  /**
   * Creates the policy.
   *
   * @param field The id field.
   * @return the policy.
   */
  public static IdFieldAssignment create(String field) {
    return new IdFieldAssignment(field);
  }

  /** @return the id field. */
  public String getField() {
    return mField;
  }

  /** {@inheritDoc} */
  @Override
  public IndexRef columnFor(SchemaDescriptor descriptor, Record record)
      throws MalformedRecordException {
    final Object value = record.get(mField);
    if (null == value) {
      throw new MalformedRecordException(String.format("Id field '%s' is missing.", mField));
    }
    final long id;
    try {
      id = FieldValues.toLong(mField, value);
    } catch (MappingException me) {
      throw new MalformedRecordException("Invalid column id: " + me.getMessage(), me);
    }
    if (id < 0) {
      throw new MalformedRecordException(
          String.format("Id field '%s' holds a negative id: %d", mField, id));
    }
    return IndexRef.id(id);
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasColumnKeys() {
    return false;
  }

  /** {@inheritDoc} */
  @Override
  public boolean isColumnOnly(String field) {
    return mField.equals(field);
  }
}
