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

import org.pilosa.pdk.ingest.ConfigException;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Record;

/**
 * Decides the column of a record. Exactly one policy is active for a run.
 */
public abstract class IdAssignment {
  /**
   * Derives the column of a record.
   *
   * @param descriptor Descriptor of the record type.
   * @param record The record.
   * @return the column reference shared by every mutation of the record.
   * @throws MalformedRecordException if the record lacks what is needed to identify its column.
   */
  public abstract IndexRef columnFor(SchemaDescriptor descriptor, Record record)
      throws MalformedRecordException;

  /** @return whether columns are keys rather than ids. */
  public abstract boolean hasColumnKeys();

  /**
   * Whether a field only identifies the column and is not mapped to rows.
   *
   * @param field Field name.
   * @return true if the field must not be mapped.
   */
  public boolean isColumnOnly(String field) {
    return false;
  }

  /**
   * Creates the policy configured for a run.
   *
   * @param config The run options.
   * @return the policy.
   * @throws ConfigException if neither or both policies are configured.
   */
  public static IdAssignment fromConfig(IngestConfig config) throws ConfigException {
    final boolean primaryKey = !config.getPrimaryKeyFields().isEmpty();
    final boolean idField = null != config.getIdField();
    if (primaryKey == idField) {
      throw new ConfigException("Exactly one of primary-key-fields and id-field must be set.");
    }
    if (primaryKey) {
      return PrimaryKeyAssignment.create(config.getPrimaryKeyFields());
    }
    return IdFieldAssignment.create(config.getIdField());
  }
}
