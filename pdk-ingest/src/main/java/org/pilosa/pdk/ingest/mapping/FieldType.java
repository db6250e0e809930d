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

import java.util.Locale;

/** Logical type of a record field. */
public enum FieldType {
  BOOL,
  INT,
  FLOAT,
  STRING,
  STRING_ARRAY,
  TIMESTAMP,
  /** A nested record or array of records; not mapped. */
  RECORD;

  /**
   * Parses the lower-case name used in JSON descriptors.
   *
   * @param name Type name, for example <code>string_array</code>.
   * @return the type, or null if unknown.
   */
  public static FieldType fromName(String name) {
    for (FieldType type : values()) {
      if (type.name().equalsIgnoreCase(name)) {
        return type;
      }
    }
    if ("boolean".equalsIgnoreCase(name)) {
      return BOOL;
    }
    return null;
  }

  /** @return the name used in JSON descriptors. */
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
