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

/**
 * Thrown when the value of a single field cannot be mapped. The field is dropped and the rest of
 * the record is still mapped.
 */
public class MappingException extends Exception {
  private final String mField;

  /**
   * Creates a new exception.
   *
   * @param field The offending field.
   * @param message What is wrong with its value.
   */
  public MappingException(String field, String message) {
    super(String.format("Field '%s': %s", field, message));
    mField = field;
  }

  /** @return the offending field. */
  public String getField() {
    return mField;
  }
}
