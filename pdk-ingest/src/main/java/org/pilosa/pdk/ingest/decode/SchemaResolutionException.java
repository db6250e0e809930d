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

package org.pilosa.pdk.ingest.decode;

import java.io.IOException;

/**
 * Thrown when the schema identifier carried by a frame cannot be resolved. The frame fails and
 * is never acknowledged.
 */
public class SchemaResolutionException extends IOException {
  private final int mSchemaId;

  /**
   * Creates a new exception.
   *
   * @param schemaId The unresolved identifier.
   * @param message What went wrong.
   */
  public SchemaResolutionException(int schemaId, String message) {
    super(message);
    mSchemaId = schemaId;
  }

  /**
   * Creates a new exception.
   *
   * @param schemaId The unresolved identifier.
   * @param message What went wrong.
   * @param cause Underlying failure.
   */
  public SchemaResolutionException(int schemaId, String message, Throwable cause) {
    super(message, cause);
    mSchemaId = schemaId;
  }

  /** @return the unresolved identifier. */
  public int getSchemaId() {
    return mSchemaId;
  }
}
