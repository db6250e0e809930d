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

import org.apache.avro.Schema;

/**
 * Resolves the schema identifiers carried by binary frames.
 */
public interface SchemaResolver {
  /**
   * Resolves an identifier.
   *
   * @param id The identifier.
   * @return the writer schema.
   * @throws SchemaResolutionException if the identifier is unknown or the registry unreachable.
   */
  Schema resolve(int id) throws SchemaResolutionException;
}
