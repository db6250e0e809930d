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

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableMap;
import org.apache.avro.Schema;

/** Resolves schema identifiers from a fixed map, counting lookups. */
public final class MapSchemaResolver implements SchemaResolver {
  private final ImmutableMap<Integer, Schema> mSchemas;
  private final AtomicInteger mLookups = new AtomicInteger(0);

  /**
   * @param schemas Identifier to schema.
   */
  public MapSchemaResolver(Map<Integer, Schema> schemas) {
    mSchemas = ImmutableMap.copyOf(schemas);
  }

  /** {@inheritDoc} */
  @Override
  public Schema resolve(int id) throws SchemaResolutionException {
    mLookups.incrementAndGet();
    final Schema schema = mSchemas.get(id);
    if (null == schema) {
      throw new SchemaResolutionException(id, "Unknown schema " + id);
    }
    return schema;
  }

  /** @return the number of lookups made. */
  public int getLookups() {
    return mLookups.get();
  }
}
