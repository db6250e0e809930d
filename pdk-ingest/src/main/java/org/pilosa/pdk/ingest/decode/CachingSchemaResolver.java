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

import java.util.concurrent.ExecutionException;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.apache.avro.Schema;

/**
 * Remembers every schema resolved by another resolver. Identifiers are issued monotonically by
 * the registry and never reused, so entries are never evicted. Failed resolutions are not
 * remembered.
 */
public final class CachingSchemaResolver implements SchemaResolver {
  private final LoadingCache<Integer, Schema> mCache;

  /**
   * Builds a caching resolver.
   *
   * @param delegate The resolver to consult on a miss.
   */
  private CachingSchemaResolver(final SchemaResolver delegate) {
    Preconditions.checkNotNull(delegate);
    mCache = CacheBuilder.newBuilder()
        .build(
            new CacheLoader<Integer, Schema>() {
              /** {@inheritDoc} */
              @Override
              public Schema load(Integer id) throws SchemaResolutionException {
                return delegate.resolve(id);
              }
            });
  }

  /**
   * Creates a caching resolver.
   *
   * @param delegate The resolver to consult on a miss.
   * @return the resolver.
   */
  public static CachingSchemaResolver create(SchemaResolver delegate) {
    return new CachingSchemaResolver(delegate);
  }

  /** {@inheritDoc} */
  @Override
  public Schema resolve(int id) throws SchemaResolutionException {
    try {
      return mCache.get(id);
    } catch (ExecutionException ee) {
      if (ee.getCause() instanceof SchemaResolutionException) {
        throw (SchemaResolutionException) ee.getCause();
      }
      throw new SchemaResolutionException(id, "Could not resolve schema " + id, ee.getCause());
    } catch (UncheckedExecutionException uee) {
      throw new SchemaResolutionException(id, "Could not resolve schema " + id, uee.getCause());
    }
  }

  /** @return the number of schemas held. */
  public long size() {
    return mCache.size();
  }
}
