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

package org.pilosa.pdk.ingest.sink;

import java.io.Closeable;

import org.pilosa.pdk.ingest.batch.Batch;

/**
 * Applies batches of mutations to the target index. Implementations are called from several
 * threads at once and must be thread-safe. A batch either applies fully or fails as a unit.
 */
public interface BatchSink extends Closeable {
  /**
   * Applies a batch.
   *
   * @param batch The batch.
   * @throws SinkException if the batch was not applied.
   */
  void apply(Batch batch) throws SinkException;
}
