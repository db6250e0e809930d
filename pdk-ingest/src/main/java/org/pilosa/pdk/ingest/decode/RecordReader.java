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

import java.io.Closeable;
import java.io.IOException;

import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;

/**
 * Reads the records of one frame.
 */
public interface RecordReader extends Closeable {
  /** @return the descriptor of the records of this frame. */
  SchemaDescriptor getDescriptor();

  /**
   * Reads the next record.
   *
   * @return the record, or null after the last one.
   * @throws org.pilosa.pdk.ingest.MalformedRecordException if the next record is malformed; the
   *     reader moves past it and may be read again.
   * @throws IOException if the body cannot be read any further.
   */
  Record next() throws IOException;
}
