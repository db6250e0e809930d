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

import org.pilosa.pdk.ingest.source.Frame;

/**
 * Turns a frame of raw bytes into records.
 */
public interface Decoder {
  /**
   * Starts decoding a frame.
   *
   * @param frame The frame.
   * @return a reader over the records of the frame.
   * @throws org.pilosa.pdk.ingest.MalformedRecordException if the frame as a whole is malformed.
   * @throws SchemaResolutionException if the schema of the frame cannot be resolved.
   * @throws IOException if the body cannot be read.
   */
  RecordReader decode(Frame frame) throws IOException;
}
