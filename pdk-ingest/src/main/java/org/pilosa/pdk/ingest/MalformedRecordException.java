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

package org.pilosa.pdk.ingest;

import java.io.IOException;

/**
 * Thrown when a frame or a record within it cannot be decoded, or when a record lacks what is
 * needed to identify its column. The record is dropped and counted.
 */
public class MalformedRecordException extends IOException {
  /**
   * Creates a new exception.
   *
   * @param message Why the record is malformed.
   */
  public MalformedRecordException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Why the record is malformed.
   * @param cause The decoding failure.
   */
  public MalformedRecordException(String message, Throwable cause) {
    super(message, cause);
  }
}
