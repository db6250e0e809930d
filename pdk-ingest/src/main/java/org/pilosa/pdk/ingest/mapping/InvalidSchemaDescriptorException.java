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

import java.io.IOException;

/**
 * Thrown when a schema descriptor is invalid or inconsistent.
 */
public final class InvalidSchemaDescriptorException extends IOException {
  /**
   * Creates a new exception.
   *
   * @param message What is invalid.
   */
  public InvalidSchemaDescriptorException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message What is invalid.
   * @param cause Underlying parse error.
   */
  public InvalidSchemaDescriptorException(String message, Throwable cause) {
    super(message, cause);
  }
}
