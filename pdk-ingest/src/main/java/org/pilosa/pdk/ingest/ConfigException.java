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
 * Thrown when the options of a run are invalid or conflict. Raised before any worker starts.
 */
public class ConfigException extends IOException {
  /**
   * Creates a new exception.
   *
   * @param message Which option is wrong and why.
   */
  public ConfigException(String message) {
    super(message);
  }

  /**
   * Creates a new exception.
   *
   * @param message Which option is wrong and why.
   * @param cause What went wrong reading it.
   */
  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
