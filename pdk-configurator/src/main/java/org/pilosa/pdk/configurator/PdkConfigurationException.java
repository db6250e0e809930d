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

package org.pilosa.pdk.configurator;

/**
 * Thrown when a {@link PdkConf} declaration cannot be honored: a missing key, a setter with the
 * wrong arity, or a variable of a type the configurator does not know how to populate.
 */
public class PdkConfigurationException extends RuntimeException {
  /**
   * Creates a new exception with a message.
   *
   * @param message A description of the misdeclaration.
   */
  public PdkConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates a new exception wrapping a reflection failure.
   *
   * @param cause The underlying cause.
   */
  public PdkConfigurationException(Throwable cause) {
    super(cause);
  }
}
