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

package org.pilosa.pdk.ingest.source;

import java.io.IOException;

/**
 * Thrown when the body behind a locator cannot be fetched.
 */
public final class FetchException extends IOException {
  private static final long serialVersionUID = 1L;

  private final boolean mTransient;

  /**
   * Creates a new <code>FetchException</code>.
   *
   * @param message Description of the failure.
   * @param isTransient Whether another attempt might succeed.
   */
  public FetchException(String message, boolean isTransient) {
    super(message);
    mTransient = isTransient;
  }

  /**
   * Creates a new <code>FetchException</code>.
   *
   * @param message Description of the failure.
   * @param isTransient Whether another attempt might succeed.
   * @param cause The underlying failure.
   */
  public FetchException(String message, boolean isTransient, Throwable cause) {
    super(message, cause);
    mTransient = isTransient;
  }

  /** @return whether another attempt might succeed. */
  public boolean isTransient() {
    return mTransient;
  }
}
