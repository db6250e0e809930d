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

import java.io.IOException;

/**
 * Thrown when a batch cannot be applied to the index.
 */
public final class SinkException extends IOException {
  private static final long serialVersionUID = 1L;

  private final boolean mRetryable;

  /**
   * Creates a new <code>SinkException</code>.
   *
   * @param message Description of the failure.
   * @param retryable Whether applying the same batch again might succeed.
   */
  public SinkException(String message, boolean retryable) {
    super(message);
    mRetryable = retryable;
  }

  /**
   * Creates a new <code>SinkException</code>.
   *
   * @param message Description of the failure.
   * @param retryable Whether applying the same batch again might succeed.
   * @param cause The underlying failure.
   */
  public SinkException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    mRetryable = retryable;
  }

  /** @return whether applying the same batch again might succeed. */
  public boolean isRetryable() {
    return mRetryable;
  }
}
