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

/** Outcome of a run, as reported to the operating system. */
public enum ExitStatus {
  /** Every stage drained. */
  OK(0),
  /** Invalid or conflicting configuration; no worker was started. */
  CONFIG_ERROR(2),
  /** At least one batch was dead-lettered by the sink. */
  SINK_FAILURE(3),
  /** At least one frame referenced a schema that could not be resolved. */
  SCHEMA_ERROR(4),
  /** The locator list could not be read. */
  FETCH_FAILURE(5);

  private final int mCode;

  /**
   * Binds a process exit code.
   *
   * @param code The exit code.
   */
  ExitStatus(int code) {
    mCode = code;
  }

  /** @return the process exit code. */
  public int getCode() {
    return mCode;
  }
}
