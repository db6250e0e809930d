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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Summary of a finished run.
 */
public final class IngestResult {
  private final ExitStatus mStatus;
  private final ImmutableMap<IngestCounter, Long> mCounters;
  private final boolean mCancelled;

  /**
   * Builds a result.
   *
   * @param status Exit status.
   * @param counters Counter values at the end of the run.
   * @param cancelled Whether the run was cancelled.
   */
  private IngestResult(
      ExitStatus status,
      ImmutableMap<IngestCounter, Long> counters,
      boolean cancelled) {
    mStatus = Preconditions.checkNotNull(status);
    mCounters = Preconditions.checkNotNull(counters);
    mCancelled = cancelled;
  }

  /**
   * Creates a result.
   *
   * @param status Exit status.
   * @param counters Counter values at the end of the run.
   * @param cancelled Whether the run was cancelled.
   * @return the result.
   */
  public static IngestResult create(
      ExitStatus status,
      ImmutableMap<IngestCounter, Long> counters,
      boolean cancelled) {
    return new IngestResult(status, counters, cancelled);
  }

  /**
   * Creates the result of a run rejected before starting.
   *
   * @param status Exit status.
   * @return the result.
   */
  public static IngestResult failedBeforeStart(ExitStatus status) {
    return new IngestResult(status, ImmutableMap.<IngestCounter, Long>of(), false);
  }

  /** @return the exit status. */
  public ExitStatus getStatus() {
    return mStatus;
  }

  /** @return whether the run was cancelled. */
  public boolean isCancelled() {
    return mCancelled;
  }

  /** @return every counter value at the end of the run. */
  public ImmutableMap<IngestCounter, Long> getCounters() {
    return mCounters;
  }

  /**
   * Reads a counter.
   *
   * @param counter The counter.
   * @return its value at the end of the run, 0 if the run never started.
   */
  public long getCount(IngestCounter counter) {
    final Long count = mCounters.get(counter);
    return null == count ? 0L : count;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("status", mStatus)
        .add("cancelled", mCancelled)
        .add("counters", mCounters)
        .toString();
  }
}
