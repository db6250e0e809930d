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

import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Tracks the offsets of one partition that were handed out but not acknowledged yet, and
 * computes the offset that is safe to commit: every offset below it was acknowledged.
 *
 * <p>Thread-safe.</p>
 */
final class OffsetTracker {
  /** Offsets handed out and not acknowledged. */
  private final NavigableSet<Long> mOutstanding = new TreeSet<Long>();

  /** Highest offset ever handed out, or -1. */
  private long mHighest = -1L;

  /** Last committed offset, or -1. */
  private long mLastCommitted = -1L;

  /**
   * Records an offset handed out to the pipeline. An offset at or below the highest one seen is
   * a redelivery after a seek or a rebalance, and is outstanding again until acknowledged.
   *
   * @param offset Offset of the message.
   */
  synchronized void register(long offset) {
    mOutstanding.add(offset);
    mHighest = Math.max(mHighest, offset);
  }

  /**
   * Records an offset whose message is fully applied.
   *
   * @param offset Offset of the message.
   */
  synchronized void acknowledge(long offset) {
    mOutstanding.remove(offset);
  }

  /**
   * Computes the offset to commit, that is the next offset to consume after a restart.
   *
   * @return the offset, or -1 if nothing new can be committed.
   */
  synchronized long committable() {
    final long next = mOutstanding.isEmpty() ? mHighest + 1 : mOutstanding.first();
    return (next > mLastCommitted && next > 0) ? next : -1L;
  }

  /**
   * Records a successful commit.
   *
   * @param offset The committed offset.
   */
  synchronized void committed(long offset) {
    mLastCommitted = Math.max(mLastCommitted, offset);
  }

  /** @return the last committed offset, or -1. */
  synchronized long getLastCommitted() {
    return mLastCommitted;
  }

  /** @return the number of outstanding offsets. */
  synchronized int getOutstandingCount() {
    return mOutstanding.size();
  }
}
