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

package org.pilosa.pdk.ingest.batch;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;

import org.pilosa.pdk.ingest.source.Frame;
import org.pilosa.pdk.ingest.source.Source;

/**
 * Counts the mutations of a frame that are not applied yet, and acknowledges the frame to its
 * source once decoding is over and every mutation was applied. A failed frame is never
 * acknowledged.
 *
 * <p>The count starts at one for the decoding itself, which {@link #finishDecoding()}
 * releases.</p>
 */
public final class FrameTracker {
  private final Frame mFrame;
  private final Source mSource;
  private final AtomicInteger mPending = new AtomicInteger(1);
  private final AtomicBoolean mFailed = new AtomicBoolean(false);
  private final AtomicBoolean mAcknowledged = new AtomicBoolean(false);

  /**
   * Builds a tracker.
   *
   * @param frame The frame.
   * @param source The source to acknowledge the frame to.
   */
  private FrameTracker(Frame frame, Source source) {
    mFrame = Preconditions.checkNotNull(frame);
    mSource = Preconditions.checkNotNull(source);
  }

  /**
   * Creates a tracker.
   *
   * @param frame The frame.
   * @param source The source to acknowledge the frame to.
   * @return the tracker.
   */
  public static FrameTracker create(Frame frame, Source source) {
    return new FrameTracker(frame, source);
  }

  /** Counts one more mutation in flight. */
  public void add() {
    Preconditions.checkState(mPending.getAndIncrement() > 0,
        "Frame %s already settled.", mFrame);
  }

  /** Counts one mutation applied. */
  public void mutationApplied() {
    release();
  }

  /** Marks the frame failed: it will never be acknowledged. */
  public void fail() {
    mFailed.set(true);
  }

  /** Marks the end of decoding: no more mutations will be added. */
  public void finishDecoding() {
    release();
  }

  /** Drops one pending count, acknowledging the frame when none is left. */
  private void release() {
    final int pending = mPending.decrementAndGet();
    Preconditions.checkState(pending >= 0, "Frame %s released too often.", mFrame);
    if (0 == pending && !mFailed.get() && mAcknowledged.compareAndSet(false, true)) {
      mSource.acknowledge(mFrame);
    }
  }

  /** @return the tracked frame. */
  public Frame getFrame() {
    return mFrame;
  }

  /** @return whether the frame failed. */
  public boolean isFailed() {
    return mFailed.get();
  }

  /** @return whether the frame was acknowledged. */
  public boolean isAcknowledged() {
    return mAcknowledged.get();
  }
}
