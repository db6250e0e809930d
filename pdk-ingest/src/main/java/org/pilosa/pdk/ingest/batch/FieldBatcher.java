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

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.Mutation;

/**
 * Coalesces the mutations of one field into batches. A batch is flushed when it reaches the
 * batch size, when the oldest pending mutation waited for the flush interval, when an
 * incompatible mutation arrives, and when the batcher is closed.
 *
 * <p>The batcher waits for each flushed batch to be applied before it takes more mutations, so
 * a slow sink fills the queue and blocks the mappers.</p>
 */
final class FieldBatcher implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(FieldBatcher.class);

  /** Marks the end of the input. */
  private static final Entry END = new Entry(null, null);

  /** A mutation with the frame it came from. */
  static final class Entry {
    private final Mutation mMutation;
    private final FrameTracker mTracker;

    /**
     * @param mutation The mutation.
     * @param tracker The tracker of its frame.
     */
    Entry(Mutation mutation, FrameTracker tracker) {
      mMutation = mutation;
      mTracker = tracker;
    }
  }

  private final String mFieldName;
  private final int mBatchSize;
  private final long mFlushIntervalMillis;
  private final BatchApplier mApplier;
  private final BlockingQueue<Entry> mQueue;

  private final List<Entry> mPending = Lists.newArrayList();
  private long mFlushDeadline = 0L;

  /**
   * Builds a batcher.
   *
   * @param fieldName Name of the field.
   * @param batchSize Flush threshold.
   * @param flushIntervalMillis Longest time a mutation waits for its batch to fill.
   * @param applier Applies flushed batches.
   */
  FieldBatcher(String fieldName, int batchSize, long flushIntervalMillis, BatchApplier applier) {
    mFieldName = fieldName;
    mBatchSize = batchSize;
    mFlushIntervalMillis = flushIntervalMillis;
    mApplier = applier;
    mQueue = new ArrayBlockingQueue<>(Math.max(16, 2 * batchSize));
  }

  /**
   * Queues a mutation, blocking while the queue is full.
   *
   * @param mutation The mutation.
   * @param tracker The tracker of its frame.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  void put(Mutation mutation, FrameTracker tracker) throws InterruptedException {
    mQueue.put(new Entry(mutation, tracker));
  }

  /**
   * Asks the batcher to flush what it holds and stop.
   *
   * @param timeout How long to wait for room in the queue.
   * @param unit Unit of the timeout.
   * @return false if the queue stayed full.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  boolean finish(long timeout, TimeUnit unit) throws InterruptedException {
    return mQueue.offer(END, timeout, unit);
  }

  /** {@inheritDoc} */
  @Override
  public void run() {
    try {
      while (true) {
        final Entry entry;
        if (mPending.isEmpty()) {
          entry = mQueue.take();
        } else {
          final long wait = mFlushDeadline - System.currentTimeMillis();
          entry = wait > 0 ? mQueue.poll(wait, TimeUnit.MILLISECONDS) : null;
        }

        if (null == entry) {
          flush();
          continue;
        }
        if (END == entry) {
          flush();
          break;
        }
        if (!mPending.isEmpty()
            && !Batch.compatible(mPending.get(0).mMutation, entry.mMutation)) {
          flush();
        }
        if (mPending.isEmpty()) {
          mFlushDeadline = System.currentTimeMillis() + mFlushIntervalMillis;
        }
        mPending.add(entry);
        if (mPending.size() >= mBatchSize) {
          flush();
        }
      }
    } catch (InterruptedException ie) {
      Thread.interrupted();
      LOG.warn("Batcher of field {} interrupted with {} pending mutations.",
          mFieldName, mPending.size());
      failPending();
    }
  }

  /**
   * Applies the pending mutations and settles their frames.
   *
   * @throws InterruptedException if interrupted while the batch is applied.
   */
  private void flush() throws InterruptedException {
    if (mPending.isEmpty()) {
      return;
    }
    final List<Mutation> mutations = Lists.newArrayListWithCapacity(mPending.size());
    for (Entry entry : mPending) {
      mutations.add(entry.mMutation);
    }
    final Future<Boolean> outcome = mApplier.submit(Batch.create(mutations));
    boolean applied;
    try {
      applied = outcome.get();
    } catch (ExecutionException ee) {
      LOG.error("Applying a batch of field {} failed.", mFieldName, ee.getCause());
      applied = false;
    } catch (InterruptedException ie) {
      outcome.cancel(true);
      throw ie;
    }
    for (Entry entry : mPending) {
      if (applied) {
        entry.mTracker.mutationApplied();
      } else {
        entry.mTracker.fail();
      }
    }
    mPending.clear();
  }

  /** Fails the frames of the pending and queued mutations. */
  private void failPending() {
    final List<Entry> queued = Lists.newArrayList();
    mQueue.drainTo(queued);
    mPending.addAll(queued);
    for (Entry entry : mPending) {
      if (END != entry) {
        entry.mTracker.fail();
      }
    }
    mPending.clear();
  }

  /** @return the name of the field. */
  String getFieldName() {
    return mFieldName;
  }
}
