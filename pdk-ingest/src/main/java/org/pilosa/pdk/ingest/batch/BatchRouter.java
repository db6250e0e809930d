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

import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.Mutation;

/**
 * Routes mutations to one batcher per target field, starting each batcher on the first
 * mutation of its field.
 */
public final class BatchRouter {
  private static final Logger LOG = LoggerFactory.getLogger(BatchRouter.class);

  private final int mBatchSize;
  private final long mFlushIntervalMillis;
  private final BatchApplier mApplier;
  private final ConcurrentMap<String, FieldBatcher> mBatchers = Maps.newConcurrentMap();
  private final ExecutorService mExecutor;
  private final Set<String> mFinished = Sets.newHashSet();
  private volatile boolean mClosed = false;

  /**
   * Builds a router.
   *
   * @param batchSize Flush threshold of every batcher.
   * @param flushIntervalMillis Flush interval of every batcher.
   * @param applier Applies flushed batches.
   */
  private BatchRouter(int batchSize, long flushIntervalMillis, BatchApplier applier) {
    Preconditions.checkArgument(batchSize > 0, "Batch size must be positive, got %s.", batchSize);
    Preconditions.checkArgument(flushIntervalMillis > 0,
        "Flush interval must be positive, got %s.", flushIntervalMillis);
    mBatchSize = batchSize;
    mFlushIntervalMillis = flushIntervalMillis;
    mApplier = Preconditions.checkNotNull(applier);
    mExecutor = Executors.newCachedThreadPool(
        new ThreadFactoryBuilder()
            .setNameFormat("pdk-batch-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Creates a router.
   *
   * @param batchSize Flush threshold of every batcher.
   * @param flushIntervalMillis Flush interval of every batcher.
   * @param applier Applies flushed batches.
   * @return the router.
   */
  public static BatchRouter create(int batchSize, long flushIntervalMillis, BatchApplier applier) {
    return new BatchRouter(batchSize, flushIntervalMillis, applier);
  }

  /**
   * Hands a mutation to the batcher of its field. Blocks while that batcher is full.
   *
   * @param mutation The mutation.
   * @param tracker The tracker of the frame it came from.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public void route(Mutation mutation, FrameTracker tracker) throws InterruptedException {
    Preconditions.checkState(!mClosed, "Router is closed.");
    tracker.add();
    try {
      batcherOf(mutation.getFieldName()).put(mutation, tracker);
    } catch (InterruptedException ie) {
      tracker.fail();
      throw ie;
    }
  }

  /**
   * Gets the batcher of a field, starting it if needed.
   *
   * @param fieldName The field.
   * @return its batcher.
   */
  private FieldBatcher batcherOf(String fieldName) {
    final FieldBatcher batcher = mBatchers.get(fieldName);
    if (null != batcher) {
      return batcher;
    }
    final FieldBatcher created =
        new FieldBatcher(fieldName, mBatchSize, mFlushIntervalMillis, mApplier);
    final FieldBatcher existing = mBatchers.putIfAbsent(fieldName, created);
    if (null != existing) {
      return existing;
    }
    LOG.debug("Starting batcher of field {}.", fieldName);
    mExecutor.execute(created);
    return created;
  }

  /**
   * Asks every batcher to flush what it holds and stop. No mutation may be routed afterwards.
   * May be called again until it returns true.
   *
   * @param timeout How long to wait for room in the batcher queues.
   * @param unit Unit of the timeout.
   * @return true once every batcher was asked.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean finish(long timeout, TimeUnit unit) throws InterruptedException {
    mClosed = true;
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    for (FieldBatcher batcher : mBatchers.values()) {
      if (mFinished.contains(batcher.getFieldName())) {
        continue;
      }
      if (!batcher.finish(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
        LOG.debug("Batcher of field {} is still busy.", batcher.getFieldName());
        return false;
      }
      mFinished.add(batcher.getFieldName());
    }
    mExecutor.shutdown();
    return true;
  }

  /**
   * Waits for the batchers to stop after {@link #finish}.
   *
   * @param timeout How long to wait at most.
   * @param unit Unit of the timeout.
   * @return true if every batcher stopped.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return mExecutor.awaitTermination(timeout, unit);
  }

  /** Interrupts every batcher; their pending frames fail. */
  public void forceStop() {
    mExecutor.shutdownNow();
  }

  /** @return the number of batchers started. */
  public int getBatcherCount() {
    return mBatchers.size();
  }
}
