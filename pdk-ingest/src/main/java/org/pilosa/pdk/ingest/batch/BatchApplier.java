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

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.Cancellation;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.RetryPolicy;
import org.pilosa.pdk.ingest.sink.BatchSink;
import org.pilosa.pdk.ingest.sink.SinkException;

/**
 * Applies batches to a sink from a small pool of threads, retrying failed attempts with
 * exponential backoff. A batch that keeps failing, or fails in a way that cannot be retried, is
 * dead-lettered: its mutations are logged on the <code>deadletter</code> logger and never
 * applied.
 *
 * <p>Once the run is cancelled, a failing batch is not retried past its next attempt.</p>
 */
public final class BatchApplier implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(BatchApplier.class);
  private static final Logger DEADLETTER_LOG =
      LoggerFactory.getLogger("deadletter." + BatchApplier.class.getName());

  private final BatchSink mSink;
  private final RetryPolicy mRetryPolicy;
  private final IngestMetrics mMetrics;
  private final Cancellation mCancellation;
  private final ExecutorService mExecutor;

  /**
   * Builds an applier.
   *
   * @param sink The sink to apply batches to.
   * @param retryPolicy Retry policy of failed attempts.
   * @param sinkConcurrency Number of threads applying batches.
   * @param metrics Run counters.
   * @param cancellation Token of the run.
   */
  private BatchApplier(
      BatchSink sink,
      RetryPolicy retryPolicy,
      int sinkConcurrency,
      IngestMetrics metrics,
      Cancellation cancellation) {
    Preconditions.checkArgument(sinkConcurrency > 0,
        "Sink concurrency must be positive, got %s.", sinkConcurrency);
    mSink = Preconditions.checkNotNull(sink);
    mRetryPolicy = Preconditions.checkNotNull(retryPolicy);
    mMetrics = Preconditions.checkNotNull(metrics);
    mCancellation = Preconditions.checkNotNull(cancellation);
    mExecutor = Executors.newFixedThreadPool(sinkConcurrency,
        new ThreadFactoryBuilder()
            .setNameFormat("pdk-sink-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Creates an applier.
   *
   * @param sink The sink to apply batches to.
   * @param retryPolicy Retry policy of failed attempts.
   * @param sinkConcurrency Number of threads applying batches.
   * @param metrics Run counters.
   * @param cancellation Token of the run.
   * @return the applier.
   */
  public static BatchApplier create(
      BatchSink sink,
      RetryPolicy retryPolicy,
      int sinkConcurrency,
      IngestMetrics metrics,
      Cancellation cancellation) {
    return new BatchApplier(sink, retryPolicy, sinkConcurrency, metrics, cancellation);
  }

  /**
   * Schedules a batch.
   *
   * @param batch The batch.
   * @return resolves to true once applied, to false once dead-lettered.
   */
  public Future<Boolean> submit(final Batch batch) {
    return mExecutor.submit(new Callable<Boolean>() {
      /** {@inheritDoc} */
      @Override
      public Boolean call() {
        return apply(batch);
      }
    });
  }

  /**
   * Applies a batch in the calling thread.
   *
   * @param batch The batch.
   * @return true if applied, false if dead-lettered.
   */
  boolean apply(Batch batch) {
    int retries = 0;
    while (true) {
      try {
        mSink.apply(batch);
        mMetrics.increment(IngestCounter.BATCHES_APPLIED);
        LOG.debug("Applied {}.", batch);
        return true;
      } catch (SinkException se) {
        if (!se.isRetryable()) {
          deadLetter(batch, "not retryable: " + se.getMessage());
          return false;
        }
        if (mCancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
          deadLetter(batch, "run cancelled: " + se.getMessage());
          return false;
        }
        if (!mRetryPolicy.canRetry(retries)) {
          deadLetter(batch, "retries exhausted: " + se.getMessage());
          return false;
        }
        mMetrics.increment(IngestCounter.BATCHES_RETRIED);
        LOG.warn("Applying {} failed ({}), retry {} of {}.",
            batch, se.getMessage(), retries + 1, mRetryPolicy.getMaxRetries());
        try {
          // Returns at once when cancelled; the next attempt is then the last.
          mRetryPolicy.backoff(retries, mCancellation);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          deadLetter(batch, "interrupted: " + se.getMessage());
          return false;
        }
        retries++;
      } catch (RuntimeException re) {
        LOG.error("Sink failed unexpectedly on {}.", batch, re);
        deadLetter(batch, re.toString());
        return false;
      }
    }
  }

  /**
   * Gives up on a batch.
   *
   * @param batch The batch.
   * @param reason Why.
   */
  private void deadLetter(Batch batch, String reason) {
    mMetrics.increment(IngestCounter.BATCHES_DEAD_LETTERED);
    DEADLETTER_LOG.error("Dead-lettered {}: {}", batch, reason);
    for (Mutation mutation : batch.getMutations()) {
      DEADLETTER_LOG.info("  {}", mutation);
    }
  }

  /** Interrupts the sink threads. */
  @Override
  public void close() {
    mExecutor.shutdownNow();
  }
}
