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

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;

/**
 * Bounded exponential backoff: attempt <i>n</i> (counting retries from 0) waits
 * <code>min(max, base * 2^n)</code> milliseconds.
 */
public final class RetryPolicy {
  private final int mMaxRetries;
  private final long mBaseBackoffMillis;
  private final long mMaxBackoffMillis;

  /**
   * Builds a policy.
   *
   * @param maxRetries Retries allowed after the first attempt.
   * @param baseBackoffMillis Wait before the first retry.
   * @param maxBackoffMillis Upper bound on any wait.
   */
  private RetryPolicy(int maxRetries, long baseBackoffMillis, long maxBackoffMillis) {
    Preconditions.checkArgument(maxRetries >= 0, "Negative retry count: %s", maxRetries);
    Preconditions.checkArgument(baseBackoffMillis >= 0, "Negative backoff: %s", baseBackoffMillis);
    Preconditions.checkArgument(maxBackoffMillis >= baseBackoffMillis,
        "Maximum backoff %s is below the base backoff %s.", maxBackoffMillis, baseBackoffMillis);
    mMaxRetries = maxRetries;
    mBaseBackoffMillis = baseBackoffMillis;
    mMaxBackoffMillis = maxBackoffMillis;
  }

  /**
   * Creates a policy.
   *
   * @param maxRetries Retries allowed after the first attempt.
   * @param baseBackoffMillis Wait before the first retry.
   * @param maxBackoffMillis Upper bound on any wait.
   * @return the policy.
   */
  public static RetryPolicy create(int maxRetries, long baseBackoffMillis, long maxBackoffMillis) {
    return new RetryPolicy(maxRetries, baseBackoffMillis, maxBackoffMillis);
  }

  /**
   * Creates the policy configured for a run.
   *
   * @param config The run configuration.
   * @return the policy.
   */
  public static RetryPolicy fromConfig(IngestConfig config) {
    return new RetryPolicy(
        config.getMaxRetries(), config.getRetryBackoffMillis(), config.getMaxBackoffMillis());
  }

  /** @return a policy that never retries. */
  public static RetryPolicy noRetries() {
    return new RetryPolicy(0, 0L, 0L);
  }

  /** @return the number of retries allowed after the first attempt. */
  public int getMaxRetries() {
    return mMaxRetries;
  }

  /**
   * Whether another attempt is allowed.
   *
   * @param retriesSoFar Retries already made.
   * @return true if another retry may be made.
   */
  public boolean canRetry(int retriesSoFar) {
    return retriesSoFar < mMaxRetries;
  }

  /**
   * Computes the wait before a retry.
   *
   * @param retry Index of the retry, starting at 0.
   * @return the wait in milliseconds.
   */
  public long getBackoffMillis(int retry) {
    if (retry >= 62 || mBaseBackoffMillis > (mMaxBackoffMillis >> retry)) {
      return mMaxBackoffMillis;
    }
    return Math.min(mMaxBackoffMillis, mBaseBackoffMillis << retry);
  }

  /**
   * Waits before a retry, returning early when the run is cancelled.
   *
   * @param retry Index of the retry, starting at 0.
   * @param cancellation Token of the run.
   * @return true if the run was cancelled while waiting.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean backoff(int retry, Cancellation cancellation) throws InterruptedException {
    return cancellation.await(getBackoffMillis(retry), TimeUnit.MILLISECONDS);
  }
}
