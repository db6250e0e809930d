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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A token shared by every stage of a run. Once cancelled it stays cancelled.
 */
public final class Cancellation {
  private final CountDownLatch mCancelled = new CountDownLatch(1);

  /** Cancels the run. Idempotent. */
  public void cancel() {
    mCancelled.countDown();
  }

  /** @return whether the run was cancelled. */
  public boolean isCancelled() {
    return mCancelled.getCount() == 0;
  }

  /**
   * Sleeps unless cancelled.
   *
   * @param timeout How long to sleep at most.
   * @param unit Unit of the timeout.
   * @return true if the run was cancelled before the timeout elapsed.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return mCancelled.await(timeout, unit);
  }
}
