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

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * A lazy sequence of frames. Implementations are polled by a single thread; only
 * {@link #acknowledge(Frame)} may be called from other threads.
 */
public interface Source extends Closeable {
  /**
   * Waits for the next frame.
   *
   * @param timeout How long to wait at most.
   * @param unit Unit of the timeout.
   * @return the next frame, or null if none arrived in time.
   * @throws IOException if the source failed in a way that ends the run.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  Frame next(long timeout, TimeUnit unit) throws IOException, InterruptedException;

  /** @return true once no frame will ever be returned again. */
  boolean isExhausted();

  /**
   * Reports that every mutation derived from a frame was applied.
   *
   * @param frame A frame returned by {@link #next}.
   */
  void acknowledge(Frame frame);
}
