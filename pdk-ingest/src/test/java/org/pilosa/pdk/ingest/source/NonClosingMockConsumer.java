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

import java.time.Duration;

import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;

/** A mock consumer that stays readable after close, so that commits can be checked. */
public final class NonClosingMockConsumer extends MockConsumer<byte[], byte[]> {
  private volatile boolean mCloseCalled = false;

  /** Creates a consumer resetting to the earliest offset. */
  public NonClosingMockConsumer() {
    super(OffsetResetStrategy.EARLIEST);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void close() {
    mCloseCalled = true;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void close(Duration timeout) {
    mCloseCalled = true;
  }

  /** @return whether close was called. */
  public boolean isCloseCalled() {
    return mCloseCalled;
  }
}
