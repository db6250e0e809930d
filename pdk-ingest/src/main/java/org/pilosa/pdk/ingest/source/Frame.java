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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.apache.commons.io.IOUtils;

/**
 * One unit of raw input: the body behind a locator, or one message of a topic partition.
 *
 * <p>A body is either materialized, or an open stream that the decoder reads once. Whoever
 * consumes a frame must {@link #release()} it when done, which closes an open stream and lets
 * the fetcher that produced it move on.</p>
 */
public final class Frame {
  private final String mLocator;
  private final byte[] mBytes;
  private final InputStream mStream;
  private final String mTopic;
  private final int mPartition;
  private final long mOffset;
  private final byte[] mKey;
  private final CountDownLatch mReleased = new CountDownLatch(1);
  private boolean mStreamOpened = false;

  /**
   * Builds a frame.
   *
   * @param locator Where the frame comes from.
   * @param bytes Materialized body, or null.
   * @param stream Open body, or null.
   * @param topic Topic of a message, or null.
   * @param partition Partition of a message.
   * @param offset Offset of a message.
   * @param key Key of a message, or null.
   */
  private Frame(
      String locator,
      byte[] bytes,
      InputStream stream,
      String topic,
      int partition,
      long offset,
      byte[] key) {
    mLocator = Preconditions.checkNotNull(locator);
    Preconditions.checkArgument((null == bytes) != (null == stream),
        "A frame has either bytes or a stream.");
    mBytes = bytes;
    mStream = stream;
    mTopic = topic;
    mPartition = partition;
    mOffset = offset;
    mKey = key;
  }

  /**
   * Creates a materialized frame.
   *
   * @param locator Where the body comes from.
   * @param bytes The body.
   * @return the frame.
   */
  public static Frame ofBytes(String locator, byte[] bytes) {
    return new Frame(locator, Preconditions.checkNotNull(bytes), null, null, -1, -1L, null);
  }

  /**
   * Creates a streaming frame.
   *
   * @param locator Where the body comes from.
   * @param stream The open body; closed on release.
   * @return the frame.
   */
  public static Frame ofStream(String locator, InputStream stream) {
    return new Frame(locator, null, Preconditions.checkNotNull(stream), null, -1, -1L, null);
  }

  /**
   * Creates the frame of a topic message.
   *
   * @param topic Topic.
   * @param partition Partition.
   * @param offset Offset of the message within its partition.
   * @param key Message key, may be null.
   * @param payload Message value.
   * @return the frame.
   */
  public static Frame ofMessage(
      String topic,
      int partition,
      long offset,
      byte[] key,
      byte[] payload) {
    Preconditions.checkNotNull(topic);
    return new Frame(topic + "-" + partition + "@" + offset,
        null == payload ? new byte[0] : payload, null, topic, partition, offset, key);
  }

  /** @return where this frame comes from. */
  public String getLocator() {
    return mLocator;
  }

  /** @return whether the body is in memory. */
  public boolean isMaterialized() {
    return null != mBytes;
  }

  /**
   * Opens the body. A streaming body can be opened only once.
   *
   * @return the body.
   */
  public synchronized InputStream openStream() {
    if (null != mBytes) {
      return new ByteArrayInputStream(mBytes);
    }
    Preconditions.checkState(!mStreamOpened, "The body of %s was already opened.", mLocator);
    mStreamOpened = true;
    return mStream;
  }

  /**
   * Reads the whole body.
   *
   * @return the body.
   * @throws IOException if a streaming body fails mid-way.
   */
  public byte[] getBytes() throws IOException {
    if (null != mBytes) {
      return mBytes;
    }
    return IOUtils.toByteArray(openStream());
  }

  /** @return whether this frame is a topic message. */
  public boolean isMessage() {
    return null != mTopic;
  }

  /** @return topic of a message. */
  public String getTopic() {
    Preconditions.checkState(isMessage(), "%s is not a message.", mLocator);
    return mTopic;
  }

  /** @return partition of a message. */
  public int getPartition() {
    Preconditions.checkState(isMessage(), "%s is not a message.", mLocator);
    return mPartition;
  }

  /** @return offset of a message. */
  public long getOffset() {
    Preconditions.checkState(isMessage(), "%s is not a message.", mLocator);
    return mOffset;
  }

  /** @return key of a message, or null. */
  public byte[] getKey() {
    return mKey;
  }

  /**
   * Hash of the partition of a message, used to route every message of a partition to the same
   * worker.
   *
   * @return the hash, or null for frames that are not messages.
   */
  public Integer getPartitionHash() {
    if (!isMessage()) {
      return null;
    }
    return Objects.hashCode(mTopic, mPartition);
  }

  /** Marks this frame consumed and closes a streaming body. Idempotent. */
  public void release() {
    if (null != mStream) {
      IOUtils.closeQuietly(mStream);
    }
    mReleased.countDown();
  }

  /**
   * Waits for this frame to be released.
   *
   * @param timeout How long to wait at most.
   * @param unit Unit of the timeout.
   * @return true if released.
   * @throws InterruptedException if the calling thread is interrupted.
   */
  public boolean awaitRelease(long timeout, TimeUnit unit) throws InterruptedException {
    return mReleased.await(timeout, unit);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return mLocator;
  }
}
