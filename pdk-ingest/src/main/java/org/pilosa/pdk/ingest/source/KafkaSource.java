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

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;

/**
 * Consumes topics of a message bus as a member of a consumer group. Each message becomes one
 * frame.
 *
 * <p>Offsets are committed by hand, and only up to the lowest message of each partition that
 * was handed out but not acknowledged yet: a message is committed only once it and every
 * message before it are fully applied. Messages of failed frames are never acknowledged, so
 * they are consumed again by the next session.</p>
 *
 * <p>The consumer is used only from the thread calling {@link #next} and {@link #close()};
 * acknowledgements from other threads are queued in per-partition trackers and committed on the
 * next poll.</p>
 *
 * <p>When the group takes a partition away, its acknowledged prefix is committed and its
 * tracker and buffered messages are dropped. A partition assigned again restarts from its last
 * committed offset with a fresh tracker, so messages that were in flight are delivered again.</p>
 */
public final class KafkaSource implements Source {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaSource.class);

  private final Consumer<byte[], byte[]> mConsumer;
  private final ImmutableList<String> mTopics;
  private final IngestMetrics mMetrics;

  /** Polled messages not handed out yet. */
  private final Deque<ConsumerRecord<byte[], byte[]>> mBuffer =
      new ArrayDeque<ConsumerRecord<byte[], byte[]>>();

  private final ConcurrentMap<TopicPartition, OffsetTracker> mTrackers = Maps.newConcurrentMap();

  private final ConsumerRebalanceListener mRebalanceListener = new RebalanceHandler();

  /**
   * Builds a source and subscribes the consumer to the topics.
   *
   * @param consumer The consumer, owned by this source from now on.
   * @param topics Topics to consume.
   * @param metrics Run counters.
   */
  private KafkaSource(
      Consumer<byte[], byte[]> consumer,
      List<String> topics,
      IngestMetrics metrics) {
    Preconditions.checkArgument(!topics.isEmpty(), "No topics to consume.");
    mConsumer = Preconditions.checkNotNull(consumer);
    mTopics = ImmutableList.copyOf(topics);
    mMetrics = Preconditions.checkNotNull(metrics);
    mConsumer.subscribe(mTopics, mRebalanceListener);
  }

  /**
   * Creates a source over an existing consumer. The consumer must not commit automatically.
   *
   * @param consumer The consumer, owned by this source from now on.
   * @param topics Topics to consume.
   * @param metrics Run counters.
   * @return the source.
   */
  public static KafkaSource create(
      Consumer<byte[], byte[]> consumer,
      List<String> topics,
      IngestMetrics metrics) {
    return new KafkaSource(consumer, topics, metrics);
  }

  /**
   * Creates the source of a run configured with topics.
   *
   * @param config The run configuration, with <code>topics</code> set.
   * @param metrics Run counters.
   * @return the source.
   */
  public static KafkaSource fromConfig(IngestConfig config, IngestMetrics metrics) {
    return new KafkaSource(
        new KafkaConsumer<byte[], byte[]>(consumerProperties(config)),
        config.getTopics(),
        metrics);
  }

  /**
   * Builds the consumer settings of a run.
   *
   * @param config The run configuration.
   * @return the consumer properties.
   */
  static Properties consumerProperties(IngestConfig config) {
    final Properties props = new Properties();
    props.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        Joiner.on(',').join(config.getKafkaHosts()));
    props.setProperty(ConsumerConfig.GROUP_ID_CONFIG, config.getGroup());
    props.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.setProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        ByteArrayDeserializer.class.getName());
    props.setProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        ByteArrayDeserializer.class.getName());
    return props;
  }

  /** {@inheritDoc} */
  @Override
  public Frame next(long timeout, TimeUnit unit) throws IOException {
    commitAcknowledged();
    if (mBuffer.isEmpty()) {
      final ConsumerRecords<byte[], byte[]> records;
      try {
        records = mConsumer.poll(Duration.ofMillis(unit.toMillis(timeout)));
      } catch (KafkaException ke) {
        throw new IOException("Polling " + mTopics + " failed.", ke);
      }
      for (ConsumerRecord<byte[], byte[]> record : records) {
        trackerOf(new TopicPartition(record.topic(), record.partition()))
            .register(record.offset());
        mBuffer.addLast(record);
      }
    }
    final ConsumerRecord<byte[], byte[]> record = mBuffer.pollFirst();
    if (null == record) {
      return null;
    }
    return Frame.ofMessage(
        record.topic(), record.partition(), record.offset(), record.key(), record.value());
  }

  /**
   * A bus is never exhausted; the run ends on cancellation or message cap.
   *
   * @return false.
   */
  @Override
  public boolean isExhausted() {
    return false;
  }

  /**
   * Acknowledges a message. A message of a partition this source no longer owns is ignored: the
   * partition's new owner consumes it again from the last commit.
   *
   * @param frame The applied message frame.
   */
  @Override
  public void acknowledge(Frame frame) {
    Preconditions.checkArgument(frame.isMessage(), "%s is not a message.", frame);
    final OffsetTracker tracker =
        mTrackers.get(new TopicPartition(frame.getTopic(), frame.getPartition()));
    if (null != tracker) {
      tracker.acknowledge(frame.getOffset());
    }
  }

  /** @return the listener this source subscribed with. */
  ConsumerRebalanceListener getRebalanceListener() {
    return mRebalanceListener;
  }

  /**
   * Gets the tracker of a partition, creating it if needed.
   *
   * @param partition The partition.
   * @return its tracker.
   */
  private OffsetTracker trackerOf(TopicPartition partition) {
    final OffsetTracker tracker = mTrackers.get(partition);
    if (null != tracker) {
      return tracker;
    }
    final OffsetTracker created = new OffsetTracker();
    final OffsetTracker existing = mTrackers.putIfAbsent(partition, created);
    return null == existing ? created : existing;
  }

  /**
   * Commits every partition whose safe offset moved forward.
   *
   * @throws IOException if the commit fails.
   */
  private void commitAcknowledged() throws IOException {
    try {
      commit(mTrackers.keySet());
    } catch (KafkaException ke) {
      throw new IOException("Committing offsets of " + mTrackers.keySet() + " failed.", ke);
    }
  }

  /**
   * Commits the partitions among the given ones whose safe offset moved forward.
   *
   * @param partitions Partitions to consider.
   */
  private void commit(Collection<TopicPartition> partitions) {
    final Map<TopicPartition, OffsetAndMetadata> offsets = Maps.newHashMap();
    for (TopicPartition partition : partitions) {
      final OffsetTracker tracker = mTrackers.get(partition);
      final long offset = null == tracker ? -1L : tracker.committable();
      if (offset >= 0) {
        offsets.put(partition, new OffsetAndMetadata(offset));
      }
    }
    if (offsets.isEmpty()) {
      return;
    }
    mConsumer.commitSync(offsets);
    for (Map.Entry<TopicPartition, OffsetAndMetadata> entry : offsets.entrySet()) {
      mTrackers.get(entry.getKey()).committed(entry.getValue().offset());
      mMetrics.increment(IngestCounter.OFFSETS_COMMITTED);
    }
    LOG.debug("Committed offsets {}.", offsets);
  }

  /**
   * Forgets partitions: their trackers and their messages not handed out yet.
   *
   * @param partitions Partitions to forget.
   */
  private void drop(Collection<TopicPartition> partitions) {
    for (TopicPartition partition : partitions) {
      final OffsetTracker tracker = mTrackers.remove(partition);
      if (null != tracker && tracker.getOutstandingCount() > 0) {
        LOG.info("Partition {} moved away with {} unacknowledged messages.",
            partition, tracker.getOutstandingCount());
      }
    }
    final Iterator<ConsumerRecord<byte[], byte[]>> it = mBuffer.iterator();
    while (it.hasNext()) {
      final ConsumerRecord<byte[], byte[]> record = it.next();
      if (partitions.contains(new TopicPartition(record.topic(), record.partition()))) {
        it.remove();
      }
    }
  }

  /** Keeps the trackers in step with the partitions the group assigns to this source. */
  private final class RebalanceHandler implements ConsumerRebalanceListener {
    /** {@inheritDoc} */
    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      try {
        commit(partitions);
      } finally {
        drop(partitions);
      }
    }

    /** {@inheritDoc} */
    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
      drop(partitions);
    }

    /** {@inheritDoc} */
    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      for (TopicPartition partition : partitions) {
        mTrackers.put(partition, new OffsetTracker());
      }
      LOG.info("Assigned partitions {}.", partitions);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() throws IOException {
    try {
      commitAcknowledged();
    } finally {
      for (Map.Entry<TopicPartition, OffsetTracker> entry : mTrackers.entrySet()) {
        final int outstanding = entry.getValue().getOutstandingCount();
        if (outstanding > 0) {
          LOG.info("Leaving {} unacknowledged messages of {} uncommitted.",
              outstanding, entry.getKey());
        }
      }
      mConsumer.close();
    }
  }
}
