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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.Before;
import org.junit.Test;

import org.pilosa.pdk.ingest.IngestConfig;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;

public class TestKafkaSource {
  private static final String TOPIC = "events";
  private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

  private NonClosingMockConsumer mConsumer;
  private IngestMetrics mMetrics;
  private KafkaSource mSource;

  @Before
  public void setup() {
    mConsumer = new NonClosingMockConsumer();
    mMetrics = IngestMetrics.create();
    mSource = KafkaSource.create(mConsumer, ImmutableList.of(TOPIC), mMetrics);
    mConsumer.rebalance(ImmutableList.of(PARTITION));
    mConsumer.updateBeginningOffsets(ImmutableMap.of(PARTITION, 0L));
    for (long offset = 0; offset < 3; offset++) {
      mConsumer.addRecord(record(offset, "value" + offset));
    }
  }

  private static ConsumerRecord<byte[], byte[]> record(long offset, String value) {
    return new ConsumerRecord<byte[], byte[]>(TOPIC, 0, offset,
        "key".getBytes(Charsets.UTF_8), value.getBytes(Charsets.UTF_8));
  }

  /** @return the committed offset of the partition, or null. */
  private Long committed() {
    final OffsetAndMetadata committed =
        mConsumer.committed(ImmutableSet.of(PARTITION)).get(PARTITION);
    return null == committed ? null : committed.offset();
  }

  @Test
  public void testFramesCarryMessages() throws IOException {
    final Frame frame = mSource.next(10, TimeUnit.MILLISECONDS);
    assertTrue(frame.isMessage());
    assertEquals(TOPIC, frame.getTopic());
    assertEquals(0, frame.getPartition());
    assertEquals(0L, frame.getOffset());
    assertArrayEquals("key".getBytes(Charsets.UTF_8), frame.getKey());
    assertArrayEquals("value0".getBytes(Charsets.UTF_8), frame.getBytes());
    assertEquals("events-0@0", frame.getLocator());
    assertFalse(mSource.isExhausted());
  }

  @Test
  public void testCommitsOnlyAcknowledgedPrefix() throws IOException {
    final Frame first = mSource.next(10, TimeUnit.MILLISECONDS);
    final Frame second = mSource.next(10, TimeUnit.MILLISECONDS);
    final Frame third = mSource.next(10, TimeUnit.MILLISECONDS);
    assertEquals(2L, third.getOffset());

    mSource.acknowledge(second);
    assertNull(mSource.next(10, TimeUnit.MILLISECONDS));
    assertNull("Offset 0 is still in flight", committed());

    mSource.acknowledge(first);
    assertNull(mSource.next(10, TimeUnit.MILLISECONDS));
    assertEquals(Long.valueOf(2L), committed());
    assertEquals(1L, mMetrics.get(IngestCounter.OFFSETS_COMMITTED));

    mSource.acknowledge(third);
    mSource.close();
    assertEquals(Long.valueOf(3L), committed());
    assertTrue(mConsumer.isCloseCalled());
  }

  @Test
  public void testUnacknowledgedMessagesAreNotCommittedOnClose() throws IOException {
    mSource.next(10, TimeUnit.MILLISECONDS);
    mSource.close();
    assertNull(committed());
    assertEquals(0L, mMetrics.get(IngestCounter.OFFSETS_COMMITTED));
  }

  @Test
  public void testRedeliveredMessagesAreHandedOutAgain() throws IOException {
    for (long offset = 0; offset < 3; offset++) {
      assertEquals(offset, mSource.next(10, TimeUnit.MILLISECONDS).getOffset());
    }
    mConsumer.rebalance(ImmutableList.<TopicPartition>of());
    mConsumer.rebalance(ImmutableList.of(PARTITION));
    mConsumer.seek(PARTITION, 0L);
    mConsumer.addRecord(record(0L, "value0"));

    final Frame again = mSource.next(10, TimeUnit.MILLISECONDS);
    assertEquals(0L, again.getOffset());
    mSource.acknowledge(again);
    assertNull(mSource.next(10, TimeUnit.MILLISECONDS));
    assertEquals(Long.valueOf(1L), committed());
  }

  @Test
  public void testRevokedPartitionCommitsAcknowledgedPrefix() throws IOException {
    final Frame first = mSource.next(10, TimeUnit.MILLISECONDS);
    mSource.acknowledge(first);

    final ConsumerRebalanceListener listener = mSource.getRebalanceListener();
    listener.onPartitionsRevoked(ImmutableList.of(PARTITION));
    assertEquals(Long.valueOf(1L), committed());

    mConsumer.rebalance(ImmutableList.of(PARTITION));
    listener.onPartitionsAssigned(ImmutableList.of(PARTITION));
    mConsumer.seek(PARTITION, 1L);
    mConsumer.addRecord(record(1L, "again1"));
    mConsumer.addRecord(record(2L, "again2"));

    // Messages buffered before the revocation are gone; the new poll delivers them again.
    final Frame second = mSource.next(10, TimeUnit.MILLISECONDS);
    assertEquals(1L, second.getOffset());
    assertArrayEquals("again1".getBytes(Charsets.UTF_8), second.getBytes());
    final Frame third = mSource.next(10, TimeUnit.MILLISECONDS);
    assertEquals(2L, third.getOffset());

    mSource.acknowledge(second);
    mSource.acknowledge(third);
    mSource.close();
    assertEquals(Long.valueOf(3L), committed());
  }

  @Test
  public void testAcknowledgementOfRevokedPartitionIsIgnored() throws IOException {
    final Frame first = mSource.next(10, TimeUnit.MILLISECONDS);
    mSource.getRebalanceListener().onPartitionsRevoked(ImmutableList.of(PARTITION));
    mSource.acknowledge(first);
    mSource.close();
    assertNull(committed());
  }

  @Test
  public void testConsumerProperties() {
    final Properties props = new Properties();
    props.setProperty("kafka-hosts", "k1:9092,k2:9092");
    props.setProperty("group", "ingesters");
    final Properties consumer =
        KafkaSource.consumerProperties(IngestConfig.fromProperties(props));
    assertEquals("k1:9092,k2:9092", consumer.getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("ingesters", consumer.getProperty(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals("false", consumer.getProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
    assertEquals("earliest", consumer.getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
  }
}
