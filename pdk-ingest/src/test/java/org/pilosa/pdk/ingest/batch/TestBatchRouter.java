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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.pilosa.pdk.ingest.Cancellation;
import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.RetryPolicy;
import org.pilosa.pdk.ingest.sink.FlakySink;
import org.pilosa.pdk.ingest.source.Frame;
import org.pilosa.pdk.ingest.source.ListSource;

public class TestBatchRouter {
  private static final FieldSpec COLOR = FieldSpec.set("color", true, false);
  private static final FieldSpec SIZE = FieldSpec.integer("size", 0L, 100L);

  private Frame mFrame;
  private ListSource mSource;
  private BatchApplier mApplier;

  @Before
  public void setup() {
    mFrame = Frame.ofBytes("frame", new byte[0]);
    mSource = new ListSource(ImmutableList.of(mFrame));
  }

  @After
  public void teardown() {
    if (null != mApplier) {
      mApplier.close();
    }
  }

  private BatchRouter router(FlakySink sink, int batchSize, long flushIntervalMillis) {
    mApplier = BatchApplier.create(
        sink, RetryPolicy.noRetries(), 2, IngestMetrics.create(), new Cancellation());
    return BatchRouter.create(batchSize, flushIntervalMillis, mApplier);
  }

  private static void stop(BatchRouter router) throws InterruptedException {
    assertTrue(router.finish(5, TimeUnit.SECONDS));
    assertTrue(router.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  public void testBatchesPerField() throws Exception {
    final FlakySink sink = new FlakySink(0, true);
    final BatchRouter router = router(sink, 2, 60000L);
    final FrameTracker tracker = FrameTracker.create(mFrame, mSource);
    for (long column = 1; column <= 3; column++) {
      router.route(Mutation.set(COLOR, IndexRef.key("red"), IndexRef.id(column), null), tracker);
    }
    router.route(Mutation.value(SIZE, IndexRef.id(1L), 42L), tracker);
    tracker.finishDecoding();
    assertEquals(2, router.getBatcherCount());
    stop(router);

    assertTrue(tracker.isAcknowledged());
    assertEquals(ImmutableSet.of(IndexRef.id(1L), IndexRef.id(2L), IndexRef.id(3L)),
        sink.getIndex().getColumns("color", IndexRef.key("red")));
    assertEquals(Long.valueOf(42L), sink.getIndex().getValue("size", IndexRef.id(1L)));
    // Two batches of color, the second flushed on finish, and one of size.
    assertEquals(3, sink.getIndex().getAppliedBatchCount());
  }

  @Test
  public void testPartialBatchIsFlushedOnInterval() throws Exception {
    final FlakySink sink = new FlakySink(0, true);
    final BatchRouter router = router(sink, 1000, 20L);
    final FrameTracker tracker = FrameTracker.create(mFrame, mSource);
    router.route(Mutation.set(COLOR, IndexRef.key("red"), IndexRef.id(1L), null), tracker);
    tracker.finishDecoding();

    final long deadline = System.currentTimeMillis() + 5000L;
    while (!tracker.isAcknowledged() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10L);
    }
    assertTrue("Interval flush did not happen", tracker.isAcknowledged());
    stop(router);
  }

  @Test
  public void testDeadLetteredBatchFailsItsFrame() throws Exception {
    final FlakySink sink = new FlakySink(1, false);
    final BatchRouter router = router(sink, 10, 60000L);
    final FrameTracker tracker = FrameTracker.create(mFrame, mSource);
    router.route(Mutation.set(COLOR, IndexRef.key("red"), IndexRef.id(1L), null), tracker);
    tracker.finishDecoding();
    stop(router);

    assertTrue(tracker.isFailed());
    assertFalse(tracker.isAcknowledged());
    assertTrue(mSource.getAcknowledged().isEmpty());
  }

  @Test(expected=IllegalStateException.class)
  public void testNoRoutingAfterFinish() throws Exception {
    final BatchRouter router = router(new FlakySink(0, true), 10, 60000L);
    stop(router);
    router.route(Mutation.value(SIZE, IndexRef.id(1L), 1L),
        FrameTracker.create(mFrame, mSource));
  }
}
