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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestOffsetTracker {
  @Test
  public void testCommitsUpToLowestOutstanding() {
    final OffsetTracker tracker = new OffsetTracker();
    tracker.register(0L);
    tracker.register(1L);
    tracker.register(2L);
    assertEquals(-1L, tracker.committable());

    // Acknowledging out of order must not skip offset 0.
    tracker.acknowledge(1L);
    assertEquals(-1L, tracker.committable());

    tracker.acknowledge(0L);
    assertEquals(2L, tracker.committable());
    tracker.committed(2L);
    assertEquals(-1L, tracker.committable());

    tracker.acknowledge(2L);
    assertEquals(3L, tracker.committable());
    tracker.committed(3L);
    assertEquals(3L, tracker.getLastCommitted());
    assertEquals(0, tracker.getOutstandingCount());
  }

  @Test
  public void testFailedOffsetBlocksCommits() {
    final OffsetTracker tracker = new OffsetTracker();
    tracker.register(10L);
    tracker.register(11L);
    tracker.register(12L);
    tracker.acknowledge(10L);
    tracker.acknowledge(12L);
    // 11 is never acknowledged.
    assertEquals(11L, tracker.committable());
    tracker.committed(11L);
    assertEquals(-1L, tracker.committable());
  }

  @Test
  public void testRedeliveredOffsetIsOutstandingAgain() {
    final OffsetTracker tracker = new OffsetTracker();
    tracker.register(5L);
    tracker.register(6L);
    tracker.acknowledge(5L);
    tracker.acknowledge(6L);
    assertEquals(7L, tracker.committable());
    tracker.committed(7L);

    // A seek back hands out 5 again.
    tracker.register(5L);
    assertEquals(1, tracker.getOutstandingCount());
    assertEquals(-1L, tracker.committable());
    tracker.acknowledge(5L);
    assertEquals(-1L, tracker.committable());
    assertEquals(7L, tracker.getLastCommitted());
  }
}
