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

package org.pilosa.pdk.ingest.sink;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.batch.Batch;

public class TestInMemoryIndexSink {
  private static final FieldSpec COLOR = FieldSpec.set("color", true, false);
  private static final FieldSpec SIZE = FieldSpec.integer("size", 0L, 100L);

  private static Batch colors(long... columns) {
    final ImmutableList.Builder<Mutation> mutations = ImmutableList.builder();
    for (long column : columns) {
      mutations.add(Mutation.set(COLOR, IndexRef.key("red"), IndexRef.id(column), null));
    }
    return Batch.create(mutations.build());
  }

  @Test
  public void testBitsHaveSetSemantics() throws SinkException {
    final InMemoryIndexSink sink = InMemoryIndexSink.create();
    sink.apply(colors(1L, 2L));
    sink.apply(colors(2L, 3L));
    assertEquals(ImmutableSet.of(IndexRef.id(1L), IndexRef.id(2L), IndexRef.id(3L)),
        sink.getColumns("color", IndexRef.key("red")));
    assertEquals(ImmutableSet.of(IndexRef.key("red")), sink.getRows("color"));
    assertEquals(3L, sink.getBitCount());
    assertEquals(2, sink.getAppliedBatchCount());
    assertEquals(COLOR, sink.getFieldSpec("color"));
    assertTrue(sink.getColumns("color", IndexRef.key("blue")).isEmpty());
    assertTrue(sink.getRows("shape").isEmpty());
  }

  @Test
  public void testLastValueWins() throws SinkException {
    final InMemoryIndexSink sink = InMemoryIndexSink.create();
    sink.apply(Batch.create(ImmutableList.of(Mutation.value(SIZE, IndexRef.id(1L), 10L))));
    sink.apply(Batch.create(ImmutableList.of(Mutation.value(SIZE, IndexRef.id(1L), 20L))));
    assertEquals(Long.valueOf(20L), sink.getValue("size", IndexRef.id(1L)));
    assertNull(sink.getValue("size", IndexRef.id(2L)));
    assertEquals(ImmutableSet.of("size"), sink.getFieldNames());
  }

  @Test
  public void testOutOfRangeValueRejectsWholeBatch() {
    final InMemoryIndexSink sink = InMemoryIndexSink.create();
    try {
      sink.apply(Batch.create(ImmutableList.of(
          Mutation.value(SIZE, IndexRef.id(1L), 10L),
          Mutation.value(SIZE, IndexRef.id(2L), 101L))));
      fail("Expected a SinkException.");
    } catch (SinkException se) {
      assertFalse(se.isRetryable());
    }
    assertNull(sink.getValue("size", IndexRef.id(1L)));
    assertEquals(0, sink.getAppliedBatchCount());
  }

  @Test
  public void testSameContent() throws SinkException {
    final InMemoryIndexSink once = InMemoryIndexSink.create();
    once.apply(colors(1L, 2L));
    final InMemoryIndexSink twice = InMemoryIndexSink.create();
    twice.apply(colors(1L));
    twice.apply(colors(2L, 1L));
    assertTrue(once.hasSameContentAs(twice));

    twice.apply(colors(3L));
    assertFalse(once.hasSameContentAs(twice));
  }
}
