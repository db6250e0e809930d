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

package org.pilosa.pdk.ingest.mapping;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.IndexRef;
import org.pilosa.pdk.ingest.IngestCounter;
import org.pilosa.pdk.ingest.IngestMetrics;
import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Mutation;
import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.decode.BigSchema;

public class TestRecordMapper {
  private static final IndexRef PRIMARY_KEY =
      IndexRef.key(new byte[] {50, 49, 0, 0, 0, (byte) 159});

  private IngestMetrics mMetrics;
  private SchemaDescriptor mBigSchema;

  @Before
  public void setup() throws IOException {
    mMetrics = IngestMetrics.create();
    mBigSchema = AvroSchemaDescriptors.fromSchema(BigSchema.schema());
  }

  private RecordMapper mapper(IdAssignment ids, String packBools) {
    return RecordMapper.create(ids, packBools, mMetrics, 1L);
  }

  private static Mutation keyed(String field, String row, IndexRef column) {
    return Mutation.set(FieldSpec.set(field, true, false), IndexRef.key(row), column, null);
  }

  private static Mutation numbered(String field, long row, IndexRef column) {
    return Mutation.set(FieldSpec.set(field, false, false), IndexRef.id(row), column, null);
  }

  @Test
  public void testPrimaryKeyWithPackedBooleans() throws MalformedRecordException {
    final RecordMapper mapper =
        mapper(PrimaryKeyAssignment.create(ImmutableList.of("abc", "db", "user_id")), "bools");
    final List<Mutation> mutations = mapper.map(mBigSchema, BigSchema.record(159L));

    assertEquals(ImmutableList.of(
        keyed("abc", "2", PRIMARY_KEY),
        keyed("db", "1", PRIMARY_KEY),
        numbered("user_id", 159L, PRIMARY_KEY),
        keyed("bools", "all_users", PRIMARY_KEY),
        keyed("bools-exists", "all_users", PRIMARY_KEY),
        keyed("bools-exists", "has_deleted_date", PRIMARY_KEY),
        keyed("central_group", "cgr", PRIMARY_KEY),
        keyed("custom_audiences", "a", PRIMARY_KEY),
        keyed("custom_audiences", "b", PRIMARY_KEY),
        numbered("desktop_frequency", 7L, PRIMARY_KEY),
        numbered("ddd_category_total_current_rhinocerous_checking", 5L, PRIMARY_KEY),
        keyed("survey1234", "yes", PRIMARY_KEY),
        numbered("days_since_last_logon", 8L, PRIMARY_KEY)),
        mutations);
    assertEquals(13L, mMetrics.get(IngestCounter.MUTATIONS_EMITTED));
    assertEquals(0L, mMetrics.get(IngestCounter.FIELDS_DROPPED));
  }

  @Test
  public void testIdFieldIsNotMapped() throws MalformedRecordException {
    final RecordMapper mapper = mapper(IdFieldAssignment.create("user_id"), "bools");
    final List<Mutation> mutations = mapper.map(mBigSchema, BigSchema.record(159L));
    assertEquals(12, mutations.size());
    for (Mutation mutation : mutations) {
      assertEquals(IndexRef.id(159L), mutation.getColumn());
      assertFalse("user_id".equals(mutation.getFieldName()));
    }
  }

  @Test
  public void testUnpackedBooleans() throws MalformedRecordException {
    final RecordMapper mapper = mapper(IdFieldAssignment.create("user_id"), null);
    final List<Mutation> mutations = mapper.map(mBigSchema, BigSchema.record(3L));
    assertTrue(mutations.contains(numbered("all_users", 1L, IndexRef.id(3L))));
    assertTrue(mutations.contains(numbered("has_deleted_date", 0L, IndexRef.id(3L))));
  }

  @Test(expected=MalformedRecordException.class)
  public void testMissingPrimaryKeyField() throws MalformedRecordException {
    final RecordMapper mapper =
        mapper(PrimaryKeyAssignment.create(ImmutableList.of("abc", "central_group")), null);
    mapper.map(mBigSchema, Record.builder().putAll(BigSchema.record(1L))
        .put("central_group", null)
        .build());
  }

  @Test(expected=MalformedRecordException.class)
  public void testNegativeColumnId() throws MalformedRecordException {
    mapper(IdFieldAssignment.create("user_id"), null).map(mBigSchema, BigSchema.record(-1L));
  }

  @Test
  public void testBadFieldsAreDropped() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.create(ImmutableList.of(
        FieldDescriptor.of("id", FieldType.INT),
        FieldDescriptor.of("count", FieldType.INT),
        FieldDescriptor.builder("size", FieldType.INT).withRange(0L, 10L).build(),
        FieldDescriptor.builder("color", FieldType.STRING).withNullable(false).build(),
        FieldDescriptor.builder("zip", FieldType.STRING).withRowIds(true).build()));
    final RecordMapper mapper = mapper(IdFieldAssignment.create("id"), null);
    final Record record = Record.builder()
        .put("id", "4")
        .put("count", "many")
        .put("size", "11")
        .put("color", null)
        .put("zip", "94107")
        .put("undeclared", "ignored")
        .build();

    final List<Mutation> mutations = mapper.map(descriptor, record);
    assertEquals(ImmutableList.of(numbered("zip", 94107L, IndexRef.id(4L))), mutations);
    assertEquals(3L, mMetrics.get(IngestCounter.FIELDS_DROPPED));
  }

  @Test
  public void testRangesAndScaling() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.create(ImmutableList.of(
        FieldDescriptor.of("id", FieldType.INT),
        FieldDescriptor.builder("fare", FieldType.FLOAT)
            .withMultiplier(100.0)
            .withOffset(1.0)
            .withRange(0L, 100000L)
            .build()));
    final List<Mutation> mutations = mapper(IdFieldAssignment.create("id"), null)
        .map(descriptor, Record.builder().put("id", 1L).put("fare", "12.34").build());
    assertEquals(ImmutableList.of(
        Mutation.value(FieldSpec.integer("fare", 0L, 100000L), IndexRef.id(1L), 1134L)),
        mutations);
  }

  @Test
  public void testTimestampIsAttached() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.create(ImmutableList.of(
        FieldDescriptor.of("id", FieldType.INT),
        FieldDescriptor.builder("at", FieldType.TIMESTAMP).withTimeFormat("yyyy-MM-dd").build(),
        FieldDescriptor.of("color", FieldType.STRING)));
    final RecordMapper mapper = mapper(IdFieldAssignment.create("id"), "flags");
    final List<Mutation> mutations = mapper.map(descriptor,
        Record.builder().put("id", 1L).put("at", "1970-01-02").put("color", "red").build());
    assertEquals(ImmutableList.of(Mutation.set(FieldSpec.set("color", true, true),
        IndexRef.key("red"), IndexRef.id(1L), 86400000L)), mutations);

    final List<Mutation> untimed = mapper.map(descriptor,
        Record.builder().put("id", 1L).put("at", "yesterday").put("color", "red").build());
    assertNull(untimed.get(0).getTimestamp());
    assertEquals(1L, mMetrics.get(IngestCounter.FIELDS_DROPPED));
  }
}
