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

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import org.pilosa.pdk.ingest.FieldSpec;

public class TestSchemaDescriptor {
  private static final String TAXI_LIKE = "{ \"fields\" : ["
      + "{ \"name\" : \"vendor_id\", \"type\" : \"string\" },"
      + "{ \"name\" : \"pickup\", \"type\" : \"timestamp\", \"format\" : \"yyyy-MM-dd HH:mm\" },"
      + "{ \"name\" : \"passengers\", \"type\" : \"int\" },"
      + "{ \"name\" : \"fare\", \"type\" : \"float\", \"multiplier\" : 100, \"min\" : 0,"
      + "  \"max\" : 100000 },"
      + "{ \"name\" : \"zip\", \"type\" : \"string\", \"rowIds\" : true },"
      + "{ \"name\" : \"tags\", \"type\" : \"string_array\" },"
      + "{ \"name\" : \"active\", \"type\" : \"boolean\", \"nullable\" : false }"
      + "] }";

  @Test
  public void testFromJson() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.fromJson(TAXI_LIKE);
    assertEquals(7, descriptor.getFields().size());
    assertTrue(descriptor.isTimed());
    assertEquals("pickup", descriptor.getTimestampField().getName());
    assertEquals("yyyy-MM-dd HH:mm", descriptor.getTimestampField().getTimeFormat());
    assertNull("Timestamps map to no field", descriptor.getFieldSpec("pickup"));

    assertEquals(FieldSpec.set("vendor_id", true, true), descriptor.getFieldSpec("vendor_id"));
    assertEquals(FieldSpec.set("passengers", false, true), descriptor.getFieldSpec("passengers"));
    assertEquals(FieldSpec.integer("fare", 0L, 100000L), descriptor.getFieldSpec("fare"));
    assertEquals(FieldSpec.set("zip", false, true), descriptor.getFieldSpec("zip"));
    assertEquals(FieldSpec.set("tags", true, true), descriptor.getFieldSpec("tags"));

    final FieldDescriptor active = descriptor.getField("active");
    assertEquals(FieldType.BOOL, active.getType());
    assertFalse(active.isNullable());
    assertEquals(100.0, descriptor.getField("fare").getMultiplier(), 0.0);
  }

  @Test
  public void testJsonRoundTrip() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.fromJson(TAXI_LIKE);
    assertEquals(descriptor, SchemaDescriptor.fromJson(descriptor.toJson()));
  }

  @Test
  public void testUntimedDescriptor() throws IOException {
    final SchemaDescriptor descriptor = SchemaDescriptor.create(ImmutableList.of(
        FieldDescriptor.of("color", FieldType.STRING)));
    assertFalse(descriptor.isTimed());
    assertEquals(FieldSpec.set("color", true, false), descriptor.getFieldSpec("color"));
    assertNull(descriptor.getField("size"));
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testUnknownType() throws IOException {
    SchemaDescriptor.fromJson("{ \"fields\" : [ { \"name\" : \"a\", \"type\" : \"blob\" } ] }");
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testDuplicateField() throws IOException {
    SchemaDescriptor.fromJson("{ \"fields\" : [ { \"name\" : \"a\", \"type\" : \"int\" },"
        + " { \"name\" : \"a\", \"type\" : \"string\" } ] }");
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testTwoTimestamps() throws IOException {
    SchemaDescriptor.create(ImmutableList.of(
        FieldDescriptor.of("a", FieldType.TIMESTAMP),
        FieldDescriptor.of("b", FieldType.TIMESTAMP)));
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testHalfRange() throws IOException {
    SchemaDescriptor.fromJson(
        "{ \"fields\" : [ { \"name\" : \"a\", \"type\" : \"int\", \"min\" : 0 } ] }");
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testRangeOnString() throws IOException {
    SchemaDescriptor.fromJson("{ \"fields\" : [ { \"name\" : \"a\", \"type\" : \"string\","
        + " \"min\" : 0, \"max\" : 1 } ] }");
  }

  @Test(expected=InvalidSchemaDescriptorException.class)
  public void testMalformedJson() throws IOException {
    SchemaDescriptor.fromJson("{ \"fields\" : [ ");
  }
}
