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
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class TestFieldValues {
  @Test
  public void testBooleans() throws MappingException {
    assertTrue(FieldValues.toBoolean("f", true));
    assertTrue(FieldValues.toBoolean("f", " T "));
    assertTrue(FieldValues.toBoolean("f", 1L));
    assertFalse(FieldValues.toBoolean("f", "false"));
    assertFalse(FieldValues.toBoolean("f", "0"));
  }

  @Test(expected=MappingException.class)
  public void testNotABoolean() throws MappingException {
    FieldValues.toBoolean("f", 2L);
  }

  @Test
  public void testIntegers() throws MappingException {
    assertEquals(12L, FieldValues.toLong("f", " 12 "));
    assertEquals(3L, FieldValues.toLong("f", 3.0));
    assertEquals(1L, FieldValues.toLong("f", true));
  }

  @Test(expected=MappingException.class)
  public void testFractionIsNotAnInteger() throws MappingException {
    FieldValues.toLong("f", 3.5);
  }

  @Test
  public void testStrings() throws MappingException {
    assertEquals("7", FieldValues.toText("f", 7L));
    assertEquals(ImmutableList.of("x"), FieldValues.toStrings("f", "x"));
    assertEquals(ImmutableList.of("a", "b"),
        FieldValues.toStrings("f", ImmutableList.of("a", "b")));
  }

  @Test
  public void testTimestamps() throws MappingException {
    final FieldDescriptor field = FieldDescriptor.of("at", FieldType.TIMESTAMP);
    assertEquals(1000L, FieldValues.toTimestamp(field, 1000L));
    assertEquals(1000L, FieldValues.toTimestamp(field, "1000"));
    assertEquals(3600000L, FieldValues.toTimestamp(field, "1970-01-01 01:00:00"));
  }

  @Test
  public void testBadTimestampNamesTheFormat() {
    try {
      FieldValues.toTimestamp(FieldDescriptor.of("at", FieldType.TIMESTAMP), "noon");
      throw new AssertionError("Expected a MappingException.");
    } catch (MappingException me) {
      assertEquals("at", me.getField());
    }
  }
}
