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

package org.pilosa.pdk.ingest;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestIndexRef {
  @Test
  public void testIdsAndKeysNeverMatch() {
    assertFalse(IndexRef.id(7L).equals(IndexRef.key("7")));
    assertEquals(IndexRef.key("7"), IndexRef.key(new byte[] {'7'}));
    assertEquals(IndexRef.id(7L), IndexRef.id(7L));
    assertEquals(IndexRef.id(7L).hashCode(), IndexRef.id(7L).hashCode());
  }

  @Test
  public void testKeyBytesAreCopied() {
    final byte[] bytes = {1, 2};
    final IndexRef ref = IndexRef.key(bytes);
    bytes[0] = 9;
    assertArrayEquals(new byte[] {1, 2}, ref.getKeyBytes());
    ref.getKeyBytes()[1] = 9;
    assertArrayEquals(new byte[] {1, 2}, ref.getKeyBytes());
  }

  @Test
  public void testToString() {
    assertEquals("18446744073709551615", IndexRef.id(-1L).toString());
    assertEquals("'red'", IndexRef.key("red").toString());
    assertEquals("0x0aff", IndexRef.key(new byte[] {10, (byte) 0xff}).toString());
  }

  @Test
  public void testKind() {
    assertTrue(IndexRef.key("a").isKey());
    assertEquals("a", IndexRef.key("a").getKeyString());
    assertEquals(3L, IndexRef.id(3L).getId());
  }

  @Test(expected=IllegalStateException.class)
  public void testIdOfKey() {
    IndexRef.key("a").getId();
  }
}
