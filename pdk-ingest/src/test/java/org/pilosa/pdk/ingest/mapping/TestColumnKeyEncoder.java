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

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;

public class TestColumnKeyEncoder {
  @Test
  public void testComponentsAreConcatenated() {
    final byte[] key = ColumnKeyEncoder.create().append("2").append("1").append(159L).toByteArray();
    assertArrayEquals(new byte[] {50, 49, 0, 0, 0, (byte) 159}, key);
  }

  @Test
  public void testWideIntegers() {
    assertArrayEquals(new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff},
        ColumnKeyEncoder.create().append(0xFFFFFFFFL).toByteArray());
    assertArrayEquals(new byte[] {0, 0, 0, 1, 0, 0, 0, 0},
        ColumnKeyEncoder.create().append(0x100000000L).toByteArray());
    assertArrayEquals(new byte[] {-1, -1, -1, -1, -1, -1, -1, -1},
        ColumnKeyEncoder.create().append(-1L).toByteArray());
  }

  @Test
  public void testBooleansAndDoubles() {
    assertArrayEquals(new byte[] {1, 0},
        ColumnKeyEncoder.create().append(true).append(false).toByteArray());
    assertArrayEquals(new byte[] {0x3f, (byte) 0xf0, 0, 0, 0, 0, 0, 0},
        ColumnKeyEncoder.create().append(1.0).toByteArray());
  }
}
