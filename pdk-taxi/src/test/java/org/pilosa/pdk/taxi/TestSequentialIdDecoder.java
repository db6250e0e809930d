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

package org.pilosa.pdk.taxi;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.IOException;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.decode.DelimitedTextDecoder;
import org.pilosa.pdk.ingest.decode.RecordReader;
import org.pilosa.pdk.ingest.mapping.FieldDescriptor;
import org.pilosa.pdk.ingest.mapping.FieldType;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.source.Frame;

public class TestSequentialIdDecoder {
  private SchemaDescriptor mColors;
  private DelimitedTextDecoder mText;

  @Before
  public void setup() throws IOException {
    mColors =
        SchemaDescriptor.create(ImmutableList.of(FieldDescriptor.of("color", FieldType.STRING)));
    mText = DelimitedTextDecoder.withHeader(mColors, ',', ImmutableList.of("color"));
  }

  private static Frame frame(String text) {
    return Frame.ofBytes("colors.csv", text.getBytes(Charsets.UTF_8));
  }

  @Test
  public void testIdsContinueAcrossFrames() throws IOException {
    final SequentialIdDecoder decoder = SequentialIdDecoder.create(mText, "trip", 5L);
    final RecordReader first = decoder.decode(frame("red\nblue\n"));
    assertEquals(mColors, first.getDescriptor());
    assertEquals(Record.builder().put("color", "red").put("trip", 5L).build(), first.next());
    assertEquals(6L, first.next().get("trip"));
    assertNull(first.next());
    first.close();

    final RecordReader second = decoder.decode(frame("green\n"));
    assertEquals(7L, second.next().get("trip"));
    second.close();
    assertEquals(8L, decoder.getNextId());
  }

  @Test
  public void testDefaultField() throws IOException {
    final RecordReader reader = SequentialIdDecoder.create(mText).decode(frame("red\n"));
    assertEquals(0L, reader.next().get(SequentialIdDecoder.ID_FIELD));
    reader.close();
  }
}
