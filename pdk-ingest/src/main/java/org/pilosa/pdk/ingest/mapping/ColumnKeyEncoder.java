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

import com.google.common.base.Charsets;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Canonical byte form of primary key components. Components are concatenated as they are, with
 * nothing between them:
 *
 * <ul>
 *   <li>text: its UTF-8 bytes;</li>
 *   <li>integers from 0 to 2<sup>32</sup>-1: four bytes, big-endian;</li>
 *   <li>other integers: eight bytes, big-endian two's complement;</li>
 *   <li>booleans: one byte, 0 or 1;</li>
 *   <li>floating point numbers: eight bytes of IEEE-754, big-endian.</li>
 * </ul>
 *
 * <p>For example the components <code>"2", "1", 159</code> encode as
 * <code>32 31 00 00 00 9F</code>.</p>
 */
public final class ColumnKeyEncoder {
  /** Largest integer encoded on four bytes. */
  private static final long MAX_UINT32 = 0xFFFFFFFFL;

  private final ByteArrayDataOutput mOutput = ByteStreams.newDataOutput();

  /** Use {@link #create()}. */
  private ColumnKeyEncoder() {}

  /** @return an empty encoder. */
  public static ColumnKeyEncoder create() {
    return new ColumnKeyEncoder();
  }

  /**
   * Appends a text component.
   *
   * @param text The text.
   * @return this encoder.
   */
  public ColumnKeyEncoder append(String text) {
    mOutput.write(text.getBytes(Charsets.UTF_8));
    return this;
  }

  /**
   * Appends an integer component.
   *
   * @param value The integer.
   * @return this encoder.
   */
  public ColumnKeyEncoder append(long value) {
    if (value >= 0 && value <= MAX_UINT32) {
      mOutput.writeInt((int) value);
    } else {
      mOutput.writeLong(value);
    }
    return this;
  }

  /**
   * Appends a boolean component.
   *
   * @param value The boolean.
   * @return this encoder.
   */
  public ColumnKeyEncoder append(boolean value) {
    mOutput.writeBoolean(value);
    return this;
  }

  /**
   * Appends a floating point component.
   *
   * @param value The number.
   * @return this encoder.
   */
  public ColumnKeyEncoder append(double value) {
    mOutput.writeDouble(value);
    return this;
  }

  /** @return the key bytes appended so far. */
  public byte[] toByteArray() {
    return mOutput.toByteArray();
  }
}
