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

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;

import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.decode.Decoder;
import org.pilosa.pdk.ingest.decode.RecordReader;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.source.Frame;

/**
 * Numbers the records of another decoder, for inputs that carry no column id of their own.
 *
 * <p>Ids are unique across every frame decoded by one instance, but their order across frames
 * decoded in parallel is unspecified. Pair this decoder with the id field it writes.</p>
 */
public final class SequentialIdDecoder implements Decoder {
  /** Default name of the id field. */
  public static final String ID_FIELD = "id";

  private final Decoder mDelegate;
  private final String mField;
  private final AtomicLong mNextId;

  /**
   * @param delegate Decoder of the records.
   * @param field Name of the id field to add.
   * @param firstId Id of the first record.
   */
  private SequentialIdDecoder(Decoder delegate, String field, long firstId) {
    mDelegate = Preconditions.checkNotNull(delegate);
    mField = Preconditions.checkNotNull(field);
    Preconditions.checkArgument(firstId >= 0, "Column ids may not be negative: %s", firstId);
    mNextId = new AtomicLong(firstId);
  }

  /**
   * Numbers records from 0 in the {@link #ID_FIELD} field.
   *
   * @param delegate Decoder of the records.
   * @return the decoder.
   */
  public static SequentialIdDecoder create(Decoder delegate) {
    return new SequentialIdDecoder(delegate, ID_FIELD, 0L);
  }

  /**
   * Numbers records in a given field.
   *
   * @param delegate Decoder of the records.
   * @param field Name of the id field to add.
   * @param firstId Id of the first record.
   * @return the decoder.
   */
  public static SequentialIdDecoder create(Decoder delegate, String field, long firstId) {
    return new SequentialIdDecoder(delegate, field, firstId);
  }

  /** @return the id the next record will get. */
  public long getNextId() {
    return mNextId.get();
  }

  /** {@inheritDoc} */
  @Override
  public RecordReader decode(Frame frame) throws IOException {
    final RecordReader reader = mDelegate.decode(frame);
    return new RecordReader() {
      /** {@inheritDoc} */
      @Override
      public SchemaDescriptor getDescriptor() {
        return reader.getDescriptor();
      }

      /** {@inheritDoc} */
      @Override
      public Record next() throws IOException {
        final Record record = reader.next();
        if (null == record) {
          return null;
        }
        return Record.builder()
            .putAll(record)
            .put(mField, mNextId.getAndIncrement())
            .build();
      }

      /** {@inheritDoc} */
      @Override
      public void close() throws IOException {
        reader.close();
      }
    };
  }
}
