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

package org.pilosa.pdk.ingest.decode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.text.ParseException;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.mapping.FieldDescriptor;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.source.Frame;

/**
 * Decodes frames of delimited text: one record per line, fields split on a delimiter and
 * unquoted per RFC 4180. A quoted field may span lines; its line breaks read back as
 * <code>\n</code>.
 *
 * <p>Field names are either given up front, or read from the first non-blank line of every
 * frame. Values are text; empty fields are null. Blank lines are skipped and a line whose field
 * count differs from the header is malformed.</p>
 */
public final class DelimitedTextDecoder implements Decoder {
  private final SchemaDescriptor mDescriptor;
  private final CsvParser mParser;
  private final ImmutableList<String> mHeader;

  /**
   * Builds a decoder.
   *
   * @param descriptor Descriptor of the records.
   * @param delimiter Field delimiter.
   * @param header Field names in column order, or empty to read a header row.
   */
  private DelimitedTextDecoder(SchemaDescriptor descriptor, char delimiter, List<String> header) {
    mDescriptor = Preconditions.checkNotNull(descriptor);
    mParser = CsvParser.create(delimiter);
    mHeader = ImmutableList.copyOf(header);
  }

  /**
   * Creates a decoder with positional field names.
   *
   * @param descriptor Descriptor of the records.
   * @param delimiter Field delimiter.
   * @param header Field names in column order.
   * @return the decoder.
   */
  public static DelimitedTextDecoder withHeader(
      SchemaDescriptor descriptor,
      char delimiter,
      List<String> header) {
    Preconditions.checkArgument(!header.isEmpty(), "Empty header.");
    return new DelimitedTextDecoder(descriptor, delimiter, header);
  }

  /**
   * Creates a decoder reading field names from the first line of every frame.
   *
   * @param descriptor Descriptor of the records.
   * @param delimiter Field delimiter.
   * @return the decoder.
   */
  public static DelimitedTextDecoder withHeaderRow(SchemaDescriptor descriptor, char delimiter) {
    return new DelimitedTextDecoder(descriptor, delimiter, ImmutableList.<String>of());
  }

  /** {@inheritDoc} */
  @Override
  public RecordReader decode(Frame frame) throws IOException {
    return new LineReader(frame);
  }

  /**
   * Encodes a record as one line, in the column order of the header, or in declaration order
   * when the header is read from the frames.
   *
   * @param record The record.
   * @return the line, terminated by a newline.
   */
  public byte[] encode(Record record) {
    final List<String> fields = Lists.newArrayList();
    for (String name : getColumns()) {
      final Object value = record.get(name);
      fields.add(null == value ? null : value.toString());
    }
    return (mParser.format(fields) + "\n").getBytes(Charsets.UTF_8);
  }

  /** @return the header line matching {@link #encode(Record)}, terminated by a newline. */
  public byte[] encodeHeader() {
    return (mParser.format(getColumns()) + "\n").getBytes(Charsets.UTF_8);
  }

  /** @return the column names used by {@link #encode(Record)}. */
  private List<String> getColumns() {
    if (!mHeader.isEmpty()) {
      return mHeader;
    }
    final List<String> columns = Lists.newArrayList();
    for (FieldDescriptor field : mDescriptor.getFields()) {
      columns.add(field.getName());
    }
    return columns;
  }

  /** Reads the lines of one frame. */
  private final class LineReader implements RecordReader {
    private final Frame mFrame;
    private final BufferedReader mReader;
    private List<String> mColumns;
    private long mLineNumber = 0;

    /**
     * Opens the body of a frame.
     *
     * @param frame The frame.
     */
    private LineReader(Frame frame) {
      mFrame = frame;
      mReader = new BufferedReader(new InputStreamReader(frame.openStream(), Charsets.UTF_8));
      mColumns = mHeader.isEmpty() ? null : mHeader;
    }

    /** {@inheritDoc} */
    @Override
    public SchemaDescriptor getDescriptor() {
      return mDescriptor;
    }

    /** {@inheritDoc} */
    @Override
    public Record next() throws IOException {
      while (true) {
        final String line = readRecordText();
        if (null == line) {
          return null;
        }
        if (line.trim().isEmpty()) {
          continue;
        }
        final List<String> fields;
        try {
          fields = mParser.parse(line);
        } catch (ParseException pe) {
          throw new MalformedRecordException(String.format("%s line %d: %s",
              mFrame.getLocator(), mLineNumber, pe.getMessage()), pe);
        }
        if (null == mColumns) {
          mColumns = trimAll(fields);
          continue;
        }
        if (fields.size() != mColumns.size()) {
          throw new MalformedRecordException(String.format(
              "%s line %d: expected %d fields, got %d",
              mFrame.getLocator(), mLineNumber, mColumns.size(), fields.size()));
        }
        final Record.Builder builder = Record.builder();
        for (int i = 0; i < fields.size(); i++) {
          final String value = fields.get(i);
          builder.put(mColumns.get(i), value.isEmpty() ? null : value);
        }
        return builder.build();
      }
    }

    /**
     * Reads the lines of the next record, joining lines while a quoted field is open.
     *
     * @return the record text, or null at the end of the frame.
     * @throws IOException on I/O error.
     */
    private String readRecordText() throws IOException {
      final String first = mReader.readLine();
      if (null == first) {
        return null;
      }
      mLineNumber++;
      final StringBuilder text = new StringBuilder(first);
      while (mParser.endsInQuotedField(text.toString())) {
        final String more = mReader.readLine();
        if (null == more) {
          // The parser reports the unmatched quote.
          break;
        }
        mLineNumber++;
        text.append('\n').append(more);
      }
      return text.toString();
    }

    /** {@inheritDoc} */
    @Override
    public void close() throws IOException {
      mReader.close();
    }
  }

  /**
   * Trims header names.
   *
   * @param names Raw names.
   * @return trimmed names.
   */
  private static List<String> trimAll(List<String> names) {
    final List<String> trimmed = Lists.newArrayListWithCapacity(names.size());
    for (String name : names) {
      trimmed.add(name.trim());
    }
    return trimmed;
  }
}
