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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;

import org.pilosa.pdk.ingest.MalformedRecordException;
import org.pilosa.pdk.ingest.Record;
import org.pilosa.pdk.ingest.mapping.AvroSchemaDescriptors;
import org.pilosa.pdk.ingest.mapping.InvalidSchemaDescriptorException;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;
import org.pilosa.pdk.ingest.source.Frame;

/**
 * Decodes Avro messages framed by a schema identifier: a magic byte <code>0x00</code>, the
 * identifier as four big-endian bytes, then the Avro binary body. Each frame holds one record.
 *
 * <p>Identifiers are resolved through a {@link SchemaResolver}; the descriptor derived from each
 * schema is kept for the life of the decoder.</p>
 */
public final class SchemaEncodedDecoder implements Decoder {
  /** First byte of every frame. */
  public static final byte MAGIC_BYTE = 0x0;

  /** Length of the magic byte and schema identifier. */
  public static final int PREFIX_LENGTH = 5;

  private final SchemaResolver mResolver;

  /** Schema identifier to decoding state. Append only. */
  private final ConcurrentMap<Integer, Resolved> mResolved = Maps.newConcurrentMap();

  /** A resolved schema and its descriptor. */
  private static final class Resolved {
    private final Schema mSchema;
    private final SchemaDescriptor mDescriptor;

    /**
     * Pairs a schema with its descriptor.
     *
     * @param schema Writer schema.
     * @param descriptor Derived descriptor.
     */
    private Resolved(Schema schema, SchemaDescriptor descriptor) {
      mSchema = schema;
      mDescriptor = descriptor;
    }
  }

  /**
   * Builds a decoder.
   *
   * @param resolver Resolves schema identifiers.
   */
  private SchemaEncodedDecoder(SchemaResolver resolver) {
    mResolver = Preconditions.checkNotNull(resolver);
  }

  /**
   * Creates a decoder.
   *
   * @param resolver Resolves schema identifiers.
   * @return the decoder.
   */
  public static SchemaEncodedDecoder create(SchemaResolver resolver) {
    return new SchemaEncodedDecoder(resolver);
  }

  /** {@inheritDoc} */
  @Override
  public RecordReader decode(Frame frame) throws IOException {
    final byte[] bytes = frame.getBytes();
    if (bytes.length < PREFIX_LENGTH || bytes[0] != MAGIC_BYTE) {
      throw new MalformedRecordException(frame.getLocator() + ": missing schema identifier.");
    }
    final int schemaId = ByteBuffer.wrap(bytes, 1, 4).getInt();
    final Resolved resolved = resolve(schemaId);

    final GenericRecord datum;
    try {
      final BinaryDecoder decoder = DecoderFactory.get()
          .binaryDecoder(bytes, PREFIX_LENGTH, bytes.length - PREFIX_LENGTH, null);
      datum = new GenericDatumReader<GenericRecord>(resolved.mSchema).read(null, decoder);
    } catch (IOException ioe) {
      throw new MalformedRecordException(
          frame.getLocator() + ": undecodable body for schema " + schemaId, ioe);
    } catch (RuntimeException re) {
      // Truncated or corrupt bodies surface as index or size errors.
      throw new MalformedRecordException(
          frame.getLocator() + ": corrupt body for schema " + schemaId, re);
    }
    return new SingleRecordReader(resolved.mDescriptor, toRecord(datum));
  }

  /**
   * Encodes a record with the schema of an identifier.
   *
   * @param record The record.
   * @param schemaId The schema identifier.
   * @return the framed bytes.
   * @throws IOException if the schema cannot be resolved or the record does not fit it.
   */
  public byte[] encode(Record record, int schemaId) throws IOException {
    final Schema schema = resolve(schemaId).mSchema;
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(MAGIC_BYTE);
    out.write(ByteBuffer.allocate(4).putInt(schemaId).array());
    final BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    try {
      final GenericRecord datum = (GenericRecord) toAvro(schema, record);
      new GenericDatumWriter<GenericRecord>(schema).write(datum, encoder);
    } catch (RuntimeException re) {
      // Wrong value types surface as cast or null pointer errors.
      throw new MalformedRecordException("Record does not fit schema " + schemaId, re);
    }
    encoder.flush();
    return out.toByteArray();
  }

  /**
   * Resolves an identifier, deriving its descriptor on first use.
   *
   * @param schemaId The identifier.
   * @return the schema and descriptor.
   * @throws SchemaResolutionException if the identifier cannot be resolved, or its schema cannot
   *     be mapped.
   */
  private Resolved resolve(int schemaId) throws SchemaResolutionException {
    final Resolved cached = mResolved.get(schemaId);
    if (null != cached) {
      return cached;
    }
    final Schema schema = mResolver.resolve(schemaId);
    final SchemaDescriptor descriptor;
    try {
      descriptor = AvroSchemaDescriptors.fromSchema(schema);
    } catch (InvalidSchemaDescriptorException isde) {
      throw new SchemaResolutionException(schemaId,
          "Schema " + schemaId + " cannot be mapped: " + isde.getMessage(), isde);
    }
    final Resolved resolved = new Resolved(schema, descriptor);
    final Resolved previous = mResolved.putIfAbsent(schemaId, resolved);
    return null == previous ? resolved : previous;
  }

  /**
   * Converts a decoded Avro record.
   *
   * @param datum The Avro record.
   * @return the record.
   */
  static Record toRecord(GenericRecord datum) {
    final Record.Builder builder = Record.builder();
    for (Schema.Field field : datum.getSchema().getFields()) {
      builder.put(field.name(), fromAvro(field.schema(), datum.get(field.pos())));
    }
    return builder.build();
  }

  /**
   * Converts a decoded Avro value, descending into records and collections. Union values are
   * wrapped with their branch, so that only they are unwrapped.
   *
   * @param schema Writer schema of the value.
   * @param value The Avro value.
   * @return a value {@link Record} can normalize.
   */
  private static Object fromAvro(Schema schema, Object value) {
    switch (schema.getType()) {
      case UNION: {
        final Schema branch =
            schema.getTypes().get(GenericData.get().resolveUnion(schema, value));
        return Record.union(branch.getName(), fromAvro(branch, value));
      }
      case RECORD:
        return toRecord((GenericRecord) value);
      case ARRAY: {
        final List<Object> items = Lists.newArrayList();
        for (Object item : (Collection<?>) value) {
          items.add(fromAvro(schema.getElementType(), item));
        }
        return items;
      }
      case MAP: {
        final Map<String, Object> entries = Maps.newLinkedHashMap();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          entries.put(entry.getKey().toString(), fromAvro(schema.getValueType(), entry.getValue()));
        }
        return entries;
      }
      default:
        return value;
    }
  }

  /**
   * Converts a record value to the Avro representation of a schema.
   *
   * @param schema Target schema.
   * @param value Normalized record value.
   * @return the Avro value.
   * @throws IllegalArgumentException if the value does not fit the schema.
   */
  private static Object toAvro(Schema schema, Object value) {
    switch (schema.getType()) {
      case UNION:
        for (Schema branch : schema.getTypes()) {
          if (fits(branch, value)) {
            return toAvro(branch, value);
          }
        }
        throw new IllegalArgumentException("No branch of " + schema + " fits " + value);
      case NULL:
        Preconditions.checkArgument(null == value, "Expected null, got %s", value);
        return null;
      case BOOLEAN:
        return (Boolean) value;
      case INT:
        return ((Long) value).intValue();
      case LONG:
        return (Long) value;
      case FLOAT:
        return ((Number) value).floatValue();
      case DOUBLE:
        return ((Number) value).doubleValue();
      case STRING:
        return (String) value;
      case BYTES:
        return ByteBuffer.wrap(((String) value).getBytes(Charsets.UTF_8));
      case ENUM:
        return new GenericData.EnumSymbol(schema, (String) value);
      case ARRAY: {
        final List<?> items = (List<?>) value;
        final GenericData.Array<Object> array =
            new GenericData.Array<Object>(items.size(), schema);
        for (Object item : items) {
          array.add(toAvro(schema.getElementType(), item));
        }
        return array;
      }
      case MAP: {
        final Map<String, Object> map = Maps.newLinkedHashMap();
        for (Map.Entry<String, Object> entry : ((Record) value).asMap().entrySet()) {
          map.put(entry.getKey(), toAvro(schema.getValueType(), entry.getValue()));
        }
        return map;
      }
      case RECORD: {
        final Record record = (Record) value;
        final GenericData.Record datum = new GenericData.Record(schema);
        for (Schema.Field field : schema.getFields()) {
          datum.put(field.pos(), toAvro(field.schema(), record.get(field.name())));
        }
        return datum;
      }
      default:
        throw new IllegalArgumentException("Unsupported schema type " + schema.getType());
    }
  }

  /**
   * Whether a record value fits a non-union schema.
   *
   * @param schema The schema.
   * @param value The value.
   * @return true if {@link #toAvro} can convert the value.
   */
  private static boolean fits(Schema schema, Object value) {
    switch (schema.getType()) {
      case NULL:
        return null == value;
      case BOOLEAN:
        return value instanceof Boolean;
      case INT:
        return value instanceof Long
            && (Long) value >= Integer.MIN_VALUE && (Long) value <= Integer.MAX_VALUE;
      case LONG:
        return value instanceof Long;
      case FLOAT:
      case DOUBLE:
        return value instanceof Double;
      case STRING:
      case BYTES:
        return value instanceof String;
      case ENUM:
        return value instanceof String && schema.hasEnumSymbol((String) value);
      case ARRAY:
        return value instanceof List;
      case MAP:
      case RECORD:
        return value instanceof Record;
      default:
        return false;
    }
  }

  /** Reader over the single record of a message. */
  private static final class SingleRecordReader implements RecordReader {
    private final SchemaDescriptor mDescriptor;
    private Record mRecord;

    /**
     * Wraps a record.
     *
     * @param descriptor Its descriptor.
     * @param record The record.
     */
    private SingleRecordReader(SchemaDescriptor descriptor, Record record) {
      mDescriptor = descriptor;
      mRecord = record;
    }

    /** {@inheritDoc} */
    @Override
    public SchemaDescriptor getDescriptor() {
      return mDescriptor;
    }

    /** {@inheritDoc} */
    @Override
    public Record next() {
      final Record record = mRecord;
      mRecord = null;
      return record;
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
      mRecord = null;
    }
  }
}
