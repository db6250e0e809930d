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

import java.util.List;

import com.google.common.collect.Lists;
import org.apache.avro.LogicalType;
import org.apache.avro.Schema;

/**
 * Derives schema descriptors from Avro record schemas.
 *
 * <p>Nullable unions map to their non-null branch. Mapping options come from properties of the
 * Avro field:</p>
 * <pre><code>
 * { "name" : "fare", "type" : "double", "pdk.multiplier" : 100, "pdk.min" : 0, "pdk.max" : 50000 }
 * { "name" : "zip", "type" : "string", "pdk.rowIds" : true }
 * { "name" : "seen", "type" : "long", "pdk.timestamp" : true }
 * </code></pre>
 *
 * <p>Longs with the <code>timestamp-millis</code> logical type are timestamps as well.</p>
 */
public final class AvroSchemaDescriptors {
  public static final String PROP_MIN = "pdk.min";
  public static final String PROP_MAX = "pdk.max";
  public static final String PROP_MULTIPLIER = "pdk.multiplier";
  public static final String PROP_OFFSET = "pdk.offset";
  public static final String PROP_ROW_IDS = "pdk.rowIds";
  public static final String PROP_TIMESTAMP = "pdk.timestamp";

  /** Utility class. */
  private AvroSchemaDescriptors() {}

  /**
   * Derives the descriptor of an Avro record schema.
   *
   * @param schema The record schema.
   * @return the descriptor.
   * @throws InvalidSchemaDescriptorException if the schema is not a record or its mapping
   *     properties are inconsistent.
   */
  public static SchemaDescriptor fromSchema(Schema schema)
      throws InvalidSchemaDescriptorException {
    if (schema.getType() != Schema.Type.RECORD) {
      throw new InvalidSchemaDescriptorException(
          "Expected a record schema, got " + schema.getType());
    }
    final List<FieldDescriptor> fields = Lists.newArrayList();
    for (Schema.Field field : schema.getFields()) {
      fields.add(fromField(field));
    }
    return SchemaDescriptor.create(fields);
  }

  /**
   * Derives the descriptor of one field.
   *
   * @param field The Avro field.
   * @return the field descriptor.
   * @throws InvalidSchemaDescriptorException if its mapping properties are inconsistent.
   */
  private static FieldDescriptor fromField(Schema.Field field)
      throws InvalidSchemaDescriptorException {
    Schema schema = field.schema();
    boolean nullable = false;
    if (schema.getType() == Schema.Type.UNION) {
      final List<Schema> branches = Lists.newArrayList();
      for (Schema branch : schema.getTypes()) {
        if (branch.getType() == Schema.Type.NULL) {
          nullable = true;
        } else {
          branches.add(branch);
        }
      }
      if (branches.size() == 1) {
        schema = branches.get(0);
      } else {
        // Mixed scalar branches are mapped by their text.
        return FieldDescriptor.builder(field.name(), mixedUnionType(branches))
            .withNullable(nullable)
            .build();
      }
    } else if (schema.getType() == Schema.Type.NULL) {
      nullable = true;
    }

    final FieldDescriptor.Builder builder =
        FieldDescriptor.builder(field.name(), typeOf(field, schema)).withNullable(nullable);
    try {
      if (isTrue(field, PROP_ROW_IDS)) {
        builder.withRowIds(true);
      }
      final Number multiplier = numberProp(field, PROP_MULTIPLIER);
      if (null != multiplier) {
        builder.withMultiplier(multiplier.doubleValue());
      }
      final Number offset = numberProp(field, PROP_OFFSET);
      if (null != offset) {
        builder.withOffset(offset.doubleValue());
      }
      final Number min = numberProp(field, PROP_MIN);
      final Number max = numberProp(field, PROP_MAX);
      if (null != min || null != max) {
        if (null == min || null == max) {
          throw new InvalidSchemaDescriptorException(String.format(
              "Field '%s' must declare both %s and %s.", field.name(), PROP_MIN, PROP_MAX));
        }
        builder.withRange(min.longValue(), max.longValue());
      }
      return builder.build();
    } catch (IllegalArgumentException iae) {
      throw new InvalidSchemaDescriptorException(iae.getMessage(), iae);
    }
  }

  /**
   * Gets the logical type of a non-union field schema.
   *
   * @param field The Avro field, for its properties.
   * @param schema The effective schema of the field.
   * @return the logical type.
   */
  private static FieldType typeOf(Schema.Field field, Schema schema) {
    switch (schema.getType()) {
      case BOOLEAN:
        return FieldType.BOOL;
      case INT:
      case LONG:
        final LogicalType logicalType = schema.getLogicalType();
        if (isTrue(field, PROP_TIMESTAMP)
            || (null != logicalType && "timestamp-millis".equals(logicalType.getName()))) {
          return FieldType.TIMESTAMP;
        }
        return FieldType.INT;
      case FLOAT:
      case DOUBLE:
        return FieldType.FLOAT;
      case STRING:
      case ENUM:
      case BYTES:
        return FieldType.STRING;
      case ARRAY:
        final Schema.Type elementType = schema.getElementType().getType();
        if (elementType == Schema.Type.STRING || elementType == Schema.Type.ENUM) {
          return FieldType.STRING_ARRAY;
        }
        return FieldType.RECORD;
      default:
        return FieldType.RECORD;
    }
  }

  /**
   * Gets the type of a union with several non-null branches.
   *
   * @param branches The non-null branches.
   * @return STRING when every branch is a scalar, RECORD otherwise.
   */
  private static FieldType mixedUnionType(List<Schema> branches) {
    for (Schema branch : branches) {
      switch (branch.getType()) {
        case RECORD:
        case ARRAY:
        case MAP:
        case FIXED:
          return FieldType.RECORD;
        default:
          break;
      }
    }
    return FieldType.STRING;
  }

  /**
   * Reads a numeric property of a field.
   *
   * @param field The Avro field.
   * @param name Property name.
   * @return the number, or null when absent.
   * @throws InvalidSchemaDescriptorException if the property is not a number.
   */
  private static Number numberProp(Schema.Field field, String name)
      throws InvalidSchemaDescriptorException {
    final Object prop = field.getObjectProp(name);
    if (null == prop) {
      return null;
    } else if (prop instanceof Number) {
      return (Number) prop;
    } else {
      try {
        return Double.valueOf(prop.toString());
      } catch (NumberFormatException nfe) {
        throw new InvalidSchemaDescriptorException(String.format(
            "Property %s of field '%s' is not a number: %s", name, field.name(), prop));
      }
    }
  }

  /**
   * Reads a boolean property of a field.
   *
   * @param field The Avro field.
   * @param name Property name.
   * @return true if the property is set to true.
   */
  private static boolean isTrue(Schema.Field field, String name) {
    final Object prop = field.getObjectProp(name);
    return null != prop && Boolean.parseBoolean(prop.toString());
  }
}
