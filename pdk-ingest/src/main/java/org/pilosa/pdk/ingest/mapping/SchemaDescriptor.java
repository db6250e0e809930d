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

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.pilosa.pdk.ingest.FieldSpec;

/**
 * Per-field mapping metadata of a record type. Immutable, and shared by every mapper worker.
 *
 * <p>Sample JSON descriptor:</p>
 * <pre><code>
 * {
 *   "fields" : [
 *     { "name" : "vendor_id", "type" : "string" },
 *     { "name" : "pickup_datetime", "type" : "timestamp", "format" : "yyyy-MM-dd HH:mm:ss" },
 *     { "name" : "passenger_count", "type" : "int" },
 *     { "name" : "fare_amount", "type" : "float", "multiplier" : 100, "min" : 0, "max" : 100000 },
 *     { "name" : "zip", "type" : "string", "rowIds" : true },
 *     { "name" : "tags", "type" : "string_array" },
 *     { "name" : "active", "type" : "bool", "nullable" : false }
 *   ]
 * }
 * </code></pre>
 *
 * <p>At most one field may be a timestamp. When there is one, set fields also record time.</p>
 */
public final class SchemaDescriptor {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Fields in declaration order. */
  private final ImmutableList<FieldDescriptor> mFields;

  /** Field name to descriptor. */
  private final ImmutableMap<String, FieldDescriptor> mFieldMap;

  /** Field name to index layout, for fields that produce mutations. */
  private final ImmutableMap<String, FieldSpec> mFieldSpecs;

  /** The timestamp field, or null. */
  private final FieldDescriptor mTimestampField;

  /**
   * Builds a descriptor.
   *
   * @param fields Field descriptors in declaration order.
   * @throws InvalidSchemaDescriptorException if names repeat or there is more than one timestamp.
   */
  private SchemaDescriptor(List<FieldDescriptor> fields)
      throws InvalidSchemaDescriptorException {
    final Map<String, FieldDescriptor> fieldMap = Maps.newLinkedHashMap();
    FieldDescriptor timestampField = null;
    for (FieldDescriptor field : fields) {
      if (null != fieldMap.put(field.getName(), field)) {
        throw new InvalidSchemaDescriptorException(
            String.format("Duplicate field '%s'.", field.getName()));
      }
      if (field.getType() == FieldType.TIMESTAMP) {
        if (null != timestampField) {
          throw new InvalidSchemaDescriptorException(String.format(
              "Only one timestamp field is allowed, got '%s' and '%s'.",
              timestampField.getName(), field.getName()));
        }
        timestampField = field;
      }
    }
    mFields = ImmutableList.copyOf(fields);
    mFieldMap = ImmutableMap.copyOf(fieldMap);
    mTimestampField = timestampField;

    final boolean timed = null != timestampField;
    final ImmutableMap.Builder<String, FieldSpec> specs = ImmutableMap.builder();
    for (FieldDescriptor field : fields) {
      final FieldSpec spec = specOf(field, timed);
      if (null != spec) {
        specs.put(field.getName(), spec);
      }
    }
    mFieldSpecs = specs.build();
  }

  /**
   * Creates a descriptor.
   *
   * @param fields Field descriptors in declaration order.
   * @return the descriptor.
   * @throws InvalidSchemaDescriptorException if names repeat or there is more than one timestamp.
   */
  public static SchemaDescriptor create(List<FieldDescriptor> fields)
      throws InvalidSchemaDescriptorException {
    return new SchemaDescriptor(Preconditions.checkNotNull(fields));
  }

  /**
   * Gets the index layout a field maps to.
   *
   * @param field The field.
   * @param timed Whether the record type has a timestamp.
   * @return the layout, or null for fields that produce no mutation of their own.
   */
  private static FieldSpec specOf(FieldDescriptor field, boolean timed) {
    switch (field.getType()) {
      case BOOL:
        return FieldSpec.set(field.getName(), false, timed);
      case INT:
      case FLOAT:
        if (field.hasRange()) {
          return FieldSpec.integer(field.getName(), field.getMin(), field.getMax());
        }
        return FieldSpec.set(field.getName(), false, timed);
      case STRING:
        return FieldSpec.set(field.getName(), !field.hasRowIds(), timed);
      case STRING_ARRAY:
        return FieldSpec.set(field.getName(), true, timed);
      case TIMESTAMP:
      case RECORD:
        return null;
      default:
        throw new IllegalStateException("Unhandled field type: " + field.getType());
    }
  }

  /**
   * Parses a JSON descriptor.
   *
   * @param input Stream holding the JSON document.
   * @return the descriptor.
   * @throws IOException if the stream cannot be read or the document is invalid.
   */
  public static SchemaDescriptor fromJson(InputStream input) throws IOException {
    final JsonNode root;
    try {
      root = MAPPER.readTree(input);
    } catch (JsonProcessingException jpe) {
      throw new InvalidSchemaDescriptorException("Malformed JSON descriptor.", jpe);
    }
    return fromJson(root);
  }

  /**
   * Parses a JSON descriptor.
   *
   * @param json The JSON document.
   * @return the descriptor.
   * @throws InvalidSchemaDescriptorException if the document is invalid.
   */
  public static SchemaDescriptor fromJson(String json) throws InvalidSchemaDescriptorException {
    try {
      return fromJson(MAPPER.readTree(json));
    } catch (JsonProcessingException jpe) {
      throw new InvalidSchemaDescriptorException("Malformed JSON descriptor.", jpe);
    }
  }

  /**
   * Builds a descriptor from a parsed JSON document.
   *
   * @param root The document.
   * @return the descriptor.
   * @throws InvalidSchemaDescriptorException if the document is invalid.
   */
  private static SchemaDescriptor fromJson(JsonNode root) throws InvalidSchemaDescriptorException {
    if (null == root || !root.path("fields").isArray()) {
      throw new InvalidSchemaDescriptorException("Descriptor must hold a 'fields' array.");
    }
    final List<FieldDescriptor> fields = Lists.newArrayList();
    final Iterator<JsonNode> it = root.get("fields").elements();
    while (it.hasNext()) {
      fields.add(fieldFromJson(it.next()));
    }
    return new SchemaDescriptor(fields);
  }

  /**
   * Builds a field descriptor from its JSON object.
   *
   * @param node The JSON object.
   * @return the field descriptor.
   * @throws InvalidSchemaDescriptorException if the object is invalid.
   */
  private static FieldDescriptor fieldFromJson(JsonNode node)
      throws InvalidSchemaDescriptorException {
    final String name = node.path("name").asText(null);
    if (null == name || name.isEmpty()) {
      throw new InvalidSchemaDescriptorException("Field without a name: " + node);
    }
    final FieldType type = FieldType.fromName(node.path("type").asText(""));
    if (null == type) {
      throw new InvalidSchemaDescriptorException(String.format(
          "Field '%s' has unknown type '%s'.", name, node.path("type").asText()));
    }
    final FieldDescriptor.Builder builder = FieldDescriptor.builder(name, type)
        .withNullable(node.path("nullable").asBoolean(true))
        .withRowIds(node.path("rowIds").asBoolean(false))
        .withMultiplier(node.path("multiplier").asDouble(1.0))
        .withOffset(node.path("offset").asDouble(0.0));
    if (node.has("format")) {
      builder.withTimeFormat(node.get("format").asText());
    }
    if (node.has("min") || node.has("max")) {
      if (!node.path("min").canConvertToLong() || !node.path("max").canConvertToLong()) {
        throw new InvalidSchemaDescriptorException(
            String.format("Field '%s' needs integer 'min' and 'max'.", name));
      }
      builder.withRange(node.get("min").asLong(), node.get("max").asLong());
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException iae) {
      throw new InvalidSchemaDescriptorException(iae.getMessage(), iae);
    }
  }

  /** @return this descriptor as a JSON document. */
  public String toJson() {
    final ObjectNode root = MAPPER.createObjectNode();
    final ArrayNode fields = root.putArray("fields");
    for (FieldDescriptor field : mFields) {
      final ObjectNode node = fields.addObject();
      node.put("name", field.getName());
      node.put("type", field.getType().jsonName());
      node.put("nullable", field.isNullable());
      if (field.hasRowIds()) {
        node.put("rowIds", true);
      }
      if (field.hasRange()) {
        node.put("min", field.getMin());
        node.put("max", field.getMax());
      }
      if (field.getType() == FieldType.FLOAT) {
        node.put("multiplier", field.getMultiplier());
        node.put("offset", field.getOffset());
      }
      if (field.getType() == FieldType.TIMESTAMP) {
        node.put("format", field.getTimeFormat());
      }
    }
    return root.toString();
  }

  /** @return the fields in declaration order. */
  public List<FieldDescriptor> getFields() {
    return mFields;
  }

  /**
   * Gets a field.
   *
   * @param name Field name.
   * @return the field descriptor, or null if the field is not declared.
   */
  public FieldDescriptor getField(String name) {
    return mFieldMap.get(name);
  }

  /**
   * Gets the index layout of a field.
   *
   * @param name Field name.
   * @return the layout, or null if the field is not declared or produces no mutation of its own.
   */
  public FieldSpec getFieldSpec(String name) {
    return mFieldSpecs.get(name);
  }

  /** @return the timestamp field, or null. */
  public FieldDescriptor getTimestampField() {
    return mTimestampField;
  }

  /** @return whether set fields record time. */
  public boolean isTimed() {
    return null != mTimestampField;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    return other instanceof SchemaDescriptor && mFields.equals(((SchemaDescriptor) other).mFields);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return mFields.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return toJson();
  }
}
