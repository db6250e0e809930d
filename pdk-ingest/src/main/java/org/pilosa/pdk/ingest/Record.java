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

import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A decoded input row: an unordered mapping from field name to value.
 *
 * <p>Values are normalized on the way in, so that a record built from a delimited text line and
 * one built from a binary message compare equal when they carry the same data:</p>
 * <ul>
 *   <li>null stays null.</li>
 *   <li>Booleans stay {@link Boolean}.</li>
 *   <li>Integral numbers become {@link Long}; floating point numbers become {@link Double}.</li>
 *   <li>Character sequences become {@link String}; byte buffers are read as UTF-8 text.</li>
 *   <li>Lists become a list of strings, or a list of records when the elements are maps or
 *     records.</li>
 *   <li>A union wrapper made by {@link #union(String, Object)} is replaced by its effective
 *     value; maps become nested records, whatever their size.</li>
 * </ul>
 *
 * <p>Records are immutable.</p>
 */
public final class Record {
  /** Normalized field values, nulls included. */
  private final Map<String, Object> mValues;

  /**
   * Builds a record over already normalized values.
   *
   * @param values The normalized values.
   */
  private Record(Map<String, Object> values) {
    mValues = Collections.unmodifiableMap(values);
  }

  /**
   * Builds a record from a map of raw values.
   *
   * @param values Field name to raw value.
   * @return a new record.
   */
  public static Record of(Map<String, ?> values) {
    final Builder builder = builder();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /**
   * Wraps the value of one branch of a union. A record holds the effective value only; the
   * wrapper keeps union values apart from maps on the way in.
   *
   * @param branch Name of the branch type, such as <code>boolean</code>.
   * @param value Raw value of the branch.
   * @return the wrapper, to be passed to {@link Builder#put(String, Object)}.
   */
  public static Object union(String branch, Object value) {
    return new UnionValue(branch, value);
  }

  /** A raw union value tagged with its branch. */
  private static final class UnionValue {
    private final String mBranch;
    private final Object mValue;

    /**
     * @param branch Name of the branch type.
     * @param value Raw value.
     */
    private UnionValue(String branch, Object value) {
      mBranch = Preconditions.checkNotNull(branch);
      mValue = value;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
      return "{" + mBranch + ": " + mValue + "}";
    }
  }

  /** @return a new record builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Accumulates fields of a record. */
  public static final class Builder {
    private final Map<String, Object> mValues = Maps.newLinkedHashMap();

    /** Use {@link Record#builder()}. */
    private Builder() {}

    /**
     * Sets a field.
     *
     * @param name Field name.
     * @param value Raw value; normalized according to the rules of {@link Record}.
     * @return this builder.
     */
    public Builder put(String name, Object value) {
      Preconditions.checkNotNull(name, "Record field names may not be null.");
      mValues.put(name, normalize(value));
      return this;
    }

    /**
     * Copies every field of a record into this builder.
     *
     * @param record The record to copy.
     * @return this builder.
     */
    public Builder putAll(Record record) {
      mValues.putAll(record.mValues);
      return this;
    }

    /** @return the record. */
    public Record build() {
      return new Record(Maps.newLinkedHashMap(mValues));
    }
  }

  /**
   * Normalizes a raw value.
   *
   * @param value The raw value.
   * @return the normalized value.
   */
  static Object normalize(Object value) {
    if (null == value || value instanceof Boolean || value instanceof Record) {
      return value;
    } else if (value instanceof Double || value instanceof Float) {
      return ((Number) value).doubleValue();
    } else if (value instanceof Number) {
      return ((Number) value).longValue();
    } else if (value instanceof CharSequence) {
      return value.toString();
    } else if (value instanceof ByteBuffer) {
      final ByteBuffer buffer = ((ByteBuffer) value).duplicate();
      final byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return new String(bytes, Charsets.UTF_8);
    } else if (value instanceof UnionValue) {
      return normalize(((UnionValue) value).mValue);
    } else if (value instanceof Map) {
      final Builder nested = builder();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        nested.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      return nested.build();
    } else if (value instanceof Collection) {
      return normalizeList((Collection<?>) value);
    } else if (value instanceof Object[]) {
      return normalizeList(Lists.newArrayList((Object[]) value));
    }
    // Enum symbols and anything else with a meaningful textual form.
    return value.toString();
  }

  /**
   * Normalizes a list value into either a list of strings or a list of records.
   *
   * @param items The raw elements.
   * @return the normalized, unmodifiable list.
   */
  private static List<?> normalizeList(Collection<?> items) {
    boolean records = false;
    final List<Object> normalized = Lists.newArrayListWithCapacity(items.size());
    for (Object item : items) {
      final Object element = normalize(item);
      if (element instanceof Record) {
        records = true;
      }
      normalized.add(element);
    }
    if (!records) {
      final List<String> strings = Lists.newArrayListWithCapacity(normalized.size());
      for (Object element : normalized) {
        strings.add(null == element ? null : element.toString());
      }
      return Collections.unmodifiableList(strings);
    }
    return Collections.unmodifiableList(normalized);
  }

  /**
   * Gets the value of a field.
   *
   * @param name Field name.
   * @return the value, or null if the field is absent or null.
   */
  public Object get(String name) {
    return mValues.get(name);
  }

  /**
   * Whether the record carries the field, possibly with a null value.
   *
   * @param name Field name.
   * @return true if the field is present.
   */
  public boolean contains(String name) {
    return mValues.containsKey(name);
  }

  /** @return the field names of this record. */
  public Set<String> getFieldNames() {
    return mValues.keySet();
  }

  /** @return the number of fields in this record. */
  public int size() {
    return mValues.size();
  }

  /** @return an unmodifiable view of the field values. */
  public Map<String, Object> asMap() {
    return mValues;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Record)) {
      return false;
    }
    return mValues.equals(((Record) other).mValues);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return mValues.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return mValues.toString();
  }
}
