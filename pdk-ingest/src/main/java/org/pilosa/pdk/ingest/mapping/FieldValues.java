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

import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Collections;
import java.util.List;
import java.util.TimeZone;

import com.google.common.primitives.Longs;

import org.pilosa.pdk.ingest.Record;

/**
 * Coerces normalized record values to the type their field is declared with. Text coming from
 * delimited input is parsed here.
 */
final class FieldValues {
  /** Utility class. */
  private FieldValues() {}

  /**
   * Reads a boolean.
   *
   * @param field Field name, for error messages.
   * @param value Normalized value.
   * @return the boolean.
   * @throws MappingException if the value is not a boolean.
   */
  static boolean toBoolean(String field, Object value) throws MappingException {
    if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof Long) {
      final long l = (Long) value;
      if (l == 0L || l == 1L) {
        return l == 1L;
      }
    } else if (value instanceof String) {
      final String text = ((String) value).trim();
      if ("true".equalsIgnoreCase(text) || "t".equalsIgnoreCase(text) || "1".equals(text)) {
        return true;
      } else if ("false".equalsIgnoreCase(text) || "f".equalsIgnoreCase(text)
          || "0".equals(text)) {
        return false;
      }
    }
    throw new MappingException(field, "not a boolean: " + value);
  }

  /**
   * Reads an integer.
   *
   * @param field Field name, for error messages.
   * @param value Normalized value.
   * @return the integer.
   * @throws MappingException if the value is not integral.
   */
  static long toLong(String field, Object value) throws MappingException {
    if (value instanceof Long) {
      return (Long) value;
    } else if (value instanceof Double) {
      final double d = (Double) value;
      if (d == Math.rint(d) && !Double.isInfinite(d)
          && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
        return (long) d;
      }
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? 1L : 0L;
    } else if (value instanceof String) {
      final Long parsed = Longs.tryParse(((String) value).trim());
      if (null != parsed) {
        return parsed;
      }
    }
    throw new MappingException(field, "not an integer: " + value);
  }

  /**
   * Reads a floating point number.
   *
   * @param field Field name, for error messages.
   * @param value Normalized value.
   * @return the number.
   * @throws MappingException if the value is not a number.
   */
  static double toDouble(String field, Object value) throws MappingException {
    if (value instanceof Double || value instanceof Long) {
      return ((Number) value).doubleValue();
    } else if (value instanceof String) {
      try {
        return Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException nfe) {
        throw new MappingException(field, "not a number: " + value);
      }
    }
    throw new MappingException(field, "not a number: " + value);
  }

  /**
   * Reads text.
   *
   * @param field Field name, for error messages.
   * @param value Normalized value.
   * @return the text.
   * @throws MappingException if the value is a list or a record.
   */
  static String toText(String field, Object value) throws MappingException {
    if (value instanceof String) {
      return (String) value;
    } else if (value instanceof Long || value instanceof Double || value instanceof Boolean) {
      return value.toString();
    }
    throw new MappingException(field, "not a scalar: " + value);
  }

  /**
   * Reads a list of strings. A single scalar reads as a list of one.
   *
   * @param field Field name, for error messages.
   * @param value Normalized value.
   * @return the strings.
   * @throws MappingException if the value holds records.
   */
  @SuppressWarnings("unchecked")
  static List<String> toStrings(String field, Object value) throws MappingException {
    if (value instanceof List) {
      final List<?> list = (List<?>) value;
      for (Object element : list) {
        if (element instanceof Record) {
          throw new MappingException(field, "list of records where strings were expected");
        }
      }
      return (List<String>) list;
    }
    return Collections.singletonList(toText(field, value));
  }

  /**
   * Reads a timestamp.
   *
   * @param field The timestamp field.
   * @param value Normalized value: milliseconds since the epoch, or text in the field's format.
   * @return milliseconds since the epoch.
   * @throws MappingException if the value cannot be read.
   */
  static long toTimestamp(FieldDescriptor field, Object value) throws MappingException {
    if (value instanceof Long) {
      return (Long) value;
    } else if (value instanceof String) {
      final String text = ((String) value).trim();
      final Long millis = Longs.tryParse(text);
      if (null != millis) {
        return millis;
      }
      // SimpleDateFormat is not thread safe.
      final SimpleDateFormat format = new SimpleDateFormat(field.getTimeFormat());
      format.setTimeZone(TimeZone.getTimeZone("UTC"));
      format.setLenient(false);
      try {
        return format.parse(text).getTime();
      } catch (ParseException pe) {
        throw new MappingException(field.getName(),
            String.format("'%s' does not match format '%s'", text, field.getTimeFormat()));
      }
    }
    throw new MappingException(field.getName(), "not a timestamp: " + value);
  }
}
