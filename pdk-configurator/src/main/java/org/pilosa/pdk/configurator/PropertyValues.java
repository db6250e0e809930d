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

package org.pilosa.pdk.configurator;

import java.util.Collection;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Converts textual property values into the types a {@link PdkConf} variable may have.
 */
final class PropertyValues {
  /** Splits list-valued properties. */
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  /** Utility class. */
  private PropertyValues() {}

  /**
   * Whether a variable of the given type can be populated.
   *
   * @param type The declared type of the field or setter parameter.
   * @return true if {@link #convert} understands the type.
   */
  static boolean isSupported(Class<?> type) {
    return boolean.class == type
        || int.class == type
        || long.class == type
        || float.class == type
        || double.class == type
        || type.isAssignableFrom(String.class)
        || type.isAssignableFrom(List.class)
        || type.isAssignableFrom(Collection.class)
        || String[].class == type;
  }

  /**
   * Converts raw text into a value of the requested type.
   *
   * @param type The declared type of the variable.
   * @param raw The raw property text, never null.
   * @return The converted value, boxed for primitives.
   * @throws NumberFormatException if a numeric type cannot be parsed.
   */
  static Object convert(Class<?> type, String raw) {
    final String trimmed = raw.trim();
    if (boolean.class == type) {
      return Boolean.parseBoolean(trimmed);
    } else if (int.class == type) {
      return Integer.parseInt(trimmed);
    } else if (long.class == type) {
      return Long.parseLong(trimmed);
    } else if (float.class == type) {
      return Float.parseFloat(trimmed);
    } else if (double.class == type) {
      return Double.parseDouble(trimmed);
    } else if (type.isAssignableFrom(String.class)) {
      return raw;
    } else if (type.isAssignableFrom(List.class) || type.isAssignableFrom(Collection.class)) {
      return ImmutableList.copyOf(LIST_SPLITTER.split(raw));
    } else if (String[].class == type) {
      final List<String> items = ImmutableList.copyOf(LIST_SPLITTER.split(raw));
      return items.toArray(new String[items.size()]);
    }
    throw new PdkConfigurationException("Unsupported type for @PdkConf: " + type.getName());
  }
}
