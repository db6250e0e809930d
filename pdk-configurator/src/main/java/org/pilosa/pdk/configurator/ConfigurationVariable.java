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

import java.lang.reflect.Field;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A field annotated with {@link PdkConf}.
 */
final class ConfigurationVariable {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationVariable.class);

  private final Field mField;
  private final PdkConf mAnnotation;

  /**
   * Constructs a ConfigurationVariable instance.
   *
   * @param field The variable that has the annotation on it.
   * @param annotation The annotation on the field.
   */
  ConfigurationVariable(Field field, PdkConf annotation) {
    mField = field;
    mAnnotation = annotation;
  }

  /** @return the property key declared by the annotation. */
  String getKey() {
    return mAnnotation.key();
  }

  /** @return the annotation on the field. */
  PdkConf getAnnotation() {
    return mAnnotation;
  }

  /**
   * Populates the field of an object with the value read from a set of properties.
   *
   * <p>If the property is absent the declared default is used; if there is no declared default
   * either, the field is left alone. A value that cannot be parsed is logged and ignored.</p>
   *
   * @param instance The object to populate.
   * @param properties The properties to read from.
   * @throws IllegalAccessException If the field cannot be set on the object.
   */
  void setValue(Object instance, Properties properties) throws IllegalAccessException {
    final String key = getKey();
    if (null == key || key.isEmpty()) {
      throw new PdkConfigurationException("Missing 'key' attribute of @PdkConf on "
          + instance.getClass().getName() + "." + mField.getName());
    }
    if (!PropertyValues.isSupported(mField.getType())) {
      throw new PdkConfigurationException("Unsupported field type annotated by @PdkConf: "
          + instance.getClass().getName() + "." + mField.getName());
    }

    String raw = properties.getProperty(key);
    if (null == raw) {
      if (mAnnotation.defaultValue().isEmpty()) {
        // Nothing set and no default; keep the initializer's value.
        return;
      }
      raw = mAnnotation.defaultValue();
    }

    final Object value;
    try {
      value = PropertyValues.convert(mField.getType(), raw);
    } catch (NumberFormatException nfe) {
      LOG.warn("Ignoring unparseable value '{}' for property {}.", raw, key);
      return;
    }

    mField.setAccessible(true);
    mField.set(instance, value);
  }
}
