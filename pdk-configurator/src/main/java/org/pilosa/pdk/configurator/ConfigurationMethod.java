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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single-argument method annotated with {@link PdkConf}.
 */
final class ConfigurationMethod {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationMethod.class);

  private final Method mMethod;
  private final PdkConf mAnnotation;

  /**
   * Constructs a ConfigurationMethod instance.
   *
   * @param method The method that has the annotation on it.
   * @param annotation The annotation on the method.
   */
  ConfigurationMethod(Method method, PdkConf annotation) {
    mMethod = method;
    mAnnotation = annotation;
  }

  /** @return the property key declared by the annotation. */
  String getKey() {
    return mAnnotation.key();
  }

  /** @return the annotation on the method. */
  PdkConf getAnnotation() {
    return mAnnotation;
  }

  /**
   * Calls the method of an object with the value read from a set of properties.
   *
   * <p>The method is not called when the property is absent and has no declared default. When the
   * property cannot be parsed the declared default is passed instead, if there is one.</p>
   *
   * @param instance The object to call the method on.
   * @param properties The properties to read from.
   * @throws IllegalAccessException If the method cannot be called on the object.
   */
  void call(Object instance, Properties properties) throws IllegalAccessException {
    final String key = getKey();
    if (null == key || key.isEmpty()) {
      throw new PdkConfigurationException("Missing 'key' attribute of @PdkConf on "
          + instance.getClass().getName() + "." + mMethod.getName());
    }

    final Class<?>[] parameterTypes = mMethod.getParameterTypes();
    if (1 != parameterTypes.length) {
      throw new PdkConfigurationException(
          "Methods annotated with @PdkConf must have exactly one parameter: "
          + instance.getClass().getName() + "." + mMethod.getName());
    }
    final Class<?> parameterType = parameterTypes[0];
    if (!PropertyValues.isSupported(parameterType)) {
      throw new PdkConfigurationException(
          "Unsupported method parameter type annotated by @PdkConf: "
          + instance.getClass().getName() + "." + mMethod.getName());
    }

    final String defaultValue = mAnnotation.defaultValue();
    final String raw = properties.getProperty(key, defaultValue.isEmpty() ? null : defaultValue);
    if (null == raw) {
      return;
    }

    Object value;
    try {
      value = PropertyValues.convert(parameterType, raw);
    } catch (NumberFormatException nfe) {
      if (defaultValue.isEmpty() || raw.equals(defaultValue)) {
        LOG.warn("Ignoring unparseable value '{}' for property {}.", raw, key);
        return;
      }
      LOG.warn("Unparseable value '{}' for property {}; using default '{}'.",
          raw, key, defaultValue);
      value = PropertyValues.convert(parameterType, defaultValue);
    }

    mMethod.setAccessible(true);
    try {
      mMethod.invoke(instance, value);
    } catch (InvocationTargetException ite) {
      throw new PdkConfigurationException(ite.getCause());
    }
  }
}
