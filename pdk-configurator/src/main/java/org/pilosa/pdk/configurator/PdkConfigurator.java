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
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * The entry point for the configurator system.
 *
 * <p>Call {@link #configure(Object, Properties)} to populate every field and setter annotated
 * with {@link PdkConf} on an object (and its superclasses) from a set of properties:</p>
 *
 * <pre>
 * public class Foo {
 *   &#64;PdkConf(key="index", usage="The index to write to", defaultValue="pdk")
 *   private String mIndex;
 * }
 *
 * final Foo foo = new Foo();
 * PdkConfigurator.configure(foo, properties);
 * // foo.mIndex now holds properties.getProperty("index", "pdk").
 * </pre>
 */
public final class PdkConfigurator {
  /** Disable the constructor for this utility class. */
  private PdkConfigurator() {}

  /**
   * Populates the annotated variables of an instance from a set of properties.
   *
   * @param instance The instance to configure.
   * @param properties The properties to read from.
   * @throws PdkConfigurationException If an annotation is misdeclared.
   */
  public static void configure(Object instance, Properties properties) {
    Preconditions.checkNotNull(instance);
    Preconditions.checkNotNull(properties);

    try {
      for (ConfigurationVariable variable : extractDeclaredVariables(instance.getClass())) {
        variable.setValue(instance, properties);
      }
      for (ConfigurationMethod method : extractDeclaredMethods(instance.getClass())) {
        method.call(instance, properties);
      }
    } catch (IllegalAccessException iae) {
      throw new PdkConfigurationException(iae);
    }
  }

  /**
   * Lists the keys declared on a class with their usage strings, for help output.
   *
   * @param clazz The class to inspect.
   * @return an ordered map from property key to usage.
   */
  public static Map<String, String> describe(Class<?> clazz) {
    final Map<String, String> usages = Maps.newTreeMap();
    for (ConfigurationVariable variable : extractDeclaredVariables(clazz)) {
      usages.put(variable.getKey(), variable.getAnnotation().usage());
    }
    for (ConfigurationMethod method : extractDeclaredMethods(clazz)) {
      usages.put(method.getKey(), method.getAnnotation().usage());
    }
    return ImmutableMap.copyOf(usages);
  }

  /**
   * Extracts the fields annotated with {@literal @}PdkConf from a class and its superclasses.
   *
   * @param clazz The class to extract declarations from.
   * @return the list of configuration variables.
   */
  private static List<ConfigurationVariable> extractDeclaredVariables(Class<?> clazz) {
    final List<ConfigurationVariable> variables = Lists.newArrayList();
    Class<?> current = clazz;
    do {
      for (Field field : current.getDeclaredFields()) {
        final PdkConf annotation = field.getAnnotation(PdkConf.class);
        if (null != annotation) {
          variables.add(new ConfigurationVariable(field, annotation));
        }
      }
    } while (null != (current = current.getSuperclass()));
    return variables;
  }

  /**
   * Extracts the methods annotated with {@literal @}PdkConf from a class and its superclasses.
   *
   * @param clazz The class to extract declarations from.
   * @return the list of configuration methods.
   */
  private static List<ConfigurationMethod> extractDeclaredMethods(Class<?> clazz) {
    final List<ConfigurationMethod> methods = Lists.newArrayList();
    Class<?> current = clazz;
    do {
      for (Method method : current.getDeclaredMethods()) {
        final PdkConf annotation = method.getAnnotation(PdkConf.class);
        if (null != annotation) {
          methods.add(new ConfigurationMethod(method, annotation));
        }
      }
    } while (null != (current = current.getSuperclass()));
    return methods;
  }
}
