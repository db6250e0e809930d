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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an instance variable or a single-argument setter that the {@link PdkConfigurator}
 * should populate with a value read from a {@link java.util.Properties} instance.
 *
 * <pre>
 * public class Foo {
 *   &#64;PdkConf(key="batch-size", usage="Mutations per batch", defaultValue="1000")
 *   private int mBatchSize;
 * }
 *
 * PdkConfigurator.configure(foo, properties);
 * </pre>
 *
 * @see PdkConfigurator
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface PdkConf {
  /**
   * The property name this variable is read from.
   *
   * <p>This field is required.</p>
   */
  String key();

  /** Documents the usage of this configuration variable. */
  String usage() default "";

  /**
   * The default value, in its textual form. When empty and the property is absent, the
   * variable keeps whatever value it was initialized with.
   */
  String defaultValue() default "";
}
