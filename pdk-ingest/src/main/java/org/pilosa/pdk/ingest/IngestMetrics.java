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

import java.util.Locale;
import java.util.Map;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Pipeline counters, kept in a Dropwizard {@link MetricRegistry} so they can be reported with any
 * of its reporters.
 */
public final class IngestMetrics {
  /** Prefix of every counter name in the registry. */
  public static final String PREFIX = "pdk.ingest";

  private final MetricRegistry mRegistry;
  private final Map<IngestCounter, Counter> mCounters;

  /**
   * Registers the pipeline counters in a registry.
   *
   * @param registry The registry to register with.
   */
  private IngestMetrics(MetricRegistry registry) {
    mRegistry = registry;
    final Map<IngestCounter, Counter> counters = Maps.newEnumMap(IngestCounter.class);
    for (IngestCounter counter : IngestCounter.values()) {
      counters.put(counter, registry.counter(nameOf(counter)));
    }
    mCounters = counters;
  }

  /** @return counters backed by a new registry. */
  public static IngestMetrics create() {
    return new IngestMetrics(new MetricRegistry());
  }

  /**
   * Creates counters in an existing registry.
   *
   * @param registry The registry to register with.
   * @return the counters.
   */
  public static IngestMetrics create(MetricRegistry registry) {
    return new IngestMetrics(registry);
  }

  /**
   * Gets the registry name of a counter.
   *
   * @param counter The counter.
   * @return its name, for example <code>pdk.ingest.records_admitted</code>.
   */
  public static String nameOf(IngestCounter counter) {
    return MetricRegistry.name(PREFIX, counter.name().toLowerCase(Locale.ROOT));
  }

  /**
   * Increments a counter by one.
   *
   * @param counter The counter.
   */
  public void increment(IngestCounter counter) {
    mCounters.get(counter).inc();
  }

  /**
   * Increments a counter.
   *
   * @param counter The counter.
   * @param amount How much to add.
   */
  public void increment(IngestCounter counter, long amount) {
    mCounters.get(counter).inc(amount);
  }

  /**
   * Reads a counter.
   *
   * @param counter The counter.
   * @return its current count.
   */
  public long get(IngestCounter counter) {
    return mCounters.get(counter).getCount();
  }

  /** @return the current value of every counter. */
  public ImmutableMap<IngestCounter, Long> snapshot() {
    final ImmutableMap.Builder<IngestCounter, Long> builder = ImmutableMap.builder();
    for (Map.Entry<IngestCounter, Counter> entry : mCounters.entrySet()) {
      builder.put(entry.getKey(), entry.getValue().getCount());
    }
    return builder.build();
  }

  /** @return the backing registry. */
  public MetricRegistry getRegistry() {
    return mRegistry;
  }
}
