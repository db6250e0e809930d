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

package org.pilosa.pdk.taxi;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import org.pilosa.pdk.ingest.FieldSpec;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;

public class TestTaxiSchema {
  @Test
  public void testDescriptor() {
    final SchemaDescriptor descriptor = TaxiSchema.descriptor();
    assertEquals(14, descriptor.getFields().size());
    assertTrue(descriptor.isTimed());
    assertEquals(TaxiSchema.PICKUP_DATETIME, descriptor.getTimestampField().getName());
    assertNull(descriptor.getFieldSpec(TaxiSchema.PICKUP_DATETIME));
  }

  @Test
  public void testLayouts() {
    final SchemaDescriptor descriptor = TaxiSchema.descriptor();
    assertEquals(FieldSpec.set(TaxiSchema.VENDOR_ID, true, true),
        descriptor.getFieldSpec(TaxiSchema.VENDOR_ID));
    assertEquals(FieldSpec.set(TaxiSchema.PASSENGER_COUNT, false, true),
        descriptor.getFieldSpec(TaxiSchema.PASSENGER_COUNT));
    assertEquals(FieldSpec.integer(TaxiSchema.FARE_AMOUNT, 0L, 100000000L),
        descriptor.getFieldSpec(TaxiSchema.FARE_AMOUNT));
    assertEquals(FieldSpec.integer(TaxiSchema.PICKUP_LONGITUDE, 0L, 3600000L),
        descriptor.getFieldSpec(TaxiSchema.PICKUP_LONGITUDE));
    assertEquals(FieldSpec.integer(TaxiSchema.DROPOFF_LATITUDE, 0L, 1800000L),
        descriptor.getFieldSpec(TaxiSchema.DROPOFF_LATITUDE));
  }
}
