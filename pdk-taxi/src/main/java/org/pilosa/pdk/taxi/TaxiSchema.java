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

import com.google.common.collect.ImmutableList;

import org.pilosa.pdk.ingest.mapping.FieldDescriptor;
import org.pilosa.pdk.ingest.mapping.FieldType;
import org.pilosa.pdk.ingest.mapping.InvalidSchemaDescriptorException;
import org.pilosa.pdk.ingest.mapping.SchemaDescriptor;

/**
 * Columns of the yellow cab trip files and how each maps to the taxi index.
 *
 * <p>The files carry a header row. Columns absent from the descriptor, such as
 * <code>dropoff_datetime</code> or <code>mta_tax</code>, are read and ignored.</p>
 */
public final class TaxiSchema {
  /** Private c'tor denies instantiation. */
  private TaxiSchema() {
  }

  /** Trip provider code. */
  public static final String VENDOR_ID = "vendor_id";

  /** Pickup time; every set bit of the trip is recorded at this time. */
  public static final String PICKUP_DATETIME = "pickup_datetime";

  /** Number of passengers. */
  public static final String PASSENGER_COUNT = "passenger_count";

  /** Trip distance in miles, kept in hundredths. */
  public static final String TRIP_DISTANCE = "trip_distance";

  /** Pickup longitude. */
  public static final String PICKUP_LONGITUDE = "pickup_longitude";

  /** Pickup latitude. */
  public static final String PICKUP_LATITUDE = "pickup_latitude";

  /** Numeric fare rate code. */
  public static final String RATE_CODE = "rate_code";

  /** Whether the trip was held in the vehicle before being sent. */
  public static final String STORE_AND_FWD_FLAG = "store_and_fwd_flag";

  /** Drop-off longitude. */
  public static final String DROPOFF_LONGITUDE = "dropoff_longitude";

  /** Drop-off latitude. */
  public static final String DROPOFF_LATITUDE = "dropoff_latitude";

  /** Payment type code, CSH or CRD. */
  public static final String PAYMENT_TYPE = "payment_type";

  /** Fare in dollars, kept in cents. */
  public static final String FARE_AMOUNT = "fare_amount";

  /** Tip in dollars, kept in cents. */
  public static final String TIP_AMOUNT = "tip_amount";

  /** Total in dollars, kept in cents. */
  public static final String TOTAL_AMOUNT = "total_amount";

  /** Pattern of the pickup times. */
  public static final String TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

  /** Coordinates are kept with four decimals. */
  private static final double COORDINATE_SCALE = 10000.0;

  /** Amounts are kept in cents. */
  private static final double CENTS = 100.0;

  /** Largest amount in cents: one million dollars. */
  private static final long MAX_CENTS = 100000000L;

  /**
   * Builds the descriptor of trip records.
   *
   * @return the descriptor.
   */
  public static SchemaDescriptor descriptor() {
    try {
      return SchemaDescriptor.create(ImmutableList.of(
          FieldDescriptor.of(VENDOR_ID, FieldType.STRING),
          FieldDescriptor.builder(PICKUP_DATETIME, FieldType.TIMESTAMP)
              .withTimeFormat(TIME_FORMAT)
              .build(),
          FieldDescriptor.of(PASSENGER_COUNT, FieldType.INT),
          FieldDescriptor.builder(TRIP_DISTANCE, FieldType.FLOAT)
              .withMultiplier(CENTS)
              .withRange(0L, MAX_CENTS)
              .build(),
          coordinate(PICKUP_LONGITUDE, 180.0),
          coordinate(PICKUP_LATITUDE, 90.0),
          FieldDescriptor.of(RATE_CODE, FieldType.INT),
          FieldDescriptor.of(STORE_AND_FWD_FLAG, FieldType.STRING),
          coordinate(DROPOFF_LONGITUDE, 180.0),
          coordinate(DROPOFF_LATITUDE, 90.0),
          FieldDescriptor.of(PAYMENT_TYPE, FieldType.STRING),
          amount(FARE_AMOUNT),
          amount(TIP_AMOUNT),
          amount(TOTAL_AMOUNT)));
    } catch (InvalidSchemaDescriptorException isde) {
      // Field names are distinct constants and only one field is a timestamp.
      throw new IllegalStateException(isde);
    }
  }

  /**
   * Describes a coordinate, shifted to be non-negative.
   *
   * @param name Field name.
   * @param bound Largest absolute value of the coordinate.
   * @return the descriptor.
   */
  private static FieldDescriptor coordinate(String name, double bound) {
    return FieldDescriptor.builder(name, FieldType.FLOAT)
        .withOffset(-bound)
        .withMultiplier(COORDINATE_SCALE)
        .withRange(0L, Math.round(2 * bound * COORDINATE_SCALE))
        .build();
  }

  /**
   * Describes an amount in dollars.
   *
   * @param name Field name.
   * @return the descriptor.
   */
  private static FieldDescriptor amount(String name) {
    return FieldDescriptor.builder(name, FieldType.FLOAT)
        .withMultiplier(CENTS)
        .withRange(0L, MAX_CENTS)
        .build();
  }
}
