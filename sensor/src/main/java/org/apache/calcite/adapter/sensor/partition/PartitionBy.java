/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.sensor.partition;

import org.apache.calcite.adapter.sensor.SensorConfigException;

import java.util.Locale;

/**
 * Granularity used when enumerating partitions for a date range.
 *
 * <pre>{@code
 * partition_by: month   # or "year"
 * }</pre>
 *
 * @see PartitionIterator
 */
public enum PartitionBy {
  /** One partition per calendar year. */
  YEAR,

  /** One partition per calendar month. */
  MONTH;

  /**
   * Parses a granularity from its configuration name.
   *
   * @param value "year" or "month" (case-insensitive)
   * @return PartitionBy
   * @throws SensorConfigException if the name is unknown
   */
  public static PartitionBy fromString(String value) {
    if (value == null) {
      throw new SensorConfigException("Wrong partition_by argument 'null'");
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
    case "year":
      return YEAR;
    case "month":
      return MONTH;
    default:
      throw new SensorConfigException("Wrong partition_by argument '" + value + "'");
    }
  }
}
