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

import org.apache.calcite.adapter.sensor.InvalidRangeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a date range into the partitions that intersect it.
 *
 * <p>For {@link PartitionBy#YEAR} every calendar year from the start's
 * year to the end's year is produced. For {@link PartitionBy#MONTH} every
 * calendar month between the two bounds is produced, including the
 * partially covered months at either end. Years and months are read from
 * each bound in its own zone.
 *
 * <p>Example:
 * <pre>{@code
 * List<Partition> partitions = PartitionIterator.enumerate(PartitionBy.MONTH,
 *     ZonedDateTime.parse("2020-02-15T00:00:00Z"),
 *     ZonedDateTime.parse("2020-04-02T00:00:00Z"));
 * // [MonthPartition(2020, 2), MonthPartition(2020, 3), MonthPartition(2020, 4)]
 * }</pre>
 */
public final class PartitionIterator {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionIterator.class);

  private PartitionIterator() {
  }

  /**
   * Enumerates partitions covering {@code [start, end]} in ascending order.
   *
   * @param partitionBy Granularity
   * @param start Range start
   * @param end Range end
   * @return Ascending partitions, never empty
   * @throws InvalidRangeException if start is after end
   */
  public static List<Partition> enumerate(PartitionBy partitionBy, ZonedDateTime start,
      ZonedDateTime end) {
    if (start.isAfter(end)) {
      throw new InvalidRangeException("start_period bigger then end_period. '"
          + start + "' > '" + end + "'");
    }
    List<Partition> partitions = new ArrayList<Partition>();
    int startYear = start.getYear();
    int endYear = end.getYear();
    switch (partitionBy) {
    case YEAR:
      for (int year = startYear; year <= endYear; year++) {
        partitions.add(Partition.year(year));
      }
      break;
    case MONTH:
      for (int year = startYear; year <= endYear; year++) {
        for (int month = 1; month <= 12; month++) {
          if ((year == startYear && month < start.getMonthValue())
              || (year == endYear && month > end.getMonthValue())) {
            continue;
          }
          partitions.add(Partition.month(year, month));
        }
      }
      break;
    default:
      throw new IllegalArgumentException("Unsupported partition granularity: " + partitionBy);
    }
    LOGGER.debug("Range {} - {} split by {} into {} partitions",
        start, end, partitionBy, partitions.size());
    return partitions;
  }
}
