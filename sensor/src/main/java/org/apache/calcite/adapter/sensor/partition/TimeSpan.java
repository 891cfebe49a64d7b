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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calendar span used to cut a period into aligned pieces.
 */
public enum TimeSpan {
  YEAR {
    @Override public ZonedDateTime align(ZonedDateTime dateTime) {
      return dateTime.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
    }

    @Override public ZonedDateTime addSpan(ZonedDateTime dateTime) {
      return dateTime.plusYears(1);
    }
  },

  MONTH {
    @Override public ZonedDateTime align(ZonedDateTime dateTime) {
      return dateTime.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
    }

    @Override public ZonedDateTime addSpan(ZonedDateTime dateTime) {
      return dateTime.plusMonths(1);
    }
  };

  /**
   * Start of the span containing the given instant.
   */
  public abstract ZonedDateTime align(ZonedDateTime dateTime);

  /**
   * The given instant moved forward by one span.
   */
  public abstract ZonedDateTime addSpan(ZonedDateTime dateTime);

  public static TimeSpan of(PartitionBy partitionBy) {
    return partitionBy == PartitionBy.YEAR ? YEAR : MONTH;
  }

  /**
   * Splits {@code [start, end)} into consecutive span-aligned periods.
   * The first period starts at the aligned start, so it may begin before
   * {@code start}; the last one is the first whose end reaches past
   * {@code end}.
   *
   * @throws InvalidRangeException if start is not before end
   */
  public List<Period> split(ZonedDateTime start, ZonedDateTime end) {
    if (!start.isBefore(end)) {
      throw new InvalidRangeException("period_start should be lower then period_end");
    }
    List<Period> periods = new ArrayList<Period>();
    ZonedDateTime current = align(start);
    while (true) {
      ZonedDateTime next = addSpan(current);
      periods.add(new Period(current, next));
      if (!next.isBefore(end)) {
        break;
      }
      current = next;
    }
    return periods;
  }

  /**
   * Half-open period {@code [start, end)}.
   */
  public static final class Period {
    private final ZonedDateTime start;
    private final ZonedDateTime end;

    public Period(ZonedDateTime start, ZonedDateTime end) {
      this.start = start;
      this.end = end;
    }

    public ZonedDateTime getStart() {
      return start;
    }

    public ZonedDateTime getEnd() {
      return end;
    }

    @Override public boolean equals(@Nullable Object o) {
      if (!(o instanceof Period)) {
        return false;
      }
      Period that = (Period) o;
      return start.isEqual(that.start) && end.isEqual(that.end);
    }

    @Override public int hashCode() {
      return Objects.hash(start.toInstant(), end.toInstant());
    }

    @Override public String toString() {
      return "Period[" + start + ", " + end + ")";
    }
  }
}
