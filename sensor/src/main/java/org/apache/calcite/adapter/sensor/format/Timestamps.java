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
package org.apache.calcite.adapter.sensor.format;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.concurrent.TimeUnit;

/**
 * Conversions of stored timestamps to epoch milliseconds. Values without
 * an offset are taken as UTC.
 */
final class Timestamps {
  private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .toFormatter();

  // Unit-less epoch values above these magnitudes are nano / micro seconds
  private static final long NANOS_THRESHOLD = 100_000_000_000_000_000L;
  private static final long MICROS_THRESHOLD = 100_000_000_000_000L;

  private Timestamps() {
  }

  /**
   * Parses an ISO-8601 like timestamp, with either 'T' or a space between
   * date and time and an optional offset, or a plain date.
   *
   * @throws java.time.format.DateTimeParseException if the text is not a timestamp
   */
  static long parse(String text) {
    String trimmed = text.trim();
    if (trimmed.length() == 10) {
      return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    TemporalAccessor parsed =
        FORMATTER.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
    if (parsed instanceof OffsetDateTime) {
      return ((OffsetDateTime) parsed).toInstant().toEpochMilli();
    }
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
  }

  /**
   * Converts an epoch number whose unit is given by a logical type name
   * ({@code timestamp-millis}, {@code timestamp-micros}, ...). Without a
   * unit the magnitude decides.
   */
  static long fromEpoch(long value, @Nullable String unit) {
    if (unit != null) {
      if (unit.endsWith("nanos")) {
        return TimeUnit.NANOSECONDS.toMillis(value);
      } else if (unit.endsWith("micros")) {
        return TimeUnit.MICROSECONDS.toMillis(value);
      } else if (unit.endsWith("millis")) {
        return value;
      }
    }
    long magnitude = Math.abs(value);
    if (magnitude >= NANOS_THRESHOLD) {
      return TimeUnit.NANOSECONDS.toMillis(value);
    } else if (magnitude >= MICROS_THRESHOLD) {
      return TimeUnit.MICROSECONDS.toMillis(value);
    }
    return value;
  }
}
