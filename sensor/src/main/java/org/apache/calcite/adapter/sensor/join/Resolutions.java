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
package org.apache.calcite.adapter.sensor.join;

import org.apache.calcite.adapter.sensor.SensorConfigException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses resolution and interpolation-limit strings.
 * Supports formats like:
 * - "10T", "10min", "8H", "30S", "1D", "500ms" (offset aliases)
 * - "7 minutes", "1 hour" (human-readable)
 * - "PT10M" (ISO 8601)
 */
public class Resolutions {
  private static final Pattern ALIAS_PATTERN =
      Pattern.compile("(\\d+)?\\s*(T|min|H|h|S|s|sec|D|d|L|ms)");
  private static final Pattern HUMAN_PATTERN =
      Pattern.compile("(\\d+)\\s+(millisecond|second|minute|hour|day)s?", Pattern.CASE_INSENSITIVE);

  private Resolutions() {
    // Utility class should not be instantiated
  }

  /**
   * Parses a duration string.
   *
   * @param value Duration like "10T", "8 hours" or "PT10M"
   * @return Positive duration
   * @throws SensorConfigException if the string is not a positive duration
   */
  public static Duration parse(String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new SensorConfigException("Empty duration");
    }
    String trimmed = value.trim();
    Duration duration;
    if (trimmed.startsWith("P")) {
      try {
        duration = Duration.parse(trimmed);
      } catch (DateTimeParseException e) {
        throw new SensorConfigException("Invalid duration '" + value + "'", e);
      }
    } else {
      duration = parseUnits(trimmed);
      if (duration == null) {
        throw new SensorConfigException("Invalid duration '" + value + "'");
      }
    }
    if (duration.isZero() || duration.isNegative()) {
      throw new SensorConfigException("Duration '" + value + "' should be positive");
    }
    return duration;
  }

  private static @Nullable Duration parseUnits(String trimmed) {
    Matcher alias = ALIAS_PATTERN.matcher(trimmed);
    if (alias.matches()) {
      long amount = alias.group(1) == null ? 1 : Long.parseLong(alias.group(1));
      switch (alias.group(2)) {
      case "T":
      case "min":
        return Duration.ofMinutes(amount);
      case "H":
      case "h":
        return Duration.ofHours(amount);
      case "S":
      case "s":
      case "sec":
        return Duration.ofSeconds(amount);
      case "D":
      case "d":
        return Duration.ofDays(amount);
      case "L":
      case "ms":
        return Duration.ofMillis(amount);
      default:
        return null;
      }
    }

    Matcher human = HUMAN_PATTERN.matcher(trimmed);
    if (!human.matches()) {
      return null;
    }
    long amount = Long.parseLong(human.group(1));
    switch (human.group(2).toLowerCase(Locale.ROOT)) {
    case "millisecond":
      return Duration.ofMillis(amount);
    case "second":
      return Duration.ofSeconds(amount);
    case "minute":
      return Duration.ofMinutes(amount);
    case "hour":
      return Duration.ofHours(amount);
    case "day":
      return Duration.ofDays(amount);
    default:
      return null;
    }
  }
}
