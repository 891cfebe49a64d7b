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
package org.apache.calcite.adapter.sensor.reader;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Objects;

/**
 * A named series of (timestamp, value) samples sorted by time.
 *
 * <p>Timestamps are epoch milliseconds; the zone only affects how the
 * series is displayed and where calendar-aligned buckets start. Values
 * may be NaN. Instances are immutable.
 */
public final class RawSeries {
  private static final long[] NO_TIMES = new long[0];
  private static final double[] NO_VALUES = new double[0];

  private final String name;
  private final ZoneId zone;
  private final long[] epochMillis;
  private final double[] values;

  public RawSeries(String name, ZoneId zone, long[] epochMillis, double[] values) {
    if (epochMillis.length != values.length) {
      throw new IllegalArgumentException("Series " + name + " has " + epochMillis.length
          + " timestamps but " + values.length + " values");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.epochMillis = epochMillis.clone();
    this.values = values.clone();
  }

  /**
   * An explicitly empty UTC series.
   */
  public static RawSeries empty(String name) {
    return new RawSeries(name, ZoneOffset.UTC, NO_TIMES, NO_VALUES);
  }

  public String getName() {
    return name;
  }

  public ZoneId getZone() {
    return zone;
  }

  public int size() {
    return epochMillis.length;
  }

  public boolean isEmpty() {
    return epochMillis.length == 0;
  }

  public long getEpochMillis(int i) {
    return epochMillis[i];
  }

  public double getValue(int i) {
    return values[i];
  }

  public Instant getInstant(int i) {
    return Instant.ofEpochMilli(epochMillis[i]);
  }

  /** Copy of the timestamps. */
  public long[] timestamps() {
    return epochMillis.clone();
  }

  /** Copy of the values. */
  public double[] values() {
    return values.clone();
  }

  /**
   * Samples with {@code startInclusive <= t < endExclusive}.
   */
  public RawSeries filter(Instant startInclusive, Instant endExclusive) {
    long from = startInclusive.toEpochMilli();
    long to = endExclusive.toEpochMilli();
    int lo = 0;
    while (lo < epochMillis.length && epochMillis[lo] < from) {
      lo++;
    }
    int hi = lo;
    while (hi < epochMillis.length && epochMillis[hi] < to) {
      hi++;
    }
    if (lo == 0 && hi == epochMillis.length) {
      return this;
    }
    return new RawSeries(name, zone, Arrays.copyOfRange(epochMillis, lo, hi),
        Arrays.copyOfRange(values, lo, hi));
  }

  /**
   * Same samples under another name.
   */
  public RawSeries withName(String newName) {
    return new RawSeries(newName, zone, epochMillis, values);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawSeries)) {
      return false;
    }
    RawSeries that = (RawSeries) o;
    return name.equals(that.name)
        && zone.equals(that.zone)
        && Arrays.equals(epochMillis, that.epochMillis)
        && Arrays.equals(values, that.values);
  }

  @Override public int hashCode() {
    return Objects.hash(name, zone, Arrays.hashCode(epochMillis), Arrays.hashCode(values));
  }

  @Override public String toString() {
    if (isEmpty()) {
      return "RawSeries{" + name + ", empty}";
    }
    return "RawSeries{" + name + ", " + size() + " samples, " + getInstant(0) + " .. "
        + getInstant(size() - 1) + "}";
  }
}
