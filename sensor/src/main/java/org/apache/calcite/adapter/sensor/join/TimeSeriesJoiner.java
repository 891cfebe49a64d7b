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

import org.apache.calcite.adapter.sensor.InsufficientDataException;
import org.apache.calcite.adapter.sensor.OutOfRangeException;
import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.reader.RawSeries;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Joins independently sampled series into one table on a common grid.
 *
 * <p>Each series is padded with a NaN sample at the grid start and end
 * when its data does not reach them, resampled into buckets of the given
 * resolution, gap-filled, and stripped of rows that still miss a value.
 * The per-series results are then inner-joined on their bucket labels.
 *
 * <p>Example:
 * <pre>{@code
 * JoinResult result = new TimeSeriesJoiner("10T",
 *     Collections.singletonList(Aggregation.MEAN),
 *     InterpolationMethod.LINEAR_INTERPOLATION, "8H")
 *     .join(series, gridStart, gridEnd);
 * }</pre>
 */
public class TimeSeriesJoiner {
  private static final Logger LOGGER = LoggerFactory.getLogger(TimeSeriesJoiner.class);

  public static final String DEFAULT_INTERPOLATION_LIMIT = "8H";

  private final Duration resolution;
  private final List<Aggregation> aggregations;
  private final InterpolationMethod interpolationMethod;
  private final @Nullable Integer limit;
  private final BucketResampler resampler;

  /**
   * Creates a joiner.
   *
   * @param resolution Bucket width, e.g. "10T"
   * @param aggregations Aggregations, at least one; several produce two-level columns
   * @param interpolationMethod Gap filling method
   * @param interpolationLimit Longest gap filled from the last valid value,
   *     e.g. "8H"; null fills every gap
   * @throws SensorConfigException if the limit is shorter than the resolution
   *     or no aggregation is given
   */
  public TimeSeriesJoiner(String resolution, List<Aggregation> aggregations,
      InterpolationMethod interpolationMethod, @Nullable String interpolationLimit) {
    if (aggregations.isEmpty()) {
      throw new SensorConfigException("At least one aggregation method is required");
    }
    this.resolution = Resolutions.parse(resolution);
    this.aggregations = ImmutableList.copyOf(aggregations);
    this.interpolationMethod = interpolationMethod;
    if (interpolationLimit != null) {
      long buckets = Resolutions.parse(interpolationLimit).toMillis() / this.resolution.toMillis();
      if (buckets <= 0) {
        throw new SensorConfigException("Interpolation limit must be larger than given resolution");
      }
      this.limit = (int) Math.min(buckets, Integer.MAX_VALUE);
    } else {
      this.limit = null;
    }
    this.resampler = new BucketResampler(this.resolution, this.aggregations);
  }

  /**
   * Joiner with mean aggregation, linear interpolation and an 8 hour limit.
   */
  public static TimeSeriesJoiner withDefaults(String resolution) {
    return new TimeSeriesJoiner(resolution, ImmutableList.of(Aggregation.MEAN),
        InterpolationMethod.LINEAR_INTERPOLATION, DEFAULT_INTERPOLATION_LIMIT);
  }

  /**
   * Creates a joiner from configuration names.
   *
   * @param resolution Bucket width, e.g. "10T"
   * @param aggregationMethods Method names, e.g. "mean" or "max"
   * @param interpolationMethod "linear_interpolation" or "ffill"
   * @param interpolationLimit Gap limit, null for unlimited
   * @throws SensorConfigException on an unknown name or an invalid limit
   */
  public static TimeSeriesJoiner create(String resolution, List<String> aggregationMethods,
      String interpolationMethod, @Nullable String interpolationLimit) {
    List<Aggregation> aggregations = new ArrayList<Aggregation>();
    for (String method : aggregationMethods) {
      aggregations.add(Aggregation.fromString(method));
    }
    return new TimeSeriesJoiner(resolution, aggregations,
        InterpolationMethod.fromString(interpolationMethod), interpolationLimit);
  }

  public Duration getResolution() {
    return resolution;
  }

  public List<Aggregation> getAggregations() {
    return aggregations;
  }

  public InterpolationMethod getInterpolationMethod() {
    return interpolationMethod;
  }

  /**
   * Gap limit in buckets, null when unlimited.
   */
  public @Nullable Integer getLimit() {
    return limit;
  }

  /**
   * Joins series on the grid {@code [gridStart, gridEnd]}.
   *
   * @param series Series to join, each sorted by time
   * @param gridStart No series may start before this instant
   * @param gridEnd No series may end after this instant
   * @return The joined table and its metadata
   * @throws InsufficientDataException if any series has no data; every
   *     such series is named
   * @throws OutOfRangeException if a series extends beyond the grid
   */
  public JoinResult join(List<RawSeries> series, ZonedDateTime gridStart, ZonedDateTime gridEnd)
      throws InsufficientDataException {
    if (series.isEmpty()) {
      throw new InsufficientDataException("No series to join");
    }
    JoinMetadata metadata = new JoinMetadata();
    List<String> missing = new ArrayList<String>();
    List<Resampled> resampled = new ArrayList<Resampled>();
    for (RawSeries one : series) {
      metadata.recordOriginal(one.getName(), one.size());
      if (one.isEmpty()) {
        missing.add(one.getName());
        continue;
      }
      Resampled result = resample(one, gridStart, gridEnd);
      if (result.labels.length == 0) {
        missing.add(one.getName());
        continue;
      }
      resampled.add(result);
      metadata.recordResampled(one.getName(), result.labels.length);
    }
    if (!missing.isEmpty()) {
      throw new InsufficientDataException(missing);
    }

    AlignedTable joined = innerJoin(resampled, zoneOf(series));
    AlignedTable dropped = dropIncompleteRows(joined);
    metadata.recordJoin(joined.getRowCount(), dropped.getRowCount());
    LOGGER.debug("Joined {} series into {} rows", series.size(), dropped.getRowCount());
    return new JoinResult(dropped, metadata);
  }

  /**
   * Pads, resamples and fills one non-empty series, then drops the rows
   * that still miss a value.
   */
  private Resampled resample(RawSeries series, ZonedDateTime gridStart, ZonedDateTime gridEnd) {
    String name = series.getName();
    long start = gridStart.toInstant().toEpochMilli();
    long end = gridEnd.toInstant().toEpochMilli();
    long first = series.getEpochMillis(0);
    long last = series.getEpochMillis(series.size() - 1);

    long[] times = series.timestamps();
    double[] values = series.values();
    if (first > start) {
      times = prepend(start, times);
      values = prepend(Double.NaN, values);
      LOGGER.debug("Appending NaN to {} at time {}", name, gridStart);
    } else if (first < start) {
      String message = "Error - for " + name + ", first timestamp " + series.getInstant(0)
          + " is before the resampling start point " + gridStart;
      LOGGER.error(message);
      throw new OutOfRangeException(name, message);
    }
    if (last < end) {
      times = append(times, end);
      values = append(values, Double.NaN);
      LOGGER.debug("Appending NaN to {} at time {}", name, gridEnd);
    } else if (last > end) {
      String message = "Error - for " + name + ", last timestamp "
          + series.getInstant(series.size() - 1) + " is later than the resampling end point "
          + gridEnd;
      LOGGER.error(message);
      throw new OutOfRangeException(name, message);
    }

    BucketResampler.Resampled buckets = resampler.resample(series.getZone(), times, values);
    double[][] filled = new double[buckets.columns.length][];
    for (int a = 0; a < filled.length; a++) {
      filled[a] = GapFiller.fill(interpolationMethod, buckets.columns[a], limit);
    }

    List<ColumnKey> keys = new ArrayList<ColumnKey>();
    for (Aggregation aggregation : aggregations) {
      keys.add(aggregations.size() == 1
          ? ColumnKey.of(name) : ColumnKey.of(name, aggregation));
    }
    return Resampled.complete(keys, buckets.labels, filled);
  }

  private static AlignedTable innerJoin(List<Resampled> parts, ZoneId zone) {
    // Labels are ascending in every part, so a merge walk finds the common ones
    long[] common = parts.get(0).labels;
    for (int p = 1; p < parts.size(); p++) {
      common = intersect(common, parts.get(p).labels);
    }
    List<ColumnKey> keys = new ArrayList<ColumnKey>();
    List<double[]> columns = new ArrayList<double[]>();
    for (Resampled part : parts) {
      int[] rows = positions(part.labels, common);
      for (int c = 0; c < part.keys.size(); c++) {
        double[] column = new double[common.length];
        for (int r = 0; r < rows.length; r++) {
          column[r] = part.columns[c][rows[r]];
        }
        keys.add(part.keys.get(c));
        columns.add(column);
      }
    }
    return new AlignedTable(zone, common, keys, columns.toArray(new double[0][]));
  }

  private static AlignedTable dropIncompleteRows(AlignedTable table) {
    int columnCount = table.getColumnCount();
    long[] index = new long[table.getRowCount()];
    double[][] data = new double[columnCount][table.getRowCount()];
    int n = 0;
    for (int r = 0; r < table.getRowCount(); r++) {
      if (rowComplete(table, r)) {
        index[n] = table.getEpochMillis(r);
        for (int c = 0; c < columnCount; c++) {
          data[c][n] = table.getValue(r, c);
        }
        n++;
      }
    }
    for (int c = 0; c < columnCount; c++) {
      data[c] = Arrays.copyOf(data[c], n);
    }
    return new AlignedTable(table.getZone(), Arrays.copyOf(index, n), table.getColumns(), data);
  }

  private static boolean rowComplete(AlignedTable table, int row) {
    for (int c = 0; c < table.getColumnCount(); c++) {
      if (Double.isNaN(table.getValue(row, c))) {
        return false;
      }
    }
    return true;
  }

  /** Zone shared by all series, UTC when they differ. */
  private static ZoneId zoneOf(List<RawSeries> series) {
    ZoneId zone = series.get(0).getZone();
    for (RawSeries one : series) {
      if (!one.getZone().equals(zone)) {
        return ZoneOffset.UTC;
      }
    }
    return zone;
  }

  private static long[] intersect(long[] a, long[] b) {
    long[] result = new long[Math.min(a.length, b.length)];
    int i = 0;
    int j = 0;
    int n = 0;
    while (i < a.length && j < b.length) {
      if (a[i] < b[j]) {
        i++;
      } else if (a[i] > b[j]) {
        j++;
      } else {
        result[n++] = a[i];
        i++;
        j++;
      }
    }
    return Arrays.copyOf(result, n);
  }

  private static int[] positions(long[] labels, long[] wanted) {
    int[] result = new int[wanted.length];
    int i = 0;
    for (int w = 0; w < wanted.length; w++) {
      while (labels[i] != wanted[w]) {
        i++;
      }
      result[w] = i;
    }
    return result;
  }

  private static long[] prepend(long head, long[] tail) {
    long[] result = new long[tail.length + 1];
    result[0] = head;
    System.arraycopy(tail, 0, result, 1, tail.length);
    return result;
  }

  private static double[] prepend(double head, double[] tail) {
    double[] result = new double[tail.length + 1];
    result[0] = head;
    System.arraycopy(tail, 0, result, 1, tail.length);
    return result;
  }

  private static long[] append(long[] head, long tail) {
    long[] result = Arrays.copyOf(head, head.length + 1);
    result[head.length] = tail;
    return result;
  }

  private static double[] append(double[] head, double tail) {
    double[] result = Arrays.copyOf(head, head.length + 1);
    result[head.length] = tail;
    return result;
  }

  /** Filled buckets of one series with incomplete rows removed. */
  private static final class Resampled {
    final List<ColumnKey> keys;
    final long[] labels;
    final double[][] columns;

    private Resampled(List<ColumnKey> keys, long[] labels, double[][] columns) {
      this.keys = keys;
      this.labels = labels;
      this.columns = columns;
    }

    static Resampled complete(List<ColumnKey> keys, long[] labels, double[][] columns) {
      int n = 0;
      long[] keptLabels = new long[labels.length];
      double[][] kept = new double[columns.length][labels.length];
      for (int r = 0; r < labels.length; r++) {
        boolean complete = true;
        for (double[] column : columns) {
          if (Double.isNaN(column[r])) {
            complete = false;
            break;
          }
        }
        if (complete) {
          keptLabels[n] = labels[r];
          for (int c = 0; c < columns.length; c++) {
            kept[c][n] = columns[c][r];
          }
          n++;
        }
      }
      for (int c = 0; c < kept.length; c++) {
        kept[c] = Arrays.copyOf(kept[c], n);
      }
      return new Resampled(keys, Arrays.copyOf(keptLabels, n), kept);
    }
  }
}
