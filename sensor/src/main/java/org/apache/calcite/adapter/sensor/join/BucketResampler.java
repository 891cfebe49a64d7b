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

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;

/**
 * Groups the samples of a series into fixed-width buckets.
 *
 * <p>Buckets are closed on the left and labelled by their left edge. The
 * bucket grid is anchored at midnight, in the given zone, of the day of the
 * first sample. Labels run from the bucket holding the first sample to the
 * bucket holding the last one; buckets in between without samples are kept.
 */
class BucketResampler {
  private final Duration resolution;
  private final List<Aggregation> aggregations;

  BucketResampler(Duration resolution, List<Aggregation> aggregations) {
    this.resolution = resolution;
    this.aggregations = ImmutableList.copyOf(aggregations);
  }

  /**
   * Resamples sorted samples.
   *
   * @param zone Zone whose midnight anchors the grid
   * @param times Sample timestamps, ascending, epoch milliseconds
   * @param values Sample values, NaN for missing
   * @return Bucket labels and one column per aggregation
   */
  Resampled resample(ZoneId zone, long[] times, double[] values) {
    if (times.length == 0) {
      return new Resampled(new long[0], new double[aggregations.size()][0]);
    }
    long step = resolution.toMillis();
    long origin = Instant.ofEpochMilli(times[0]).atZone(zone)
        .truncatedTo(ChronoUnit.DAYS).toInstant().toEpochMilli();
    long firstBucket = Math.floorDiv(times[0] - origin, step);
    long lastBucket = Math.floorDiv(times[times.length - 1] - origin, step);
    int bucketCount = Math.toIntExact(lastBucket - firstBucket + 1);

    long[] labels = new long[bucketCount];
    for (int b = 0; b < bucketCount; b++) {
      labels[b] = origin + (firstBucket + b) * step;
    }
    double[][] columns = new double[aggregations.size()][bucketCount];

    double[] buffer = new double[16];
    int i = 0;
    for (int b = 0; b < bucketCount; b++) {
      long bucketEnd = labels[b] + step;
      int n = 0;
      while (i < times.length && times[i] < bucketEnd) {
        if (!Double.isNaN(values[i])) {
          if (n == buffer.length) {
            buffer = Arrays.copyOf(buffer, n * 2);
          }
          buffer[n++] = values[i];
        }
        i++;
      }
      for (int a = 0; a < columns.length; a++) {
        columns[a][b] = aggregations.get(a).apply(buffer, n);
      }
    }
    return new Resampled(labels, columns);
  }

  /** Bucket labels and aggregated columns. */
  static final class Resampled {
    final long[] labels;
    final double[][] columns;

    Resampled(long[] labels, double[][] columns) {
      this.labels = labels;
      this.columns = columns;
    }
  }
}
