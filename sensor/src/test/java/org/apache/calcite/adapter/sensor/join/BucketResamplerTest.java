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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link BucketResampler} and {@link Aggregation}.
 */
@Tag("unit")
public class BucketResamplerTest {

  private static long millis(String isoInstant) {
    return Instant.parse(isoInstant).toEpochMilli();
  }

  @Test
  void testBucketsAnchoredAtMidnight() {
    BucketResampler resampler = new BucketResampler(Duration.ofMinutes(7),
        Collections.singletonList(Aggregation.MEAN));
    BucketResampler.Resampled result = resampler.resample(ZoneOffset.UTC,
        new long[] {millis("2020-01-01T00:15:00Z"), millis("2020-01-01T00:20:00Z"),
            millis("2020-01-01T00:29:00Z")},
        new double[] {1, 3, 10});
    // 00:14 holds the first two samples, 00:21 is empty, 00:28 holds the last
    assertArrayEquals(new long[] {millis("2020-01-01T00:14:00Z"),
        millis("2020-01-01T00:21:00Z"), millis("2020-01-01T00:28:00Z")}, result.labels);
    assertArrayEquals(new double[] {2, Double.NaN, 10}, result.columns[0]);
  }

  @Test
  void testZoneMidnight() {
    BucketResampler resampler = new BucketResampler(Duration.ofHours(5),
        Collections.singletonList(Aggregation.FIRST));
    BucketResampler.Resampled result = resampler.resample(ZoneId.of("Asia/Bangkok"),
        new long[] {millis("2020-01-01T00:30:00Z")}, new double[] {4});
    // Midnight in Bangkok is 17:00 UTC the day before
    assertArrayEquals(new long[] {millis("2019-12-31T22:00:00Z")}, result.labels);
  }

  @Test
  void testNaNSamplesAreSkipped() {
    BucketResampler resampler = new BucketResampler(Duration.ofMinutes(10),
        Arrays.asList(Aggregation.COUNT, Aggregation.MAX));
    BucketResampler.Resampled result = resampler.resample(ZoneOffset.UTC,
        new long[] {0L, 60_000L, 120_000L, 1_200_000L},
        new double[] {Double.NaN, 5, 2, Double.NaN});
    assertArrayEquals(new double[] {2, 0, 0}, result.columns[0]);
    assertEquals(5.0, result.columns[1][0]);
    assertTrue(Double.isNaN(result.columns[1][2]));
  }

  @Test
  void testEmpty() {
    BucketResampler.Resampled result = new BucketResampler(Duration.ofMinutes(1),
        Collections.singletonList(Aggregation.MEAN)).resample(ZoneOffset.UTC,
        new long[0], new double[0]);
    assertEquals(0, result.labels.length);
  }

  @Test
  void testAggregations() {
    double[] values = {4, 1, 3, 2, 99};
    int n = 4;
    assertEquals(2.5, Aggregation.MEAN.apply(values, n));
    assertEquals(1.0, Aggregation.MIN.apply(values, n));
    assertEquals(4.0, Aggregation.MAX.apply(values, n));
    assertEquals(10.0, Aggregation.SUM.apply(values, n));
    assertEquals(4.0, Aggregation.COUNT.apply(values, n));
    assertEquals(2.5, Aggregation.MEDIAN.apply(values, n));
    assertEquals(3.0, Aggregation.MEDIAN.apply(values, 3));
    assertEquals(4.0, Aggregation.FIRST.apply(values, n));
    assertEquals(2.0, Aggregation.LAST.apply(values, n));
    assertEquals(Math.sqrt(5.0 / 3.0), Aggregation.STD.apply(values, n), 1e-12);
    assertTrue(Double.isNaN(Aggregation.STD.apply(values, 1)));
    assertTrue(Double.isNaN(Aggregation.MEAN.apply(values, 0)));
  }

  @Test
  void testAggregationNames() {
    assertEquals(Aggregation.MAX, Aggregation.fromString(" Max "));
    assertEquals(Arrays.asList(Aggregation.MEAN, Aggregation.STD),
        Aggregation.fromObject(Arrays.asList("mean", "std")));
    assertEquals(Collections.singletonList(Aggregation.SUM), Aggregation.fromObject("sum"));
    assertThrows(SensorConfigException.class, () -> Aggregation.fromString("mode"));
  }
}
