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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TimeSeriesJoiner}.
 */
@Tag("unit")
public class TimeSeriesJoinerTest {
  private static final ZonedDateTime SHORT_START = ZonedDateTime.parse("2017-12-25T06:00:00+07:00");
  private static final ZonedDateTime SHORT_END = ZonedDateTime.parse("2018-01-12T13:07:00+07:00");
  private static final ZonedDateTime LONG_START = ZonedDateTime.parse("2017-01-01T06:00:00+07:00");
  private static final ZonedDateTime LONG_END = ZonedDateTime.parse("2018-02-01T13:07:00+07:00");

  /** Regularly sampled series, both ends included. */
  private static RawSeries regular(String name, String start, String end, long stepMillis) {
    long from = Instant.parse(start).toEpochMilli();
    long to = Instant.parse(end).toEpochMilli();
    int n = (int) ((to - from) / stepMillis) + 1;
    long[] times = new long[n];
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      times[i] = from + i * stepMillis;
      values[i] = Math.sin(i / 100.0);
    }
    return new RawSeries(name, ZoneOffset.UTC, times, values);
  }

  private static RawSeries seconds() {
    return regular("Tag 1", "2018-01-01T06:00:00Z", "2018-01-07T06:00:00Z", 1000L);
  }

  private static RawSeries minutes() {
    return regular("Tag 2", "2017-12-28T06:00:00Z", "2018-01-05T06:00:00Z", 60_000L);
  }

  private static RawSeries hours() {
    return regular("Tag 3", "2018-01-03T06:00:00Z", "2018-01-12T06:00:00Z", 3_600_000L);
  }

  private static List<RawSeries> fixtures() {
    return Arrays.asList(seconds(), minutes(), hours());
  }

  @Test
  void testJoinWithDefaults() throws InsufficientDataException {
    JoinResult result = TimeSeriesJoiner.withDefaults("7T").join(fixtures(), SHORT_START,
        SHORT_END);
    AlignedTable table = result.getTable();
    assertEquals(481, table.getRowCount());
    assertEquals(3, table.getColumnCount());
    assertFalse(table.isMultiLevel());
    assertEquals(Arrays.asList(ColumnKey.of("Tag 1"), ColumnKey.of("Tag 2"), ColumnKey.of("Tag 3")),
        table.getColumns());
    assertEquals(Instant.parse("2018-01-03T05:56:00Z"), table.getTimestamp(0).toInstant());
    assertEquals(7 * 60_000L, table.getEpochMillis(1) - table.getEpochMillis(0));
  }

  @Test
  void testLongerGrid() throws InsufficientDataException {
    AlignedTable table = TimeSeriesJoiner.withDefaults("10T")
        .join(fixtures(), LONG_START, LONG_END).getTable();
    assertEquals(337, table.getRowCount());
    assertEquals(Instant.parse("2018-01-03T06:00:00Z"), table.getTimestamp(0).toInstant());
  }

  @Test
  void testUnlimitedInterpolation() throws InsufficientDataException {
    TimeSeriesJoiner joiner = new TimeSeriesJoiner("10T",
        Collections.singletonList(Aggregation.MEAN), InterpolationMethod.LINEAR_INTERPOLATION,
        null);
    assertNull(joiner.getLimit());
    assertEquals(4177, joiner.join(fixtures(), LONG_START, LONG_END).getTable().getRowCount());
  }

  @Test
  void testLongGapsAreRemoved() throws InsufficientDataException {
    RawSeries minutes = minutes();
    long gapStart = Instant.parse("2018-01-03T12:00:00Z").toEpochMilli();
    long gapEnd = Instant.parse("2018-01-04T12:00:00Z").toEpochMilli();
    List<Long> times = new ArrayList<Long>();
    List<Double> values = new ArrayList<Double>();
    for (int i = 0; i < minutes.size(); i++) {
      long t = minutes.getEpochMillis(i);
      if (t < gapStart || t >= gapEnd) {
        times.add(t);
        values.add(minutes.getValue(i));
      }
    }
    long[] t = new long[times.size()];
    double[] v = new double[values.size()];
    for (int i = 0; i < t.length; i++) {
      t[i] = times.get(i);
      v[i] = values.get(i);
    }
    List<RawSeries> series = Arrays.asList(seconds(),
        new RawSeries("Tag 2", ZoneOffset.UTC, t, v), hours());

    TimeSeriesJoiner joiner = TimeSeriesJoiner.withDefaults("10T");
    assertEquals(Integer.valueOf(48), joiner.getLimit());
    AlignedTable table = joiner.join(series, SHORT_START, SHORT_END).getTable();
    // 8 hours of the 24 hour gap are interpolated, the remaining 96 buckets are dropped
    assertEquals(337 - 96, table.getRowCount());
    assertEquals(Instant.parse("2018-01-03T06:00:00Z"), table.getTimestamp(0).toInstant());
    long firstDropped = Instant.parse("2018-01-03T20:00:00Z").toEpochMilli();
    for (long label : table.index()) {
      assertTrue(label < firstDropped || label >= gapEnd);
    }

    assertEquals(1297, new TimeSeriesJoiner("10T", Collections.singletonList(Aggregation.MEAN),
        InterpolationMethod.FFILL, null).join(series, SHORT_START, SHORT_END)
        .getTable().getRowCount());
  }

  @Test
  void testInterpolationSettings() {
    SensorConfigException e = assertThrows(SensorConfigException.class,
        () -> TimeSeriesJoiner.create("10T", Collections.singletonList("mean"), "wrong_method",
            "8H"));
    assertTrue(e.getMessage().contains("linear_interpolation or ffill"));
    assertThrows(SensorConfigException.class,
        () -> TimeSeriesJoiner.create("10T", Collections.singletonList("mean"), "ffill", "1T"));
    assertThrows(SensorConfigException.class,
        () -> new TimeSeriesJoiner("10T", Collections.<Aggregation>emptyList(),
            InterpolationMethod.FFILL, null));
    assertEquals(Integer.valueOf(6),
        TimeSeriesJoiner.create("10T", Collections.singletonList("max"), "ffill", "1H")
            .getLimit());
  }

  @Test
  void testInsufficientDataNamesEverySeries() {
    List<RawSeries> series = Arrays.asList(RawSeries.empty("Tag 1"), hours(),
        RawSeries.empty("Tag 3"));
    InsufficientDataException e = assertThrows(InsufficientDataException.class,
        () -> TimeSeriesJoiner.withDefaults("10T").join(series, SHORT_START, SHORT_END));
    assertEquals(Arrays.asList("Tag 1", "Tag 3"), e.getSeriesNames());

    assertThrows(InsufficientDataException.class,
        () -> TimeSeriesJoiner.withDefaults("10T")
            .join(Collections.<RawSeries>emptyList(), SHORT_START, SHORT_END));
  }

  @Test
  void testSeriesOutsideGrid() {
    OutOfRangeException early = assertThrows(OutOfRangeException.class,
        () -> TimeSeriesJoiner.withDefaults("10T").join(fixtures(),
            ZonedDateTime.parse("2018-01-02T00:00:00Z"), SHORT_END));
    assertEquals("Tag 1", early.getSeriesName());
    OutOfRangeException late = assertThrows(OutOfRangeException.class,
        () -> TimeSeriesJoiner.withDefaults("10T").join(fixtures(), SHORT_START,
            ZonedDateTime.parse("2018-01-10T00:00:00Z")));
    assertEquals("Tag 3", late.getSeriesName());
  }

  @Test
  void testMultipleAggregations() throws InsufficientDataException, IOException {
    ZonedDateTime start = ZonedDateTime.parse("2020-01-01T00:00:00Z");
    ZonedDateTime end = ZonedDateTime.parse("2020-01-01T01:00:00Z");
    RawSeries a = regular("A", "2020-01-01T00:00:00Z", "2020-01-01T01:00:00Z", 600_000L);
    RawSeries b = new RawSeries("B", ZoneOffset.UTC,
        new long[] {Instant.parse("2020-01-01T00:05:00Z").toEpochMilli(),
            Instant.parse("2020-01-01T00:35:00Z").toEpochMilli()},
        new double[] {2.0, 6.0});

    JoinResult result = TimeSeriesJoiner.create("30T", Arrays.asList("mean", "max"),
        "linear_interpolation", "8H").join(Arrays.asList(a, b), start, end);
    AlignedTable table = result.getTable();

    assertTrue(table.isMultiLevel());
    assertEquals(Arrays.asList(ColumnKey.of("A", Aggregation.MEAN),
        ColumnKey.of("A", Aggregation.MAX), ColumnKey.of("B", Aggregation.MEAN),
        ColumnKey.of("B", Aggregation.MAX)), table.getColumns());
    assertEquals("B__max", table.getColumns().get(3).flatName());
    assertEquals(3, table.getRowCount());
    assertArrayEquals(new double[] {2.0, 6.0, 6.0},
        table.column(ColumnKey.of("B", Aggregation.MEAN)));
    assertNull(table.column(ColumnKey.of("B")));

    JoinMetadata metadata = result.getMetadata();
    assertEquals(7, metadata.getSeries().get("A").getOriginalLength());
    assertEquals(2, metadata.getSeries().get("B").getOriginalLength());
    assertEquals(Integer.valueOf(3), metadata.getSeries().get("B").getResampledLength());
    assertEquals(3, metadata.getJoinedLength());
    assertEquals(3, metadata.getDroppedNaLength());

    JsonNode json = new ObjectMapper().readTree(metadata.toJson());
    assertEquals(7, json.get("A").get("original_length").asInt());
    assertEquals(3, json.get("aggregate_metadata").get("dropped_na_length").asInt());
    Map<String, Object> map = metadata.toMap();
    assertEquals(Arrays.asList("A", "B", "aggregate_metadata"),
        new ArrayList<String>(map.keySet()));
  }

  @Test
  void testZoneOfResult() throws InsufficientDataException {
    ZoneId bangkok = ZoneId.of("Asia/Bangkok");
    RawSeries local = new RawSeries("L", bangkok,
        new long[] {Instant.parse("2020-01-01T00:00:00Z").toEpochMilli()}, new double[] {1});
    AlignedTable table = TimeSeriesJoiner.withDefaults("1H").join(
        Collections.singletonList(local), ZonedDateTime.parse("2020-01-01T00:00:00Z"),
        ZonedDateTime.parse("2020-01-01T02:00:00Z")).getTable();
    assertEquals(bangkok, table.getZone());
    assertEquals(3, table.getRowCount());
    assertEquals(bangkok, table.getTimestamp(0).getZone());
  }
}
