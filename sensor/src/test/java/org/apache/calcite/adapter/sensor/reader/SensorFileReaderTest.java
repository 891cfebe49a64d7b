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

import org.apache.calcite.adapter.sensor.InvalidRangeException;
import org.apache.calcite.adapter.sensor.ReaderMismatchException;
import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.SensorFixtures;
import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.lookup.AssetPathSpec;
import org.apache.calcite.adapter.sensor.lookup.AssetsConfig;
import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.partition.PartitionBy;
import org.apache.calcite.adapter.sensor.storage.LocalFileStorageProvider;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.apache.calcite.adapter.sensor.SensorFixtures.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SensorFileReader}.
 */
@Tag("unit")
public class SensorFileReaderTest {

  @TempDir
  Path tempDir;

  private AssetsConfig catalog;
  private String assetDir;

  @BeforeEach
  void setUp() throws IOException {
    Path plant = tempDir.resolve("plant");
    assetDir = plant.resolve("1101-SFB").toString();
    SensorFixtures.writeParquet(plant.resolve("1101-SFB/TAG-A/parquet/2020/TAG-A_202001.parquet"),
        "TAG-A", Arrays.asList(
            row("2020-01-31T22:00:00Z", 1.0, null),
            row("2020-01-31T23:00:00Z", 2.0, 192),
            row("2020-01-31T23:30:00Z", 99.0, 0)));
    SensorFixtures.writeParquet(plant.resolve("1101-SFB/TAG-A/parquet/2020/TAG-A_202002.parquet"),
        "TAG-A", Arrays.asList(
            row("2020-02-01T00:00:00Z", 3.0, null),
            row("2020-02-01T01:00:00Z", 4.0, null)));
    SensorFixtures.writeCsv(plant.resolve("1101-SFB/TAG-B/TAG-B_2020.csv"), "TAG-B",
        Arrays.asList(
            row("2020-01-31T23:00:00Z", 7.0, 192),
            row("2020-02-01T00:00:00Z", 8.0, 192)));
    catalog = new AssetsConfig(ImmutableMap.<String, Map<String, AssetPathSpec>>of("local",
        ImmutableMap.of(
            "1101-sfb", new AssetPathSpec("ncs_reader", plant.toString(), "1101-SFB"),
            "9999-oth", new AssetPathSpec("other_reader", plant.toString(), "OTH"))));
  }

  private SensorFileReader reader(SensorReaderConfig config) {
    return new SensorFileReader(new LocalFileStorageProvider(), catalog, config);
  }

  private static ZonedDateTime at(String isoInstant) {
    return ZonedDateTime.parse(isoInstant);
  }

  @Test
  void testLoadSeries() throws IOException {
    SensorFileReader reader = reader(SensorReaderConfig.builder().threads(2).build());
    List<RawSeries> series = reader.loadSeries(at("2020-01-31T23:00:00Z"),
        at("2020-02-01T01:00:00Z"),
        Arrays.asList(SensorTag.of("TAG-A", "1101-sfb"), SensorTag.of("TAG-B", "1101-sfb"),
            SensorTag.of("TAG-A", "1101-sfb"), SensorTag.of("TAG-MISSING", "1101-sfb")),
        false);

    assertEquals(3, series.size());
    RawSeries a = series.get(0);
    assertEquals("TAG-A", a.getName());
    assertEquals(2, a.size());
    assertEquals(Instant.parse("2020-01-31T23:00:00Z"), a.getInstant(0));
    assertEquals(2.0, a.getValue(0));
    assertEquals(3.0, a.getValue(1));

    // CSV files are yearly, monthly partitions find none
    assertTrue(series.get(1).isEmpty());
    assertTrue(series.get(2).isEmpty());
    assertEquals("TAG-MISSING", series.get(2).getName());
  }

  @Test
  void testYearlyPartitions() throws IOException {
    SensorFileReader reader = reader(SensorReaderConfig.builder()
        .partitionBy(PartitionBy.YEAR)
        .lookupFor(Arrays.asList("csv")).build());
    List<RawSeries> series = reader.loadSeries(at("2020-01-01T00:00:00Z"),
        at("2021-01-01T00:00:00Z"), Collections.singletonList(SensorTag.of("TAG-B", "1101-sfb")),
        false);
    assertEquals(2, series.get(0).size());
    assertEquals(7.0, series.get(0).getValue(0));
  }

  @Test
  void testSequentialAndParallelAgree() throws IOException {
    List<SensorTag> tags = Arrays.asList(SensorTag.of("TAG-A", "1101-sfb"),
        SensorTag.of("TAG-B", "1101-sfb"));
    ZonedDateTime start = at("2020-01-01T00:00:00Z");
    ZonedDateTime end = at("2020-03-01T00:00:00Z");
    assertEquals(reader(SensorReaderConfig.defaults()).loadSeries(start, end, tags, false),
        reader(SensorReaderConfig.builder().threads(8).build()).loadSeries(start, end, tags,
            false));
  }

  @Test
  void testDryRun() throws IOException {
    List<RawSeries> series = reader(SensorReaderConfig.defaults()).loadSeries(
        at("2020-01-01T00:00:00Z"), at("2020-03-01T00:00:00Z"),
        Collections.singletonList(SensorTag.of("TAG-A", "1101-sfb")), true);
    assertTrue(series.get(0).isEmpty());
  }

  @Test
  void testBaseDirectoryOverride() throws IOException {
    SensorFileReader reader = new SensorFileReader(new LocalFileStorageProvider(), null,
        SensorReaderConfig.builder().dlBasePath(assetDir).build());
    List<RawSeries> series = reader.loadSeries(at("2020-02-01T00:00:00Z"),
        at("2020-03-01T00:00:00Z"), Collections.singletonList(SensorTag.of("TAG-A")), false);
    assertEquals(2, series.get(0).size());
    assertTrue(reader.canHandleTag(SensorTag.of("anything")));
  }

  @Test
  void testEndBeforeStart() {
    assertThrows(InvalidRangeException.class,
        () -> reader(SensorReaderConfig.defaults()).loadSeries(at("2020-02-01T00:00:00Z"),
            at("2020-01-01T00:00:00Z"),
            Collections.singletonList(SensorTag.of("TAG-A", "1101-sfb")), false));
  }

  @Test
  void testBasePathFromAsset() {
    SensorFileReader reader = reader(SensorReaderConfig.defaults());
    assertEquals(assetDir, reader.basePathFromAsset("1101-SFB"));
    assertEquals(assetDir, reader.basePathFromAsset("1101-sfb"));
    assertNull(reader.basePathFromAsset("0000-unk"));
    assertNull(reader.basePathFromAsset(null));
    assertThrows(ReaderMismatchException.class, () -> reader.basePathFromAsset("9999-OTH"));

    assertTrue(reader.canHandleTag(SensorTag.of("TAG-A", "1101-SFB")));
    assertFalse(reader.canHandleTag(SensorTag.of("TAG-A", "0000-unk")));
    assertFalse(reader.canHandleTag(SensorTag.of("TAG-A")));
  }

  @Test
  void testReadTagFiles() throws IOException {
    SensorFileReader reader = reader(SensorReaderConfig.defaults());
    RawSeries series = reader.readTagFiles(SensorTag.of("TAG-A", "1101-SFB"),
        Arrays.<Partition>asList(Partition.month(2020, 1), Partition.month(2020, 2)), false);
    assertEquals(4, series.size());

    assertThrows(FileNotFoundException.class,
        () -> reader.readTagFiles(SensorTag.of("TAG-MISSING", "1101-sfb"),
            Collections.singletonList(Partition.month(2020, 1)), false));
    assertThrows(SensorConfigException.class,
        () -> reader.readTagFiles(SensorTag.of("TAG-A"),
            Collections.singletonList(Partition.month(2020, 1)), false));
  }
}
