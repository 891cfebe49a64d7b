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

import org.apache.calcite.adapter.sensor.SensorFixtures;
import org.apache.calcite.adapter.sensor.storage.LocalFileStorageProvider;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.apache.calcite.adapter.sensor.SensorFixtures.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ParquetFileFormat}.
 */
@Tag("unit")
public class ParquetFileFormatTest {

  @TempDir
  Path tempDir;

  @Test
  void testReadRows() throws IOException {
    File file = SensorFixtures.writeParquet(tempDir.resolve("TAG-1_202001.parquet"), "TAG-1",
        Arrays.asList(
            row("2020-01-01T00:00:00Z", 1.5, 192),
            row("2020-01-01T00:00:01Z", 2.5, null),
            row("2020-01-01T00:00:02Z", Double.NaN, 0)));

    List<TimeSeriesRow> rows =
        new ParquetFileFormat().read(new LocalFileStorageProvider(), file.getAbsolutePath());

    assertEquals(3, rows.size());
    assertEquals(Instant.parse("2020-01-01T00:00:01Z").toEpochMilli(),
        rows.get(1).getEpochMillis());
    assertEquals(1.5, rows.get(0).getValue());
    assertEquals(Integer.valueOf(192), rows.get(0).getStatus());
    assertNull(rows.get(1).getStatus());
    assertEquals(Integer.valueOf(0), rows.get(2).getStatus());
  }

  @Test
  void testMissingFile() {
    assertThrows(FileNotFoundException.class,
        () -> new ParquetFileFormat().read(new LocalFileStorageProvider(),
            tempDir.resolve("missing.parquet").toString()));
  }

  @Test
  void testEpochUnits() {
    long millis = 1577836800000L;
    assertEquals(millis, Timestamps.fromEpoch(millis, "timestamp-millis"));
    assertEquals(millis, Timestamps.fromEpoch(millis * 1000, "timestamp-micros"));
    assertEquals(millis, Timestamps.fromEpoch(millis * 1000, null));
    assertEquals(millis, Timestamps.fromEpoch(millis * 1000_000, null));
    assertEquals(millis, Timestamps.fromEpoch(millis, null));
  }

  @Test
  void testParseTimestamps() {
    long midnight = 1577836800000L;
    assertEquals(midnight, Timestamps.parse("2020-01-01"));
    assertEquals(midnight, Timestamps.parse("2020-01-01T00:00:00"));
    assertEquals(midnight, Timestamps.parse("2020-01-01 00:00:00Z"));
    assertEquals(midnight, Timestamps.parse("2020-01-01T07:00:00+07:00"));
    assertEquals(midnight, Timestamps.parse("2020-01-01T07:00:00+0700"));
  }
}
