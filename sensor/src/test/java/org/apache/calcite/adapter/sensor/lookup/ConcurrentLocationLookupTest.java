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
package org.apache.calcite.adapter.sensor.lookup;

import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ConcurrentLocationLookup}.
 */
@Tag("unit")
public class ConcurrentLocationLookupTest {
  private static final List<Partition> PARTITIONS =
      Arrays.<Partition>asList(Partition.month(2020, 1), Partition.month(2020, 2));

  @TempDir
  Path tempDir;

  private AssetsConfig catalog;
  private List<SensorTag> tags;

  @BeforeEach
  void setUp() throws IOException {
    tags = new ArrayList<SensorTag>();
    for (int i = 0; i < 12; i++) {
      String name = "TAG-" + i;
      tags.add(SensorTag.of(name, "1101-sfb"));
      if (i % 4 == 3) {
        continue;
      }
      Path tagDir = tempDir.resolve("plant/1101-SFB").resolve(name);
      Files.createDirectories(tagDir.resolve("parquet/2020"));
      Files.write(tagDir.resolve("parquet/2020/" + name + "_202001.parquet"), new byte[4]);
      if (i % 2 == 0) {
        Files.write(tagDir.resolve("parquet/2020/" + name + "_202002.parquet"), new byte[4]);
      }
    }
    catalog = new AssetsConfig(ImmutableMap.<String, Map<String, AssetPathSpec>>of("local",
        ImmutableMap.of("1101-sfb",
            new AssetPathSpec("ncs_reader", tempDir.resolve("plant").toString(), "1101-SFB"))));
  }

  private static ConcurrentLocationLookup lookup(LocalFileStorageProvider storage) {
    return ConcurrentLocationLookup.of(LocationResolver.create(storage, null, "local", null));
  }

  @Test
  void testThreadCountDoesNotChangeResult() throws IOException {
    ConcurrentLocationLookup lookup = lookup(new LocalFileStorageProvider());
    List<TagLocations> sequential = lookup.lookup(catalog, tags, PARTITIONS, 1, null);
    assertEquals(tags.size(), sequential.size());
    for (int i = 0; i < tags.size(); i++) {
      TagLocations result = sequential.get(i);
      assertEquals(tags.get(i), result.getTag());
      if (i % 4 == 3) {
        assertFalse(result.isAvailable());
      } else {
        assertEquals(i % 2 == 0 ? 2 : 1, result.partitions().size());
      }
    }
    assertEquals(sequential, lookup.lookup(catalog, tags, PARTITIONS, 2, null));
    assertEquals(sequential, lookup.lookup(catalog, tags, PARTITIONS, 10, null));
  }

  @Test
  void testInvalidThreadCount() {
    SensorConfigException e = assertThrows(SensorConfigException.class,
        () -> lookup(new LocalFileStorageProvider())
            .lookup(catalog, tags, PARTITIONS, 0, null));
    assertTrue(e.getMessage().contains("thread_count"));
  }

  @Test
  void testFailureDegradesToNotFound() throws IOException {
    ConcurrentLocationLookup lookup = lookup(new FailingStorage("TAG-2"));
    List<TagLocations> results = lookup.lookup(catalog, tags, PARTITIONS, 4, null);
    assertEquals(tags.size(), results.size());
    assertFalse(results.get(2).isAvailable());
    assertTrue(results.get(0).isAvailable());
    assertTrue(results.get(4).isAvailable());
  }

  @Test
  void testFailFastRethrowsFirstFailure() {
    ConcurrentLocationLookup lookup = lookup(new FailingStorage("TAG-5"));
    IOException e = assertThrows(IOException.class,
        () -> lookup.lookup(catalog, tags, PARTITIONS, 3, null, true));
    assertTrue(e.getMessage().contains("TAG-5"));
    assertThrows(IOException.class,
        () -> lookup.lookup(catalog, tags, PARTITIONS, 1, null, true));
  }

  @Test
  void testListingFailureOnlyAffectsItsAsset() throws IOException {
    Path plant = tempDir.resolve("plant");
    Files.createDirectories(plant.resolve("GOOD/T1/parquet/2020"));
    Files.write(plant.resolve("GOOD/T1/parquet/2020/T1_202001.parquet"), new byte[4]);
    Files.createDirectories(plant.resolve("BAD/T2"));
    AssetsConfig twoAssets = new AssetsConfig(
        ImmutableMap.<String, Map<String, AssetPathSpec>>of("local", ImmutableMap.of(
            "good", new AssetPathSpec("ncs_reader", plant.toString(), "GOOD"),
            "bad", new AssetPathSpec("ncs_reader", plant.toString(), "BAD"))));
    List<SensorTag> sensors = Arrays.asList(SensorTag.of("T1", "good"), SensorTag.of("T2", "bad"));
    ConcurrentLocationLookup lookup = lookup(new FailingListStorage("BAD"));

    for (int threads : new int[] {1, 4}) {
      List<TagLocations> results = lookup.lookup(twoAssets, sensors, PARTITIONS, threads, null);
      assertEquals(2, results.size());
      assertEquals(SensorTag.of("T1", "good"), results.get(0).getTag());
      assertTrue(results.get(0).isAvailable());
      assertEquals(1, results.get(0).partitions().size());
      assertEquals(SensorTag.of("T2", "bad"), results.get(1).getTag());
      assertFalse(results.get(1).isAvailable());
    }

    IOException e = assertThrows(IOException.class,
        () -> lookup.lookup(twoAssets, sensors, PARTITIONS, 4, null, true));
    assertTrue(e.getMessage().contains("BAD"));
  }

  @Test
  void testSameNameFromSeveralAssetsUnderBaseDirectory() throws IOException {
    String baseDir = tempDir.resolve("plant/1101-SFB").toString();
    List<SensorTag> sensors =
        Arrays.asList(SensorTag.of("TAG-0", "a"), SensorTag.of("TAG-0", "b"));
    List<TagLocations> results = lookup(new LocalFileStorageProvider())
        .lookup(null, sensors, PARTITIONS, 2, baseDir);
    assertEquals(2, results.size());
    for (int i = 0; i < 2; i++) {
      assertEquals(sensors.get(i), results.get(i).getTag());
      assertEquals(2, results.get(i).partitions().size());
    }
  }

  /** Storage whose listings fail under one directory. */
  private static class FailingListStorage extends LocalFileStorageProvider {
    private final String brokenDir;

    FailingListStorage(String brokenDir) {
      this.brokenDir = brokenDir;
    }

    @Override public List<StorageProvider.FileEntry> listFiles(String path, boolean recursive)
        throws IOException {
      if (path.contains(brokenDir)) {
        throw new IOException("Listing failed for " + path);
      }
      return super.listFiles(path, recursive);
    }
  }

  /** Storage whose existence checks fail for one sensor's files. */
  private static class FailingStorage extends LocalFileStorageProvider {
    private final String brokenTag;

    FailingStorage(String brokenTag) {
      this.brokenTag = brokenTag;
    }

    @Override public boolean exists(String path) throws IOException {
      if (path.contains(brokenTag + "_")) {
        throw new IOException("Storage failure reading " + path);
      }
      return super.exists(path);
    }
  }
}
