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

import org.apache.calcite.adapter.sensor.ReaderMismatchException;
import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.SensorTag;
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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link AssetDirectoryResolver}.
 */
@Tag("unit")
public class AssetDirectoryResolverTest {

  @TempDir
  Path tempDir;

  private AssetsConfig catalog;

  @BeforeEach
  void setUp() throws IOException {
    Files.createDirectories(tempDir.resolve("plant/1101-SFB/TAG-B"));
    Files.createDirectories(tempDir.resolve("plant/1101-SFB/TAG-A"));
    Files.createDirectories(tempDir.resolve("plant/1755-GRA/TAG-C"));
    Files.createFile(tempDir.resolve("plant/1101-SFB/TAG-D"));
    String base = tempDir.resolve("plant").toString();
    catalog = new AssetsConfig(ImmutableMap.<String, Map<String, AssetPathSpec>>of(
        "local", ImmutableMap.of(
            "1101-sfb", new AssetPathSpec("ncs_reader", base, "1101-SFB"),
            "1755-gra", new AssetPathSpec("ncs_reader", base, "1755-GRA"),
            "empty", new AssetPathSpec("ncs_reader", base, "MISSING"),
            "9999-oth", new AssetPathSpec("other_reader", base, "OTH"))));
  }

  @Test
  void testResolveGroupsByAsset() throws IOException {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new LocalFileStorageProvider(), "local");
    List<SensorTag> tags = Arrays.asList(
        SensorTag.of("TAG-C", "1755-gra"),
        SensorTag.of("TAG-B", "1101-sfb"),
        SensorTag.of("TAG-X", "1755-gra"),
        SensorTag.of("TAG-A", "1101-sfb"));

    List<AssetDirectoryResolver.TagDirectory> dirs = resolver.resolve(catalog, tags, null);

    assertEquals(4, dirs.size());
    assertEquals("TAG-C", dirs.get(0).getTag().getName());
    assertEquals(tempDir.resolve("plant/1755-GRA/TAG-C").toString(), dirs.get(0).getDirectory());
    assertEquals("TAG-X", dirs.get(1).getTag().getName());
    assertNull(dirs.get(1).getDirectory());
    // listing order within an asset
    assertEquals("TAG-A", dirs.get(2).getTag().getName());
    assertEquals("TAG-B", dirs.get(3).getTag().getName());
  }

  @Test
  void testFilesAreNotDirectories() throws IOException {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new LocalFileStorageProvider(), "local");
    List<AssetDirectoryResolver.TagDirectory> dirs = resolver.tagDirsLookup(
        tempDir.resolve("plant/1101-SFB").toString(),
        Arrays.asList(SensorTag.of("TAG-D"), SensorTag.of("TAG-A")));
    assertEquals("TAG-A", dirs.get(0).getTag().getName());
    assertEquals("TAG-D", dirs.get(1).getTag().getName());
    assertNull(dirs.get(1).getDirectory());
  }

  @Test
  void testMissingBaseDirectory() throws IOException {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new LocalFileStorageProvider(), "local");
    List<AssetDirectoryResolver.TagDirectory> dirs =
        resolver.resolve(catalog, Arrays.asList(SensorTag.of("TAG-A", "empty")), null);
    assertEquals(1, dirs.size());
    assertNull(dirs.get(0).getDirectory());
  }

  @Test
  void testBaseDirectoryBypassesCatalog() throws IOException {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new LocalFileStorageProvider(), "local");
    List<AssetDirectoryResolver.TagDirectory> dirs = resolver.resolve(null,
        Arrays.asList(SensorTag.of("TAG-C")), tempDir.resolve("plant/1755-GRA").toString());
    assertEquals(tempDir.resolve("plant/1755-GRA/TAG-C").toString(), dirs.get(0).getDirectory());
  }

  @Test
  void testSameNameFromSeveralAssetsUnderBaseDirectory() {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new LocalFileStorageProvider(), "local");
    String baseDir = tempDir.resolve("plant/1101-SFB").toString();
    List<AssetDirectoryResolver.TagDirectory> dirs = resolver.resolve(null,
        Arrays.asList(SensorTag.of("TAG-A", "a"), SensorTag.of("TAG-A", "b")), baseDir);
    assertEquals(2, dirs.size());
    String expected = tempDir.resolve("plant/1101-SFB/TAG-A").toString();
    assertEquals(SensorTag.of("TAG-A", "a"), dirs.get(0).getTag());
    assertEquals(expected, dirs.get(0).getDirectory());
    assertEquals(SensorTag.of("TAG-A", "b"), dirs.get(1).getTag());
    assertEquals(expected, dirs.get(1).getDirectory());
  }

  @Test
  void testListingFailureStaysWithItsAsset() {
    AssetDirectoryResolver resolver =
        new AssetDirectoryResolver(new FailingListStorage("1755-GRA"), "local");
    List<AssetDirectoryResolver.TagDirectory> dirs = resolver.resolve(catalog,
        Arrays.asList(SensorTag.of("TAG-C", "1755-gra"), SensorTag.of("TAG-A", "1101-sfb")),
        null);
    assertEquals(2, dirs.size());
    assertEquals("TAG-C", dirs.get(0).getTag().getName());
    assertNull(dirs.get(0).getDirectory());
    assertNotNull(dirs.get(0).getFailure());
    assertEquals("TAG-A", dirs.get(1).getTag().getName());
    assertEquals(tempDir.resolve("plant/1101-SFB/TAG-A").toString(), dirs.get(1).getDirectory());
    assertNull(dirs.get(1).getFailure());
  }

  @Test
  void testConfigErrorsBeforeStorageAccess() {
    AssetDirectoryResolver resolver = new AssetDirectoryResolver(new UnusableStorage(), "local");
    assertThrows(SensorConfigException.class,
        () -> resolver.resolve(catalog, Arrays.asList(SensorTag.of("TAG-A")), null));
    assertThrows(SensorConfigException.class,
        () -> resolver.resolve(catalog,
            Arrays.asList(SensorTag.of("TAG-A", "1101-sfb"), SensorTag.of("TAG-Z", "nowhere")),
            null));
    assertThrows(SensorConfigException.class,
        () -> resolver.resolve(null, Arrays.asList(SensorTag.of("TAG-A", "1101-sfb")), null));
    ReaderMismatchException e = assertThrows(ReaderMismatchException.class,
        () -> resolver.resolve(catalog, Arrays.asList(SensorTag.of("TAG-O", "9999-oth")), null));
    assertEquals("ncs_reader", e.getExpectedReader());
    assertEquals("other_reader", e.getActualReader());
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

  /** Storage that fails every call. */
  private static class UnusableStorage extends LocalFileStorageProvider {
    @Override public List<StorageProvider.FileEntry> listFiles(String path, boolean recursive)
        throws IOException {
      throw new IOException("storage should not be touched");
    }
  }
}
