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
import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves sensors to their directories.
 *
 * <p>Sensors are grouped by asset in first-seen order and every asset is
 * resolved once through the {@link AssetCatalog}. Each asset root is listed
 * once and its subdirectories are matched, case-sensitively, against the
 * percent-encoded sensor names. A sensor without a matching directory is
 * returned with a null directory.
 *
 * <p>A caller-supplied base directory bypasses the catalog: all sensors
 * are then looked up directly under it.
 */
public class AssetDirectoryResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(AssetDirectoryResolver.class);

  /** Reader name sensor assets must be bound to in the catalog. */
  public static final String READER_NAME = "ncs_reader";

  private final StorageProvider storage;
  private final String storageName;
  private final String readerName;

  public AssetDirectoryResolver(StorageProvider storage, String storageName) {
    this(storage, storageName, READER_NAME);
  }

  public AssetDirectoryResolver(StorageProvider storage, String storageName, String readerName) {
    this.storage = storage;
    this.storageName = storageName;
    this.readerName = readerName;
  }

  public String getStorageName() {
    return storageName;
  }

  public String getReaderName() {
    return readerName;
  }

  /**
   * Resolves the directory of every sensor.
   *
   * <p>Without a base directory all assets are validated before any
   * storage access.
   *
   * <p>A failure to list an asset root does not stop the other assets. The
   * sensors of that asset are returned with the failure attached, see
   * {@link TagDirectory#getFailure()}.
   *
   * @param catalog Asset catalog, may be null when a base directory is given
   * @param tags Sensors
   * @param baseDir Directory overriding the catalog, or null
   * @return One entry per distinct sensor, grouped by asset
   * @throws SensorConfigException if a sensor has no asset or an asset is unknown
   * @throws ReaderMismatchException if an asset is bound to another reader
   */
  public List<TagDirectory> resolve(@Nullable AssetCatalog catalog, List<SensorTag> tags,
      @Nullable String baseDir) {
    List<Map.Entry<AssetPathSpec, List<SensorTag>>> groups =
        new ArrayList<Map.Entry<AssetPathSpec, List<SensorTag>>>();
    if (baseDir == null || baseDir.isEmpty()) {
      Map<String, List<SensorTag>> tagsByAsset = new LinkedHashMap<String, List<SensorTag>>();
      for (SensorTag tag : tags) {
        if (!tag.hasAsset()) {
          throw new SensorConfigException(tag.getName() + " tag has empty asset");
        }
        tagsByAsset.computeIfAbsent(tag.getAsset(), asset -> new ArrayList<SensorTag>()).add(tag);
      }
      for (Map.Entry<String, List<SensorTag>> entry : tagsByAsset.entrySet()) {
        AssetPathSpec pathSpec = pathSpec(catalog, entry.getKey());
        groups.add(new AbstractMap.SimpleImmutableEntry<AssetPathSpec, List<SensorTag>>(
            pathSpec, entry.getValue()));
      }
    } else {
      groups.add(new AbstractMap.SimpleImmutableEntry<AssetPathSpec, List<SensorTag>>(
          new AssetPathSpec(readerName, baseDir, ""), tags));
    }

    List<TagDirectory> result = new ArrayList<TagDirectory>();
    for (Map.Entry<AssetPathSpec, List<SensorTag>> group : groups) {
      String assetDir = group.getKey().fullPath(storage);
      try {
        result.addAll(tagDirsLookup(assetDir, group.getValue()));
      } catch (IOException e) {
        LOGGER.warn("Listing of '{}' in storage '{}' failed: {}", assetDir, storageName,
            e.toString());
        for (SensorTag tag : group.getValue()) {
          result.add(TagDirectory.failed(tag, e));
        }
      }
    }
    return result;
  }

  /**
   * Resolves an asset through the catalog and checks its reader binding.
   *
   * @throws SensorConfigException if the asset is unknown
   * @throws ReaderMismatchException if the asset is bound to another reader
   */
  public AssetPathSpec pathSpec(@Nullable AssetCatalog catalog, String asset) {
    AssetPathSpec pathSpec = catalog == null ? null : catalog.getPath(storageName, asset);
    if (pathSpec == null) {
      throw new SensorConfigException("Unable to find asset '" + asset + "' in storage '"
          + storageName + "'");
    }
    if (!readerName.equals(pathSpec.getReaderName())) {
      throw new ReaderMismatchException(readerName, pathSpec.getReaderName());
    }
    return pathSpec;
  }

  /**
   * Lists a base directory once and matches its subdirectories against the
   * sensors. Found sensors come first, in listing order, followed by the
   * sensors that were not found.
   *
   * @param baseDir Directory holding sensor directories
   * @param tags Sensors
   * @return One entry per distinct sensor; sensors sharing a name share its directory
   * @throws IOException if the listing fails for a reason other than a missing base directory
   */
  public List<TagDirectory> tagDirsLookup(String baseDir, List<SensorTag> tags)
      throws IOException {
    Map<String, List<SensorTag>> pending = new LinkedHashMap<String, List<SensorTag>>();
    for (SensorTag tag : tags) {
      List<SensorTag> sameName = pending.computeIfAbsent(
          LocationResolver.quoteTagName(tag.getName()), name -> new ArrayList<SensorTag>());
      if (!sameName.contains(tag)) {
        sameName.add(tag);
      }
    }
    List<TagDirectory> result = new ArrayList<TagDirectory>();
    List<StorageProvider.FileEntry> entries;
    try {
      entries = storage.listFiles(baseDir, false);
    } catch (FileNotFoundException e) {
      LOGGER.warn("Base directory '{}' not found in storage '{}'", baseDir, storageName);
      entries = new ArrayList<StorageProvider.FileEntry>();
    }
    for (StorageProvider.FileEntry entry : entries) {
      if (!entry.isDirectory()) {
        continue;
      }
      List<SensorTag> matched = pending.remove(entry.getName());
      if (matched != null) {
        for (SensorTag tag : matched) {
          result.add(new TagDirectory(tag, entry.getPath()));
        }
      }
    }
    for (List<SensorTag> missing : pending.values()) {
      for (SensorTag tag : missing) {
        LOGGER.debug("Directory of {} not found under {}", tag.getName(), baseDir);
        result.add(new TagDirectory(tag, null));
      }
    }
    return result;
  }

  /**
   * A sensor and its directory, null when the directory was not found or
   * when listing its asset root failed.
   */
  public static final class TagDirectory {
    private final SensorTag tag;
    private final @Nullable String directory;
    private final @Nullable IOException failure;

    public TagDirectory(SensorTag tag, @Nullable String directory) {
      this(tag, directory, null);
    }

    private TagDirectory(SensorTag tag, @Nullable String directory,
        @Nullable IOException failure) {
      this.tag = tag;
      this.directory = directory;
      this.failure = failure;
    }

    /** Creates an entry for a sensor whose asset root could not be listed. */
    public static TagDirectory failed(SensorTag tag, IOException failure) {
      return new TagDirectory(tag, null, failure);
    }

    public SensorTag getTag() {
      return tag;
    }

    public @Nullable String getDirectory() {
      return directory;
    }

    /** Returns the listing failure, or null if the asset root was listed. */
    public @Nullable IOException getFailure() {
      return failure;
    }

    @Override public boolean equals(@Nullable Object o) {
      if (!(o instanceof TagDirectory)) {
        return false;
      }
      TagDirectory that = (TagDirectory) o;
      return tag.equals(that.tag) && Objects.equals(directory, that.directory);
    }

    @Override public int hashCode() {
      return Objects.hash(tag, directory);
    }

    @Override public String toString() {
      return tag.getName() + " -> " + (failure == null ? directory : failure.toString());
    }
  }
}
