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
import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.lookup.AssetCatalog;
import org.apache.calcite.adapter.sensor.lookup.AssetDirectoryResolver;
import org.apache.calcite.adapter.sensor.lookup.AssetPathSpec;
import org.apache.calcite.adapter.sensor.lookup.ConcurrentLocationLookup;
import org.apache.calcite.adapter.sensor.lookup.LocationResolver;
import org.apache.calcite.adapter.sensor.lookup.TagLocations;
import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.partition.PartitionIterator;
import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Reads sensor series from partitioned files.
 *
 * <p>Sensors are located through an {@link AssetCatalog}, or directly under
 * a configured base directory. The requested range is split into
 * partitions of the configured granularity, the files of every sensor are
 * looked up and read on a fixed thread pool, and each series is cut to the
 * requested range.
 *
 * <p>Example:
 * <pre>{@code
 * SensorFileReader reader = new SensorFileReader(storage,
 *     AssetsConfig.fromResource("/assets.yaml"),
 *     SensorReaderConfig.builder().threads(10).storageName("dataplatform").build());
 * List<RawSeries> series = reader.loadSeries(start, end,
 *     SensorTag.fromList(Arrays.asList("TAG-1", "TAG-2")), false);
 * }</pre>
 */
public class SensorFileReader implements SensorDataProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(SensorFileReader.class);

  private final StorageProvider storage;
  private final @Nullable AssetCatalog catalog;
  private final SensorReaderConfig config;
  private final String storageName;
  private final ConcurrentLocationLookup lookup;
  private final SeriesReader seriesReader;

  public SensorFileReader(StorageProvider storage, @Nullable AssetCatalog catalog,
      SensorReaderConfig config) {
    this.storage = storage;
    this.catalog = catalog;
    this.config = config;
    this.storageName = config.getStorageName() != null
        ? config.getStorageName() : storage.getStorageType();
    this.lookup = ConcurrentLocationLookup.of(
        LocationResolver.create(storage, config.getLookupFor(), storageName,
            config.getMaxFileSize()));
    this.seriesReader = new SeriesReader(storage);
    LOGGER.info("Starting sensor reader with {} threads", config.getThreads());
  }

  public SensorReaderConfig getConfig() {
    return config;
  }

  public String getStorageName() {
    return storageName;
  }

  /**
   * Name of the reader assets must be bound to.
   */
  public String getReaderName() {
    return AssetDirectoryResolver.READER_NAME;
  }

  public ConcurrentLocationLookup getLookup() {
    return lookup;
  }

  @Override public boolean canHandleTag(SensorTag tag) {
    return config.getDlBasePath() != null || basePathFromAsset(tag.getAsset()) != null;
  }

  @Override public List<RawSeries> loadSeries(ZonedDateTime start,
      ZonedDateTime end, List<SensorTag> tags, boolean dryRun) throws IOException {
    if (end.isBefore(start)) {
      throw new InvalidRangeException("Sensor reader called with end " + end
          + " before start " + start);
    }
    List<Partition> partitions =
        PartitionIterator.enumerate(config.getPartitionBy(), start, end);
    List<SensorTag> distinct = new ArrayList<SensorTag>(new LinkedHashSet<SensorTag>(tags));

    List<TagLocations> found = lookup.lookup(catalog, distinct, partitions,
        config.getThreads(), config.getDlBasePath(), config.isFailFast());
    List<RawSeries> loaded = readAll(found, dryRun);

    List<RawSeries> result = new ArrayList<RawSeries>(loaded.size());
    for (RawSeries series : loaded) {
      result.add(series.filter(start.toInstant(), end.toInstant()));
    }
    return result;
  }

  private List<RawSeries> readAll(final List<TagLocations> found, final boolean dryRun)
      throws IOException {
    List<RawSeries> result = new ArrayList<RawSeries>(found.size());
    if (config.getThreads() == 1 || found.size() < 2) {
      for (TagLocations tagLocations : found) {
        result.add(read(tagLocations, dryRun));
      }
      return result;
    }

    ExecutorService executor = Executors.newFixedThreadPool(config.getThreads());
    try {
      List<CompletableFuture<RawSeries>> futures = new ArrayList<CompletableFuture<RawSeries>>();
      for (final TagLocations tagLocations : found) {
        futures.add(CompletableFuture.supplyAsync(() -> {
          try {
            return read(tagLocations, dryRun);
          } catch (IOException e) {
            throw new CompletionException(e);
          }
        }, executor));
      }
      for (CompletableFuture<RawSeries> future : futures) {
        try {
          result.add(future.join());
        } catch (CompletionException e) {
          if (e.getCause() instanceof IOException) {
            throw (IOException) e.getCause();
          }
          throw e;
        }
      }
      return result;
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
          LOGGER.warn("Reader executor did not terminate in time");
        }
      } catch (InterruptedException e) {
        LOGGER.warn("Reader executor interrupted: {}", e.getMessage());
        Thread.currentThread().interrupt();
      }
    }
  }

  private RawSeries read(TagLocations tagLocations, boolean dryRun) throws IOException {
    if (!tagLocations.isAvailable()) {
      return RawSeries.empty(tagLocations.getTag().getName());
    }
    return seriesReader.readLocations(tagLocations, config.getRemoveStatusCodes(), dryRun);
  }

  /**
   * Reads the files of a single sensor for the given partitions.
   *
   * @param tag Sensor
   * @param partitions Partitions to read
   * @param dryRun Whether to only stat the first file
   * @return The sensor's series over all found partitions
   * @throws SensorConfigException if no base directory is known for the sensor
   * @throws FileNotFoundException if the sensor's directory does not exist
   * @throws IOException if storage access fails
   */
  public RawSeries readTagFiles(SensorTag tag, Iterable<? extends Partition> partitions,
      boolean dryRun) throws IOException {
    String basePath = config.getDlBasePath();
    if (basePath == null || basePath.isEmpty()) {
      basePath = basePathFromAsset(tag.getAsset());
    }
    if (basePath == null || basePath.isEmpty()) {
      throw new SensorConfigException("Unable to find base path from tag " + tag);
    }
    LOGGER.info("Downloading tag: {} for partitions: {}", tag, partitions);

    String tagDir = null;
    for (AssetDirectoryResolver.TagDirectory tagDirectory
        : lookup.getDirectoryResolver().tagDirsLookup(basePath, Collections.singletonList(tag))) {
      if (tagDirectory.getTag().equals(tag)) {
        tagDir = tagDirectory.getDirectory();
        break;
      }
    }
    if (tagDir == null) {
      throw new FileNotFoundException("Unable to find location of " + tag + " in storage "
          + storageName);
    }
    TagLocations tagLocations = lookup.getLocationResolver().filesLookup(tagDir, tag, partitions);
    return seriesReader.readLocations(tagLocations, config.getRemoveStatusCodes(), dryRun);
  }

  /**
   * Resolves an asset to the directory holding its sensors.
   *
   * @param asset Asset name, matched in lower case
   * @return Directory, or null if the asset is empty or unknown
   * @throws ReaderMismatchException if the asset is bound to another reader
   */
  public @Nullable String basePathFromAsset(@Nullable String asset) {
    if (asset == null || asset.isEmpty()) {
      return null;
    }
    LOGGER.debug("Looking for match for asset {}", asset);
    String key = asset.toLowerCase(Locale.ROOT);
    if (catalog == null) {
      return null;
    }
    AssetPathSpec pathSpec = catalog.getPath(storageName, key);
    if (pathSpec == null) {
      return null;
    }
    if (!getReaderName().equals(pathSpec.getReaderName())) {
      throw new ReaderMismatchException(getReaderName(), pathSpec.getReaderName());
    }
    String fullPath = pathSpec.fullPath(storage);
    LOGGER.debug("Found asset code {}, returning {}", key, fullPath);
    return fullPath;
  }
}
