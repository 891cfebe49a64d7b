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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the files of many sensors, optionally on a fixed thread pool.
 *
 * <p>Directories are resolved first, once per asset root. File lookups
 * then run one unit of work per sensor. A sensor whose asset root could
 * not be listed counts as a failed unit. Results come back in the order
 * the sensors were given, whatever order the workers finish in.
 *
 * <p>A failing unit does not affect its siblings. By default the failure
 * is logged and the sensor is reported as not found. In fail-fast mode
 * every unit still runs to completion, then the first failure in input
 * order is rethrown.
 */
public class ConcurrentLocationLookup {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConcurrentLocationLookup.class);

  private final AssetDirectoryResolver directoryResolver;
  private final LocationResolver locationResolver;

  public ConcurrentLocationLookup(AssetDirectoryResolver directoryResolver,
      LocationResolver locationResolver) {
    this.directoryResolver = directoryResolver;
    this.locationResolver = locationResolver;
  }

  /**
   * Creates a lookup whose directory resolver shares the location
   * resolver's storage and storage name.
   */
  public static ConcurrentLocationLookup of(LocationResolver locationResolver) {
    return new ConcurrentLocationLookup(
        new AssetDirectoryResolver(locationResolver.getStorage(),
            locationResolver.getStorageName()),
        locationResolver);
  }

  public AssetDirectoryResolver getDirectoryResolver() {
    return directoryResolver;
  }

  public LocationResolver getLocationResolver() {
    return locationResolver;
  }

  /**
   * Same as {@link #lookup(AssetCatalog, List, Iterable, int, String, boolean)}
   * with failures degraded to "not found".
   */
  public List<TagLocations> lookup(@Nullable AssetCatalog catalog, List<SensorTag> tags,
      Iterable<? extends Partition> partitions, int threads, @Nullable String baseDir)
      throws IOException {
    return lookup(catalog, tags, partitions, threads, baseDir, false);
  }

  /**
   * Finds the files of every sensor.
   *
   * @param catalog Asset catalog, may be null when a base directory is given
   * @param tags Sensors
   * @param partitions Partitions to look for
   * @param threads Worker count; 1 runs on the calling thread
   * @param baseDir Directory overriding the catalog, or null
   * @param failFast Whether a failing sensor fails the whole lookup
   * @return One result per sensor, in input order
   * @throws SensorConfigException if threads is below 1 or the asset configuration is invalid
   * @throws IOException in fail-fast mode, if a sensor's directory or file lookup failed
   */
  public List<TagLocations> lookup(@Nullable AssetCatalog catalog, List<SensorTag> tags,
      Iterable<? extends Partition> partitions, int threads, @Nullable String baseDir,
      boolean failFast) throws IOException {
    if (threads < 1) {
      throw new SensorConfigException("thread_count should bigger or equal to 1");
    }
    final List<Partition> partitionList = ImmutableList.copyOf(partitions);

    Map<SensorTag, AssetDirectoryResolver.TagDirectory> directories =
        new HashMap<SensorTag, AssetDirectoryResolver.TagDirectory>();
    for (AssetDirectoryResolver.TagDirectory tagDirectory
        : directoryResolver.resolve(catalog, tags, baseDir)) {
      directories.put(tagDirectory.getTag(), tagDirectory);
    }

    List<Outcome> outcomes;
    if (threads == 1) {
      outcomes = new ArrayList<Outcome>(tags.size());
      for (SensorTag tag : tags) {
        outcomes.add(resolveOne(tag, directories.get(tag), partitionList));
      }
    } else {
      outcomes = runParallel(tags, directories, partitionList, threads);
    }

    List<TagLocations> results = new ArrayList<TagLocations>(outcomes.size());
    Exception firstFailure = null;
    for (Outcome outcome : outcomes) {
      if (outcome.failure != null) {
        if (failFast) {
          if (firstFailure == null) {
            firstFailure = outcome.failure;
          }
        } else {
          LOGGER.warn("Lookup of {} failed, treating it as not found: {}",
              outcome.tag.getName(), outcome.failure.toString());
        }
        results.add(TagLocations.notFound(outcome.tag));
      } else {
        results.add(outcome.result);
      }
    }
    if (firstFailure != null) {
      if (firstFailure instanceof IOException) {
        throw (IOException) firstFailure;
      }
      throw (RuntimeException) firstFailure;
    }
    return results;
  }

  private List<Outcome> runParallel(List<SensorTag> tags,
      final Map<SensorTag, AssetDirectoryResolver.TagDirectory> directories,
      final List<Partition> partitions, int threads) {
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<CompletableFuture<Outcome>> futures = new ArrayList<CompletableFuture<Outcome>>();
      for (final SensorTag tag : tags) {
        futures.add(
            CompletableFuture.supplyAsync(() -> resolveOne(tag, directories.get(tag), partitions),
            executor));
      }
      // Wait for every unit before looking at any result
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

      List<Outcome> outcomes = new ArrayList<Outcome>(futures.size());
      for (CompletableFuture<Outcome> future : futures) {
        outcomes.add(future.join());
      }
      return outcomes;
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
          LOGGER.warn("Lookup executor did not terminate in time");
        }
      } catch (InterruptedException e) {
        LOGGER.warn("Lookup executor interrupted: {}", e.getMessage());
        Thread.currentThread().interrupt();
      }
    }
  }

  private Outcome resolveOne(SensorTag tag,
      AssetDirectoryResolver.@Nullable TagDirectory tagDirectory, List<Partition> partitions) {
    if (tagDirectory != null && tagDirectory.getFailure() != null) {
      return new Outcome(tag, null, tagDirectory.getFailure());
    }
    String tagDir = tagDirectory == null ? null : tagDirectory.getDirectory();
    if (tagDir == null) {
      LOGGER.info("Unable to find tag '{}' (asset '{}') directory in storage '{}'",
          tag.getName(), tag.getAsset(), locationResolver.getStorageName());
      return new Outcome(tag, TagLocations.notFound(tag), null);
    }
    try {
      return new Outcome(tag, locationResolver.filesLookup(tagDir, tag, partitions), null);
    } catch (IOException | RuntimeException e) {
      return new Outcome(tag, null, e);
    }
  }

  /**
   * Result or failure of one sensor's unit of work.
   */
  private static final class Outcome {
    final SensorTag tag;
    final TagLocations result;
    final Exception failure;

    Outcome(SensorTag tag, @Nullable TagLocations result, @Nullable Exception failure) {
      this.tag = tag;
      this.result = result;
      this.failure = failure;
    }
  }
}
