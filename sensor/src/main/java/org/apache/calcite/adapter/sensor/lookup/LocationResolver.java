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

import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.format.FileTypeProbe;
import org.apache.calcite.adapter.sensor.format.FileTypeProbes;
import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds which of a sensor's partition files physically exist.
 *
 * <p>For every requested partition the probes are tried in priority order.
 * Only probes storing that partition's granularity take part. The first
 * candidate that exists and is no larger than the maximum file size wins
 * and the remaining probes are skipped. An oversized file counts as
 * missing, so a lower-priority probe may still supply the partition.
 *
 * <p>Example, with the default probes and monthly partitions:
 * <pre>{@code
 * LocationResolver resolver = LocationResolver.create(storage, null, "local",
 *     LocationResolver.DEFAULT_MAX_FILE_SIZE);
 * TagLocations found = resolver.filesLookup("/data/asset/TAG-1", SensorTag.of("TAG-1"),
 *     PartitionIterator.enumerate(PartitionBy.MONTH, start, end));
 * }</pre>
 */
public class LocationResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocationResolver.class);

  /** Files above 1000 MiB are not downloaded. */
  public static final long DEFAULT_MAX_FILE_SIZE = 1000L * 1024 * 1024;

  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private final StorageProvider storage;
  private final List<FileTypeProbe> probes;
  private final String storageName;
  private final @Nullable Long maxFileSize;

  /**
   * Creates a resolver.
   *
   * @param storage Storage holding the sensor directories
   * @param probes Probes in priority order
   * @param storageName Name of the storage in the asset catalog
   * @param maxFileSize Largest accepted file in bytes, null for no limit
   */
  public LocationResolver(StorageProvider storage, List<FileTypeProbe> probes,
      String storageName, @Nullable Long maxFileSize) {
    this.storage = storage;
    this.probes = ImmutableList.copyOf(probes);
    this.storageName = storageName;
    this.maxFileSize = maxFileSize;
  }

  /**
   * Creates a resolver with probes looked up by name.
   *
   * @param typeNames Probe names in priority order, null for the defaults
   * @throws org.apache.calcite.adapter.sensor.SensorConfigException on an unknown name
   */
  public static LocationResolver create(StorageProvider storage, @Nullable List<String> typeNames,
      @Nullable String storageName, @Nullable Long maxFileSize) {
    return new LocationResolver(storage, FileTypeProbes.load(typeNames),
        storageName != null ? storageName : storage.getStorageType(), maxFileSize);
  }

  public StorageProvider getStorage() {
    return storage;
  }

  public List<FileTypeProbe> getProbes() {
    return probes;
  }

  public String getStorageName() {
    return storageName;
  }

  public @Nullable Long getMaxFileSize() {
    return maxFileSize;
  }

  /**
   * Percent-encodes a sensor name the way sensor directories and files are
   * named: unreserved characters and spaces stay, every other character is
   * written as its UTF-8 bytes in {@code %XX} form.
   */
  public static String quoteTagName(String tagName) {
    StringBuilder sb = new StringBuilder(tagName.length());
    for (byte b : tagName.getBytes(StandardCharsets.UTF_8)) {
      int c = b & 0xFF;
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
          || c == '-' || c == '_' || c == '.' || c == '~' || c == ' ') {
        sb.append((char) c);
      } else {
        sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
      }
    }
    return sb.toString();
  }

  /**
   * Finds the files of one sensor for the given partitions.
   *
   * @param tagDir The sensor's directory
   * @param tag Sensor
   * @param partitions Requested partitions
   * @return Found locations, an empty mapping if nothing matched
   * @throws IOException if the storage fails for a reason other than a missing file
   */
  public TagLocations filesLookup(String tagDir, SensorTag tag,
      Iterable<? extends Partition> partitions) throws IOException {
    String tagName = quoteTagName(tag.getName());
    Map<Partition, Location> locations = new LinkedHashMap<Partition, Location>();
    for (Partition partition : partitions) {
      Location location = findLocation(tagDir, tagName, partition);
      if (location != null) {
        locations.put(partition, location);
      }
    }
    LOGGER.debug("Found {} of {} partitions for {} in {}",
        locations.size(), sizeOf(partitions), tag.getName(), tagDir);
    return new TagLocations(tag, locations);
  }

  private @Nullable Location findLocation(String tagDir, String tagName, Partition partition)
      throws IOException {
    List<Partition> single = Collections.singletonList(partition);
    for (FileTypeProbe probe : probes) {
      if (!probe.accepts(partition)) {
        continue;
      }
      for (FileTypeProbe.CandidatePath candidate : probe.buildPaths(tagName, single)) {
        String fullPath = storage.resolvePath(tagDir, candidate.getRelativePath());
        if (storage.exists(fullPath) && validateFile(fullPath)) {
          return new Location(fullPath, probe.getFormat(), candidate.getPartition());
        }
        LOGGER.debug("No usable {} file for {} at {}", probe.getName(), partition, fullPath);
      }
    }
    return null;
  }

  /**
   * Applies the size policy. Files deleted between the existence check and
   * the stat count as missing.
   */
  boolean validateFile(String fullPath) throws IOException {
    if (maxFileSize == null) {
      return true;
    }
    long size;
    try {
      size = storage.getMetadata(fullPath).getSize();
    } catch (FileNotFoundException e) {
      LOGGER.debug("File '{}' disappeared before its size could be read", fullPath);
      return false;
    }
    if (size > maxFileSize) {
      LOGGER.debug("Size of file '{}' is {} bytes that bigger than the maximum file size {} bytes",
          fullPath, size, maxFileSize);
      return false;
    }
    return true;
  }

  private static int sizeOf(Iterable<?> iterable) {
    if (iterable instanceof Collection) {
      return ((Collection<?>) iterable).size();
    }
    int size = 0;
    for (Object ignored : iterable) {
      size++;
    }
    return size;
  }
}
