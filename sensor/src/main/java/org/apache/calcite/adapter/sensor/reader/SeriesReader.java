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

import org.apache.calcite.adapter.sensor.format.TimeSeriesRow;
import org.apache.calcite.adapter.sensor.lookup.Location;
import org.apache.calcite.adapter.sensor.lookup.TagLocations;
import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import com.google.common.collect.ImmutableSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the files found for a sensor into one series.
 *
 * <p>Files are read in ascending partition order. Samples whose status
 * code is excluded are dropped, each file is sorted by time, and the files
 * are concatenated. When a timestamp occurs more than once the last
 * occurrence wins. A file that vanished after the lookup is skipped.
 */
public class SeriesReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(SeriesReader.class);

  private static final Comparator<TimeSeriesRow> BY_TIME =
      Comparator.comparingLong(TimeSeriesRow::getEpochMillis);

  private final StorageProvider storage;

  public SeriesReader(StorageProvider storage) {
    this.storage = storage;
  }

  public StorageProvider getStorage() {
    return storage;
  }

  /**
   * Reads every location of a sensor.
   *
   * @param tagLocations Locations found for the sensor
   * @param excludedStatusCodes Status codes whose samples are dropped
   * @return Series named after the sensor, empty if no file could be read
   * @throws IOException if a file exists but cannot be read
   */
  public RawSeries readLocations(TagLocations tagLocations,
      Collection<Integer> excludedStatusCodes) throws IOException {
    return readLocations(tagLocations, excludedStatusCodes, false);
  }

  /**
   * Reads every location of a sensor.
   *
   * <p>In dry-run mode the first file is only stat'ed and an empty series
   * is returned.
   */
  public RawSeries readLocations(TagLocations tagLocations,
      Collection<Integer> excludedStatusCodes, boolean dryRun) throws IOException {
    String name = tagLocations.getTag().getName();
    Set<Integer> excluded = ImmutableSet.copyOf(excludedStatusCodes);

    LOGGER.info("Downloading tag: {} for partitions: {}", tagLocations.getTag(),
        tagLocations.partitions());
    List<List<TimeSeriesRow>> parts = new ArrayList<List<TimeSeriesRow>>();
    for (TagLocations.Entry entry : tagLocations) {
      Location location = entry.getLocation();
      String path = location.getPath();
      LOGGER.info("Parsing file {} from partition {}", path, entry.getPartition());
      try {
        StorageProvider.FileMetadata metadata = storage.getMetadata(path);
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("File size for file {}: {} MB", path,
              String.format(Locale.ROOT, "%.2f", metadata.getSize() / (1024.0 * 1024.0)));
        }
        if (dryRun) {
          LOGGER.info("Dry run only, returning empty series early");
          return RawSeries.empty(name);
        }
        long started = System.currentTimeMillis();
        List<TimeSeriesRow> rows = filterStatus(location.getFormat().read(storage, path), excluded);
        rows.sort(BY_TIME);
        parts.add(rows);
        LOGGER.info("Done in {} ms {}", System.currentTimeMillis() - started, path);
      } catch (FileNotFoundException e) {
        LOGGER.debug("{} not found, skipping it: {}", path, e.getMessage());
      }
    }
    if (parts.isEmpty()) {
      LOGGER.debug("No partitions to concatenate for {}", name);
      return RawSeries.empty(name);
    }
    return toSeries(name, parts);
  }

  private static List<TimeSeriesRow> filterStatus(List<TimeSeriesRow> rows, Set<Integer> excluded) {
    List<TimeSeriesRow> kept = new ArrayList<TimeSeriesRow>(rows.size());
    for (TimeSeriesRow row : rows) {
      Integer status = row.getStatus();
      if (status == null || !excluded.contains(status)) {
        kept.add(row);
      }
    }
    return kept;
  }

  /** Concatenates the parts and keeps the last sample of each timestamp. */
  static RawSeries toSeries(String name, List<List<TimeSeriesRow>> parts) {
    List<TimeSeriesRow> all = new ArrayList<TimeSeriesRow>();
    for (List<TimeSeriesRow> part : parts) {
      all.addAll(part);
    }
    // Stable, so equal timestamps keep their file order
    all.sort(BY_TIME);

    long[] times = new long[all.size()];
    double[] values = new double[all.size()];
    int n = 0;
    for (TimeSeriesRow row : all) {
      if (n > 0 && times[n - 1] == row.getEpochMillis()) {
        values[n - 1] = row.getValue();
        continue;
      }
      times[n] = row.getEpochMillis();
      values[n] = row.getValue();
      n++;
    }
    if (n < all.size()) {
      LOGGER.debug("Dropped {} duplicated timestamps of {}", all.size() - n, name);
    }
    return new RawSeries(name, ZoneOffset.UTC, Arrays.copyOf(times, n),
        Arrays.copyOf(values, n));
  }
}
