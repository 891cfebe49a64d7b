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
package org.apache.calcite.adapter.sensor.dataset;

import org.apache.calcite.adapter.sensor.InsufficientDataException;
import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.join.AlignedTable;
import org.apache.calcite.adapter.sensor.join.JoinMetadata;
import org.apache.calcite.adapter.sensor.join.JoinResult;
import org.apache.calcite.adapter.sensor.reader.RawSeries;
import org.apache.calcite.adapter.sensor.reader.SensorDataProvider;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sensor data for a training window, aligned into one table.
 *
 * <p>Series are loaded through a {@link SensorDataProvider} for
 * {@code [trainStart, trainEnd)} and joined on a grid spanning the same
 * window. A result with no more rows than the row threshold is rejected.
 *
 * <pre>{@code
 * SensorDataset dataset = new SensorDataset(reader, SensorDatasetConfig.fromYaml(in));
 * AlignedTable data = dataset.getData();
 * Map<String, Object> metadata = dataset.getMetadata();
 * }</pre>
 */
public class SensorDataset {
  private static final Logger LOGGER = LoggerFactory.getLogger(SensorDataset.class);

  private final SensorDataProvider provider;
  private final SensorDatasetConfig config;
  private @Nullable JoinMetadata joinMetadata;
  private @Nullable AlignedTable data;

  public SensorDataset(SensorDataProvider provider, SensorDatasetConfig config) {
    this.provider = provider;
    this.config = config;
  }

  public SensorDatasetConfig getConfig() {
    return config;
  }

  /**
   * Loads and joins the series. Each call reads the data again.
   *
   * @return Aligned table without missing values
   * @throws InsufficientDataException if a series has no data, or the table
   *     has no more rows than the row threshold
   * @throws IOException if reading fails
   */
  public AlignedTable getData() throws IOException, InsufficientDataException {
    List<SensorTag> tags = config.getTags();
    LOGGER.info("Loading {} tags from {} to {}", tags.size(), config.getTrainStart(),
        config.getTrainEnd());
    List<RawSeries> series =
        provider.loadSeries(config.getTrainStart(), config.getTrainEnd(), tags, false);

    JoinResult result = config.createJoiner()
        .join(series, config.getTrainStart(), config.getTrainEnd());
    AlignedTable table = result.getTable();
    this.joinMetadata = result.getMetadata();
    if (table.getRowCount() <= config.getRowThreshold()) {
      throw new InsufficientDataException("The length of the generated data is "
          + table.getRowCount() + ", which is not above the row threshold "
          + config.getRowThreshold());
    }
    this.data = table;
    LOGGER.info("Dataset has {} rows and {} columns", table.getRowCount(),
        table.getColumnCount());
    return table;
  }

  /**
   * Describes the dataset: configuration, and after a successful
   * {@link #getData()} the join lengths and the table shape.
   */
  public Map<String, Object> getMetadata() {
    Map<String, Object> metadata = new LinkedHashMap<String, Object>();
    metadata.put("train_start_date", config.getTrainStart().toOffsetDateTime().toString());
    metadata.put("train_end_date", config.getTrainEnd().toOffsetDateTime().toString());
    List<String> tagNames = new ArrayList<String>();
    for (SensorTag tag : config.getTags()) {
      tagNames.add(tag.getName());
    }
    metadata.put("tag_list", tagNames);
    metadata.put("resolution", config.getResolution());
    metadata.put("row_threshold", config.getRowThreshold());
    if (joinMetadata != null) {
      metadata.put("join_metadata", joinMetadata.toMap());
    }
    if (data != null) {
      metadata.put("row_count", data.getRowCount());
      metadata.put("column_count", data.getColumnCount());
    }
    return metadata;
  }
}
