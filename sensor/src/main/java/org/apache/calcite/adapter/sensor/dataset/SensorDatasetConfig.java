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

import org.apache.calcite.adapter.sensor.InvalidRangeException;
import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.SensorTag;
import org.apache.calcite.adapter.sensor.join.Aggregation;
import org.apache.calcite.adapter.sensor.join.InterpolationMethod;
import org.apache.calcite.adapter.sensor.join.Resolutions;
import org.apache.calcite.adapter.sensor.join.TimeSeriesJoiner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a {@link SensorDataset}.
 *
 * <h3>YAML Configuration Example</h3>
 *
 * <pre>{@code
 * train_start_date: 2017-12-25T06:00:00+07:00
 * train_end_date: 2018-01-12T13:07:00+07:00
 * asset: 1101-sfb               # default asset of tags given without one
 * tag_list:
 *   - TAG-1
 *   - {name: TAG-2, asset: 1755-gra}
 * resolution: 10T
 * aggregation_methods: [mean, max]
 * interpolation_method: linear_interpolation
 * interpolation_limit: 8H        # null fills every gap
 * row_threshold: 0
 * }</pre>
 *
 * <p>Dates must carry a UTC offset.
 */
public class SensorDatasetConfig {
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  public static final String DEFAULT_RESOLUTION = "10T";

  private final ZonedDateTime trainStart;
  private final ZonedDateTime trainEnd;
  private final List<SensorTag> tags;
  private final String resolution;
  private final List<Aggregation> aggregations;
  private final InterpolationMethod interpolationMethod;
  private final @Nullable String interpolationLimit;
  private final int rowThreshold;

  private SensorDatasetConfig(Builder builder) {
    if (builder.trainStart == null || builder.trainEnd == null) {
      throw new SensorConfigException("train_start_date and train_end_date are required");
    }
    if (!builder.trainStart.isBefore(builder.trainEnd)) {
      throw new InvalidRangeException("train_start_date " + builder.trainStart
          + " should be before train_end_date " + builder.trainEnd);
    }
    if (builder.tags.isEmpty()) {
      throw new SensorConfigException("tag_list should not be empty");
    }
    if (builder.aggregations.isEmpty()) {
      throw new SensorConfigException("At least one aggregation method is required");
    }
    if (builder.rowThreshold < 0) {
      throw new SensorConfigException("row_threshold should not be negative");
    }
    // Fail early on malformed durations
    Resolutions.parse(builder.resolution);
    if (builder.interpolationLimit != null) {
      Resolutions.parse(builder.interpolationLimit);
    }
    this.trainStart = builder.trainStart;
    this.trainEnd = builder.trainEnd;
    List<SensorTag> tags = new ArrayList<SensorTag>();
    for (SensorTag tag : builder.tags) {
      tags.add(tag.hasAsset() || builder.asset == null
          ? tag : SensorTag.of(tag.getName(), builder.asset));
    }
    this.tags = ImmutableList.copyOf(tags);
    this.resolution = builder.resolution;
    this.aggregations = ImmutableList.copyOf(builder.aggregations);
    this.interpolationMethod = builder.interpolationMethod;
    this.interpolationLimit = builder.interpolationLimit;
    this.rowThreshold = builder.rowThreshold;
  }

  public ZonedDateTime getTrainStart() {
    return trainStart;
  }

  public ZonedDateTime getTrainEnd() {
    return trainEnd;
  }

  /**
   * Tags, with the default asset applied.
   */
  public List<SensorTag> getTags() {
    return tags;
  }

  public String getResolution() {
    return resolution;
  }

  public List<Aggregation> getAggregations() {
    return aggregations;
  }

  public InterpolationMethod getInterpolationMethod() {
    return interpolationMethod;
  }

  public @Nullable String getInterpolationLimit() {
    return interpolationLimit;
  }

  /**
   * A dataset with this many rows or fewer is rejected.
   */
  public int getRowThreshold() {
    return rowThreshold;
  }

  /**
   * Joiner configured with this dataset's resolution, aggregations and
   * interpolation.
   */
  public TimeSeriesJoiner createJoiner() {
    return new TimeSeriesJoiner(resolution, aggregations, interpolationMethod,
        interpolationLimit);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the configuration from a YAML stream.
   */
  @SuppressWarnings("unchecked")
  public static SensorDatasetConfig fromYaml(InputStream inputStream) throws IOException {
    Map<String, Object> yamlData = YAML_MAPPER.readValue(inputStream, Map.class);
    return fromMap(yamlData);
  }

  /**
   * Creates a configuration from a YAML/JSON map.
   *
   * @throws SensorConfigException on a missing or malformed value
   */
  public static SensorDatasetConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new SensorConfigException("Dataset config should not be empty");
    }
    Builder builder = builder()
        .trainStart(parseDate(map.get("train_start_date"), "train_start_date"))
        .trainEnd(parseDate(map.get("train_end_date"), "train_end_date"))
        .tags(SensorTag.fromList(listOrNull(map.get("tag_list"), "tag_list")));

    Object assetObj = map.get("asset");
    if (assetObj != null) {
      builder.asset(String.valueOf(assetObj));
    }

    Object resolutionObj = map.get("resolution");
    if (resolutionObj != null) {
      builder.resolution(String.valueOf(resolutionObj));
    }

    Object aggregationObj = map.get("aggregation_methods");
    if (aggregationObj != null) {
      builder.aggregations(Aggregation.fromObject(aggregationObj));
    }

    Object methodObj = map.get("interpolation_method");
    if (methodObj != null) {
      builder.interpolationMethod(InterpolationMethod.fromString(String.valueOf(methodObj)));
    }

    if (map.containsKey("interpolation_limit")) {
      Object limitObj = map.get("interpolation_limit");
      builder.interpolationLimit(limitObj == null ? null : String.valueOf(limitObj));
    }

    Object thresholdObj = map.get("row_threshold");
    if (thresholdObj instanceof Number) {
      builder.rowThreshold(((Number) thresholdObj).intValue());
    } else if (thresholdObj != null) {
      throw new SensorConfigException("row_threshold should be a number, not '"
          + thresholdObj + "'");
    }

    return builder.build();
  }

  private static @Nullable List<?> listOrNull(@Nullable Object value, String key) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof List)) {
      throw new SensorConfigException(key + " should be a list");
    }
    return (List<?>) value;
  }

  /**
   * Parses an ISO-8601 date-time with offset; a space may separate date
   * and time.
   */
  static ZonedDateTime parseDate(@Nullable Object value, String key) {
    if (value == null) {
      throw new SensorConfigException(key + " is required");
    }
    if (value instanceof ZonedDateTime) {
      return (ZonedDateTime) value;
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toZonedDateTime();
    }
    String text = String.valueOf(value).trim();
    if (text.length() > 10 && text.charAt(10) == ' ') {
      text = text.substring(0, 10) + 'T' + text.substring(11);
    }
    try {
      return OffsetDateTime.parse(text).toZonedDateTime();
    } catch (DateTimeParseException e) {
      throw new SensorConfigException(key + " should be a timezone-aware date-time, not '"
          + value + "'", e);
    }
  }

  /**
   * Map form of this configuration, accepted by {@link #fromMap}.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("train_start_date", trainStart.toOffsetDateTime().toString());
    map.put("train_end_date", trainEnd.toOffsetDateTime().toString());
    List<Object> tagList = new ArrayList<Object>();
    for (SensorTag tag : tags) {
      Map<String, Object> tagMap = new LinkedHashMap<String, Object>();
      tagMap.put("name", tag.getName());
      tagMap.put("asset", tag.getAsset());
      tagList.add(tagMap);
    }
    map.put("tag_list", tagList);
    map.put("resolution", resolution);
    List<String> methods = new ArrayList<String>();
    for (Aggregation aggregation : aggregations) {
      methods.add(aggregation.getMethodName());
    }
    map.put("aggregation_methods", methods.size() == 1 ? methods.get(0) : methods);
    map.put("interpolation_method", interpolationMethod.getMethodName());
    map.put("interpolation_limit", interpolationLimit);
    map.put("row_threshold", rowThreshold);
    return map;
  }

  @Override public String toString() {
    return "SensorDatasetConfig" + toMap();
  }

  /**
   * Builder for SensorDatasetConfig.
   */
  public static class Builder {
    private @Nullable ZonedDateTime trainStart;
    private @Nullable ZonedDateTime trainEnd;
    private List<SensorTag> tags = ImmutableList.of();
    private @Nullable String asset;
    private String resolution = DEFAULT_RESOLUTION;
    private List<Aggregation> aggregations = ImmutableList.of(Aggregation.MEAN);
    private InterpolationMethod interpolationMethod = InterpolationMethod.LINEAR_INTERPOLATION;
    private @Nullable String interpolationLimit = TimeSeriesJoiner.DEFAULT_INTERPOLATION_LIMIT;
    private int rowThreshold;

    public Builder trainStart(ZonedDateTime trainStart) {
      this.trainStart = trainStart;
      return this;
    }

    public Builder trainEnd(ZonedDateTime trainEnd) {
      this.trainEnd = trainEnd;
      return this;
    }

    public Builder tags(List<SensorTag> tags) {
      this.tags = tags;
      return this;
    }

    /** Asset given to tags that have none. */
    public Builder asset(@Nullable String asset) {
      this.asset = asset;
      return this;
    }

    public Builder resolution(String resolution) {
      this.resolution = resolution;
      return this;
    }

    public Builder aggregations(List<Aggregation> aggregations) {
      this.aggregations = aggregations;
      return this;
    }

    public Builder interpolationMethod(InterpolationMethod interpolationMethod) {
      this.interpolationMethod = interpolationMethod;
      return this;
    }

    public Builder interpolationLimit(@Nullable String interpolationLimit) {
      this.interpolationLimit = interpolationLimit;
      return this;
    }

    public Builder rowThreshold(int rowThreshold) {
      this.rowThreshold = rowThreshold;
      return this;
    }

    public SensorDatasetConfig build() {
      return new SensorDatasetConfig(this);
    }
  }
}
