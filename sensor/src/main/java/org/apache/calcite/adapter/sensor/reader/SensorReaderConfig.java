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

import org.apache.calcite.adapter.sensor.SensorConfigException;
import org.apache.calcite.adapter.sensor.format.FileTypeProbes;
import org.apache.calcite.adapter.sensor.lookup.LocationResolver;
import org.apache.calcite.adapter.sensor.partition.PartitionBy;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration of a {@link SensorFileReader}.
 *
 * <h3>YAML Configuration Example</h3>
 *
 * <pre>{@code
 * threads: 10
 * remove_status_codes: [0, 64, 60, 8, 24, 3, 32768]
 * dl_base_path: /demo/sensordata   # optional, bypasses the asset catalog
 * lookup_for: [parquet, yearly_parquet, csv]
 * storage_name: dataplatform
 * max_file_size: 1048576000        # null disables the size check
 * partition_by: month
 * fail_fast: false
 * }</pre>
 */
public class SensorReaderConfig {

  /** Status codes removed unless configured otherwise. */
  public static final List<Integer> DEFAULT_REMOVE_STATUS_CODES =
      ImmutableList.of(0, 64, 60, 8, 24, 3, 32768);

  private final int threads;
  private final List<Integer> removeStatusCodes;
  private final @Nullable String dlBasePath;
  private final List<String> lookupFor;
  private final @Nullable String storageName;
  private final @Nullable Long maxFileSize;
  private final PartitionBy partitionBy;
  private final boolean failFast;

  private SensorReaderConfig(Builder builder) {
    if (builder.threads < 1) {
      throw new SensorConfigException("threads should bigger or equal to 1");
    }
    this.threads = builder.threads;
    this.removeStatusCodes = builder.removeStatusCodes != null
        ? ImmutableList.copyOf(builder.removeStatusCodes)
        : DEFAULT_REMOVE_STATUS_CODES;
    this.dlBasePath = builder.dlBasePath;
    this.lookupFor = builder.lookupFor != null
        ? ImmutableList.copyOf(builder.lookupFor)
        : FileTypeProbes.DEFAULT_TYPE_NAMES;
    this.storageName = builder.storageName;
    this.maxFileSize = builder.maxFileSize;
    this.partitionBy = builder.partitionBy;
    this.failFast = builder.failFast;
  }

  public int getThreads() {
    return threads;
  }

  public List<Integer> getRemoveStatusCodes() {
    return removeStatusCodes;
  }

  /**
   * Directory overriding the asset catalog, or null.
   */
  public @Nullable String getDlBasePath() {
    return dlBasePath;
  }

  /**
   * Probe names in priority order.
   */
  public List<String> getLookupFor() {
    return lookupFor;
  }

  /**
   * Storage name used in the asset catalog; null means the storage type.
   */
  public @Nullable String getStorageName() {
    return storageName;
  }

  public @Nullable Long getMaxFileSize() {
    return maxFileSize;
  }

  public PartitionBy getPartitionBy() {
    return partitionBy;
  }

  public boolean isFailFast() {
    return failFast;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Configuration with every default.
   */
  public static SensorReaderConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a configuration from a YAML/JSON map. Absent keys keep their
   * defaults; an explicit null {@code max_file_size} disables the size check.
   *
   * @throws SensorConfigException on a malformed value
   */
  public static SensorReaderConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object threadsObj = map.get("threads");
    if (threadsObj instanceof Number) {
      builder.threads(((Number) threadsObj).intValue());
    } else if (threadsObj != null) {
      throw new SensorConfigException("threads should be a number, not '" + threadsObj + "'");
    }

    Object codesObj = map.get("remove_status_codes");
    if (codesObj instanceof List) {
      List<Integer> codes = new ArrayList<Integer>();
      for (Object code : (List<?>) codesObj) {
        if (!(code instanceof Number)) {
          throw new SensorConfigException("Status code should be a number, not '" + code + "'");
        }
        codes.add(((Number) code).intValue());
      }
      builder.removeStatusCodes(codes);
    }

    Object basePathObj = map.get("dl_base_path");
    if (basePathObj instanceof String) {
      builder.dlBasePath((String) basePathObj);
    }

    Object lookupObj = map.get("lookup_for");
    if (lookupObj instanceof List) {
      List<String> names = new ArrayList<String>();
      for (Object name : (List<?>) lookupObj) {
        names.add(String.valueOf(name));
      }
      builder.lookupFor(names);
    }

    Object storageObj = map.get("storage_name");
    if (storageObj instanceof String) {
      builder.storageName((String) storageObj);
    }

    if (map.containsKey("max_file_size")) {
      Object sizeObj = map.get("max_file_size");
      if (sizeObj == null) {
        builder.maxFileSize(null);
      } else if (sizeObj instanceof Number) {
        builder.maxFileSize(((Number) sizeObj).longValue());
      } else {
        throw new SensorConfigException("max_file_size should be a number, not '" + sizeObj + "'");
      }
    }

    Object partitionObj = map.get("partition_by");
    if (partitionObj != null) {
      builder.partitionBy(PartitionBy.fromString(String.valueOf(partitionObj)));
    }

    Object failFastObj = map.get("fail_fast");
    if (failFastObj instanceof Boolean) {
      builder.failFast((Boolean) failFastObj);
    }

    return builder.build();
  }

  /**
   * Map form of this configuration, accepted by {@link #fromMap}.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("threads", threads);
    map.put("remove_status_codes", removeStatusCodes);
    if (dlBasePath != null) {
      map.put("dl_base_path", dlBasePath);
    }
    map.put("lookup_for", lookupFor);
    if (storageName != null) {
      map.put("storage_name", storageName);
    }
    map.put("max_file_size", maxFileSize);
    map.put("partition_by", partitionBy.name().toLowerCase(Locale.ROOT));
    map.put("fail_fast", failFast);
    return map;
  }

  @Override public String toString() {
    return "SensorReaderConfig" + toMap();
  }

  /**
   * Builder for SensorReaderConfig.
   */
  public static class Builder {
    private int threads = 1;
    private @Nullable List<Integer> removeStatusCodes;
    private @Nullable String dlBasePath;
    private @Nullable List<String> lookupFor;
    private @Nullable String storageName;
    private @Nullable Long maxFileSize = LocationResolver.DEFAULT_MAX_FILE_SIZE;
    private PartitionBy partitionBy = PartitionBy.MONTH;
    private boolean failFast;

    public Builder threads(int threads) {
      this.threads = threads;
      return this;
    }

    public Builder removeStatusCodes(List<Integer> removeStatusCodes) {
      this.removeStatusCodes = removeStatusCodes;
      return this;
    }

    public Builder dlBasePath(@Nullable String dlBasePath) {
      this.dlBasePath = dlBasePath;
      return this;
    }

    public Builder lookupFor(@Nullable List<String> lookupFor) {
      this.lookupFor = lookupFor;
      return this;
    }

    public Builder storageName(@Nullable String storageName) {
      this.storageName = storageName;
      return this;
    }

    public Builder maxFileSize(@Nullable Long maxFileSize) {
      this.maxFileSize = maxFileSize;
      return this;
    }

    public Builder partitionBy(PartitionBy partitionBy) {
      this.partitionBy = partitionBy;
      return this;
    }

    public Builder failFast(boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    public SensorReaderConfig build() {
      return new SensorReaderConfig(this);
    }
  }
}
