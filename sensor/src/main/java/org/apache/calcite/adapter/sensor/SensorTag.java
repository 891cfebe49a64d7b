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
package org.apache.calcite.adapter.sensor;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of a single sensor: its name and, optionally, the asset
 * (physical site) whose storage root holds its files.
 *
 * <p>Instances are immutable and compared by value, so they can be used
 * as map keys throughout lookup and reading.
 */
public final class SensorTag {
  private final String name;
  private final @Nullable String asset;

  public SensorTag(String name, @Nullable String asset) {
    if (name == null || name.isEmpty()) {
      throw new SensorConfigException("Sensor tag name is required");
    }
    this.name = name;
    this.asset = asset;
  }

  public static SensorTag of(String name) {
    return new SensorTag(name, null);
  }

  public static SensorTag of(String name, @Nullable String asset) {
    return new SensorTag(name, asset);
  }

  public String getName() {
    return name;
  }

  public @Nullable String getAsset() {
    return asset;
  }

  /**
   * Whether an asset is set and non-empty.
   */
  public boolean hasAsset() {
    return asset != null && !asset.isEmpty();
  }

  /**
   * Creates a tag from a configuration value. Accepts either a plain
   * string (the name) or a map with {@code name} and optional {@code asset}.
   *
   * @param value String or map
   * @return SensorTag
   * @throws SensorConfigException if the value has an unsupported shape
   */
  public static SensorTag fromObject(Object value) {
    if (value instanceof SensorTag) {
      return (SensorTag) value;
    }
    if (value instanceof String) {
      return of((String) value);
    }
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      Object name = map.get("name");
      if (!(name instanceof String)) {
        throw new SensorConfigException("Sensor tag map requires a 'name' entry: " + map);
      }
      Object asset = map.get("asset");
      return new SensorTag((String) name, asset != null ? String.valueOf(asset) : null);
    }
    throw new SensorConfigException("Unable to build sensor tag from " + value);
  }

  /**
   * Converts a list of configuration values into tags.
   */
  public static List<SensorTag> fromList(@Nullable List<?> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptyList();
    }
    List<SensorTag> tags = new ArrayList<SensorTag>(values.size());
    for (Object value : values) {
      tags.add(fromObject(value));
    }
    return tags;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SensorTag)) {
      return false;
    }
    SensorTag that = (SensorTag) o;
    return name.equals(that.name) && Objects.equals(asset, that.asset);
  }

  @Override public int hashCode() {
    return Objects.hash(name, asset);
  }

  @Override public String toString() {
    return "SensorTag{name='" + name + "', asset="
        + (asset != null ? "'" + asset + "'" : null) + "}";
  }
}
