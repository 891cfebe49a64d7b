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
import org.apache.calcite.adapter.sensor.partition.Partition;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The files found for one sensor, keyed by partition.
 *
 * <p>Null locations mean the sensor's directory was not found at all.
 * A found directory without matching files has an empty, non-null
 * mapping. Iteration visits partitions in ascending order.
 */
public final class TagLocations implements Iterable<TagLocations.Entry> {
  private final SensorTag tag;
  private final @Nullable ImmutableMap<Partition, Location> locations;

  public TagLocations(SensorTag tag, @Nullable Map<Partition, Location> locations) {
    this.tag = Objects.requireNonNull(tag, "tag");
    this.locations = locations == null ? null : ImmutableMap.copyOf(locations);
  }

  /**
   * Result for a sensor whose directory does not exist.
   */
  public static TagLocations notFound(SensorTag tag) {
    return new TagLocations(tag, null);
  }

  public SensorTag getTag() {
    return tag;
  }

  /**
   * Whether the sensor's directory was found.
   */
  public boolean isAvailable() {
    return locations != null;
  }

  public @Nullable Map<Partition, Location> getLocations() {
    return locations;
  }

  /**
   * Partitions with a file, ascending.
   */
  public List<Partition> partitions() {
    if (locations == null) {
      return Collections.emptyList();
    }
    List<Partition> partitions = new ArrayList<Partition>(locations.keySet());
    Collections.sort(partitions);
    return ImmutableList.copyOf(partitions);
  }

  public @Nullable Location getLocation(Partition partition) {
    return locations == null ? null : locations.get(partition);
  }

  /**
   * Location of a yearly partition.
   */
  public @Nullable Location getLocation(int year) {
    return getLocation(Partition.year(year));
  }

  @Override public Iterator<Entry> iterator() {
    List<Entry> entries = new ArrayList<Entry>();
    if (locations != null) {
      for (Partition partition : partitions()) {
        entries.add(new Entry(tag, partition, locations.get(partition)));
      }
    }
    return entries.iterator();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TagLocations)) {
      return false;
    }
    TagLocations that = (TagLocations) o;
    return tag.equals(that.tag) && Objects.equals(locations, that.locations);
  }

  @Override public int hashCode() {
    return Objects.hash(tag, locations);
  }

  @Override public String toString() {
    return "TagLocations{" + tag + ", " + (locations == null ? "not found" : partitions()) + "}";
  }

  /**
   * One (tag, partition, location) triple.
   */
  public static final class Entry {
    private final SensorTag tag;
    private final Partition partition;
    private final Location location;

    Entry(SensorTag tag, Partition partition, Location location) {
      this.tag = tag;
      this.partition = partition;
      this.location = location;
    }

    public SensorTag getTag() {
      return tag;
    }

    public Partition getPartition() {
      return partition;
    }

    public Location getLocation() {
      return location;
    }
  }
}
