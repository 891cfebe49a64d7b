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

import org.apache.calcite.adapter.sensor.format.FileFormat;
import org.apache.calcite.adapter.sensor.partition.Partition;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A verified file holding one sensor's data for one partition.
 */
public final class Location {
  private final String path;
  private final FileFormat format;
  private final @Nullable Partition partition;

  public Location(String path, FileFormat format, @Nullable Partition partition) {
    this.path = Objects.requireNonNull(path, "path");
    this.format = Objects.requireNonNull(format, "format");
    this.partition = partition;
  }

  public String getPath() {
    return path;
  }

  /**
   * Format of the file, as given by the probe that found it.
   */
  public FileFormat getFormat() {
    return format;
  }

  public @Nullable Partition getPartition() {
    return partition;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Location)) {
      return false;
    }
    Location that = (Location) o;
    return path.equals(that.path)
        && format.getName().equals(that.format.getName())
        && Objects.equals(partition, that.partition);
  }

  @Override public int hashCode() {
    return Objects.hash(path, format.getName(), partition);
  }

  @Override public String toString() {
    return "Location{" + path + ", " + format.getName() + ", " + partition + "}";
  }
}
