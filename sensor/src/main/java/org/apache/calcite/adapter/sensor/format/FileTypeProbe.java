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
package org.apache.calcite.adapter.sensor.format;

import org.apache.calcite.adapter.sensor.UnsupportedPartitionException;
import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.partition.PartitionBy;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Knows where one file type stores a sensor's data for a partition.
 *
 * <p>A probe pairs a {@link FileFormat} with the partition granularity its
 * files are cut by, and builds the candidate path of a partition's file
 * relative to the sensor's directory. Probes are tried in priority order
 * by {@link org.apache.calcite.adapter.sensor.lookup.LocationResolver}.
 *
 * @see FileTypeProbes
 */
public abstract class FileTypeProbe {
  private final String name;
  private final FileFormat format;
  private final PartitionBy partitionBy;

  protected FileTypeProbe(String name, FileFormat format, PartitionBy partitionBy) {
    this.name = name;
    this.format = format;
    this.partitionBy = partitionBy;
  }

  /**
   * Registry name of the probe, e.g. "parquet".
   */
  public String getName() {
    return name;
  }

  public FileFormat getFormat() {
    return format;
  }

  /**
   * Partition granularity this probe's files are cut by.
   */
  public PartitionBy getPartitionBy() {
    return partitionBy;
  }

  /**
   * Whether this probe stores files for partitions of the given kind.
   */
  public boolean accepts(Partition partition) {
    return partition.getPartitionBy() == partitionBy;
  }

  /**
   * Builds the candidate relative path of each partition's file.
   *
   * @param tagName Percent-encoded sensor name
   * @param partitions Partitions, all of this probe's granularity
   * @return One candidate per partition, in input order
   * @throws UnsupportedPartitionException if a partition has another granularity
   */
  public List<CandidatePath> buildPaths(String tagName, Iterable<? extends Partition> partitions) {
    List<CandidatePath> paths = new ArrayList<CandidatePath>();
    for (Partition partition : partitions) {
      if (!accepts(partition)) {
        throw new UnsupportedPartitionException("File type '" + name + "' stores "
            + partitionBy + " partitions, not " + partition);
      }
      paths.add(new CandidatePath(partition, relativePath(tagName, partition)));
    }
    return paths;
  }

  /**
   * Path of the partition's file relative to the sensor directory, using
   * '/' as separator.
   */
  protected abstract String relativePath(String tagName, Partition partition);

  @Override public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }

  /**
   * Relative path proposed for one partition.
   */
  public static final class CandidatePath {
    private final Partition partition;
    private final String relativePath;

    public CandidatePath(Partition partition, String relativePath) {
      this.partition = partition;
      this.relativePath = relativePath;
    }

    public Partition getPartition() {
      return partition;
    }

    public String getRelativePath() {
      return relativePath;
    }

    @Override public boolean equals(@Nullable Object o) {
      if (!(o instanceof CandidatePath)) {
        return false;
      }
      CandidatePath that = (CandidatePath) o;
      return partition.equals(that.partition) && relativePath.equals(that.relativePath);
    }

    @Override public int hashCode() {
      return Objects.hash(partition, relativePath);
    }

    @Override public String toString() {
      return partition + " -> " + relativePath;
    }
  }
}
