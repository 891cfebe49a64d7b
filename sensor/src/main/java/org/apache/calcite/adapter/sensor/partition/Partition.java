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
package org.apache.calcite.adapter.sensor.partition;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A calendar bucket used to shard a sensor's files: either a whole
 * {@link Year} or a single {@link Month}.
 *
 * <p>Partitions of the same kind are totally ordered. Comparing a year
 * partition with a month partition is a programming error and throws
 * {@link ClassCastException}, the same way {@link Comparable} does for
 * incomparable types.
 *
 * @see PartitionBy
 * @see PartitionIterator
 */
public abstract class Partition implements Comparable<Partition> {
  private final int year;

  private Partition(int year) {
    this.year = year;
  }

  public static Year year(int year) {
    return new Year(year);
  }

  public static Month month(int year, int month) {
    return new Month(year, month);
  }

  public int getYear() {
    return year;
  }

  /**
   * Granularity this partition belongs to.
   */
  public abstract PartitionBy getPartitionBy();

  /**
   * Whole-year partition.
   */
  public static final class Year extends Partition {
    Year(int year) {
      super(year);
    }

    @Override public PartitionBy getPartitionBy() {
      return PartitionBy.YEAR;
    }

    @Override public int compareTo(Partition other) {
      if (!(other instanceof Year)) {
        throw new ClassCastException("Unable to compare " + this + " with " + other);
      }
      return Integer.compare(getYear(), other.getYear());
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof Year && ((Year) o).getYear() == getYear();
    }

    @Override public int hashCode() {
      return getYear();
    }

    @Override public String toString() {
      return "YearPartition(" + getYear() + ")";
    }
  }

  /**
   * Single calendar month partition.
   */
  public static final class Month extends Partition {
    private final int month;

    Month(int year, int month) {
      super(year);
      if (month < 1 || month > 12) {
        throw new IllegalArgumentException("Month should be between 1 and 12, got " + month);
      }
      this.month = month;
    }

    public int getMonth() {
      return month;
    }

    @Override public PartitionBy getPartitionBy() {
      return PartitionBy.MONTH;
    }

    @Override public int compareTo(Partition other) {
      if (!(other instanceof Month)) {
        throw new ClassCastException("Unable to compare " + this + " with " + other);
      }
      int result = Integer.compare(getYear(), other.getYear());
      if (result != 0) {
        return result;
      }
      return Integer.compare(month, ((Month) other).month);
    }

    @Override public boolean equals(@Nullable Object o) {
      if (!(o instanceof Month)) {
        return false;
      }
      Month that = (Month) o;
      return that.getYear() == getYear() && that.month == month;
    }

    @Override public int hashCode() {
      return getYear() * 31 + month;
    }

    @Override public String toString() {
      return "MonthPartition(" + getYear() + ", " + month + ")";
    }
  }
}
