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
package org.apache.calcite.adapter.sensor.join;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Identifies a column of an {@link AlignedTable}: the series it comes from
 * and, when several aggregations were requested, the aggregation.
 */
public final class ColumnKey {
  private final String series;
  private final @Nullable Aggregation aggregation;

  public ColumnKey(String series, @Nullable Aggregation aggregation) {
    this.series = Objects.requireNonNull(series, "series");
    this.aggregation = aggregation;
  }

  public static ColumnKey of(String series) {
    return new ColumnKey(series, null);
  }

  public static ColumnKey of(String series, Aggregation aggregation) {
    return new ColumnKey(series, aggregation);
  }

  public String getSeries() {
    return series;
  }

  /**
   * Aggregation, null for single-level columns.
   */
  public @Nullable Aggregation getAggregation() {
    return aggregation;
  }

  /**
   * Flat column name: the series name, or {@code series__aggregation} for
   * two-level columns.
   */
  public String flatName() {
    return aggregation == null ? series : series + "__" + aggregation.getMethodName();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnKey)) {
      return false;
    }
    ColumnKey that = (ColumnKey) o;
    return series.equals(that.series) && aggregation == that.aggregation;
  }

  @Override public int hashCode() {
    return Objects.hash(series, aggregation);
  }

  @Override public String toString() {
    return aggregation == null ? series : "(" + series + ", " + aggregation.getMethodName() + ")";
  }
}
