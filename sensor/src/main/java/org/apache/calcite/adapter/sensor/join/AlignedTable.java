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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Series aligned on a common time index, without missing values.
 *
 * <p>Rows are ordered by time. Columns are either one per series, or one
 * per (series, aggregation) pair when several aggregations were used.
 */
public final class AlignedTable {
  private final ZoneId zone;
  private final long[] index;
  private final List<ColumnKey> columns;
  private final double[][] data;

  /**
   * Creates a table.
   *
   * @param zone Zone of the index
   * @param index Row timestamps, ascending, epoch milliseconds
   * @param columns Column keys
   * @param data One array per column, each as long as the index
   */
  public AlignedTable(ZoneId zone, long[] index, List<ColumnKey> columns, double[][] data) {
    if (columns.size() != data.length) {
      throw new IllegalArgumentException("Expected " + columns.size() + " columns, got "
          + data.length);
    }
    for (double[] column : data) {
      if (column.length != index.length) {
        throw new IllegalArgumentException("Column length " + column.length
            + " differs from index length " + index.length);
      }
    }
    this.zone = zone;
    this.index = index.clone();
    this.columns = ImmutableList.copyOf(columns);
    this.data = new double[data.length][];
    for (int c = 0; c < data.length; c++) {
      this.data[c] = data[c].clone();
    }
  }

  public ZoneId getZone() {
    return zone;
  }

  public int getRowCount() {
    return index.length;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public List<ColumnKey> getColumns() {
    return columns;
  }

  /**
   * Whether columns are keyed by (series, aggregation).
   */
  public boolean isMultiLevel() {
    return !columns.isEmpty() && columns.get(0).getAggregation() != null;
  }

  public long getEpochMillis(int row) {
    return index[row];
  }

  public ZonedDateTime getTimestamp(int row) {
    return Instant.ofEpochMilli(index[row]).atZone(zone);
  }

  public double getValue(int row, int column) {
    return data[column][row];
  }

  /** Copy of the index. */
  public long[] index() {
    return index.clone();
  }

  /**
   * Copy of a column, or null if the table has no such column.
   */
  public double @Nullable [] column(ColumnKey key) {
    int c = columns.indexOf(key);
    return c < 0 ? null : data[c].clone();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("AlignedTable{").append(index.length).append(" rows");
    if (index.length > 0) {
      sb.append(", ").append(getTimestamp(0)).append(" .. ").append(getTimestamp(index.length - 1));
    }
    return sb.append(", columns=").append(columns).append('}').toString();
  }
}
