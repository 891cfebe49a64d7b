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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Names of the columns a sensor file stores its samples in.
 */
public final class TimeSeriesColumns {
  /** Column layout shared by all sensor file types. */
  public static final TimeSeriesColumns DEFAULT =
      new TimeSeriesColumns("Time", "Value", "Status");

  private final String datetimeColumn;
  private final String valueColumn;
  private final @Nullable String statusColumn;

  public TimeSeriesColumns(String datetimeColumn, String valueColumn,
      @Nullable String statusColumn) {
    this.datetimeColumn = Objects.requireNonNull(datetimeColumn, "datetimeColumn");
    this.valueColumn = Objects.requireNonNull(valueColumn, "valueColumn");
    this.statusColumn = statusColumn;
  }

  public String getDatetimeColumn() {
    return datetimeColumn;
  }

  public String getValueColumn() {
    return valueColumn;
  }

  public @Nullable String getStatusColumn() {
    return statusColumn;
  }

  /**
   * Datetime, value and (when present) status column names.
   */
  public List<String> getColumns() {
    ImmutableList.Builder<String> columns = ImmutableList.builder();
    columns.add(datetimeColumn, valueColumn);
    if (statusColumn != null) {
      columns.add(statusColumn);
    }
    return columns.build();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (!(o instanceof TimeSeriesColumns)) {
      return false;
    }
    TimeSeriesColumns that = (TimeSeriesColumns) o;
    return datetimeColumn.equals(that.datetimeColumn)
        && valueColumn.equals(that.valueColumn)
        && Objects.equals(statusColumn, that.statusColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(datetimeColumn, valueColumn, statusColumn);
  }

  @Override public String toString() {
    return "TimeSeriesColumns" + getColumns();
  }
}
