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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * One sample read from a sensor file.
 */
public final class TimeSeriesRow {
  private final long epochMillis;
  private final double value;
  private final @Nullable Integer status;

  public TimeSeriesRow(long epochMillis, double value, @Nullable Integer status) {
    this.epochMillis = epochMillis;
    this.value = value;
    this.status = status;
  }

  public long getEpochMillis() {
    return epochMillis;
  }

  public double getValue() {
    return value;
  }

  /**
   * Quality code of the sample, null when the file has no status column
   * or the cell is empty.
   */
  public @Nullable Integer getStatus() {
    return status;
  }

  @Override public String toString() {
    return Instant.ofEpochMilli(epochMillis) + "=" + value
        + (status != null ? " [" + status + "]" : "");
  }
}
