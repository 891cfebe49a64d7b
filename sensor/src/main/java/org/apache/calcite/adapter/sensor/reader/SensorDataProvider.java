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

import org.apache.calcite.adapter.sensor.SensorTag;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Source of raw sensor series.
 */
public interface SensorDataProvider {

  /**
   * Loads one series per sensor, restricted to {@code [start, end)}.
   *
   * @param start Inclusive start
   * @param end Exclusive end
   * @param tags Sensors to load
   * @param dryRun Whether to only check that data is there; implementations
   *     decide what this means and may return empty series
   * @return One series per sensor, in the order of {@code tags}; a sensor
   *     without data gives an empty series
   * @throws org.apache.calcite.adapter.sensor.InvalidRangeException if end is before start
   * @throws IOException if storage access fails
   */
  List<RawSeries> loadSeries(ZonedDateTime start, ZonedDateTime end, List<SensorTag> tags,
      boolean dryRun) throws IOException;

  /**
   * Whether this provider can possibly read the given sensor, typically
   * because its asset is known.
   */
  boolean canHandleTag(SensorTag tag);
}
