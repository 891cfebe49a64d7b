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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when one or more series carry no usable data after resampling,
 * or when a dataset ends up with fewer rows than required.
 *
 * <p>The exception names every offending series, in input order.
 */
public class InsufficientDataException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> seriesNames;

  public InsufficientDataException(String message) {
    super(message);
    this.seriesNames = ImmutableList.of();
  }

  public InsufficientDataException(List<String> seriesNames) {
    super("The following features are missing data: " + seriesNames);
    this.seriesNames = ImmutableList.copyOf(seriesNames);
  }

  /**
   * Names of the series that had no data, empty when the failure is not
   * tied to individual series.
   */
  public List<String> getSeriesNames() {
    return seriesNames;
  }
}
