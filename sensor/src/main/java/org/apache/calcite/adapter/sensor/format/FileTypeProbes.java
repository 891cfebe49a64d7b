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

import org.apache.calcite.adapter.sensor.SensorConfigException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Registry of the built-in file-type probes, keyed by name.
 *
 * <p>A list of names is turned into probes in the same order; the order is
 * the lookup priority. For {@code ["csv", "parquet"]} CSV files win over
 * Parquet files.
 *
 * <table>
 *   <caption>Probes</caption>
 *   <tr><th>Name</th><th>Partition</th><th>Path</th></tr>
 *   <tr><td>parquet</td><td>month</td><td>{@code parquet/<year>/<tag>_<year><MM>.parquet}</td></tr>
 *   <tr><td>yearly_parquet</td><td>year</td><td>{@code parquet/<tag>_<year>.parquet}</td></tr>
 *   <tr><td>csv</td><td>year</td><td>{@code <tag>_<year>.csv}</td></tr>
 * </table>
 */
public final class FileTypeProbes {

  /** Default lookup priority. */
  public static final List<String> DEFAULT_TYPE_NAMES = ImmutableList.of(
      MonthlyParquetProbe.NAME, YearlyParquetProbe.NAME, CsvProbe.NAME);

  private static final Map<String, Supplier<FileTypeProbe>> PROBES =
      ImmutableMap.<String, Supplier<FileTypeProbe>>of(
          MonthlyParquetProbe.NAME, MonthlyParquetProbe::new,
          YearlyParquetProbe.NAME, YearlyParquetProbe::new,
          CsvProbe.NAME, CsvProbe::new);

  private FileTypeProbes() {
  }

  /**
   * Creates the probe registered under a name.
   *
   * @throws SensorConfigException if no probe has that name
   */
  public static FileTypeProbe get(String name) {
    Supplier<FileTypeProbe> supplier = PROBES.get(name);
    if (supplier == null) {
      throw new SensorConfigException("Can not find file type '" + name + "'");
    }
    return supplier.get();
  }

  /**
   * Creates probes for the given names, in order. Null means
   * {@link #DEFAULT_TYPE_NAMES}.
   *
   * @throws SensorConfigException if any name is unknown
   */
  public static List<FileTypeProbe> load(@Nullable List<String> names) {
    List<String> typeNames = names == null ? DEFAULT_TYPE_NAMES : names;
    ImmutableList.Builder<FileTypeProbe> probes = ImmutableList.builder();
    for (String name : typeNames) {
      probes.add(get(name));
    }
    return probes.build();
  }

  public static List<String> names() {
    return ImmutableList.copyOf(PROBES.keySet());
  }
}
