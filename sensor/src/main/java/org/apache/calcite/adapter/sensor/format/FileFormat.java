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

import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import java.io.IOException;
import java.util.List;

/**
 * Reader for one kind of sensor file.
 *
 * <p>Implementations are immutable and may be shared between threads.
 *
 * @see CsvFileFormat
 * @see ParquetFileFormat
 */
public interface FileFormat {

  /**
   * Short name, e.g. "csv" or "parquet".
   */
  String getName();

  /**
   * File extension including the leading dot.
   */
  String getFileExtension();

  /**
   * Columns the samples are read from.
   */
  TimeSeriesColumns getColumns();

  /**
   * Reads every sample of a file, in file order.
   *
   * @param storage Storage holding the file
   * @param path Full path of the file
   * @return Samples in the order they are stored
   * @throws java.io.FileNotFoundException If the file does not exist
   * @throws IOException If the file cannot be read or parsed
   */
  List<TimeSeriesRow> read(StorageProvider storage, String path) throws IOException;
}
