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

import com.google.common.collect.ImmutableList;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads header-less delimited sensor files.
 *
 * <p>The file has no header row, so the full column layout is supplied
 * up front; only the datetime, value and status columns are used. Values
 * are stored with single precision.
 *
 * <pre>{@code
 * TAG-1;1.5;2020-01-01T00:00:00+00:00;192
 * TAG-1;1.75;2020-01-01T00:00:01+00:00;192
 * }</pre>
 */
public class CsvFileFormat implements FileFormat {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvFileFormat.class);

  /** Column layout of sensor CSV exports. */
  public static final List<String> DEFAULT_HEADER =
      ImmutableList.of("Sensor", "Value", "Time", "Status");

  private final ImmutableList<String> header;
  private final TimeSeriesColumns columns;
  private final char separator;

  private final int datetimeIndex;
  private final int valueIndex;
  private final int statusIndex;

  public CsvFileFormat() {
    this(DEFAULT_HEADER, TimeSeriesColumns.DEFAULT, ';');
  }

  public CsvFileFormat(List<String> header, TimeSeriesColumns columns, char separator) {
    this.header = ImmutableList.copyOf(header);
    this.columns = columns;
    this.separator = separator;
    this.datetimeIndex = indexOf(columns.getDatetimeColumn());
    this.valueIndex = indexOf(columns.getValueColumn());
    String statusColumn = columns.getStatusColumn();
    this.statusIndex = statusColumn == null ? -1 : indexOf(statusColumn);
  }

  private int indexOf(String column) {
    int index = header.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException("Column '" + column + "' is not in header " + header);
    }
    return index;
  }

  @Override public String getName() {
    return "csv";
  }

  @Override public String getFileExtension() {
    return ".csv";
  }

  @Override public TimeSeriesColumns getColumns() {
    return columns;
  }

  public List<String> getHeader() {
    return header;
  }

  public char getSeparator() {
    return separator;
  }

  @Override public List<TimeSeriesRow> read(StorageProvider storage, String path)
      throws IOException {
    List<TimeSeriesRow> rows = new ArrayList<TimeSeriesRow>();
    try (CSVReader csvReader = new CSVReaderBuilder(storage.openReader(path))
        .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
        .build()) {
      String[] line;
      while ((line = csvReader.readNext()) != null) {
        if (line.length == 1 && line[0].trim().isEmpty()) {
          continue;
        }
        if (line.length < header.size()) {
          throw new IOException("Line " + csvReader.getLinesRead() + " of " + path
              + " has " + line.length + " columns, expected " + header.size());
        }
        rows.add(toRow(line, path, csvReader.getLinesRead()));
      }
    } catch (CsvValidationException e) {
      throw new IOException("Unable to parse CSV file " + path, e);
    }
    LOGGER.debug("Read {} rows from {}", rows.size(), path);
    return rows;
  }

  private TimeSeriesRow toRow(String[] line, String path, long lineNumber) throws IOException {
    try {
      long timestamp = Timestamps.parse(line[datetimeIndex]);
      String valueText = line[valueIndex].trim();
      double value = valueText.isEmpty() ? Double.NaN : (double) Float.parseFloat(valueText);
      return new TimeSeriesRow(timestamp, value,
          parseStatus(statusIndex < 0 ? null : line[statusIndex]));
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IOException("Invalid value on line " + lineNumber + " of " + path, e);
    }
  }

  static @Nullable Integer parseStatus(@Nullable String text) {
    if (text == null || text.trim().isEmpty()) {
      return null;
    }
    String trimmed = text.trim();
    if (trimmed.indexOf('.') >= 0) {
      double status = Double.parseDouble(trimmed);
      return Double.isNaN(status) ? null : (int) status;
    }
    return Integer.valueOf(trimmed);
  }
}
