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
import org.apache.calcite.adapter.sensor.storage.StorageProviderInputFile;

import org.apache.avro.LogicalType;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads sensor Parquet files through parquet-avro.
 *
 * <p>The datetime column may be stored as a {@code timestamp-millis} or
 * {@code timestamp-micros} long, as a plain epoch long or as an ISO-8601
 * string. Value and status columns may be numeric or numeric strings.
 */
public class ParquetFileFormat implements FileFormat {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetFileFormat.class);

  private final TimeSeriesColumns columns;

  public ParquetFileFormat() {
    this(TimeSeriesColumns.DEFAULT);
  }

  public ParquetFileFormat(TimeSeriesColumns columns) {
    this.columns = columns;
  }

  @Override public String getName() {
    return "parquet";
  }

  @Override public String getFileExtension() {
    return ".parquet";
  }

  @Override public TimeSeriesColumns getColumns() {
    return columns;
  }

  @Override public List<TimeSeriesRow> read(StorageProvider storage, String path)
      throws IOException {
    List<TimeSeriesRow> rows = new ArrayList<TimeSeriesRow>();
    StorageProviderInputFile inputFile = new StorageProviderInputFile(storage, path);
    try (ParquetReader<GenericRecord> reader =
        AvroParquetReader.<GenericRecord>builder(inputFile).build()) {
      String timeUnit = null;
      boolean first = true;
      GenericRecord record;
      while ((record = reader.read()) != null) {
        if (first) {
          timeUnit = logicalTypeName(record.getSchema(), columns.getDatetimeColumn());
          first = false;
        }
        rows.add(toRow(record, timeUnit, path));
      }
    }
    LOGGER.debug("Read {} rows from {}", rows.size(), path);
    return rows;
  }

  private TimeSeriesRow toRow(GenericRecord record, @Nullable String timeUnit, String path)
      throws IOException {
    Object time = field(record, columns.getDatetimeColumn());
    if (time == null) {
      throw new IOException("Null '" + columns.getDatetimeColumn() + "' in " + path);
    }
    long timestamp = toEpochMillis(time, timeUnit, path);
    double value = toDouble(field(record, columns.getValueColumn()));
    Integer status = null;
    String statusColumn = columns.getStatusColumn();
    if (statusColumn != null) {
      status = toStatus(field(record, statusColumn));
    }
    return new TimeSeriesRow(timestamp, value, status);
  }

  /** Value of a field, null when the file does not have that column. */
  private static @Nullable Object field(GenericRecord record, String name) {
    return record.getSchema().getField(name) == null ? null : record.get(name);
  }

  private static long toEpochMillis(Object time, @Nullable String unit, String path)
      throws IOException {
    if (time instanceof Long || time instanceof Integer) {
      return Timestamps.fromEpoch(((Number) time).longValue(), unit);
    } else if (time instanceof Instant) {
      return ((Instant) time).toEpochMilli();
    } else if (time instanceof LocalDateTime) {
      return ((LocalDateTime) time).toInstant(ZoneOffset.UTC).toEpochMilli();
    } else if (time instanceof CharSequence) {
      try {
        return Timestamps.parse(time.toString());
      } catch (DateTimeParseException e) {
        throw new IOException("Invalid timestamp '" + time + "' in " + path, e);
      }
    }
    throw new IOException("Unsupported timestamp type " + time.getClass().getName()
        + " in " + path);
  }

  private static double toDouble(@Nullable Object value) {
    if (value == null) {
      return Double.NaN;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Double.NaN : Double.parseDouble(text);
  }

  private static @Nullable Integer toStatus(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      double status = ((Number) value).doubleValue();
      return Double.isNaN(status) ? null : (int) status;
    }
    return CsvFileFormat.parseStatus(value.toString());
  }

  /**
   * Name of the logical type of a (possibly nullable) field, null if none.
   */
  private static @Nullable String logicalTypeName(Schema schema, String fieldName) {
    Schema.Field field = schema.getField(fieldName);
    if (field == null) {
      return null;
    }
    Schema fieldSchema = field.schema();
    if (fieldSchema.getType() == Schema.Type.UNION) {
      for (Schema branch : fieldSchema.getTypes()) {
        if (branch.getType() != Schema.Type.NULL) {
          fieldSchema = branch;
          break;
        }
      }
    }
    LogicalType logicalType = fieldSchema.getLogicalType();
    return logicalType == null ? null : logicalType.getName();
  }
}
