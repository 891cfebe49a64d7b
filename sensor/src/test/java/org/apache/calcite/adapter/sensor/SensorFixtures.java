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

import org.apache.calcite.adapter.sensor.format.TimeSeriesRow;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes sensor files in the layouts the probes look for.
 */
public final class SensorFixtures {
  private static final DateTimeFormatter CSV_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

  private SensorFixtures() {
  }

  /** Schema of sensor Parquet files, time in epoch milliseconds. */
  public static Schema parquetSchema() {
    Schema timeSchema = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
    return SchemaBuilder.record("SensorRow").fields()
        .name("Time").type(timeSchema).noDefault()
        .name("Value").type().doubleType().noDefault()
        .name("Status").type().nullable().intType().noDefault()
        .endRecord();
  }

  /**
   * Writes a Parquet file, creating parent directories.
   */
  public static File writeParquet(Path file, String tagName, List<TimeSeriesRow> rows)
      throws IOException {
    Files.createDirectories(file.getParent());
    Schema schema = parquetSchema();
    File target = file.toFile();
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
        .<GenericRecord>builder(new org.apache.hadoop.fs.Path(target.getAbsolutePath()))
        .withSchema(schema)
        .withCompressionCodec(CompressionCodecName.SNAPPY)
        .build()) {
      for (TimeSeriesRow row : rows) {
        GenericRecord record = new GenericData.Record(schema);
        record.put("Time", row.getEpochMillis());
        record.put("Value", row.getValue());
        record.put("Status", row.getStatus());
        writer.write(record);
      }
    }
    return target;
  }

  /**
   * Writes a header-less, semicolon separated CSV file, creating parent
   * directories.
   */
  public static File writeCsv(Path file, String tagName, List<TimeSeriesRow> rows)
      throws IOException {
    Files.createDirectories(file.getParent());
    StringBuilder sb = new StringBuilder();
    for (TimeSeriesRow row : rows) {
      sb.append(tagName).append(';')
          .append(row.getValue()).append(';')
          .append(CSV_TIME.format(Instant.ofEpochMilli(row.getEpochMillis()))).append(';')
          .append(row.getStatus() == null ? "" : row.getStatus().toString())
          .append('\n');
    }
    Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
    return file.toFile();
  }

  public static TimeSeriesRow row(String isoInstant, double value, Integer status) {
    return new TimeSeriesRow(Instant.parse(isoInstant).toEpochMilli(), value, status);
  }
}
