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

import org.apache.calcite.adapter.sensor.partition.Partition;
import org.apache.calcite.adapter.sensor.partition.PartitionBy;

import java.util.Locale;

/**
 * Monthly Parquet files: {@code parquet/<year>/<tag>_<year><MM>.parquet}.
 */
public class MonthlyParquetProbe extends FileTypeProbe {
  public static final String NAME = "parquet";

  public MonthlyParquetProbe() {
    super(NAME, new ParquetFileFormat(), PartitionBy.MONTH);
  }

  @Override protected String relativePath(String tagName, Partition partition) {
    Partition.Month month = (Partition.Month) partition;
    return String.format(Locale.ROOT, "parquet/%d/%s_%d%02d%s", month.getYear(), tagName,
        month.getYear(), month.getMonth(), getFormat().getFileExtension());
  }
}
