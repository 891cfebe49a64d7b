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
package org.apache.calcite.adapter.sensor.table;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.sensor.join.AlignedTable;
import org.apache.calcite.adapter.sensor.join.ColumnKey;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exposes an {@link AlignedTable} to SQL.
 *
 * <p>The first column holds the row time as a {@code TIMESTAMP} in the
 * table's zone. One {@code DOUBLE} column follows per aligned column,
 * named after the series, or {@code series__aggregation} when several
 * aggregations were used.
 *
 * <p>Field names are unique. A column whose name is already taken, by
 * the time column or by an earlier column, gets the first free suffix
 * {@code _1}, {@code _2} and so on.
 */
public class AlignedScannableTable extends AbstractTable implements ScannableTable {
  public static final String TIME_COLUMN = "time";

  private final AlignedTable table;

  public AlignedScannableTable(AlignedTable table) {
    this.table = table;
  }

  public AlignedTable getTable() {
    return table;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    RelDataTypeFactory.Builder builder = typeFactory.builder()
        .add(TIME_COLUMN, SqlTypeName.TIMESTAMP);
    for (String name : columnNames()) {
      builder.add(name, SqlTypeName.DOUBLE);
    }
    return builder.build();
  }

  /** Names of the value columns, in table order. */
  public List<String> columnNames() {
    Set<String> used = new HashSet<String>();
    used.add(TIME_COLUMN);
    List<String> names = new ArrayList<String>(table.getColumnCount());
    for (ColumnKey key : table.getColumns()) {
      String name = key.flatName();
      for (int i = 1; !used.add(name); i++) {
        name = key.flatName() + "_" + i;
      }
      names.add(name);
    }
    return names;
  }

  @Override public Enumerable<Object[]> scan(DataContext root) {
    List<Object[]> rows = new ArrayList<Object[]>(table.getRowCount());
    int columnCount = table.getColumnCount();
    for (int r = 0; r < table.getRowCount(); r++) {
      Object[] row = new Object[columnCount + 1];
      row[0] = localMillis(table.getEpochMillis(r));
      for (int c = 0; c < columnCount; c++) {
        row[c + 1] = table.getValue(r, c);
      }
      rows.add(row);
    }
    return Linq4j.asEnumerable(rows);
  }

  /** Wall-clock millis in the table's zone, as Calcite represents TIMESTAMP. */
  private long localMillis(long epochMillis) {
    int offsetSeconds = table.getZone().getRules()
        .getOffset(Instant.ofEpochMilli(epochMillis)).getTotalSeconds();
    return epochMillis + offsetSeconds * 1000L;
  }

  @Override public String toString() {
    return "AlignedScannableTable{" + table + "}";
  }
}
