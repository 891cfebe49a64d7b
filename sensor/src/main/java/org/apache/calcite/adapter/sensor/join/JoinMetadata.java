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
package org.apache.calcite.adapter.sensor.join;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lengths recorded while joining: per series the number of raw samples and
 * the number of resampled rows, and for the join the number of rows before
 * and after dropping incomplete ones.
 *
 * <pre>{@code
 * {
 *   "TAG-1": {"original_length": 518400, "resampled_length": 1250},
 *   "aggregate_metadata": {"joined_length": 481, "dropped_na_length": 481}
 * }
 * }</pre>
 */
public final class JoinMetadata {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, SeriesLengths> series = new LinkedHashMap<String, SeriesLengths>();
  private int joinedLength = -1;
  private int droppedNaLength = -1;

  void recordOriginal(String name, int originalLength) {
    series.put(name, new SeriesLengths(originalLength));
  }

  void recordResampled(String name, int resampledLength) {
    SeriesLengths lengths = series.get(name);
    if (lengths != null) {
      lengths.resampledLength = resampledLength;
    }
  }

  void recordJoin(int joinedLength, int droppedNaLength) {
    this.joinedLength = joinedLength;
    this.droppedNaLength = droppedNaLength;
  }

  public Map<String, SeriesLengths> getSeries() {
    return Collections.unmodifiableMap(series);
  }

  public int getJoinedLength() {
    return joinedLength;
  }

  public int getDroppedNaLength() {
    return droppedNaLength;
  }

  /**
   * Nested map form, keyed by series name plus {@code aggregate_metadata}.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, SeriesLengths> entry : series.entrySet()) {
      map.put(entry.getKey(), entry.getValue().toMap());
    }
    Map<String, Object> aggregate = new LinkedHashMap<String, Object>();
    aggregate.put("joined_length", joinedLength);
    aggregate.put("dropped_na_length", droppedNaLength);
    map.put("aggregate_metadata", aggregate);
    return map;
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(toMap());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize join metadata", e);
    }
  }

  @Override public String toString() {
    return toMap().toString();
  }

  /**
   * Lengths of one series.
   */
  public static final class SeriesLengths {
    private final int originalLength;
    private @Nullable Integer resampledLength;

    SeriesLengths(int originalLength) {
      this.originalLength = originalLength;
    }

    public int getOriginalLength() {
      return originalLength;
    }

    /**
     * Rows left after resampling, null if the series had no data.
     */
    public @Nullable Integer getResampledLength() {
      return resampledLength;
    }

    Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<String, Object>();
      map.put("original_length", originalLength);
      if (resampledLength != null) {
        map.put("resampled_length", resampledLength);
      }
      return map;
    }
  }
}
