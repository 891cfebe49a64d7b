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

import org.apache.calcite.adapter.sensor.SensorConfigException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * How the samples falling into one bucket are reduced to a single value.
 *
 * <p>NaN samples are ignored. A bucket without samples yields NaN, except
 * for {@link #SUM} and {@link #COUNT} which yield 0.
 */
public enum Aggregation {
  MEAN("mean") {
    @Override double apply(double[] values, int n) {
      if (n == 0) {
        return Double.NaN;
      }
      return sum(values, n) / n;
    }
  },
  MIN("min") {
    @Override double apply(double[] values, int n) {
      if (n == 0) {
        return Double.NaN;
      }
      double min = values[0];
      for (int i = 1; i < n; i++) {
        min = Math.min(min, values[i]);
      }
      return min;
    }
  },
  MAX("max") {
    @Override double apply(double[] values, int n) {
      if (n == 0) {
        return Double.NaN;
      }
      double max = values[0];
      for (int i = 1; i < n; i++) {
        max = Math.max(max, values[i]);
      }
      return max;
    }
  },
  SUM("sum") {
    @Override double apply(double[] values, int n) {
      return sum(values, n);
    }
  },
  COUNT("count") {
    @Override double apply(double[] values, int n) {
      return n;
    }
  },
  MEDIAN("median") {
    @Override double apply(double[] values, int n) {
      if (n == 0) {
        return Double.NaN;
      }
      double[] sorted = Arrays.copyOf(values, n);
      Arrays.sort(sorted);
      int mid = n / 2;
      return n % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }
  },
  FIRST("first") {
    @Override double apply(double[] values, int n) {
      return n == 0 ? Double.NaN : values[0];
    }
  },
  LAST("last") {
    @Override double apply(double[] values, int n) {
      return n == 0 ? Double.NaN : values[n - 1];
    }
  },
  /** Sample standard deviation. */
  STD("std") {
    @Override double apply(double[] values, int n) {
      if (n < 2) {
        return Double.NaN;
      }
      double mean = sum(values, n) / n;
      double squares = 0;
      for (int i = 0; i < n; i++) {
        double d = values[i] - mean;
        squares += d * d;
      }
      return Math.sqrt(squares / (n - 1));
    }
  };

  private final String methodName;

  Aggregation(String methodName) {
    this.methodName = methodName;
  }

  /**
   * Name used in configuration and in aligned column names.
   */
  public String getMethodName() {
    return methodName;
  }

  /**
   * Reduces the first {@code n} values of the array, which are the non-NaN
   * samples of a bucket in time order.
   */
  abstract double apply(double[] values, int n);

  private static double sum(double[] values, int n) {
    double sum = 0;
    for (int i = 0; i < n; i++) {
      sum += values[i];
    }
    return sum;
  }

  /**
   * Parses an aggregation from its method name.
   *
   * @throws SensorConfigException if the name is unknown
   */
  public static Aggregation fromString(String value) {
    if (value == null) {
      throw new SensorConfigException("Aggregation method should not be null");
    }
    for (Aggregation aggregation : values()) {
      if (aggregation.methodName.equals(value.trim().toLowerCase(Locale.ROOT))) {
        return aggregation;
      }
    }
    throw new SensorConfigException("Unknown aggregation method '" + value + "'");
  }

  /**
   * Parses a single method name or a list of method names.
   */
  public static List<Aggregation> fromObject(Object value) {
    List<Aggregation> result = new ArrayList<Aggregation>();
    if (value instanceof List) {
      for (Object item : (List<?>) value) {
        result.add(fromString(String.valueOf(item)));
      }
    } else {
      result.add(fromString(String.valueOf(value)));
    }
    if (result.isEmpty()) {
      throw new SensorConfigException("At least one aggregation method is required");
    }
    return result;
  }
}
