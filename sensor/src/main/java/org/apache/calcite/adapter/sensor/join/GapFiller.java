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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fills NaN gaps in a regularly spaced column.
 *
 * <p>Only gaps after the first valid value are filled. With a limit, at
 * most {@code limit} consecutive cells of each gap are filled, counted from
 * the start of the gap; the rest stay NaN.
 */
final class GapFiller {
  private GapFiller() {
  }

  static double[] fill(InterpolationMethod method, double[] column, @Nullable Integer limit) {
    switch (method) {
    case FFILL:
      return forwardFill(column, limit);
    case LINEAR_INTERPOLATION:
    default:
      return linear(column, limit);
    }
  }

  /**
   * Interpolates interior gaps linearly by position. Cells after the last
   * valid value take that value.
   */
  static double[] linear(double[] column, @Nullable Integer limit) {
    double[] result = column.clone();
    int previous = -1;
    int i = 0;
    while (i < result.length) {
      if (!Double.isNaN(result[i])) {
        previous = i;
        i++;
        continue;
      }
      int gapStart = i;
      while (i < result.length && Double.isNaN(result[i])) {
        i++;
      }
      if (previous < 0) {
        continue;
      }
      int gapEnd = i;
      int fillEnd = limit == null ? gapEnd : Math.min(gapEnd, gapStart + limit);
      double from = result[previous];
      if (gapEnd == result.length) {
        for (int k = gapStart; k < fillEnd; k++) {
          result[k] = from;
        }
      } else {
        double to = result[gapEnd];
        int span = gapEnd - previous;
        for (int k = gapStart; k < fillEnd; k++) {
          result[k] = from + (to - from) * (k - previous) / span;
        }
      }
    }
    return result;
  }

  /**
   * Carries the last valid value forward.
   */
  static double[] forwardFill(double[] column, @Nullable Integer limit) {
    double[] result = column.clone();
    double last = Double.NaN;
    int run = 0;
    for (int i = 0; i < result.length; i++) {
      if (!Double.isNaN(result[i])) {
        last = result[i];
        run = 0;
      } else if (!Double.isNaN(last)) {
        run++;
        if (limit == null || run <= limit) {
          result[i] = last;
        }
      }
    }
    return result;
  }
}
