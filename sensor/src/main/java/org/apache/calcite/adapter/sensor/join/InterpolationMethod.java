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

/**
 * How gaps left after resampling are filled.
 */
public enum InterpolationMethod {
  /** Linear interpolation between neighbours, last value carried over trailing gaps. */
  LINEAR_INTERPOLATION("linear_interpolation"),

  /** Last valid value carried forward. */
  FFILL("ffill");

  private final String methodName;

  InterpolationMethod(String methodName) {
    this.methodName = methodName;
  }

  public String getMethodName() {
    return methodName;
  }

  /**
   * Parses a method from its configuration name.
   *
   * @throws SensorConfigException if the name is neither "linear_interpolation" nor "ffill"
   */
  public static InterpolationMethod fromString(String value) {
    if (value != null) {
      for (InterpolationMethod method : values()) {
        if (method.methodName.equals(value.trim())) {
          return method;
        }
      }
    }
    throw new SensorConfigException(
        "Interpolation method should be either linear_interpolation or ffill, not '"
            + value + "'");
  }
}
