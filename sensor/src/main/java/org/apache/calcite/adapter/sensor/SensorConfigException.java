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

/**
 * Thrown when a sensor reader, lookup or join is configured with a value
 * it cannot work with: an unknown partition granularity, a non-positive
 * thread count, an unknown file type name, an unsupported interpolation
 * method or limit, or a sensor whose asset cannot be resolved.
 *
 * <p>Configuration errors are never retried.
 */
public class SensorConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public SensorConfigException(String message) {
    super(message);
  }

  public SensorConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
