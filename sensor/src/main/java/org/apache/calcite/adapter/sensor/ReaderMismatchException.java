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
 * Thrown when the asset catalog binds an asset to a reader other than the
 * one asking for it.
 */
public class ReaderMismatchException extends SensorConfigException {
  private static final long serialVersionUID = 1L;

  private final String expectedReader;
  private final String actualReader;

  public ReaderMismatchException(String expectedReader, String actualReader) {
    super("Assets reader name should be equal '" + expectedReader
        + "' and not '" + actualReader + "'");
    this.expectedReader = expectedReader;
    this.actualReader = actualReader;
  }

  public String getExpectedReader() {
    return expectedReader;
  }

  public String getActualReader() {
    return actualReader;
  }
}
