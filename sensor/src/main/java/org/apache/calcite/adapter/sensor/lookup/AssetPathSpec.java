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
package org.apache.calcite.adapter.sensor.lookup;

import org.apache.calcite.adapter.sensor.storage.StorageProvider;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Where an asset's sensor directories live: a base path plus a path
 * relative to it, bound to the reader that understands the layout.
 */
public final class AssetPathSpec {
  private final String readerName;
  private final String basePath;
  private final String relativePath;

  public AssetPathSpec(String readerName, String basePath, String relativePath) {
    this.readerName = Objects.requireNonNull(readerName, "readerName");
    this.basePath = Objects.requireNonNull(basePath, "basePath");
    this.relativePath = relativePath == null ? "" : relativePath;
  }

  public String getReaderName() {
    return readerName;
  }

  public String getBasePath() {
    return basePath;
  }

  public String getRelativePath() {
    return relativePath;
  }

  /**
   * Base and relative path joined by the storage's rules.
   */
  public String fullPath(StorageProvider storage) {
    return storage.resolvePath(basePath, relativePath);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (!(o instanceof AssetPathSpec)) {
      return false;
    }
    AssetPathSpec that = (AssetPathSpec) o;
    return readerName.equals(that.readerName)
        && basePath.equals(that.basePath)
        && relativePath.equals(that.relativePath);
  }

  @Override public int hashCode() {
    return Objects.hash(readerName, basePath, relativePath);
  }

  @Override public String toString() {
    return "AssetPathSpec{reader=" + readerName + ", base=" + basePath
        + ", path=" + relativePath + "}";
  }
}
