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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps an asset to the storage root holding its sensor directories.
 *
 * @see AssetsConfig
 */
public interface AssetCatalog {

  /**
   * Resolves an asset within a named storage.
   *
   * @param storageName Storage the asset is stored in
   * @param asset Asset name
   * @return Path spec, or null if the asset is unknown to that storage
   */
  @Nullable AssetPathSpec getPath(String storageName, String asset);
}
