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
package org.apache.calcite.adapter.sensor.storage;

import org.apache.calcite.adapter.sensor.SensorConfigException;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates storage providers by type name or from a path URL.
 *
 * <pre>{@code
 * StorageProvider local = StorageProviderFactory.create("local", null);
 * StorageProvider s3 = StorageProviderFactory.createFromUrl("s3://datalake/");
 * }</pre>
 */
public final class StorageProviderFactory {

  private static final Map<String, Function<@Nullable Map<String, Object>, StorageProvider>>
      PROVIDERS = ImmutableMap.<String, Function<@Nullable Map<String, Object>, StorageProvider>>of(
          "local", config -> new LocalFileStorageProvider(),
          "s3", S3StorageProvider::new);

  private StorageProviderFactory() {
  }

  /**
   * Registered storage type names.
   */
  public static Set<String> getStorageTypes() {
    return Collections.unmodifiableSet(PROVIDERS.keySet());
  }

  /**
   * Creates a storage provider of the given type.
   *
   * @param storageType "local" or "s3"
   * @param config Provider specific configuration, may be null
   * @return StorageProvider
   * @throws SensorConfigException if the type is unknown
   */
  public static StorageProvider create(String storageType,
      @Nullable Map<String, Object> config) {
    Function<@Nullable Map<String, Object>, StorageProvider> factory =
        storageType == null ? null : PROVIDERS.get(storageType.toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw new SensorConfigException("Unknown storage type '" + storageType
          + "', expected one of " + PROVIDERS.keySet());
    }
    return factory.apply(config);
  }

  /**
   * Picks a storage provider from the scheme of a path.
   */
  public static StorageProvider createFromUrl(String url) {
    if (url != null && url.startsWith("s3://")) {
      return create("s3", null);
    }
    return create("local", null);
  }
}
