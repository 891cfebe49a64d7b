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

import org.apache.calcite.adapter.sensor.SensorConfigException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asset catalog loaded from YAML.
 *
 * <pre>{@code
 * storages:
 *   dataplatform:
 *     - reader: ncs_reader
 *       base_dir: /raw/plant/sensordata
 *       assets:
 *         - name: 1101-sfb
 *           path: 1101-SFB
 *         - name: 1755-gra
 *           path: 1755-GRA
 * }</pre>
 *
 * <p>Each storage holds groups of assets sharing a reader and a base
 * directory. An asset's directory is {@code base_dir/path}.
 */
public class AssetsConfig implements AssetCatalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(AssetsConfig.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final Map<String, Map<String, AssetPathSpec>> storages;

  public AssetsConfig(Map<String, Map<String, AssetPathSpec>> storages) {
    Map<String, Map<String, AssetPathSpec>> copy =
        new LinkedHashMap<String, Map<String, AssetPathSpec>>();
    for (Map.Entry<String, Map<String, AssetPathSpec>> entry : storages.entrySet()) {
      copy.put(entry.getKey(),
          Collections.unmodifiableMap(new LinkedHashMap<String, AssetPathSpec>(entry.getValue())));
    }
    this.storages = Collections.unmodifiableMap(copy);
  }

  @Override public @Nullable AssetPathSpec getPath(String storageName, String asset) {
    Map<String, AssetPathSpec> assets = storages.get(storageName);
    if (assets == null) {
      return null;
    }
    return assets.get(asset);
  }

  /**
   * Storage name to asset name to path spec.
   */
  public Map<String, Map<String, AssetPathSpec>> getStorages() {
    return storages;
  }

  /**
   * Loads the catalog from a YAML stream.
   *
   * @throws IOException if the stream cannot be read or is not YAML
   * @throws SensorConfigException if the document does not have the expected layout
   */
  @SuppressWarnings("unchecked")
  public static AssetsConfig fromYaml(InputStream inputStream) throws IOException {
    Map<String, Object> yamlData = YAML_MAPPER.readValue(inputStream, Map.class);
    return fromMap(yamlData);
  }

  /**
   * Loads the catalog from a classpath resource.
   */
  public static AssetsConfig fromResource(String resourcePath) throws IOException {
    InputStream inputStream = AssetsConfig.class.getResourceAsStream(resourcePath);
    if (inputStream == null) {
      throw new IOException("Assets config resource not found: " + resourcePath);
    }
    try (InputStream in = inputStream) {
      AssetsConfig config = fromYaml(in);
      LOGGER.debug("Loaded assets config from {}", resourcePath);
      return config;
    }
  }

  /**
   * Builds the catalog from a parsed YAML/JSON map.
   */
  @SuppressWarnings("unchecked")
  public static AssetsConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null || !(map.get("storages") instanceof Map)) {
      throw new SensorConfigException("Assets config requires a 'storages' map");
    }
    Map<String, Object> storagesMap = (Map<String, Object>) map.get("storages");
    Map<String, Map<String, AssetPathSpec>> storages =
        new LinkedHashMap<String, Map<String, AssetPathSpec>>();
    for (Map.Entry<String, Object> storageEntry : storagesMap.entrySet()) {
      String storageName = storageEntry.getKey();
      if (!(storageEntry.getValue() instanceof List)) {
        throw new SensorConfigException("Storage '" + storageName + "' should be a list of groups");
      }
      Map<String, AssetPathSpec> assets = new LinkedHashMap<String, AssetPathSpec>();
      for (Object groupObj : (List<Object>) storageEntry.getValue()) {
        if (!(groupObj instanceof Map)) {
          throw new SensorConfigException("Invalid asset group in storage '" + storageName + "'");
        }
        Map<String, Object> group = (Map<String, Object>) groupObj;
        String reader = requireString(group, "reader", storageName);
        String baseDir = requireString(group, "base_dir", storageName);
        Object assetsObj = group.get("assets");
        if (!(assetsObj instanceof List)) {
          continue;
        }
        for (Object assetObj : (List<Object>) assetsObj) {
          if (!(assetObj instanceof Map)) {
            throw new SensorConfigException("Invalid asset entry in storage '" + storageName + "'");
          }
          Map<String, Object> asset = (Map<String, Object>) assetObj;
          String name = requireString(asset, "name", storageName);
          Object path = asset.get("path");
          assets.put(name,
              new AssetPathSpec(reader, baseDir, path == null ? "" : String.valueOf(path)));
        }
      }
      storages.put(storageName, assets);
    }
    return new AssetsConfig(storages);
  }

  private static String requireString(Map<String, Object> map, String key, String storageName) {
    Object value = map.get(key);
    if (value == null) {
      throw new SensorConfigException("Missing '" + key + "' in storage '" + storageName + "'");
    }
    return String.valueOf(value);
  }
}
