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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StorageProviderFactory} and S3 path handling.
 */
@Tag("unit")
public class StorageProviderFactoryTest {

  @Test
  void testCreateLocal() {
    assertInstanceOf(LocalFileStorageProvider.class, StorageProviderFactory.create("local", null));
    assertInstanceOf(LocalFileStorageProvider.class, StorageProviderFactory.create("LOCAL", null));
    assertInstanceOf(LocalFileStorageProvider.class,
        StorageProviderFactory.createFromUrl("/data/sensordata"));
  }

  @Test
  void testUnknownType() {
    SensorConfigException e = assertThrows(SensorConfigException.class,
        () -> StorageProviderFactory.create("ftp", null));
    assertTrue(e.getMessage().contains("ftp"));
  }

  @Test
  void testStorageTypes() {
    assertTrue(StorageProviderFactory.getStorageTypes().contains("local"));
    assertTrue(StorageProviderFactory.getStorageTypes().contains("s3"));
  }

  @Test
  void testParseS3UriKeepsEscapes() throws IOException {
    S3StorageProvider.S3Uri uri =
        S3StorageProvider.parseS3Uri("s3://lake/raw/1101-SFB/%C3%81sgar%C3%B0r/");
    assertEquals("lake", uri.bucket);
    assertEquals("raw/1101-SFB/%C3%81sgar%C3%B0r/", uri.key);
  }

  @Test
  void testParseS3UriErrors() {
    assertThrows(IOException.class, () -> S3StorageProvider.parseS3Uri("/local/path"));
    assertThrows(IOException.class, () -> S3StorageProvider.parseS3Uri("s3:///key"));
  }
}
