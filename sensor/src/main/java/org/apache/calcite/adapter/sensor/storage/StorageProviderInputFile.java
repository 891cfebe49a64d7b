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

import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Parquet {@link InputFile} over a {@link StorageProvider}, so that sensor
 * Parquet files can be read from any store without a Hadoop file system.
 *
 * <p>The file is fetched once, on the first stream, and kept in memory;
 * sensor partitions are bounded by the lookup's maximum file size.
 */
public class StorageProviderInputFile implements InputFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageProviderInputFile.class);

  private final StorageProvider storageProvider;
  private final String path;
  private byte[] content;

  public StorageProviderInputFile(StorageProvider storageProvider, String path) {
    this.storageProvider = storageProvider;
    this.path = path;
  }

  @Override public long getLength() throws IOException {
    return load().length;
  }

  @Override public SeekableInputStream newStream() throws IOException {
    LOGGER.debug("Opening stream for: {}", path);
    return new InMemorySeekableInputStream(load());
  }

  private synchronized byte[] load() throws IOException {
    if (content == null) {
      try (InputStream in = storageProvider.openInputStream(path)) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int bytesRead;
        while ((bytesRead = in.read(chunk)) != -1) {
          buffer.write(chunk, 0, bytesRead);
        }
        content = buffer.toByteArray();
      }
      LOGGER.debug("Fetched {} bytes from {}", content.length, path);
    }
    return content;
  }

  @Override public String toString() {
    return path;
  }

  /**
   * Seekable stream over a byte array.
   */
  private static class InMemorySeekableInputStream extends DelegatingSeekableInputStream {
    private final SeekableByteArrayInputStream in;

    InMemorySeekableInputStream(byte[] bytes) {
      this(new SeekableByteArrayInputStream(bytes));
    }

    private InMemorySeekableInputStream(SeekableByteArrayInputStream in) {
      super(in);
      this.in = in;
    }

    @Override public long getPos() {
      return in.position();
    }

    @Override public void seek(long newPos) {
      in.seek(newPos);
    }
  }

  /**
   * Byte array stream exposing its position.
   */
  private static class SeekableByteArrayInputStream extends ByteArrayInputStream {
    SeekableByteArrayInputStream(byte[] bytes) {
      super(bytes);
    }

    long position() {
      return pos;
    }

    void seek(long newPos) {
      if (newPos < 0 || newPos > count) {
        throw new IllegalArgumentException("Invalid seek position: " + newPos);
      }
      pos = (int) newPos;
    }
  }
}
