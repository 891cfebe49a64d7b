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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Storage provider backed by the local file system.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    Path dir = Paths.get(path);
    if (!Files.isDirectory(dir)) {
      throw new FileNotFoundException("Directory not found: " + path);
    }
    List<FileEntry> entries = new ArrayList<FileEntry>();
    collect(dir, recursive, entries);
    LOGGER.debug("Listed {} entries under {}", entries.size(), path);
    return entries;
  }

  private static void collect(Path dir, boolean recursive, List<FileEntry> entries)
      throws IOException {
    List<Path> children = new ArrayList<Path>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      for (Path child : stream) {
        children.add(child);
      }
    }
    // Directory streams have no defined order
    Collections.sort(children, Comparator.comparing(Path::toString));
    for (Path child : children) {
      BasicFileAttributes attributes = Files.readAttributes(child, BasicFileAttributes.class);
      entries.add(
          new FileEntry(child.toString(),
          child.getFileName().toString(),
          attributes.isDirectory(),
          attributes.isDirectory() ? 0 : attributes.size(),
          attributes.lastModifiedTime().toMillis()));
      if (recursive && attributes.isDirectory()) {
        collect(child, true, entries);
      }
    }
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    try {
      BasicFileAttributes attributes =
          Files.readAttributes(Paths.get(path), BasicFileAttributes.class);
      return new FileMetadata(path, attributes.size(),
          attributes.lastModifiedTime().toMillis(), null, null);
    } catch (NoSuchFileException e) {
      throw notFound(path, e);
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    try {
      return Files.newInputStream(Paths.get(path));
    } catch (NoSuchFileException e) {
      throw notFound(path, e);
    }
  }

  @Override public Reader openReader(String path) throws IOException {
    try {
      return Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw notFound(path, e);
    }
  }

  @Override public boolean exists(String path) throws IOException {
    return Files.exists(Paths.get(path));
  }

  @Override public boolean isDirectory(String path) throws IOException {
    return Files.isDirectory(Paths.get(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    if (relativePath == null || relativePath.isEmpty()) {
      return basePath;
    }
    return Paths.get(basePath).resolve(relativePath).toString();
  }

  private static FileNotFoundException notFound(String path, NoSuchFileException cause) {
    FileNotFoundException e = new FileNotFoundException("File not found: " + path);
    e.initCause(cause);
    return e;
  }
}
