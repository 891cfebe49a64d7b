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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.List;

/**
 * Read-only access to the hierarchical store holding sensor files.
 * Implementations exist for the local file system and S3.
 *
 * <p>A missing path is always reported as {@link java.io.FileNotFoundException}
 * so that callers can tell "not there" from other I/O failures. Providers
 * are shared between lookup worker threads and must be safe for concurrent
 * reads.
 */
public interface StorageProvider {

  /**
   * Lists files in a directory or container.
   *
   * @param path The directory or container path
   * @param recursive Whether to include subdirectories
   * @return List of file entries
   * @throws IOException If an I/O error occurs
   */
  List<FileEntry> listFiles(String path, boolean recursive) throws IOException;

  /**
   * Gets metadata for a single file.
   *
   * @param path The file path
   * @return File metadata
   * @throws java.io.FileNotFoundException If the file does not exist
   * @throws IOException If an I/O error occurs
   */
  FileMetadata getMetadata(String path) throws IOException;

  /**
   * Opens an input stream for reading file content.
   *
   * @param path The file path
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Opens a reader for reading text file content.
   *
   * @param path The file path
   * @return Reader for the file
   * @throws IOException If an I/O error occurs
   */
  Reader openReader(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Checks if a path is a directory.
   *
   * @param path The path to check
   * @return true if the path is a directory
   * @throws IOException If an I/O error occurs
   */
  boolean isDirectory(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local", "s3")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a base path. An empty relative path
   * resolves to the base path itself.
   *
   * @param basePath The base path
   * @param relativePath The relative path
   * @return The resolved path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * Entry of a directory listing.
   */
  class FileEntry {
    private final String path;
    private final String name;
    private final boolean isDirectory;
    private final long size;
    private final long lastModified;

    public FileEntry(String path, String name, boolean isDirectory,
                     long size, long lastModified) {
      this.path = path;
      this.name = name;
      this.isDirectory = isDirectory;
      this.size = size;
      this.lastModified = lastModified;
    }

    public String getPath() {
      return path;
    }

    /**
     * Last path segment, without any trailing separator.
     */
    public String getName() {
      return name;
    }

    public boolean isDirectory() {
      return isDirectory;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    @Override public String toString() {
      return "FileEntry{" + path + (isDirectory ? "/" : ", " + size + " bytes") + "}";
    }
  }

  /**
   * File metadata returned by {@link #getMetadata(String)}.
   */
  class FileMetadata {
    private final String path;
    private final long size;
    private final long lastModified;
    private final @Nullable String contentType;
    private final @Nullable String etag;

    public FileMetadata(String path, long size, long lastModified,
                        @Nullable String contentType, @Nullable String etag) {
      this.path = path;
      this.size = size;
      this.lastModified = lastModified;
      this.contentType = contentType;
      this.etag = etag;
    }

    public String getPath() {
      return path;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    public @Nullable String getContentType() {
      return contentType;
    }

    public @Nullable String getEtag() {
      return etag;
    }
  }
}
