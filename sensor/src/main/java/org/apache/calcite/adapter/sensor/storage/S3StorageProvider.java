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

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.regions.DefaultAwsRegionProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only storage provider for Amazon S3 and S3-compatible stores.
 *
 * <p>Paths are {@code s3://bucket/key} URIs. Configuration keys:
 * {@code accessKeyId}, {@code secretAccessKey}, {@code region} and
 * {@code endpoint}; anything missing falls back to the default AWS
 * provider chains and the {@code AWS_REGION} / {@code AWS_ENDPOINT_OVERRIDE}
 * environment variables.
 *
 * <p>The underlying {@link AmazonS3} client is thread-safe, so a single
 * provider can serve all lookup workers.
 */
public class S3StorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageProvider.class);

  private static final String SCHEME = "s3://";

  private final AmazonS3 s3Client;

  public S3StorageProvider(AmazonS3 s3Client) {
    this.s3Client = s3Client;
  }

  public S3StorageProvider(@Nullable Map<String, Object> config) {
    this(buildClient(config));
  }

  private static AmazonS3 buildClient(@Nullable Map<String, Object> config) {
    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(5 * 60 * 1000);
    clientConfig.setConnectionTimeout(60 * 1000);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig);

    String accessKeyId = config != null ? (String) config.get("accessKeyId") : null;
    String secretAccessKey = config != null ? (String) config.get("secretAccessKey") : null;
    if (accessKeyId != null && secretAccessKey != null) {
      builder.withCredentials(
          new AWSStaticCredentialsProvider(
          new BasicAWSCredentials(accessKeyId, secretAccessKey)));
    } else {
      builder.withCredentials(new DefaultAWSCredentialsProviderChain());
    }

    String endpoint = config != null ? (String) config.get("endpoint") : null;
    if (endpoint == null) {
      endpoint = System.getenv("AWS_ENDPOINT_OVERRIDE");
    }
    String region = config != null ? (String) config.get("region") : null;
    if (region == null) {
      region = System.getenv("AWS_REGION");
    }
    if (region == null) {
      try {
        region = new DefaultAwsRegionProviderChain().getRegion();
      } catch (RuntimeException e) {
        LOGGER.debug("No AWS region configured, using us-east-1: {}", e.getMessage());
        region = "us-east-1";
      }
    }

    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      // MinIO and friends need path-style access
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    return builder.build();
  }

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    String prefix = s3Uri.key.isEmpty() || s3Uri.key.endsWith("/") ? s3Uri.key : s3Uri.key + "/";
    List<FileEntry> entries = new ArrayList<FileEntry>();

    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(s3Uri.bucket)
        .withPrefix(prefix);
    if (!recursive) {
      request.withDelimiter("/");
    }

    ListObjectsV2Result result;
    do {
      try {
        result = s3Client.listObjectsV2(request);
      } catch (AmazonServiceException e) {
        throw translate(path, e);
      }

      for (S3ObjectSummary summary : result.getObjectSummaries()) {
        if (!summary.getKey().equals(prefix)) {
          entries.add(
              new FileEntry(SCHEME + s3Uri.bucket + "/" + summary.getKey(),
              getFileName(summary.getKey()),
              false,
              summary.getSize(),
              summary.getLastModified().getTime()));
        }
      }

      if (!recursive && result.getCommonPrefixes() != null) {
        for (String commonPrefix : result.getCommonPrefixes()) {
          String trimmed = commonPrefix.endsWith("/")
              ? commonPrefix.substring(0, commonPrefix.length() - 1) : commonPrefix;
          entries.add(
              new FileEntry(SCHEME + s3Uri.bucket + "/" + trimmed,
              getFileName(trimmed),
              true,
              0,
              0));
        }
      }

      request.setContinuationToken(result.getNextContinuationToken());
    } while (result.isTruncated());

    LOGGER.debug("Listed {} entries under {}", entries.size(), path);
    return entries;
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      ObjectMetadata metadata = s3Client.getObjectMetadata(s3Uri.bucket, s3Uri.key);
      return new FileMetadata(
          path,
          metadata.getContentLength(),
          metadata.getLastModified() != null ? metadata.getLastModified().getTime() : 0L,
          metadata.getContentType(),
          metadata.getETag());
    } catch (AmazonServiceException e) {
      throw translate(path, e);
    }
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      S3Object object = s3Client.getObject(new GetObjectRequest(s3Uri.bucket, s3Uri.key));
      return object.getObjectContent();
    } catch (AmazonServiceException e) {
      throw translate(path, e);
    }
  }

  @Override public Reader openReader(String path) throws IOException {
    return new InputStreamReader(openInputStream(path), StandardCharsets.UTF_8);
  }

  @Override public boolean exists(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);
    try {
      boolean exists = s3Client.doesObjectExist(s3Uri.bucket, s3Uri.key);
      LOGGER.debug("S3 exists check: {} -> {}", path, exists);
      return exists;
    } catch (AmazonServiceException e) {
      throw translate(path, e);
    }
  }

  @Override public boolean isDirectory(String path) throws IOException {
    S3Uri s3Uri = parseS3Uri(path);

    // Directories are key prefixes in S3
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(s3Uri.bucket)
        .withPrefix(s3Uri.key.endsWith("/") ? s3Uri.key : s3Uri.key + "/")
        .withMaxKeys(1);
    try {
      ListObjectsV2Result result = s3Client.listObjectsV2(request);
      return result.getKeyCount() > 0;
    } catch (AmazonServiceException e) {
      throw translate(path, e);
    }
  }

  @Override public String getStorageType() {
    return "s3";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    if (relativePath == null || relativePath.isEmpty()) {
      return basePath;
    }
    if (relativePath.startsWith(SCHEME)) {
      return relativePath;
    }
    String base = basePath.endsWith("/") ? basePath : basePath + "/";
    String relative = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
    return base + relative;
  }

  private static IOException translate(String path, AmazonServiceException e) {
    if (e.getStatusCode() == 404) {
      FileNotFoundException notFound = new FileNotFoundException("S3 object not found: " + path);
      notFound.initCause(e);
      return notFound;
    }
    return new IOException("S3 request failed for " + path + ": " + e.getErrorMessage(), e);
  }

  static S3Uri parseS3Uri(String uri) throws IOException {
    if (!uri.startsWith(SCHEME)) {
      throw new IOException("Invalid S3 URI: " + uri);
    }
    // Keys are taken verbatim: sensor directories contain literal '%' escapes
    String rest = uri.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    String bucket = slash < 0 ? rest : rest.substring(0, slash);
    String key = slash < 0 ? "" : rest.substring(slash + 1);
    if (bucket.isEmpty()) {
      throw new IOException("Missing bucket in S3 URI: " + uri);
    }
    return new S3Uri(bucket, key);
  }

  private static String getFileName(String key) {
    int lastSlash = key.lastIndexOf('/');
    if (lastSlash >= 0 && lastSlash < key.length() - 1) {
      return key.substring(lastSlash + 1);
    }
    return key;
  }

  /**
   * Bucket and key of an {@code s3://} URI.
   */
  static class S3Uri {
    final String bucket;
    final String key;

    S3Uri(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }
  }
}
