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
package org.apache.calcite.adapter.popgetter.storage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Storage provider interface for abstracting read access to published
 * releases. Implementations provide access to the local filesystem and to
 * HTTP servers that honour range requests.
 *
 * <p>Paths are the strings that appear in the catalog, joined to the release
 * base path with {@link #resolvePath(String, String)}.
 */
public interface StorageProvider {

  /**
   * Opens an input stream for reading the whole file.
   *
   * @param path The file path or URL
   * @return Input stream positioned at the first byte
   * @throws IOException If the file cannot be opened
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Reads a byte range of a file.
   *
   * @param path The file path or URL
   * @param offset First byte to read
   * @param length Number of bytes wanted
   * @return The bytes read; shorter than {@code length} only at end of file
   * @throws IOException If the range cannot be read
   */
  byte[] readRange(String path, long offset, int length) throws IOException;

  /**
   * Gets the size of a file in bytes.
   *
   * @param path The file path or URL
   * @return File length
   * @throws IOException If the file does not exist or cannot be inspected
   */
  long getLength(String path) throws IOException;

  /**
   * Checks if a file exists.
   *
   * @param path The file path or URL
   * @return true if the file exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local", "http")
   */
  String getStorageType();

  /**
   * Resolves a path relative to a base path.
   *
   * @param basePath The base path
   * @param relativePath The relative path
   * @return The resolved path
   */
  default String resolvePath(String basePath, String relativePath) {
    if (basePath.endsWith("/")) {
      return basePath + relativePath;
    }
    return basePath + "/" + relativePath;
  }

  /**
   * Reads a whole file as UTF-8 text.
   *
   * @param path The file path or URL
   * @return File content
   * @throws IOException If an I/O error occurs
   */
  default String readText(String path) throws IOException {
    try (InputStream in = openInputStream(path)) {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      byte[] chunk = new byte[8192];
      int bytesRead;
      while ((bytesRead = in.read(chunk)) != -1) {
        buffer.write(chunk, 0, bytesRead);
      }
      return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }
  }
}
