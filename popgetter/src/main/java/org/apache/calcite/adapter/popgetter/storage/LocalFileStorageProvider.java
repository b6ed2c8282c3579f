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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Storage provider for a release laid out on the local filesystem.
 * Accepts plain paths and {@code file:} URIs.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public InputStream openInputStream(String path) throws IOException {
    Path file = toPath(path);
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toString());
    }
    return Files.newInputStream(file);
  }

  @Override public byte[] readRange(String path, long offset, int length) throws IOException {
    Path file = toPath(path);
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
      long available = Math.max(0L, channel.size() - offset);
      ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(length, available));
      long position = offset;
      while (buffer.hasRemaining()) {
        int read = channel.read(buffer, position);
        if (read < 0) {
          break;
        }
        position += read;
      }
      LOGGER.trace("Read {} bytes at {} from {}", buffer.position(), offset, file);
      if (buffer.position() == buffer.capacity()) {
        return buffer.array();
      }
      byte[] bytes = new byte[buffer.position()];
      System.arraycopy(buffer.array(), 0, bytes, 0, bytes.length);
      return bytes;
    }
  }

  @Override public long getLength(String path) throws IOException {
    return Files.size(toPath(path));
  }

  @Override public boolean exists(String path) {
    return Files.exists(toPath(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  static Path toPath(String path) {
    if (path.startsWith("file:")) {
      return Paths.get(URI.create(path));
    }
    return Paths.get(path);
  }
}
