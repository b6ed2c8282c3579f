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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Random-access reader over one file of a {@link StorageProvider} that keeps
 * a single read-ahead window, so that runs of small reads near each other cost
 * one range request.
 *
 * <p>Not thread-safe.
 */
public class BufferedRangeReader {
  public static final int DEFAULT_WINDOW = 64 * 1024;

  private final StorageProvider storageProvider;
  private final String path;
  private final int window;
  private long length = -1;
  private byte[] buffer = new byte[0];
  private long bufferStart;

  public BufferedRangeReader(StorageProvider storageProvider, String path) {
    this(storageProvider, path, DEFAULT_WINDOW);
  }

  public BufferedRangeReader(StorageProvider storageProvider, String path, int window) {
    this.storageProvider = storageProvider;
    this.path = path;
    this.window = window;
  }

  public String path() {
    return path;
  }

  public long length() throws IOException {
    if (length < 0) {
      length = storageProvider.getLength(path);
    }
    return length;
  }

  /**
   * Copies up to {@code len} bytes at {@code position}; returns the count
   * copied, or -1 at end of file.
   */
  public int read(long position, byte[] dst, int off, int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    if (position >= length()) {
      return -1;
    }
    if (position < bufferStart || position >= bufferStart + buffer.length) {
      fill(position, len);
    }
    int start = (int) (position - bufferStart);
    int count = Math.min(len, buffer.length - start);
    System.arraycopy(buffer, start, dst, off, count);
    return count;
  }

  public void readFully(long position, byte[] dst, int off, int len) throws IOException {
    int done = 0;
    while (done < len) {
      int read = read(position + done, dst, off + done, len - done);
      if (read < 0) {
        throw new EOFException("Unexpected end of " + path + " at " + (position + done));
      }
      done += read;
    }
  }

  /** Reads exactly {@code len} bytes into a little-endian buffer. */
  public ByteBuffer readBuffer(long position, int len) throws IOException {
    byte[] bytes = new byte[len];
    readFully(position, bytes, 0, len);
    return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
  }

  private void fill(long position, int wanted) throws IOException {
    int size = (int) Math.min(Math.max(wanted, window), length() - position);
    buffer = storageProvider.readRange(path, position, size);
    bufferStart = position;
    if (buffer.length == 0) {
      throw new EOFException("No bytes returned for " + path + " at " + position);
    }
  }
}
