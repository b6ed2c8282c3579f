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

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Parquet InputFile implementation that uses StorageProvider to access files.
 *
 * <p>Reads go through a {@link BufferedRangeReader}, so only the footer and the
 * column chunks a projection needs are transferred from remote storage.
 */
public class StorageProviderInputFile implements InputFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageProviderInputFile.class);

  private final StorageProvider storageProvider;
  private final String path;
  private Long cachedLength;

  public StorageProviderInputFile(StorageProvider storageProvider, String path) {
    this.storageProvider = storageProvider;
    this.path = path;
  }

  @Override public long getLength() throws IOException {
    if (cachedLength == null) {
      LOGGER.debug("Getting file length for: {}", path);
      cachedLength = storageProvider.getLength(path);
    }
    return cachedLength;
  }

  @Override public SeekableInputStream newStream() throws IOException {
    LOGGER.debug("Opening ranged stream for: {}", path);
    final long length = getLength();
    BufferedRangeReader reader =
        new BufferedRangeReader(storageProvider, path, BufferedRangeReader.DEFAULT_WINDOW) {
          @Override public long length() {
            return length;
          }
        };
    return new RangeSeekableInputStream(reader, length);
  }

  @Override public String toString() {
    return path;
  }

  /**
   * SeekableInputStream over a {@link BufferedRangeReader}.
   * Parquet requires seekable streams to read file metadata and data pages.
   */
  private static class RangeSeekableInputStream extends SeekableInputStream {
    private final BufferedRangeReader reader;
    private final long length;
    private long position;

    RangeSeekableInputStream(BufferedRangeReader reader, long length) {
      this.reader = reader;
      this.length = length;
    }

    @Override public long getPos() {
      return position;
    }

    @Override public void seek(long newPos) {
      if (newPos < 0 || newPos > length) {
        throw new IllegalArgumentException("Invalid seek position: " + newPos);
      }
      position = newPos;
    }

    @Override public void readFully(byte[] bytes) throws IOException {
      readFully(bytes, 0, bytes.length);
    }

    @Override public void readFully(byte[] bytes, int start, int len) throws IOException {
      if (position + len > length) {
        throw new EOFException("End of stream reached");
      }
      reader.readFully(position, bytes, start, len);
      position += len;
    }

    @Override public int read(ByteBuffer buf) throws IOException {
      if (position >= length) {
        return -1;
      }
      int len = (int) Math.min(buf.remaining(), length - position);
      byte[] bytes = new byte[len];
      reader.readFully(position, bytes, 0, len);
      buf.put(bytes);
      position += len;
      return len;
    }

    @Override public void readFully(ByteBuffer buf) throws IOException {
      int len = buf.remaining();
      if (position + len > length) {
        throw new EOFException("End of stream reached");
      }
      byte[] bytes = new byte[len];
      reader.readFully(position, bytes, 0, len);
      buf.put(bytes);
      position += len;
    }

    @Override public int read() throws IOException {
      if (position >= length) {
        return -1;
      }
      byte[] one = new byte[1];
      reader.readFully(position, one, 0, 1);
      position++;
      return one[0] & 0xFF;
    }

    @Override public int read(byte[] b, int off, int len) throws IOException {
      if (position >= length) {
        return -1;
      }
      int read = reader.read(position, b, off, (int) Math.min(len, length - position));
      if (read > 0) {
        position += read;
      }
      return read;
    }

    @Override public void close() {
      // Nothing held open between range requests
    }
  }
}
