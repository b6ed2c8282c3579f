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
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Storage provider for releases published over HTTP(S).
 *
 * <p>Byte ranges are fetched with {@code Range} requests. A server that
 * ignores the header and answers 200 still works, at the cost of transferring
 * the whole file for every range.
 */
public class HttpStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpStorageProvider.class);

  private static final String USER_AGENT = "calcite-popgetter";

  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final AtomicBoolean rangeWarningLogged = new AtomicBoolean();

  public HttpStorageProvider() {
    this(Duration.ofSeconds(30), Duration.ofSeconds(120));
  }

  public HttpStorageProvider(Duration connectTimeout, Duration requestTimeout) {
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    this.requestTimeout = requestTimeout;
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    LOGGER.debug("GET {}", path);
    HttpResponse<InputStream> response =
        send(request(path).GET().build(), HttpResponse.BodyHandlers.ofInputStream());
    if (response.statusCode() != 200) {
      response.body().close();
      throw new IOException("HTTP " + response.statusCode() + " from " + path);
    }
    return response.body();
  }

  @Override public byte[] readRange(String path, long offset, int length) throws IOException {
    if (length == 0) {
      return new byte[0];
    }
    long last = offset + length - 1;
    LOGGER.debug("GET {} bytes={}-{}", path, offset, last);
    HttpRequest request = request(path)
        .header("Range", "bytes=" + offset + "-" + last)
        .GET()
        .build();
    HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
    int status = response.statusCode();
    if (status == 206) {
      return response.body();
    }
    if (status == 416) {
      return new byte[0];
    }
    if (status == 200) {
      if (rangeWarningLogged.compareAndSet(false, true)) {
        LOGGER.warn("Server for {} ignored a range request; reading whole responses instead", path);
      }
      byte[] body = response.body();
      if (offset >= body.length) {
        return new byte[0];
      }
      return Arrays.copyOfRange(body, (int) offset, (int) Math.min(body.length, offset + length));
    }
    throw new IOException("HTTP " + status + " from " + path + " (bytes " + offset + "-" + last + ")");
  }

  @Override public long getLength(String path) throws IOException {
    HttpRequest head = request(path)
        .method("HEAD", HttpRequest.BodyPublishers.noBody())
        .build();
    HttpResponse<Void> response = send(head, HttpResponse.BodyHandlers.discarding());
    if (response.statusCode() != 200) {
      throw new IOException("HTTP " + response.statusCode() + " from " + path);
    }
    Optional<String> contentLength = response.headers().firstValue("Content-Length");
    if (contentLength.isPresent()) {
      return Long.parseLong(contentLength.get().trim());
    }
    // No length on HEAD; ask for one byte and read the total from Content-Range.
    HttpRequest firstByte = request(path).header("Range", "bytes=0-0").GET().build();
    HttpResponse<byte[]> ranged = send(firstByte, HttpResponse.BodyHandlers.ofByteArray());
    Optional<String> contentRange = ranged.headers().firstValue("Content-Range");
    if (ranged.statusCode() == 206 && contentRange.isPresent()) {
      String value = contentRange.get();
      return Long.parseLong(value.substring(value.lastIndexOf('/') + 1).trim());
    }
    if (ranged.statusCode() == 200) {
      return ranged.body().length;
    }
    throw new IOException("Cannot determine length of " + path);
  }

  @Override public boolean exists(String path) throws IOException {
    HttpRequest head = request(path)
        .method("HEAD", HttpRequest.BodyPublishers.noBody())
        .build();
    int status = send(head, HttpResponse.BodyHandlers.discarding()).statusCode();
    return status >= 200 && status < 300;
  }

  @Override public String getStorageType() {
    return "http";
  }

  private HttpRequest.Builder request(String url) {
    return HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(requestTimeout)
        .header("User-Agent", USER_AGENT);
  }

  private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
      throws IOException {
    try {
      return httpClient.send(request, handler);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted =
          new InterruptedIOException("Interrupted fetching " + request.uri());
      interrupted.initCause(e);
      throw interrupted;
    }
  }
}
