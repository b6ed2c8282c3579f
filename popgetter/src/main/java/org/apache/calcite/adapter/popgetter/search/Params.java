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
package org.apache.calcite.adapter.popgetter.search;

import java.util.Objects;

/** A search together with the options of the download that follows it. */
public final class Params {
  private final SearchParams search;
  private final DownloadParams download;

  public Params(SearchParams search, DownloadParams download) {
    this.search = Objects.requireNonNull(search, "search");
    this.download = Objects.requireNonNull(download, "download");
  }

  public SearchParams search() {
    return search;
  }

  public DownloadParams download() {
    return download;
  }

  @Override public boolean equals(Object o) {
    return o instanceof Params
        && search.equals(((Params) o).search)
        && download.equals(((Params) o).download);
  }

  @Override public int hashCode() {
    return Objects.hash(search, download);
  }

  @Override public String toString() {
    return "Params{search=" + search + ", download=" + download + "}";
  }
}
