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
package org.apache.calcite.adapter.popgetter.geo;

import org.apache.calcite.adapter.popgetter.search.BBox;
import org.apache.calcite.adapter.popgetter.storage.BufferedRangeReader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Searches the static packed Hilbert R-tree of a FlatGeobuf file by reading
 * only the nodes a query visits, through ranged reads.
 *
 * <p>Nodes are 40 bytes: {@code minX, minY, maxX, maxY} as little-endian
 * doubles followed by a {@code uint64} offset. Levels are stored root first;
 * an interior node's offset is the index of its first child, and a leaf's
 * offset is its feature's byte offset from the start of the feature section.
 */
public final class PackedRTreeSearch {
  public static final int NODE_ITEM_BYTES = 40;

  private PackedRTreeSearch() {
  }

  /**
   * Returns {@code [start, end)} node indexes of every level, leaves first.
   */
  public static List<long[]> levelBounds(long numItems, int nodeSize) {
    if (nodeSize < 2) {
      throw new IllegalArgumentException("Node size must be at least 2");
    }
    if (numItems == 0) {
      throw new IllegalArgumentException("Number of items must be greater than 0");
    }
    long n = numItems;
    long numNodes = n;
    List<Long> levelNumNodes = new ArrayList<>();
    levelNumNodes.add(n);
    do {
      n = (n + nodeSize - 1) / nodeSize;
      numNodes += n;
      levelNumNodes.add(n);
    } while (n != 1);

    List<long[]> bounds = new ArrayList<>(levelNumNodes.size());
    long remaining = numNodes;
    for (long size : levelNumNodes) {
      long offset = remaining - size;
      bounds.add(new long[] {offset, offset + size});
      remaining -= size;
    }
    return bounds;
  }

  /**
   * Finds the features whose bounds intersect {@code bbox}.
   *
   * @param reader reader over the file holding the tree
   * @param treeOffset byte position of the tree in the file
   * @return feature byte offsets, relative to the feature section, ascending
   */
  public static List<Long> search(BufferedRangeReader reader, long treeOffset, long numItems,
      int nodeSize, BBox bbox) throws IOException {
    List<long[]> bounds = levelBounds(numItems, nodeSize);
    long numNodes = bounds.get(0)[1];
    long leafStart = numNodes - numItems;

    List<Long> hits = new ArrayList<>();
    Deque<long[]> queue = new ArrayDeque<>();
    queue.add(new long[] {0, bounds.size() - 1});
    while (!queue.isEmpty()) {
      long[] next = queue.poll();
      long nodeIndex = next[0];
      int level = (int) next[1];
      boolean leaf = nodeIndex >= leafStart;
      long end = Math.min(nodeIndex + nodeSize, bounds.get(level)[1]);
      int count = (int) (end - nodeIndex);
      ByteBuffer nodes = reader.readBuffer(treeOffset + nodeIndex * NODE_ITEM_BYTES,
          count * NODE_ITEM_BYTES);
      for (int i = 0; i < count; i++) {
        int base = i * NODE_ITEM_BYTES;
        double minX = nodes.getDouble(base);
        double minY = nodes.getDouble(base + 8);
        double maxX = nodes.getDouble(base + 16);
        double maxY = nodes.getDouble(base + 24);
        long offset = nodes.getLong(base + 32);
        if (!bbox.intersects(minX, minY, maxX, maxY)) {
          continue;
        }
        if (leaf) {
          hits.add(offset);
        } else {
          queue.add(new long[] {offset, level - 1});
        }
      }
    }
    Collections.sort(hits);
    return hits;
  }
}
