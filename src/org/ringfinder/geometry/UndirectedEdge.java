/*
 * Copyright 2026 The Ring Finder Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.ringfinder.geometry;

import com.google.common.base.Preconditions;
import java.io.Serializable;

/**
 * An immutable unordered pair of distinct node ids. The endpoints are stored in canonical order,
 * {@code lo() < hi()}, so that the edge (3, 1) is equal to the edge (1, 3) and both print as "1-3".
 * Edges are ordered lexicographically by (lo, hi).
 */
public final class UndirectedEdge implements Comparable<UndirectedEdge>, Serializable {
  private static final long serialVersionUID = 1L;

  private final int lo;
  private final int hi;

  private UndirectedEdge(int lo, int hi) {
    this.lo = lo;
    this.hi = hi;
  }

  /**
   * Returns the edge between nodes {@code a} and {@code b}, in either order.
   *
   * @throws RingException with code MALFORMED_EDGE if {@code a == b}.
   */
  public static UndirectedEdge of(int a, int b) {
    if (a == b) {
      throw new RingException(RingError.Code.MALFORMED_EDGE, "Edge %d-%d is a self-loop", a, b);
    }
    return a < b ? new UndirectedEdge(a, b) : new UndirectedEdge(b, a);
  }

  /** Returns the smaller node id. */
  public int lo() {
    return lo;
  }

  /** Returns the larger node id. */
  public int hi() {
    return hi;
  }

  /** Returns true if the given node is one of the endpoints. */
  public boolean isEndpoint(int node) {
    return node == lo || node == hi;
  }

  /**
   * Returns the endpoint opposite to {@code node}.
   *
   * @throws IllegalArgumentException if {@code node} is not an endpoint of this edge.
   */
  public int other(int node) {
    Preconditions.checkArgument(isEndpoint(node), "Node %s is not an endpoint of %s", node, this);
    return node == lo ? hi : lo;
  }

  @Override
  public int compareTo(UndirectedEdge that) {
    int cmp = Integer.compare(lo, that.lo);
    return cmp != 0 ? cmp : Integer.compare(hi, that.hi);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof UndirectedEdge)) {
      return false;
    }
    UndirectedEdge that = (UndirectedEdge) o;
    return lo == that.lo && hi == that.hi;
  }

  @Override
  public int hashCode() {
    return 31 * lo + hi;
  }

  @Override
  public String toString() {
    return lo + "-" + hi;
  }
}
