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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * A simple mutable {@link UndirectedGraph} backed by sorted adjacency sets, so that iteration over
 * nodes and neighbors is always in ascending id order. Self-loops are rejected and repeated edges
 * are ignored, so the graph is always simple.
 */
public final class AdjacencyGraph implements UndirectedGraph {
  private final Int2ObjectSortedMap<IntSortedSet> adjacency = new Int2ObjectAVLTreeMap<>();
  private int numEdges = 0;

  /** Creates an empty graph. */
  public AdjacencyGraph() {}

  /** Returns a graph with the given edges and the nodes they touch. */
  public static AdjacencyGraph fromEdges(Iterable<UndirectedEdge> edges) {
    AdjacencyGraph graph = new AdjacencyGraph();
    for (UndirectedEdge edge : edges) {
      graph.addEdge(edge.lo(), edge.hi());
    }
    return graph;
  }

  /** Returns a copy of the given graph, including any isolated nodes. */
  public static AdjacencyGraph copyOf(UndirectedGraph other) {
    AdjacencyGraph graph = new AdjacencyGraph();
    for (int u : other.nodes()) {
      graph.addNode(u);
      for (int v : other.neighbors(u)) {
        graph.addEdge(u, v);
      }
    }
    return graph;
  }

  /** Adds an isolated node. Returns false if the node was already present. */
  @CanIgnoreReturnValue
  public boolean addNode(int node) {
    if (adjacency.containsKey(node)) {
      return false;
    }
    adjacency.put(node, new IntAVLTreeSet());
    return true;
  }

  /**
   * Adds the edge between {@code u} and {@code v}, adding either node if necessary. Returns false
   * if the edge was already present.
   *
   * @throws RingException with code MALFORMED_EDGE if {@code u == v}.
   */
  @CanIgnoreReturnValue
  public boolean addEdge(int u, int v) {
    if (u == v) {
      throw new RingException(RingError.Code.MALFORMED_EDGE, "Edge %d-%d is a self-loop", u, v);
    }
    addNode(u);
    addNode(v);
    if (!adjacency.get(u).add(v)) {
      return false;
    }
    adjacency.get(v).add(u);
    numEdges++;
    return true;
  }

  /** Removes the edge between {@code u} and {@code v}. Returns false if there was no such edge. */
  @CanIgnoreReturnValue
  public boolean removeEdge(int u, int v) {
    IntSortedSet uNeighbors = adjacency.get(u);
    if (uNeighbors == null || !uNeighbors.remove(v)) {
      return false;
    }
    adjacency.get(v).remove(u);
    numEdges--;
    return true;
  }

  /** Removes the node and all of its edges. Returns false if there was no such node. */
  @CanIgnoreReturnValue
  public boolean removeNode(int node) {
    IntSortedSet neighbors = adjacency.remove(node);
    if (neighbors == null) {
      return false;
    }
    for (int v : neighbors) {
      adjacency.get(v).remove(node);
    }
    numEdges -= neighbors.size();
    return true;
  }

  @Override
  public IntSortedSet nodes() {
    return IntSortedSets.unmodifiable(adjacency.keySet());
  }

  @Override
  public IntSortedSet neighbors(int node) {
    IntSortedSet neighbors = adjacency.get(node);
    return neighbors == null ? IntSortedSets.EMPTY_SET : IntSortedSets.unmodifiable(neighbors);
  }

  /** Returns true if the graph contains the given node. */
  public boolean containsNode(int node) {
    return adjacency.containsKey(node);
  }

  /** Returns true if the graph contains an edge between {@code u} and {@code v}. */
  public boolean containsEdge(int u, int v) {
    IntSortedSet neighbors = adjacency.get(u);
    return neighbors != null && neighbors.contains(v);
  }

  /** Returns the number of neighbors of {@code node}, or 0 if it is not in the graph. */
  public int degree(int node) {
    IntSortedSet neighbors = adjacency.get(node);
    return neighbors == null ? 0 : neighbors.size();
  }

  /** Returns the number of nodes. */
  public int numNodes() {
    return adjacency.size();
  }

  /** Returns the number of undirected edges. */
  public int numEdges() {
    return numEdges;
  }

  /** Returns every edge once, in ascending (lo, hi) order. */
  public ImmutableList<UndirectedEdge> edges() {
    ImmutableList.Builder<UndirectedEdge> result = ImmutableList.builderWithExpectedSize(numEdges);
    for (Int2ObjectMap.Entry<IntSortedSet> entry : adjacency.int2ObjectEntrySet()) {
      int u = entry.getIntKey();
      // There are no self-loops, so every neighbor in the tail set is greater than u.
      for (int v : entry.getValue().tailSet(u)) {
        result.add(UndirectedEdge.of(u, v));
      }
    }
    return result.build();
  }

  @Override
  public String toString() {
    return "AdjacencyGraph{nodes=" + numNodes() + ", edges=" + edges() + "}";
  }
}
