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

import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * The view of an undirected graph that ring finding needs: its nodes, and the neighbors of each
 * node. Nodes are int ids. Edges are implied by adjacency and must be symmetric, i.e. {@code v} is
 * a neighbor of {@code u} exactly when {@code u} is a neighbor of {@code v}.
 *
 * <p>Ring finders only read from the graph; they never modify it.
 */
public interface UndirectedGraph {
  /** Returns the ids of all nodes in the graph. */
  IntCollection nodes();

  /** Returns the ids of the nodes adjacent to {@code node}, or an empty collection if none. */
  IntCollection neighbors(int node);
}
