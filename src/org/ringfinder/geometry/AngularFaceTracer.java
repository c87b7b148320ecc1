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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Traces the faces of a planar straight-line graph. Every face boundary is found, both the bounded
 * faces (the rings) and the unbounded outer face of each connected component.
 *
 * <p>Each undirected edge is split into two half-edges, one in each direction. Around each node
 * the outgoing half-edges are sorted counter-clockwise by angle. Arriving at node v along the
 * half-edge u->v, the trace continues along the outgoing half-edge that immediately precedes v->u
 * in counter-clockwise order. That is the tightest possible left turn, so the trace follows the
 * boundary of the face on the left of each half-edge. Bounded faces are therefore traced
 * counter-clockwise (positive signed area) and outer faces clockwise (negative signed area).
 *
 * <p>Every half-edge belongs to exactly one face, so the face lengths sum to twice the number of
 * edges. Nodes of degree one or zero can never be part of a ring, so they are stripped repeatedly
 * before tracing, which removes dangling chains entirely.
 *
 * <p>The trace is computed eagerly in the constructor; the graph and coordinates are not modified.
 */
public final class AngularFaceTracer {
  private static final Logger log = Platform.getLoggerForClass(AngularFaceTracer.class);

  private final Int2ObjectMap<R2Vector> coords;

  /** Source node of each half-edge. Half-edges 2e and 2e+1 are the two directions of edge e. */
  private final int[] src;

  /** Destination node of each half-edge. */
  private final int[] dst;

  private final int numPrunedNodes;
  private final ImmutableList<int[]> faces;

  /**
   * Traces every face of the given graph.
   *
   * @throws RingException with code MISSING_COORDINATE if a node with at least one edge has no
   *     coordinate.
   */
  public AngularFaceTracer(UndirectedGraph graph, Int2ObjectMap<R2Vector> coords) {
    this.coords = coords;
    checkCoordinates(graph, coords);

    AdjacencyGraph pruned = AdjacencyGraph.copyOf(graph);
    numPrunedNodes = pruneDanglingNodes(pruned);

    List<UndirectedEdge> edges = pruned.edges();
    src = new int[2 * edges.size()];
    dst = new int[2 * edges.size()];
    for (int e = 0; e < edges.size(); e++) {
      UndirectedEdge edge = edges.get(e);
      src[2 * e] = edge.lo();
      dst[2 * e] = edge.hi();
      src[2 * e + 1] = edge.hi();
      dst[2 * e + 1] = edge.lo();
    }

    faces = traceFaces(buildLeftTurnMap());
    log.fine(
        "Pruned "
            + numPrunedNodes
            + " nodes, traced "
            + faces.size()
            + " faces from "
            + src.length
            + " half-edges");
  }

  /** Throws if any node that has an edge, or any neighbor, is missing from the coordinate map. */
  static void checkCoordinates(UndirectedGraph graph, Int2ObjectMap<R2Vector> coords) {
    for (int u : graph.nodes()) {
      for (int v : graph.neighbors(u)) {
        if (!coords.containsKey(u)) {
          throw new RingException(
              RingError.Code.MISSING_COORDINATE, "Node %d has an edge but no coordinate", u);
        }
        if (!coords.containsKey(v)) {
          throw new RingException(
              RingError.Code.MISSING_COORDINATE, "Node %d has an edge but no coordinate", v);
        }
      }
    }
  }

  /**
   * Repeatedly removes nodes with fewer than two neighbors from the graph, and returns how many
   * were removed. Removing the tip of a dangling chain exposes the next node of the chain.
   */
  private static int pruneDanglingNodes(AdjacencyGraph graph) {
    IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
    for (int node : graph.nodes()) {
      if (graph.degree(node) < 2) {
        queue.enqueue(node);
      }
    }
    int removed = 0;
    while (!queue.isEmpty()) {
      int node = queue.dequeueInt();
      if (!graph.containsNode(node)) {
        continue;
      }
      int[] neighbors = graph.neighbors(node).toIntArray();
      graph.removeNode(node);
      removed++;
      for (int v : neighbors) {
        if (graph.degree(v) < 2) {
          queue.enqueue(v);
        }
      }
    }
    return removed;
  }

  /**
   * Returns the left turn map: for each incoming half-edge u->v, the outgoing half-edge at v that
   * immediately precedes v->u in counter-clockwise order around v.
   */
  private int[] buildLeftTurnMap() {
    int numHalfEdges = src.length;
    double[] angles = new double[numHalfEdges];
    double[] lengths = new double[numHalfEdges];
    Int2ObjectMap<IntArrayList> outgoing = new Int2ObjectOpenHashMap<>();
    for (int h = 0; h < numHalfEdges; h++) {
      R2Vector d = coords.get(dst[h]).sub(coords.get(src[h]));
      angles[h] = d.angle();
      lengths[h] = d.norm2();
      IntArrayList out = outgoing.get(src[h]);
      if (out == null) {
        out = new IntArrayList();
        outgoing.put(src[h], out);
      }
      out.add(h);
    }

    // Sort the outgoing half-edges counter-clockwise around each node, and remember where each
    // half-edge ended up. Collinear overlapping edges are not planar, but are still ordered
    // deterministically: shorter first, then by destination id.
    int[][] sorted = new int[numHalfEdges][];
    int[] position = new int[numHalfEdges];
    for (IntArrayList out : outgoing.values()) {
      int[] around = out.toIntArray();
      IntArrays.quickSort(
          around,
          (a, b) -> {
            int cmp = Double.compare(angles[a], angles[b]);
            if (cmp == 0) {
              cmp = Double.compare(lengths[a], lengths[b]);
            }
            return cmp != 0 ? cmp : Integer.compare(dst[a], dst[b]);
          });
      for (int i = 0; i < around.length; i++) {
        sorted[around[i]] = around;
        position[around[i]] = i;
      }
    }

    int[] leftTurnMap = new int[numHalfEdges];
    for (int h = 0; h < numHalfEdges; h++) {
      int sibling = h ^ 1;
      int[] around = sorted[sibling];
      int k = around.length;
      leftTurnMap[h] = around[(position[sibling] + k - 1) % k];
    }
    return leftTurnMap;
  }

  /**
   * Follows the left turn map from each unvisited half-edge, in ascending half-edge order, until
   * it returns to its start. The left turn map is a permutation, so every walk closes.
   */
  private ImmutableList<int[]> traceFaces(int[] leftTurnMap) {
    boolean[] used = new boolean[src.length];
    List<int[]> result = new ArrayList<>();
    IntArrayList face = new IntArrayList();
    for (int start = 0; start < src.length; start++) {
      if (used[start]) {
        continue;
      }
      for (int h = start; !used[h]; h = leftTurnMap[h]) {
        used[h] = true;
        face.add(src[h]);
      }
      result.add(face.toIntArray());
      face.clear();
    }
    return ImmutableList.copyOf(result);
  }

  /**
   * Returns every traced face as the cyclic list of nodes visited, in tracing order. A node may
   * appear more than once in a face that touches a bridge or a cut node. The arrays must not be
   * modified.
   */
  public ImmutableList<int[]> faces() {
    return faces;
  }

  /** Returns the number of nodes stripped before tracing because they could not be in a ring. */
  public int numPrunedNodes() {
    return numPrunedNodes;
  }

  /** Returns the number of undirected edges that remained after pruning. */
  public int numEdges() {
    return src.length / 2;
  }

  /** Returns the number of half-edges traced, which is the sum of the lengths of all faces. */
  public int numHalfEdges() {
    return src.length;
  }

  /** Returns the coordinate map used for tracing. */
  public Int2ObjectMap<R2Vector> coordinates() {
    return coords;
  }

  /**
   * Returns the signed area of the given face: positive for a bounded face, negative for the outer
   * face of a component.
   */
  public double signedArea(int[] face) {
    return Shape.calculatePolygonArea(face, coords);
  }

  /**
   * Returns the given face as a Shape with this tracer's coordinates. An edge that the face walks
   * along in both directions, i.e. a bridge reaching into the face, does not bound it and is left
   * out.
   */
  public Shape toShape(int[] face) {
    Multiset<UndirectedEdge> walked = HashMultiset.create(face.length);
    for (int i = 0; i < face.length; i++) {
      walked.add(UndirectedEdge.of(face[i], face[(i + 1) % face.length]));
    }
    List<UndirectedEdge> boundary = new ArrayList<>(face.length);
    for (Multiset.Entry<UndirectedEdge> entry : walked.entrySet()) {
      if (entry.getCount() == 1) {
        boundary.add(entry.getElement());
      }
    }
    return new Shape(boundary, coords);
  }

  /**
   * Returns the outer boundary of a bounded face as a simple cycle of nodes. A face that encloses
   * another component, or whose boundary touches itself at a cut node, is walked as several
   * cycles joined at repeated nodes. The walk is split into those cycles, two-node cycles from
   * bridges are dropped, and the counter-clockwise cycle of largest area is returned. For a face
   * that is already a simple cycle the face itself is returned.
   */
  public int[] outerBoundary(int[] face) {
    List<int[]> cycles = simpleCycles(face);
    if (cycles.size() == 1 && cycles.get(0).length == face.length) {
      return face;
    }
    int[] outer = face;
    double outerArea = Double.NEGATIVE_INFINITY;
    for (int[] cycle : cycles) {
      double area = signedArea(cycle);
      if (area > outerArea) {
        outer = cycle;
        outerArea = area;
      }
    }
    return outer;
  }

  /**
   * Splits a closed walk into simple cycles of at least three nodes. A node seen twice closes the
   * cycle walked since its first visit.
   */
  static List<int[]> simpleCycles(int[] walk) {
    List<int[]> cycles = new ArrayList<>();
    IntArrayList stack = new IntArrayList(walk.length);
    Int2IntOpenHashMap position = new Int2IntOpenHashMap(walk.length);
    position.defaultReturnValue(-1);
    for (int node : walk) {
      int first = position.get(node);
      if (first < 0) {
        position.put(node, stack.size());
        stack.add(node);
        continue;
      }
      addCycle(cycles, stack.subList(first, stack.size()).toIntArray());
      for (int i = stack.size() - 1; i > first; i--) {
        position.remove(stack.removeInt(i));
      }
    }
    addCycle(cycles, stack.toIntArray());
    return cycles;
  }

  private static void addCycle(List<int[]> cycles, int[] cycle) {
    if (cycle.length >= 3) {
      cycles.add(cycle);
    }
  }

  @Override
  public String toString() {
    StringBuilder out = new StringBuilder("AngularFaceTracer{");
    for (int[] face : faces) {
      out.append(Arrays.toString(face));
    }
    return out.append('}').toString();
  }
}
