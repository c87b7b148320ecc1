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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A Shape is a polygon described by its set of undirected edges, optionally with the positions of
 * its nodes. A Shape that has no coordinates is "abstract": it can be compared and merged, but not
 * measured or drawn.
 *
 * <p>The identity of a Shape is its edge set alone. Two Shapes with the same edges are equal no
 * matter what order the edges were given in, which node a traversal starts from, or which
 * coordinate map they refer to. This makes Shapes suitable as set elements for deduplicating rings
 * found from different starting edges.
 *
 * <p>The coordinate map is shared by reference, not copied, and must not be modified while any
 * Shape refers to it. Shapes are immutable; {@link #merge} returns a new Shape.
 *
 * <p>Most geometric operations require that the shape is a simple ring, i.e. that every node has
 * exactly two incident edges and the edges form a single cycle. See {@link #isSimpleRing()}.
 */
public final class Shape {
  private final ImmutableSortedSet<UndirectedEdge> edges;
  private final IntSortedSet nodes;
  private final @Nullable Int2ObjectMap<R2Vector> coords;

  /** Constructs an abstract shape from the given edges. */
  public Shape(Iterable<UndirectedEdge> edges) {
    this(edges, null);
  }

  /**
   * Constructs a shape from the given edges, which may contain duplicates, and an optional map from
   * node ids to coordinates. If coordinates are given, they are used for area and winding order.
   *
   * @throws RingException with code MALFORMED_EDGE if an edge is null.
   */
  public Shape(Iterable<UndirectedEdge> edges, @Nullable Int2ObjectMap<R2Vector> coords) {
    ImmutableSortedSet.Builder<UndirectedEdge> builder = ImmutableSortedSet.naturalOrder();
    IntAVLTreeSet nodeSet = new IntAVLTreeSet();
    for (UndirectedEdge edge : edges) {
      if (edge == null) {
        throw new RingException(RingError.Code.MALFORMED_EDGE, "Shape edges may not be null");
      }
      builder.add(edge);
      nodeSet.add(edge.lo());
      nodeSet.add(edge.hi());
    }
    this.edges = builder.build();
    this.nodes = IntSortedSets.unmodifiable(nodeSet);
    this.coords = coords;
  }

  /**
   * Returns a ring shape whose edges connect consecutive nodes of the given list, including the
   * last node back to the first.
   */
  public static Shape fromNodeList(int[] nodeList, @Nullable Int2ObjectMap<R2Vector> coords) {
    return new Shape(nodeListToEdges(nodeList, true), coords);
  }

  /**
   * Converts a list of connected nodes, where {@code nodeList[i]} is connected to {@code
   * nodeList[i - 1]} and {@code nodeList[i + 1]}, into the corresponding set of edges. This is the
   * inverse of {@link #toNodeList()}.
   *
   * @param isRing if true, the last node is also connected to the first node.
   */
  public static ImmutableSortedSet<UndirectedEdge> nodeListToEdges(int[] nodeList, boolean isRing) {
    ImmutableSortedSet.Builder<UndirectedEdge> result = ImmutableSortedSet.naturalOrder();
    int n = nodeList.length;
    int last = isRing ? n : n - 1;
    for (int i = 0; i < last; i++) {
      result.add(UndirectedEdge.of(nodeList[i], nodeList[(i + 1) % n]));
    }
    return result.build();
  }

  /**
   * Returns the signed area of the polygon visiting the given nodes in order, using the shoelace
   * formula. The area is positive if the nodes are ordered counter-clockwise, and negative if they
   * are ordered clockwise.
   *
   * @throws RingException with code MISSING_COORDINATE if a node has no coordinate.
   */
  public static double calculatePolygonArea(int[] nodeList, Int2ObjectMap<R2Vector> coords) {
    double signedArea = 0;
    for (int i = 0; i < nodeList.length; i++) {
      R2Vector a = coordinate(coords, nodeList[i]);
      R2Vector b = coordinate(coords, nodeList[(i + 1) % nodeList.length]);
      signedArea += a.crossProd(b);
    }
    return 0.5 * signedArea;
  }

  private static R2Vector coordinate(Int2ObjectMap<R2Vector> coords, int node) {
    R2Vector p = coords.get(node);
    if (p == null) {
      throw new RingException(RingError.Code.MISSING_COORDINATE, "Node %d has no coordinate", node);
    }
    return p;
  }

  /** Returns the edges of this shape, in ascending order. */
  public ImmutableSortedSet<UndirectedEdge> edges() {
    return edges;
  }

  /** Returns the ids of all the nodes touched by this shape's edges, in ascending order. */
  public IntSortedSet nodes() {
    return nodes;
  }

  /** Returns the coordinate map this shape refers to, or null if the shape is abstract. */
  public @Nullable Int2ObjectMap<R2Vector> coordinates() {
    return coords;
  }

  /** Returns true if this shape has coordinates. */
  public boolean hasCoordinates() {
    return coords != null;
  }

  /** Returns an abstract shape with the same edges as this one. */
  public Shape withoutCoordinates() {
    return coords == null ? this : new Shape(edges, null);
  }

  /** Returns the number of edges, which for a ring is also its number of nodes. */
  public int size() {
    return edges.size();
  }

  /** Returns true if this shape has no edges. */
  public boolean isEmpty() {
    return edges.isEmpty();
  }

  /** Returns true if the given edge is part of this shape. */
  public boolean contains(UndirectedEdge edge) {
    return edges.contains(edge);
  }

  /** Returns true if the edge between {@code u} and {@code v} is part of this shape. */
  public boolean contains(int u, int v) {
    return u != v && edges.contains(UndirectedEdge.of(u, v));
  }

  /**
   * Merges two shapes together by removing their common edges, i.e. returns the shape whose edges
   * are the symmetric difference of the two edge sets. For example two squares that share an edge
   * merge into a hexagon. The result refers to this shape's coordinates, or to the other shape's if
   * this one is abstract.
   *
   * <p>Two shapes that disagree about where a node is cannot be merged. If both shapes have
   * coordinates, every node they share must have exactly equal coordinates in both maps.
   *
   * @throws RingException with code INCONSISTENT_COORDINATES if a shared node is at different
   *     positions in the two shapes.
   */
  public Shape merge(Shape other) {
    if (coords != null && other.coords != null && coords != other.coords) {
      IntSortedSet smaller = nodes.size() <= other.nodes.size() ? nodes : other.nodes;
      IntSortedSet larger = smaller == nodes ? other.nodes : nodes;
      for (int node : smaller) {
        if (!larger.contains(node)) {
          continue;
        }
        R2Vector mine = coords.get(node);
        R2Vector theirs = other.coords.get(node);
        if (mine == null || !mine.equals(theirs)) {
          throw new RingException(
              RingError.Code.INCONSISTENT_COORDINATES,
              "These two shapes believe that node %d is in two different places: %s and %s",
              node,
              mine,
              theirs);
        }
      }
    }
    return new Shape(
        Sets.symmetricDifference(edges, other.edges), coords != null ? coords : other.coords);
  }

  /**
   * Returns true if every node of this shape has exactly two incident edges, and the edges form a
   * single cycle. The empty shape is not a simple ring.
   */
  public boolean isSimpleRing() {
    if (edges.isEmpty()) {
      return false;
    }
    Int2ObjectMap<IntArrayList> adjacency = adjacency();
    for (IntArrayList neighbors : adjacency.values()) {
      if (neighbors.size() != 2) {
        return false;
      }
    }
    // Walk the cycle from the smallest node; a single cycle visits every node.
    int start = nodes.firstInt();
    int previous = start;
    int current = adjacency.get(start).getInt(0);
    int visited = 1;
    while (current != start) {
      IntArrayList neighbors = adjacency.get(current);
      int next = neighbors.getInt(0) == previous ? neighbors.getInt(1) : neighbors.getInt(0);
      previous = current;
      current = next;
      visited++;
    }
    return visited == nodes.size();
  }

  private Int2ObjectMap<IntArrayList> adjacency() {
    Int2ObjectMap<IntArrayList> adjacency = new Int2ObjectOpenHashMap<>(nodes.size());
    for (UndirectedEdge edge : edges) {
      addNeighbor(adjacency, edge.lo(), edge.hi());
      addNeighbor(adjacency, edge.hi(), edge.lo());
    }
    return adjacency;
  }

  private static void addNeighbor(Int2ObjectMap<IntArrayList> adjacency, int u, int v) {
    IntArrayList neighbors = adjacency.get(u);
    if (neighbors == null) {
      neighbors = new IntArrayList(2);
      adjacency.put(u, neighbors);
    }
    neighbors.add(v);
  }

  /**
   * Turns the set of edges into a list of nodes in the order they are connected, e.g. the triangle
   * {0-1, 1-2, 0-2} becomes [0, 1, 2]. The smallest node id is always first. Without coordinates,
   * each step moves to the smallest unvisited neighbor. With coordinates, the winding is made
   * counter-clockwise, so that {@link #calculatePolygonArea} of the result is non-negative.
   *
   * <p>The ordering is for display and geometry only; it plays no part in equality.
   *
   * @throws RingException with code NOT_SIMPLE_RING if this shape is not a simple ring, and with
   *     code MISSING_COORDINATE if a node has no coordinate in the map.
   */
  public int[] toNodeList() {
    if (edges.isEmpty()) {
      return new int[0];
    }
    if (!isSimpleRing()) {
      throw new RingException(
          RingError.Code.NOT_SIMPLE_RING, "Edges %s do not form a single simple ring", edges);
    }
    Int2ObjectMap<IntArrayList> adjacency = adjacency();
    int[] nodeList = new int[edges.size()];
    IntSet seen = new IntOpenHashSet(nodeList.length);
    nodeList[0] = nodes.firstInt();
    seen.add(nodeList[0]);
    for (int i = 1; i < nodeList.length; i++) {
      int next = Integer.MAX_VALUE;
      boolean found = false;
      for (int neighbor : adjacency.get(nodeList[i - 1])) {
        if (!seen.contains(neighbor) && (!found || neighbor < next)) {
          next = neighbor;
          found = true;
        }
      }
      nodeList[i] = next;
      seen.add(next);
    }

    if (coords != null && calculatePolygonArea(nodeList, coords) < 0) {
      // Reverse the list, then rotate so the smallest node is at the front again.
      int[] reversed = new int[nodeList.length];
      reversed[0] = nodeList[0];
      for (int i = 1; i < nodeList.length; i++) {
        reversed[i] = nodeList[nodeList.length - i];
      }
      nodeList = reversed;
    }
    return nodeList;
  }

  /**
   * Returns the signed area of this ring over the node list from {@link #toNodeList()}. As that
   * list has counter-clockwise winding, the result is non-negative.
   *
   * @throws RingException with code MISSING_COORDINATES if this shape is abstract.
   */
  public double getSignedArea() {
    return calculatePolygonArea(toNodeList(), requireCoordinates("compute an area"));
  }

  /**
   * Returns the area enclosed by this ring.
   *
   * @throws RingException with code MISSING_COORDINATES if this shape is abstract.
   */
  public double getArea() {
    return Math.abs(getSignedArea());
  }

  /**
   * Returns the coordinates of this ring's nodes in the order of {@link #toNodeList()}, with the
   * first coordinate repeated at the end to close the polygon. This is the hand-off to renderers.
   *
   * @throws RingException with code MISSING_COORDINATES if this shape is abstract.
   */
  public ImmutableList<R2Vector> toPolygon() {
    Int2ObjectMap<R2Vector> polygonCoords = requireCoordinates("construct a polygon");
    int[] nodeList = toNodeList();
    ImmutableList.Builder<R2Vector> polygon =
        ImmutableList.builderWithExpectedSize(nodeList.length + 1);
    for (int node : nodeList) {
      polygon.add(coordinate(polygonCoords, node));
    }
    if (nodeList.length > 0) {
      polygon.add(coordinate(polygonCoords, nodeList[0]));
    }
    return polygon.build();
  }

  private Int2ObjectMap<R2Vector> requireCoordinates(String operation) {
    if (coords == null) {
      throw new RingException(
          RingError.Code.MISSING_COORDINATES,
          "Shape %s has no coordinates, so we cannot %s",
          edges,
          operation);
    }
    return coords;
  }

  /** Returns true if the given object is a Shape with exactly the same edges. */
  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Shape)) {
      return false;
    }
    return edges.equals(((Shape) other).edges);
  }

  @Override
  public int hashCode() {
    return edges.hashCode();
  }

  /** Returns the node list of a simple ring, e.g. "[0, 1, 2]", or the edge list otherwise. */
  @Override
  public String toString() {
    if (isSimpleRing()) {
      return Arrays.toString(toNodeList());
    }
    return edges.toString();
  }
}
