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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.ringfinder.geometry.primitives.DisjointSet;

/**
 * Finds the rings of a planar graph embedded in the plane: the minimal polygons that enclose no
 * edges, such as the rings of an amorphous two-dimensional network.
 *
 * <p>All the work is done by the constructor, and the results never change afterwards:
 *
 * <ul>
 *   <li>{@link #currentRings()} holds each bounded face of the embedding as a Shape. These are
 *       the faces that {@link AngularFaceTracer} traces with positive signed area.
 *   <li>{@link #perimeterRings()} holds the outer boundary loops. Rings that share edges are
 *       grouped together, and each group is merged by cancelling every shared edge, which leaves
 *       just the boundary of the group. Two squares sharing an edge have one hexagonal perimeter.
 * </ul>
 *
 * <p>Nodes without a neighbor, dangling chains and components without a cycle contribute no rings
 * and are not an error. A node with an edge but without a coordinate is an error, and construction
 * throws a {@link RingException} rather than returning partial results.
 *
 * <p>Example:
 *
 * <pre>{@code
 * AdjacencyGraph graph = new AdjacencyGraph();
 * graph.addEdge(0, 1);
 * ...
 * RingFinder finder = new RingFinder(graph, coords);
 * for (Shape ring : finder.currentRings()) {
 *   System.out.println(ring.size() + " " + ring.getArea());
 * }
 * }</pre>
 */
public class RingFinder {
  private static final Logger log = Platform.getLoggerForClass(RingFinder.class);

  private final Int2ObjectMap<R2Vector> coords;
  private final ImmutableSet<Shape> currentRings;
  private final ImmutableSet<Shape> perimeterRings;

  /**
   * Finds the rings of the given graph, with nodes at the given coordinates.
   *
   * @throws RingException with code MISSING_COORDINATE if a node with an edge has no coordinate.
   */
  public RingFinder(UndirectedGraph graph, Int2ObjectMap<R2Vector> coords) {
    this(
        coords,
        findInteriorRings(new AngularFaceTracer(graph, Preconditions.checkNotNull(coords))));
  }

  private RingFinder(Int2ObjectMap<R2Vector> coords, ImmutableSet<Shape> currentRings) {
    this(coords, currentRings, mergePerimeters(currentRings));
  }

  /** Constructor for subclasses that find their rings in some other way. */
  protected RingFinder(
      Int2ObjectMap<R2Vector> coords,
      ImmutableSet<Shape> currentRings,
      ImmutableSet<Shape> perimeterRings) {
    this.coords = coords;
    this.currentRings = currentRings;
    this.perimeterRings = perimeterRings;
  }

  /**
   * Returns the outer boundary of every face traced with positive signed area, as a Shape. A face
   * that encloses other edges, such as a ring with a smaller ring inside joined to it by a bridge,
   * is reported as its outer boundary alone, so every result is a simple ring.
   */
  static ImmutableSet<Shape> findInteriorRings(AngularFaceTracer tracer) {
    ImmutableSet.Builder<Shape> rings = ImmutableSet.builder();
    int outerFaces = 0;
    for (int[] face : tracer.faces()) {
      if (tracer.signedArea(face) > 0) {
        int[] boundary = tracer.outerBoundary(face);
        if (boundary.length < face.length) {
          log.warning(
              "Face of "
                  + face.length
                  + " half-edges encloses other edges; keeping its outer boundary of "
                  + boundary.length
                  + " nodes");
        }
        rings.add(tracer.toShape(boundary));
      } else {
        outerFaces++;
      }
    }
    ImmutableSet<Shape> result = rings.build();
    log.fine("Found " + result.size() + " rings and " + outerFaces + " outer faces");
    return result;
  }

  /**
   * Returns the boundary loops of the given rings. Rings are grouped into components connected by
   * shared edges, and each component is merged with {@link Shape#merge}, which cancels every edge
   * shared by two rings. Each connected loop of edges that survives is one perimeter ring, so a
   * component with a hole yields its outer loop and a loop around the hole. A set of rings in which
   * every edge is shared, as in a fully periodic network, has no perimeter at all.
   *
   * @throws RingException with code INCONSISTENT_COORDINATES if two rings that share an edge place
   *     a node at different coordinates.
   */
  public static ImmutableSet<Shape> mergePerimeters(Collection<Shape> rings) {
    DisjointSet<Shape> components = new DisjointSet<>();
    Map<UndirectedEdge, Shape> edgeOwners = new HashMap<>();
    for (Shape ring : rings) {
      components.add(ring);
      for (UndirectedEdge edge : ring.edges()) {
        Shape owner = edgeOwners.putIfAbsent(edge, ring);
        if (owner != null) {
          components.union(owner, ring);
        }
      }
    }

    ImmutableSet.Builder<Shape> perimeters = ImmutableSet.builder();
    for (ImmutableList<Shape> component : components.subsets()) {
      Shape merged = component.get(0);
      for (int i = 1; i < component.size(); i++) {
        merged = merged.merge(component.get(i));
      }
      perimeters.addAll(splitLoops(merged));
    }
    return perimeters.build();
  }

  /** Splits the edges of the given shape into its connected pieces. */
  private static ImmutableList<Shape> splitLoops(Shape shape) {
    DisjointSet<Integer> nodes = new DisjointSet<>();
    for (int node : shape.nodes()) {
      nodes.add(node);
    }
    for (UndirectedEdge edge : shape.edges()) {
      nodes.union(edge.lo(), edge.hi());
    }
    ListMultimap<Integer, UndirectedEdge> loops =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (UndirectedEdge edge : shape.edges()) {
      loops.put(nodes.findRoot(edge.lo()), edge);
    }
    ImmutableList.Builder<Shape> result = ImmutableList.builder();
    for (Collection<UndirectedEdge> loop : loops.asMap().values()) {
      result.add(new Shape(loop, shape.coordinates()));
    }
    return result.build();
  }

  /** Returns the coordinate map the rings were found with. */
  public Int2ObjectMap<R2Vector> coordinates() {
    return coords;
  }

  /** Returns the minimal interior rings. No two are equal. */
  public ImmutableSet<Shape> currentRings() {
    return currentRings;
  }

  /** Returns the outer boundary loops. Empty for a network with no outer boundary. */
  public ImmutableSet<Shape> perimeterRings() {
    return perimeterRings;
  }

  /** Returns the number of current rings of each size. */
  public ImmutableMultiset<Integer> ringSizes() {
    ImmutableMultiset.Builder<Integer> sizes = ImmutableMultiset.builder();
    for (Shape ring : currentRings) {
      sizes.add(ring.size());
    }
    return sizes.build();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{rings="
        + currentRings.size()
        + ", sizes="
        + ringSizes()
        + ", perimeters="
        + perimeterRings.size()
        + "}";
  }
}
