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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * RingTextFormat contains functions for reading and writing networks and rings in the plain text
 * formats used for test fixtures. Each format has one record per line. Fields are separated by
 * whitespace or commas, blank lines are skipped, and everything after a '#' is a comment.
 *
 * <pre> Formats:
 *     edges:        "u v" or "u, v"
 *     coordinates:  "x y", where the node id is the index of the line among data lines,
 *                   or "id x y" / "id, x, y"
 *     rings:        "n0 n1 n2 ...", the nodes of one ring in order
 * </pre>
 *
 * <p>The xxxOrDie methods throw IllegalArgumentException on malformed input, and the other methods
 * return null instead.
 */
public final class RingTextFormat {
  private static final Splitter FIELD_SPLITTER =
      Splitter.on(CharMatcher.anyOf(", \t")).omitEmptyStrings().trimResults();

  private RingTextFormat() {}

  /**
   * Parses one edge per line.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static List<UndirectedEdge> parseEdgesOrDie(Iterable<String> lines) {
    List<UndirectedEdge> edges = parseEdges(lines);
    Preconditions.checkArgument(edges != null, "Malformed edge list");
    return edges;
  }

  /**
   * As {@link #parseEdgesOrDie(Iterable)} above, but returns null if any line is not a pair of
   * distinct integers.
   */
  public static @Nullable List<UndirectedEdge> parseEdges(Iterable<String> lines) {
    List<UndirectedEdge> edges = new ArrayList<>();
    for (List<String> fields : records(lines)) {
      if (fields.size() != 2) {
        return null;
      }
      Integer u = Ints.tryParse(fields.get(0));
      Integer v = Ints.tryParse(fields.get(1));
      if (u == null || v == null || u.equals(v)) {
        return null;
      }
      edges.add(UndirectedEdge.of(u, v));
    }
    return edges;
  }

  /**
   * Parses one node coordinate per line.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static Int2ObjectMap<R2Vector> parseCoordinatesOrDie(Iterable<String> lines) {
    Int2ObjectMap<R2Vector> coords = parseCoordinates(lines);
    Preconditions.checkArgument(coords != null, "Malformed coordinate list");
    return coords;
  }

  /**
   * As {@link #parseCoordinatesOrDie(Iterable)} above, but returns null on invalid input, including
   * a node id given twice.
   */
  public static @Nullable Int2ObjectMap<R2Vector> parseCoordinates(Iterable<String> lines) {
    Int2ObjectMap<R2Vector> coords = new Int2ObjectOpenHashMap<>();
    int index = 0;
    for (List<String> fields : records(lines)) {
      Integer id;
      int first;
      if (fields.size() == 2) {
        id = index;
        first = 0;
      } else if (fields.size() == 3) {
        id = Ints.tryParse(fields.get(0));
        first = 1;
      } else {
        return null;
      }
      Double x = Doubles.tryParse(fields.get(first));
      Double y = Doubles.tryParse(fields.get(first + 1));
      if (id == null || x == null || y == null || coords.containsKey(id.intValue())) {
        return null;
      }
      coords.put(id.intValue(), new R2Vector(x, y));
      index++;
    }
    return coords;
  }

  /**
   * Parses one ring per line, as the list of its nodes in order.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static List<int[]> parseRingsOrDie(Iterable<String> lines) {
    List<int[]> rings = parseRings(lines);
    Preconditions.checkArgument(rings != null, "Malformed ring list");
    return rings;
  }

  /** As {@link #parseRingsOrDie(Iterable)} above, but returns null on invalid input. */
  public static @Nullable List<int[]> parseRings(Iterable<String> lines) {
    List<int[]> rings = new ArrayList<>();
    for (List<String> fields : records(lines)) {
      int[] ring = new int[fields.size()];
      for (int i = 0; i < ring.length; i++) {
        Integer node = Ints.tryParse(fields.get(i));
        if (node == null) {
          return null;
        }
        ring[i] = node;
      }
      rings.add(ring);
    }
    return rings;
  }

  /**
   * Returns the number of rings of each size in a ring list.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static ImmutableMultiset<Integer> parseRingSizes(Iterable<String> lines) {
    ImmutableMultiset.Builder<Integer> sizes = ImmutableMultiset.builder();
    for (int[] ring : parseRingsOrDie(lines)) {
      sizes.add(ring.length);
    }
    return sizes.build();
  }

  /** Returns a graph with the given edges. */
  public static AdjacencyGraph makeGraph(Iterable<UndirectedEdge> edges) {
    return AdjacencyGraph.fromEdges(edges);
  }

  /** Parses an edge list and returns the graph. */
  public static AdjacencyGraph makeGraphOrDie(Iterable<String> lines) {
    return makeGraph(parseEdgesOrDie(lines));
  }

  /**
   * Returns the shape as one line in the ring format: the node list if it is a simple ring, or else
   * the space-separated nodes of each edge.
   */
  public static String toString(Shape shape) {
    StringBuilder out = new StringBuilder();
    if (shape.isSimpleRing()) {
      for (int node : shape.toNodeList()) {
        appendField(out, node);
      }
    } else {
      for (UndirectedEdge edge : shape.edges()) {
        appendField(out, edge.lo());
        appendField(out, edge.hi());
      }
    }
    return out.toString();
  }

  /** Returns the shapes in the ring format, one per line, in iteration order. */
  public static String toString(Collection<Shape> shapes) {
    StringBuilder out = new StringBuilder();
    for (Shape shape : shapes) {
      out.append(toString(shape)).append('\n');
    }
    return out.toString();
  }

  private static void appendField(StringBuilder out, int value) {
    if (out.length() > 0) {
      out.append(' ');
    }
    out.append(value);
  }

  /** Returns the fields of each non-empty line, with comments removed. */
  private static ImmutableList<List<String>> records(Iterable<String> lines) {
    ImmutableList.Builder<List<String>> result = ImmutableList.builder();
    for (String line : lines) {
      int comment = line.indexOf('#');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      List<String> fields = FIELD_SPLITTER.splitToList(line);
      if (!fields.isEmpty()) {
        result.add(fields);
      }
    }
    return result.build();
  }
}
