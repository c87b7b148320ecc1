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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RingTextFormatTest extends GeometryTestCase {
  @Test
  public void testParseEdges() {
    List<UndirectedEdge> edges =
        RingTextFormat.parseEdgesOrDie(
            ImmutableList.of("# A triangle", "0 1", "", "2, 1", "  0\t2  # closing edge"));
    assertEquals(
        ImmutableList.of(UndirectedEdge.of(0, 1), UndirectedEdge.of(1, 2), UndirectedEdge.of(0, 2)),
        edges);
    assertTrue(RingTextFormat.parseEdgesOrDie(ImmutableList.<String>of()).isEmpty());
  }

  @Test
  public void testParseEdgesInvalid() {
    assertNull(RingTextFormat.parseEdges(ImmutableList.of("0 1 2")));
    assertNull(RingTextFormat.parseEdges(ImmutableList.of("0")));
    assertNull(RingTextFormat.parseEdges(ImmutableList.of("0 x")));
    assertNull(RingTextFormat.parseEdges(ImmutableList.of("0 1.5")));
    // Self-loops are not edges.
    assertNull(RingTextFormat.parseEdges(ImmutableList.of("0 1", "3 3")));
    assertThrows(
        IllegalArgumentException.class,
        () -> RingTextFormat.parseEdgesOrDie(ImmutableList.of("0 1", "bad")));
  }

  @Test
  public void testParseCoordinates() {
    Int2ObjectMap<R2Vector> byIndex =
        RingTextFormat.parseCoordinatesOrDie(
            ImmutableList.of("0.5 1", "# skipped", "-2, 3e-1", "", "4 4"));
    assertEquals(3, byIndex.size());
    assertEquals(new R2Vector(0.5, 1), byIndex.get(0));
    assertEquals(new R2Vector(-2, 0.3), byIndex.get(1));
    assertEquals(new R2Vector(4, 4), byIndex.get(2));

    Int2ObjectMap<R2Vector> byId =
        RingTextFormat.parseCoordinatesOrDie(ImmutableList.of("7 1 2", "3, -1, 0"));
    assertEquals(2, byId.size());
    assertEquals(new R2Vector(1, 2), byId.get(7));
    assertEquals(new R2Vector(-1, 0), byId.get(3));
  }

  @Test
  public void testParseCoordinatesInvalid() {
    assertNull(RingTextFormat.parseCoordinates(ImmutableList.of("1")));
    assertNull(RingTextFormat.parseCoordinates(ImmutableList.of("1 2 3 4")));
    assertNull(RingTextFormat.parseCoordinates(ImmutableList.of("1 y")));
    assertNull(RingTextFormat.parseCoordinates(ImmutableList.of("1.5 2 3")));
    // The same node given twice, once by index and once by id.
    assertNull(RingTextFormat.parseCoordinates(ImmutableList.of("0 0", "0 1 1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> RingTextFormat.parseCoordinatesOrDie(ImmutableList.of("4 1 1", "4 2 2")));
  }

  @Test
  public void testParseRings() {
    List<int[]> rings =
        RingTextFormat.parseRingsOrDie(ImmutableList.of("0 1 2 3", "# comment", "5, 6, 7"));
    assertEquals(2, rings.size());
    assertArrayEquals(new int[] {0, 1, 2, 3}, rings.get(0));
    assertArrayEquals(new int[] {5, 6, 7}, rings.get(1));
    assertNull(RingTextFormat.parseRings(ImmutableList.of("0 1 two")));
    assertThrows(
        IllegalArgumentException.class,
        () -> RingTextFormat.parseRingsOrDie(ImmutableList.of("0 1 two")));
  }

  @Test
  public void testParseRingSizes() {
    assertEquals(
        ImmutableMultiset.of(3, 4, 4),
        RingTextFormat.parseRingSizes(ImmutableList.of("0 1 2", "0 1 2 3", "4 5 6 7")));
  }

  @Test
  public void testMakeGraph() {
    AdjacencyGraph graph =
        RingTextFormat.makeGraphOrDie(ImmutableList.of("0 1", "1 2", "2 0", "1 0"));
    assertEquals(3, graph.numNodes());
    assertEquals(3, graph.numEdges());
    assertTrue(graph.containsEdge(2, 0));

    AdjacencyGraph same =
        RingTextFormat.makeGraph(
            ImmutableList.of(UndirectedEdge.of(2, 1), UndirectedEdge.of(0, 2)));
    assertEquals(2, same.numEdges());
    assertEquals(2, same.degree(2));
  }

  @Test
  public void testToString() {
    assertEquals(
        "0 1 2 3", RingTextFormat.toString(Shape.fromNodeList(new int[] {2, 1, 0, 3}, null)));
    // With coordinates the ring is written counter-clockwise.
    assertEquals(
        "0 3 2 1",
        RingTextFormat.toString(Shape.fromNodeList(new int[] {0, 1, 2, 3}, twoSquaresCoords())));
    // Edges that are not a ring are written as endpoint pairs.
    assertEquals(
        "0 1 5 7",
        RingTextFormat.toString(
            new Shape(ImmutableList.of(UndirectedEdge.of(7, 5), UndirectedEdge.of(1, 0)))));

    String text =
        RingTextFormat.toString(
            ImmutableList.of(
                Shape.fromNodeList(new int[] {0, 1, 2}, null),
                Shape.fromNodeList(new int[] {3, 4, 5, 6}, null)));
    assertEquals("0 1 2\n3 4 5 6\n", text);
  }

  @Test
  public void testRingsRoundTripThroughRingFinder() {
    RingFinder finder = new RingFinder(twoSquaresGraph(), twoSquaresCoords());
    List<String> lines =
        ImmutableList.copyOf(RingTextFormat.toString(finder.currentRings()).split("\n"));
    assertEquals(2, lines.size());
    for (int[] ring : RingTextFormat.parseRingsOrDie(lines)) {
      assertTrue(finder.currentRings().contains(Shape.fromNodeList(ring, null)));
    }
    assertEquals(finder.ringSizes(), RingTextFormat.parseRingSizes(lines));
  }
}
