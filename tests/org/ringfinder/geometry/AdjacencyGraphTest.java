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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AdjacencyGraphTest extends GeometryTestCase {
  @Test
  public void testAddEdge() {
    AdjacencyGraph graph = new AdjacencyGraph();
    assertTrue(graph.addEdge(2, 1));
    assertFalse(graph.addEdge(1, 2));
    assertTrue(graph.addEdge(1, 3));
    assertEquals(3, graph.numNodes());
    assertEquals(2, graph.numEdges());
    assertTrue(graph.containsEdge(2, 1));
    assertTrue(graph.containsEdge(1, 2));
    assertFalse(graph.containsEdge(2, 3));
    assertEquals(2, graph.degree(1));
    assertEquals(0, graph.degree(99));
    assertEquals(IntArrayList.wrap(new int[] {2, 3}), new IntArrayList(graph.neighbors(1)));
  }

  @Test
  public void testSelfLoopRejected() {
    AdjacencyGraph graph = new AdjacencyGraph();
    RingException e = assertThrows(RingException.class, () -> graph.addEdge(5, 5));
    assertEquals(RingError.Code.MALFORMED_EDGE, e.code());
    assertEquals(0, graph.numNodes());
  }

  @Test
  public void testIsolatedNodes() {
    AdjacencyGraph graph = new AdjacencyGraph();
    assertTrue(graph.addNode(4));
    assertFalse(graph.addNode(4));
    assertTrue(graph.containsNode(4));
    assertTrue(graph.neighbors(4).isEmpty());
    assertTrue(graph.neighbors(5).isEmpty());
    assertEquals(0, graph.numEdges());
  }

  @Test
  public void testRemove() {
    AdjacencyGraph graph = twoSquaresGraph();
    assertEquals(7, graph.numEdges());
    assertTrue(graph.removeEdge(3, 2));
    assertFalse(graph.removeEdge(3, 2));
    assertEquals(6, graph.numEdges());
    assertTrue(graph.removeNode(0));
    assertFalse(graph.removeNode(0));
    assertEquals(4, graph.numEdges());
    assertFalse(graph.neighbors(1).contains(0));
  }

  @Test
  public void testEdgesAreSorted() {
    AdjacencyGraph graph = graph(5, 4, 0, 3, 2, 0, 1, 0);
    assertEquals(
        ImmutableList.of(
            UndirectedEdge.of(0, 1),
            UndirectedEdge.of(0, 2),
            UndirectedEdge.of(0, 3),
            UndirectedEdge.of(4, 5)),
        graph.edges());
  }

  @Test
  public void testCopyOf() {
    AdjacencyGraph graph = twoSquaresGraph();
    graph.addNode(10);
    AdjacencyGraph copy = AdjacencyGraph.copyOf(graph);
    assertEquals(graph.edges(), copy.edges());
    assertTrue(copy.containsNode(10));
    copy.removeNode(2);
    assertTrue(graph.containsNode(2));
  }

  @Test
  public void testFromEdges() {
    AdjacencyGraph graph = AdjacencyGraph.fromEdges(ringEdges(0, 1, 2));
    assertEquals(3, graph.numEdges());
    assertEquals(ringEdges(0, 1, 2), graph.edges());
  }

  @Test
  public void testViewsAreUnmodifiable() {
    AdjacencyGraph graph = twoSquaresGraph();
    assertThrows(UnsupportedOperationException.class, () -> graph.nodes().add(100));
    assertThrows(UnsupportedOperationException.class, () -> graph.neighbors(0).add(100));
  }
}
