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

import com.google.common.collect.ImmutableSortedSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UndirectedEdgeTest extends GeometryTestCase {
  @Test
  public void testCanonicalOrder() {
    UndirectedEdge edge = UndirectedEdge.of(7, 3);
    assertEquals(3, edge.lo());
    assertEquals(7, edge.hi());
    assertEquals(UndirectedEdge.of(3, 7), edge);
    assertEquals(UndirectedEdge.of(3, 7).hashCode(), edge.hashCode());
    assertEquals("3-7", edge.toString());
  }

  @Test
  public void testSelfLoopIsMalformed() {
    RingException e = assertThrows(RingException.class, () -> UndirectedEdge.of(4, 4));
    assertEquals(RingError.Code.MALFORMED_EDGE, e.code());
  }

  @Test
  public void testEndpoints() {
    UndirectedEdge edge = UndirectedEdge.of(1, 2);
    assertTrue(edge.isEndpoint(1));
    assertTrue(edge.isEndpoint(2));
    assertFalse(edge.isEndpoint(3));
    assertEquals(2, edge.other(1));
    assertEquals(1, edge.other(2));
    assertThrows(IllegalArgumentException.class, () -> edge.other(3));
  }

  @Test
  public void testOrdering() {
    ImmutableSortedSet<UndirectedEdge> edges =
        ImmutableSortedSet.of(
            UndirectedEdge.of(2, 1), UndirectedEdge.of(0, 5), UndirectedEdge.of(1, 0));
    assertEquals("[0-1, 0-5, 1-2]", edges.toString());
  }

  @Test
  public void testNegativeIds() {
    UndirectedEdge edge = UndirectedEdge.of(0, -3);
    assertEquals(-3, edge.lo());
    assertEquals(0, edge.hi());
  }

  @Test
  public void testSerialization() {
    doSerializationTest(UndirectedEdge.of(10, 20));
  }
}
