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
package org.ringfinder.geometry.primitives;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DisjointSetTest {
  @Test
  public void testAdd() {
    DisjointSet<String> set = new DisjointSet<>();
    assertTrue(set.add("a"));
    assertFalse(set.add("a"));
    assertEquals(ImmutableList.of(ImmutableList.of("a")), set.subsets());
    assertEquals("a", set.findRoot("a"));
    assertNull(set.findRoot("b"));
  }

  @Test
  public void testUnion() {
    DisjointSet<Integer> set = new DisjointSet<>();
    for (int i = 0; i < 6; i++) {
      set.add(i);
    }
    assertTrue(set.union(0, 1));
    assertTrue(set.union(2, 3));
    assertTrue(set.union(1, 3));
    assertFalse(set.union(0, 99));
    assertEquals(set.findRoot(0), set.findRoot(2));
    assertEquals(set.findRoot(3), set.findRoot(1));
    assertFalse(set.findRoot(0).equals(set.findRoot(4)));
    assertNull(set.findRoot(99));
    assertEquals(3, set.subsets().size());
  }

  @Test
  public void testSubsetsKeepInsertionOrder() {
    DisjointSet<String> set = new DisjointSet<>();
    for (String s : new String[] {"e", "d", "c", "b", "a"}) {
      set.add(s);
    }
    set.union("a", "d");
    set.union("b", "e");
    assertEquals(
        ImmutableList.of(
            ImmutableList.of("e", "b"), ImmutableList.of("d", "a"), ImmutableList.of("c")),
        set.subsets());
  }

  @Test
  public void testLongChainCompresses() {
    DisjointSet<Integer> set = new DisjointSet<>();
    for (int i = 0; i < 10000; i++) {
      set.add(i);
      if (i > 0) {
        set.union(i - 1, i);
      }
    }
    assertEquals(1, set.subsets().size());
    assertEquals(set.findRoot(0), set.findRoot(9999));
  }
}
