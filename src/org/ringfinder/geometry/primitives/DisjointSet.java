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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A disjoint set (AKA union-find set) stores a partition of a set of elements into disjoint
 * subsets. It is used to collect rings into groups connected by shared edges, and nodes into
 * connected components.
 *
 * <p>This implementation uses both path compression and union-by-size, so both the union() and
 * findRoot() operations have O(a(N)) amortized complexity, where a(n) is the inverse Ackermann
 * function.
 */
public class DisjointSet<T> {
  /** Map from elements to their indices in the elements, parents, and sizes lists. */
  private final Map<T, Integer> elementIndices = new HashMap<>();
  /** The inverse of elementIndices, maps from index back to element. */
  private final ArrayList<T> elements = new ArrayList<>();
  /** Parallel array with elements: the index of the parent of each element. */
  private final IntArrayList parents = new IntArrayList();
  /** Parallel array with elements: the number of elements that have this element as their root. */
  private final IntArrayList sizes = new IntArrayList();

  /** Creates a new, empty disjoint set. */
  public DisjointSet() {}

  /**
   * Adds a new element to the set, in a subset of its own. If the element is already in the set,
   * no changes are made and false is returned.
   */
  @CanIgnoreReturnValue
  public boolean add(T val) {
    if (elementIndices.containsKey(val)) {
      return false;
    }
    int elementIndex = elements.size();
    elements.add(val);
    elementIndices.put(val, elementIndex);
    parents.add(elementIndex);
    sizes.add(1);
    return true;
  }

  /** Returns the root of the given element. If the element isn't in the set, returns null. */
  public @Nullable T findRoot(T val) {
    Integer index = elementIndices.get(val);
    if (index == null) {
      return null;
    }
    return elements.get(findRootIndex(index));
  }

  /** Returns the index of the root for the element at the given index. */
  private int findRootIndex(int elementIndex) {
    int root = elementIndex;
    while (parents.getInt(root) != root) {
      root = parents.getInt(root);
    }
    // Path compression.
    while (parents.getInt(elementIndex) != root) {
      int next = parents.getInt(elementIndex);
      parents.set(elementIndex, root);
      elementIndex = next;
    }
    return root;
  }

  /**
   * Merges the subsets containing a and b. If either a or b isn't in the set, returns false and
   * does not modify the set. Otherwise returns true.
   */
  @CanIgnoreReturnValue
  public boolean union(T a, T b) {
    Integer aIndex = elementIndices.get(a);
    Integer bIndex = elementIndices.get(b);
    if (aIndex == null || bIndex == null) {
      return false;
    }
    int aRootIndex = findRootIndex(aIndex);
    int bRootIndex = findRootIndex(bIndex);
    if (aRootIndex == bRootIndex) {
      return true;
    }
    // Make the smaller subtree the child of the larger.
    if (sizes.getInt(aRootIndex) < sizes.getInt(bRootIndex)) {
      parents.set(aRootIndex, bRootIndex);
      sizes.set(bRootIndex, sizes.getInt(bRootIndex) + sizes.getInt(aRootIndex));
    } else {
      parents.set(bRootIndex, aRootIndex);
      sizes.set(aRootIndex, sizes.getInt(aRootIndex) + sizes.getInt(bRootIndex));
    }
    return true;
  }

  /**
   * Returns the subsets, each listing its elements in the order they were added. Subsets are
   * ordered by their first-added element.
   */
  public ImmutableList<ImmutableList<T>> subsets() {
    ListMultimap<Integer, T> byRoot = LinkedListMultimap.create();
    for (int i = 0; i < elements.size(); i++) {
      byRoot.put(findRootIndex(i), elements.get(i));
    }
    ImmutableList.Builder<ImmutableList<T>> result = ImmutableList.builder();
    for (Collection<T> subset : byRoot.asMap().values()) {
      result.add(ImmutableList.copyOf(subset));
    }
    return result.build();
  }
}
