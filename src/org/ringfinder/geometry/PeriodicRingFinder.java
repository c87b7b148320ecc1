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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Finds the rings of a network that repeats periodically in both directions, such as a simulation
 * cell with periodic boundary conditions. Edges may cross the cell boundary: an edge whose
 * endpoints are more than half a cell apart along an axis is taken to connect to the nearest
 * periodic image of its far endpoint.
 *
 * <p>The network is replicated over a block of cells around the origin, and the block is traced
 * as an ordinary planar graph. Each ring then appears once per cell; exactly one copy is kept,
 * the copy whose smallest (node, cell) image lies in the origin cell. Rings are reported over the
 * original node ids, each with its own coordinate map holding the unwrapped position of every node
 * of the ring, so areas and winding are those of the real polygon.
 *
 * <p>The block starts at {@link Options#tilingRadius()} cells around the origin. If a traced ring
 * reaches further from its smallest image than that, the block is rebuilt with a radius large
 * enough to hold it, up to {@link Options#maxTilingRadius()}.
 *
 * <p>Perimeter rings are computed from abstract copies of the rings, since a boundary loop of a
 * periodic network has no single placement. A network that is periodic in both directions has no
 * perimeter.
 */
public class PeriodicRingFinder extends RingFinder {
  private static final Logger log = Platform.getLoggerForClass(PeriodicRingFinder.class);

  /** Options for tiling the periodic network. */
  public static final class Options {
    /**
     * Default options: a tiling radius of 1, growing up to 8 for wide rings, and wrap sum
     * validation enabled.
     */
    public static final Options DEFAULT = builder().build();

    private final int tilingRadius;
    private final int maxTilingRadius;
    private final boolean validateWrapSums;

    private Options(Builder builder) {
      this.tilingRadius = builder.tilingRadius;
      this.maxTilingRadius = builder.maxTilingRadius;
      this.validateWrapSums = builder.validateWrapSums;
    }

    public static Builder builder() {
      return new Builder();
    }

    public Builder toBuilder() {
      return new Builder(this);
    }

    /**
     * Returns the number of cells kept in each direction around the origin cell. A radius of 1
     * keeps a 3x3 block of cells, which is enough for any ring smaller than a cell.
     */
    public int tilingRadius() {
      return tilingRadius;
    }

    /**
     * Returns the largest radius the tiling may grow to when a ring reaches further than
     * {@link #tilingRadius()} cells from its smallest image.
     */
    public int maxTilingRadius() {
      return maxTilingRadius;
    }

    /** Returns true if the wrap vectors around each ring are checked to sum to zero. */
    public boolean validateWrapSums() {
      return validateWrapSums;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Options)) {
        return false;
      }
      Options that = (Options) other;
      return tilingRadius == that.tilingRadius
          && maxTilingRadius == that.maxTilingRadius
          && validateWrapSums == that.validateWrapSums;
    }

    @Override
    public int hashCode() {
      return (31 * tilingRadius + maxTilingRadius) * 31 + (validateWrapSums ? 1 : 0);
    }

    @Override
    public String toString() {
      return "Options{tilingRadius="
          + tilingRadius
          + ", maxTilingRadius="
          + maxTilingRadius
          + ", validateWrapSums="
          + validateWrapSums
          + "}";
    }

    /** Builder for {@link Options}. */
    public static final class Builder {
      private int tilingRadius = 1;
      private int maxTilingRadius = 8;
      private boolean validateWrapSums = true;

      private Builder() {}

      private Builder(Options options) {
        this.tilingRadius = options.tilingRadius;
        this.maxTilingRadius = options.maxTilingRadius;
        this.validateWrapSums = options.validateWrapSums;
      }

      @CanIgnoreReturnValue
      public Builder setTilingRadius(int tilingRadius) {
        this.tilingRadius = tilingRadius;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setMaxTilingRadius(int maxTilingRadius) {
        this.maxTilingRadius = maxTilingRadius;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setValidateWrapSums(boolean validateWrapSums) {
        this.validateWrapSums = validateWrapSums;
        return this;
      }

      /**
       * Returns the options.
       *
       * @throws RingException with code INVALID_ARGUMENT if the tiling radius is less than 1 or
       *     greater than the maximum tiling radius.
       */
      public Options build() {
        if (tilingRadius < 1) {
          throw new RingException(
              RingError.Code.INVALID_ARGUMENT,
              "Tiling radius must be at least 1, got %d",
              tilingRadius);
        }
        if (maxTilingRadius < tilingRadius) {
          throw new RingException(
              RingError.Code.INVALID_ARGUMENT,
              "Maximum tiling radius %d is less than the tiling radius %d",
              maxTilingRadius,
              tilingRadius);
        }
        return new Options(this);
      }
    }
  }

  private final R2Vector cell;
  private final Options options;
  private final int tilingRadius;

  /** Finds the rings of the given periodic network with {@link Options#DEFAULT}. */
  public PeriodicRingFinder(UndirectedGraph graph, Int2ObjectMap<R2Vector> coords, R2Vector cell) {
    this(graph, coords, cell, Options.DEFAULT);
  }

  /**
   * Finds the rings of the given periodic network.
   *
   * @param cell the dimensions of the periodic cell along x and y
   * @throws RingException with code INVALID_CELL if a cell dimension is not positive and finite,
   *     MISSING_COORDINATE if a node with an edge has no coordinate, NONZERO_WRAP_SUM if a ring
   *     does not close in the periodic cell, RING_SPANS_PERIODIC_IMAGES if a ring passes
   *     through two images of the same node, or TILING_TOO_SMALL if a ring reaches further than
   *     the maximum tiling radius.
   */
  public PeriodicRingFinder(
      UndirectedGraph graph, Int2ObjectMap<R2Vector> coords, R2Vector cell, Options options) {
    this(Tiling.grow(graph, coords, checkCell(cell), Preconditions.checkNotNull(options)));
  }

  private PeriodicRingFinder(Tiling tiling) {
    super(tiling.coords, tiling.rings, mergePerimeters(abstractCopies(tiling.rings)));
    this.cell = tiling.cell;
    this.options = tiling.options;
    this.tilingRadius = tiling.radius;
  }

  private static R2Vector checkCell(R2Vector cell) {
    Preconditions.checkNotNull(cell);
    if (!cell.isFinite() || !(cell.x() > 0) || !(cell.y() > 0)) {
      throw new RingException(
          RingError.Code.INVALID_CELL, "Cell dimensions must be positive and finite: %s", cell);
    }
    return cell;
  }

  private static List<Shape> abstractCopies(ImmutableSet<Shape> rings) {
    List<Shape> result = new ArrayList<>(rings.size());
    for (Shape ring : rings) {
      result.add(ring.withoutCoordinates());
    }
    return result;
  }

  /** Returns the dimensions of the periodic cell. */
  public R2Vector cell() {
    return cell;
  }

  public Options options() {
    return options;
  }

  /**
   * Returns the tiling radius the rings were found with. This is larger than
   * {@code options().tilingRadius()} if some ring needed a wider tiling.
   */
  public int tilingRadius() {
    return tilingRadius;
  }

  /**
   * Returns the number of cells {wx, wy} to add to the position of {@code v} so that it is the
   * image nearest to {@code u}. The result is nonzero along an axis only if the nodes are more than
   * half a cell apart along it. {@code wrapVector(v, u)} is the negation of {@code wrapVector(u,
   * v)}.
   */
  public int[] wrapVector(int u, int v) {
    R2Vector pu = coordinates().get(u);
    R2Vector pv = coordinates().get(v);
    Preconditions.checkArgument(pu != null && pv != null, "No coordinate for %s or %s", u, v);
    return wrap(pv.sub(pu), cell);
  }

  static int[] wrap(R2Vector d, R2Vector cell) {
    return new int[] {-wrap(d.x() / cell.x()), -wrap(d.y() / cell.y())};
  }

  /** Returns the number of whole cells to subtract from a displacement of n cells. */
  private static int wrap(double n) {
    int cells = Math.max(0, (int) Math.ceil(Math.abs(n) - 0.5));
    return n < 0 ? -cells : cells;
  }

  /**
   * Replicates the network over a square block of cells, traces it, and keeps one copy of each
   * ring. Image nodes are numbered so that their natural order is the lexicographic order of
   * (node, ox, oy), which makes the smallest image of a face its anchor.
   */
  private static final class Tiling {
    final Int2ObjectMap<R2Vector> coords;
    final R2Vector cell;
    final Options options;
    final int radius;

    /** The kept rings, or empty if {@link #requiredRadius} exceeds {@link #radius}. */
    final ImmutableSet<Shape> rings;

    /** The smallest radius that holds every traced ring around its anchor. */
    private final int requiredRadius;

    /** Base nodes with at least one edge, ascending. */
    private final int[] baseNodes;

    /** Half the side of the replicated block, in cells. */
    private final int reach;

    /** Side of the replicated block, in cells. */
    private final int side;

    /**
     * Tiles the network with the smallest radius, starting from the options' tiling radius, at
     * which every traced ring fits around its anchor.
     */
    static Tiling grow(
        UndirectedGraph graph, Int2ObjectMap<R2Vector> coords, R2Vector cell, Options options) {
      int radius = options.tilingRadius();
      while (true) {
        Tiling tiling = new Tiling(graph, coords, cell, options, radius);
        if (tiling.requiredRadius <= radius) {
          return tiling;
        }
        if (tiling.requiredRadius > options.maxTilingRadius()) {
          throw new RingException(
              RingError.Code.TILING_TOO_SMALL,
              "A ring reaches %d cells from its anchor, beyond the maximum tiling radius %d",
              tiling.requiredRadius,
              options.maxTilingRadius());
        }
        log.info(
            "A ring reaches "
                + tiling.requiredRadius
                + " cells from its anchor; retiling with radius "
                + tiling.requiredRadius);
        radius = tiling.requiredRadius;
      }
    }

    private Tiling(
        UndirectedGraph graph,
        Int2ObjectMap<R2Vector> coords,
        R2Vector cell,
        Options options,
        int radius) {
      this.coords = Preconditions.checkNotNull(coords);
      this.cell = cell;
      this.options = options;
      this.radius = radius;
      AngularFaceTracer.checkCoordinates(graph, coords);

      IntArrayList nodes = new IntArrayList();
      for (int u : graph.nodes()) {
        if (!graph.neighbors(u).isEmpty()) {
          nodes.add(u);
        }
      }
      baseNodes = nodes.toIntArray();
      IntArrays.quickSort(baseNodes);
      Int2IntOpenHashMap index = new Int2IntOpenHashMap();
      for (int i = 0; i < baseNodes.length; i++) {
        index.put(baseNodes[i], i);
      }

      List<int[]> edges = new ArrayList<>();
      int maxWrap = 0;
      for (int u : baseNodes) {
        for (int v : graph.neighbors(u)) {
          if (u < v) {
            int[] w = wrap(coords.get(v).sub(coords.get(u)), cell);
            edges.add(new int[] {index.get(u), index.get(v), w[0], w[1]});
            maxWrap = Math.max(maxWrap, Math.max(Math.abs(w[0]), Math.abs(w[1])));
          }
        }
      }
      reach = radius + maxWrap;
      side = 2 * reach + 1;

      AdjacencyGraph images = new AdjacencyGraph();
      Int2ObjectMap<R2Vector> imageCoords = new Int2ObjectOpenHashMap<>();
      for (int[] edge : edges) {
        for (int ox = -reach; ox <= reach; ox++) {
          for (int oy = -reach; oy <= reach; oy++) {
            int vx = ox + edge[2];
            int vy = oy + edge[3];
            if (Math.abs(vx) > reach || Math.abs(vy) > reach) {
              continue;
            }
            int a = image(edge[0], ox, oy);
            int b = image(edge[1], vx, vy);
            images.addEdge(a, b);
            imageCoords.put(a, imageCoordinate(a));
            imageCoords.put(b, imageCoordinate(b));
          }
        }
      }
      log.fine(
          "Tiled "
              + baseNodes.length
              + " nodes over "
              + side
              + "x"
              + side
              + " cells: "
              + images.numNodes()
              + " image nodes, "
              + images.numEdges()
              + " image edges");

      AngularFaceTracer tracer = new AngularFaceTracer(images, imageCoords);
      requiredRadius = requiredRadius(tracer);
      if (requiredRadius <= radius) {
        rings = keepOriginRings(tracer);
        logOpenHalfEdges(2 * edges.size());
      } else {
        rings = ImmutableSet.of();
      }
    }

    private int image(int baseIndex, int ox, int oy) {
      return (baseIndex * side + ox + reach) * side + oy + reach;
    }

    private int baseIndex(int image) {
      return image / (side * side);
    }

    private int offsetX(int image) {
      return (image / side) % side - reach;
    }

    private int offsetY(int image) {
      return image % side - reach;
    }

    private R2Vector imageCoordinate(int image) {
      R2Vector base = coords.get(baseNodes[baseIndex(image)]);
      return new R2Vector(
          base.x() + offsetX(image) * cell.x(), base.y() + offsetY(image) * cell.y());
    }

    /**
     * Returns the largest number of cells between the anchor of a bounded face and any of its
     * images. A bounded face of the block is a ring of the periodic network, since every edge
     * left out of the block leads outside it.
     */
    private int requiredRadius(AngularFaceTracer tracer) {
      int required = 0;
      for (int[] face : tracer.faces()) {
        if (!(tracer.signedArea(face) > 0)) {
          continue;
        }
        int anchor = anchor(face);
        for (int image : face) {
          required =
              Math.max(
                  required,
                  Math.max(
                      Math.abs(offsetX(image) - offsetX(anchor)),
                      Math.abs(offsetY(image) - offsetY(anchor))));
        }
      }
      return required;
    }

    private static int anchor(int[] face) {
      int anchor = face[0];
      for (int image : face) {
        anchor = Math.min(anchor, image);
      }
      return anchor;
    }

    private ImmutableSet<Shape> keepOriginRings(AngularFaceTracer tracer) {
      ImmutableSet.Builder<Shape> result = ImmutableSet.builder();
      Set<Shape> kept = new HashSet<>();
      for (int[] face : tracer.faces()) {
        if (!(tracer.signedArea(face) > 0)) {
          continue;
        }
        int anchor = anchor(face);
        if (offsetX(anchor) != 0 || offsetY(anchor) != 0) {
          continue;
        }
        Shape ring = toBaseShape(tracer.toShape(tracer.outerBoundary(face)));
        if (options.validateWrapSums()) {
          checkWrapSum(face);
        }
        if (!kept.add(ring)) {
          log.warning("Dropping ring " + ring + ", a translate of a ring already found");
          continue;
        }
        result.add(ring);
      }
      ImmutableSet<Shape> rings = result.build();
      log.fine("Kept " + rings.size() + " rings anchored in the origin cell");
      return rings;
    }

    /**
     * Logs how many base half-edges bound no ring. Each half-edge bounds exactly one face, so in
     * a network that is periodic along both axes every half-edge lies on exactly one ring, and the
     * rest lie on open boundaries.
     */
    private void logOpenHalfEdges(int numHalfEdges) {
      int covered = 0;
      for (Shape ring : rings) {
        covered += ring.size();
      }
      log.fine((numHalfEdges - covered) + " of " + numHalfEdges + " half-edges bound no ring");
    }

    /** Maps a ring of image nodes back to the base nodes, with unwrapped coordinates. */
    private Shape toBaseShape(Shape imageRing) {
      Int2ObjectMap<R2Vector> unwrapped = new Int2ObjectOpenHashMap<>();
      for (int image : imageRing.nodes()) {
        int node = baseNodes[baseIndex(image)];
        if (unwrapped.containsKey(node)) {
          throw new RingException(
              RingError.Code.RING_SPANS_PERIODIC_IMAGES,
              "Ring %s visits node %d twice in different cells; the cell is too small",
              imageRing,
              node);
        }
        unwrapped.put(node, imageCoordinate(image));
      }
      List<UndirectedEdge> edges = new ArrayList<>(imageRing.size());
      for (UndirectedEdge edge : imageRing.edges()) {
        edges.add(
            UndirectedEdge.of(baseNodes[baseIndex(edge.lo())], baseNodes[baseIndex(edge.hi())]));
      }
      return new Shape(edges, unwrapped);
    }

    /** Checks that the wraps of the base edges along the face cancel out. */
    private void checkWrapSum(int[] face) {
      int sumX = 0;
      int sumY = 0;
      for (int i = 0; i < face.length; i++) {
        int a = face[i];
        int b = face[(i + 1) % face.length];
        R2Vector pa = coords.get(baseNodes[baseIndex(a)]);
        R2Vector pb = coords.get(baseNodes[baseIndex(b)]);
        int[] w = wrap(pb.sub(pa), cell);
        sumX += w[0];
        sumY += w[1];
      }
      if (sumX != 0 || sumY != 0) {
        throw new RingException(
            RingError.Code.NONZERO_WRAP_SUM,
            "Wraps around ring of %d nodes sum to (%d, %d)",
            face.length,
            sumX,
            sumY);
      }
    }
  }

  @Override
  public String toString() {
    return "PeriodicRingFinder{rings="
        + currentRings().size()
        + ", sizes="
        + ringSizes()
        + ", cell="
        + cell
        + ", "
        + options
        + "}";
  }
}
