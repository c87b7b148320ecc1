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

import static java.lang.Math.abs;
import static java.lang.Math.atan2;
import static java.lang.Math.sqrt;

import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An immutable point or displacement in the plane. Node coordinates, periodic cell dimensions and
 * edge displacements are all R2Vectors.
 */
@SuppressWarnings("AmbiguousMethodReference")
@JsType
public final class R2Vector implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The origin, (0, 0). */
  public static final R2Vector ORIGIN = new R2Vector(0, 0);

  private final double x;
  private final double y;

  /** Constructs a new R2 vector from the given x and y coordinates. */
  public R2Vector(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /** Constructs a new R2 vector from the given coordinates array, which must have length 2. */
  @JsIgnore
  public R2Vector(double[] coord) {
    if (coord.length != 2) {
      throw new IllegalArgumentException("Points must have exactly 2 coordinates");
    }
    this.x = coord[0];
    this.y = coord[1];
  }

  /** Returns the x coordinate of this vector. */
  public double x() {
    return x;
  }

  /** Returns the y coordinate of this vector. */
  public double y() {
    return y;
  }

  /**
   * Returns the coordinate of the given axis, which will be the x axis if index is 0, and the y
   * axis if index is 1.
   *
   * @throws ArrayIndexOutOfBoundsException Thrown if the given index is not 0 or 1.
   */
  public double get(int index) {
    if (index < 0 || index > 1) {
      throw new ArrayIndexOutOfBoundsException(index);
    }
    return index == 0 ? x : y;
  }

  /** Returns the vector result of {@code p1 + p2}. */
  public static R2Vector add(R2Vector p1, R2Vector p2) {
    return new R2Vector(p1.x + p2.x, p1.y + p2.y);
  }

  /** Returns add(this, p) */
  public R2Vector add(R2Vector p) {
    return add(this, p);
  }

  /** Returns the vector result of {@code p1 - p2}. */
  public static R2Vector sub(R2Vector p1, R2Vector p2) {
    return new R2Vector(p1.x - p2.x, p1.y - p2.y);
  }

  /** Returns sub(this, p) */
  public R2Vector sub(R2Vector p) {
    return sub(this, p);
  }

  /** Returns the vector {@code p} scaled by {@code m}. */
  public static R2Vector mul(R2Vector p, double m) {
    return new R2Vector(m * p.x, m * p.y);
  }

  /** Returns mul(this, m) */
  public R2Vector mul(double m) {
    return mul(this, m);
  }

  /** Returns the element-wise product {@code [p1.x*p2.x, p1.y*p2.y]}. */
  @JsIgnore
  public static R2Vector mul(R2Vector p1, R2Vector p2) {
    return new R2Vector(p1.x * p2.x, p1.y * p2.y);
  }

  /** Returns mul(this, p) */
  @JsIgnore
  public R2Vector mul(R2Vector p) {
    return mul(this, p);
  }

  /** Returns the vector magnitude. */
  public double norm() {
    return sqrt(norm2());
  }

  /** Returns the square of the vector magnitude. */
  public double norm2() {
    return (x * x) + (y * y);
  }

  /**
   * Returns the direction of this vector as an angle in radians from the positive x axis, in the
   * range (-pi, pi]. The zero vector has angle 0.
   */
  public double angle() {
    return atan2(y, x);
  }

  /** Returns the dot product of the given vectors. */
  @JsIgnore
  public static double dotProd(R2Vector p1, R2Vector p2) {
    return (p1.x * p2.x) + (p1.y * p2.y);
  }

  /** Returns the dot product of this vector with that vector. */
  public double dotProd(R2Vector that) {
    return dotProd(this, that);
  }

  /** Returns the cross product of this vector with that vector. */
  public double crossProd(R2Vector that) {
    return this.x * that.y - this.y * that.x;
  }

  /** Returns true if neither coordinate is infinite or NaN. */
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }

  /**
   * Returns true if this vector is less than that vector, with the x-axis as the primary sort key
   * and the y-axis as the secondary sort key.
   */
  public boolean lessThan(R2Vector that) {
    if (x < that.x) {
      return true;
    }
    if (that.x < x) {
      return false;
    }
    return y < that.y;
  }

  /** Returns true if that object is an R2Vector with exactly the same x and y coordinates. */
  @Override
  public boolean equals(Object that) {
    if (!(that instanceof R2Vector)) {
      return false;
    }
    R2Vector thatPoint = (R2Vector) that;
    return this.x == thatPoint.x && this.y == thatPoint.y;
  }

  /**
   * Calculates hashcode based on stored coordinates. Since we want +0.0 and -0.0 to be treated the
   * same, we ignore the sign of the coordinates.
   */
  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(abs(x));
    value += 37 * value + Double.doubleToLongBits(abs(y));
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + Platform.formatDouble(x) + ", " + Platform.formatDouble(y) + ")";
  }
}
