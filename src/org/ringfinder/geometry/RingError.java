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

import com.google.common.base.Strings;
import jsinterop.annotations.JsType;

/**
 * An error code and text string describing the first problem found while building shapes or
 * finding rings. Errors are reported to callers by throwing a {@link RingException} that wraps one
 * of these.
 */
@JsType
public class RingError {
  /** Numeric values for ring finding errors. */
  @JsType
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    ////////////////////////////////////////////////////////////////////
    // Generic errors:

    /** Unknown error. */
    UNKNOWN(1000),
    /** Invalid argument (other than one of the specific configuration errors below). */
    INVALID_ARGUMENT(1003),

    ////////////////////////////////////////////////////////////////////
    // Configuration errors, found before any tracing is done:

    /** A node referenced by an edge or node list has no coordinate. */
    MISSING_COORDINATE(1),
    /** A geometric operation was requested on a shape without coordinates. */
    MISSING_COORDINATES(2),
    /** The periodic cell has a non-positive, infinite or NaN dimension. */
    INVALID_CELL(3),
    /** An edge is a self-loop or is otherwise malformed. */
    MALFORMED_EDGE(4),

    ////////////////////////////////////////////////////////////////////
    // Geometric inconsistencies, found by the operation that needs consistency:

    /** Two shapes being merged place a shared node at different coordinates. */
    INCONSISTENT_COORDINATES(100),
    /** The edges of a shape do not form a single cycle in which every node has degree 2. */
    NOT_SIMPLE_RING(101),
    /** The wrap vectors around a periodic ring do not sum to zero. */
    NONZERO_WRAP_SUM(200),
    /** A periodic ring visits two images of the same node, so the cell is too small. */
    RING_SPANS_PERIODIC_IMAGES(201),
    /** A periodic ring reaches further from its anchor than the maximum tiling radius. */
    TILING_TOO_SMALL(202);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Creates an error with code NO_ERROR. */
  public RingError() {}

  /** Creates an error with the given code and text, formatted as by {@link #init}. */
  public RingError(Code code, String format, Object... args) {
    init(code, format, args);
  }

  /** Prepares a RingError instance for reuse by resetting it to its original state. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the error code and text description; the description is formatted according to the rules
   * defined in {@link Strings#lenientFormat(String, Object...)}, except that '%d' positional
   * arguments are also handled.
   *
   * <p>This method may be called more than once, so that outer layers can add context:
   *
   * <pre>{@code
   * error.init(error.code(), "Ring %d: %s", index, error.text());
   * }</pre>
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    format = format.replace("%d", "%s");
    this.text = Strings.lenientFormat(format, args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "OK";
    }
    return Strings.lenientFormat("%s: %s", code, text);
  }
}
