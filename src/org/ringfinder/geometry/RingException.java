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

/**
 * An unchecked exception thrown when ring finding cannot proceed: either the input is
 * misconfigured (a node without a coordinate, a bad periodic cell, a malformed edge) or the
 * geometry is inconsistent (two shapes disagree about where a node is). A RingException wraps a
 * {@link RingError}, and provides a convenience method to get the underlying {@link
 * RingError.Code}.
 *
 * <p>Construction of a {@link RingFinder} either completes or throws; no partially populated
 * result is ever observable.
 */
public class RingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final RingError error;

  /** Creates a new RingException wrapping the given RingError. */
  public RingException(RingError error) {
    this.error = error;
  }

  /** Creates a new RingException wrapping a new RingError with the given code and text. */
  public RingException(RingError.Code code, String format, Object... args) {
    this(new RingError(code, format, args));
  }

  /** Returns the RingError wrapped by this exception. */
  public RingError error() {
    return error;
  }

  /** Returns the code of the RingError wrapped by this RingException. */
  public RingError.Code code() {
    return error.code();
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
