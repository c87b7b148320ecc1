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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for RingError and RingException. */
@RunWith(JUnit4.class)
public class RingErrorTest {
  @Test
  public void testDefaultIsOk() {
    RingError error = new RingError();
    assertTrue(error.ok());
    assertEquals(RingError.Code.NO_ERROR, error.code());
    assertEquals("OK", error.toString());
  }

  @Test
  public void testInitFormatsPercentD() {
    RingError error = new RingError(RingError.Code.MISSING_COORDINATE, "Node %d of %s", 7, "ring");
    assertFalse(error.ok());
    assertEquals("Node 7 of ring", error.text());
    assertEquals("MISSING_COORDINATE: Node 7 of ring", error.toString());
  }

  @Test
  public void testInitAddsContext() {
    RingError error = new RingError(RingError.Code.NOT_SIMPLE_RING, "bad edges");
    error.init(error.code(), "Ring %d: %s", 3, error.text());
    assertEquals(RingError.Code.NOT_SIMPLE_RING, error.code());
    assertEquals("Ring 3: bad edges", error.text());
    error.clear();
    assertTrue(error.ok());
    assertEquals("", error.text());
  }

  @Test
  public void testCodesAreDistinct() {
    assertEquals(1, RingError.Code.MISSING_COORDINATE.code());
    assertEquals(200, RingError.Code.NONZERO_WRAP_SUM.code());
    assertEquals(201, RingError.Code.RING_SPANS_PERIODIC_IMAGES.code());
    assertEquals(202, RingError.Code.TILING_TOO_SMALL.code());
  }

  @Test
  public void testExceptionWrapsError() {
    RingException e = new RingException(RingError.Code.INVALID_CELL, "cell %s", "(0, 1)");
    assertEquals(RingError.Code.INVALID_CELL, e.code());
    assertEquals("cell (0, 1)", e.getMessage());

    RingError error = new RingError(RingError.Code.UNKNOWN, "oops");
    assertSame(error, new RingException(error).error());
  }
}
