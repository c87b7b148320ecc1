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

import java.util.Locale;
import java.util.logging.Logger;

/** Contains the few utility methods whose implementation is environment specific. */
final class Platform {

  private Platform() {}

  /**
   * Returns the {@link Logger} for the class.
   *
   * @see Logger#getLogger(String)
   */
  static Logger getLoggerForClass(Class<?> clazz) {
    return Logger.getLogger(clazz.getCanonicalName());
  }

  /**
   * Formats the double as a string and removes unneeded trailing zeros, so that fixture files and
   * debug output print "1.5" rather than "1.500000". Uses at most 15 significant digits.
   */
  static String formatDouble(double d) {
    if (d == 0d) {
      return "0";
    }
    StringBuilder out = new StringBuilder(String.format(Locale.US, "%.15g", d));

    // Style 'g' switches to 'e' for very small or large magnitudes; keep the exponent intact.
    int exponent = out.indexOf("e");
    String suffix = "";
    if (exponent >= 0) {
      suffix = out.substring(exponent);
      out.setLength(exponent);
    }
    if (out.indexOf(".") >= 0) {
      while (out.charAt(out.length() - 1) == '0') {
        out.setLength(out.length() - 1);
      }
      if (out.charAt(out.length() - 1) == '.') {
        out.setLength(out.length() - 1);
      }
    }
    return out.append(suffix).toString();
  }
}
