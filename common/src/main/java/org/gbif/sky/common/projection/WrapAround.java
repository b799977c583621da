/*
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
package org.gbif.sky.common.projection;

/**
 * Utilities for the discontinuity where right ascension jumps from 360 back to 0 degrees.
 * <p>
 * Detection is a heuristic: no single image is expected to span {@link #MAX_DELTA_RA} degrees of right ascension,
 * so a larger span between the extrema means the image straddles the discontinuity.
 */
public final class WrapAround {

  /** Largest range of right ascension an image may legitimately cover. */
  public static final double MAX_DELTA_RA = 300.0;

  private WrapAround() {}

  /**
   * @return true if the two right ascensions are so far apart that the image must cross 0/360
   */
  public static boolean imageWrapsAround(double raMin, double raMax) {
    return Math.abs(raMin - raMax) > MAX_DELTA_RA;
  }

  /**
   * Makes right ascension monotonic across a wrapped image by moving the small values above 360.
   * This must be applied to every value compared once wrapping is detected.
   */
  public static double makeRaMonotonic(double ra) {
    return ra < MAX_DELTA_RA ? ra + 360.0 : ra;
  }

  /**
   * Returns the equivalent right ascension in [0, 360).
   */
  public static double restoreWrapAround(double ra) {
    double restored = ra % 360.0;
    if (restored < 0) {
      restored += 360.0;
    }
    // -tiny + 360 rounds to exactly 360
    if (restored >= 360.0) {
      restored -= 360.0;
    }
    return restored;
  }
}
