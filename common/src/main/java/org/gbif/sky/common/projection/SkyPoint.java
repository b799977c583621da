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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An immutable point on the sky along with its location in the 1-based pixel frame of an image.
 */
@Data
@AllArgsConstructor
public class SkyPoint implements Serializable {
  private static final long serialVersionUID = 2804735601236178217L;

  private final double ra;
  private final double dec;
  private final double x;
  private final double y;

  /**
   * Planar distance in pixel space.
   */
  public double distanceXY(SkyPoint other) {
    return Math.hypot(x - other.x, y - other.y);
  }

  /**
   * Planar distance treating ra and dec as cartesian coordinates, which is only meaningful over small areas.
   */
  public double distanceRaDec(SkyPoint other) {
    return Math.hypot(ra - other.ra, dec - other.dec);
  }

  /**
   * Length of the chord joining both points on the unit sphere.
   */
  public double distanceRaDecExact(SkyPoint other) {
    double r1 = Math.toRadians(ra);
    double d1 = Math.toRadians(dec);
    double r2 = Math.toRadians(other.ra);
    double d2 = Math.toRadians(other.dec);

    double dx = Math.cos(d1) * Math.cos(r1) - Math.cos(d2) * Math.cos(r2);
    double dy = Math.cos(d1) * Math.sin(r1) - Math.cos(d2) * Math.sin(r2);
    double dz = Math.sin(d1) - Math.sin(d2);
    return Math.sqrt(dx * dx + dy * dy + dz * dz);
  }
}
