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
 * An angular rectangle on the sky with east and west expressed in -180..180, ready for KML.
 * East is always greater than west, so west may fall below -180 for areas straddling the antimeridian.
 */
@Data
@AllArgsConstructor
public class SkyRectangle implements Serializable {
  private static final long serialVersionUID = -8203451150913657210L;

  private final double north;
  private final double south;
  private final double east;
  private final double west;

  /**
   * Builds the rectangle from two right ascensions in any order. The larger one, before wrapping, becomes the east
   * edge since right ascension grows eastwards. Both are then moved into the -180..180 convention of the viewer.
   */
  public static SkyRectangle fromRaDec(double ra1, double ra2, double north, double south) {
    double east = WrapAround.restoreWrapAround(Math.max(ra1, ra2)) - 180.0;
    double west = WrapAround.restoreWrapAround(Math.min(ra1, ra2)) - 180.0;
    // viewers expect east > west and only honour a decreased west
    if (east < west) {
      west -= 360.0;
    }
    return new SkyRectangle(north, south, east, west);
  }
}
