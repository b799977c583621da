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
 * A location in the 1-based pixel frame of an image, flagged with whether it falls on the image.
 * Points that cannot be projected at all (e.g. behind a tangent plane) have NaN coordinates.
 */
@Data
@AllArgsConstructor
public class PixelCoordinate implements Serializable {
  private static final long serialVersionUID = 7715062090117374046L;

  private final double x;
  private final double y;
  private final boolean inside;

  static PixelCoordinate outside() {
    return new PixelCoordinate(Double.NaN, Double.NaN, false);
  }
}
