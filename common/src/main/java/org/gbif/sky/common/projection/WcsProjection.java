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
 * Maps between the pixels of one image and the sky.
 * Pixel coordinates are 1-based, so the centre of the first pixel is (1, 1). Angles are in degrees.
 */
public interface WcsProjection {

  /**
   * Converts a pixel location to the sky, with right ascension in [0, 360). This never fails.
   */
  SkyCoordinate toSky(double x, double y);

  /**
   * Converts a sky location to pixels. Landing outside the image is reported through
   * {@link PixelCoordinate#isInside()} and is not an error.
   */
  PixelCoordinate toPixel(double ra, double dec);

  int getWidth();

  int getHeight();
}
