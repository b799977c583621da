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
 * An affine mapping between pixels and the sky, for images small enough that the curvature of the sky is
 * irrelevant. Right ascension wraps at 360.
 */
public class LinearProjection implements WcsProjection {
  private final int width;
  private final int height;
  private final double ra0;
  private final double dec0;
  private final double raPerX;
  private final double raPerY;
  private final double decPerX;
  private final double decPerY;

  /**
   * @param ra0 right ascension of pixel (1, 1)
   * @param dec0 declination of pixel (1, 1)
   */
  public LinearProjection(int width, int height, double ra0, double dec0, double raPerX, double raPerY,
                          double decPerX, double decPerY) {
    this.width = width;
    this.height = height;
    this.ra0 = ra0;
    this.dec0 = dec0;
    this.raPerX = raPerX;
    this.raPerY = raPerY;
    this.decPerX = decPerX;
    this.decPerY = decPerY;
  }

  @Override
  public SkyCoordinate toSky(double x, double y) {
    double ra = ra0 + raPerX * (x - 1) + raPerY * (y - 1);
    double dec = dec0 + decPerX * (x - 1) + decPerY * (y - 1);
    return new SkyCoordinate(WrapAround.restoreWrapAround(ra), dec);
  }

  @Override
  public PixelCoordinate toPixel(double ra, double dec) {
    double deltaRa = WrapAround.restoreWrapAround(ra - ra0);
    if (deltaRa > 180) {
      deltaRa -= 360;
    }
    double deltaDec = dec - dec0;
    double determinant = raPerX * decPerY - raPerY * decPerX;
    double x = 1 + (decPerY * deltaRa - raPerY * deltaDec) / determinant;
    double y = 1 + (raPerX * deltaDec - decPerX * deltaRa) / determinant;
    boolean inside = x >= 0.5 && x <= width + 0.5 && y >= 0.5 && y <= height + 0.5;
    return new PixelCoordinate(x, y, inside);
  }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  public int getHeight() {
    return height;
  }
}
