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

import com.google.common.base.Preconditions;

import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * The angular envelope of an image on the sky, found by walking the perimeter of the image through its projection.
 * <p>
 * When the image straddles right ascension 0/360 the extrema are held in monotonic form, i.e. with values past the
 * discontinuity moved above 360, so {@code getRaMin().getRa() <= getRaMax().getRa()} always holds. The pole probes
 * catch the interior declination extrema a perimeter walk cannot see.
 * <p>
 * Instances are immutable; compute a new one for a different image.
 */
@Slf4j
@Getter
@ToString
public class BoundingBox {
  // just shy of the poles, where projections become singular
  static final double NORTH_POLE = 89.9999999;
  static final double SOUTH_POLE = -89.9999999;

  private final SkyPoint raMin;
  private final SkyPoint raMax;
  private final SkyPoint decMin;
  private final SkyPoint decMax;
  private final boolean wrapped;
  private final boolean crossesNorthPole;
  private final boolean crossesSouthPole;

  /**
   * Finds the bounding box of an image of the given dimensions.
   */
  public BoundingBox(WcsProjection projection, int width, int height) {
    Preconditions.checkNotNull(projection, "Projection cannot be null");
    Preconditions.checkArgument(width > 1 && height > 1, "Image must be larger than 1x1 pixels, found %sx%s",
                                width, height);

    Extrema extrema = walkPerimeter(projection, width, height, false);

    // extrema are wrong when ra is not monotonic across the image, so do it again in monotonic form
    boolean wraps = WrapAround.imageWrapsAround(extrema.raMin.getRa(), extrema.raMax.getRa());
    if (wraps) {
      log.debug("Image wraps around ra 0/360, recomputing the bounding box");
      extrema = walkPerimeter(projection, width, height, true);
    }

    PixelCoordinate north = projection.toPixel(0.0, NORTH_POLE);
    if (north.isInside()) {
      extrema.decMax = new SkyPoint(0.0, NORTH_POLE, north.getX(), north.getY());
    }
    PixelCoordinate south = projection.toPixel(0.0, SOUTH_POLE);
    if (south.isInside()) {
      extrema.decMin = new SkyPoint(0.0, SOUTH_POLE, south.getX(), south.getY());
    }

    this.raMin = extrema.raMin;
    this.raMax = extrema.raMax;
    this.decMin = extrema.decMin;
    this.decMax = extrema.decMax;
    this.wrapped = wraps;
    this.crossesNorthPole = north.isInside();
    this.crossesSouthPole = south.isInside();
  }

  private static Extrema walkPerimeter(WcsProjection projection, int width, int height, boolean wrapped) {
    Extrema extrema = new Extrema(projection, wrapped);
    // the 4 corners are visited twice
    for (int x = 1; x <= width; x++) {
      extrema.update(x, 1);
    }
    for (int x = 1; x <= width; x++) {
      extrema.update(x, height);
    }
    for (int y = 1; y <= height; y++) {
      extrema.update(1, y);
    }
    for (int y = 1; y <= height; y++) {
      extrema.update(width, y);
    }
    Preconditions.checkState(extrema.raMin != null && extrema.decMin != null,
                             "Perimeter walk produced no valid samples");
    return extrema;
  }

  /**
   * @return {ra min, ra max} where the minimum is in [0, 360) and the maximum is at least as large, so it can
   * exceed 360 for wrapped images
   */
  public double[] getMonotonicRaBounds() {
    double min = WrapAround.restoreWrapAround(raMin.getRa());
    double max = wrapped ? WrapAround.makeRaMonotonic(raMax.getRa()) : raMax.getRa();
    return new double[] {min, max};
  }

  /**
   * @return {ra min, ra max}, both in [0, 360), so the minimum exceeds the maximum for wrapped images
   */
  public double[] getWrappedRaBounds() {
    return new double[] {WrapAround.restoreWrapAround(raMin.getRa()), WrapAround.restoreWrapAround(raMax.getRa())};
  }

  /**
   * @return {dec min, dec max}
   */
  public double[] getDecBounds() {
    return new double[] {decMin.getDec(), decMax.getDec()};
  }

  /**
   * @return the centre of the box, with ra in [0, 360)
   */
  public SkyCoordinate getCenter() {
    double[] bounds = getMonotonicRaBounds();
    double ra = WrapAround.restoreWrapAround(0.5 * (bounds[0] + bounds[1]));
    return new SkyCoordinate(ra, 0.5 * (decMin.getDec() + decMax.getDec()));
  }

  /**
   * Running extrema of a perimeter walk, null until the first sample.
   */
  private static class Extrema {
    private final WcsProjection projection;
    private final boolean wrapped;
    private SkyPoint raMin;
    private SkyPoint raMax;
    private SkyPoint decMin;
    private SkyPoint decMax;

    private Extrema(WcsProjection projection, boolean wrapped) {
      this.projection = projection;
      this.wrapped = wrapped;
    }

    private void update(double x, double y) {
      SkyCoordinate sky = projection.toSky(x, y);
      double ra = wrapped ? WrapAround.makeRaMonotonic(sky.getRa()) : sky.getRa();
      double dec = sky.getDec();
      if (Double.isNaN(ra) || Double.isNaN(dec)) {
        return;
      }
      SkyPoint point = new SkyPoint(ra, dec, x, y);

      // ra and dec are independent, the same point may hold several extrema
      if (raMax == null || ra > raMax.getRa()) {
        raMax = point;
      }
      if (raMin == null || ra < raMin.getRa()) {
        raMin = point;
      }
      if (decMax == null || dec > decMax.getDec()) {
        decMax = point;
      }
      if (decMin == null || dec < decMin.getDec()) {
        decMin = point;
      }
    }
  }
}
