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
package org.gbif.sky.common.kml;

import org.gbif.sky.common.projection.BoundingBox;
import org.gbif.sky.common.projection.SkyCoordinate;
import org.gbif.sky.common.projection.SkyRectangle;

import com.google.common.annotations.VisibleForTesting;

/**
 * Builds the ground overlay for a single warped image covering a bounding box, with a view that frames it.
 */
public final class GroundOverlays {
  static final double RADIUS_EARTH = 6378135.0;
  // widest angle in degrees that still fits the view, found by eye
  static final double VIEWABLE_ANGULAR_SCALE = 50.0;
  static final double TINY_FLOAT_VALUE = 1.0e-8;

  private GroundOverlays() {}

  public static GroundOverlay fromBoundingBox(BoundingBox boundingBox, String imageHref, String name) {
    double[] monotonic = boundingBox.getMonotonicRaBounds();
    double[] dec = boundingBox.getDecBounds();
    SkyRectangle extent = SkyRectangle.fromRaDec(monotonic[0], monotonic[1], dec[1], dec[0]);

    SkyCoordinate center = boundingBox.getCenter();
    double angularScale = Math.max(monotonic[1] - monotonic[0], dec[1] - dec[0]);
    LookAt lookAt = new LookAt(center.getRa() - 180.0, center.getDec(), range(angularScale));

    return GroundOverlay.builder()
      .name(name)
      .icon(new Icon(imageHref))
      .latLonBox(LatLonBox.of(extent))
      .lookAt(lookAt)
      .build();
  }

  /**
   * A document holding only the ground overlay.
   */
  public static Kml document(BoundingBox boundingBox, String imageHref, String name) {
    return Kml.of(Document.builder().groundOverlay(fromBoundingBox(boundingBox, imageHref, name)).build());
  }

  /**
   * The distance in metres to look from so that the angular scale fills a comfortable part of the view. Scales
   * beyond the viewable one zoom all the way out.
   */
  @VisibleForTesting
  static double range(double angularScale) {
    double alpha = Math.toRadians(0.5 * VIEWABLE_ANGULAR_SCALE);
    double beta = Math.min(alpha, Math.toRadians(0.5 * angularScale));
    return RADIUS_EARTH * (1.0 - Math.sin(alpha - beta) / (Math.sin(alpha) + TINY_FLOAT_VALUE));
  }
}
