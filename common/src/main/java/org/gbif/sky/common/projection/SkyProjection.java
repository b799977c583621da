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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.gbif.sky.common.image.Color;
import org.gbif.sky.common.image.Colorspace;
import org.gbif.sky.common.image.Mask;
import org.gbif.sky.common.image.PixelBuffer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;

import lombok.extern.slf4j.Slf4j;

/**
 * Warps an image onto a grid that is linear in right ascension and declination, i.e. an equirectangular projection
 * of the sky, which is what the viewer drapes ground overlays with.
 * <p>
 * The output size defaults to one that keeps the native resolution of the image and can be changed before the
 * warp. Warping consumes the internal copy of the image so it can only happen once.
 * This class is not threadsafe.
 */
@Slf4j
public class SkyProjection {
  // tolerance in degrees for treating the rotation as a multiple of 90
  static final double TINY_THETA_VALUE = 0.1;
  static final double TINY_FLOAT_VALUE = 1.0e-8;

  private final WcsProjection projection;
  private final BoundingBox boundingBox;
  private final int inputWidth;
  private final int inputHeight;
  private PixelBuffer image;
  private Color backgroundColor = Color.TRANSPARENT;
  private ImageOrigin inputImageOrigin = ImageOrigin.UPPER_LEFT;
  private int projectedWidth;
  private int projectedHeight;

  /**
   * Copies the image to RGBA, finds its bounding box and determines the default output size.
   *
   * @param image source image of any colourspace
   * @param projection maps the pixels of the image to the sky
   */
  public SkyProjection(PixelBuffer image, WcsProjection projection) {
    Preconditions.checkNotNull(image, "Image cannot be null");
    Preconditions.checkNotNull(projection, "Projection cannot be null");
    Preconditions.checkArgument(image.getWidth() == projection.getWidth()
                                && image.getHeight() == projection.getHeight(),
                                "Image is %sx%s but the projection describes %sx%s", image.getWidth(),
                                image.getHeight(), projection.getWidth(), projection.getHeight());
    this.image = image.convertTo(Colorspace.RGBA);
    this.projection = projection;
    this.inputWidth = image.getWidth();
    this.inputHeight = image.getHeight();
    this.boundingBox = new BoundingBox(projection, inputWidth, inputHeight);
    determineProjectedSize();
  }

  @VisibleForTesting
  static int round(double value) {
    return (int) (value + 0.5);
  }

  /**
   * Chooses an output size that keeps the side lengths of the image in pixels, given its rotation on the sky.
   */
  private void determineProjectedSize() {
    SkyPoint raMin = boundingBox.getRaMin();
    SkyPoint raMax = boundingBox.getRaMax();
    SkyPoint decMin = boundingBox.getDecMin();

    int eastSide = round(raMax.distanceXY(decMin));
    int northSide = round(raMin.distanceXY(decMin));

    // angle between east and the x axis of the image, with the denominator guarded for 0 degrees
    double cosTheta = (raMax.getRa() - decMin.getRa()) / (raMax.distanceRaDec(decMin) + TINY_FLOAT_VALUE);
    double theta = Math.acos(cosTheta);
    double thetaDegrees = Math.toDegrees(theta);

    // one side collapses at multiples of 90, so use the image dimensions directly
    if (Math.abs(thetaDegrees - 90.0) < TINY_THETA_VALUE || Math.abs(thetaDegrees - 270.0) < TINY_THETA_VALUE) {
      projectedWidth = inputWidth;
      projectedHeight = inputHeight;
    } else if (Math.abs(thetaDegrees) < TINY_THETA_VALUE || Math.abs(thetaDegrees - 180.0) < TINY_THETA_VALUE) {
      projectedWidth = inputHeight;
      projectedHeight = inputWidth;
    } else {
      projectedWidth = round(Math.cos(theta) * eastSide + Math.sin(theta) * northSide);
      projectedHeight = round(Math.sin(theta) * eastSide + Math.cos(theta) * northSide);
    }
    log.debug("East side {}, north side {}, rotation {} degrees gives {}x{}", eastSide, northSide, thetaDegrees,
              projectedWidth, projectedHeight);
    Preconditions.checkState(projectedWidth > 0 && projectedHeight > 0,
                             "Unable to determine the projected size (%sx%s), set it manually", projectedWidth,
                             projectedHeight);
  }

  /**
   * Overrides the automatically determined output size.
   */
  public void setProjectedSize(int width, int height) {
    Preconditions.checkArgument(width > 0 && height > 0, "Projected size must be positive, found %sx%s", width,
                                height);
    projectedWidth = width;
    projectedHeight = height;
  }

  /**
   * Shrinks the output so neither side exceeds the given length, keeping the aspect ratio. Only the larger side is
   * clamped, the other is scaled by the same ratio.
   */
  public void setMaxSideLength(int maxSideLength) {
    Preconditions.checkArgument(maxSideLength > 0, "Max side length must be positive, found %s", maxSideLength);
    if (projectedWidth >= projectedHeight && projectedWidth > maxSideLength) {
      projectedHeight = round(projectedHeight * ((double) maxSideLength / projectedWidth));
      projectedWidth = maxSideLength;
    } else if (projectedHeight > projectedWidth && projectedHeight > maxSideLength) {
      projectedWidth = round(projectedWidth * ((double) maxSideLength / projectedHeight));
      projectedHeight = maxSideLength;
    }
    projectedWidth = Math.max(projectedWidth, 1);
    projectedHeight = Math.max(projectedHeight, 1);
  }

  /**
   * Builds a border mask of the given RGBA colour over the internal copy of the image.
   *
   * @see Mask#createMask(PixelBuffer, Color)
   */
  public PixelBuffer createMask(Color maskedColor) {
    checkNotWarped();
    return Mask.createMask(image, maskedColor);
  }

  /**
   * Replaces the alpha channel of the internal copy of the image with the single channel mask.
   */
  public void applyMask(PixelBuffer mask) {
    checkNotWarped();
    Mask.setAlphaChannelFromMask(mask, image);
  }

  /**
   * Resamples the image onto the equirectangular grid by nearest neighbour. Output pixels whose sky position falls
   * outside the source image get the background colour.
   *
   * @return the warped RGBA image
   * @throws IllegalStateException if the image was already warped
   */
  public PixelBuffer warpImage() {
    checkNotWarped();
    log.info("Warping {}x{} image to {}x{}", inputWidth, inputHeight, projectedWidth, projectedHeight);
    PixelBuffer warped = PixelBuffer.allocate(projectedWidth, projectedHeight, Colorspace.RGBA);
    double[] ra = boundingBox.getMonotonicRaBounds();
    double[] dec = boundingBox.getDecBounds();
    double xScale = scale(ra, projectedWidth);
    double yScale = scale(dec, projectedHeight);

    for (int i = 0; i < projectedWidth; i++) {
      double outputRa = WrapAround.restoreWrapAround(ra[1] - i * xScale);
      for (int j = 0; j < projectedHeight; j++) {
        PixelCoordinate pixel = projection.toPixel(outputRa, dec[1] - j * yScale);
        if (!pixel.isInside()) {
          warped.setPixel(i, j, backgroundColor);
          continue;
        }

        // the WCS has (1, 1) at the centre of the first pixel
        double x = pixel.getX() - 1.0;
        double y = inputImageOrigin == ImageOrigin.LOWER_LEFT ? inputHeight - pixel.getY() : pixel.getY() - 1.0;
        int m = Math.max(0, Math.min(round(x), inputWidth - 1));
        int n = Math.max(0, Math.min(round(y), inputHeight - 1));
        warped.copyPixel(image, m, n, i, j);
      }
    }

    image = null;
    return warped;
  }

  /**
   * The sky position sampled for a pixel of the warped image, with ra in [0, 360). Right ascension falls linearly
   * from the maximum at the left and declination from the maximum at the top.
   */
  public SkyCoordinate getOutputCoordinate(int i, int j) {
    double[] ra = boundingBox.getMonotonicRaBounds();
    double[] dec = boundingBox.getDecBounds();
    return new SkyCoordinate(WrapAround.restoreWrapAround(ra[1] - i * scale(ra, projectedWidth)),
                             dec[1] - j * scale(dec, projectedHeight));
  }

  // degrees per output pixel, the bounds falling on the centres of the first and last pixels
  private static double scale(double[] bounds, int pixels) {
    return pixels > 1 ? (bounds[1] - bounds[0]) / (pixels - 1) : 0;
  }

  /**
   * Creates the six lines of an ESRI world file for the warped image: the pixel sizes, which are negative since
   * ra and dec fall away from the upper left corner, and the centre of the upper left pixel in -180..180.
   */
  public String createWorldFile() {
    double[] monotonic = boundingBox.getMonotonicRaBounds();
    double[] wrapped = boundingBox.getWrappedRaBounds();
    double[] dec = boundingBox.getDecBounds();
    double raPixelScale = (monotonic[1] - monotonic[0]) / projectedWidth;
    double decPixelScale = (dec[1] - dec[0]) / projectedHeight;

    StringBuilder world = new StringBuilder();
    for (double value : new double[] {-raPixelScale, 0.0, 0.0, -decPixelScale, wrapped[1] - 180.0, dec[1]}) {
      world.append(String.format(Locale.ROOT, "%.14f\n", value));
    }
    return world.toString();
  }

  public void writeWorldFile(File file) throws IOException {
    log.info("Writing world file to {}", file);
    Files.asCharSink(file, StandardCharsets.US_ASCII).write(createWorldFile());
  }

  private void checkNotWarped() {
    Preconditions.checkState(image != null, "The image has already been warped");
  }

  public BoundingBox getBoundingBox() {
    return boundingBox;
  }

  public WcsProjection getProjection() {
    return projection;
  }

  public Color getBackgroundColor() {
    return backgroundColor;
  }

  /**
   * @param backgroundColor RGBA colour for output pixels outside the source image, or an RGB one taken as opaque
   */
  public void setBackgroundColor(Color backgroundColor) {
    this.backgroundColor = backgroundColor.withOpaqueAlpha(Colorspace.RGBA);
  }

  public ImageOrigin getInputImageOrigin() {
    return inputImageOrigin;
  }

  public void setInputImageOrigin(ImageOrigin inputImageOrigin) {
    this.inputImageOrigin = Preconditions.checkNotNull(inputImageOrigin);
  }

  public int getProjectedWidth() {
    return projectedWidth;
  }

  public int getProjectedHeight() {
    return projectedHeight;
  }

  public int getInputWidth() {
    return inputWidth;
  }

  public int getInputHeight() {
    return inputHeight;
  }
}
