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
package org.gbif.sky.common.image;

import com.google.common.base.Preconditions;

/**
 * Builds opacity masks for the blank borders that surround many scanned and mosaicked images.
 */
public final class Mask {
  public static final int OPAQUE = 255;
  public static final int MASKED = 0;

  private Mask() {}

  /**
   * Creates a {@link Colorspace#GRAYSCALE} mask, {@value #OPAQUE} everywhere except for the runs of the given colour
   * that touch the border, which are {@value #MASKED}. The runs are found scanning inwards from each of the four
   * edges along rows and columns, stopping at the first pixel of another colour.
   *
   * @param maskedColor colour to mask, with as many channels as the image
   */
  public static PixelBuffer createMask(PixelBuffer image, Color maskedColor) {
    Preconditions.checkArgument(maskedColor.getChannels() == image.getChannels(),
                                "Mask color should have %s channels (has %s)", image.getChannels(),
                                maskedColor.getChannels());
    int width = image.getWidth();
    int height = image.getHeight();
    PixelBuffer mask = PixelBuffer.allocate(width, height, Colorspace.GRAYSCALE);
    mask.fillChannel(0, OPAQUE);

    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width && matches(image, x, y, maskedColor); x++) {
        mask.setValue(x, y, 0, MASKED);
      }
      for (int x = width - 1; x >= 0 && matches(image, x, y, maskedColor); x--) {
        mask.setValue(x, y, 0, MASKED);
      }
    }
    for (int x = 0; x < width; x++) {
      for (int y = 0; y < height && matches(image, x, y, maskedColor); y++) {
        mask.setValue(x, y, 0, MASKED);
      }
      for (int y = height - 1; y >= 0 && matches(image, x, y, maskedColor); y--) {
        mask.setValue(x, y, 0, MASKED);
      }
    }
    return mask;
  }

  private static boolean matches(PixelBuffer image, int x, int y, Color color) {
    for (int c = 0; c < color.getChannels(); c++) {
      if (image.getValue(x, y, c) != color.getChannel(c)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Copies a single channel mask into the alpha channel of the image.
   *
   * @throws IllegalArgumentException if the sizes differ, the mask has several channels or the image has no alpha
   */
  public static void setAlphaChannelFromMask(PixelBuffer mask, PixelBuffer image) {
    Preconditions.checkArgument(mask.getWidth() == image.getWidth() && mask.getHeight() == image.getHeight(),
                                "Mask is %sx%s but the image is %sx%s", mask.getWidth(), mask.getHeight(),
                                image.getWidth(), image.getHeight());
    Preconditions.checkArgument(mask.getChannels() == 1, "Mask must have a single channel, found %s",
                                mask.getColorspace());
    Preconditions.checkArgument(image.getColorspace().hasAlpha(), "No alpha channel in %s image",
                                image.getColorspace());
    int alpha = image.getColorspace().getAlphaChannel();
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        image.setValue(x, y, alpha, mask.getValue(x, y, 0));
      }
    }
  }
}
