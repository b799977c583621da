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

import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * A raster of 8 bit channels held in a single row-major array, addressed by 0-based (x, y, channel) with
 * (0, 0) the upper left corner. All access is bounds checked.
 * <p>
 * Conversions between colourspaces return new buffers and leave this one untouched.
 * This class is not threadsafe.
 */
public class PixelBuffer {
  private static final int OPAQUE = 255;

  private final int width;
  private final int height;
  private final Colorspace colorspace;
  private final byte[] data;

  private PixelBuffer(int width, int height, Colorspace colorspace, byte[] data) {
    this.width = width;
    this.height = height;
    this.colorspace = colorspace;
    this.data = data;
  }

  /**
   * Allocates a buffer with every channel set to 0.
   *
   * @throws IllegalArgumentException if a dimension is not positive or the buffer would be too large
   */
  public static PixelBuffer allocate(int width, int height, Colorspace colorspace) {
    Preconditions.checkArgument(width > 0 && height > 0, "Dimensions must be positive, found %sx%s", width, height);
    Preconditions.checkNotNull(colorspace, "Colorspace cannot be null");
    int size;
    try {
      size = Math.multiplyExact(Math.multiplyExact(width, height), colorspace.getChannels());
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Image of " + width + "x" + height + " " + colorspace + " is too large", e);
    }
    return new PixelBuffer(width, height, colorspace, new byte[size]);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public Colorspace getColorspace() {
    return colorspace;
  }

  public int getChannels() {
    return colorspace.getChannels();
  }

  private int index(int x, int y, int channel) {
    Preconditions.checkElementIndex(x, width, "x");
    Preconditions.checkElementIndex(y, height, "y");
    Preconditions.checkElementIndex(channel, colorspace.getChannels(), "channel");
    return (y * width + x) * colorspace.getChannels() + channel;
  }

  public int getValue(int x, int y, int channel) {
    return data[index(x, y, channel)] & 0xFF;
  }

  public void setValue(int x, int y, int channel, int value) {
    Preconditions.checkArgument(value >= 0 && value <= 255, "Channel value %s out of range 0..255", value);
    data[index(x, y, channel)] = (byte) value;
  }

  public Color getPixel(int x, int y) {
    int[] values = new int[colorspace.getChannels()];
    int offset = index(x, y, 0);
    for (int c = 0; c < values.length; c++) {
      values[c] = data[offset + c] & 0xFF;
    }
    return Color.of(values);
  }

  public void setPixel(int x, int y, Color color) {
    checkChannels(color);
    int offset = index(x, y, 0);
    for (int c = 0; c < color.getChannels(); c++) {
      data[offset + c] = (byte) color.getChannel(c);
    }
  }

  /**
   * Copies one pixel from a buffer of the same colourspace.
   */
  public void copyPixel(PixelBuffer source, int sourceX, int sourceY, int x, int y) {
    Preconditions.checkArgument(source.colorspace == colorspace, "Cannot copy a %s pixel into a %s image",
                                source.colorspace, colorspace);
    System.arraycopy(source.data, source.index(sourceX, sourceY, 0), data, index(x, y, 0), colorspace.getChannels());
  }

  /**
   * Sets every pixel to the colour.
   */
  public void fill(Color color) {
    checkChannels(color);
    int channels = colorspace.getChannels();
    for (int offset = 0; offset < data.length; offset += channels) {
      for (int c = 0; c < channels; c++) {
        data[offset + c] = (byte) color.getChannel(c);
      }
    }
  }

  /**
   * Sets one channel of every pixel to the value.
   */
  public void fillChannel(int channel, int value) {
    Preconditions.checkElementIndex(channel, colorspace.getChannels(), "channel");
    Preconditions.checkArgument(value >= 0 && value <= 255, "Channel value %s out of range 0..255", value);
    int channels = colorspace.getChannels();
    for (int offset = channel; offset < data.length; offset += channels) {
      data[offset] = (byte) value;
    }
  }

  /**
   * @return true if every pixel has an alpha of 0, which is trivially false without an alpha channel
   */
  public boolean isFullyTransparent() {
    if (!colorspace.hasAlpha()) {
      return false;
    }
    int channels = colorspace.getChannels();
    for (int offset = colorspace.getAlphaChannel(); offset < data.length; offset += channels) {
      if (data[offset] != 0) {
        return false;
      }
    }
    return true;
  }

  public PixelBuffer copy() {
    return new PixelBuffer(width, height, colorspace, data.clone());
  }

  /**
   * Returns a copy of this image in another colourspace. Gray is the truncated mean of red, green and blue, a new
   * alpha channel is fully opaque and a dropped alpha channel is discarded.
   */
  public PixelBuffer convertTo(Colorspace target) {
    Preconditions.checkNotNull(target, "Colorspace cannot be null");
    if (target == colorspace) {
      return copy();
    }

    PixelBuffer converted = allocate(width, height, target);
    int sourceChannels = colorspace.getChannels();
    int targetChannels = target.getChannels();
    for (int i = 0, s = 0, t = 0; i < width * height; i++, s += sourceChannels, t += targetChannels) {
      int alpha = colorspace.hasAlpha() ? data[s + sourceChannels - 1] & 0xFF : OPAQUE;
      int red;
      int green;
      int blue;
      if (colorspace.isGrayscale()) {
        red = data[s] & 0xFF;
        green = red;
        blue = red;
      } else {
        red = data[s] & 0xFF;
        green = data[s + 1] & 0xFF;
        blue = data[s + 2] & 0xFF;
      }

      if (target.isGrayscale()) {
        converted.data[t] = (byte) ((red + green + blue) / 3);
      } else {
        converted.data[t] = (byte) red;
        converted.data[t + 1] = (byte) green;
        converted.data[t + 2] = (byte) blue;
      }
      if (target.hasAlpha()) {
        converted.data[t + targetChannels - 1] = (byte) alpha;
      }
    }
    return converted;
  }

  /**
   * The raw interleaved channels, row by row. This is a copy.
   */
  public byte[] toByteArray() {
    return data.clone();
  }

  /**
   * Wraps a copy of interleaved channel data, as returned by {@link #toByteArray()}.
   */
  @VisibleForTesting
  static PixelBuffer fromByteArray(int width, int height, Colorspace colorspace, byte[] data) {
    PixelBuffer buffer = allocate(width, height, colorspace);
    Preconditions.checkArgument(data.length == buffer.data.length, "Expected %s bytes, found %s",
                                buffer.data.length, data.length);
    System.arraycopy(data, 0, buffer.data, 0, data.length);
    return buffer;
  }

  private void checkChannels(Color color) {
    Preconditions.checkArgument(color.getChannels() == colorspace.getChannels(),
                                "Color has %s channels but the image is %s", color.getChannels(), colorspace);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PixelBuffer that = (PixelBuffer) o;
    return width == that.width && height == that.height && colorspace == that.colorspace
           && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * (31 * width + height) + colorspace.hashCode()) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "PixelBuffer[" + width + "x" + height + " " + colorspace + "]";
  }
}
