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

/**
 * The channel layouts of a {@link PixelBuffer}. Alpha, when present, is always the last channel.
 */
public enum Colorspace {
  GRAYSCALE(1, false),
  GRAYSCALE_PLUS_ALPHA(2, true),
  RGB(3, false),
  RGBA(4, true);

  private final int channels;
  private final boolean alpha;

  Colorspace(int channels, boolean alpha) {
    this.channels = channels;
    this.alpha = alpha;
  }

  public int getChannels() {
    return channels;
  }

  public boolean hasAlpha() {
    return alpha;
  }

  /**
   * @return the index of the alpha channel
   * @throws IllegalStateException if there is no alpha channel
   */
  public int getAlphaChannel() {
    if (!alpha) {
      throw new IllegalStateException(this + " has no alpha channel");
    }
    return channels - 1;
  }

  public boolean isGrayscale() {
    return channels <= 2;
  }

  public static Colorspace forChannels(int channels) {
    for (Colorspace colorspace : values()) {
      if (colorspace.channels == channels) {
        return colorspace;
      }
    }
    throw new IllegalArgumentException("No colorspace has " + channels + " channels");
  }
}
