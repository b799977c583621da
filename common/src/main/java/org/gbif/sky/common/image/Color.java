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
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import lombok.EqualsAndHashCode;

/**
 * An immutable colour of 1 to 4 channels, each 0..255, laid out as described by {@link Colorspace}.
 */
@EqualsAndHashCode
public final class Color {
  public static final Color TRANSPARENT = of(0, 0, 0, 0);

  private final int[] values;

  private Color(int[] values) {
    this.values = values;
  }

  public static Color of(int... values) {
    Preconditions.checkArgument(values.length >= 1 && values.length <= 4,
                                "Colors have 1 to 4 channels, found %s", values.length);
    for (int value : values) {
      Preconditions.checkArgument(value >= 0 && value <= 255, "Channel value %s out of range 0..255", value);
    }
    return new Color(values.clone());
  }

  /**
   * Parses comma separated channel values, e.g. {@code 0,0,0,255}.
   */
  public static Color parse(String text) {
    List<String> parts = Splitter.on(',').trimResults().splitToList(text);
    int[] values = new int[parts.size()];
    for (int i = 0; i < values.length; i++) {
      try {
        values[i] = Integer.parseInt(parts.get(i));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid color " + text, e);
      }
    }
    return of(values);
  }

  public int getChannels() {
    return values.length;
  }

  public int getChannel(int channel) {
    Preconditions.checkElementIndex(channel, values.length, "channel");
    return values[channel];
  }

  /**
   * Whether the colours agree on every channel but the last, which holds alpha.
   *
   * @throws IllegalArgumentException if the colours have different channel counts
   */
  public boolean equalsIgnoringAlpha(Color other) {
    Preconditions.checkArgument(values.length == other.values.length, "Cannot compare %s with %s", this, other);
    for (int i = 0; i < values.length - 1; i++) {
      if (values[i] != other.values[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a colour of the given layout with one additional opaque alpha channel, if this colour lacks one.
   */
  public Color withOpaqueAlpha(Colorspace colorspace) {
    Preconditions.checkArgument(colorspace.hasAlpha(), "%s has no alpha channel", colorspace);
    if (values.length == colorspace.getChannels()) {
      return this;
    }
    Preconditions.checkArgument(values.length == colorspace.getChannels() - 1,
                                "A %s color cannot be completed to %s", values.length, colorspace);
    int[] completed = Arrays.copyOf(values, values.length + 1);
    completed[values.length] = 255;
    return new Color(completed);
  }

  @Override
  public String toString() {
    return "Color" + Arrays.toString(values);
  }
}
