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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ColorTest {

  @Test
  public void testParse() {
    Color color = Color.parse("1, 2,3");
    assertEquals(3, color.getChannels());
    assertEquals(Color.of(1, 2, 3), color);
    assertEquals(Color.of(0, 0, 0, 0), Color.parse("0,0,0,0"));
    assertEquals(Color.TRANSPARENT, Color.parse("0,0,0,0"));
    assertNotEquals(Color.of(1, 2, 3), Color.of(1, 2, 3, 255));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseNotANumber() {
    Color.parse("1,2,blue");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOutOfRange() {
    Color.of(0, 256, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTooManyChannels() {
    Color.parse("1,2,3,4,5");
  }

  @Test
  public void testWithOpaqueAlpha() {
    assertEquals(Color.of(1, 2, 3, 255), Color.of(1, 2, 3).withOpaqueAlpha(Colorspace.RGBA));
    assertEquals(Color.of(9, 255), Color.of(9).withOpaqueAlpha(Colorspace.GRAYSCALE_PLUS_ALPHA));
    Color rgba = Color.of(1, 2, 3, 4);
    assertSame(rgba, rgba.withOpaqueAlpha(Colorspace.RGBA));
  }

  @Test
  public void testEqualsIgnoringAlpha() {
    Color gray = Color.of(128, 128, 128, 128);
    assertTrue(gray.equalsIgnoringAlpha(Color.of(128, 128, 128, 128)));
    assertTrue(gray.equalsIgnoringAlpha(Color.of(128, 128, 128, 255)));
    assertTrue(Color.of(128, 128, 128, 255).equalsIgnoringAlpha(gray));
    assertFalse(gray.equalsIgnoringAlpha(Color.of(0, 0, 0, 128)));
    assertFalse(gray.equalsIgnoringAlpha(Color.of(128, 128, 127, 127)));
    assertFalse(Color.of(128, 128, 127, 127).equalsIgnoringAlpha(gray));
    assertTrue(Color.of(9, 0).equalsIgnoringAlpha(Color.of(9, 255)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEqualsIgnoringAlphaChannelMismatch() {
    Color.of(1, 2, 3).equalsIgnoringAlpha(Color.of(1, 2, 3, 4));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWithOpaqueAlphaMismatch() {
    Color.of(1).withOpaqueAlpha(Colorspace.RGBA);
  }

  @Test
  public void testColorspace() {
    assertEquals(Colorspace.RGBA, Colorspace.forChannels(4));
    assertEquals(Colorspace.GRAYSCALE_PLUS_ALPHA, Colorspace.forChannels(2));
    assertEquals(3, Colorspace.RGBA.getAlphaChannel());
    assertEquals(1, Colorspace.GRAYSCALE_PLUS_ALPHA.getAlphaChannel());
  }

  @Test(expected = IllegalStateException.class)
  public void testNoAlphaChannel() {
    Colorspace.RGB.getAlphaChannel();
  }
}
