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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class SkyRectangleTest {

  @Test
  public void testFromRaDec() {
    SkyRectangle rectangle = SkyRectangle.fromRaDec(10, 4.89, 5, -0.11);
    assertEquals(5, rectangle.getNorth(), 0);
    assertEquals(-0.11, rectangle.getSouth(), 0);
    assertEquals(-170, rectangle.getEast(), 1e-12);
    assertEquals(-175.11, rectangle.getWest(), 1e-12);

    // argument order of the right ascensions is irrelevant
    assertEquals(rectangle, SkyRectangle.fromRaDec(4.89, 10, 5, -0.11));
  }

  @Test
  public void testFromRaDecAcrossZero() {
    // 355..365 in monotonic form, east wraps to 5 and west has to move below -180
    SkyRectangle rectangle = SkyRectangle.fromRaDec(365, 355, 11, 10);
    assertEquals(-175, rectangle.getEast(), 1e-12);
    assertEquals(-185, rectangle.getWest(), 1e-12);
  }

  @Test
  public void testSkyPointDistances() {
    SkyPoint a = new SkyPoint(10, 20, 1, 1);
    SkyPoint b = new SkyPoint(13, 24, 4, 5);
    assertEquals(5, a.distanceXY(b), 1e-12);
    assertEquals(5, a.distanceRaDec(b), 1e-12);
    assertEquals(0, a.distanceRaDecExact(a), 0);

    // a quarter of a great circle is a chord of sqrt(2)
    assertEquals(Math.sqrt(2), new SkyPoint(0, 0, 0, 0).distanceRaDecExact(new SkyPoint(90, 0, 0, 0)), 1e-12);
  }
}
