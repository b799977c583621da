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

import java.io.IOException;

import com.google.common.base.Joiner;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TanProjectionTest {
  private static final double EPSILON = 1e-9;

  // pixel x, pixel y, ra, dec
  private static final double[][] REFERENCE = {
    {1, 1, 211.22294735674018, 4.05902713965908},
    {512, 1, 211.23196153167223, 4.28811486571381},
    {1, 372, 211.38968824884054, 4.05248327187094},
    {512, 372, 211.39875091170057, 4.28156919355767},
    {256, 186, 211.31060308825374, 4.17008771653732}
  };

  @Test
  public void testToSky() throws IOException {
    TanProjection projection = Fixtures.sdssProjection();
    for (double[] reference : REFERENCE) {
      SkyCoordinate sky = projection.toSky(reference[0], reference[1]);
      assertEquals("ra of " + reference[0] + "," + reference[1], reference[2], sky.getRa(), EPSILON);
      assertEquals("dec of " + reference[0] + "," + reference[1], reference[3], sky.getDec(), EPSILON);
    }
  }

  @Test
  public void testToPixel() throws IOException {
    TanProjection projection = Fixtures.sdssProjection();
    for (double[] reference : REFERENCE) {
      PixelCoordinate pixel = projection.toPixel(reference[2], reference[3]);
      assertEquals(reference[0], pixel.getX(), 1e-6);
      assertEquals(reference[1], pixel.getY(), 1e-6);
      assertTrue(pixel.isInside());
    }
  }

  @Test
  public void testOutside() throws IOException {
    TanProjection projection = Fixtures.sdssProjection();
    assertFalse(projection.toPixel(212.23, 67.67).isInside());
    assertFalse(projection.toPixel(154.15, 15.45).isInside());

    // the opposite side of the sky does not project at all
    PixelCoordinate behind = projection.toPixel(31.3, -4.16);
    assertFalse(behind.isInside());
    assertTrue(Double.isNaN(behind.getX()));
    assertTrue(Double.isNaN(behind.getY()));
  }

  @Test
  public void testReferencePixel() {
    double[][] cd = {{-0.001, 0}, {0, 0.001}};
    TanProjection projection = new TanProjection(100, 100, 50.5, 50.5, 359.99, -30, cd);
    SkyCoordinate sky = projection.toSky(50.5, 50.5);
    assertEquals(359.99, sky.getRa(), EPSILON);
    assertEquals(-30, sky.getDec(), EPSILON);

    // crossing ra 0 stays in [0, 360)
    SkyCoordinate left = projection.toSky(1, 50.5);
    assertTrue(left.getRa() >= 0 && left.getRa() < 1);
  }

  @Test
  public void testCdeltAndRotation() {
    FitsHeader header = FitsHeader.parse(Joiner.on('\n').join(
      "NAXIS1  = 100", "NAXIS2  = 80", "CTYPE1  = 'RA---TAN'", "CTYPE2  = 'DEC--TAN'", "EQUINOX = 2000.0",
      "CRPIX1  = 50", "CRPIX2  = 40", "CRVAL1  = 120", "CRVAL2  = 45", "CDELT1  = -0.001", "CDELT2  = 0.001",
      "CROTA2  = 30", "END"));
    TanProjection projection = TanProjection.fromHeader(header, 100, 80);

    double rotation = Math.toRadians(30);
    double[][] cd = {
      {-0.001 * Math.cos(rotation), -0.001 * Math.sin(rotation)},
      {-0.001 * Math.sin(rotation), 0.001 * Math.cos(rotation)}
    };
    TanProjection expected = new TanProjection(100, 80, 50, 40, 120, 45, cd);
    for (double[] pixel : new double[][] {{1, 1}, {100, 1}, {1, 80}, {100, 80}}) {
      SkyCoordinate a = expected.toSky(pixel[0], pixel[1]);
      SkyCoordinate b = projection.toSky(pixel[0], pixel[1]);
      assertEquals(a.getRa(), b.getRa(), EPSILON);
      assertEquals(a.getDec(), b.getDec(), EPSILON);
    }
  }

  @Test
  public void testPcMatrix() {
    FitsHeader header = FitsHeader.parse(Joiner.on('\n').join(
      "CTYPE1  = 'RA---TAN'", "CTYPE2  = 'DEC--TAN'", "EQUINOX = 2000.0", "CRPIX1  = 10", "CRPIX2  = 10",
      "CRVAL1  = 20", "CRVAL2  = 10", "CDELT1  = 0.002", "CDELT2  = 0.001", "PC1_1   = 0", "PC1_2   = 1",
      "PC2_1   = 1", "PC2_2   = 0", "END"));
    TanProjection projection = TanProjection.fromHeader(header, 20, 20);
    TanProjection expected = new TanProjection(20, 20, 10, 10, 20, 10, new double[][] {{0, 0.002}, {0.001, 0}});
    SkyCoordinate a = expected.toSky(1, 20);
    SkyCoordinate b = projection.toSky(1, 20);
    assertEquals(a.getRa(), b.getRa(), EPSILON);
    assertEquals(a.getDec(), b.getDec(), EPSILON);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSizeMismatch() throws IOException {
    TanProjection.fromHeader(Fixtures.sdssHeader(), 372, 512);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedProjection() {
    FitsHeader header = FitsHeader.parse(Joiner.on('\n').join(
      "CTYPE1  = 'RA---SIN'", "CTYPE2  = 'DEC--SIN'", "EQUINOX = 2000.0", "CRPIX1  = 10", "CRPIX2  = 10",
      "CRVAL1  = 20", "CRVAL2  = 10", "CDELT1  = 0.002", "CDELT2  = 0.001", "END"));
    TanProjection.fromHeader(header, 20, 20);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSingularMatrix() {
    new TanProjection(10, 10, 5, 5, 0, 0, new double[][] {{0.001, 0.002}, {0.001, 0.002}});
  }
}
