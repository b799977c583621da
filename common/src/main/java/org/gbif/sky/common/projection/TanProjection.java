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

import lombok.extern.slf4j.Slf4j;

/**
 * The gnomonic (tangent plane) projection of the FITS world coordinate system, i.e. {@code RA---TAN} and
 * {@code DEC--TAN}, which is what the vast majority of optical survey images use.
 * <p>
 * Pixels are mapped to intermediate world coordinates through the CD matrix relative to the reference pixel, and
 * those are deprojected from the plane tangent to the sky at the reference value.
 * <p>
 * This class is threadsafe.
 */
@Slf4j
public class TanProjection implements WcsProjection {
  private static final String TAN = "-TAN";

  private final int width;
  private final int height;
  private final double crpix1;
  private final double crpix2;
  private final double ra0;
  private final double sinDec0;
  private final double cosDec0;
  private final double cd11;
  private final double cd12;
  private final double cd21;
  private final double cd22;
  private final double determinant;

  /**
   * @param width image width in pixels
   * @param height image height in pixels
   * @param crpix1 reference pixel x (1-based)
   * @param crpix2 reference pixel y (1-based)
   * @param crval1 right ascension of the reference pixel in degrees
   * @param crval2 declination of the reference pixel in degrees
   * @param cd CD matrix in degrees per pixel, as {@code {{CD1_1, CD1_2}, {CD2_1, CD2_2}}}
   */
  public TanProjection(int width, int height, double crpix1, double crpix2, double crval1, double crval2,
                       double[][] cd) {
    Preconditions.checkArgument(width > 0 && height > 0, "Image dimensions must be positive: %sx%s", width, height);
    Preconditions.checkArgument(cd.length == 2 && cd[0].length == 2 && cd[1].length == 2, "CD matrix must be 2x2");
    Preconditions.checkArgument(crval2 >= -90 && crval2 <= 90, "Reference declination out of range: %s", crval2);
    this.width = width;
    this.height = height;
    this.crpix1 = crpix1;
    this.crpix2 = crpix2;
    this.ra0 = crval1;
    this.sinDec0 = Math.sin(Math.toRadians(crval2));
    this.cosDec0 = Math.cos(Math.toRadians(crval2));
    this.cd11 = cd[0][0];
    this.cd12 = cd[0][1];
    this.cd21 = cd[1][0];
    this.cd22 = cd[1][1];
    this.determinant = cd11 * cd22 - cd12 * cd21;
    Preconditions.checkArgument(determinant != 0 && Double.isFinite(determinant), "CD matrix is singular");
  }

  /**
   * Builds the projection from a FITS header describing an image of the given size.
   *
   * @throws IllegalArgumentException if the header lacks a usable tangent plane WCS or disagrees with the image size
   */
  public static TanProjection fromHeader(FitsHeader header, int width, int height) {
    header.checkWcs();
    String ctype1 = header.getString("CTYPE1");
    String ctype2 = header.getString("CTYPE2");
    Preconditions.checkArgument(ctype1.startsWith("RA") && ctype1.endsWith(TAN),
                                "Unsupported projection CTYPE1 = %s", ctype1);
    Preconditions.checkArgument(ctype2.startsWith("DEC") && ctype2.endsWith(TAN),
                                "Unsupported projection CTYPE2 = %s", ctype2);

    if (header.contains("NAXIS1")) {
      int naxis1 = header.getInt("NAXIS1");
      Preconditions.checkArgument(naxis1 == width, "FITS and image widths disagree (FITS = %s, image = %s)",
                                  naxis1, width);
    }
    if (header.contains("NAXIS2")) {
      int naxis2 = header.getInt("NAXIS2");
      Preconditions.checkArgument(naxis2 == height, "FITS and image heights disagree (FITS = %s, image = %s)",
                                  naxis2, height);
    }

    double[][] cd;
    if (header.hasCdMatrix()) {
      cd = new double[][] {
        {header.getDouble("CD1_1"), header.getDouble("CD1_2")},
        {header.getDouble("CD2_1"), header.getDouble("CD2_2")}
      };
    } else {
      double cdelt1 = header.getDouble("CDELT1");
      double cdelt2 = header.getDouble("CDELT2");
      if (header.contains("PC1_1") || header.contains("PC001001")) {
        boolean modern = header.contains("PC1_1");
        cd = new double[][] {
          {cdelt1 * header.getDouble(modern ? "PC1_1" : "PC001001", 1),
           cdelt1 * header.getDouble(modern ? "PC1_2" : "PC001002", 0)},
          {cdelt2 * header.getDouble(modern ? "PC2_1" : "PC002001", 0),
           cdelt2 * header.getDouble(modern ? "PC2_2" : "PC002002", 1)}
        };
      } else {
        double rotation = Math.toRadians(header.getDouble("CROTA2", 0));
        double cos = Math.cos(rotation);
        double sin = Math.sin(rotation);
        cd = new double[][] {
          {cdelt1 * cos, -cdelt2 * sin},
          {cdelt1 * sin, cdelt2 * cos}
        };
      }
    }
    log.debug("TAN projection with CD matrix [[{}, {}], [{}, {}]]", cd[0][0], cd[0][1], cd[1][0], cd[1][1]);
    return new TanProjection(width, height, header.getDouble("CRPIX1"), header.getDouble("CRPIX2"),
                             header.getDouble("CRVAL1"), header.getDouble("CRVAL2"), cd);
  }

  @Override
  public SkyCoordinate toSky(double x, double y) {
    double dx = x - crpix1;
    double dy = y - crpix2;
    double xi = Math.toRadians(cd11 * dx + cd12 * dy);
    double eta = Math.toRadians(cd21 * dx + cd22 * dy);

    double denominator = cosDec0 - eta * sinDec0;
    double ra = ra0 + Math.toDegrees(Math.atan2(xi, denominator));
    double dec = Math.toDegrees(Math.atan2(eta * cosDec0 + sinDec0, Math.hypot(xi, denominator)));
    return new SkyCoordinate(WrapAround.restoreWrapAround(ra), dec);
  }

  @Override
  public PixelCoordinate toPixel(double ra, double dec) {
    double deltaRa = Math.toRadians(ra - ra0);
    double d = Math.toRadians(dec);
    double sinDec = Math.sin(d);
    double cosDec = Math.cos(d);
    double cosDeltaRa = Math.cos(deltaRa);

    // cosine of the angular distance from the tangent point, the far hemisphere does not project
    double cosDistance = sinDec0 * sinDec + cosDec0 * cosDec * cosDeltaRa;
    if (cosDistance <= 0) {
      return PixelCoordinate.outside();
    }

    double xi = Math.toDegrees(cosDec * Math.sin(deltaRa) / cosDistance);
    double eta = Math.toDegrees((cosDec0 * sinDec - sinDec0 * cosDec * cosDeltaRa) / cosDistance);

    double x = crpix1 + (cd22 * xi - cd12 * eta) / determinant;
    double y = crpix2 + (cd11 * eta - cd21 * xi) / determinant;
    boolean inside = x >= 0.5 && x <= width + 0.5 && y >= 0.5 && y <= height + 0.5;
    return new PixelCoordinate(x, y, inside);
  }

  @Override
  public int getWidth() {
    return width;
  }

  @Override
  public int getHeight() {
    return height;
  }
}
