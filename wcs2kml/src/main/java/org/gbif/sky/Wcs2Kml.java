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
package org.gbif.sky;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import org.gbif.sky.common.image.Color;
import org.gbif.sky.common.image.Colorspace;
import org.gbif.sky.common.image.PixelBuffer;
import org.gbif.sky.common.image.PngCodec;
import org.gbif.sky.common.kml.GroundOverlays;
import org.gbif.sky.common.kml.KmlWriter;
import org.gbif.sky.common.projection.BoundingBox;
import org.gbif.sky.common.projection.FitsHeader;
import org.gbif.sky.common.projection.ImageOrigin;
import org.gbif.sky.common.projection.SkyProjection;
import org.gbif.sky.common.projection.TanProjection;
import org.gbif.sky.common.regionator.Regionator;
import org.gbif.sky.common.regionator.TileRecord;
import org.gbif.sky.config.TilerConfiguration;

import com.beust.jcommander.JCommander;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;

import lombok.extern.slf4j.Slf4j;

/**
 * Warps an image with a FITS world coordinate system onto the sky and writes it as KML, either as a single ground
 * overlay or regionated into a pyramid of tiles.
 * Usage: wcs2kml --imagefile image.png --fitsfile image.fits [--regionate] ...
 */
@Slf4j
public class Wcs2Kml {
  static final String DEFAULT_CONFIG = "/wcs2kml.yml";

  private final Wcs2KmlArgs args;
  private final TilerConfiguration config;

  public Wcs2Kml(Wcs2KmlArgs args, TilerConfiguration config) {
    this.args = args;
    this.config = config;
  }

  public static void main(String[] argv) throws IOException {
    Wcs2KmlArgs args = new Wcs2KmlArgs();
    JCommander commander = JCommander.newBuilder().addObject(args).programName("wcs2kml").build();
    commander.parse(argv);
    if (args.isHelp()) {
      commander.usage();
      return;
    }

    TilerConfiguration config = args.getConf() == null
      ? TilerConfiguration.build(DEFAULT_CONFIG)
      : TilerConfiguration.fromFile(new File(args.getConf()));
    try {
      new Wcs2Kml(args, config).run();
    } catch (IOException e) {
      log.error("Unable to read or write files converting {}", args.getImageFile());
      throw e; // deliberate log and throw to keep logs together
    } catch (IllegalArgumentException | IllegalStateException e) {
      log.error("Unable to convert {}: {}", args.getImageFile(), e.getMessage());
      throw e;
    }
  }

  /**
   * Runs the whole conversion.
   *
   * @return the root tile when regionating, null otherwise
   * @throws IOException if an input cannot be read or an output cannot be written
   * @throws IllegalArgumentException if the inputs are unusable, e.g. a header without a tangent plane WCS
   */
  public TileRecord run() throws IOException {
    log.info("Reading image {}", args.getImageFile());
    PixelBuffer image = PngCodec.read(new File(args.getImageFile()));

    log.info("Reading WCS from {}", args.getFitsFile());
    FitsHeader header = FitsHeader.read(new File(args.getFitsFile()));
    TanProjection wcs = TanProjection.fromHeader(header, image.getWidth(), image.getHeight());

    SkyProjection projection = new SkyProjection(image, wcs);
    projection.setBackgroundColor(Color.parse(config.getBackgroundColor()));
    logBoundingBox(projection.getBoundingBox());

    boolean upperLeft = args.isInputImageOriginIsUpperLeft() || config.isInputImageOriginUpperLeft();
    projection.setInputImageOrigin(upperLeft ? ImageOrigin.UPPER_LEFT : ImageOrigin.LOWER_LEFT);

    // the automatic size struggles with extreme warping and rotations near multiples of 90 degrees
    if (args.getOutputWidth() > 0 && args.getOutputHeight() > 0) {
      projection.setProjectedSize(args.getOutputWidth(), args.getOutputHeight());
    }
    if (args.isCopyInputSize()) {
      projection.setProjectedSize(image.getWidth(), image.getHeight());
    }
    projection.setMaxSideLength(MoreObjects.firstNonNull(args.getMaxSideLength(), config.getMaxSideLength()));
    log.info("Projected image size will be {}x{}", projection.getProjectedWidth(), projection.getProjectedHeight());

    applyMask(projection);

    PixelBuffer warped = projection.warpImage();

    TileRecord root = null;
    File kmlFile = new File(MoreObjects.firstNonNull(args.getKmlFile(), config.getKmlFile()));
    if (!args.isRegionate()) {
      File outFile = new File(MoreObjects.firstNonNull(args.getOutFile(), config.getOutFile()));
      log.info("Writing warped image to {}", outFile);
      PngCodec.write(warped, outFile);

      log.info("Writing KML to {}", kmlFile);
      String name = MoreObjects.firstNonNull(args.getGroundOverlayName(), config.getGroundOverlayName());
      KmlWriter.write(GroundOverlays.document(projection.getBoundingBox(), outFile.getName(), name), kmlFile);
    } else {
      root = regionator(warped, projection.getBoundingBox(), kmlFile).regionate();
    }

    if (args.getWldFile() != null) {
      projection.writeWorldFile(new File(args.getWldFile()));
    }
    log.info("All done");
    return root;
  }

  private void applyMask(SkyProjection projection) throws IOException {
    if (args.isAutomask()) {
      Color masked = Color.of(args.getAutomaskRed(), args.getAutomaskGreen(), args.getAutomaskBlue())
        .withOpaqueAlpha(Colorspace.RGBA);
      log.info("Using automasking for color {}", masked);
      Color background = projection.getBackgroundColor();
      if (background.getChannel(Colorspace.RGBA.getAlphaChannel()) != 0 && background.equalsIgnoringAlpha(masked)) {
        log.warn("Background {} has the automask color, masked borders will be transparent but the area outside "
                 + "the image will not", background);
      }
      PixelBuffer mask = projection.createMask(masked);
      projection.applyMask(mask);

      File maskFile = new File(MoreObjects.firstNonNull(args.getAutomaskFile(), config.getAutomaskFile()) + ".png");
      log.info("Writing mask to {}", maskFile);
      PngCodec.write(mask, maskFile);
    } else if (args.getMaskFile() != null) {
      log.info("Using masking from {}", args.getMaskFile());
      PixelBuffer mask = PngCodec.read(new File(args.getMaskFile())).convertTo(Colorspace.GRAYSCALE);
      projection.applyMask(mask);
    }
  }

  @VisibleForTesting
  Regionator regionator(PixelBuffer warped, BoundingBox boundingBox, File rootKml) {
    TilerConfiguration.RegionateConfiguration defaults = config.getRegionate();
    Regionator regionator = new Regionator(warped, boundingBox);
    regionator.setMaxTileSideLength(MoreObjects.firstNonNull(args.getRegionateTileSize(), defaults.getTileSize()));
    regionator.setFilenamePrefix(MoreObjects.firstNonNull(args.getRegionatePrefix(), defaults.getPrefix()));
    regionator.setOutputDirectory(new File(MoreObjects.firstNonNull(args.getRegionateDir(),
                                                                    defaults.getDirectory())));
    regionator.setRootKml(rootKml);
    regionator.setMinLodPixels(MoreObjects.firstNonNull(args.getRegionateMinLodPixels(),
                                                        defaults.getMinLodPixels()));
    regionator.setMaxLodPixels(MoreObjects.firstNonNull(args.getRegionateMaxLodPixels(),
                                                        defaults.getMaxLodPixels()));
    regionator.setTopLevelDrawOrder(MoreObjects.firstNonNull(args.getRegionateTopLevelDrawOrder(),
                                                             defaults.getTopLevelDrawOrder()));
    regionator.setDrawTileBorders(args.isRegionateDrawTileBorders() || defaults.isDrawTileBorders());
    log.info("Regionating into {}, root KML {}", regionator.getOutputDirectory(), rootKml);
    return regionator;
  }

  private static void logBoundingBox(BoundingBox box) {
    double[] ra = box.getWrappedRaBounds();
    double[] dec = box.getDecBounds();
    log.info("Wraps around in ra: {}, crosses the north pole: {}, crosses the south pole: {}", box.isWrapped(),
             box.isCrossesNorthPole(), box.isCrossesSouthPole());
    log.info("Range in ra is {} to {}", degrees(ra[0]), degrees(ra[1]));
    log.info("Range in dec is {} to {}", degrees(dec[0]), degrees(dec[1]));
  }

  private static String degrees(double value) {
    return String.format(Locale.ROOT, "%.8f", value);
  }
}
