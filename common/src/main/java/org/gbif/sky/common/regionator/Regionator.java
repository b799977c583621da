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
package org.gbif.sky.common.regionator;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.gbif.sky.common.image.Color;
import org.gbif.sky.common.image.Colorspace;
import org.gbif.sky.common.image.PixelBuffer;
import org.gbif.sky.common.image.PngCodec;
import org.gbif.sky.common.kml.Document;
import org.gbif.sky.common.kml.GroundOverlay;
import org.gbif.sky.common.kml.Icon;
import org.gbif.sky.common.kml.Kml;
import org.gbif.sky.common.kml.KmlWriter;
import org.gbif.sky.common.kml.LatLonAltBox;
import org.gbif.sky.common.kml.LatLonBox;
import org.gbif.sky.common.kml.LineString;
import org.gbif.sky.common.kml.Link;
import org.gbif.sky.common.kml.Lod;
import org.gbif.sky.common.kml.NetworkLink;
import org.gbif.sky.common.kml.Placemark;
import org.gbif.sky.common.kml.Region;
import org.gbif.sky.common.projection.BoundingBox;
import org.gbif.sky.common.projection.SkyRectangle;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.extern.slf4j.Slf4j;

/**
 * Cuts a warped image into a quadtree of tiles, each with a KML document that loads its four children through
 * network links once the viewer zooms in far enough. This lets the viewer load large images progressively.
 * <p>
 * The image is padded with transparency to a multiple of the tile size. A tile whose rectangle spans one tile of
 * pixels or less, or that is entirely transparent, is a leaf. Adjacent quadrants share their boundary row or
 * column of pixels.
 * <p>
 * Tiles are written depth first on the calling thread. This class is not threadsafe.
 */
@Slf4j
public class Regionator {
  public static final int DEFAULT_TILE_SIZE = 256;
  // a tile shows from half its size on screen, so it is never stretched
  public static final int DEFAULT_MIN_LOD_PIXELS = 128;
  public static final int DEFAULT_MAX_LOD_PIXELS = -1;

  private static final int OPAQUE = 255;

  private final PixelBuffer image;
  private final double raUpperLeft;
  private final double decUpperLeft;
  private final double raPixelScale;
  private final double decPixelScale;

  private int xTileSize;
  private int yTileSize;
  private File outputDirectory = new File("tiles");
  private String filenamePrefix = "tile";
  private File rootKml = new File("root.kml");
  private int minLodPixels = DEFAULT_MIN_LOD_PIXELS;
  private int maxLodPixels = DEFAULT_MAX_LOD_PIXELS;
  private int topLevelDrawOrder = 0;
  private boolean drawTileBorders = false;

  /**
   * @param image the warped RGBA image
   * @param boundingBox the bounding box the image was warped over
   */
  public Regionator(PixelBuffer image, BoundingBox boundingBox) {
    Preconditions.checkArgument(image.getWidth() > 1 && image.getHeight() > 1,
                                "Image must be larger than 1x1 pixels, found %sx%s", image.getWidth(),
                                image.getHeight());
    Preconditions.checkArgument(image.getColorspace() == Colorspace.RGBA, "Image must be RGBA, found %s",
                                image.getColorspace());
    this.image = image;

    // pixel (0, 0) is at ra max and dec max, so both scales are negative
    double[] ra = boundingBox.getMonotonicRaBounds();
    double[] dec = boundingBox.getDecBounds();
    this.raUpperLeft = ra[1];
    this.decUpperLeft = dec[1];
    this.raPixelScale = (ra[0] - ra[1]) / (image.getWidth() - 1);
    this.decPixelScale = (dec[0] - dec[1]) / (image.getHeight() - 1);

    setMaxTileSideLength(DEFAULT_TILE_SIZE);
  }

  /**
   * Sets the tile size so its longer side is the given length, keeping the aspect ratio of the image.
   */
  public void setMaxTileSideLength(int sideLength) {
    Preconditions.checkArgument(sideLength > 0, "Tile side length must be positive, found %s", sideLength);
    double aspectRatio = (double) image.getWidth() / image.getHeight();
    if (image.getWidth() > image.getHeight()) {
      xTileSize = sideLength;
      yTileSize = Math.max(1, (int) (sideLength / aspectRatio + 0.5));
    } else {
      xTileSize = Math.max(1, (int) (sideLength * aspectRatio + 0.5));
      yTileSize = sideLength;
    }
  }

  @VisibleForTesting
  static int pad(int size, int blockSize) {
    return (blockSize - size % blockSize) % blockSize;
  }

  /**
   * Writes the tiles, their KML documents and the root KML document.
   *
   * @return the root of the written tree
   * @throws IOException if the output directory cannot be created or any file cannot be written
   */
  public TileRecord regionate() throws IOException {
    Path directory = outputDirectory.toPath();
    if (!Files.isDirectory(directory)) {
      log.info("Creating output directory {}", directory);
      Files.createDirectories(directory);
    }

    int paddedWidth = image.getWidth() + pad(image.getWidth(), xTileSize);
    int paddedHeight = image.getHeight() + pad(image.getHeight(), yTileSize);
    log.info("Regionating {}x{} image, padded to {}x{}, into {}x{} tiles in {}", image.getWidth(),
             image.getHeight(), paddedWidth, paddedHeight, xTileSize, yTileSize, directory);

    TileRecord root = splitTileRecursively(0, 0, 0, paddedWidth - 1, paddedHeight - 1);

    // the top tile is always visible and lives below the root document
    NetworkLink topLink = makeNetworkLink(0, 0, paddedWidth - 1, paddedHeight - 1);
    NetworkLink rootLink = topLink.toBuilder()
      .region(Region.builder().latLonAltBox(topLink.getRegion().getLatLonAltBox()).lod(Lod.ALWAYS_VISIBLE).build())
      .link(new Link(rootHref(topLink.getLink().getHref())))
      .build();
    KmlWriter.write(Kml.of(Document.builder().networkLink(rootLink).build()), rootKml);

    log.info("Wrote {} tiles and root KML {}", root.size(), rootKml);
    return root;
  }

  /**
   * The link from the root document to a tile document, relative to the directory of the root document.
   */
  private String rootHref(String tileKml) {
    Path rootDirectory = rootKml.getAbsoluteFile().toPath().normalize().getParent();
    Path tiles = outputDirectory.getAbsoluteFile().toPath().normalize();
    String relative = rootDirectory == null ? tiles.toString() : rootDirectory.relativize(tiles).toString();
    relative = relative.replace(File.separatorChar, '/');
    return relative.isEmpty() ? tileKml : relative + "/" + tileKml;
  }

  private TileRecord splitTileRecursively(int level, int x1, int y1, int x2, int y2) throws IOException {
    Preconditions.checkArgument(x2 > x1 && y2 > y1, "Empty tile rectangle (%s, %s, %s, %s)", x1, y1, x2, y2);

    // point sample the rectangle, the viewer applies its own filtering
    PixelBuffer tile = PixelBuffer.allocate(xTileSize, yTileSize, Colorspace.RGBA);
    double dx = xTileSize > 1 ? (double) (x2 - x1) / (xTileSize - 1) : 0;
    double dy = yTileSize > 1 ? (double) (y2 - y1) / (yTileSize - 1) : 0;
    boolean transparent = true;
    boolean opaque = true;
    for (int i = 0; i < xTileSize; i++) {
      int x = Math.min((int) (x1 + i * dx + 0.5), x2);
      for (int j = 0; j < yTileSize; j++) {
        int y = Math.min((int) (y1 + j * dy + 0.5), y2);
        if (x >= image.getWidth() || y >= image.getHeight()) {
          tile.setPixel(i, j, Color.TRANSPARENT);
          opaque = false;
        } else {
          tile.copyPixel(image, x, y, i, j);
          int alpha = image.getValue(x, y, 3);
          transparent &= alpha == 0;
          opaque &= alpha == OPAQUE;
        }
      }
    }

    String prefix = makeFilenamePrefix(x1, y1, x2, y2);
    String filename = prefix + ".png";
    String kmlFilename = prefix + ".kml";
    PngCodec.write(opaque ? tile.convertTo(Colorspace.RGB) : tile, new File(outputDirectory, filename));
    log.debug("Wrote tile {} at level {}", filename, level);

    SkyRectangle extent = computeExtent(x1, y1, x2, y2);
    Lod lod = level == 0 ? Lod.ALWAYS_VISIBLE : new Lod(minLodPixels, maxLodPixels);
    Document.DocumentBuilder kml = Document.builder()
      .region(Region.builder().latLonAltBox(LatLonAltBox.of(extent)).lod(lod).build())
      .groundOverlay(GroundOverlay.builder()
                       .drawOrder(level + topLevelDrawOrder)
                       .icon(new Icon(filename))
                       .latLonBox(LatLonBox.of(extent))
                       .build());

    if (drawTileBorders) {
      kml.placemark(Placemark.builder()
                      .lineString(LineString.of(extent.getEast(), extent.getNorth(),
                                                extent.getWest(), extent.getNorth(),
                                                extent.getWest(), extent.getSouth(),
                                                extent.getEast(), extent.getSouth(),
                                                extent.getEast(), extent.getNorth()))
                      .build());
    }

    List<TileRecord> children = ImmutableList.of();
    // x2 - x1 rather than the true width x2 - x1 + 1 since quadrants overlap by a pixel
    if (x2 - x1 > xTileSize && y2 - y1 > yTileSize && !transparent) {
      int xMid = (x1 + x2) / 2;
      int yMid = (y1 + y2) / 2;
      kml.networkLink(makeNetworkLink(x1, y1, xMid, yMid))
        .networkLink(makeNetworkLink(xMid, y1, x2, yMid))
        .networkLink(makeNetworkLink(x1, yMid, xMid, y2))
        .networkLink(makeNetworkLink(xMid, yMid, x2, y2));

      children = ImmutableList.of(
        splitTileRecursively(level + 1, x1, y1, xMid, yMid),
        splitTileRecursively(level + 1, xMid, y1, x2, yMid),
        splitTileRecursively(level + 1, x1, yMid, xMid, y2),
        splitTileRecursively(level + 1, xMid, yMid, x2, y2));
    }

    KmlWriter.write(Kml.of(kml.build()), new File(outputDirectory, kmlFilename));
    return new TileRecord(prefix, x1, y1, x2, y2, level, extent, transparent, opaque, children);
  }

  private NetworkLink makeNetworkLink(int x1, int y1, int x2, int y2) {
    Region region = Region.builder()
      .latLonAltBox(LatLonAltBox.of(computeExtent(x1, y1, x2, y2)))
      .lod(new Lod(minLodPixels, maxLodPixels))
      .build();
    return NetworkLink.builder()
      .region(region)
      .link(new Link(makeFilenamePrefix(x1, y1, x2, y2) + ".kml"))
      .build();
  }

  @VisibleForTesting
  String makeFilenamePrefix(int x1, int y1, int x2, int y2) {
    return String.format("%s_%d_%d_%d_%d", filenamePrefix, x1, y1, x2, y2);
  }

  /**
   * The sky footprint of a pixel rectangle, from the linear mapping of the warped grid.
   */
  @VisibleForTesting
  SkyRectangle computeExtent(int x1, int y1, int x2, int y2) {
    double north = decUpperLeft + y1 * decPixelScale;
    double south = decUpperLeft + y2 * decPixelScale;
    double ra1 = raUpperLeft + x1 * raPixelScale;
    double ra2 = raUpperLeft + x2 * raPixelScale;
    return SkyRectangle.fromRaDec(ra1, ra2, north, south);
  }

  public int getXTileSize() {
    return xTileSize;
  }

  public int getYTileSize() {
    return yTileSize;
  }

  public File getOutputDirectory() {
    return outputDirectory;
  }

  public void setOutputDirectory(File outputDirectory) {
    this.outputDirectory = Preconditions.checkNotNull(outputDirectory);
  }

  public String getFilenamePrefix() {
    return filenamePrefix;
  }

  public void setFilenamePrefix(String filenamePrefix) {
    Preconditions.checkArgument(filenamePrefix != null && !filenamePrefix.isEmpty(), "Prefix cannot be empty");
    this.filenamePrefix = filenamePrefix;
  }

  public File getRootKml() {
    return rootKml;
  }

  public void setRootKml(File rootKml) {
    this.rootKml = Preconditions.checkNotNull(rootKml);
  }

  public int getMinLodPixels() {
    return minLodPixels;
  }

  public void setMinLodPixels(int minLodPixels) {
    this.minLodPixels = minLodPixels;
  }

  public int getMaxLodPixels() {
    return maxLodPixels;
  }

  public void setMaxLodPixels(int maxLodPixels) {
    this.maxLodPixels = maxLodPixels;
  }

  public int getTopLevelDrawOrder() {
    return topLevelDrawOrder;
  }

  public void setTopLevelDrawOrder(int topLevelDrawOrder) {
    this.topLevelDrawOrder = topLevelDrawOrder;
  }

  public boolean isDrawTileBorders() {
    return drawTileBorders;
  }

  public void setDrawTileBorders(boolean drawTileBorders) {
    this.drawTileBorders = drawTileBorders;
  }
}
