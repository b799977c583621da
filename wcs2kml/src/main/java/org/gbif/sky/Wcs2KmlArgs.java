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

import com.beust.jcommander.Parameter;

import lombok.Data;

/**
 * Command line flags. Flags left unset fall back to the configuration.
 */
@Data
public class Wcs2KmlArgs {

  @Parameter(names = "--imagefile", description = "Input image, in any format ImageIO reads", required = true)
  private String imageFile;

  @Parameter(names = "--fitsfile", description = "FITS file, or header text, holding the WCS of the image",
             required = true)
  private String fitsFile;

  @Parameter(names = "--conf", description = "Path to a YAML configuration file, the bundled defaults otherwise")
  private String conf;

  @Parameter(names = "--automask", description = "Mask out the border of the image with the automask color")
  private boolean automask;

  @Parameter(names = "--automask-red", description = "Red channel of the color masked with automasking")
  private int automaskRed;

  @Parameter(names = "--automask-green", description = "Green channel of the color masked with automasking")
  private int automaskGreen;

  @Parameter(names = "--automask-blue", description = "Blue channel of the color masked with automasking")
  private int automaskBlue;

  @Parameter(names = "--automaskfile", description = "Prefix of the generated mask image, .png is appended")
  private String automaskFile;

  @Parameter(names = "--maskfile", description = "Mask image, converted to grayscale and used as alpha channel")
  private String maskFile;

  @Parameter(names = "--copy-input-size", description = "Make the warped image as large as the input image")
  private boolean copyInputSize;

  @Parameter(names = "--output-width", description = "Width of the warped image, used with --output-height")
  private int outputWidth = -1;

  @Parameter(names = "--output-height", description = "Height of the warped image, used with --output-width")
  private int outputHeight = -1;

  @Parameter(names = "--max-side-length", description = "Maximum side length of the warped image")
  private Integer maxSideLength;

  @Parameter(names = "--input-image-origin-is-upper-left",
             description = "The first row of the input image is its top, rather than the FITS convention of bottom")
  private boolean inputImageOriginIsUpperLeft;

  @Parameter(names = "--outfile", description = "Warped image to write when not regionating")
  private String outFile;

  @Parameter(names = "--kmlfile", description = "KML document to write, the root document when regionating")
  private String kmlFile;

  @Parameter(names = "--ground-overlay-name", description = "Name of the ground overlay when not regionating")
  private String groundOverlayName;

  @Parameter(names = "--regionate", description = "Cut the warped image into a pyramid of tiles")
  private boolean regionate;

  @Parameter(names = "--regionate-dir", description = "Directory for the tiles")
  private String regionateDir;

  @Parameter(names = "--regionate-prefix", description = "Filename prefix of the tiles")
  private String regionatePrefix;

  @Parameter(names = "--regionate-tile-size", description = "Longest side of a tile")
  private Integer regionateTileSize;

  @Parameter(names = "--regionate-min-lod-pixels", description = "Screen size in pixels at which tiles appear")
  private Integer regionateMinLodPixels;

  @Parameter(names = "--regionate-max-lod-pixels",
             description = "Screen size in pixels at which tiles disappear, -1 for never")
  private Integer regionateMaxLodPixels;

  @Parameter(names = "--regionate-top-level-draw-order", description = "Draw order of the top tile")
  private Integer regionateTopLevelDrawOrder;

  @Parameter(names = "--regionate-draw-tile-borders", description = "Outline every tile")
  private boolean regionateDrawTileBorders;

  @Parameter(names = "--wldfile", description = "World file to write for the warped image")
  private String wldFile;

  @Parameter(names = {"--help", "-h"}, help = true, description = "Show this help")
  private boolean help;
}
