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
package org.gbif.sky.config;

import java.io.File;
import java.io.IOException;
import java.net.URL;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Defaults for warping and regionating, read from YAML. Command line flags take precedence over these.
 */
@Data
@Builder
@Jacksonized
@Slf4j
public class TilerConfiguration {

  @Builder.Default
  private int maxSideLength = 10000;
  // RGBA, e.g. "0,0,0,0" for transparent, or RGB for an opaque colour
  @Builder.Default
  private String backgroundColor = "0,0,0,0";
  private boolean inputImageOriginUpperLeft;
  @Builder.Default
  private String outFile = "warped_image.png";
  @Builder.Default
  private String kmlFile = "doc.kml";
  @Builder.Default
  private String groundOverlayName = "Your registered image";
  @Builder.Default
  private String automaskFile = "auto_generated_mask";
  @Builder.Default
  private RegionateConfiguration regionate = RegionateConfiguration.builder().build();

  @Data
  @Builder
  @Jacksonized
  public static class RegionateConfiguration {
    @Builder.Default
    private String directory = "tiles";
    @Builder.Default
    private String prefix = "tile";
    @Builder.Default
    private int tileSize = 256;
    @Builder.Default
    private int minLodPixels = 128;
    @Builder.Default
    private int maxLodPixels = -1;
    private int topLevelDrawOrder;
    private boolean drawTileBorders;
  }

  /** E.g. pass in the filename relative to the classpath, e.g. "/wcs2kml.yml" */
  public static TilerConfiguration build(String filename) throws IOException {
    URL conf = Resources.getResource(TilerConfiguration.class, filename);
    log.info("Reading from {}", conf);
    return new ObjectMapper(new YAMLFactory()).readValue(conf, TilerConfiguration.class);
  }

  public static TilerConfiguration fromFile(File file) throws IOException {
    log.info("Reading from {}", file);
    return new ObjectMapper(new YAMLFactory()).readValue(file, TilerConfiguration.class);
  }
}
