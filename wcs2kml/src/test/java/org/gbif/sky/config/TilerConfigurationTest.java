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
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class TilerConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testBundledDefaults() throws IOException {
    TilerConfiguration config = TilerConfiguration.build("/wcs2kml.yml");
    assertEquals(10000, config.getMaxSideLength());
    assertEquals("0,0,0,0", config.getBackgroundColor());
    assertFalse(config.isInputImageOriginUpperLeft());
    assertEquals("warped_image.png", config.getOutFile());
    assertEquals("doc.kml", config.getKmlFile());
    assertEquals("Your registered image", config.getGroundOverlayName());
    assertEquals("auto_generated_mask", config.getAutomaskFile());
    assertEquals("tiles", config.getRegionate().getDirectory());
    assertEquals("tile", config.getRegionate().getPrefix());
    assertEquals(256, config.getRegionate().getTileSize());
    assertEquals(128, config.getRegionate().getMinLodPixels());
    assertEquals(-1, config.getRegionate().getMaxLodPixels());

    // the bundled file and the builder agree
    assertEquals(TilerConfiguration.builder().build(), config);
  }

  @Test
  public void testPartialFile() throws IOException {
    File file = folder.newFile("wcs2kml.yml");
    Files.asCharSink(file, StandardCharsets.UTF_8).write("maxSideLength: 400\n"
                                                         + "regionate:\n"
                                                         + "  tileSize: 128\n"
                                                         + "  drawTileBorders: true\n");
    TilerConfiguration config = TilerConfiguration.fromFile(file);
    assertEquals(400, config.getMaxSideLength());
    assertEquals("doc.kml", config.getKmlFile());
    assertEquals(128, config.getRegionate().getTileSize());
    assertEquals("tile", config.getRegionate().getPrefix());
    assertEquals(true, config.getRegionate().isDrawTileBorders());
  }

  @Test
  public void testMissingRegionateBlock() throws IOException {
    File file = folder.newFile("wcs2kml.yml");
    Files.asCharSink(file, StandardCharsets.UTF_8).write("groundOverlayName: M51\n");
    TilerConfiguration config = TilerConfiguration.fromFile(file);
    assertEquals("M51", config.getGroundOverlayName());
    assertEquals(256, config.getRegionate().getTileSize());
  }
}
