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
import java.net.URL;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Resources;

/**
 * The header of a downsampled SDSS frame, 512x372 pixels, rotated by nearly 90 degrees on the sky.
 */
public class Fixtures {
  public static final String SDSS_HEADER = "fpC-001478-g3-0022_small.hdr";
  public static final int SDSS_WIDTH = 512;
  public static final int SDSS_HEIGHT = 372;

  public static FitsHeader sdssHeader() throws IOException {
    URL url = Resources.getResource(SDSS_HEADER);
    return FitsHeader.parse(Resources.toString(url, StandardCharsets.US_ASCII));
  }

  public static TanProjection sdssProjection() throws IOException {
    return TanProjection.fromHeader(sdssHeader(), SDSS_WIDTH, SDSS_HEIGHT);
  }
}
