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

/**
 * Where the first row of a raster sits. FITS images start at the lower left while most raster formats start at the
 * upper left, so images converted from FITS are often upside down relative to their WCS.
 */
public enum ImageOrigin {
  UPPER_LEFT,
  LOWER_LEFT
}
