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
package org.gbif.sky.common.kml;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Level of detail, the range of projected sizes in screen pixels within which a region is active.
 * A maximum of -1 means no upper limit.
 */
@Value
@JsonPropertyOrder({"minLodPixels", "maxLodPixels"})
public class Lod {
  public static final Lod ALWAYS_VISIBLE = new Lod(0, -1);

  int minLodPixels;
  int maxLodPixels;
}
