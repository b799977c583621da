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

import org.gbif.sky.common.projection.SkyRectangle;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import lombok.Value;

/**
 * Where the corners of a ground overlay image are pinned.
 */
@Value
@JsonPropertyOrder({"north", "south", "east", "west"})
public class LatLonBox {
  @JsonSerialize(using = AngleSerializer.class)
  double north;
  @JsonSerialize(using = AngleSerializer.class)
  double south;
  @JsonSerialize(using = AngleSerializer.class)
  double east;
  @JsonSerialize(using = AngleSerializer.class)
  double west;

  public static LatLonBox of(SkyRectangle rectangle) {
    return new LatLonBox(rectangle.getNorth(), rectangle.getSouth(), rectangle.getEast(), rectangle.getWest());
  }
}
