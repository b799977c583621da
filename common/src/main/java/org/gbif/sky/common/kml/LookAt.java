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
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import lombok.Value;

/**
 * The initial view onto a feature, range in metres.
 */
@Value
@JsonPropertyOrder({"longitude", "latitude", "range"})
public class LookAt {
  @JsonSerialize(using = AngleSerializer.class)
  double longitude;
  @JsonSerialize(using = AngleSerializer.class)
  double latitude;
  @JsonSerialize(using = AngleSerializer.class)
  double range;
}
