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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.google.common.base.Preconditions;

import lombok.Builder;
import lombok.Value;

/**
 * A named feature, here only ever a line.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "description", "lookAt", "lineString"})
public class Placemark {

  String name;

  String description;

  @JacksonXmlProperty(localName = "LookAt")
  LookAt lookAt;

  @JacksonXmlProperty(localName = "LineString")
  LineString lineString;

  @Builder
  private Placemark(String name, String description, LookAt lookAt, LineString lineString) {
    Preconditions.checkArgument(name != null || description != null || lineString != null,
                                "An empty placemark is not allowed");
    this.name = name;
    this.description = description;
    this.lookAt = lookAt;
    this.lineString = lineString;
  }
}
