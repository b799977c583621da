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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An image draped over the sky.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "drawOrder", "icon", "latLonBox", "lookAt"})
public class GroundOverlay {

  String name;

  Integer drawOrder;

  @NonNull
  @JacksonXmlProperty(localName = "Icon")
  Icon icon;

  @NonNull
  @JacksonXmlProperty(localName = "LatLonBox")
  LatLonBox latLonBox;

  @JacksonXmlProperty(localName = "LookAt")
  LookAt lookAt;
}
