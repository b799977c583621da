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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A KML Document. Its Region cascades to every feature inside, so network links carry their own.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"region", "placemarks", "groundOverlays", "networkLinks"})
public class Document {

  @JacksonXmlProperty(localName = "Region")
  Region region;

  @Singular
  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Placemark")
  List<Placemark> placemarks;

  @Singular
  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "GroundOverlay")
  List<GroundOverlay> groundOverlays;

  @Singular
  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "NetworkLink")
  List<NetworkLink> networkLinks;
}
