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

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The root of a KML document intended for the sky mode of the viewer.
 */
@Value
@Builder
@JacksonXmlRootElement(localName = "kml")
public class Kml {
  public static final String NAMESPACE = "http://earth.google.com/kml/2.2";
  public static final String SKY_HINT = "target=sky";

  @Builder.Default
  @JacksonXmlProperty(isAttribute = true)
  String xmlns = NAMESPACE;

  @Builder.Default
  @JacksonXmlProperty(isAttribute = true)
  String hint = SKY_HINT;

  @NonNull
  @JacksonXmlProperty(localName = "Document")
  Document document;

  public static Kml of(Document document) {
    return Kml.builder().document(document).build();
  }
}
