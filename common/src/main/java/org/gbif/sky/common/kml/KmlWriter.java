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

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders {@link Kml} documents as indented XML with a declaration.
 * This class is threadsafe.
 */
@Slf4j
public final class KmlWriter {
  private static final XmlMapper MAPPER = XmlMapper.builder()
    .enable(SerializationFeature.INDENT_OUTPUT)
    .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
    .build();

  private KmlWriter() {}

  public static String toXml(Kml kml) {
    try {
      return MAPPER.writeValueAsString(kml);
    } catch (JsonProcessingException e) {
      // only in memory, so this is a defect in the model
      throw new IllegalStateException("Unable to serialize KML", e);
    }
  }

  public static void write(Kml kml, File file) throws IOException {
    log.debug("Writing KML to {}", file);
    MAPPER.writeValue(file, kml);
  }
}
