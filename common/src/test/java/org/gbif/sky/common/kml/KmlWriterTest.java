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
import java.util.Arrays;
import java.util.Collections;

import org.gbif.sky.common.projection.SkyRectangle;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.w3c.dom.Element;

import static org.gbif.sky.common.kml.KmlTestSupport.childNames;
import static org.gbif.sky.common.kml.KmlTestSupport.elements;
import static org.gbif.sky.common.kml.KmlTestSupport.parse;
import static org.gbif.sky.common.kml.KmlTestSupport.text;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class KmlWriterTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testGroundOverlay() throws Exception {
    GroundOverlay overlay = GroundOverlay.builder()
      .name("M51")
      .drawOrder(3)
      .icon(new Icon("warped.png"))
      .latLonBox(new LatLonBox(1.5, -2.25, 31.39875091170057, -170))
      .build();
    String xml = KmlWriter.toXml(Kml.of(Document.builder().groundOverlay(overlay).build()));
    assertTrue(xml.startsWith("<?xml"));

    Element kml = parse(xml);
    assertEquals("kml", kml.getTagName());
    assertEquals(Kml.SKY_HINT, kml.getAttribute("hint"));
    assertEquals(Collections.singletonList("Document"), childNames(kml));

    Element document = elements(kml, "Document").get(0);
    assertEquals(Collections.singletonList("GroundOverlay"), childNames(document));
    Element groundOverlay = elements(document, "GroundOverlay").get(0);
    assertEquals(Arrays.asList("name", "drawOrder", "Icon", "LatLonBox"), childNames(groundOverlay));
    assertEquals("M51", text(groundOverlay, "name"));
    assertEquals("3", text(groundOverlay, "drawOrder"));
    assertEquals("warped.png", text(groundOverlay, "href"));

    Element box = elements(groundOverlay, "LatLonBox").get(0);
    assertEquals(Arrays.asList("north", "south", "east", "west"), childNames(box));
    assertEquals("1.50000000000000", text(box, "north"));
    assertEquals("-2.25000000000000", text(box, "south"));
    assertEquals("31.39875091170057", text(box, "east"));
    assertEquals("-170.00000000000000", text(box, "west"));
  }

  @Test
  public void testRegionAndNetworkLinks() throws Exception {
    SkyRectangle extent = SkyRectangle.fromRaDec(10, 4.89, 5, -0.11);
    Region region = Region.builder().latLonAltBox(LatLonAltBox.of(extent)).lod(new Lod(128, -1)).build();
    Document document = Document.builder()
      .region(region)
      .placemark(Placemark.builder().lineString(LineString.of(1, 2, 3, 4)).build())
      .groundOverlay(GroundOverlay.builder().icon(new Icon("tile.png")).latLonBox(LatLonBox.of(extent)).build())
      .networkLink(NetworkLink.builder().region(region).link(new Link("a.kml")).build())
      .networkLink(NetworkLink.builder().region(region).link(new Link("b.kml")).build())
      .build();

    Element kml = parse(KmlWriter.toXml(Kml.of(document)));
    Element root = elements(kml, "Document").get(0);
    assertEquals(Arrays.asList("Region", "Placemark", "GroundOverlay", "NetworkLink", "NetworkLink"),
                 childNames(root));

    Element lod = elements(root, "Lod").get(0);
    assertEquals(Arrays.asList("minLodPixels", "maxLodPixels"), childNames(lod));
    assertEquals("128", text(lod, "minLodPixels"));
    assertEquals("-1", text(lod, "maxLodPixels"));

    Element altBox = elements(root, "LatLonAltBox").get(0);
    assertEquals("-170.00000000000000", text(altBox, "east"));
    assertEquals(-175.11, Double.parseDouble(text(altBox, "west")), 1e-12);

    assertEquals("1.00000000000000,2.00000000000000,0.00000000000000 "
                 + "3.00000000000000,4.00000000000000,0.00000000000000", text(root, "coordinates"));

    Element second = elements(root, "NetworkLink").get(1);
    assertEquals(Arrays.asList("Region", "Link"), childNames(second));
    assertEquals("b.kml", text(second, "href"));
  }

  @Test
  public void testLookAt() throws Exception {
    GroundOverlay overlay = GroundOverlay.builder()
      .icon(new Icon("warped.png"))
      .latLonBox(new LatLonBox(1, 0, 1, 0))
      .lookAt(new LookAt(-148.69, 4.17, 1234.5))
      .build();
    Element lookAt = elements(parse(KmlWriter.toXml(Kml.of(Document.builder().groundOverlay(overlay).build()))),
                              "LookAt").get(0);
    assertEquals(Arrays.asList("longitude", "latitude", "range"), childNames(lookAt));
    assertEquals(-148.69, Double.parseDouble(text(lookAt, "longitude")), 1e-12);
    assertEquals(1234.5, Double.parseDouble(text(lookAt, "range")), 0);
  }

  @Test
  public void testWrite() throws Exception {
    File file = new File(folder.getRoot(), "doc.kml");
    KmlWriter.write(Kml.of(Document.builder()
                             .networkLink(NetworkLink.builder().link(new Link("tiles/top.kml")).build())
                             .build()), file);
    Element kml = parse(file);
    assertEquals("tiles/top.kml", text(kml, "href"));
    assertEquals(Collections.singletonList("Link"), childNames(elements(kml, "NetworkLink").get(0)));
  }

  @Test(expected = NullPointerException.class)
  public void testIconRequired() {
    GroundOverlay.builder().latLonBox(new LatLonBox(1, 0, 1, 0)).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyPlacemark() {
    Placemark.builder().build();
  }
}
