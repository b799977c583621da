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
package org.gbif.sky.common.regionator;

import java.util.List;
import java.util.stream.Stream;

import org.gbif.sky.common.projection.SkyRectangle;

import lombok.Value;

/**
 * One node of a regionated pyramid: the rectangle of the padded warped image it samples, inclusive of both corners,
 * where it lies on the sky and its children, which are empty for leaves.
 */
@Value
public class TileRecord {
  String name;
  int x1;
  int y1;
  int x2;
  int y2;
  int level;
  SkyRectangle extent;
  boolean transparent;
  boolean opaque;
  List<TileRecord> children;

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /**
   * @return this tile and all of its descendants, parents before children
   */
  public Stream<TileRecord> stream() {
    return Stream.concat(Stream.of(this), children.stream().flatMap(TileRecord::stream));
  }

  /**
   * @return the number of tiles in the tree rooted here
   */
  public int size() {
    return (int) stream().count();
  }
}
