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
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A path through a sequence of longitude, latitude pairs, written at zero altitude.
 */
public class LineString {
  private final List<double[]> points;

  private LineString(List<double[]> points) {
    Preconditions.checkArgument(!points.isEmpty(), "A line needs at least one point");
    this.points = points;
  }

  /**
   * @param coordinates alternating longitude and latitude values
   */
  public static LineString of(double... coordinates) {
    Preconditions.checkArgument(coordinates.length % 2 == 0, "Coordinates must come in longitude, latitude pairs");
    ImmutableList.Builder<double[]> points = ImmutableList.builder();
    for (int i = 0; i < coordinates.length; i += 2) {
      points.add(new double[] {coordinates[i], coordinates[i + 1]});
    }
    return new LineString(points.build());
  }

  @JsonIgnore
  public int size() {
    return points.size();
  }

  @JsonProperty("coordinates")
  public String getCoordinates() {
    return points.stream()
      .map(p -> AngleSerializer.format(p[0]) + "," + AngleSerializer.format(p[1]) + "," + AngleSerializer.format(0))
      .collect(Collectors.joining(" "));
  }
}
