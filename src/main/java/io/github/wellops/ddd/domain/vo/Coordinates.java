/*
 * Copyright 2024 Roman Khlebnov
 *
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

package io.github.wellops.ddd.domain.vo;

import io.github.wellops.ddd.domain.DomainPreconditions;
import java.io.Serial;
import java.io.Serializable;

/**
 * WGS84 surface location of a well.
 *
 * @param latitude in degrees, between -90 and 90
 * @param longitude in degrees, between -180 and 180
 */
public record Coordinates(double latitude, double longitude) implements Serializable {
  @Serial private static final long serialVersionUID = 7779134270474858165L;

  /**
   * Default constructor.
   *
   * @throws io.github.wellops.ddd.domain.ValidationException if any of the values is out of range
   */
  public Coordinates {
    DomainPreconditions.check(
        Double.isFinite(latitude) && latitude >= -90.0 && latitude <= 90.0,
        "latitude",
        "Latitude must be between -90 and 90 degrees");
    DomainPreconditions.check(
        Double.isFinite(longitude) && longitude >= -180.0 && longitude <= 180.0,
        "longitude",
        "Longitude must be between -180 and 180 degrees");
  }
}
