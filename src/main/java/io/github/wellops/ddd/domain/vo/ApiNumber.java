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
 * American Petroleum Institute well number: 2-digit state code, 3-digit county code and 5-digit
 * unique well identifier, normalized to {@code SS-CCC-UUUUU}.
 *
 * <p>Accepts the digits with or without dashes or spaces in between.
 */
public final class ApiNumber implements Serializable {
  @Serial private static final long serialVersionUID = 2905563806493512817L;

  private static final String FIELD = "apiNumber";

  private final String value;

  private ApiNumber(final String value) {
    this.value = value;
  }

  /**
   * @param raw API number in any of the accepted formats
   * @return normalized API number
   * @throws io.github.wellops.ddd.domain.ValidationException if the input does not contain exactly
   *     ten digits
   */
  public static ApiNumber of(final String raw) {
    final String trimmed = DomainPreconditions.requireText(raw, FIELD);
    final String digits = trimmed.replaceAll("[\\s-]", "");
    DomainPreconditions.check(
        digits.matches("\\d{10}"), FIELD, "API Number must be exactly 10 digits");

    return new ApiNumber(
        "%s-%s-%s".formatted(digits.substring(0, 2), digits.substring(2, 5), digits.substring(5)));
  }

  public String getValue() {
    return value;
  }

  /**
   * @return the 2-digit state code
   */
  public String getStateCode() {
    return value.substring(0, 2);
  }

  /**
   * @return the 3-digit county code
   */
  public String getCountyCode() {
    return value.substring(3, 6);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ApiNumber other && value.equals(other.value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
