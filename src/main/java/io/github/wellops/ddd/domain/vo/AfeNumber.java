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
import java.time.Year;
import java.util.Locale;

/**
 * Authorization for Expenditure number in the {@code AFE-YYYY-NNNN} format.
 *
 * @param value normalized AFE number
 */
public record AfeNumber(String value) implements Serializable {
  @Serial private static final long serialVersionUID = -1163706931302617449L;

  private static final String FIELD = "afeNumber";

  /**
   * Default constructor, upper-cases the input.
   *
   * @throws io.github.wellops.ddd.domain.ValidationException if the format is not recognized
   */
  public AfeNumber {
    value = DomainPreconditions.requireText(value, FIELD).toUpperCase(Locale.ROOT);
    DomainPreconditions.check(
        value.matches("AFE-\\d{4}-\\d{4}"), FIELD, "AFE number must match AFE-YYYY-NNNN");
  }

  /**
   * @return the year part of the number
   */
  public Year year() {
    return Year.of(Integer.parseInt(value.substring(4, 8)));
  }

  /**
   * @return the sequence part of the number
   */
  public int sequence() {
    return Integer.parseInt(value.substring(9));
  }

  @Override
  public String toString() {
    return value;
  }
}
