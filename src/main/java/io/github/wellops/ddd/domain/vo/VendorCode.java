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
 * Vendor identifier unique within an organization: 3 to 20 letters, digits, hyphens or
 * underscores, starting and ending with a letter or a digit. Case is preserved.
 *
 * @param value trimmed vendor code
 */
public record VendorCode(String value) implements Serializable {
  @Serial private static final long serialVersionUID = 3371509245630829541L;

  private static final String FIELD = "vendorCode";

  /**
   * Default constructor, trims the input.
   *
   * @throws io.github.wellops.ddd.domain.ValidationException if the code breaks any of the rules
   */
  public VendorCode {
    value = DomainPreconditions.requireText(value, FIELD);
    DomainPreconditions.check(
        value.length() >= 3 && value.length() <= 20,
        FIELD,
        "Vendor code must be between 3 and 20 characters");
    DomainPreconditions.check(
        value.matches("[A-Za-z0-9_-]+"),
        FIELD,
        "Vendor code can only contain letters, numbers, hyphens, and underscores");
    DomainPreconditions.check(
        value.matches("[A-Za-z0-9].*[A-Za-z0-9]"),
        FIELD,
        "Vendor code must start and end with a letter or number");
  }

  @Override
  public String toString() {
    return value;
  }
}
