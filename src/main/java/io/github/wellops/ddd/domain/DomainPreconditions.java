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

package io.github.wellops.ddd.domain;

/**
 * Field-level checks shared by value objects and aggregates. Every failure is reported as a
 * {@link ValidationException} naming the offending field.
 */
public final class DomainPreconditions {
  private DomainPreconditions() {
    // Cannot be instantiated
  }

  /**
   * @param value which must not be {@code null}
   * @param field name reported on failure
   * @return value if it was not {@code null}
   * @param <T> is the type of the value
   * @throws ValidationException when the value is {@code null}
   */
  public static <T> T requireValue(final T value, final String field) {
    if (value == null) {
      throw new ValidationException(field, "%s is required".formatted(field));
    }

    return value;
  }

  /**
   * @param value which must contain at least one non-whitespace character
   * @param field name reported on failure
   * @return trimmed value
   * @throws ValidationException when the value is {@code null} or blank
   */
  public static String requireText(final String value, final String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field, "%s cannot be empty".formatted(field));
    }

    return value.trim();
  }

  /**
   * @param condition which must hold
   * @param field name reported on failure
   * @param message describing the violated rule
   * @throws ValidationException when the condition is {@code false}
   */
  public static void check(final boolean condition, final String field, final String message) {
    if (!condition) {
      throw new ValidationException(field, message);
    }
  }
}
