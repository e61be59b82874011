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

import java.io.Serial;

/**
 * Thrown when a value object or an aggregate field receives an input it cannot accept.
 *
 * <p>Validation always happens before any mutation, so the object is left unchanged and the
 * caller can correct the input and retry.
 */
public class ValidationException extends DomainException {
  @Serial private static final long serialVersionUID = 1846209571180534920L;

  private final String field;

  /**
   * Constructs a new validation exception for a specific field.
   *
   * @param field which did not pass the validation
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  /**
   * @return the name of the offending field
   */
  public final String getField() {
    return field;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad
   *     Request</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 400;
  }
}
