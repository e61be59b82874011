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

package io.github.wellops.ddd.client;

import io.github.wellops.ddd.domain.DomainException;
import java.io.Serial;

/** Thrown if a {@link DomainClient} is not allowed to invoke an operation. */
public class UnauthorizedException extends DomainException {
  @Serial private static final long serialVersionUID = 7996325054039085081L;

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public UnauthorizedException(String message) {
    super(message);
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 403;
  }
}
