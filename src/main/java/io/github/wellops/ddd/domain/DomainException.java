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
 * Root of every failure raised by the aggregate lifecycle core.
 *
 * <p>All subclasses are unchecked: callers decide which of them are worth handling, typically
 * {@link VersionConflictException} to implement a bounded retry, while the rest are surfaced to
 * the original caller as is.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3528706235839434581L;

  /**
   * Constructs a new domain exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected DomainException(String message) {
    super(message);
  }

  /**
   * Constructs a new domain exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  protected DomainException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  public abstract int getStatusCode();
}
