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

package io.github.wellops.ddd.cqrs;

/**
 * Retry rule for commands updating an existing aggregate.
 *
 * <p>When saving fails with a {@link io.github.wellops.ddd.domain.VersionConflictException}, the
 * stale aggregate is discarded, a fresh one is loaded and the business operation runs again from
 * scratch - until the attempts are used up, at which point the conflict reaches the caller.
 *
 * @param maxAttempts total number of attempts, including the first one
 */
public record CommandRetryPolicy(int maxAttempts) {
  /**
   * Default constructor.
   *
   * @throws IllegalArgumentException if fewer than one attempt is allowed
   */
  public CommandRetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "At least one attempt is required, got %d".formatted(maxAttempts));
    }
  }

  /**
   * @return policy surfacing the first conflict to the caller
   */
  public static CommandRetryPolicy noRetries() {
    return new CommandRetryPolicy(1);
  }

  /**
   * @param attempt number of the attempt which just failed, starting at {@code 1}
   * @return {@code true} if another attempt is allowed
   */
  public boolean allowsAnotherAttemptAfter(final int attempt) {
    return attempt < maxAttempts;
  }
}
