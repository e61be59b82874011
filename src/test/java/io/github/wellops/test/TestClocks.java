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

package io.github.wellops.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** Fixed clocks, truncated to whole seconds so that timestamps survive a database round trip. */
public final class TestClocks {
  public static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
  public static final LocalDate TODAY = LocalDate.of(2024, 6, 15);
  public static final Clock FIXED = Clock.fixed(NOW, ZoneOffset.UTC);

  private TestClocks() {
    // Cannot be instantiated
  }

  public static Clock daysLater(final long days) {
    return Clock.offset(FIXED, Duration.ofDays(days));
  }
}
