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
 * Explicit tag identifying each aggregate type known to the core.
 *
 * <p>Used wherever behavior depends on the kind of aggregate - error reporting, event naming or
 * selecting a {@code DSLContext} - instead of inspecting runtime class identity.
 */
public enum AggregateType {
  WELL("Well"),
  AFE("Afe"),
  PERMIT("Permit"),
  VENDOR("Vendor"),
  LEASE_OPERATING_STATEMENT("LeaseOperatingStatement");

  private final String displayName;

  AggregateType(String displayName) {
    this.displayName = displayName;
  }

  /**
   * @return human-readable name, also used as a prefix of event types (e.g. {@code
   *     WellStatusChanged})
   */
  public String displayName() {
    return displayName;
  }
}
