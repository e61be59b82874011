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

import java.io.Serial;

/**
 * A named {@link DomainClient}, typically an operator's user account or a scheduled job.
 *
 * @param clientId of the actor
 * @param domainRole of the actor
 */
public record NamedDomainClient(String clientId, String domainRole) implements DomainClient {
  @Serial private static final long serialVersionUID = 4102749512873660125L;

  /**
   * Default constructor.
   *
   * @throws IllegalArgumentException if any of the values is {@code null} or blank
   */
  public NamedDomainClient {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("Client ID cannot be blank");
    }

    if (domainRole == null || domainRole.isBlank()) {
      throw new IllegalArgumentException("Client role cannot be blank");
    }
  }
}
