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

import java.io.Serializable;

/**
 * Represents a program element interacting with the system.
 *
 * <p>Every business mutation producing an audit-relevant domain event must be attributed to an
 * actor - {@link DomainClient} carries that identity alongside the message that requested the
 * change, without enforcing any particular storage options.
 */
public interface DomainClient extends Serializable {
  /**
   * @return stable identifier of the actor, recorded in domain events as the one who made the
   *     change
   */
  String clientId();

  /**
   * @return assumed client's role within the domain used primarily for error reporting
   */
  String domainRole();
}
