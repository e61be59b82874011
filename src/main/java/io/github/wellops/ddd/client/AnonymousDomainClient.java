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
 * Caller of messages which do not name one, e.g. a nightly sweep expiring permits. Changes made on
 * its behalf are recorded under the actor {@value #CLIENT_ID}.
 */
@SuppressWarnings({"unchecked", "squid:S6548"})
public final class AnonymousDomainClient implements DomainClient {
  @Serial private static final long serialVersionUID = -2611523096852178379L;

  public static final String CLIENT_ID = "anonymous";
  public static final String ROLE = "ANONYMOUS";

  private static final AnonymousDomainClient INSTANCE = new AnonymousDomainClient();

  private AnonymousDomainClient() {
    // Cannot be instantiated
  }

  /**
   * @return the only instance
   */
  public static <T extends DomainClient> T getInstance() {
    return (T) INSTANCE;
  }

  @Override
  public String clientId() {
    return CLIENT_ID;
  }

  @Override
  public String domainRole() {
    return ROLE;
  }

  @Override
  public String toString() {
    return CLIENT_ID;
  }

  /** Messages travel serialized, the client they carry must stay the singleton. */
  @Serial
  private Object readResolve() {
    return INSTANCE;
  }
}
