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

import io.github.wellops.ddd.client.DomainClient;
import java.io.Serial;

@SuppressWarnings({"unchecked", "squid:S6548"})
public final class AnotherDomainClient implements DomainClient {
  @Serial private static final long serialVersionUID = -5017245916573810644L;

  private AnotherDomainClient() {
    // Cannot be instantiated
  }

  public static <T extends DomainClient> T getInstance() {
    return (T) Holder.INSTANCE;
  }

  @Override
  public String clientId() {
    return "contractor";
  }

  @Override
  public String domainRole() {
    return "OTHER";
  }

  private static class Holder {
    private static final AnotherDomainClient INSTANCE = new AnotherDomainClient();
  }
}
