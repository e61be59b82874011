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

import io.github.wellops.ddd.client.AnonymousDomainClient;
import io.github.wellops.ddd.client.DomainClient;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Common shape of everything travelling through the system: commands and queries on the way in,
 * domain events on the way out. Each message is identified, timestamped and attributed to a
 * {@link DomainClient}, which is enough for audit trails and for idempotent consumers.
 *
 * @param <I> is the type of the message identifier
 * @param <T> is the type of the timestamp when this message was created
 */
// @formatter:off
public interface DomainMessage<
  I extends Serializable,
  T extends Temporal & Serializable
> extends Serializable {
// @formatter:on

  /**
   * Named {@code messageId()} rather than {@code id()} because the latter usually describes the
   * aggregate the message is about.
   *
   * @return an identifier for the current message
   */
  I messageId();

  /**
   * @return the time when this message was created
   */
  T createdAt();

  /**
   * @return the client on whose behalf the message was sent
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }

  /**
   * @return identity recorded as the actor of changes caused by this message
   */
  default String actorId() {
    final DomainClient client = domainClient();
    if (client == null) {
      throw new IllegalStateException("Message client cannot be null");
    }

    return client.clientId();
  }
}
