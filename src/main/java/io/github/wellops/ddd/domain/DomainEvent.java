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

import io.github.wellops.ddd.cqrs.DomainMessage;
import java.time.Instant;
import java.util.UUID;

/**
 * An immutable record of something that happened to an aggregate, published after the change was
 * persisted.
 *
 * <p>Events reference their aggregate by identifier only and never hold the aggregate itself.
 */
public interface DomainEvent extends DomainMessage<UUID, Instant> {
  /**
   * @return a tag identifying the kind of event, e.g. {@code WellStatusChanged}
   */
  String eventType();

  AggregateType aggregateType();

  UUID aggregateId();

  /**
   * @return the aggregate version produced by the change this event describes
   */
  long aggregateVersion();

  /**
   * @return the time when the change happened
   */
  Instant occurredAt();

  /** {@inheritDoc} */
  @Override
  default Instant createdAt() {
    return occurredAt();
  }
}
