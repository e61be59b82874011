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
import java.time.Instant;
import java.util.UUID;

/**
 * Raised by every successful status change of an aggregate.
 *
 * @param messageId unique identifier of this event, usable for deduplication
 * @param occurredAt when the change happened
 * @param aggregateType of the changed aggregate
 * @param aggregateId of the changed aggregate
 * @param aggregateVersion produced by the change
 * @param previousStatus before the change
 * @param newStatus after the change
 * @param changedBy identity of the actor
 * @param reason optional free-form explanation, {@code null} when not given
 * @param <S> the status enum of the aggregate type
 */
public record StatusChangedEvent<S extends Enum<S>>(
    UUID messageId,
    Instant occurredAt,
    AggregateType aggregateType,
    UUID aggregateId,
    long aggregateVersion,
    S previousStatus,
    S newStatus,
    String changedBy,
    String reason)
    implements DomainEvent {
  @Serial private static final long serialVersionUID = 6262141427093787531L;

  /**
   * Default constructor.
   *
   * @throws IllegalArgumentException if any of the mandatory components is {@code null}
   */
  public StatusChangedEvent {
    if (messageId == null
        || occurredAt == null
        || aggregateType == null
        || aggregateId == null
        || previousStatus == null
        || newStatus == null
        || changedBy == null) {
      throw new IllegalArgumentException("Status change event is incomplete");
    }
  }

  /** {@inheritDoc} */
  @Override
  public String eventType() {
    return aggregateType.displayName() + "StatusChanged";
  }
}
