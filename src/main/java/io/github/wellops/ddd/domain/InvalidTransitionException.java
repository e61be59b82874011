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
import java.util.UUID;

/**
 * Thrown when a requested status change is not present in the {@link TransitionTable} for the
 * current status. The aggregate is left unchanged.
 */
public class InvalidTransitionException extends DomainException {
  @Serial private static final long serialVersionUID = -6390563720781190238L;

  private final AggregateType aggregateType;
  private final UUID aggregateId;
  private final Enum<?> from;
  private final Enum<?> to;

  /**
   * Default constructor.
   *
   * @param aggregateType of the aggregate being changed
   * @param aggregateId of the aggregate being changed
   * @param from status the aggregate is currently in
   * @param to status which was requested
   */
  public InvalidTransitionException(
      AggregateType aggregateType, UUID aggregateId, Enum<?> from, Enum<?> to) {
    super(
        "%s '%s' cannot transition from %s to %s"
            .formatted(aggregateType.displayName(), aggregateId, from, to));
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
    this.from = from;
    this.to = to;
  }

  public final AggregateType getAggregateType() {
    return aggregateType;
  }

  public final UUID getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the status the aggregate was in when the transition was attempted
   */
  public final Enum<?> getFrom() {
    return from;
  }

  /**
   * @return the status which was rejected
   */
  public final Enum<?> getTo() {
    return to;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 409;
  }
}
