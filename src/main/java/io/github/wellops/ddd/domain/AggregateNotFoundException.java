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

/** Thrown when an aggregate with the requested identifier does not exist. */
public class AggregateNotFoundException extends DomainException {
  @Serial private static final long serialVersionUID = -8000236547139461273L;

  private final AggregateType aggregateType;
  private final UUID aggregateId;

  /**
   * Default constructor.
   *
   * @param aggregateType which was looked up
   * @param aggregateId which was looked up
   */
  public AggregateNotFoundException(AggregateType aggregateType, UUID aggregateId) {
    super("%s '%s' was not found".formatted(aggregateType.displayName(), aggregateId));
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
  }

  public final AggregateType getAggregateType() {
    return aggregateType;
  }

  public final UUID getAggregateId() {
    return aggregateId;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 404;
  }
}
