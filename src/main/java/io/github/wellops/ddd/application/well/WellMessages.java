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

package io.github.wellops.ddd.application.well;

import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.cqrs.DomainCommand;
import io.github.wellops.ddd.cqrs.DomainQuery;
import io.github.wellops.ddd.domain.well.WellStatus;
import io.github.wellops.ddd.domain.well.WellType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/** Commands and queries accepted by the {@link WellContext}. */
public final class WellMessages {
  private WellMessages() {
    // Cannot be instantiated
  }

  public record CreateWell(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      String apiNumber,
      String name,
      UUID operatorId,
      WellType wellType,
      double latitude,
      double longitude)
      implements DomainCommand.Create<UUID, Instant> {}

  public record UpdateWellStatus(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      WellStatus status)
      implements DomainCommand.Update<UUID, Instant> {}

  /**
   * Records the outcome of drilling: completion date and total depth.
   *
   * @param completionDate of the well
   * @param totalDepthFeet measured depth
   */
  public record RecordWellCompletion(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      LocalDate completionDate,
      int totalDepthFeet)
      implements DomainCommand.Update<UUID, Instant> {}

  public record GetWellById(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID wellId)
      implements DomainQuery.One<UUID, Instant> {}

  /**
   * @param operatorId operating the wells
   * @param statuses to narrow down to, empty for any
   */
  public record GetWellsByOperator(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID operatorId,
      Set<WellStatus> statuses)
      implements DomainQuery.Many<UUID, Instant> {}
}
