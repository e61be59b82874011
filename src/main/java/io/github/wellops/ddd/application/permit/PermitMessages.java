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

package io.github.wellops.ddd.application.permit;

import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.cqrs.DomainCommand;
import io.github.wellops.ddd.cqrs.DomainQuery;
import io.github.wellops.ddd.domain.permit.PermitType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Commands and queries accepted by the {@link PermitContext}. */
public final class PermitMessages {
  private PermitMessages() {
    // Cannot be instantiated
  }

  public record CreatePermit(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      String permitNumber,
      PermitType permitType,
      UUID wellId,
      UUID organizationId,
      String issuingAgency)
      implements DomainCommand.Create<UUID, Instant> {}

  public record SubmitPermit(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Update<UUID, Instant> {}

  public record ApprovePermit(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      LocalDate expirationDate)
      implements DomainCommand.Update<UUID, Instant> {}

  public record RenewPermit(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      LocalDate newExpirationDate)
      implements DomainCommand.Update<UUID, Instant> {}

  /**
   * @param organizationId holding the permits
   * @param days from today, inclusive
   */
  public record GetPermitsExpiringWithin(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID organizationId, int days)
      implements DomainQuery.Many<UUID, Instant> {}
}
