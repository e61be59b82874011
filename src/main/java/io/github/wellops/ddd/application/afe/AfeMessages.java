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

package io.github.wellops.ddd.application.afe;

import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.cqrs.DomainCommand;
import io.github.wellops.ddd.cqrs.DomainQuery;
import io.github.wellops.ddd.domain.afe.AfeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Commands and queries accepted by the {@link AfeContext}. */
public final class AfeMessages {
  private AfeMessages() {
    // Cannot be instantiated
  }

  /**
   * @param wellId the AFE is raised for, may be {@code null}
   * @param description may be {@code null} while drafting
   */
  public record CreateAfe(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      String afeNumber,
      UUID organizationId,
      UUID wellId,
      AfeType afeType,
      BigDecimal estimatedCost,
      String currency,
      String description)
      implements DomainCommand.Create<UUID, Instant> {}

  public record SubmitAfe(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Update<UUID, Instant> {}

  /**
   * @param approvedAmount in the AFE currency, {@code null} to approve the estimate as is
   */
  public record ApproveAfe(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      BigDecimal approvedAmount)
      implements DomainCommand.Update<UUID, Instant> {}

  public record RejectAfe(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      String reason)
      implements DomainCommand.Update<UUID, Instant> {}

  /** Only drafts can be deleted. */
  public record DeleteDraftAfe(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Delete<UUID, Instant> {}

  public record GetAfesAwaitingApproval(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID organizationId)
      implements DomainQuery.Many<UUID, Instant> {}
}
