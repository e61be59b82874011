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

package io.github.wellops.ddd.application.los;

import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.cqrs.DomainCommand;
import io.github.wellops.ddd.cqrs.DomainQuery;
import io.github.wellops.ddd.domain.los.ExpenseCategory;
import io.github.wellops.ddd.domain.los.ExpenseType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/** Commands and queries accepted by the {@link LeaseOperatingStatementContext}. */
public final class LeaseOperatingStatementMessages {
  private LeaseOperatingStatementMessages() {
    // Cannot be instantiated
  }

  public record CreateStatement(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID leaseId,
      UUID organizationId,
      YearMonth statementMonth,
      String currency)
      implements DomainCommand.Create<UUID, Instant> {}

  /**
   * @param lineItemId unique within the statement
   * @param amount in the statement currency
   */
  public record AddExpense(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      String lineItemId,
      String description,
      ExpenseCategory category,
      ExpenseType expenseType,
      BigDecimal amount)
      implements DomainCommand.Update<UUID, Instant> {}

  public record RemoveExpense(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      String lineItemId)
      implements DomainCommand.Update<UUID, Instant> {}

  public record FinalizeStatement(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Update<UUID, Instant> {}

  public record DistributeStatement(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Update<UUID, Instant> {}

  public record GetStatementsByLease(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID leaseId)
      implements DomainQuery.Many<UUID, Instant> {}
}
