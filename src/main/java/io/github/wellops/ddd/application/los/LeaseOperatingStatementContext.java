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

import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.AddExpense;
import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.CreateStatement;
import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.DistributeStatement;
import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.FinalizeStatement;
import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.GetStatementsByLease;
import io.github.wellops.ddd.application.los.LeaseOperatingStatementMessages.RemoveExpense;
import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.cqrs.BoundedContext;
import io.github.wellops.ddd.cqrs.CommandRetryPolicy;
import io.github.wellops.ddd.cqrs.DomainCommandHandler;
import io.github.wellops.ddd.cqrs.DomainQueryHandler;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.los.ExpenseLineItem;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatement;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatementRepository;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatementSpecifications;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.jooq.AggregateRepository;
import java.time.Clock;
import java.util.List;

/** Monthly expense statements of leases. */
public class LeaseOperatingStatementContext extends BoundedContext<LeaseOperatingStatement> {
  public LeaseOperatingStatementContext(
      final LeaseOperatingStatementRepository repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy,
      final Clock clock) {
    super(repository, domainEventPublisher, retryPolicy);

    addDomainCommandHandler(new CreateStatementHandler(clock));
    addDomainCommandHandler(new AddExpenseHandler());
    addDomainCommandHandler(new RemoveExpenseHandler());
    addDomainCommandHandler(new FinalizeStatementHandler());
    addDomainCommandHandler(new DistributeStatementHandler());
    addDomainQueryHandler(new GetStatementsByLeaseHandler());
  }

  /** One statement per lease and month. */
  static final class CreateStatementHandler
      extends DomainCommandHandler.Create<CreateStatement, LeaseOperatingStatement> {
    private final Clock clock;

    CreateStatementHandler(final Clock clock) {
      super(CreateStatement.class);
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    }

    @Override
    protected LeaseOperatingStatement create(
        final CreateStatement command,
        final AggregateRepository<LeaseOperatingStatement> repository) {
      final LeaseOperatingStatement statement =
          LeaseOperatingStatement.create(
              clock,
              command.leaseId(),
              command.organizationId(),
              command.statementMonth(),
              command.currency());

      final int duplicates =
          repository.count(
              LeaseOperatingStatementSpecifications.forLease(statement.getLeaseId())
                  .and(
                      LeaseOperatingStatementSpecifications.forMonth(
                          statement.getStatementMonth())));
      if (duplicates > 0) {
        throw new ValidationException(
            "statementMonth",
            "Statement for %s already exists for this lease"
                .formatted(statement.getStatementMonth()));
      }

      return statement;
    }
  }

  static final class AddExpenseHandler
      extends DomainCommandHandler.Update<AddExpense, LeaseOperatingStatement> {
    AddExpenseHandler() {
      super(AddExpense.class);
    }

    @Override
    protected void apply(final AddExpense command, final LeaseOperatingStatement statement) {
      statement.addExpenseLineItem(
          new ExpenseLineItem(
              command.lineItemId(),
              command.description(),
              command.category(),
              command.expenseType(),
              Money.of(command.amount(), statement.getCurrency())));
    }
  }

  static final class RemoveExpenseHandler
      extends DomainCommandHandler.Update<RemoveExpense, LeaseOperatingStatement> {
    RemoveExpenseHandler() {
      super(RemoveExpense.class);
    }

    @Override
    protected void apply(final RemoveExpense command, final LeaseOperatingStatement statement) {
      statement.removeExpenseLineItem(command.lineItemId());
    }
  }

  static final class FinalizeStatementHandler
      extends DomainCommandHandler.Update<FinalizeStatement, LeaseOperatingStatement> {
    FinalizeStatementHandler() {
      super(FinalizeStatement.class);
    }

    @Override
    protected void apply(
        final FinalizeStatement command, final LeaseOperatingStatement statement) {
      statement.finalizeStatement(command.actorId());
    }
  }

  static final class DistributeStatementHandler
      extends DomainCommandHandler.Update<DistributeStatement, LeaseOperatingStatement> {
    DistributeStatementHandler() {
      super(DistributeStatement.class);
    }

    @Override
    protected void apply(
        final DistributeStatement command, final LeaseOperatingStatement statement) {
      statement.distribute(command.actorId());
    }
  }

  static final class GetStatementsByLeaseHandler
      extends DomainQueryHandler.Many<GetStatementsByLease, LeaseOperatingStatement> {
    GetStatementsByLeaseHandler() {
      super(GetStatementsByLease.class);
    }

    @Override
    protected List<LeaseOperatingStatement> run(
        final GetStatementsByLease query,
        final AggregateRepository<LeaseOperatingStatement> repository) {
      return repository.findBy(
          LeaseOperatingStatementSpecifications.forLease(
              throwIllegalStateIfNull(query.leaseId(), "Lease ID")));
    }
  }
}
