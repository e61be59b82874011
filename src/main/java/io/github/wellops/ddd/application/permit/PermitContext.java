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

import io.github.wellops.ddd.application.permit.PermitMessages.ApprovePermit;
import io.github.wellops.ddd.application.permit.PermitMessages.CreatePermit;
import io.github.wellops.ddd.application.permit.PermitMessages.GetPermitsExpiringWithin;
import io.github.wellops.ddd.application.permit.PermitMessages.RenewPermit;
import io.github.wellops.ddd.application.permit.PermitMessages.SubmitPermit;
import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.cqrs.BoundedContext;
import io.github.wellops.ddd.cqrs.CommandRetryPolicy;
import io.github.wellops.ddd.cqrs.DomainCommandHandler;
import io.github.wellops.ddd.cqrs.DomainQueryHandler;
import io.github.wellops.ddd.domain.permit.Permit;
import io.github.wellops.ddd.domain.permit.PermitRepository;
import io.github.wellops.ddd.domain.permit.PermitSpecifications;
import io.github.wellops.ddd.jooq.AggregateRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/** Regulatory workflow of {@link Permit}s. */
public class PermitContext extends BoundedContext<Permit> {
  public PermitContext(
      final PermitRepository repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy,
      final Clock clock) {
    super(repository, domainEventPublisher, retryPolicy);

    addDomainCommandHandler(new CreatePermitHandler(clock));
    addDomainCommandHandler(new SubmitPermitHandler());
    addDomainCommandHandler(new ApprovePermitHandler());
    addDomainCommandHandler(new RenewPermitHandler());
    addDomainQueryHandler(new GetPermitsExpiringWithinHandler(clock));
  }

  static final class CreatePermitHandler extends DomainCommandHandler.Create<CreatePermit, Permit> {
    private final Clock clock;

    CreatePermitHandler(final Clock clock) {
      super(CreatePermit.class);
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    }

    @Override
    protected Permit create(
        final CreatePermit command, final AggregateRepository<Permit> repository) {
      return Permit.create(
          clock,
          command.permitNumber(),
          command.permitType(),
          command.wellId(),
          command.organizationId(),
          command.issuingAgency());
    }
  }

  static final class SubmitPermitHandler
      extends DomainCommandHandler.Update<SubmitPermit, Permit> {
    SubmitPermitHandler() {
      super(SubmitPermit.class);
    }

    @Override
    protected void apply(final SubmitPermit command, final Permit permit) {
      permit.submit(command.actorId());
    }
  }

  static final class ApprovePermitHandler
      extends DomainCommandHandler.Update<ApprovePermit, Permit> {
    ApprovePermitHandler() {
      super(ApprovePermit.class);
    }

    @Override
    protected void apply(final ApprovePermit command, final Permit permit) {
      permit.approve(command.actorId(), command.expirationDate());
    }
  }

  static final class RenewPermitHandler extends DomainCommandHandler.Update<RenewPermit, Permit> {
    RenewPermitHandler() {
      super(RenewPermit.class);
    }

    @Override
    protected void apply(final RenewPermit command, final Permit permit) {
      permit.renew(command.actorId(), command.newExpirationDate());
    }
  }

  static final class GetPermitsExpiringWithinHandler
      extends DomainQueryHandler.Many<GetPermitsExpiringWithin, Permit> {
    private final Clock clock;

    GetPermitsExpiringWithinHandler(final Clock clock) {
      super(GetPermitsExpiringWithin.class);
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    }

    @Override
    protected List<Permit> run(
        final GetPermitsExpiringWithin query, final AggregateRepository<Permit> repository) {
      return repository.findBy(
          PermitSpecifications.ownedBy(
                  throwIllegalStateIfNull(query.organizationId(), "Organization ID"))
              .and(PermitSpecifications.expiringWithin(LocalDate.now(clock), query.days())));
    }
  }
}
