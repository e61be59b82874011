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

import io.github.wellops.ddd.application.afe.AfeMessages.ApproveAfe;
import io.github.wellops.ddd.application.afe.AfeMessages.CreateAfe;
import io.github.wellops.ddd.application.afe.AfeMessages.DeleteDraftAfe;
import io.github.wellops.ddd.application.afe.AfeMessages.GetAfesAwaitingApproval;
import io.github.wellops.ddd.application.afe.AfeMessages.RejectAfe;
import io.github.wellops.ddd.application.afe.AfeMessages.SubmitAfe;
import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.cqrs.BoundedContext;
import io.github.wellops.ddd.cqrs.CommandRetryPolicy;
import io.github.wellops.ddd.cqrs.DomainCommandHandler;
import io.github.wellops.ddd.cqrs.DomainQueryHandler;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.afe.Afe;
import io.github.wellops.ddd.domain.afe.AfeRepository;
import io.github.wellops.ddd.domain.afe.AfeSpecifications;
import io.github.wellops.ddd.domain.afe.AfeStatus;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.jooq.AggregateRepository;
import java.time.Clock;
import java.util.List;

/** Approval workflow of {@link Afe}s. */
public class AfeContext extends BoundedContext<Afe> {
  public AfeContext(
      final AfeRepository repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy,
      final Clock clock) {
    super(repository, domainEventPublisher, retryPolicy);

    addDomainCommandHandler(new CreateAfeHandler(clock));
    addDomainCommandHandler(new SubmitAfeHandler());
    addDomainCommandHandler(new ApproveAfeHandler());
    addDomainCommandHandler(new RejectAfeHandler());
    addDomainCommandHandler(new DeleteDraftAfeHandler());
    addDomainQueryHandler(new GetAfesAwaitingApprovalHandler());
  }

  /** AFE numbers are unique within an organization. */
  static final class CreateAfeHandler extends DomainCommandHandler.Create<CreateAfe, Afe> {
    private final Clock clock;

    CreateAfeHandler(final Clock clock) {
      super(CreateAfe.class);
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    }

    @Override
    protected Afe create(final CreateAfe command, final AggregateRepository<Afe> repository) {
      final Afe afe =
          Afe.create(
              clock,
              new AfeNumber(command.afeNumber()),
              command.organizationId(),
              command.wellId(),
              command.afeType(),
              Money.of(command.estimatedCost(), command.currency()),
              command.description());

      final int duplicates =
          repository.count(
              AfeSpecifications.withAfeNumber(afe.getAfeNumber())
                  .and(AfeSpecifications.ownedBy(afe.getOrganizationId())));
      if (duplicates > 0) {
        throw new ValidationException(
            "afeNumber", "AFE number %s is already in use".formatted(afe.getAfeNumber()));
      }

      return afe;
    }
  }

  static final class SubmitAfeHandler extends DomainCommandHandler.Update<SubmitAfe, Afe> {
    SubmitAfeHandler() {
      super(SubmitAfe.class);
    }

    @Override
    protected void apply(final SubmitAfe command, final Afe afe) {
      afe.submit(command.actorId());
    }
  }

  static final class ApproveAfeHandler extends DomainCommandHandler.Update<ApproveAfe, Afe> {
    ApproveAfeHandler() {
      super(ApproveAfe.class);
    }

    @Override
    protected void apply(final ApproveAfe command, final Afe afe) {
      final Money approvedAmount =
          command.approvedAmount() == null
              ? null
              : Money.of(command.approvedAmount(), afe.getEstimatedCost().getCurrency());

      afe.approve(command.actorId(), approvedAmount);
    }
  }

  static final class RejectAfeHandler extends DomainCommandHandler.Update<RejectAfe, Afe> {
    RejectAfeHandler() {
      super(RejectAfe.class);
    }

    @Override
    protected void apply(final RejectAfe command, final Afe afe) {
      afe.reject(command.actorId(), command.reason());
    }
  }

  static final class DeleteDraftAfeHandler
      extends DomainCommandHandler.Delete<DeleteDraftAfe, Afe> {
    DeleteDraftAfeHandler() {
      super(DeleteDraftAfe.class);
    }

    @Override
    protected void verifyDeletable(final DeleteDraftAfe command, final Afe afe) {
      if (afe.getStatus() != AfeStatus.DRAFT) {
        throw new ValidationException(
            "status",
            "Only draft AFEs can be deleted, %s is %s"
                .formatted(afe.getAfeNumber(), afe.getStatus()));
      }
    }
  }

  static final class GetAfesAwaitingApprovalHandler
      extends DomainQueryHandler.Many<GetAfesAwaitingApproval, Afe> {
    GetAfesAwaitingApprovalHandler() {
      super(GetAfesAwaitingApproval.class);
    }

    @Override
    protected List<Afe> run(
        final GetAfesAwaitingApproval query, final AggregateRepository<Afe> repository) {
      return repository.findBy(
          AfeSpecifications.ownedBy(
                  throwIllegalStateIfNull(query.organizationId(), "Organization ID"))
              .and(AfeSpecifications.awaitingApproval()));
    }
  }
}
