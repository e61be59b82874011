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

import io.github.wellops.ddd.application.well.WellMessages.CreateWell;
import io.github.wellops.ddd.application.well.WellMessages.GetWellById;
import io.github.wellops.ddd.application.well.WellMessages.GetWellsByOperator;
import io.github.wellops.ddd.application.well.WellMessages.RecordWellCompletion;
import io.github.wellops.ddd.application.well.WellMessages.UpdateWellStatus;
import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.cqrs.BoundedContext;
import io.github.wellops.ddd.cqrs.CommandRetryPolicy;
import io.github.wellops.ddd.cqrs.DomainCommandHandler;
import io.github.wellops.ddd.cqrs.DomainQueryHandler;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.ddd.domain.well.Well;
import io.github.wellops.ddd.domain.well.WellRepository;
import io.github.wellops.ddd.domain.well.WellSpecifications;
import io.github.wellops.ddd.jooq.AggregateRepository;
import io.github.wellops.ddd.specification.Specification;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/** Lifecycle operations on {@link Well}s. */
public class WellContext extends BoundedContext<Well> {
  public WellContext(
      final WellRepository repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy,
      final Clock clock) {
    super(repository, domainEventPublisher, retryPolicy);

    addDomainCommandHandler(new CreateWellHandler(clock));
    addDomainCommandHandler(new UpdateWellStatusHandler());
    addDomainCommandHandler(new RecordWellCompletionHandler());
    addDomainQueryHandler(new GetWellByIdHandler());
    addDomainQueryHandler(new GetWellsByOperatorHandler());
  }

  /** API numbers are unique across all wells. */
  static final class CreateWellHandler extends DomainCommandHandler.Create<CreateWell, Well> {
    private final Clock clock;

    CreateWellHandler(final Clock clock) {
      super(CreateWell.class);
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    }

    @Override
    protected Well create(final CreateWell command, final AggregateRepository<Well> repository) {
      final ApiNumber apiNumber = ApiNumber.of(command.apiNumber());
      if (repository.count(WellSpecifications.withApiNumber(apiNumber)) > 0) {
        throw new ValidationException(
            "apiNumber", "Well with API number %s already exists".formatted(apiNumber));
      }

      return Well.create(
          clock,
          apiNumber,
          command.name(),
          command.operatorId(),
          command.wellType(),
          new Coordinates(command.latitude(), command.longitude()));
    }
  }

  static final class UpdateWellStatusHandler
      extends DomainCommandHandler.Update<UpdateWellStatus, Well> {
    UpdateWellStatusHandler() {
      super(UpdateWellStatus.class);
    }

    @Override
    protected void apply(final UpdateWellStatus command, final Well well) {
      well.updateStatus(command.status(), command.actorId());
    }
  }

  static final class RecordWellCompletionHandler
      extends DomainCommandHandler.Update<RecordWellCompletion, Well> {
    RecordWellCompletionHandler() {
      super(RecordWellCompletion.class);
    }

    @Override
    protected void apply(final RecordWellCompletion command, final Well well) {
      well.recordCompletionDate(command.completionDate());
      well.recordTotalDepth(command.totalDepthFeet());
    }
  }

  static final class GetWellByIdHandler extends DomainQueryHandler.One<GetWellById, Well> {
    GetWellByIdHandler() {
      super(GetWellById.class);
    }

    @Override
    protected Optional<Well> run(
        final GetWellById query, final AggregateRepository<Well> repository) {
      return repository.findById(throwIllegalStateIfNull(query.wellId(), "Well ID"));
    }
  }

  static final class GetWellsByOperatorHandler
      extends DomainQueryHandler.Many<GetWellsByOperator, Well> {
    GetWellsByOperatorHandler() {
      super(GetWellsByOperator.class);
    }

    @Override
    protected List<Well> run(
        final GetWellsByOperator query, final AggregateRepository<Well> repository) {
      Specification<Well> specification =
          WellSpecifications.operatedBy(throwIllegalStateIfNull(query.operatorId(), "Operator ID"));

      if (query.statuses() != null && !query.statuses().isEmpty()) {
        specification = specification.and(WellSpecifications.statusIn(query.statuses()));
      }

      return repository.findBy(specification);
    }
  }
}
