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

package io.github.wellops.ddd.cqrs;

import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.client.UnauthorizedException;
import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.DomainEvent;
import io.github.wellops.ddd.domain.VersionConflictException;
import io.github.wellops.ddd.jooq.AggregateRepository;
import io.vavr.control.Try;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Assert that the {@link io.github.wellops.ddd.client.DomainClient} can invoke the {@link
 *       DomainCommand}.
 *   <li>Load or create the aggregate and run the business operation on it.
 *   <li>Save the aggregate through its {@link AggregateRepository}.
 *   <li>Only after a successful save: publish the pending {@link DomainEvent}s and clear them.
 * </ul>
 *
 * <p>Publication is at-least-once from the consumer's perspective and best-effort from the
 * caller's: a publisher failure is logged and never turns a committed change into an error.
 *
 * <p>Because {@link DomainCommand} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <A> the aggregate type the command works with
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?, ?>,
  A extends AggregateRoot<?>
>
extends
        DomainHandler<COMMAND>
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update,
  DomainCommandHandler.Delete
{
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(DomainCommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * @return the class type of the command being handled by this {@link DomainCommandHandler}
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Executes the core logic of the command, up to and including the save.
   *
   * @param command being executed
   * @param repository to load and save the aggregate with
   * @param retryPolicy to apply on version conflicts
   * @return the saved aggregate, still holding its pending events
   */
  protected abstract A internalRunContract(
      final COMMAND command,
      final AggregateRepository<A> repository,
      final CommandRetryPolicy retryPolicy);

  /**
   * Executes the given command and publishes the resulting events.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link BoundedContext}
   * only.
   *
   * @param command to be executed
   * @param repository to load and save the aggregate with
   * @param domainEventPublisher to hand the events to after the save
   * @param retryPolicy to apply on version conflicts
   * @return the saved aggregate with no pending events
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if any internal state is invalid (typically null)
   * @throws UnauthorizedException if the client is not authorized to execute the command
   */
  final A runInContext(
      final COMMAND command,
      final AggregateRepository<A> repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    verifyClient(nonNullCommand, "Command", getCommandClass());

    final AggregateRepository<A> nonNullRepository =
        throwIllegalStateIfNull(repository, "Repository");
    final DomainEventPublisher nonNullPublisher =
        throwIllegalStateIfNull(domainEventPublisher, "Event publisher");
    final CommandRetryPolicy nonNullRetryPolicy =
        throwIllegalStateIfNull(retryPolicy, "Retry policy");

    final A aggregate =
        throwIllegalStateIfNull(
            internalRunContract(nonNullCommand, nonNullRepository, nonNullRetryPolicy),
            "Command handler result");

    publishPendingEvents(aggregate, nonNullPublisher);
    return aggregate;
  }

  /**
   * Runs an attempt until it succeeds, or fails with something other than a version conflict, or
   * the policy gives up.
   *
   * @param aggregateId the attempts work on
   * @param retryPolicy to consult after every conflict
   * @param attempt loading a fresh aggregate, running the business operation and saving it
   * @return the result of the first successful attempt
   */
  final A retryOnConflict(
      final UUID aggregateId, final CommandRetryPolicy retryPolicy, final Supplier<A> attempt) {
    int attemptNumber = 1;

    while (true) {
      try {
        return attempt.get();
      } catch (VersionConflictException e) {
        if (!retryPolicy.allowsAnotherAttemptAfter(attemptNumber)) {
          throw e;
        }

        log.warn(
            "{} on '{}' lost a race (attempt {} of {}), retrying with a fresh copy",
            getCommandClass().getSimpleName(),
            aggregateId,
            attemptNumber,
            retryPolicy.maxAttempts());
        attemptNumber++;
      }
    }
  }

  private void publishPendingEvents(final A aggregate, final DomainEventPublisher publisher) {
    final List<DomainEvent> events = aggregate.getDomainEvents();

    for (DomainEvent event : events) {
      Try.run(() -> publisher.publish(event))
          .onFailure(
              cause ->
                  log.error(
                      "Failed to publish {} '{}' for {} '{}'",
                      event.eventType(),
                      event.messageId(),
                      event.aggregateType().displayName(),
                      event.aggregateId(),
                      cause));
    }

    aggregate.clearDomainEvents();
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <A> the aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>,
    A extends AggregateRoot<?>
  > extends DomainCommandHandler<CREATE, A> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic building the new aggregate.
     *
     * @param command containing the data required to create the aggregate
     * @param repository to consult for uniqueness rules, must not be used for writing
     * @return the new aggregate, not yet saved
     */
    protected abstract A create(final CREATE command, final AggregateRepository<A> repository);

    /** {@inheritDoc} */
    @Override
    protected final A internalRunContract(
        final CREATE command,
        final AggregateRepository<A> repository,
        final CommandRetryPolicy retryPolicy) {
      final A aggregate =
          throwIllegalStateIfNull(create(command, repository), "Created aggregate");
      repository.save(aggregate);
      return aggregate;
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}: load, apply
   * the business operation, save, retrying the whole cycle on version conflicts.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <A> the aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?, ?>,
    A extends AggregateRoot<?>
  > extends DomainCommandHandler<UPDATE, A> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic changing the aggregate. May run more than once for the same command, each
     * time against a freshly loaded aggregate.
     *
     * @param command containing the data required to change the aggregate
     * @param aggregate freshly loaded
     */
    protected abstract void apply(final UPDATE command, final A aggregate);

    /** {@inheritDoc} */
    @Override
    protected final A internalRunContract(
        final UPDATE command,
        final AggregateRepository<A> repository,
        final CommandRetryPolicy retryPolicy) {
      final UUID aggregateId = throwIllegalStateIfNull(command.aggregateId(), "Aggregate ID");

      return retryOnConflict(
          aggregateId,
          retryPolicy,
          () -> {
            final A aggregate = repository.getById(aggregateId);
            apply(command, aggregate);
            repository.save(aggregate);
            return aggregate;
          });
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Delete}.
   *
   * @param <DELETE> the type of the particular {@link DomainCommand.Delete}
   * @param <A> the aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Delete<
    DELETE extends DomainCommand.Delete<?, ?>,
    A extends AggregateRoot<?>
  > extends DomainCommandHandler<DELETE, A> {
  // @formatter:on
    protected Delete(final Class<DELETE> commandClass) {
      super(commandClass);
    }

    /**
     * Business rule deciding whether the aggregate may be deleted, does nothing by default.
     *
     * @param command requesting the deletion
     * @param aggregate freshly loaded
     */
    protected void verifyDeletable(final DELETE command, final A aggregate) {
      // Everything can be deleted unless stated otherwise
    }

    /** {@inheritDoc} */
    @Override
    protected final A internalRunContract(
        final DELETE command,
        final AggregateRepository<A> repository,
        final CommandRetryPolicy retryPolicy) {
      final UUID aggregateId = throwIllegalStateIfNull(command.aggregateId(), "Aggregate ID");

      return retryOnConflict(
          aggregateId,
          retryPolicy,
          () -> {
            final A aggregate = repository.getById(aggregateId);
            verifyDeletable(command, aggregate);
            repository.delete(aggregate);
            return aggregate;
          });
    }
  }
}
