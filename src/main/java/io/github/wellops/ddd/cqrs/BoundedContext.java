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
import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.jooq.AggregateRepository;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the handlers of one aggregate type, and the single entry point to invoke them.
 *
 * <p>Each {@link DomainCommand} or {@link DomainQuery} class can be served by exactly one handler;
 * registering a second one for the same class is a programming error.
 *
 * @param <A> the aggregate type of this context
 */
public abstract non-sealed class BoundedContext<A extends AggregateRoot<?>> extends Suspicious {
  private static final Logger log = LoggerFactory.getLogger(BoundedContext.class);

  private final AggregateRepository<A> repository;
  private final DomainEventPublisher domainEventPublisher;
  private final CommandRetryPolicy retryPolicy;

  private final ReentrantReadWriteLock commandHandlersLock;
  private final Map<Class<?>, DomainCommandHandler<?, A>> commandHandlers;

  private final ReentrantReadWriteLock queryHandlersLock;
  private final Map<Class<?>, DomainQueryHandler<?, A, ?>> queryHandlers;

  /**
   * Default constructor.
   *
   * @param repository of the aggregate type
   * @param domainEventPublisher receiving events after every successful save
   * @param retryPolicy applied to commands on version conflicts
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected BoundedContext(
      final AggregateRepository<A> repository,
      final DomainEventPublisher domainEventPublisher,
      final CommandRetryPolicy retryPolicy) {
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
    this.domainEventPublisher =
        throwIllegalArgumentIfNull(domainEventPublisher, "Domain event publisher");
    this.retryPolicy = throwIllegalArgumentIfNull(retryPolicy, "Retry policy");

    this.commandHandlersLock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();

    this.queryHandlersLock = new ReentrantReadWriteLock();
    this.queryHandlers = new HashMap<>();
  }

  public final AggregateRepository<A> getRepository() {
    return repository;
  }

  /**
   * @param handler to register
   * @return this context, for chaining
   * @throws IllegalArgumentException if the handler is {@code null}
   * @throws IllegalStateException if a handler for the same command class is registered already
   */
  public final BoundedContext<A> addDomainCommandHandler(final DomainCommandHandler<?, A> handler) {
    final DomainCommandHandler<?, A> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");

    withLock(
        commandHandlersLock.writeLock(),
        () -> register(commandHandlers, nonNullHandler.getCommandClass(), nonNullHandler));
    return this;
  }

  /**
   * @param handler to register
   * @return this context, for chaining
   * @throws IllegalArgumentException if the handler is {@code null}
   * @throws IllegalStateException if a handler for the same query class is registered already
   */
  public final BoundedContext<A> addDomainQueryHandler(final DomainQueryHandler<?, A, ?> handler) {
    final DomainQueryHandler<?, A, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Query handler");

    withLock(
        queryHandlersLock.writeLock(),
        () -> register(queryHandlers, nonNullHandler.getQueryClass(), nonNullHandler));
    return this;
  }

  /**
   * @return command classes this context can handle
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    return withLock(commandHandlersLock.readLock(), () -> Set.copyOf(commandHandlers.keySet()));
  }

  /**
   * @return query classes this context can handle
   */
  public final Set<Class<?>> getSupportedDomainQueryClasses() {
    return withLock(queryHandlersLock.readLock(), () -> Set.copyOf(queryHandlers.keySet()));
  }

  /**
   * @param command to run
   * @return the new, saved aggregate
   * @param <C> the type of the command
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <C extends DomainCommand.Create<?, ?>> A createModel(final C command) {
    return runCommand(command, DomainCommandHandler.Create.class);
  }

  /**
   * @param command to run
   * @return the changed, saved aggregate
   * @param <C> the type of the command
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <C extends DomainCommand.Update<?, ?>> A updateModel(final C command) {
    return runCommand(command, DomainCommandHandler.Update.class);
  }

  /**
   * @param command to run
   * @return the aggregate as it was when deleted
   * @param <C> the type of the command
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public final <C extends DomainCommand.Delete<?, ?>> A deleteModel(final C command) {
    return runCommand(command, DomainCommandHandler.Delete.class);
  }

  /**
   * @param query to run
   * @return the aggregate found, if any
   * @param <Q> the type of the query
   * @throws IllegalArgumentException if the query is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  @SuppressWarnings("unchecked")
  public final <Q extends DomainQuery.One<?, ?>> Optional<A> queryOne(final Q query) {
    return (Optional<A>) runQuery(query, DomainQueryHandler.One.class);
  }

  /**
   * @param query to run
   * @return the aggregates found, possibly none
   * @param <Q> the type of the query
   * @throws IllegalArgumentException if the query is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the query
   */
  @SuppressWarnings("unchecked")
  public final <Q extends DomainQuery.Many<?, ?>> List<A> queryMany(final Q query) {
    return (List<A>) runQuery(query, DomainQueryHandler.Many.class);
  }

  /** Visible for testing. */
  final boolean isAnyReadLockHeld() {
    return commandHandlersLock.getReadLockCount() > 0 || queryHandlersLock.getReadLockCount() > 0;
  }

  /** Visible for testing. */
  final boolean isAnyWriteLockHeld() {
    return commandHandlersLock.isWriteLocked() || queryHandlersLock.isWriteLocked();
  }

  private <C extends DomainCommand<?, ?>> A runCommand(final C command, final Class<?> kind) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler<?, A> handler =
        withLock(commandHandlersLock.readLock(), () -> commandHandlers.get(command.getClass()));

    if (handler == null || !kind.isInstance(handler)) {
      throw new UnsupportedOperationException(
          "No %s handler registered for command '%s'"
              .formatted(kind.getSimpleName(), command.getClass().getSimpleName()));
    }

    log.debug("Running {}", command.getClass().getSimpleName());
    return runWith(handler, nonNullCommand);
  }

  private <Q extends DomainQuery<?, ?>> Object runQuery(final Q query, final Class<?> kind) {
    final Q nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler<?, A, ?> handler =
        withLock(queryHandlersLock.readLock(), () -> queryHandlers.get(query.getClass()));

    if (handler == null || !kind.isInstance(handler)) {
      throw new UnsupportedOperationException(
          "No %s handler registered for query '%s'"
              .formatted(kind.getSimpleName(), query.getClass().getSimpleName()));
    }

    return runWith(handler, nonNullQuery);
  }

  /**
   * Handlers are registered under their own message class, so the cast cannot fail.
   *
   * @param handler registered for the class of the command
   * @param command to run
   * @return the saved aggregate
   * @param <C> the command type the handler accepts
   */
  private <C extends DomainCommand<?, ?>> A runWith(
      final DomainCommandHandler<C, A> handler, final DomainCommand<?, ?> command) {
    return handler.runInContext(
        handler.getCommandClass().cast(command), repository, domainEventPublisher, retryPolicy);
  }

  private <Q extends DomainQuery<?, ?>, O> O runWith(
      final DomainQueryHandler<Q, A, O> handler, final DomainQuery<?, ?> query) {
    return handler.runInContext(handler.getQueryClass().cast(query), repository);
  }

  private <H> Void register(final Map<Class<?>, H> handlers, final Class<?> key, final H handler) {
    if (handlers.containsKey(key)) {
      throw new IllegalStateException(
          "Handler for '%s' is already registered".formatted(key.getSimpleName()));
    }

    handlers.put(key, handler);
    return null;
  }

  private static <T> T withLock(final Lock lock, final Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
