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

package io.github.wellops.ddd.domain;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class of every aggregate: owns the identity, the status guarded by a {@link
 * TransitionTable}, the optimistic version counter and the buffer of pending {@link DomainEvent}s.
 *
 * <p>Aggregates come to life in one of two ways:
 *
 * <ul>
 *   <li>Creation - a brand new aggregate at version {@code 1}, not yet persisted.
 *   <li>Rehydration - an aggregate loaded from storage with its exact stored version.
 * </ul>
 *
 * <p>Afterwards state changes only through business methods of the subclasses, each of which
 * validates its input first and then either calls {@link #transitionTo(Enum, String, String)} or
 * {@link #touch()}, so that every successful mutation increments the version by exactly one.
 *
 * <p>Besides the current version, the aggregate remembers the version it was loaded with: this is
 * what repositories compare against the stored version when saving.
 *
 * @param <S> the status enum of the aggregate type
 */
public abstract class AggregateRoot<S extends Enum<S>> {
  /** Version of an aggregate which has just been created. */
  public static final long INITIAL_VERSION = 1L;

  private static final long NOT_PERSISTED = 0L;

  private final UUID id;
  private final Instant createdAt;
  private final Clock clock;
  private final DomainEventBuffer domainEvents;

  private S status;
  private long version;
  private long persistedVersion;
  private Instant updatedAt;

  /**
   * Creation constructor.
   *
   * @param id of the new aggregate
   * @param initialStatus of the new aggregate, must be declared in the transition table
   * @param clock to take timestamps from
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if the initial status is not declared in the transition table
   */
  protected AggregateRoot(final UUID id, final S initialStatus, final Clock clock) {
    this.id = throwIfNull(id, "Aggregate ID");
    this.clock = throwIfNull(clock, "Clock");
    this.status = throwIfNull(initialStatus, "Initial status");
    this.domainEvents = new DomainEventBuffer();
    this.version = INITIAL_VERSION;
    this.persistedVersion = NOT_PERSISTED;
    this.createdAt = Instant.now(clock);
    this.updatedAt = createdAt;

    if (!transitionTable().isDeclared(initialStatus)) {
      throw new IllegalStateException(
          "%s cannot be created in undeclared status %s"
              .formatted(aggregateType().displayName(), initialStatus));
    }
  }

  /**
   * Rehydration constructor.
   *
   * @param id of the stored aggregate
   * @param status stored
   * @param version stored, at least {@link #INITIAL_VERSION}
   * @param createdAt stored
   * @param updatedAt stored
   * @param clock to take timestamps from
   * @throws IllegalArgumentException if any of the arguments is {@code null} or version is invalid
   */
  protected AggregateRoot(
      final UUID id,
      final S status,
      final long version,
      final Instant createdAt,
      final Instant updatedAt,
      final Clock clock) {
    if (version < INITIAL_VERSION) {
      throw new IllegalArgumentException(
          "Stored version must be positive, got %d".formatted(version));
    }

    this.id = throwIfNull(id, "Aggregate ID");
    this.status = throwIfNull(status, "Status");
    this.createdAt = throwIfNull(createdAt, "Creation time");
    this.updatedAt = throwIfNull(updatedAt, "Update time");
    this.clock = throwIfNull(clock, "Clock");
    this.domainEvents = new DomainEventBuffer();
    this.version = version;
    this.persistedVersion = version;
  }

  /**
   * @return the tag of this aggregate type
   */
  public abstract AggregateType aggregateType();

  /**
   * Must return the same table for every instance of the type; it is consulted during
   * construction.
   *
   * @return the transition table of this aggregate type
   */
  protected abstract TransitionTable<S> transitionTable();

  public final UUID getId() {
    return id;
  }

  public final S getStatus() {
    return status;
  }

  public final long getVersion() {
    return version;
  }

  /**
   * @return the version this instance was loaded with or last saved at, {@code 0} if it was never
   *     persisted
   */
  public final long getPersistedVersion() {
    return persistedVersion;
  }

  public final Instant getCreatedAt() {
    return createdAt;
  }

  public final Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * @return {@code true} if this instance has never been persisted
   */
  public final boolean isNew() {
    return persistedVersion == NOT_PERSISTED;
  }

  /**
   * @return {@code true} if this instance carries changes which were not persisted yet
   */
  public final boolean hasUnsavedChanges() {
    return version != persistedVersion;
  }

  /**
   * @param target status
   * @return {@code true} if the aggregate may move to the target status right now
   */
  public final boolean canTransitionTo(final S target) {
    return transitionTable().permits(status, target);
  }

  /**
   * @return an immutable snapshot of the events raised since the last {@link
   *     #clearDomainEvents()}
   */
  public final List<DomainEvent> getDomainEvents() {
    return domainEvents.drain();
  }

  /** Discards pending events, to be called once they were published. */
  public final void clearDomainEvents() {
    domainEvents.clear();
  }

  /**
   * Records that the current state has been durably written.
   *
   * <p>Repository callback, not part of the business API: it moves the version future saves are
   * checked against, so it only accepts the version the repository has just written.
   *
   * @param writtenVersion the version stored by the write which just committed
   * @throws IllegalStateException if the aggregate is not at the written version
   */
  public final void markPersisted(final long writtenVersion) {
    if (writtenVersion != version) {
      throw new IllegalStateException(
          "%s '%s' is at version %d, cannot mark version %d as persisted"
              .formatted(aggregateType().displayName(), id, version, writtenVersion));
    }

    persistedVersion = writtenVersion;
  }

  /**
   * Moves the aggregate to another status, then bumps the version and raises a {@link
   * StatusChangedEvent}.
   *
   * @param target status
   * @param actor identity of whoever requested the change
   * @param reason optional explanation, may be {@code null}
   * @throws InvalidTransitionException if the move is not allowed; nothing is changed then
   * @throws ValidationException if the actor is blank
   */
  protected final void transitionTo(final S target, final String actor, final String reason) {
    final String changedBy = DomainPreconditions.requireText(actor, "actor");
    final S previous = status;
    transitionTable().verify(id, previous, target);

    status = target;
    touch();
    domainEvents.append(
        new StatusChangedEvent<>(
            UUID.randomUUID(),
            updatedAt,
            aggregateType(),
            id,
            version,
            previous,
            target,
            changedBy,
            reason));
  }

  /**
   * Marks a successful mutation: refreshes the update time and increments the version by one.
   */
  protected final void touch() {
    updatedAt = Instant.now(clock);
    version++;
  }

  /**
   * @return current time according to the clock of this aggregate
   */
  protected final Instant now() {
    return Instant.now(clock);
  }

  protected final Clock clock() {
    return clock;
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof AggregateRoot<?> that)) {
      return false;
    }

    return aggregateType() == that.aggregateType() && id.equals(that.id);
  }

  @Override
  public final int hashCode() {
    return Objects.hash(aggregateType(), id);
  }

  @Override
  public String toString() {
    return "%s{id=%s, status=%s, version=%d}"
        .formatted(aggregateType().displayName(), id, status, version);
  }

  private static <T> T throwIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
