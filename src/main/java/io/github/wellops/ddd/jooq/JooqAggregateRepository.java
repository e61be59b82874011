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

package io.github.wellops.ddd.jooq;

import io.github.wellops.ddd.domain.AggregateNotFoundException;
import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.DomainException;
import io.github.wellops.ddd.domain.PersistenceException;
import io.github.wellops.ddd.domain.VersionConflictException;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.specification.Specification;
import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AggregateRepository} storing one aggregate per table row, with a numeric {@code version}
 * column guarding concurrent writes.
 *
 * <p>Subclasses only describe the mapping between a row and an aggregate; reading, version-checked
 * writing and error translation are handled here. Aggregates owning collections keep them in child
 * tables, which subclasses read in {@link #fromRecord(DSLContext, Record)} and replace in {@link
 * #writeChildren(DSLContext, AggregateRoot)}.
 *
 * @param <A> the aggregate type
 */
public abstract class JooqAggregateRepository<A extends AggregateRoot<?>>
    implements AggregateRepository<A> {
  private static final Logger log = LoggerFactory.getLogger(JooqAggregateRepository.class);

  private static final long NOT_STORED = 0L;

  private final AggregateType aggregateType;
  private final Table<?> table;
  private final Field<UUID> idColumn;
  private final Field<Long> versionColumn;
  private final List<Field<?>> columns;
  private final DslContextProvider dslContextProvider;
  private final Clock clock;

  /**
   * Default constructor.
   *
   * @param aggregateType stored in the table
   * @param table holding the aggregates
   * @param idColumn holding the aggregate identifier
   * @param versionColumn holding the aggregate version
   * @param columns to read, including identifier and version
   * @param dslContextProvider to obtain database access from
   * @param clock handed over to rehydrated aggregates
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected JooqAggregateRepository(
      final AggregateType aggregateType,
      final Table<?> table,
      final Field<UUID> idColumn,
      final Field<Long> versionColumn,
      final List<Field<?>> columns,
      final DslContextProvider dslContextProvider,
      final Clock clock) {
    this.aggregateType = throwIfNull(aggregateType, "Aggregate type");
    this.table = throwIfNull(table, "Table");
    this.idColumn = throwIfNull(idColumn, "ID column");
    this.versionColumn = throwIfNull(versionColumn, "Version column");
    this.columns = List.copyOf(throwIfNull(columns, "Columns"));
    this.dslContextProvider = throwIfNull(dslContextProvider, "DSL context provider");
    this.clock = throwIfNull(clock, "Clock");
  }

  /**
   * Rebuilds an aggregate through its rehydration path.
   *
   * @param dsl to read child rows with, if the aggregate has any
   * @param dbRecord containing all the columns passed to the constructor
   * @return rehydrated aggregate
   */
  protected abstract A fromRecord(final DSLContext dsl, final Record dbRecord);

  /**
   * @param aggregate to store
   * @return values of every column except identifier and version
   */
  protected abstract Map<Field<?>, Object> toValues(final A aggregate);

  /**
   * Replaces the child rows of an aggregate, within the transaction which has just written its
   * main row. Does nothing by default.
   *
   * @param dsl bound to the save transaction
   * @param aggregate being saved
   */
  protected void writeChildren(final DSLContext dsl, final A aggregate) {
    // No child rows
  }

  /**
   * Removes the child rows of an aggregate, within the transaction which has just deleted its main
   * row. Does nothing by default.
   *
   * @param dsl bound to the delete transaction
   * @param aggregate being deleted
   */
  protected void deleteChildren(final DSLContext dsl, final A aggregate) {
    // No child rows
  }

  /**
   * @return the clock to rehydrate aggregates with
   */
  protected final Clock clock() {
    return clock;
  }

  public final AggregateType getAggregateType() {
    return aggregateType;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<A> findById(final UUID id) {
    final UUID nonNullId = throwIfNull(id, "Aggregate ID");

    return translate(
        "load",
        () -> {
          final DSLContext dsl = dsl();
          return dsl.select(columns)
              .from(table)
              .where(idColumn.eq(nonNullId))
              .fetchOptional()
              .map(dbRecord -> fromRecord(dsl, dbRecord));
        });
  }

  /** {@inheritDoc} */
  @Override
  public A getById(final UUID id) {
    return findById(id).orElseThrow(() -> new AggregateNotFoundException(aggregateType, id));
  }

  /** {@inheritDoc} */
  @Override
  public void save(final A aggregate) {
    final A nonNullAggregate = throwIfNull(aggregate, "Aggregate");
    final long writtenVersion = nonNullAggregate.getVersion();

    translate(
        "save",
        () ->
            dsl()
                .transactionResult(
                    (final Configuration trx) -> {
                      if (nonNullAggregate.isNew()) {
                        insert(trx.dsl(), nonNullAggregate);
                      } else {
                        update(trx.dsl(), nonNullAggregate);
                      }

                      writeChildren(trx.dsl(), nonNullAggregate);
                      return nonNullAggregate;
                    }));

    nonNullAggregate.markPersisted(writtenVersion);
    log.debug("Saved {}", nonNullAggregate);
  }

  /** {@inheritDoc} */
  @Override
  public List<A> findBy(final Specification<A> specification) {
    final Specification<A> nonNullSpecification = throwIfNull(specification, "Specification");

    return translate(
        "query",
        () -> {
          final DSLContext dsl = dsl();
          return dsl.select(columns)
              .from(table)
              .where(nonNullSpecification.toQueryClause())
              .orderBy(idColumn)
              .fetch(dbRecord -> fromRecord(dsl, dbRecord));
        });
  }

  /** {@inheritDoc} */
  @Override
  public int count(final Specification<A> specification) {
    final Specification<A> nonNullSpecification = throwIfNull(specification, "Specification");

    return translate(
        "count", () -> dsl().fetchCount(table, nonNullSpecification.toQueryClause()));
  }

  /** {@inheritDoc} */
  @Override
  public void delete(final A aggregate) {
    final A nonNullAggregate = throwIfNull(aggregate, "Aggregate");
    if (nonNullAggregate.isNew()) {
      throw new AggregateNotFoundException(aggregateType, nonNullAggregate.getId());
    }

    translate(
        "delete",
        () ->
            dsl()
                .transactionResult(
                    (final Configuration trx) -> {
                      final int deleted =
                          trx.dsl()
                              .deleteFrom(table)
                              .where(
                                  idColumn
                                      .eq(nonNullAggregate.getId())
                                      .and(
                                          versionColumn.eq(
                                              nonNullAggregate.getPersistedVersion())))
                              .execute();

                      if (deleted == 0) {
                        throw missedWrite(trx.dsl(), nonNullAggregate);
                      }

                      deleteChildren(trx.dsl(), nonNullAggregate);
                      return deleted;
                    }));

    log.debug("Deleted {}", nonNullAggregate);
  }

  private void insert(final DSLContext dsl, final A aggregate) {
    final Optional<Long> storedVersion = fetchStoredVersion(dsl, aggregate.getId());
    if (storedVersion.isPresent()) {
      throw new VersionConflictException(
          aggregateType, aggregate.getId(), NOT_STORED, storedVersion.get());
    }

    dsl.insertInto(table)
        .set(toValues(aggregate))
        .set(idColumn, aggregate.getId())
        .set(versionColumn, aggregate.getVersion())
        .execute();
  }

  private void update(final DSLContext dsl, final A aggregate) {
    final int updated =
        dsl.update(table)
            .set(toValues(aggregate))
            .set(versionColumn, aggregate.getVersion())
            .where(
                idColumn
                    .eq(aggregate.getId())
                    .and(versionColumn.eq(aggregate.getPersistedVersion())))
            .execute();

    if (updated == 0) {
      throw missedWrite(dsl, aggregate);
    }
  }

  /**
   * Explains why a version-guarded statement did not touch any row.
   *
   * @param dsl to inspect the current state with
   * @param aggregate which was written
   * @return the exception to throw
   */
  private DomainException missedWrite(final DSLContext dsl, final A aggregate) {
    final Optional<Long> storedVersion = fetchStoredVersion(dsl, aggregate.getId());
    if (storedVersion.isEmpty()) {
      return new AggregateNotFoundException(aggregateType, aggregate.getId());
    }

    log.info(
        "Version conflict on {} '{}': loaded {}, stored {}",
        aggregateType.displayName(),
        aggregate.getId(),
        aggregate.getPersistedVersion(),
        storedVersion.get());
    return new VersionConflictException(
        aggregateType, aggregate.getId(), aggregate.getPersistedVersion(), storedVersion.get());
  }

  private Optional<Long> fetchStoredVersion(final DSLContext dsl, final UUID id) {
    return dsl.select(versionColumn)
        .from(table)
        .where(idColumn.eq(id))
        .fetchOptional(versionColumn);
  }

  private DSLContext dsl() {
    final DSLContext dsl = dslContextProvider.apply(aggregateType);
    if (dsl == null) {
      throw new IllegalStateException(
          "No DSLContext provided for %s".formatted(aggregateType.displayName()));
    }

    return dsl;
  }

  /**
   * Runs a store operation, letting domain failures through and hiding the store-specific ones
   * behind {@link PersistenceException}.
   *
   * @param operation name used in the error message
   * @param action to run
   * @return the result of the action
   * @param <T> the result type
   */
  private <T> T translate(final String operation, final CheckedFunction0<T> action) {
    return Try.of(action).getOrElseThrow(cause -> translateFailure(operation, cause));
  }

  private RuntimeException translateFailure(final String operation, final Throwable cause) {
    if (cause instanceof DomainException domainException) {
      return domainException;
    }

    if (cause instanceof RuntimeException runtimeException
        && !(cause instanceof DataAccessException)) {
      return runtimeException;
    }

    log.error("Failed to {} {}", operation, aggregateType.displayName(), cause);
    return new PersistenceException(
        "Failed to %s %s".formatted(operation, aggregateType.displayName()), cause);
  }

  /**
   * @param amount stored, may be {@code null}
   * @param currency stored alongside the amount
   * @return money value, or {@code null} if no amount was stored
   */
  protected static Money moneyOf(final BigDecimal amount, final String currency) {
    return amount == null ? null : Money.of(amount, currency);
  }

  private static <T> T throwIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
