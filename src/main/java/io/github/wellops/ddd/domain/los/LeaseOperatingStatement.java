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

package io.github.wellops.ddd.domain.los;

import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.TransitionTable;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.vo.Money;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Monthly statement of the expenses of a lease, distributed to the working interest owners once
 * finalized.
 *
 * <p>Expenses are kept as line items, which can only change while the statement is a {@link
 * LosStatus#DRAFT}. Totals are always derived from them. There is at most one statement per lease
 * and month; the store enforces it with a unique key.
 */
public final class LeaseOperatingStatement extends AggregateRoot<LosStatus> {
  public static final TransitionTable<LosStatus> TRANSITIONS =
      TransitionTable.builder(AggregateType.LEASE_OPERATING_STATEMENT, LosStatus.class)
          .allow(LosStatus.DRAFT, LosStatus.FINALIZED)
          .allow(LosStatus.FINALIZED, LosStatus.DISTRIBUTED, LosStatus.DRAFT)
          .allow(LosStatus.DISTRIBUTED, LosStatus.ARCHIVED)
          .terminal(LosStatus.ARCHIVED)
          .allowAnyFrom(LosStatus.UNKNOWN)
          .build();

  private final UUID leaseId;
  private final UUID organizationId;
  private final YearMonth statementMonth;
  private final String currency;
  private final Map<String, ExpenseLineItem> lineItems;

  private LeaseOperatingStatement(
      final UUID id,
      final UUID leaseId,
      final UUID organizationId,
      final YearMonth statementMonth,
      final String currency,
      final Clock clock) {
    super(id, LosStatus.DRAFT, clock);
    this.leaseId = leaseId;
    this.organizationId = organizationId;
    this.statementMonth = statementMonth;
    this.currency = currency;
    this.lineItems = new LinkedHashMap<>();
  }

  private LeaseOperatingStatement(final Snapshot snapshot, final Clock clock) {
    super(
        snapshot.id(),
        snapshot.status(),
        snapshot.version(),
        snapshot.createdAt(),
        snapshot.updatedAt(),
        clock);
    this.leaseId = snapshot.leaseId();
    this.organizationId = snapshot.organizationId();
    this.statementMonth = snapshot.statementMonth();
    this.currency = snapshot.currency();
    this.lineItems = new LinkedHashMap<>();
    if (snapshot.lineItems() != null) {
      snapshot.lineItems().forEach(lineItem -> lineItems.put(lineItem.id(), lineItem));
    }
  }

  /**
   * Opens a new statement in {@link LosStatus#DRAFT} status with no expenses.
   *
   * @param clock to take timestamps from
   * @param leaseId the statement is for
   * @param organizationId operating the lease
   * @param statementMonth covered by the statement, cannot be in the future
   * @param currency of the expenses
   * @return a new, not yet persisted statement
   */
  public static LeaseOperatingStatement create(
      final Clock clock,
      final UUID leaseId,
      final UUID organizationId,
      final YearMonth statementMonth,
      final String currency) {
    DomainPreconditions.requireValue(statementMonth, "statementMonth");
    DomainPreconditions.check(
        clock == null || !statementMonth.isAfter(YearMonth.now(clock)),
        "statementMonth",
        "Statement month cannot be in the future");

    return new LeaseOperatingStatement(
        UUID.randomUUID(),
        DomainPreconditions.requireValue(leaseId, "leaseId"),
        DomainPreconditions.requireValue(organizationId, "organizationId"),
        statementMonth,
        Money.zero(currency).getCurrency(),
        clock);
  }

  public static LeaseOperatingStatement rehydrate(final Snapshot snapshot, final Clock clock) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Lease operating statement snapshot cannot be null");
    }

    return new LeaseOperatingStatement(snapshot, clock);
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.LEASE_OPERATING_STATEMENT;
  }

  @Override
  protected TransitionTable<LosStatus> transitionTable() {
    return TRANSITIONS;
  }

  /**
   * @param lineItem to add, in the statement currency and with an ID not used on this statement
   */
  public void addExpenseLineItem(final ExpenseLineItem lineItem) {
    requireDraft();
    requireCurrencyOf(lineItem);
    if (lineItems.containsKey(lineItem.id())) {
      throw new ValidationException(
          "lineItemId", "Expense line item %s already exists".formatted(lineItem.id()));
    }

    lineItems.put(lineItem.id(), lineItem);
    touch();
  }

  /**
   * @param lineItem replacing the line item with the same ID
   */
  public void updateExpenseLineItem(final ExpenseLineItem lineItem) {
    requireDraft();
    requireCurrencyOf(lineItem);
    requireLineItem(lineItem.id());

    lineItems.put(lineItem.id(), lineItem);
    touch();
  }

  /**
   * @param lineItemId of the line item to remove
   */
  public void removeExpenseLineItem(final String lineItemId) {
    requireDraft();
    requireLineItem(lineItemId);

    lineItems.remove(lineItemId);
    touch();
  }

  /**
   * @param finalizedBy identity of the actor
   * @throws ValidationException if the statement has no line items
   */
  public void finalizeStatement(final String finalizedBy) {
    DomainPreconditions.check(
        !lineItems.isEmpty(), "expense", "Cannot finalize a statement without expenses");

    transitionTo(LosStatus.FINALIZED, finalizedBy, null);
  }

  public void reopen(final String reopenedBy, final String reason) {
    transitionTo(LosStatus.DRAFT, reopenedBy, DomainPreconditions.requireText(reason, "reason"));
  }

  public void distribute(final String distributedBy) {
    transitionTo(LosStatus.DISTRIBUTED, distributedBy, null);
  }

  public void archive(final String archivedBy) {
    transitionTo(LosStatus.ARCHIVED, archivedBy, null);
  }

  public UUID getLeaseId() {
    return leaseId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public YearMonth getStatementMonth() {
    return statementMonth;
  }

  public String getCurrency() {
    return currency;
  }

  /**
   * @return line items in the order they were added
   */
  public List<ExpenseLineItem> getExpenseLineItems() {
    return List.copyOf(lineItems.values());
  }

  public int getExpenseCount() {
    return lineItems.size();
  }

  public Money getTotalExpenses() {
    return sumOf(null);
  }

  public Money getOperatingExpenses() {
    return sumOf(ExpenseType.OPERATING);
  }

  public Money getCapitalExpenses() {
    return sumOf(ExpenseType.CAPITAL);
  }

  public Snapshot toSnapshot() {
    return new Snapshot(
        getId(),
        leaseId,
        organizationId,
        statementMonth,
        getStatus(),
        currency,
        getExpenseLineItems(),
        getCreatedAt(),
        getUpdatedAt(),
        getVersion());
  }

  /**
   * @param type to sum up, {@code null} for all of them
   */
  private Money sumOf(final ExpenseType type) {
    Money total = Money.zero(currency);
    for (ExpenseLineItem lineItem : lineItems.values()) {
      if (type == null || lineItem.type() == type) {
        total = total.add(lineItem.amount());
      }
    }

    return total;
  }

  private void requireDraft() {
    DomainPreconditions.check(
        getStatus() == LosStatus.DRAFT,
        "expense",
        "Expenses can only change while the statement is a draft");
  }

  private void requireCurrencyOf(final ExpenseLineItem lineItem) {
    DomainPreconditions.requireValue(lineItem, "lineItem");
    DomainPreconditions.check(
        lineItem.amount().getCurrency().equals(currency),
        "amount",
        "Expense must be in %s".formatted(currency));
  }

  private void requireLineItem(final String lineItemId) {
    DomainPreconditions.requireValue(lineItemId, "lineItemId");
    if (!lineItems.containsKey(lineItemId)) {
      throw new ValidationException(
          "lineItemId", "Expense line item %s not found".formatted(lineItemId));
    }
  }

  /**
   * Persistable state of a {@link LeaseOperatingStatement}.
   *
   * @param lineItems in the order they were added
   */
  public record Snapshot(
      UUID id,
      UUID leaseId,
      UUID organizationId,
      YearMonth statementMonth,
      LosStatus status,
      String currency,
      List<ExpenseLineItem> lineItems,
      Instant createdAt,
      Instant updatedAt,
      long version) {}
}
