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

import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.jooq.DslContextProvider;
import io.github.wellops.ddd.jooq.JooqAggregateRepository;
import java.time.Clock;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;

/**
 * Stores {@link LeaseOperatingStatement}s in the {@link LeaseOperatingStatementTable}, with their
 * line items in the {@link ExpenseLineItemTable}.
 */
public class LeaseOperatingStatementRepository
    extends JooqAggregateRepository<LeaseOperatingStatement> {
  public LeaseOperatingStatementRepository(
      final DslContextProvider dslContextProvider, final Clock clock) {
    super(
        AggregateType.LEASE_OPERATING_STATEMENT,
        LeaseOperatingStatementTable.TABLE,
        LeaseOperatingStatementTable.ID,
        LeaseOperatingStatementTable.VERSION,
        LeaseOperatingStatementTable.FIELDS,
        dslContextProvider,
        clock);
  }

  @Override
  protected LeaseOperatingStatement fromRecord(final DSLContext dsl, final Record dbRecord) {
    return LeaseOperatingStatement.rehydrate(
        new LeaseOperatingStatement.Snapshot(
            dbRecord.get(LeaseOperatingStatementTable.ID),
            dbRecord.get(LeaseOperatingStatementTable.LEASE_ID),
            dbRecord.get(LeaseOperatingStatementTable.ORGANIZATION_ID),
            YearMonth.from(dbRecord.get(LeaseOperatingStatementTable.STATEMENT_MONTH)),
            dbRecord.get(LeaseOperatingStatementTable.STATUS),
            dbRecord.get(LeaseOperatingStatementTable.CURRENCY),
            dsl.select(ExpenseLineItemTable.FIELDS)
                .from(ExpenseLineItemTable.TABLE)
                .where(
                    ExpenseLineItemTable.STATEMENT_ID.eq(
                        dbRecord.get(LeaseOperatingStatementTable.ID)))
                .orderBy(ExpenseLineItemTable.SORT_ORDER)
                .fetch(LeaseOperatingStatementRepository::lineItemOf),
            dbRecord.get(LeaseOperatingStatementTable.CREATED_AT),
            dbRecord.get(LeaseOperatingStatementTable.UPDATED_AT),
            dbRecord.get(LeaseOperatingStatementTable.VERSION)),
        clock());
  }

  @Override
  protected Map<Field<?>, Object> toValues(final LeaseOperatingStatement statement) {
    final LeaseOperatingStatement.Snapshot snapshot = statement.toSnapshot();

    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(LeaseOperatingStatementTable.LEASE_ID, snapshot.leaseId());
    values.put(LeaseOperatingStatementTable.ORGANIZATION_ID, snapshot.organizationId());
    values.put(LeaseOperatingStatementTable.STATEMENT_MONTH, snapshot.statementMonth().atDay(1));
    values.put(LeaseOperatingStatementTable.STATUS, snapshot.status());
    values.put(LeaseOperatingStatementTable.CURRENCY, snapshot.currency());
    values.put(
        LeaseOperatingStatementTable.TOTAL_EXPENSES, statement.getTotalExpenses().getAmount());
    values.put(
        LeaseOperatingStatementTable.OPERATING_EXPENSES,
        statement.getOperatingExpenses().getAmount());
    values.put(
        LeaseOperatingStatementTable.CAPITAL_EXPENSES, statement.getCapitalExpenses().getAmount());
    values.put(LeaseOperatingStatementTable.EXPENSE_COUNT, statement.getExpenseCount());
    values.put(LeaseOperatingStatementTable.CREATED_AT, snapshot.createdAt());
    values.put(LeaseOperatingStatementTable.UPDATED_AT, snapshot.updatedAt());
    return values;
  }

  @Override
  protected void writeChildren(final DSLContext dsl, final LeaseOperatingStatement statement) {
    deleteChildren(dsl, statement);

    final List<ExpenseLineItem> lineItems = statement.getExpenseLineItems();
    for (int sortOrder = 0; sortOrder < lineItems.size(); sortOrder++) {
      final ExpenseLineItem lineItem = lineItems.get(sortOrder);
      dsl.insertInto(ExpenseLineItemTable.TABLE)
          .set(ExpenseLineItemTable.STATEMENT_ID, statement.getId())
          .set(ExpenseLineItemTable.LINE_ITEM_ID, lineItem.id())
          .set(ExpenseLineItemTable.SORT_ORDER, sortOrder)
          .set(ExpenseLineItemTable.DESCRIPTION, lineItem.description())
          .set(ExpenseLineItemTable.CATEGORY, lineItem.category())
          .set(ExpenseLineItemTable.EXPENSE_TYPE, lineItem.type())
          .set(ExpenseLineItemTable.AMOUNT, lineItem.amount().getAmount())
          .set(ExpenseLineItemTable.CURRENCY, lineItem.amount().getCurrency())
          .execute();
    }
  }

  @Override
  protected void deleteChildren(final DSLContext dsl, final LeaseOperatingStatement statement) {
    dsl.deleteFrom(ExpenseLineItemTable.TABLE)
        .where(ExpenseLineItemTable.STATEMENT_ID.eq(statement.getId()))
        .execute();
  }

  private static ExpenseLineItem lineItemOf(final Record dbRecord) {
    return new ExpenseLineItem(
        dbRecord.get(ExpenseLineItemTable.LINE_ITEM_ID),
        dbRecord.get(ExpenseLineItemTable.DESCRIPTION),
        dbRecord.get(ExpenseLineItemTable.CATEGORY),
        dbRecord.get(ExpenseLineItemTable.EXPENSE_TYPE),
        moneyOf(
            dbRecord.get(ExpenseLineItemTable.AMOUNT),
            dbRecord.get(ExpenseLineItemTable.CURRENCY)));
  }
}
