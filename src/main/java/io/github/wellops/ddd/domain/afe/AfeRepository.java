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

package io.github.wellops.ddd.domain.afe;

import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.jooq.DslContextProvider;
import io.github.wellops.ddd.jooq.JooqAggregateRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;

/** Stores {@link Afe}s in the {@link AfeTable}. */
public class AfeRepository extends JooqAggregateRepository<Afe> {
  public AfeRepository(final DslContextProvider dslContextProvider, final Clock clock) {
    super(
        AggregateType.AFE,
        AfeTable.TABLE,
        AfeTable.ID,
        AfeTable.VERSION,
        AfeTable.FIELDS,
        dslContextProvider,
        clock);
  }

  @Override
  protected Afe fromRecord(final DSLContext dsl, final Record dbRecord) {
    final String currency = dbRecord.get(AfeTable.CURRENCY);

    return Afe.rehydrate(
        new Afe.Snapshot(
            dbRecord.get(AfeTable.ID),
            new AfeNumber(dbRecord.get(AfeTable.AFE_NUMBER)),
            dbRecord.get(AfeTable.ORGANIZATION_ID),
            dbRecord.get(AfeTable.WELL_ID),
            dbRecord.get(AfeTable.AFE_TYPE),
            dbRecord.get(AfeTable.STATUS),
            moneyOf(dbRecord.get(AfeTable.ESTIMATED_COST), currency),
            moneyOf(dbRecord.get(AfeTable.APPROVED_AMOUNT), currency),
            moneyOf(dbRecord.get(AfeTable.ACTUAL_COST), currency),
            dbRecord.get(AfeTable.DESCRIPTION),
            dbRecord.get(AfeTable.APPROVAL_DATE),
            dbRecord.get(AfeTable.CREATED_AT),
            dbRecord.get(AfeTable.UPDATED_AT),
            dbRecord.get(AfeTable.VERSION)),
        clock());
  }

  @Override
  protected Map<Field<?>, Object> toValues(final Afe afe) {
    final Afe.Snapshot snapshot = afe.toSnapshot();

    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(AfeTable.AFE_NUMBER, snapshot.afeNumber().value());
    values.put(AfeTable.ORGANIZATION_ID, snapshot.organizationId());
    values.put(AfeTable.WELL_ID, snapshot.wellId());
    values.put(AfeTable.AFE_TYPE, snapshot.afeType());
    values.put(AfeTable.STATUS, snapshot.status());
    values.put(AfeTable.CURRENCY, snapshot.estimatedCost().getCurrency());
    values.put(AfeTable.ESTIMATED_COST, snapshot.estimatedCost().getAmount());
    values.put(AfeTable.APPROVED_AMOUNT, amountOf(snapshot.approvedAmount()));
    values.put(AfeTable.ACTUAL_COST, amountOf(snapshot.actualCost()));
    values.put(AfeTable.DESCRIPTION, snapshot.description());
    values.put(AfeTable.APPROVAL_DATE, snapshot.approvalDate());
    values.put(AfeTable.CREATED_AT, snapshot.createdAt());
    values.put(AfeTable.UPDATED_AT, snapshot.updatedAt());
    return values;
  }

  private static Object amountOf(final Money money) {
    return money == null ? null : money.getAmount();
  }
}
