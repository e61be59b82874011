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

package io.github.wellops.ddd.domain.permit;

import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.jooq.DslContextProvider;
import io.github.wellops.ddd.jooq.JooqAggregateRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;

/** Stores {@link Permit}s in the {@link PermitTable}. */
public class PermitRepository extends JooqAggregateRepository<Permit> {
  public PermitRepository(final DslContextProvider dslContextProvider, final Clock clock) {
    super(
        AggregateType.PERMIT,
        PermitTable.TABLE,
        PermitTable.ID,
        PermitTable.VERSION,
        PermitTable.FIELDS,
        dslContextProvider,
        clock);
  }

  @Override
  protected Permit fromRecord(final DSLContext dsl, final Record dbRecord) {
    return Permit.rehydrate(
        new Permit.Snapshot(
            dbRecord.get(PermitTable.ID),
            dbRecord.get(PermitTable.PERMIT_NUMBER),
            dbRecord.get(PermitTable.PERMIT_TYPE),
            dbRecord.get(PermitTable.WELL_ID),
            dbRecord.get(PermitTable.ORGANIZATION_ID),
            dbRecord.get(PermitTable.ISSUING_AGENCY),
            dbRecord.get(PermitTable.STATUS),
            dbRecord.get(PermitTable.APPROVAL_DATE),
            dbRecord.get(PermitTable.EXPIRATION_DATE),
            moneyOf(dbRecord.get(PermitTable.FEE_AMOUNT), dbRecord.get(PermitTable.FEE_CURRENCY)),
            dbRecord.get(PermitTable.CREATED_AT),
            dbRecord.get(PermitTable.UPDATED_AT),
            dbRecord.get(PermitTable.VERSION)),
        clock());
  }

  @Override
  protected Map<Field<?>, Object> toValues(final Permit permit) {
    final Permit.Snapshot snapshot = permit.toSnapshot();
    final Money fee = snapshot.fee();

    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(PermitTable.PERMIT_NUMBER, snapshot.permitNumber());
    values.put(PermitTable.PERMIT_TYPE, snapshot.permitType());
    values.put(PermitTable.WELL_ID, snapshot.wellId());
    values.put(PermitTable.ORGANIZATION_ID, snapshot.organizationId());
    values.put(PermitTable.ISSUING_AGENCY, snapshot.issuingAgency());
    values.put(PermitTable.STATUS, snapshot.status());
    values.put(PermitTable.APPROVAL_DATE, snapshot.approvalDate());
    values.put(PermitTable.EXPIRATION_DATE, snapshot.expirationDate());
    values.put(PermitTable.FEE_AMOUNT, fee == null ? null : fee.getAmount());
    values.put(PermitTable.FEE_CURRENCY, fee == null ? null : fee.getCurrency());
    values.put(PermitTable.CREATED_AT, snapshot.createdAt());
    values.put(PermitTable.UPDATED_AT, snapshot.updatedAt());
    return values;
  }
}
