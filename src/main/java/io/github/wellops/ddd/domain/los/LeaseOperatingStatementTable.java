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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.EnumConverter;
import org.jooq.impl.SQLDataType;

/**
 * Columns of the {@code lease_operating_statement} table. The statement month is stored as its
 * first day. Totals and the expense count are derived from the line items and kept here so that
 * they can be queried.
 */
public final class LeaseOperatingStatementTable {
  public static final String NAME = "lease_operating_statement";
  public static final Table<?> TABLE = DSL.table(DSL.name(NAME));

  public static final Field<UUID> ID = DSL.field(DSL.name(NAME, "id"), SQLDataType.UUID);
  public static final Field<UUID> LEASE_ID =
      DSL.field(DSL.name(NAME, "lease_id"), SQLDataType.UUID);
  public static final Field<UUID> ORGANIZATION_ID =
      DSL.field(DSL.name(NAME, "organization_id"), SQLDataType.UUID);
  public static final Field<LocalDate> STATEMENT_MONTH =
      DSL.field(DSL.name(NAME, "statement_month"), SQLDataType.LOCALDATE);
  public static final Field<LosStatus> STATUS =
      DSL.field(
          DSL.name(NAME, "status"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, LosStatus.class)));
  public static final Field<String> CURRENCY =
      DSL.field(DSL.name(NAME, "currency"), SQLDataType.CHAR(3));
  public static final Field<BigDecimal> TOTAL_EXPENSES =
      DSL.field(DSL.name(NAME, "total_expenses"), SQLDataType.NUMERIC(14, 2));
  public static final Field<BigDecimal> OPERATING_EXPENSES =
      DSL.field(DSL.name(NAME, "operating_expenses"), SQLDataType.NUMERIC(14, 2));
  public static final Field<BigDecimal> CAPITAL_EXPENSES =
      DSL.field(DSL.name(NAME, "capital_expenses"), SQLDataType.NUMERIC(14, 2));
  public static final Field<Integer> EXPENSE_COUNT =
      DSL.field(DSL.name(NAME, "expense_count"), SQLDataType.INTEGER);
  public static final Field<Instant> CREATED_AT =
      DSL.field(DSL.name(NAME, "created_at"), SQLDataType.INSTANT);
  public static final Field<Instant> UPDATED_AT =
      DSL.field(DSL.name(NAME, "updated_at"), SQLDataType.INSTANT);
  public static final Field<Long> VERSION =
      DSL.field(DSL.name(NAME, "version"), SQLDataType.BIGINT);

  public static final List<Field<?>> FIELDS =
      List.of(
          ID,
          LEASE_ID,
          ORGANIZATION_ID,
          STATEMENT_MONTH,
          STATUS,
          CURRENCY,
          TOTAL_EXPENSES,
          OPERATING_EXPENSES,
          CAPITAL_EXPENSES,
          EXPENSE_COUNT,
          CREATED_AT,
          UPDATED_AT,
          VERSION);

  private LeaseOperatingStatementTable() {
    // Cannot be instantiated
  }
}
