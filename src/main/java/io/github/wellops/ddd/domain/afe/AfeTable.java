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

/** Columns of the {@code afe} table. Amounts share the single {@link #CURRENCY} column. */
public final class AfeTable {
  public static final String NAME = "afe";
  public static final Table<?> TABLE = DSL.table(DSL.name(NAME));

  public static final Field<UUID> ID = DSL.field(DSL.name(NAME, "id"), SQLDataType.UUID);
  public static final Field<String> AFE_NUMBER =
      DSL.field(DSL.name(NAME, "afe_number"), SQLDataType.VARCHAR(16));
  public static final Field<UUID> ORGANIZATION_ID =
      DSL.field(DSL.name(NAME, "organization_id"), SQLDataType.UUID);
  public static final Field<UUID> WELL_ID = DSL.field(DSL.name(NAME, "well_id"), SQLDataType.UUID);
  public static final Field<AfeType> AFE_TYPE =
      DSL.field(
          DSL.name(NAME, "afe_type"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, AfeType.class)));
  public static final Field<AfeStatus> STATUS =
      DSL.field(
          DSL.name(NAME, "status"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, AfeStatus.class)));
  public static final Field<String> CURRENCY =
      DSL.field(DSL.name(NAME, "currency"), SQLDataType.CHAR(3));
  public static final Field<BigDecimal> ESTIMATED_COST =
      DSL.field(DSL.name(NAME, "estimated_cost"), SQLDataType.NUMERIC(14, 2));
  public static final Field<BigDecimal> APPROVED_AMOUNT =
      DSL.field(DSL.name(NAME, "approved_amount"), SQLDataType.NUMERIC(14, 2));
  public static final Field<BigDecimal> ACTUAL_COST =
      DSL.field(DSL.name(NAME, "actual_cost"), SQLDataType.NUMERIC(14, 2));
  public static final Field<String> DESCRIPTION =
      DSL.field(DSL.name(NAME, "description"), SQLDataType.VARCHAR(2000));
  public static final Field<LocalDate> APPROVAL_DATE =
      DSL.field(DSL.name(NAME, "approval_date"), SQLDataType.LOCALDATE);
  public static final Field<Instant> CREATED_AT =
      DSL.field(DSL.name(NAME, "created_at"), SQLDataType.INSTANT);
  public static final Field<Instant> UPDATED_AT =
      DSL.field(DSL.name(NAME, "updated_at"), SQLDataType.INSTANT);
  public static final Field<Long> VERSION =
      DSL.field(DSL.name(NAME, "version"), SQLDataType.BIGINT);

  public static final List<Field<?>> FIELDS =
      List.of(
          ID,
          AFE_NUMBER,
          ORGANIZATION_ID,
          WELL_ID,
          AFE_TYPE,
          STATUS,
          CURRENCY,
          ESTIMATED_COST,
          APPROVED_AMOUNT,
          ACTUAL_COST,
          DESCRIPTION,
          APPROVAL_DATE,
          CREATED_AT,
          UPDATED_AT,
          VERSION);

  private AfeTable() {
    // Cannot be instantiated
  }
}
