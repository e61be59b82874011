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

/** Columns of the {@code permit} table. */
public final class PermitTable {
  public static final String NAME = "permit";
  public static final Table<?> TABLE = DSL.table(DSL.name(NAME));

  public static final Field<UUID> ID = DSL.field(DSL.name(NAME, "id"), SQLDataType.UUID);
  public static final Field<String> PERMIT_NUMBER =
      DSL.field(DSL.name(NAME, "permit_number"), SQLDataType.VARCHAR(64));
  public static final Field<PermitType> PERMIT_TYPE =
      DSL.field(
          DSL.name(NAME, "permit_type"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, PermitType.class)));
  public static final Field<UUID> WELL_ID = DSL.field(DSL.name(NAME, "well_id"), SQLDataType.UUID);
  public static final Field<UUID> ORGANIZATION_ID =
      DSL.field(DSL.name(NAME, "organization_id"), SQLDataType.UUID);
  public static final Field<String> ISSUING_AGENCY =
      DSL.field(DSL.name(NAME, "issuing_agency"), SQLDataType.VARCHAR(255));
  public static final Field<PermitStatus> STATUS =
      DSL.field(
          DSL.name(NAME, "status"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, PermitStatus.class)));
  public static final Field<LocalDate> APPROVAL_DATE =
      DSL.field(DSL.name(NAME, "approval_date"), SQLDataType.LOCALDATE);
  public static final Field<LocalDate> EXPIRATION_DATE =
      DSL.field(DSL.name(NAME, "expiration_date"), SQLDataType.LOCALDATE);
  public static final Field<BigDecimal> FEE_AMOUNT =
      DSL.field(DSL.name(NAME, "fee_amount"), SQLDataType.NUMERIC(14, 2));
  public static final Field<String> FEE_CURRENCY =
      DSL.field(DSL.name(NAME, "fee_currency"), SQLDataType.CHAR(3));
  public static final Field<Instant> CREATED_AT =
      DSL.field(DSL.name(NAME, "created_at"), SQLDataType.INSTANT);
  public static final Field<Instant> UPDATED_AT =
      DSL.field(DSL.name(NAME, "updated_at"), SQLDataType.INSTANT);
  public static final Field<Long> VERSION =
      DSL.field(DSL.name(NAME, "version"), SQLDataType.BIGINT);

  public static final List<Field<?>> FIELDS =
      List.of(
          ID,
          PERMIT_NUMBER,
          PERMIT_TYPE,
          WELL_ID,
          ORGANIZATION_ID,
          ISSUING_AGENCY,
          STATUS,
          APPROVAL_DATE,
          EXPIRATION_DATE,
          FEE_AMOUNT,
          FEE_CURRENCY,
          CREATED_AT,
          UPDATED_AT,
          VERSION);

  private PermitTable() {
    // Cannot be instantiated
  }
}
