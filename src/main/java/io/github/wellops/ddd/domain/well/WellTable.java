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

package io.github.wellops.ddd.domain.well;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.EnumConverter;
import org.jooq.impl.SQLDataType;

/** Columns of the {@code well} table. */
public final class WellTable {
  public static final String NAME = "well";
  public static final Table<?> TABLE = DSL.table(DSL.name(NAME));

  public static final Field<UUID> ID = DSL.field(DSL.name(NAME, "id"), SQLDataType.UUID);
  public static final Field<String> API_NUMBER =
      DSL.field(DSL.name(NAME, "api_number"), SQLDataType.VARCHAR(12));
  public static final Field<String> WELL_NAME =
      DSL.field(DSL.name(NAME, "name"), SQLDataType.VARCHAR(255));
  public static final Field<UUID> OPERATOR_ID =
      DSL.field(DSL.name(NAME, "operator_id"), SQLDataType.UUID);
  public static final Field<UUID> LEASE_ID =
      DSL.field(DSL.name(NAME, "lease_id"), SQLDataType.UUID);
  public static final Field<WellType> WELL_TYPE =
      DSL.field(
          DSL.name(NAME, "well_type"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, WellType.class)));
  public static final Field<WellStatus> STATUS =
      DSL.field(
          DSL.name(NAME, "status"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, WellStatus.class)));
  public static final Field<Double> LATITUDE =
      DSL.field(DSL.name(NAME, "latitude"), SQLDataType.DOUBLE);
  public static final Field<Double> LONGITUDE =
      DSL.field(DSL.name(NAME, "longitude"), SQLDataType.DOUBLE);
  public static final Field<LocalDate> SPUD_DATE =
      DSL.field(DSL.name(NAME, "spud_date"), SQLDataType.LOCALDATE);
  public static final Field<LocalDate> COMPLETION_DATE =
      DSL.field(DSL.name(NAME, "completion_date"), SQLDataType.LOCALDATE);
  public static final Field<Integer> TOTAL_DEPTH_FT =
      DSL.field(DSL.name(NAME, "total_depth_ft"), SQLDataType.INTEGER);
  public static final Field<Instant> CREATED_AT =
      DSL.field(DSL.name(NAME, "created_at"), SQLDataType.INSTANT);
  public static final Field<Instant> UPDATED_AT =
      DSL.field(DSL.name(NAME, "updated_at"), SQLDataType.INSTANT);
  public static final Field<Long> VERSION =
      DSL.field(DSL.name(NAME, "version"), SQLDataType.BIGINT);

  public static final List<Field<?>> FIELDS =
      List.of(
          ID,
          API_NUMBER,
          WELL_NAME,
          OPERATOR_ID,
          LEASE_ID,
          WELL_TYPE,
          STATUS,
          LATITUDE,
          LONGITUDE,
          SPUD_DATE,
          COMPLETION_DATE,
          TOTAL_DEPTH_FT,
          CREATED_AT,
          UPDATED_AT,
          VERSION);

  private WellTable() {
    // Cannot be instantiated
  }
}
