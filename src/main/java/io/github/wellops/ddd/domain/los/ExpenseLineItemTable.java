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
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.EnumConverter;
import org.jooq.impl.SQLDataType;

/** Columns of the {@code los_expense_line_item} table, one row per line of a statement. */
public final class ExpenseLineItemTable {
  public static final String NAME = "los_expense_line_item";
  public static final Table<?> TABLE = DSL.table(DSL.name(NAME));

  public static final Field<UUID> STATEMENT_ID =
      DSL.field(DSL.name(NAME, "statement_id"), SQLDataType.UUID);
  public static final Field<String> LINE_ITEM_ID =
      DSL.field(DSL.name(NAME, "line_item_id"), SQLDataType.VARCHAR(ExpenseLineItem.MAX_ID_LENGTH));
  public static final Field<Integer> SORT_ORDER =
      DSL.field(DSL.name(NAME, "sort_order"), SQLDataType.INTEGER);
  public static final Field<String> DESCRIPTION =
      DSL.field(
          DSL.name(NAME, "description"),
          SQLDataType.VARCHAR(ExpenseLineItem.MAX_DESCRIPTION_LENGTH));
  public static final Field<ExpenseCategory> CATEGORY =
      DSL.field(
          DSL.name(NAME, "category"),
          SQLDataType.VARCHAR(32)
              .asConvertedDataType(new EnumConverter<>(String.class, ExpenseCategory.class)));
  public static final Field<ExpenseType> EXPENSE_TYPE =
      DSL.field(
          DSL.name(NAME, "expense_type"),
          SQLDataType.VARCHAR(16)
              .asConvertedDataType(new EnumConverter<>(String.class, ExpenseType.class)));
  public static final Field<BigDecimal> AMOUNT =
      DSL.field(DSL.name(NAME, "amount"), SQLDataType.NUMERIC(14, 2));
  public static final Field<String> CURRENCY =
      DSL.field(DSL.name(NAME, "currency"), SQLDataType.CHAR(3));

  public static final List<Field<?>> FIELDS =
      List.of(
          STATEMENT_ID,
          LINE_ITEM_ID,
          SORT_ORDER,
          DESCRIPTION,
          CATEGORY,
          EXPENSE_TYPE,
          AMOUNT,
          CURRENCY);

  private ExpenseLineItemTable() {
    // Cannot be instantiated
  }
}
