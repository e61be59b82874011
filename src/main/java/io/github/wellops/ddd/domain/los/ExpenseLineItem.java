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

import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.vo.Money;

/**
 * One expense of a lease operating statement.
 *
 * @param id of the line, unique within its statement
 * @param description of the expense
 * @param category of the expense
 * @param type operating or capital
 * @param amount positive
 */
public record ExpenseLineItem(
    String id, String description, ExpenseCategory category, ExpenseType type, Money amount) {
  public static final int MAX_ID_LENGTH = 64;
  public static final int MAX_DESCRIPTION_LENGTH = 500;

  /**
   * Default constructor.
   *
   * @throws io.github.wellops.ddd.domain.ValidationException if any of the values is missing, too
   *     long, or the amount is not positive
   */
  public ExpenseLineItem {
    id = DomainPreconditions.requireText(id, "lineItemId").trim();
    DomainPreconditions.check(
        id.length() <= MAX_ID_LENGTH,
        "lineItemId",
        "Line item ID cannot exceed %d characters".formatted(MAX_ID_LENGTH));
    description = DomainPreconditions.requireText(description, "description").trim();
    DomainPreconditions.check(
        description.length() <= MAX_DESCRIPTION_LENGTH,
        "description",
        "Description cannot exceed %d characters".formatted(MAX_DESCRIPTION_LENGTH));
    DomainPreconditions.requireValue(category, "category");
    DomainPreconditions.requireValue(type, "expenseType");
    DomainPreconditions.requireValue(amount, "amount");
    DomainPreconditions.check(amount.isPositive(), "amount", "Expense must be positive");
  }
}
