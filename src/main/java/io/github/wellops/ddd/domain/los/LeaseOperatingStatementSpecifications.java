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

import io.github.wellops.ddd.specification.AggregateField;
import io.github.wellops.ddd.specification.FieldSpecification;
import io.github.wellops.ddd.specification.Specification;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.UUID;

/** Reusable {@link Specification}s over {@link LeaseOperatingStatement}s. */
public final class LeaseOperatingStatementSpecifications {
  public static final AggregateField<LeaseOperatingStatement, UUID> ID =
      new AggregateField<>("id", LeaseOperatingStatement::getId, LeaseOperatingStatementTable.ID);
  public static final AggregateField<LeaseOperatingStatement, LosStatus> STATUS =
      new AggregateField<>(
          "status", LeaseOperatingStatement::getStatus, LeaseOperatingStatementTable.STATUS);
  public static final AggregateField<LeaseOperatingStatement, UUID> LEASE_ID =
      new AggregateField<>(
          "leaseId", LeaseOperatingStatement::getLeaseId, LeaseOperatingStatementTable.LEASE_ID);
  public static final AggregateField<LeaseOperatingStatement, UUID> ORGANIZATION_ID =
      new AggregateField<>(
          "organizationId",
          LeaseOperatingStatement::getOrganizationId,
          LeaseOperatingStatementTable.ORGANIZATION_ID);
  public static final AggregateField<LeaseOperatingStatement, LocalDate> STATEMENT_MONTH =
      new AggregateField<>(
          "statementMonth",
          statement -> statement.getStatementMonth().atDay(1),
          LeaseOperatingStatementTable.STATEMENT_MONTH);
  public static final AggregateField<LeaseOperatingStatement, BigDecimal> TOTAL_EXPENSES =
      new AggregateField<>(
          "totalExpenses",
          statement -> statement.getTotalExpenses().getAmount(),
          LeaseOperatingStatementTable.TOTAL_EXPENSES);
  public static final AggregateField<LeaseOperatingStatement, BigDecimal> OPERATING_EXPENSES =
      new AggregateField<>(
          "operatingExpenses",
          statement -> statement.getOperatingExpenses().getAmount(),
          LeaseOperatingStatementTable.OPERATING_EXPENSES);
  public static final AggregateField<LeaseOperatingStatement, BigDecimal> CAPITAL_EXPENSES =
      new AggregateField<>(
          "capitalExpenses",
          statement -> statement.getCapitalExpenses().getAmount(),
          LeaseOperatingStatementTable.CAPITAL_EXPENSES);

  private LeaseOperatingStatementSpecifications() {
    // Cannot be instantiated
  }

  public static Specification<LeaseOperatingStatement> statusEquals(final LosStatus status) {
    return STATUS.eq(status);
  }

  public static Specification<LeaseOperatingStatement> statusIn(
      final Collection<LosStatus> statuses) {
    return STATUS.in(statuses);
  }

  public static Specification<LeaseOperatingStatement> forLease(final UUID leaseId) {
    return LEASE_ID.eq(leaseId);
  }

  public static Specification<LeaseOperatingStatement> ownedBy(final UUID organizationId) {
    return ORGANIZATION_ID.eq(organizationId);
  }

  public static Specification<LeaseOperatingStatement> forMonth(final YearMonth month) {
    if (month == null) {
      throw new IllegalArgumentException("Statement month cannot be null");
    }

    return STATEMENT_MONTH.eq(month.atDay(1));
  }

  /**
   * @param from first month, inclusive
   * @param to last month, inclusive
   * @return statements covering any month of the range
   */
  public static Specification<LeaseOperatingStatement> coveringMonths(
      final YearMonth from, final YearMonth to) {
    return FieldSpecification.between(
        STATEMENT_MONTH, from == null ? null : from.atDay(1), to == null ? null : to.atDay(1));
  }

  public static Specification<LeaseOperatingStatement> totalAtLeast(final BigDecimal amount) {
    return FieldSpecification.atLeast(TOTAL_EXPENSES, amount);
  }
}
