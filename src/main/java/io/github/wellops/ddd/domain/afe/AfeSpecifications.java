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

import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.specification.AggregateField;
import io.github.wellops.ddd.specification.FieldSpecification;
import io.github.wellops.ddd.specification.Specification;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.UUID;

/**
 * Reusable {@link Specification}s over {@link Afe}s.
 *
 * <p>Amount ranges compare plain decimal amounts; callers are expected to narrow by currency where
 * an organization works with more than one.
 */
public final class AfeSpecifications {
  public static final AggregateField<Afe, UUID> ID =
      new AggregateField<>("id", Afe::getId, AfeTable.ID);
  public static final AggregateField<Afe, String> AFE_NUMBER =
      new AggregateField<>("afeNumber", afe -> afe.getAfeNumber().value(), AfeTable.AFE_NUMBER);
  public static final AggregateField<Afe, AfeStatus> STATUS =
      new AggregateField<>("status", Afe::getStatus, AfeTable.STATUS);
  public static final AggregateField<Afe, AfeType> AFE_TYPE =
      new AggregateField<>("afeType", Afe::getAfeType, AfeTable.AFE_TYPE);
  public static final AggregateField<Afe, UUID> ORGANIZATION_ID =
      new AggregateField<>("organizationId", Afe::getOrganizationId, AfeTable.ORGANIZATION_ID);
  public static final AggregateField<Afe, UUID> WELL_ID =
      new AggregateField<>("wellId", Afe::getWellId, AfeTable.WELL_ID);
  public static final AggregateField<Afe, String> CURRENCY =
      new AggregateField<>(
          "currency", afe -> afe.getEstimatedCost().getCurrency(), AfeTable.CURRENCY);
  public static final AggregateField<Afe, BigDecimal> ESTIMATED_COST =
      new AggregateField<>(
          "estimatedCost", afe -> amountOf(afe.getEstimatedCost()), AfeTable.ESTIMATED_COST);
  public static final AggregateField<Afe, BigDecimal> APPROVED_AMOUNT =
      new AggregateField<>(
          "approvedAmount", afe -> amountOf(afe.getApprovedAmount()), AfeTable.APPROVED_AMOUNT);
  public static final AggregateField<Afe, LocalDate> APPROVAL_DATE =
      new AggregateField<>("approvalDate", Afe::getApprovalDate, AfeTable.APPROVAL_DATE);

  private AfeSpecifications() {
    // Cannot be instantiated
  }

  public static Specification<Afe> statusEquals(final AfeStatus status) {
    return STATUS.eq(status);
  }

  public static Specification<Afe> statusIn(final Collection<AfeStatus> statuses) {
    return STATUS.in(statuses);
  }

  public static Specification<Afe> withAfeNumber(final AfeNumber afeNumber) {
    if (afeNumber == null) {
      throw new IllegalArgumentException("AFE number cannot be null");
    }

    return AFE_NUMBER.eq(afeNumber.value());
  }

  public static Specification<Afe> ownedBy(final UUID organizationId) {
    return ORGANIZATION_ID.eq(organizationId);
  }

  public static Specification<Afe> forWell(final UUID wellId) {
    return WELL_ID.eq(wellId);
  }

  public static Specification<Afe> ofType(final AfeType afeType) {
    return AFE_TYPE.eq(afeType);
  }

  /**
   * @return AFEs waiting for a decision
   */
  public static Specification<Afe> awaitingApproval() {
    return STATUS.eq(AfeStatus.SUBMITTED);
  }

  /**
   * @param threshold inclusive
   * @return AFEs whose estimate is at least the threshold, in the threshold's currency
   */
  public static Specification<Afe> estimatedAtLeast(final Money threshold) {
    if (threshold == null) {
      throw new IllegalArgumentException("Threshold cannot be null");
    }

    return CURRENCY
        .eq(threshold.getCurrency())
        .and(FieldSpecification.atLeast(ESTIMATED_COST, threshold.getAmount()));
  }

  public static Specification<Afe> approvedBetween(final LocalDate from, final LocalDate to) {
    return FieldSpecification.between(APPROVAL_DATE, from, to);
  }

  private static BigDecimal amountOf(final Money money) {
    return money == null ? null : money.getAmount();
  }
}
