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

import io.github.wellops.ddd.specification.AggregateField;
import io.github.wellops.ddd.specification.FieldSpecification;
import io.github.wellops.ddd.specification.Specification;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.UUID;

/** Reusable {@link Specification}s over {@link Permit}s. */
public final class PermitSpecifications {
  public static final AggregateField<Permit, UUID> ID =
      new AggregateField<>("id", Permit::getId, PermitTable.ID);
  public static final AggregateField<Permit, PermitStatus> STATUS =
      new AggregateField<>("status", Permit::getStatus, PermitTable.STATUS);
  public static final AggregateField<Permit, PermitType> PERMIT_TYPE =
      new AggregateField<>("permitType", Permit::getPermitType, PermitTable.PERMIT_TYPE);
  public static final AggregateField<Permit, UUID> WELL_ID =
      new AggregateField<>("wellId", Permit::getWellId, PermitTable.WELL_ID);
  public static final AggregateField<Permit, UUID> ORGANIZATION_ID =
      new AggregateField<>(
          "organizationId", Permit::getOrganizationId, PermitTable.ORGANIZATION_ID);
  public static final AggregateField<Permit, LocalDate> EXPIRATION_DATE =
      new AggregateField<>(
          "expirationDate", Permit::getExpirationDate, PermitTable.EXPIRATION_DATE);

  private static final EnumSet<PermitStatus> IN_FORCE =
      EnumSet.of(PermitStatus.APPROVED, PermitStatus.RENEWED);

  private PermitSpecifications() {
    // Cannot be instantiated
  }

  public static Specification<Permit> statusEquals(final PermitStatus status) {
    return STATUS.eq(status);
  }

  public static Specification<Permit> statusIn(final Collection<PermitStatus> statuses) {
    return STATUS.in(statuses);
  }

  public static Specification<Permit> forWell(final UUID wellId) {
    return WELL_ID.eq(wellId);
  }

  public static Specification<Permit> ownedBy(final UUID organizationId) {
    return ORGANIZATION_ID.eq(organizationId);
  }

  public static Specification<Permit> ofType(final PermitType permitType) {
    return PERMIT_TYPE.eq(permitType);
  }

  /**
   * @return permits that currently authorize operations
   */
  public static Specification<Permit> inForce() {
    return STATUS.in(IN_FORCE);
  }

  /**
   * @param today first day of the window
   * @param days length of the window, not negative
   * @return permits in force whose expiration date falls within the window
   */
  public static Specification<Permit> expiringWithin(final LocalDate today, final int days) {
    if (today == null) {
      throw new IllegalArgumentException("Window start cannot be null");
    }

    if (days < 0) {
      throw new IllegalArgumentException("Window length cannot be negative");
    }

    return inForce()
        .and(FieldSpecification.between(EXPIRATION_DATE, today, today.plusDays(days)));
  }
}
