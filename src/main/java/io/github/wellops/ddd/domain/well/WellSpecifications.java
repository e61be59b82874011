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

import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.specification.AggregateField;
import io.github.wellops.ddd.specification.FieldSpecification;
import io.github.wellops.ddd.specification.Specification;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.UUID;

/** Reusable {@link Specification}s over {@link Well}s. */
public final class WellSpecifications {
  public static final AggregateField<Well, UUID> ID =
      new AggregateField<>("id", Well::getId, WellTable.ID);
  public static final AggregateField<Well, String> API_NUMBER =
      new AggregateField<>(
          "apiNumber", well -> well.getApiNumber().getValue(), WellTable.API_NUMBER);
  public static final AggregateField<Well, String> NAME =
      new AggregateField<>("name", Well::getName, WellTable.WELL_NAME);
  public static final AggregateField<Well, WellStatus> STATUS =
      new AggregateField<>("status", Well::getStatus, WellTable.STATUS);
  public static final AggregateField<Well, WellType> WELL_TYPE =
      new AggregateField<>("wellType", Well::getWellType, WellTable.WELL_TYPE);
  public static final AggregateField<Well, UUID> OPERATOR_ID =
      new AggregateField<>("operatorId", Well::getOperatorId, WellTable.OPERATOR_ID);
  public static final AggregateField<Well, UUID> LEASE_ID =
      new AggregateField<>("leaseId", Well::getLeaseId, WellTable.LEASE_ID);
  public static final AggregateField<Well, LocalDate> SPUD_DATE =
      new AggregateField<>("spudDate", Well::getSpudDate, WellTable.SPUD_DATE);
  public static final AggregateField<Well, Integer> TOTAL_DEPTH_FT =
      new AggregateField<>("totalDepthFeet", Well::getTotalDepthFeet, WellTable.TOTAL_DEPTH_FT);

  /** Statuses in which a well can deliver hydrocarbons without being re-permitted. */
  private static final EnumSet<WellStatus> OPERATIONAL =
      EnumSet.of(WellStatus.COMPLETED, WellStatus.PRODUCING, WellStatus.SHUT_IN, WellStatus.ACTIVE);

  private WellSpecifications() {
    // Cannot be instantiated
  }

  public static Specification<Well> statusEquals(final WellStatus status) {
    return STATUS.eq(status);
  }

  public static Specification<Well> statusIn(final Collection<WellStatus> statuses) {
    return STATUS.in(statuses);
  }

  public static Specification<Well> operational() {
    return STATUS.in(OPERATIONAL);
  }

  public static Specification<Well> withApiNumber(final ApiNumber apiNumber) {
    if (apiNumber == null) {
      throw new IllegalArgumentException("API number cannot be null");
    }

    return API_NUMBER.eq(apiNumber.getValue());
  }

  public static Specification<Well> operatedBy(final UUID operatorId) {
    return OPERATOR_ID.eq(operatorId);
  }

  public static Specification<Well> onLease(final UUID leaseId) {
    return LEASE_ID.eq(leaseId);
  }

  public static Specification<Well> ofType(final WellType wellType) {
    return WELL_TYPE.eq(wellType);
  }

  /**
   * @param from inclusive, may be {@code null} for an open range
   * @param to inclusive, may be {@code null} for an open range
   * @return wells spudded within the range; wells without a spud date never match
   */
  public static Specification<Well> spuddedBetween(final LocalDate from, final LocalDate to) {
    return FieldSpecification.between(SPUD_DATE, from, to);
  }

  public static Specification<Well> depthAtLeast(final int feet) {
    return FieldSpecification.atLeast(TOTAL_DEPTH_FT, feet);
  }
}
