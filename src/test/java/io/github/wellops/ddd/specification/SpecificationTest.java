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

package io.github.wellops.ddd.specification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.domain.afe.Afe;
import io.github.wellops.ddd.domain.afe.AfeSpecifications;
import io.github.wellops.ddd.domain.afe.AfeType;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.domain.well.Well;
import io.github.wellops.ddd.domain.well.WellSpecifications;
import io.github.wellops.ddd.domain.well.WellStatus;
import io.github.wellops.ddd.domain.well.WellType;
import io.github.wellops.test.TestClocks;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpecificationTest {
  static final UUID OPERATOR = UUID.randomUUID();
  static final UUID LEASE = UUID.randomUUID();

  static final Well PLANNED = well("4200100001", WellType.OIL, null);
  static final Well DRILLING = well("4200100002", WellType.GAS, LEASE);
  static final Well PRODUCING = well("4200100003", WellType.OIL, LEASE);

  static {
    DRILLING.updateStatus(WellStatus.DRILLING, "drilling");
    PRODUCING.updateStatus(WellStatus.DRILLING, "drilling");
    PRODUCING.updateStatus(WellStatus.COMPLETED, "completions");
    PRODUCING.updateStatus(WellStatus.PRODUCING, "production");
  }

  static final List<Well> WELLS = List.of(PLANNED, DRILLING, PRODUCING);

  static final Specification<Well> IS_DRILLING =
      WellSpecifications.statusEquals(WellStatus.DRILLING);
  static final Specification<Well> IS_OIL = WellSpecifications.ofType(WellType.OIL);
  static final Specification<Well> ON_LEASE = WellSpecifications.onLease(LEASE);

  static Well well(final String apiNumber, final WellType type, final UUID leaseId) {
    final var well =
        Well.create(
            TestClocks.FIXED,
            ApiNumber.of(apiNumber),
            "Well " + apiNumber,
            OPERATOR,
            type,
            new Coordinates(31.0, -102.0));
    if (leaseId != null) {
      well.assignLease(leaseId);
    }
    return well;
  }

  static void assertEquivalent(final Specification<Well> left, final Specification<Well> right) {
    for (Well candidate : WELLS) {
      assertEquals(
          left.isSatisfiedBy(candidate), right.isSatisfiedBy(candidate), candidate.toString());
    }
  }

  @Nested
  class Identities {
    @Test
    void always_is_the_identity_of_and() {
      assertSame(IS_DRILLING, IS_DRILLING.and(Specification.always()));
      assertSame(IS_DRILLING, Specification.<Well>always().and(IS_DRILLING));
    }

    @Test
    void never_absorbs_and() {
      assertInstanceOf(Specification.Never.class, IS_DRILLING.and(Specification.never()));
      assertInstanceOf(Specification.Never.class, Specification.<Well>never().and(IS_DRILLING));
    }

    @Test
    void never_is_the_identity_of_or_and_always_absorbs_it() {
      assertSame(IS_DRILLING, IS_DRILLING.or(Specification.never()));
      assertInstanceOf(Specification.Always.class, IS_DRILLING.or(Specification.always()));
    }

    @Test
    void combining_a_specification_with_itself_is_idempotent() {
      assertSame(IS_DRILLING, IS_DRILLING.and(IS_DRILLING));
      assertSame(IS_DRILLING, IS_DRILLING.or(IS_DRILLING));
      assertSame(
          IS_DRILLING, IS_DRILLING.and(WellSpecifications.statusEquals(WellStatus.DRILLING)));
    }

    @Test
    void double_negation_is_removed() {
      assertSame(IS_DRILLING, IS_DRILLING.not().not());
      assertInstanceOf(Specification.Never.class, Specification.<Well>always().not());
      assertInstanceOf(Specification.Always.class, Specification.<Well>never().not());
    }

    @Test
    void always_and_status_equals_selects_exactly_that_status() {
      final var combined = Specification.<Well>always().and(IS_DRILLING);

      assertEquivalent(IS_DRILLING, combined);
      assertEquals(
          List.of(DRILLING), WELLS.stream().filter(combined::isSatisfiedBy).toList());
    }
  }

  @Nested
  class Laws {
    @Test
    void de_morgan_holds_for_and() {
      assertEquivalent(IS_DRILLING.and(IS_OIL).not(), IS_DRILLING.not().or(IS_OIL.not()));
      assertEquivalent(ON_LEASE.and(IS_OIL).not(), ON_LEASE.not().or(IS_OIL.not()));
    }

    @Test
    void de_morgan_holds_for_or() {
      assertEquivalent(IS_DRILLING.or(IS_OIL).not(), IS_DRILLING.not().and(IS_OIL.not()));
    }

    @Test
    void composition_evaluates_both_sides() {
      assertEquals(
          List.of(PRODUCING),
          WELLS.stream().filter(IS_OIL.and(ON_LEASE)::isSatisfiedBy).toList());
      assertEquals(
          List.of(PLANNED, DRILLING, PRODUCING),
          WELLS.stream().filter(IS_OIL.or(ON_LEASE)::isSatisfiedBy).toList());
    }
  }

  @Nested
  class Leaves {
    @Test
    void missing_value_never_satisfies_a_leaf_but_satisfies_its_negation() {
      assertFalse(ON_LEASE.isSatisfiedBy(PLANNED));
      assertTrue(ON_LEASE.not().isSatisfiedBy(PLANNED));
    }

    @Test
    void in_matches_any_listed_value() {
      final var spec =
          WellSpecifications.statusIn(Set.of(WellStatus.PLANNED, WellStatus.PRODUCING));

      assertEquals(
          List.of(PLANNED, PRODUCING), WELLS.stream().filter(spec::isSatisfiedBy).toList());
    }

    @Test
    void decimal_comparison_ignores_scale() {
      final Afe afe =
          Afe.create(
              TestClocks.FIXED,
              new AfeNumber("AFE-2024-0100"),
              UUID.randomUUID(),
              null,
              AfeType.WORKOVER,
              Money.usd("1000"),
              "Rod pump swap");

      assertTrue(AfeSpecifications.ESTIMATED_COST.eq(new BigDecimal("1000")).isSatisfiedBy(afe));
      assertTrue(AfeSpecifications.estimatedAtLeast(Money.usd("999.99")).isSatisfiedBy(afe));
      assertFalse(AfeSpecifications.forWell(UUID.randomUUID()).isSatisfiedBy(afe));
    }

    @Test
    void exponent_notation_is_bound_with_a_non_negative_scale() {
      final var equals =
          (FieldSpecification.Equals<Afe, BigDecimal>)
              AfeSpecifications.ESTIMATED_COST.eq(new BigDecimal("2E+5"));
      final var range =
          (FieldSpecification.Between<Afe, BigDecimal>)
              FieldSpecification.between(
                  AfeSpecifications.ESTIMATED_COST, new BigDecimal("1E+5"), new BigDecimal("3E+5"));

      assertEquals(0, equals.value().scale());
      assertEquals(0, range.lower().compareTo(new BigDecimal("100000")));
      assertEquals(0, range.upper().scale());
    }

    @Test
    void ranges_include_their_bounds() {
      final var depth = WellSpecifications.depthAtLeast(10000);
      final var well = well("4200100004", WellType.OIL, null);

      assertFalse(depth.isSatisfiedBy(well));
      well.recordTotalDepth(10000);
      assertTrue(depth.isSatisfiedBy(well));
      assertTrue(
          FieldSpecification.atMost(WellSpecifications.TOTAL_DEPTH_FT, 10000).isSatisfiedBy(well));
    }
  }

  @Nested
  class Validation {
    @Test
    void when_operand_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> IS_DRILLING.and(null));
      assertThrows(IllegalArgumentException.class, () -> IS_DRILLING.or(null));
      assertThrows(IllegalArgumentException.class, () -> new Specification.Not<Well>(null));
      assertThrows(
          IllegalArgumentException.class, () -> new Specification.And<>(IS_DRILLING, null));
    }

    @Test
    void when_candidate_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> IS_DRILLING.isSatisfiedBy(null));
      assertThrows(
          IllegalArgumentException.class, () -> Specification.<Well>always().isSatisfiedBy(null));
    }

    @Test
    void when_leaf_value_is_missing_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> WellSpecifications.STATUS.eq(null));
      assertThrows(IllegalArgumentException.class, () -> WellSpecifications.STATUS.in(Set.of()));
      assertThrows(
          IllegalArgumentException.class,
          () -> FieldSpecification.between(WellSpecifications.TOTAL_DEPTH_FT, null, null));
      assertThrows(
          IllegalArgumentException.class,
          () -> FieldSpecification.between(WellSpecifications.TOTAL_DEPTH_FT, 10, 5));
    }
  }
}
