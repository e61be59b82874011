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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.wellops.ddd.domain.InvalidTransitionException;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.test.TestClocks;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WellTest {
  static Well newWell() {
    return Well.create(
        TestClocks.FIXED,
        ApiNumber.of("3001512345"),
        "Eddy State 2",
        UUID.randomUUID(),
        WellType.GAS,
        new Coordinates(32.4, -104.2));
  }

  @Nested
  class Creation {
    @Test
    void wells_are_created_as_planned() {
      final var well = newWell();

      assertEquals(WellStatus.PLANNED, well.getStatus());
      assertEquals("30-015-12345", well.getApiNumber().getValue());
      assertNull(well.getLeaseId());
      assertNull(well.getTotalDepthFeet());
    }

    @Test
    void when_required_value_is_missing_validation_exception_names_the_field() {
      final var exception =
          assertThrows(
              ValidationException.class,
              () ->
                  Well.create(
                      TestClocks.FIXED,
                      ApiNumber.of("3001512345"),
                      "Eddy State 2",
                      null,
                      WellType.GAS,
                      new Coordinates(0.0, 0.0)));
      assertEquals("operatorId", exception.getField());
    }

    @Test
    void when_clock_is_missing_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              Well.create(
                  null,
                  ApiNumber.of("3001512345"),
                  "Eddy State 2",
                  UUID.randomUUID(),
                  WellType.GAS,
                  new Coordinates(0.0, 0.0)));
    }
  }

  @Nested
  class Lifecycle {
    @Test
    void well_can_go_from_plan_to_plug() {
      final var well = newWell();

      well.updateStatus(WellStatus.PERMITTED, "regulatory");
      well.updateStatus(WellStatus.DRILLING, "drilling");
      well.updateStatus(WellStatus.COMPLETED, "completions");
      well.updateStatus(WellStatus.PRODUCING, "production");
      well.updateStatus(WellStatus.TEMPORARILY_ABANDONED, "production");
      well.updateStatus(WellStatus.PERMANENTLY_ABANDONED, "production");
      well.updateStatus(WellStatus.PLUGGED, "field");

      assertEquals(8L, well.getVersion());
      assertEquals(7, well.getDomainEvents().size());
      assertThrows(
          InvalidTransitionException.class,
          () -> well.updateStatus(WellStatus.PRODUCING, "field"));
    }

    @Test
    void when_status_is_null_validation_exception_is_thrown() {
      final var well = newWell();
      assertThrows(ValidationException.class, () -> well.updateStatus(null, "field"));
    }
  }

  @Nested
  class Drilling {
    @Test
    void spud_date_cannot_be_in_the_future() {
      final var well = newWell();

      final var exception =
          assertThrows(
              ValidationException.class,
              () -> well.recordSpudDate(TestClocks.TODAY.plusDays(1)));
      assertEquals("spudDate", exception.getField());
    }

    @Test
    void completion_date_cannot_precede_spud_date() {
      final var well = newWell();
      well.recordSpudDate(TestClocks.TODAY.minusDays(10));

      assertThrows(
          ValidationException.class,
          () -> well.recordCompletionDate(TestClocks.TODAY.minusDays(11)));

      well.recordCompletionDate(TestClocks.TODAY.minusDays(1));
      assertEquals(TestClocks.TODAY.minusDays(1), well.getCompletionDate());
      assertThrows(ValidationException.class, () -> well.recordSpudDate(TestClocks.TODAY));
    }

    @Test
    void total_depth_must_be_positive() {
      final var well = newWell();

      assertThrows(ValidationException.class, () -> well.recordTotalDepth(0));
      well.recordTotalDepth(12500);
      assertEquals(12500, well.getTotalDepthFeet());
    }

    @Test
    void lease_assignment_is_recorded() {
      final var well = newWell();
      final var leaseId = UUID.randomUUID();

      well.assignLease(leaseId);

      assertEquals(leaseId, well.getLeaseId());
      assertEquals(2L, well.getVersion());
    }
  }

  @Test
  void snapshot_round_trip_preserves_state() {
    final var well = newWell();
    well.updateStatus(WellStatus.DRILLING, "drilling");
    well.recordSpudDate(TestClocks.TODAY.minusDays(3));

    final var copy = Well.rehydrate(well.toSnapshot(), TestClocks.FIXED);

    assertEquals(well.toSnapshot(), copy.toSnapshot());
    assertEquals(0, copy.getDomainEvents().size());
  }
}
