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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.domain.InvalidTransitionException;
import io.github.wellops.ddd.domain.StatusChangedEvent;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.test.TestClocks;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AfeTest {
  static Afe newAfe(final String estimate, final String description) {
    return Afe.create(
        TestClocks.FIXED,
        new AfeNumber("AFE-2024-0001"),
        UUID.randomUUID(),
        UUID.randomUUID(),
        AfeType.DRILLING,
        Money.usd(estimate),
        description);
  }

  @Nested
  class Submission {
    @Test
    void draft_with_cost_and_description_can_be_submitted() {
      final var afe = newAfe("2500000", "Drill and case lateral");

      afe.submit("engineer");

      assertEquals(AfeStatus.SUBMITTED, afe.getStatus());
    }

    @Test
    void when_estimate_is_zero_submission_is_rejected() {
      final var afe = newAfe("0", "Drill and case lateral");

      final var exception = assertThrows(ValidationException.class, () -> afe.submit("engineer"));
      assertEquals("estimatedCost", exception.getField());
      assertEquals(AfeStatus.DRAFT, afe.getStatus());
    }

    @Test
    void when_description_is_missing_submission_is_rejected() {
      final var afe = newAfe("100", "  ");

      assertNull(afe.getDescription());
      assertThrows(ValidationException.class, () -> afe.submit("engineer"));
    }

    @Test
    void when_estimate_is_negative_creation_is_rejected() {
      assertThrows(ValidationException.class, () -> newAfe("-1", "Workover"));
    }
  }

  @Nested
  class Approval {
    @Test
    void approved_amount_defaults_to_the_estimate() {
      final var afe = newAfe("1000", "Facility upgrade");
      afe.submit("engineer");

      afe.approve("manager", null);

      assertEquals(AfeStatus.APPROVED, afe.getStatus());
      assertEquals(Money.usd("1000"), afe.getApprovedAmount());
      assertEquals(TestClocks.TODAY, afe.getApprovalDate());
    }

    @Test
    void approved_amount_must_match_currency_and_be_positive() {
      final var afe = newAfe("1000", "Facility upgrade");
      afe.submit("engineer");

      assertThrows(
          ValidationException.class,
          () -> afe.approve("manager", Money.of(BigDecimal.TEN, "CAD")));
      assertThrows(ValidationException.class, () -> afe.approve("manager", Money.zero("USD")));
      assertEquals(AfeStatus.SUBMITTED, afe.getStatus());
    }

    @Test
    void draft_cannot_be_approved_directly() {
      final var afe = newAfe("1000", "Facility upgrade");

      assertThrows(InvalidTransitionException.class, () -> afe.approve("manager", null));
      assertNull(afe.getApprovedAmount());
    }

    @Test
    void rejection_requires_a_reason_and_returns_to_draft_later() {
      final var afe = newAfe("1000", "Facility upgrade");
      afe.submit("engineer");

      assertThrows(ValidationException.class, () -> afe.reject("manager", ""));
      afe.reject("manager", "Over budget");

      final var event = (StatusChangedEvent<?>) afe.getDomainEvents().get(1);
      assertEquals("Over budget", event.reason());

      afe.updateStatus(AfeStatus.DRAFT, "engineer");
      assertEquals(AfeStatus.DRAFT, afe.getStatus());
    }
  }

  @Nested
  class Costs {
    @Test
    void estimate_can_only_be_revised_while_draft() {
      final var afe = newAfe("1000", "Facility upgrade");

      afe.reviseEstimatedCost(Money.usd("1200"));
      afe.reviseDescription("Facility upgrade, phase 2");
      afe.submit("engineer");

      assertEquals(Money.usd("1200"), afe.getEstimatedCost());
      assertThrows(ValidationException.class, () -> afe.reviseEstimatedCost(Money.usd("900")));
      assertThrows(ValidationException.class, () -> afe.reviseDescription("Other"));
    }

    @Test
    void actual_cost_over_approved_amount_is_over_budget() {
      final var afe = newAfe("1000", "Facility upgrade");
      assertThrows(ValidationException.class, () -> afe.recordActualCost(Money.usd("1")));

      afe.submit("engineer");
      afe.approve("manager", Money.usd("900"));
      afe.recordActualCost(Money.usd("850"));
      assertFalse(afe.isOverBudget());

      afe.close("accounting");
      afe.recordActualCost(Money.usd("950"));
      assertTrue(afe.isOverBudget());
      assertThrows(InvalidTransitionException.class, () -> afe.close("accounting"));
    }
  }
}
