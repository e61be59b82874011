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

package io.github.wellops.ddd.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.ddd.domain.well.Well;
import io.github.wellops.ddd.domain.well.WellStatus;
import io.github.wellops.ddd.domain.well.WellType;
import io.github.wellops.test.TestClocks;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AggregateRootTest {
  static Well newWell() {
    return Well.create(
        TestClocks.FIXED,
        ApiNumber.of("4212345678"),
        "Permian 1H",
        UUID.randomUUID(),
        WellType.OIL,
        new Coordinates(31.9, -102.1));
  }

  enum Stage {
    ONE,
    TWO,
    ORPHAN
  }

  static final TransitionTable<Stage> STAGES =
      TransitionTable.builder(AggregateType.VENDOR, Stage.class)
          .allow(Stage.ONE, Stage.TWO)
          .terminal(Stage.TWO)
          .build();

  static final class Staged extends AggregateRoot<Stage> {
    Staged(final Stage initialStatus) {
      super(UUID.randomUUID(), initialStatus, TestClocks.FIXED);
    }

    Staged(final Stage status, final long version) {
      super(UUID.randomUUID(), status, version, TestClocks.NOW, TestClocks.NOW, TestClocks.FIXED);
    }

    @Override
    public AggregateType aggregateType() {
      return AggregateType.VENDOR;
    }

    @Override
    protected TransitionTable<Stage> transitionTable() {
      return STAGES;
    }

    void advance(final String actor) {
      transitionTo(Stage.TWO, actor, "ready");
    }
  }

  @Nested
  class Creation {
    @Test
    void new_aggregate_starts_at_initial_version_without_events() {
      final var well = newWell();

      assertEquals(AggregateRoot.INITIAL_VERSION, well.getVersion());
      assertEquals(0L, well.getPersistedVersion());
      assertTrue(well.isNew());
      assertTrue(well.hasUnsavedChanges());
      assertTrue(well.getDomainEvents().isEmpty());
      assertEquals(WellStatus.PLANNED, well.getStatus());
      assertEquals(TestClocks.NOW, well.getCreatedAt());
      assertEquals(TestClocks.NOW, well.getUpdatedAt());
    }

    @Test
    void when_initial_status_is_undeclared_illegal_state_exception_is_thrown() {
      assertThrows(IllegalStateException.class, () -> new Staged(Stage.ORPHAN));
    }

    @Test
    void when_initial_status_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Staged(null));
    }

    @Test
    void when_stored_version_is_not_positive_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Staged(Stage.ONE, 0L));
    }

    @Test
    void rehydrated_aggregate_keeps_stored_version_and_is_not_new() {
      final var staged = new Staged(Stage.ONE, 7L);

      assertEquals(7L, staged.getVersion());
      assertEquals(7L, staged.getPersistedVersion());
      assertFalse(staged.isNew());
      assertFalse(staged.hasUnsavedChanges());
    }
  }

  @Nested
  class Transitions {
    @Test
    void legal_transition_bumps_version_and_records_one_event() {
      final var well = newWell();

      well.updateStatus(WellStatus.DRILLING, "geologist");

      assertEquals(WellStatus.DRILLING, well.getStatus());
      assertEquals(2L, well.getVersion());

      final var events = well.getDomainEvents();
      assertEquals(1, events.size());

      final var event = assertInstanceOf(StatusChangedEvent.class, events.get(0));
      assertEquals(WellStatus.PLANNED, event.previousStatus());
      assertEquals(WellStatus.DRILLING, event.newStatus());
      assertEquals("geologist", event.changedBy());
      assertEquals(well.getId(), event.aggregateId());
      assertEquals(AggregateType.WELL, event.aggregateType());
      assertEquals(2L, event.aggregateVersion());
      assertEquals("WellStatusChanged", event.eventType());
      assertEquals(TestClocks.NOW, event.occurredAt());
      assertEquals(event.occurredAt(), event.createdAt());
    }

    @Test
    void illegal_transition_leaves_aggregate_untouched() {
      final var well = newWell();

      final var exception =
          assertThrows(
              InvalidTransitionException.class,
              () -> well.updateStatus(WellStatus.PRODUCING, "geologist"));

      assertEquals(WellStatus.PLANNED, exception.getFrom());
      assertEquals(WellStatus.PRODUCING, exception.getTo());
      assertEquals(WellStatus.PLANNED, well.getStatus());
      assertEquals(AggregateRoot.INITIAL_VERSION, well.getVersion());
      assertTrue(well.getDomainEvents().isEmpty());
    }

    @Test
    void self_transition_is_rejected() {
      final var well = newWell();

      assertFalse(well.canTransitionTo(WellStatus.PLANNED));
      assertThrows(
          InvalidTransitionException.class,
          () -> well.updateStatus(WellStatus.PLANNED, "geologist"));
    }

    @Test
    void when_actor_is_blank_validation_exception_is_thrown_before_any_change() {
      final var staged = new Staged(Stage.ONE);

      final var exception = assertThrows(ValidationException.class, () -> staged.advance(" "));

      assertEquals("actor", exception.getField());
      assertEquals(Stage.ONE, staged.getStatus());
      assertEquals(AggregateRoot.INITIAL_VERSION, staged.getVersion());
    }

    @Test
    void transition_from_terminal_status_fails() {
      final var staged = new Staged(Stage.ONE);
      staged.advance("operator");

      assertThrows(InvalidTransitionException.class, () -> staged.advance("operator"));
      assertEquals(2L, staged.getVersion());
      assertEquals(1, staged.getDomainEvents().size());
    }

    @Test
    void updated_at_follows_the_aggregate_clock() {
      final Clock tomorrow = Clock.offset(TestClocks.FIXED, Duration.ofDays(1));
      final var well = Well.rehydrate(newWell().toSnapshot(), tomorrow);

      well.updateStatus(WellStatus.PERMITTED, "regulatory");

      assertEquals(TestClocks.NOW, well.getCreatedAt());
      assertEquals(Instant.now(tomorrow), well.getUpdatedAt());
    }
  }

  @Nested
  class Mutations {
    @Test
    void non_status_change_bumps_version_without_event() {
      final var well = newWell();

      well.rename("Permian 1H-R");

      assertEquals("Permian 1H-R", well.getName());
      assertEquals(2L, well.getVersion());
      assertTrue(well.getDomainEvents().isEmpty());
    }

    @Test
    void each_successful_operation_increases_version_by_exactly_one() {
      final var well = newWell();

      well.updateStatus(WellStatus.DRILLING, "geologist");
      well.recordSpudDate(TestClocks.TODAY.minusDays(30));
      well.updateStatus(WellStatus.COMPLETED, "geologist");

      assertEquals(4L, well.getVersion());
      assertEquals(2, well.getDomainEvents().size());
    }

    @Test
    void failed_validation_does_not_bump_version() {
      final var well = newWell();

      assertThrows(ValidationException.class, () -> well.rename(""));
      assertEquals(AggregateRoot.INITIAL_VERSION, well.getVersion());
    }
  }

  @Nested
  class EventsAndPersistence {
    @Test
    void domain_events_are_a_snapshot_and_survive_until_cleared() {
      final var well = newWell();
      well.updateStatus(WellStatus.DRILLING, "geologist");

      final var first = well.getDomainEvents();
      assertThrows(UnsupportedOperationException.class, first::clear);
      assertEquals(first, well.getDomainEvents());

      well.clearDomainEvents();
      assertTrue(well.getDomainEvents().isEmpty());
      assertEquals(1, first.size());
    }

    @Test
    void mark_persisted_aligns_persisted_version() {
      final var well = newWell();
      well.updateStatus(WellStatus.DRILLING, "geologist");

      well.markPersisted(2L);

      assertFalse(well.isNew());
      assertFalse(well.hasUnsavedChanges());
      assertEquals(2L, well.getPersistedVersion());
    }

    @Test
    void when_marked_version_was_not_written_illegal_state_exception_is_thrown() {
      final var well = newWell();
      well.updateStatus(WellStatus.DRILLING, "geologist");

      assertThrows(IllegalStateException.class, () -> well.markPersisted(1L));
      assertThrows(IllegalStateException.class, () -> well.markPersisted(42L));
      assertTrue(well.isNew());
      assertEquals(0L, well.getPersistedVersion());
    }
  }

  @Nested
  class Identity {
    @Test
    void aggregates_are_equal_by_type_and_id() {
      final var well = newWell();
      final var copy = Well.rehydrate(well.toSnapshot(), TestClocks.FIXED);

      assertEquals(well, copy);
      assertEquals(well.hashCode(), copy.hashCode());
      assertNotEquals(well, newWell());
      assertNotEquals(new Staged(Stage.ONE), new Staged(Stage.ONE));
    }
  }
}
