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

package io.github.wellops.ddd.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.async.DomainEventPublisher;
import io.github.wellops.ddd.client.AnonymousDomainClient;
import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.client.UnauthorizedException;
import io.github.wellops.ddd.domain.AggregateNotFoundException;
import io.github.wellops.ddd.domain.InvalidTransitionException;
import io.github.wellops.ddd.domain.StatusChangedEvent;
import io.github.wellops.ddd.domain.ValidationException;
import io.github.wellops.ddd.domain.VersionConflictException;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.ddd.domain.well.Well;
import io.github.wellops.ddd.domain.well.WellRepository;
import io.github.wellops.ddd.domain.well.WellStatus;
import io.github.wellops.ddd.domain.well.WellType;
import io.github.wellops.ddd.jooq.AggregateRepository;
import io.github.wellops.ddd.specification.Specification;
import io.github.wellops.test.AnotherDomainClient;
import io.github.wellops.test.RecordingEventPublisher;
import io.github.wellops.test.TestClocks;
import io.github.wellops.test.TestDatabase;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  static final WellRepository REPOSITORY =
      new WellRepository(TestDatabase.DSL_CONTEXT_PROVIDER, TestClocks.FIXED);
  static final CommandRetryPolicy RETRY_POLICY = new CommandRetryPolicy(3);

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll();
  }

  static Well storedWell(final String apiNumber) {
    final var well =
        Well.create(
            TestClocks.FIXED,
            ApiNumber.of(apiNumber),
            "Bakken 14-2H",
            UUID.randomUUID(),
            WellType.OIL,
            new Coordinates(47.8, -103.2));
    REPOSITORY.save(well);
    return well;
  }

  @Nested
  class Create {
    @Test
    void when_command_is_null_illegal_argument_must_be_thrown() {
      final var handler = new RegisterWellHandler();

      assertThrows(
          IllegalArgumentException.class,
          () ->
              handler.runInContext(
                  null, REPOSITORY, DomainEventPublisher.empty(), RETRY_POLICY));
    }

    @Test
    void when_client_is_null_illegal_state_must_be_thrown() {
      final var handler = new RegisterWellHandler();
      final var command = new RegisterWell(UUID.randomUUID(), Instant.now(), null, "4200100001");

      assertThrows(
          IllegalStateException.class,
          () ->
              handler.runInContext(
                  command, REPOSITORY, DomainEventPublisher.empty(), RETRY_POLICY));
      assertEquals(0, REPOSITORY.count(Specification.always()));
    }

    @Test
    void when_client_is_not_allowed_unauthorized_must_be_thrown() {
      final var handler = new RegisterWellHandler();
      final var command =
          new RegisterWell(
              UUID.randomUUID(), Instant.now(), AnotherDomainClient.getInstance(), "4200100001");

      final var exception =
          assertThrows(
              UnauthorizedException.class,
              () ->
                  handler.runInContext(
                      command, REPOSITORY, DomainEventPublisher.empty(), RETRY_POLICY));
      assertTrue(exception.getMessage().contains("RegisterWell"));
      assertEquals(0, REPOSITORY.count(Specification.always()));
    }

    @Test
    void when_any_of_the_collaborators_is_null_illegal_state_must_be_thrown() {
      final var handler = new RegisterWellHandler();
      final var command = registerWell("4200100001");

      assertThrows(
          IllegalStateException.class,
          () -> handler.runInContext(command, null, DomainEventPublisher.empty(), RETRY_POLICY));
      assertThrows(
          IllegalStateException.class,
          () -> handler.runInContext(command, REPOSITORY, null, RETRY_POLICY));
      assertThrows(
          IllegalStateException.class,
          () -> handler.runInContext(command, REPOSITORY, DomainEventPublisher.empty(), null));
    }

    @Test
    void when_handler_returns_nothing_illegal_state_must_be_thrown() {
      final var handler =
          new RegisterWellHandler() {
            @Override
            protected Well create(
                final RegisterWell command, final AggregateRepository<Well> repository) {
              return null;
            }
          };

      assertThrows(
          IllegalStateException.class,
          () ->
              handler.runInContext(
                  registerWell("4200100001"),
                  REPOSITORY,
                  DomainEventPublisher.empty(),
                  RETRY_POLICY));
    }

    @Test
    void new_aggregate_is_saved_at_its_first_version() {
      final var publisher = new RecordingEventPublisher();

      final var well =
          new RegisterWellHandler()
              .runInContext(registerWell("4200100001"), REPOSITORY, publisher, RETRY_POLICY);

      assertFalse(well.isNew());
      assertFalse(well.hasUnsavedChanges());
      assertEquals(1L, REPOSITORY.getById(well.getId()).getVersion());
      assertEquals(WellStatus.PLANNED, well.getStatus());
      assertTrue(publisher.getPublished().isEmpty());
    }
  }

  @Nested
  class Update {
    @Test
    void events_are_published_after_the_save_and_then_cleared() {
      final var stored = storedWell("4200100002");
      final var publisher = new RecordingEventPublisher();
      final var handler = new AdvanceWellHandler();

      final var well =
          handler.runInContext(
              advanceWell(stored.getId(), WellStatus.PERMITTED),
              REPOSITORY,
              publisher,
              RETRY_POLICY);

      assertTrue(well.getDomainEvents().isEmpty());
      assertEquals(1, publisher.getPublished().size());

      final var event = assertInstanceOf(StatusChangedEvent.class, publisher.getPublished().get(0));
      assertEquals(stored.getId(), event.aggregateId());
      assertEquals(WellStatus.PLANNED, event.previousStatus());
      assertEquals(WellStatus.PERMITTED, event.newStatus());
      assertEquals(2L, event.aggregateVersion());
      assertEquals(2L, REPOSITORY.getById(stored.getId()).getVersion());
    }

    @Test
    void publisher_failure_does_not_undo_the_save() {
      final var stored = storedWell("4200100003");
      final var publisher = new RecordingEventPublisher(1);

      final var well =
          new AdvanceWellHandler()
              .runInContext(
                  advanceWell(stored.getId(), WellStatus.PERMITTED),
                  REPOSITORY,
                  publisher,
                  RETRY_POLICY);

      assertTrue(well.getDomainEvents().isEmpty());
      assertTrue(publisher.getPublished().isEmpty());
      assertEquals(WellStatus.PERMITTED, REPOSITORY.getById(stored.getId()).getStatus());
    }

    @Test
    void failed_save_publishes_nothing_and_keeps_the_events() {
      final var stored = storedWell("4200100004");
      final var publisher = new RecordingEventPublisher();
      final var racing = new RacingRepository(Integer.MAX_VALUE);
      final var handler = new AdvanceWellHandler();

      assertThrows(
          VersionConflictException.class,
          () ->
              handler.runInContext(
                  advanceWell(stored.getId(), WellStatus.PERMITTED),
                  racing,
                  publisher,
                  CommandRetryPolicy.noRetries()));

      assertTrue(publisher.getPublished().isEmpty());
      assertEquals(1, handler.lastSeen.getDomainEvents().size());
      assertTrue(handler.lastSeen.hasUnsavedChanges());
    }

    @Test
    void lost_race_is_retried_against_a_fresh_copy() {
      final var stored = storedWell("4200100005");
      final var racing = new RacingRepository(1);
      final var handler = new RenameWellHandler();

      final var well =
          handler.runInContext(
              renameWell(stored.getId(), "Bakken 14-2H ST1"),
              racing,
              DomainEventPublisher.empty(),
              RETRY_POLICY);

      assertEquals(2, handler.attempts);
      assertEquals(3L, well.getVersion());

      final var reloaded = REPOSITORY.getById(stored.getId());
      assertEquals("Bakken 14-2H ST1", reloaded.getName());
      assertEquals(3L, reloaded.getVersion());
    }

    @Test
    void conflict_reaches_the_caller_once_the_attempts_are_used_up() {
      final var stored = storedWell("4200100006");
      final var handler = new RenameWellHandler();

      final var exception =
          assertThrows(
              VersionConflictException.class,
              () ->
                  handler.runInContext(
                      renameWell(stored.getId(), "Bakken 14-2H ST1"),
                      new RacingRepository(Integer.MAX_VALUE),
                      DomainEventPublisher.empty(),
                      new CommandRetryPolicy(2)));

      assertEquals(2, handler.attempts);
      assertEquals(stored.getId(), exception.getAggregateId());
      assertEquals("Racer", REPOSITORY.getById(stored.getId()).getName());
    }

    @Test
    void missing_aggregate_is_not_retried() {
      final var handler = new RenameWellHandler();

      assertThrows(
          AggregateNotFoundException.class,
          () ->
              handler.runInContext(
                  renameWell(UUID.randomUUID(), "Ghost"),
                  REPOSITORY,
                  DomainEventPublisher.empty(),
                  RETRY_POLICY));
      assertEquals(0, handler.attempts);
    }

    @Test
    void rejected_transition_is_not_retried_and_nothing_is_saved() {
      final var stored = storedWell("4200100007");
      final var publisher = new RecordingEventPublisher();
      final var handler = new AdvanceWellHandler();

      assertThrows(
          InvalidTransitionException.class,
          () ->
              handler.runInContext(
                  advanceWell(stored.getId(), WellStatus.PRODUCING),
                  REPOSITORY,
                  publisher,
                  RETRY_POLICY));

      assertEquals(1, handler.attempts);
      assertTrue(publisher.getPublished().isEmpty());
      assertEquals(1L, REPOSITORY.getById(stored.getId()).getVersion());
    }

    @Test
    void when_aggregate_id_is_missing_illegal_state_must_be_thrown() {
      assertThrows(
          IllegalStateException.class,
          () ->
              new RenameWellHandler()
                  .runInContext(
                      renameWell(null, "Nameless"),
                      REPOSITORY,
                      DomainEventPublisher.empty(),
                      RETRY_POLICY));
    }
  }

  @Nested
  class Delete {
    @Test
    void deletable_aggregate_is_removed() {
      final var stored = storedWell("4200100008");

      final var deleted =
          new RemoveWellHandler()
              .runInContext(
                  removeWell(stored.getId()),
                  REPOSITORY,
                  DomainEventPublisher.empty(),
                  RETRY_POLICY);

      assertEquals(stored.getId(), deleted.getId());
      assertTrue(REPOSITORY.findById(stored.getId()).isEmpty());
    }

    @Test
    void business_rule_can_refuse_the_deletion() {
      final var stored = storedWell("4200100009");
      new AdvanceWellHandler()
          .runInContext(
              advanceWell(stored.getId(), WellStatus.DRILLING),
              REPOSITORY,
              DomainEventPublisher.empty(),
              RETRY_POLICY);

      final var exception =
          assertThrows(
              ValidationException.class,
              () ->
                  new RemoveWellHandler()
                      .runInContext(
                          removeWell(stored.getId()),
                          REPOSITORY,
                          DomainEventPublisher.empty(),
                          RETRY_POLICY));

      assertEquals("status", exception.getField());
      assertTrue(REPOSITORY.findById(stored.getId()).isPresent());
    }
  }

  static RegisterWell registerWell(final String apiNumber) {
    return new RegisterWell(
        UUID.randomUUID(), Instant.now(), AnonymousDomainClient.getInstance(), apiNumber);
  }

  static AdvanceWell advanceWell(final UUID wellId, final WellStatus status) {
    return new AdvanceWell(
        UUID.randomUUID(), Instant.now(), AnonymousDomainClient.getInstance(), wellId, status);
  }

  static RenameWell renameWell(final UUID wellId, final String name) {
    return new RenameWell(
        UUID.randomUUID(), Instant.now(), AnonymousDomainClient.getInstance(), wellId, name);
  }

  static RemoveWell removeWell(final UUID wellId) {
    return new RemoveWell(
        UUID.randomUUID(), Instant.now(), AnonymousDomainClient.getInstance(), wellId);
  }

  record RegisterWell(
      UUID messageId, Instant createdAt, DomainClient domainClient, String apiNumber)
      implements DomainCommand.Create<UUID, Instant> {}

  record AdvanceWell(
      UUID messageId,
      Instant createdAt,
      DomainClient domainClient,
      UUID aggregateId,
      WellStatus status)
      implements DomainCommand.Update<UUID, Instant> {}

  record RenameWell(
      UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId, String name)
      implements DomainCommand.Update<UUID, Instant> {}

  record RemoveWell(UUID messageId, Instant createdAt, DomainClient domainClient, UUID aggregateId)
      implements DomainCommand.Delete<UUID, Instant> {}

  static class RegisterWellHandler extends DomainCommandHandler.Create<RegisterWell, Well> {
    RegisterWellHandler() {
      super(RegisterWell.class);
    }

    @Override
    protected boolean canBeUsedBy(final DomainClient domainClient) {
      return !"OTHER".equals(domainClient.domainRole());
    }

    @Override
    protected Well create(final RegisterWell command, final AggregateRepository<Well> repository) {
      return Well.create(
          TestClocks.FIXED,
          ApiNumber.of(command.apiNumber()),
          "Bakken 14-2H",
          UUID.randomUUID(),
          WellType.OIL,
          new Coordinates(47.8, -103.2));
    }
  }

  static final class AdvanceWellHandler extends DomainCommandHandler.Update<AdvanceWell, Well> {
    int attempts;
    Well lastSeen;

    AdvanceWellHandler() {
      super(AdvanceWell.class);
    }

    @Override
    protected void apply(final AdvanceWell command, final Well well) {
      attempts++;
      lastSeen = well;
      well.updateStatus(command.status(), command.actorId());
    }
  }

  static final class RenameWellHandler extends DomainCommandHandler.Update<RenameWell, Well> {
    int attempts;

    RenameWellHandler() {
      super(RenameWell.class);
    }

    @Override
    protected void apply(final RenameWell command, final Well well) {
      attempts++;
      well.rename(command.name());
    }
  }

  static final class RemoveWellHandler extends DomainCommandHandler.Delete<RemoveWell, Well> {
    RemoveWellHandler() {
      super(RemoveWell.class);
    }

    @Override
    protected void verifyDeletable(final RemoveWell command, final Well well) {
      if (well.getStatus() != WellStatus.PLANNED) {
        throw new ValidationException("status", "Only planned wells can be removed");
      }
    }
  }

  /** Lets another writer rename the stored well right before each of the next saves. */
  static final class RacingRepository implements AggregateRepository<Well> {
    private int racesLeft;

    RacingRepository(final int races) {
      this.racesLeft = races;
    }

    @Override
    public Optional<Well> findById(final UUID id) {
      return REPOSITORY.findById(id);
    }

    @Override
    public Well getById(final UUID id) {
      return REPOSITORY.getById(id);
    }

    @Override
    public void save(final Well aggregate) {
      if (racesLeft > 0) {
        racesLeft--;
        final var racer = REPOSITORY.getById(aggregate.getId());
        racer.rename("Racer");
        REPOSITORY.save(racer);
      }

      REPOSITORY.save(aggregate);
    }

    @Override
    public List<Well> findBy(final Specification<Well> specification) {
      return REPOSITORY.findBy(specification);
    }

    @Override
    public int count(final Specification<Well> specification) {
      return REPOSITORY.count(specification);
    }

    @Override
    public void delete(final Well aggregate) {
      REPOSITORY.delete(aggregate);
    }
  }
}
