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

import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.TransitionTable;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An oil &amp; gas well with its complete lifecycle, from planning to plugging.
 *
 * <p>Business rules:
 *
 * <ul>
 *   <li>Status changes follow {@link #TRANSITIONS}.
 *   <li>Spud date cannot be in the future.
 *   <li>Completion date cannot be before the spud date.
 *   <li>Total depth must be positive.
 * </ul>
 */
public final class Well extends AggregateRoot<WellStatus> {
  public static final TransitionTable<WellStatus> TRANSITIONS =
      TransitionTable.builder(AggregateType.WELL, WellStatus.class)
          .allow(WellStatus.PLANNED, WellStatus.PERMITTED, WellStatus.DRILLING)
          .allow(WellStatus.PERMITTED, WellStatus.DRILLING, WellStatus.PLANNED)
          .allow(WellStatus.DRILLING, WellStatus.COMPLETED, WellStatus.TEMPORARILY_ABANDONED)
          .allow(WellStatus.COMPLETED, WellStatus.PRODUCING, WellStatus.SHUT_IN)
          .allow(WellStatus.PRODUCING, WellStatus.SHUT_IN, WellStatus.TEMPORARILY_ABANDONED)
          .allow(WellStatus.SHUT_IN, WellStatus.PRODUCING, WellStatus.TEMPORARILY_ABANDONED)
          .allow(
              WellStatus.TEMPORARILY_ABANDONED,
              WellStatus.PERMANENTLY_ABANDONED,
              WellStatus.PRODUCING)
          .allow(WellStatus.PERMANENTLY_ABANDONED, WellStatus.PLUGGED)
          .terminal(WellStatus.PLUGGED)
          .allow(WellStatus.ACTIVE, WellStatus.INACTIVE)
          .allow(WellStatus.INACTIVE, WellStatus.ACTIVE, WellStatus.PERMANENTLY_ABANDONED)
          .allowAnyFrom(WellStatus.UNKNOWN)
          .build();

  private final ApiNumber apiNumber;
  private final UUID operatorId;
  private final WellType wellType;
  private final Coordinates location;

  private String name;
  private UUID leaseId;
  private LocalDate spudDate;
  private LocalDate completionDate;
  private Integer totalDepthFeet;

  private Well(
      final UUID id,
      final ApiNumber apiNumber,
      final String name,
      final UUID operatorId,
      final WellType wellType,
      final Coordinates location,
      final Clock clock) {
    super(id, WellStatus.PLANNED, clock);
    this.apiNumber = apiNumber;
    this.name = name;
    this.operatorId = operatorId;
    this.wellType = wellType;
    this.location = location;
  }

  private Well(final Snapshot snapshot, final Clock clock) {
    super(
        snapshot.id(),
        snapshot.status(),
        snapshot.version(),
        snapshot.createdAt(),
        snapshot.updatedAt(),
        clock);
    this.apiNumber = snapshot.apiNumber();
    this.name = snapshot.name();
    this.operatorId = snapshot.operatorId();
    this.wellType = snapshot.wellType();
    this.location = snapshot.location();
    this.leaseId = snapshot.leaseId();
    this.spudDate = snapshot.spudDate();
    this.completionDate = snapshot.completionDate();
    this.totalDepthFeet = snapshot.totalDepthFeet();
  }

  /**
   * Creates a new well in {@link WellStatus#PLANNED} status.
   *
   * @param clock to take timestamps from
   * @param apiNumber of the well
   * @param name of the well
   * @param operatorId of the operating organization
   * @param wellType of the well
   * @param location of the surface hole
   * @return a new, not yet persisted well
   * @throws io.github.wellops.ddd.domain.ValidationException if any of the values is missing
   */
  public static Well create(
      final Clock clock,
      final ApiNumber apiNumber,
      final String name,
      final UUID operatorId,
      final WellType wellType,
      final Coordinates location) {
    return new Well(
        UUID.randomUUID(),
        DomainPreconditions.requireValue(apiNumber, "apiNumber"),
        DomainPreconditions.requireText(name, "name"),
        DomainPreconditions.requireValue(operatorId, "operatorId"),
        DomainPreconditions.requireValue(wellType, "wellType"),
        DomainPreconditions.requireValue(location, "location"),
        clock);
  }

  /**
   * Reconstructs a well from its persisted state.
   *
   * @param snapshot stored state
   * @param clock to take timestamps from
   * @return a well at its stored version with no pending events
   */
  public static Well rehydrate(final Snapshot snapshot, final Clock clock) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Well snapshot cannot be null");
    }

    return new Well(snapshot, clock);
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.WELL;
  }

  @Override
  protected TransitionTable<WellStatus> transitionTable() {
    return TRANSITIONS;
  }

  /**
   * @param newStatus to move to
   * @param updatedBy identity of the actor
   * @throws io.github.wellops.ddd.domain.InvalidTransitionException if the move is not allowed
   */
  public void updateStatus(final WellStatus newStatus, final String updatedBy) {
    transitionTo(DomainPreconditions.requireValue(newStatus, "status"), updatedBy, null);
  }

  public void rename(final String newName) {
    name = DomainPreconditions.requireText(newName, "name");
    touch();
  }

  public void assignLease(final UUID newLeaseId) {
    leaseId = DomainPreconditions.requireValue(newLeaseId, "leaseId");
    touch();
  }

  public void recordSpudDate(final LocalDate date) {
    DomainPreconditions.requireValue(date, "spudDate");
    DomainPreconditions.check(
        !date.isAfter(LocalDate.now(clock())), "spudDate", "Spud date cannot be in the future");
    DomainPreconditions.check(
        completionDate == null || !completionDate.isBefore(date),
        "spudDate",
        "Spud date cannot be after completion date");

    spudDate = date;
    touch();
  }

  public void recordCompletionDate(final LocalDate date) {
    DomainPreconditions.requireValue(date, "completionDate");
    DomainPreconditions.check(
        spudDate == null || !date.isBefore(spudDate),
        "completionDate",
        "Completion date cannot be before spud date");

    completionDate = date;
    touch();
  }

  public void recordTotalDepth(final int feet) {
    DomainPreconditions.check(feet > 0, "totalDepth", "Total depth must be greater than 0");

    totalDepthFeet = feet;
    touch();
  }

  public ApiNumber getApiNumber() {
    return apiNumber;
  }

  public String getName() {
    return name;
  }

  public UUID getOperatorId() {
    return operatorId;
  }

  public WellType getWellType() {
    return wellType;
  }

  public Coordinates getLocation() {
    return location;
  }

  public UUID getLeaseId() {
    return leaseId;
  }

  public LocalDate getSpudDate() {
    return spudDate;
  }

  public LocalDate getCompletionDate() {
    return completionDate;
  }

  public Integer getTotalDepthFeet() {
    return totalDepthFeet;
  }

  /**
   * @return the persistable state of this well
   */
  public Snapshot toSnapshot() {
    return new Snapshot(
        getId(),
        apiNumber,
        name,
        operatorId,
        wellType,
        getStatus(),
        location,
        leaseId,
        spudDate,
        completionDate,
        totalDepthFeet,
        getCreatedAt(),
        getUpdatedAt(),
        getVersion());
  }

  /** Persistable state of a {@link Well}. */
  public record Snapshot(
      UUID id,
      ApiNumber apiNumber,
      String name,
      UUID operatorId,
      WellType wellType,
      WellStatus status,
      Coordinates location,
      UUID leaseId,
      LocalDate spudDate,
      LocalDate completionDate,
      Integer totalDepthFeet,
      Instant createdAt,
      Instant updatedAt,
      long version) {}
}
