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

import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.TransitionTable;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Authorization for Expenditure: a budget request for a well operation which has to be approved
 * before money is spent.
 *
 * <p>All amounts of one AFE share the currency of its estimated cost.
 */
public final class Afe extends AggregateRoot<AfeStatus> {
  public static final TransitionTable<AfeStatus> TRANSITIONS =
      TransitionTable.builder(AggregateType.AFE, AfeStatus.class)
          .allow(AfeStatus.DRAFT, AfeStatus.SUBMITTED)
          .allow(AfeStatus.SUBMITTED, AfeStatus.APPROVED, AfeStatus.REJECTED, AfeStatus.DRAFT)
          .allow(AfeStatus.APPROVED, AfeStatus.CLOSED)
          .allow(AfeStatus.REJECTED, AfeStatus.DRAFT)
          .terminal(AfeStatus.CLOSED)
          .allowAnyFrom(AfeStatus.UNKNOWN)
          .build();

  private final AfeNumber afeNumber;
  private final UUID organizationId;
  private final UUID wellId;
  private final AfeType afeType;

  private Money estimatedCost;
  private Money approvedAmount;
  private Money actualCost;
  private String description;
  private LocalDate approvalDate;

  private Afe(
      final UUID id,
      final AfeNumber afeNumber,
      final UUID organizationId,
      final UUID wellId,
      final AfeType afeType,
      final Money estimatedCost,
      final String description,
      final Clock clock) {
    super(id, AfeStatus.DRAFT, clock);
    this.afeNumber = afeNumber;
    this.organizationId = organizationId;
    this.wellId = wellId;
    this.afeType = afeType;
    this.estimatedCost = estimatedCost;
    this.description = description;
  }

  private Afe(final Snapshot snapshot, final Clock clock) {
    super(
        snapshot.id(),
        snapshot.status(),
        snapshot.version(),
        snapshot.createdAt(),
        snapshot.updatedAt(),
        clock);
    this.afeNumber = snapshot.afeNumber();
    this.organizationId = snapshot.organizationId();
    this.wellId = snapshot.wellId();
    this.afeType = snapshot.afeType();
    this.estimatedCost = snapshot.estimatedCost();
    this.approvedAmount = snapshot.approvedAmount();
    this.actualCost = snapshot.actualCost();
    this.description = snapshot.description();
    this.approvalDate = snapshot.approvalDate();
  }

  /**
   * Creates a new AFE in {@link AfeStatus#DRAFT} status.
   *
   * @param clock to take timestamps from
   * @param afeNumber unique number of the AFE
   * @param organizationId owning the AFE
   * @param wellId the AFE is raised for, may be {@code null} for facility AFEs
   * @param afeType of the operation
   * @param estimatedCost of the operation, must not be negative
   * @param description of the operation, may be {@code null} while drafting
   * @return a new, not yet persisted AFE
   */
  public static Afe create(
      final Clock clock,
      final AfeNumber afeNumber,
      final UUID organizationId,
      final UUID wellId,
      final AfeType afeType,
      final Money estimatedCost,
      final String description) {
    DomainPreconditions.requireValue(estimatedCost, "estimatedCost");
    DomainPreconditions.check(
        !estimatedCost.isNegative(), "estimatedCost", "Estimated cost cannot be negative");

    return new Afe(
        UUID.randomUUID(),
        DomainPreconditions.requireValue(afeNumber, "afeNumber"),
        DomainPreconditions.requireValue(organizationId, "organizationId"),
        wellId,
        DomainPreconditions.requireValue(afeType, "afeType"),
        estimatedCost,
        description == null || description.isBlank() ? null : description.trim(),
        clock);
  }

  /**
   * Reconstructs an AFE from its persisted state.
   *
   * @param snapshot stored state
   * @param clock to take timestamps from
   * @return an AFE at its stored version with no pending events
   */
  public static Afe rehydrate(final Snapshot snapshot, final Clock clock) {
    if (snapshot == null) {
      throw new IllegalArgumentException("AFE snapshot cannot be null");
    }

    return new Afe(snapshot, clock);
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.AFE;
  }

  @Override
  protected TransitionTable<AfeStatus> transitionTable() {
    return TRANSITIONS;
  }

  public void updateStatus(final AfeStatus newStatus, final String updatedBy) {
    transitionTo(DomainPreconditions.requireValue(newStatus, "status"), updatedBy, null);
  }

  /**
   * Sends the AFE for approval.
   *
   * @param submittedBy identity of the actor
   * @throws io.github.wellops.ddd.domain.ValidationException if the estimate is not positive or
   *     the description is missing
   */
  public void submit(final String submittedBy) {
    DomainPreconditions.check(
        estimatedCost.isPositive(), "estimatedCost", "Estimated cost must be positive to submit");
    DomainPreconditions.requireText(description, "description");

    transitionTo(AfeStatus.SUBMITTED, submittedBy, null);
  }

  /**
   * Approves the AFE and stamps today's date as approval date.
   *
   * @param approvedBy identity of the actor
   * @param amount approved, {@code null} to approve the estimated cost as is
   */
  public void approve(final String approvedBy, final Money amount) {
    final Money approved = amount == null ? estimatedCost : amount;
    requireSameCurrency(approved, "approvedAmount");
    DomainPreconditions.check(
        approved.isPositive(), "approvedAmount", "Approved amount must be positive");

    transitionTo(AfeStatus.APPROVED, approvedBy, null);
    approvedAmount = approved;
    approvalDate = LocalDate.now(clock());
  }

  public void reject(final String rejectedBy, final String reason) {
    transitionTo(AfeStatus.REJECTED, rejectedBy, DomainPreconditions.requireText(reason, "reason"));
  }

  public void close(final String closedBy) {
    transitionTo(AfeStatus.CLOSED, closedBy, null);
  }

  public void reviseEstimatedCost(final Money newEstimate) {
    DomainPreconditions.check(
        getStatus() == AfeStatus.DRAFT,
        "estimatedCost",
        "Estimated cost can only be revised while the AFE is a draft");
    requireSameCurrency(newEstimate, "estimatedCost");
    DomainPreconditions.check(
        !newEstimate.isNegative(), "estimatedCost", "Estimated cost cannot be negative");

    estimatedCost = newEstimate;
    touch();
  }

  public void reviseDescription(final String newDescription) {
    DomainPreconditions.check(
        getStatus() == AfeStatus.DRAFT,
        "description",
        "Description can only be revised while the AFE is a draft");

    description = DomainPreconditions.requireText(newDescription, "description");
    touch();
  }

  public void recordActualCost(final Money cost) {
    DomainPreconditions.check(
        getStatus() == AfeStatus.APPROVED || getStatus() == AfeStatus.CLOSED,
        "actualCost",
        "Actual cost can only be recorded for approved or closed AFEs");
    requireSameCurrency(cost, "actualCost");
    DomainPreconditions.check(!cost.isNegative(), "actualCost", "Actual cost cannot be negative");

    actualCost = cost;
    touch();
  }

  /**
   * @return {@code true} if recorded actual cost exceeds the approved amount
   */
  public boolean isOverBudget() {
    return actualCost != null && approvedAmount != null && actualCost.compareTo(approvedAmount) > 0;
  }

  private void requireSameCurrency(final Money amount, final String field) {
    DomainPreconditions.requireValue(amount, field);
    DomainPreconditions.check(
        amount.getCurrency().equals(estimatedCost.getCurrency()),
        field,
        "%s must be in %s".formatted(field, estimatedCost.getCurrency()));
  }

  public AfeNumber getAfeNumber() {
    return afeNumber;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getWellId() {
    return wellId;
  }

  public AfeType getAfeType() {
    return afeType;
  }

  public Money getEstimatedCost() {
    return estimatedCost;
  }

  public Money getApprovedAmount() {
    return approvedAmount;
  }

  public Money getActualCost() {
    return actualCost;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getApprovalDate() {
    return approvalDate;
  }

  /**
   * @return the persistable state of this AFE
   */
  public Snapshot toSnapshot() {
    return new Snapshot(
        getId(),
        afeNumber,
        organizationId,
        wellId,
        afeType,
        getStatus(),
        estimatedCost,
        approvedAmount,
        actualCost,
        description,
        approvalDate,
        getCreatedAt(),
        getUpdatedAt(),
        getVersion());
  }

  /** Persistable state of an {@link Afe}. */
  public record Snapshot(
      UUID id,
      AfeNumber afeNumber,
      UUID organizationId,
      UUID wellId,
      AfeType afeType,
      AfeStatus status,
      Money estimatedCost,
      Money approvedAmount,
      Money actualCost,
      String description,
      LocalDate approvalDate,
      Instant createdAt,
      Instant updatedAt,
      long version) {}
}
