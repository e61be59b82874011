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

import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.TransitionTable;
import io.github.wellops.ddd.domain.vo.Money;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Regulatory permit issued by an agency for an operation on a well.
 *
 * <p>An approved or renewed permit always carries an expiration date in the future of its approval.
 */
public final class Permit extends AggregateRoot<PermitStatus> {
  public static final TransitionTable<PermitStatus> TRANSITIONS =
      TransitionTable.builder(AggregateType.PERMIT, PermitStatus.class)
          .allow(PermitStatus.DRAFT, PermitStatus.SUBMITTED)
          .allow(
              PermitStatus.SUBMITTED,
              PermitStatus.UNDER_REVIEW,
              PermitStatus.APPROVED,
              PermitStatus.DENIED)
          .allow(PermitStatus.UNDER_REVIEW, PermitStatus.APPROVED, PermitStatus.DENIED)
          .allow(
              PermitStatus.APPROVED,
              PermitStatus.EXPIRED,
              PermitStatus.RENEWED,
              PermitStatus.REVOKED)
          .allow(
              PermitStatus.RENEWED,
              PermitStatus.EXPIRED,
              PermitStatus.RENEWED,
              PermitStatus.REVOKED)
          .allow(PermitStatus.EXPIRED, PermitStatus.RENEWED, PermitStatus.REVOKED)
          .terminal(PermitStatus.DENIED)
          .terminal(PermitStatus.REVOKED)
          .allowAnyFrom(PermitStatus.UNKNOWN)
          .build();

  private final String permitNumber;
  private final PermitType permitType;
  private final UUID wellId;
  private final UUID organizationId;
  private final String issuingAgency;

  private LocalDate approvalDate;
  private LocalDate expirationDate;
  private Money fee;

  private Permit(
      final UUID id,
      final String permitNumber,
      final PermitType permitType,
      final UUID wellId,
      final UUID organizationId,
      final String issuingAgency,
      final Clock clock) {
    super(id, PermitStatus.DRAFT, clock);
    this.permitNumber = permitNumber;
    this.permitType = permitType;
    this.wellId = wellId;
    this.organizationId = organizationId;
    this.issuingAgency = issuingAgency;
  }

  private Permit(final Snapshot snapshot, final Clock clock) {
    super(
        snapshot.id(),
        snapshot.status(),
        snapshot.version(),
        snapshot.createdAt(),
        snapshot.updatedAt(),
        clock);
    this.permitNumber = snapshot.permitNumber();
    this.permitType = snapshot.permitType();
    this.wellId = snapshot.wellId();
    this.organizationId = snapshot.organizationId();
    this.issuingAgency = snapshot.issuingAgency();
    this.approvalDate = snapshot.approvalDate();
    this.expirationDate = snapshot.expirationDate();
    this.fee = snapshot.fee();
  }

  public static Permit create(
      final Clock clock,
      final String permitNumber,
      final PermitType permitType,
      final UUID wellId,
      final UUID organizationId,
      final String issuingAgency) {
    return new Permit(
        UUID.randomUUID(),
        DomainPreconditions.requireText(permitNumber, "permitNumber"),
        DomainPreconditions.requireValue(permitType, "permitType"),
        DomainPreconditions.requireValue(wellId, "wellId"),
        DomainPreconditions.requireValue(organizationId, "organizationId"),
        DomainPreconditions.requireText(issuingAgency, "issuingAgency"),
        clock);
  }

  public static Permit rehydrate(final Snapshot snapshot, final Clock clock) {
    if (snapshot == null) {
      throw new IllegalArgumentException("Permit snapshot cannot be null");
    }

    return new Permit(snapshot, clock);
  }

  @Override
  public AggregateType aggregateType() {
    return AggregateType.PERMIT;
  }

  @Override
  protected TransitionTable<PermitStatus> transitionTable() {
    return TRANSITIONS;
  }

  public void submit(final String submittedBy) {
    transitionTo(PermitStatus.SUBMITTED, submittedBy, null);
  }

  public void beginReview(final String reviewer) {
    transitionTo(PermitStatus.UNDER_REVIEW, reviewer, null);
  }

  /**
   * @param approvedBy identity of the actor
   * @param expiresOn last day the permit is valid, must be after today
   */
  public void approve(final String approvedBy, final LocalDate expiresOn) {
    final LocalDate today = LocalDate.now(clock());
    DomainPreconditions.requireValue(expiresOn, "expirationDate");
    DomainPreconditions.check(
        expiresOn.isAfter(today), "expirationDate", "Expiration date must be in the future");

    transitionTo(PermitStatus.APPROVED, approvedBy, null);
    approvalDate = today;
    expirationDate = expiresOn;
  }

  public void deny(final String deniedBy, final String reason) {
    transitionTo(PermitStatus.DENIED, deniedBy, DomainPreconditions.requireText(reason, "reason"));
  }

  public void expire(final String expiredBy) {
    transitionTo(PermitStatus.EXPIRED, expiredBy, null);
  }

  /**
   * Extends the validity of the permit.
   *
   * @param renewedBy identity of the actor
   * @param newExpirationDate must be after both today and the current expiration date
   */
  public void renew(final String renewedBy, final LocalDate newExpirationDate) {
    DomainPreconditions.requireValue(newExpirationDate, "expirationDate");
    DomainPreconditions.check(
        newExpirationDate.isAfter(LocalDate.now(clock())),
        "expirationDate",
        "Expiration date must be in the future");
    DomainPreconditions.check(
        expirationDate == null || newExpirationDate.isAfter(expirationDate),
        "expirationDate",
        "Renewal must extend the current expiration date %s".formatted(expirationDate));

    transitionTo(PermitStatus.RENEWED, renewedBy, null);
    expirationDate = newExpirationDate;
  }

  public void revoke(final String revokedBy, final String reason) {
    transitionTo(
        PermitStatus.REVOKED, revokedBy, DomainPreconditions.requireText(reason, "reason"));
  }

  public void assessFee(final Money amount) {
    DomainPreconditions.requireValue(amount, "fee");
    DomainPreconditions.check(!amount.isNegative(), "fee", "Permit fee cannot be negative");

    fee = amount;
    touch();
  }

  /**
   * @param date to check against
   * @return {@code true} if the permit has an expiration date and it is before the given date
   */
  public boolean isExpiredOn(final LocalDate date) {
    return expirationDate != null && expirationDate.isBefore(date);
  }

  public String getPermitNumber() {
    return permitNumber;
  }

  public PermitType getPermitType() {
    return permitType;
  }

  public UUID getWellId() {
    return wellId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getIssuingAgency() {
    return issuingAgency;
  }

  public LocalDate getApprovalDate() {
    return approvalDate;
  }

  public LocalDate getExpirationDate() {
    return expirationDate;
  }

  public Money getFee() {
    return fee;
  }

  public Snapshot toSnapshot() {
    return new Snapshot(
        getId(),
        permitNumber,
        permitType,
        wellId,
        organizationId,
        issuingAgency,
        getStatus(),
        approvalDate,
        expirationDate,
        fee,
        getCreatedAt(),
        getUpdatedAt(),
        getVersion());
  }

  /** Persistable state of a {@link Permit}. */
  public record Snapshot(
      UUID id,
      String permitNumber,
      PermitType permitType,
      UUID wellId,
      UUID organizationId,
      String issuingAgency,
      PermitStatus status,
      LocalDate approvalDate,
      LocalDate expirationDate,
      Money fee,
      Instant createdAt,
      Instant updatedAt,
      long version) {}
}
