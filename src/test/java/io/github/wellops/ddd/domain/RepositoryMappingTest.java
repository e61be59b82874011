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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.domain.afe.Afe;
import io.github.wellops.ddd.domain.afe.AfeRepository;
import io.github.wellops.ddd.domain.afe.AfeType;
import io.github.wellops.ddd.domain.los.ExpenseCategory;
import io.github.wellops.ddd.domain.los.ExpenseLineItem;
import io.github.wellops.ddd.domain.los.ExpenseLineItemTable;
import io.github.wellops.ddd.domain.los.ExpenseType;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatement;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatementRepository;
import io.github.wellops.ddd.domain.los.LeaseOperatingStatementSpecifications;
import io.github.wellops.ddd.domain.permit.Permit;
import io.github.wellops.ddd.domain.permit.PermitRepository;
import io.github.wellops.ddd.domain.permit.PermitSpecifications;
import io.github.wellops.ddd.domain.permit.PermitType;
import io.github.wellops.ddd.domain.vendor.Vendor;
import io.github.wellops.ddd.domain.vendor.VendorCertification;
import io.github.wellops.ddd.domain.vendor.VendorCertificationTable;
import io.github.wellops.ddd.domain.vendor.VendorInsurance;
import io.github.wellops.ddd.domain.vendor.VendorRepository;
import io.github.wellops.ddd.domain.vendor.VendorSpecifications;
import io.github.wellops.ddd.domain.vendor.VendorStatus;
import io.github.wellops.ddd.domain.vendor.VendorType;
import io.github.wellops.ddd.domain.vo.AfeNumber;
import io.github.wellops.ddd.domain.vo.Money;
import io.github.wellops.ddd.domain.vo.VendorCode;
import io.github.wellops.ddd.specification.FieldSpecification;
import io.github.wellops.test.TestClocks;
import io.github.wellops.test.TestDatabase;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Every aggregate survives a trip through its table with all of its state. */
class RepositoryMappingTest {
  static final UUID ORGANIZATION = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    TestDatabase.truncateAll();
  }

  @Nested
  class Afes {
    final AfeRepository repository =
        new AfeRepository(TestDatabase.DSL_CONTEXT_PROVIDER, TestClocks.FIXED);

    @Test
    void amounts_share_the_afe_currency() {
      final var afe =
          Afe.create(
              TestClocks.FIXED,
              new AfeNumber("AFE-2024-0311"),
              ORGANIZATION,
              null,
              AfeType.COMPLETION,
              Money.of(new BigDecimal("845000.10"), "CAD"),
              "Frac 24 stages");
      afe.submit("engineer");
      afe.approve("manager", Money.of(new BigDecimal("800000"), "CAD"));
      afe.recordActualCost(Money.of(new BigDecimal("812345.67"), "CAD"));
      repository.save(afe);

      final var loaded = repository.getById(afe.getId());

      assertEquals(afe.toSnapshot(), loaded.toSnapshot());
      assertEquals("CAD", loaded.getActualCost().getCurrency());
      assertNull(loaded.getWellId());
    }
  }

  @Nested
  class Permits {
    final PermitRepository repository =
        new PermitRepository(TestDatabase.DSL_CONTEXT_PROVIDER, TestClocks.FIXED);

    @Test
    void fee_and_dates_are_stored() {
      final var permit =
          Permit.create(
              TestClocks.FIXED,
              "FL-88",
              PermitType.FLARING,
              UUID.randomUUID(),
              ORGANIZATION,
              "North Dakota Industrial Commission");
      permit.assessFee(Money.usd("125.00"));
      permit.submit("regulatory");
      permit.approve("agency", TestClocks.TODAY.plusDays(20));
      repository.save(permit);

      final var loaded = repository.getById(permit.getId());

      assertEquals(permit.toSnapshot(), loaded.toSnapshot());
      assertEquals(
          List.of(permit.getId()),
          repository.findBy(PermitSpecifications.expiringWithin(TestClocks.TODAY, 30)).stream()
              .map(Permit::getId)
              .toList());
    }

    @Test
    void permit_without_fee_is_loaded_without_fee() {
      final var permit =
          Permit.create(
              TestClocks.FIXED,
              "SWD-3",
              PermitType.DISPOSAL,
              UUID.randomUUID(),
              ORGANIZATION,
              "Oklahoma Corporation Commission");
      repository.save(permit);

      assertNull(repository.getById(permit.getId()).getFee());
    }
  }

  @Nested
  class Vendors {
    final VendorRepository repository =
        new VendorRepository(TestDatabase.DSL_CONTEXT_PROVIDER, TestClocks.FIXED);

    Vendor reviewedVendor(final String code, final VendorType type) {
      final var vendor =
          Vendor.create(
              TestClocks.FIXED, new VendorCode(code), ORGANIZATION, "Vendor " + code, type);
      vendor.updateStatus(VendorStatus.UNDER_REVIEW, "buyer", null);
      return vendor;
    }

    @Test
    void qualification_state_is_stored() {
      final var vendor = reviewedVendor("SANDCO", VendorType.SUPPLIER);
      vendor.updateStatus(VendorStatus.APPROVED, "buyer", null);
      vendor.recordInsurance(
          new VendorInsurance(
              "Permian Mutual", "GL-100", Money.usd("1000000"), TestClocks.TODAY.plusDays(10)),
          "buyer");
      repository.save(vendor);

      final var loaded = repository.getById(vendor.getId());

      assertEquals(vendor.toSnapshot(), loaded.toSnapshot());
      assertEquals(Money.usd("1000000"), loaded.getInsurance().coverage());
      assertTrue(loaded.isQualified());
      assertEquals(1, repository.count(VendorSpecifications.active()));
      assertEquals(1, repository.count(VendorSpecifications.prequalifiedBy(TestClocks.TODAY)));
      assertEquals(
          1,
          repository.count(VendorSpecifications.insuranceExpiringWithin(TestClocks.TODAY, 10)));
      assertEquals(
          0, repository.count(VendorSpecifications.insuranceExpiringWithin(TestClocks.TODAY, 9)));
    }

    @Test
    void certifications_are_stored_in_order_and_replaced_on_update() {
      final var vendor = reviewedVendor("FRACCO", VendorType.SERVICE);
      vendor.addCertification(
          VendorCertification.issued(
              "IADC RigPass",
              "IADC",
              "RP-1",
              TestClocks.TODAY.minusYears(1),
              TestClocks.TODAY.plusYears(1)),
          "buyer");
      repository.save(vendor);

      final var loaded = repository.getById(vendor.getId());
      loaded.addCertification(
          VendorCertification.issued(
              "H2S Alive",
              "Energy Safety Canada",
              "H2S-7",
              TestClocks.TODAY.minusMonths(2),
              TestClocks.TODAY.plusDays(20)),
          "buyer");
      repository.save(loaded);

      final var reloaded = repository.getById(vendor.getId());
      assertEquals(loaded.toSnapshot(), reloaded.toSnapshot());
      assertEquals(
          List.of("IADC RigPass", "H2S Alive"),
          reloaded.getCertifications().stream().map(VendorCertification::name).toList());
      assertEquals(1, reloaded.getExpiringCertifications(30).size());
    }

    @Test
    void certifications_are_removed_with_their_vendor() {
      final var vendor = reviewedVendor("WIRECO", VendorType.SERVICE);
      vendor.addCertification(
          VendorCertification.issued(
              "IADC RigPass",
              "IADC",
              "RP-2",
              TestClocks.TODAY.minusYears(1),
              TestClocks.TODAY.plusYears(1)),
          "buyer");
      repository.save(vendor);

      repository.delete(vendor);

      assertEquals(0, TestDatabase.DSL_CONTEXT.fetchCount(VendorCertificationTable.TABLE));
    }
  }

  @Nested
  class Statements {
    final LeaseOperatingStatementRepository repository =
        new LeaseOperatingStatementRepository(
            TestDatabase.DSL_CONTEXT_PROVIDER, TestClocks.FIXED);

    @Test
    void statement_month_and_line_items_are_stored() {
      final var leaseId = UUID.randomUUID();
      final var statement =
          LeaseOperatingStatement.create(
              TestClocks.FIXED, leaseId, ORGANIZATION, YearMonth.of(2024, 3), "USD");
      statement.addExpenseLineItem(
          new ExpenseLineItem(
              "power",
              "Grid power",
              ExpenseCategory.UTILITIES,
              ExpenseType.OPERATING,
              Money.usd("4200.10")));
      statement.addExpenseLineItem(
          new ExpenseLineItem(
              "tubing",
              "Replacement tubing",
              ExpenseCategory.EQUIPMENT,
              ExpenseType.CAPITAL,
              Money.usd("99.90")));
      repository.save(statement);

      final var loaded = repository.getById(statement.getId());

      assertEquals(statement.toSnapshot(), loaded.toSnapshot());
      assertEquals(Money.usd("4300"), loaded.getTotalExpenses());
      assertEquals(Money.usd("4200.10"), loaded.getOperatingExpenses());
      assertEquals(Money.usd("99.90"), loaded.getCapitalExpenses());
      assertEquals(
          1,
          repository.count(
              LeaseOperatingStatementSpecifications.forLease(leaseId)
                  .and(LeaseOperatingStatementSpecifications.forMonth(YearMonth.of(2024, 3)))));
      assertEquals(
          1,
          repository.count(
              FieldSpecification.atLeast(
                  LeaseOperatingStatementSpecifications.CAPITAL_EXPENSES,
                  new BigDecimal("99.9"))));
    }

    @Test
    void removed_line_items_are_removed_from_the_store() {
      final var statement =
          LeaseOperatingStatement.create(
              TestClocks.FIXED, UUID.randomUUID(), ORGANIZATION, YearMonth.of(2024, 2), "USD");
      statement.addExpenseLineItem(
          new ExpenseLineItem(
              "power",
              "Grid power",
              ExpenseCategory.UTILITIES,
              ExpenseType.OPERATING,
              Money.usd("100")));
      repository.save(statement);

      final var loaded = repository.getById(statement.getId());
      loaded.removeExpenseLineItem("power");
      repository.save(loaded);

      final var reloaded = repository.getById(statement.getId());
      assertEquals(0, reloaded.getExpenseCount());
      assertEquals(Money.zero("USD"), reloaded.getTotalExpenses());
      assertEquals(0, TestDatabase.DSL_CONTEXT.fetchCount(ExpenseLineItemTable.TABLE));
      assertEquals(
          1,
          repository.count(
              LeaseOperatingStatementSpecifications.TOTAL_EXPENSES.eq(BigDecimal.ZERO)));
    }

    @Test
    void second_statement_for_the_same_lease_and_month_is_refused_by_the_store() {
      final var leaseId = UUID.randomUUID();
      repository.save(
          LeaseOperatingStatement.create(
              TestClocks.FIXED, leaseId, ORGANIZATION, YearMonth.of(2024, 4), "USD"));

      final var duplicate =
          LeaseOperatingStatement.create(
              TestClocks.FIXED, leaseId, ORGANIZATION, YearMonth.of(2024, 4), "USD");

      assertThrows(PersistenceException.class, () -> repository.save(duplicate));
    }
  }
}
