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

package io.github.wellops.ddd.domain.vo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.wellops.ddd.domain.ValidationException;
import java.math.BigDecimal;
import java.util.Locale;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MoneyTest {
  @Nested
  class Creation {
    @Test
    void amounts_are_rounded_half_up_to_cents() {
      assertEquals(new BigDecimal("10.13"), Money.usd("10.125").getAmount());
      assertEquals(new BigDecimal("10.00"), Money.usd("10").getAmount());
    }

    @Test
    void currency_is_normalized_to_upper_case() {
      assertEquals("CAD", Money.of(BigDecimal.ONE, "cad").getCurrency());
    }

    @Test
    void currency_normalization_does_not_depend_on_the_default_locale() {
      final Locale defaultLocale = Locale.getDefault();
      Locale.setDefault(Locale.forLanguageTag("tr-TR"));
      try {
        assertEquals("INR", Money.of(BigDecimal.ONE, "inr").getCurrency());
        assertEquals("AFE-2024-0001", new AfeNumber("afe-2024-0001").value());
      } finally {
        Locale.setDefault(defaultLocale);
      }
    }

    @Test
    void when_currency_is_unknown_validation_exception_is_thrown() {
      final var exception =
          assertThrows(ValidationException.class, () -> Money.of(BigDecimal.ONE, "XYZ"));
      assertEquals("currency", exception.getField());
      assertThrows(ValidationException.class, () -> Money.of(BigDecimal.ONE, "US"));
      assertThrows(ValidationException.class, () -> Money.of(BigDecimal.ONE, " "));
    }

    @Test
    void when_amount_is_not_a_number_validation_exception_is_thrown() {
      final var exception = assertThrows(ValidationException.class, () -> Money.usd("ten"));
      assertEquals("amount", exception.getField());
      assertThrows(ValidationException.class, () -> Money.of(null, "USD"));
    }

    @Test
    void when_amount_exceeds_column_range_validation_exception_is_thrown() {
      assertThrows(
          ValidationException.class,
          () -> Money.of(Money.MAX_ABSOLUTE_AMOUNT.add(BigDecimal.ONE), "USD"));
      assertEquals(
          Money.MAX_ABSOLUTE_AMOUNT.negate(),
          Money.of(Money.MAX_ABSOLUTE_AMOUNT.negate(), "USD").getAmount());
    }
  }

  @Nested
  class Arithmetic {
    @Test
    void same_currency_amounts_can_be_combined() {
      assertEquals(Money.usd("15.50"), Money.usd("10.25").add(Money.usd("5.25")));
      assertEquals(Money.usd("-1"), Money.usd("2").subtract(Money.usd("3")));
    }

    @Test
    void when_currencies_differ_validation_exception_is_thrown() {
      final var cad = Money.of(BigDecimal.ONE, "CAD");

      assertThrows(ValidationException.class, () -> Money.usd("1").add(cad));
      assertThrows(ValidationException.class, () -> Money.usd("1").compareTo(cad));
    }

    @Test
    void sign_checks_reflect_the_amount() {
      assertTrue(Money.usd("0.01").isPositive());
      assertTrue(Money.usd("-0.01").isNegative());
      assertTrue(Money.zero("USD").isZero());
      assertFalse(Money.zero("USD").isPositive());
    }
  }

  @Test
  void equality_ignores_scale() {
    final var one = Money.of(new BigDecimal("1.0"), "USD");
    final var other = Money.of(new BigDecimal("1.00"), "USD");

    assertEquals(one, other);
    assertEquals(one.hashCode(), other.hashCode());
    assertEquals("USD 1.00", one.toString());
  }
}
