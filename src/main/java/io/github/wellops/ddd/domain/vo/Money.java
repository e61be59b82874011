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

import io.github.wellops.ddd.domain.DomainPreconditions;
import io.github.wellops.ddd.domain.ValidationException;
import java.io.Serial;
import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * An amount of money in a given currency, kept at a scale of two decimal places.
 *
 * <p>Amounts may be negative (credits, adjustments) but are capped at {@link #MAX_ABSOLUTE_AMOUNT}.
 * Arithmetic is only allowed between amounts of the same currency.
 */
public final class Money implements Comparable<Money>, Serializable {
  @Serial private static final long serialVersionUID = -4185036231046405219L;

  public static final String DEFAULT_CURRENCY = "USD";
  public static final BigDecimal MAX_ABSOLUTE_AMOUNT = new BigDecimal("999999999999.99");

  private static final int SCALE = 2;
  private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

  private final BigDecimal amount;
  private final String currency;

  private Money(final BigDecimal amount, final String currency) {
    this.amount = amount.setScale(SCALE, ROUNDING);
    this.currency = currency;
  }

  /**
   * @param amount of money
   * @param currency three-letter ISO 4217 code
   * @return a new instance
   * @throws ValidationException if the amount is missing or too large, or the currency is invalid
   */
  public static Money of(final BigDecimal amount, final String currency) {
    DomainPreconditions.requireValue(amount, "amount");
    final String code =
        DomainPreconditions.requireText(currency, "currency").toUpperCase(Locale.ROOT);

    if (code.length() != 3) {
      throw new ValidationException("currency", "Currency must be a 3-letter ISO code");
    }

    try {
      Currency.getInstance(code);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("currency", "Unknown currency '%s'".formatted(code));
    }

    final BigDecimal scaled = amount.setScale(SCALE, ROUNDING);
    DomainPreconditions.check(
        scaled.abs().compareTo(MAX_ABSOLUTE_AMOUNT) <= 0,
        "amount",
        "Amount exceeds maximum allowed value");
    return new Money(scaled, code);
  }

  /**
   * @param amount of money in {@link #DEFAULT_CURRENCY}
   * @return a new instance
   */
  public static Money usd(final String amount) {
    DomainPreconditions.requireText(amount, "amount");
    try {
      return of(new BigDecimal(amount.trim()), DEFAULT_CURRENCY);
    } catch (NumberFormatException e) {
      throw new ValidationException("amount", "'%s' is not a valid amount".formatted(amount));
    }
  }

  public static Money zero(final String currency) {
    return of(BigDecimal.ZERO, currency);
  }

  public Money add(final Money other) {
    requireSameCurrency(other);
    return of(amount.add(other.amount), currency);
  }

  public Money subtract(final Money other) {
    requireSameCurrency(other);
    return of(amount.subtract(other.amount), currency);
  }

  public boolean isPositive() {
    return amount.signum() > 0;
  }

  public boolean isNegative() {
    return amount.signum() < 0;
  }

  public boolean isZero() {
    return amount.signum() == 0;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  /**
   * @throws ValidationException if the currencies differ
   */
  @Override
  public int compareTo(final Money other) {
    requireSameCurrency(other);
    return amount.compareTo(other.amount);
  }

  private void requireSameCurrency(final Money other) {
    DomainPreconditions.requireValue(other, "amount");
    if (!currency.equals(other.currency)) {
      throw new ValidationException(
          "currency",
          "Cannot combine amounts in different currencies: %s vs %s"
              .formatted(currency, other.currency));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof Money money)) {
      return false;
    }

    return amount.compareTo(money.amount) == 0 && currency.equals(money.currency);
  }

  @Override
  public int hashCode() {
    return Objects.hash(amount.stripTrailingZeros(), currency);
  }

  @Override
  public String toString() {
    return currency + " " + amount.toPlainString();
  }
}
