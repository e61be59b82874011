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

package io.github.wellops.ddd.specification;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import org.jooq.Condition;

/**
 * Leaf of a {@link Specification} tree: a single primitive condition against one {@link
 * AggregateField}.
 *
 * <p>A candidate whose field value is missing never satisfies a leaf. The query clause mirrors
 * that by rendering as {@code column IS NOT NULL AND <predicate>}, which collapses SQL three-valued
 * logic into the same two-valued answer the in-memory evaluation gives - including under {@link
 * Specification#not()}.
 *
 * @param <T> the type of the candidates
 */
public sealed interface FieldSpecification<T> extends Specification<T>
    permits FieldSpecification.Equals, FieldSpecification.In, FieldSpecification.Between {

  /**
   * @param field to test
   * @param lower inclusive bound
   * @param upper inclusive bound
   * @return a specification satisfied by candidates whose value lies within the bounds
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  static <T, V extends Comparable<? super V>> Specification<T> between(
      final AggregateField<T, V> field, final V lower, final V upper) {
    return new Between<>(field, lower, upper);
  }

  /**
   * @param field to test
   * @param lower inclusive bound
   * @return a specification satisfied by candidates whose value is not below the bound
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  static <T, V extends Comparable<? super V>> Specification<T> atLeast(
      final AggregateField<T, V> field, final V lower) {
    return new Between<>(field, lower, null);
  }

  /**
   * @param field to test
   * @param upper inclusive bound
   * @return a specification satisfied by candidates whose value is not above the bound
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  static <T, V extends Comparable<? super V>> Specification<T> atMost(
      final AggregateField<T, V> field, final V upper) {
    return new Between<>(field, null, upper);
  }

  /**
   * @return the field this leaf is testing
   */
  AggregateField<T, ?> field();

  /**
   * @param value of the field, never {@code null}
   * @return {@code true} if the value passes the primitive condition
   */
  boolean test(final Object value);

  /**
   * @return the primitive condition without the {@code NOT NULL} guard
   */
  Condition predicate();

  /** {@inheritDoc} */
  @Override
  default boolean isSatisfiedBy(final T candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Candidate cannot be null");
    }

    final Object value = field().valueOf(candidate);
    return value != null && test(value);
  }

  /** {@inheritDoc} */
  @Override
  default Condition toQueryClause() {
    return field().column().isNotNull().and(predicate());
  }

  /**
   * Numbers are compared by value rather than by representation, as the database does.
   *
   * @param left value
   * @param right value
   * @return {@code true} if both values are the same
   */
  private static boolean sameValue(final Object left, final Object right) {
    if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
      return l.compareTo(r) == 0;
    }

    return left.equals(right);
  }

  /**
   * Decimals with a negative scale, such as {@code 2E+5}, are rescaled to zero so that the bound
   * value carries a precision wide enough for the number it denotes.
   *
   * @param value to bind, may be {@code null}
   * @return the same number in a form every numeric column accepts
   * @param <V> the value type
   */
  @SuppressWarnings("unchecked")
  private static <V> V normalized(final V value) {
    if (value instanceof BigDecimal decimal && decimal.scale() < 0) {
      return (V) decimal.setScale(0);
    }

    return value;
  }

  private static void requireField(final AggregateField<?, ?> field) {
    if (field == null) {
      throw new IllegalArgumentException("Specification field cannot be null");
    }
  }

  /**
   * Equality against a single value.
   *
   * @param field to test
   * @param value to compare with
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  record Equals<T, V>(AggregateField<T, V> field, V value) implements FieldSpecification<T> {
    public Equals {
      requireField(field);
      if (value == null) {
        throw new IllegalArgumentException(
            "Value of '%s' cannot be null, use a nullability check instead".formatted(field));
      }

      value = normalized(value);
    }

    @Override
    public boolean test(final Object candidateValue) {
      return sameValue(candidateValue, value);
    }

    @Override
    public Condition predicate() {
      return field.column().eq(value);
    }
  }

  /**
   * Membership in a non-empty set of values.
   *
   * @param field to test
   * @param values to look for
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  record In<T, V>(AggregateField<T, V> field, Set<V> values) implements FieldSpecification<T> {
    public In {
      requireField(field);
      values = copyOf(field, values);
    }

    private static <V> Set<V> copyOf(
        final AggregateField<?, V> field, final Collection<? extends V> values) {
      if (values == null || values.isEmpty()) {
        throw new IllegalArgumentException(
            "Values of '%s' cannot be empty, use Specification.never() instead"
                .formatted(field));
      }

      final Set<V> copy = new HashSet<>();
      for (V value : values) {
        if (value == null) {
          throw new IllegalArgumentException(
              "Values of '%s' cannot contain null".formatted(field));
        }

        copy.add(normalized(value));
      }

      return Collections.unmodifiableSet(copy);
    }

    @Override
    public boolean test(final Object candidateValue) {
      for (V value : values) {
        if (sameValue(candidateValue, value)) {
          return true;
        }
      }

      return false;
    }

    @Override
    public Condition predicate() {
      return field.column().in(values);
    }
  }

  /**
   * Inclusive range, open on the side whose bound is {@code null}.
   *
   * @param field to test
   * @param lower inclusive bound, {@code null} if unbounded
   * @param upper inclusive bound, {@code null} if unbounded
   * @param <T> the type of the candidates
   * @param <V> the value type
   */
  record Between<T, V extends Comparable<? super V>>(AggregateField<T, V> field, V lower, V upper)
      implements FieldSpecification<T> {
    public Between {
      requireField(field);

      if (lower == null && upper == null) {
        throw new IllegalArgumentException(
            "Range of '%s' needs at least one bound".formatted(field));
      }

      if (lower != null && upper != null && lower.compareTo(upper) > 0) {
        throw new IllegalArgumentException(
            "Range of '%s' is inverted: %s > %s".formatted(field, lower, upper));
      }

      lower = normalized(lower);
      upper = normalized(upper);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean test(final Object candidateValue) {
      final V value = (V) candidateValue;
      return (lower == null || value.compareTo(lower) >= 0)
          && (upper == null || value.compareTo(upper) <= 0);
    }

    @Override
    public Condition predicate() {
      if (lower == null) {
        return field.column().le(upper);
      }

      if (upper == null) {
        return field.column().ge(lower);
      }

      return field.column().between(lower, upper);
    }
  }
}
