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

import org.jooq.Condition;
import org.jooq.impl.DSL;

/**
 * A composable boolean rule over candidates of type {@code T}.
 *
 * <p>Every specification has two representations which must agree on every input:
 *
 * <ul>
 *   <li>{@link #isSatisfiedBy(Object)} - pure in-memory evaluation.
 *   <li>{@link #toQueryClause()} - a jOOQ {@link Condition} handed verbatim to the query layer.
 * </ul>
 *
 * <p>Specifications form an immutable expression tree whose nodes are {@link Always}, {@link
 * Never}, field leaves ({@link FieldSpecification}), {@link And}, {@link Or} and {@link Not}.
 * Composite nodes always hold one or two operands - there is no empty conjunction, callers needing
 * a match-everything filter use {@link #always()}.
 *
 * <p>The combinators simplify trivially redundant trees, so that {@code a.and(a)}, {@code
 * a.and(always())} and {@code a.or(never())} all return {@code a}, while {@code a.and(never())}
 * returns {@link #never()}.
 *
 * @param <T> the type of the candidates
 */
public sealed interface Specification<T>
    permits Specification.Always,
        Specification.Never,
        Specification.And,
        Specification.Or,
        Specification.Not,
        FieldSpecification {

  /**
   * @return the identity of conjunction, satisfied by every candidate
   * @param <T> the type of the candidates
   */
  static <T> Specification<T> always() {
    return new Always<>();
  }

  /**
   * @return the identity of disjunction, satisfied by no candidate
   * @param <T> the type of the candidates
   */
  static <T> Specification<T> never() {
    return new Never<>();
  }

  /**
   * @param candidate to evaluate
   * @return {@code true} if the candidate satisfies this rule
   * @throws IllegalArgumentException if the candidate is {@code null}
   */
  boolean isSatisfiedBy(final T candidate);

  /**
   * @return the condition selecting exactly the persisted candidates satisfying this rule
   */
  Condition toQueryClause();

  /**
   * @param other rule
   * @return a rule satisfied iff both this and the other one are satisfied
   * @throws IllegalArgumentException if the other rule is {@code null}
   */
  default Specification<T> and(final Specification<T> other) {
    requireOperand(other);

    if (other instanceof Always<?> || this.equals(other)) {
      return this;
    }

    if (this instanceof Always<?>) {
      return other;
    }

    if (this instanceof Never<?> || other instanceof Never<?>) {
      return never();
    }

    return new And<>(this, other);
  }

  /**
   * @param other rule
   * @return a rule satisfied iff either this or the other one is satisfied
   * @throws IllegalArgumentException if the other rule is {@code null}
   */
  default Specification<T> or(final Specification<T> other) {
    requireOperand(other);

    if (other instanceof Never<?> || this.equals(other)) {
      return this;
    }

    if (this instanceof Never<?>) {
      return other;
    }

    if (this instanceof Always<?> || other instanceof Always<?>) {
      return always();
    }

    return new Or<>(this, other);
  }

  /**
   * @return a rule satisfied iff this one is not
   */
  default Specification<T> not() {
    if (this instanceof Always<?>) {
      return never();
    }

    if (this instanceof Never<?>) {
      return always();
    }

    if (this instanceof Not<T> negation) {
      return negation.operand();
    }

    return new Not<>(this);
  }

  private static void requireOperand(final Specification<?> operand) {
    if (operand == null) {
      throw new IllegalArgumentException("Specification operand cannot be null");
    }
  }

  private static void requireCandidate(final Object candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Candidate cannot be null");
    }
  }

  /**
   * Satisfied by every candidate.
   *
   * @param <T> the type of the candidates
   */
  record Always<T>() implements Specification<T> {
    @Override
    public boolean isSatisfiedBy(final T candidate) {
      requireCandidate(candidate);
      return true;
    }

    @Override
    public Condition toQueryClause() {
      return DSL.trueCondition();
    }
  }

  /**
   * Satisfied by no candidate.
   *
   * @param <T> the type of the candidates
   */
  record Never<T>() implements Specification<T> {
    @Override
    public boolean isSatisfiedBy(final T candidate) {
      requireCandidate(candidate);
      return false;
    }

    @Override
    public Condition toQueryClause() {
      return DSL.falseCondition();
    }
  }

  /**
   * Conjunction of two rules.
   *
   * @param left operand
   * @param right operand
   * @param <T> the type of the candidates
   */
  record And<T>(Specification<T> left, Specification<T> right) implements Specification<T> {
    public And {
      requireOperand(left);
      requireOperand(right);
    }

    @Override
    public boolean isSatisfiedBy(final T candidate) {
      return left.isSatisfiedBy(candidate) && right.isSatisfiedBy(candidate);
    }

    @Override
    public Condition toQueryClause() {
      return DSL.and(left.toQueryClause(), right.toQueryClause());
    }
  }

  /**
   * Disjunction of two rules.
   *
   * @param left operand
   * @param right operand
   * @param <T> the type of the candidates
   */
  record Or<T>(Specification<T> left, Specification<T> right) implements Specification<T> {
    public Or {
      requireOperand(left);
      requireOperand(right);
    }

    @Override
    public boolean isSatisfiedBy(final T candidate) {
      return left.isSatisfiedBy(candidate) || right.isSatisfiedBy(candidate);
    }

    @Override
    public Condition toQueryClause() {
      return DSL.or(left.toQueryClause(), right.toQueryClause());
    }
  }

  /**
   * Negation of a rule.
   *
   * @param operand to negate
   * @param <T> the type of the candidates
   */
  record Not<T>(Specification<T> operand) implements Specification<T> {
    public Not {
      requireOperand(operand);
    }

    @Override
    public boolean isSatisfiedBy(final T candidate) {
      return !operand.isSatisfiedBy(candidate);
    }

    @Override
    public Condition toQueryClause() {
      return DSL.not(operand.toQueryClause());
    }
  }
}
