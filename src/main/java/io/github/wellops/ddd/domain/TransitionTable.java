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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;

/**
 * Authoritative map of legal status-to-status moves for a single {@link AggregateType}.
 *
 * <p>The table is indexed by the status enum itself, and lookups are total: a status which has no
 * entry in the table is treated as terminal, i.e. it has no legal transitions. This keeps
 * validation conservative - an aggregate rehydrated with an unexpected status cannot move
 * anywhere instead of failing with a lookup error.
 *
 * <p>A transition from a status to itself is only legal if explicitly listed.
 *
 * @param <S> the status enum of the aggregate type
 */
public final class TransitionTable<S extends Enum<S>> {
  private final AggregateType aggregateType;
  private final Class<S> statusType;
  private final Map<S, Set<S>> transitions;

  private TransitionTable(
      final AggregateType aggregateType,
      final Class<S> statusType,
      final Map<S, Set<S>> transitions) {
    this.aggregateType = aggregateType;
    this.statusType = statusType;
    this.transitions = transitions;
  }

  /**
   * @param aggregateType the table is describing
   * @param statusType enum class of the statuses
   * @return a new builder
   * @param <S> the status enum of the aggregate type
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static <S extends Enum<S>> Builder<S> builder(
      final AggregateType aggregateType, final Class<S> statusType) {
    if (aggregateType == null) {
      throw new IllegalArgumentException("Aggregate type cannot be null");
    }

    if (statusType == null) {
      throw new IllegalArgumentException("Status type cannot be null");
    }

    return new Builder<>(aggregateType, statusType);
  }

  public AggregateType getAggregateType() {
    return aggregateType;
  }

  public Class<S> getStatusType() {
    return statusType;
  }

  /**
   * @param from status to look up
   * @return an unmodifiable set of statuses {@code from} can legally move to, empty for terminal
   *     statuses and for statuses without an entry in this table
   * @throws IllegalArgumentException if the status is {@code null}
   */
  public Set<S> allowedFrom(final S from) {
    if (from == null) {
      throw new IllegalArgumentException("Status cannot be null");
    }

    final Set<S> allowed = transitions.get(from);
    if (allowed == null) {
      // Undeclared status behaves as terminal
      return Collections.emptySet();
    }

    return allowed;
  }

  /**
   * @param status to check
   * @return {@code true} if the status has an entry in this table, even an empty one
   */
  public boolean isDeclared(final S status) {
    return transitions.containsKey(status);
  }

  /**
   * @param status to check
   * @return {@code true} if no transition out of the status is legal
   */
  public boolean isTerminal(final S status) {
    return allowedFrom(status).isEmpty();
  }

  /**
   * @return an unmodifiable set of statuses which have an entry in this table
   */
  public Set<S> declaredStatuses() {
    return Collections.unmodifiableSet(transitions.keySet());
  }

  /**
   * @param from current status
   * @param to requested status
   * @return {@code true} if the move is legal
   */
  public boolean permits(final S from, final S to) {
    if (to == null) {
      throw new IllegalArgumentException("Target status cannot be null");
    }

    return allowedFrom(from).contains(to);
  }

  /**
   * Asserts that the move is legal.
   *
   * @param aggregateId of the aggregate attempting the transition, for error reporting
   * @param from current status
   * @param to requested status
   * @throws InvalidTransitionException if the move is not in this table
   */
  public void verify(final UUID aggregateId, final S from, final S to) {
    if (!permits(from, to)) {
      throw new InvalidTransitionException(aggregateType, aggregateId, from, to);
    }
  }

  /**
   * Builder of {@link TransitionTable}s.
   *
   * @param <S> the status enum of the aggregate type
   */
  public static final class Builder<S extends Enum<S>> {
    private final AggregateType aggregateType;
    private final Class<S> statusType;
    private final Map<S, Set<S>> transitions;

    private Builder(final AggregateType aggregateType, final Class<S> statusType) {
      this.aggregateType = aggregateType;
      this.statusType = statusType;
      this.transitions = new EnumMap<>(statusType);
    }

    /**
     * Declares the statuses {@code from} can move to.
     *
     * @param from status being declared
     * @param first allowed target status
     * @param rest other allowed target statuses
     * @return this builder
     * @throws IllegalStateException if {@code from} was already declared
     */
    @SafeVarargs
    public final Builder<S> allow(final S from, final S first, final S... rest) {
      final Set<S> targets = EnumSet.of(throwIfNull(first, "Target status"));
      for (S target : rest) {
        targets.add(throwIfNull(target, "Target status"));
      }

      return declare(from, targets);
    }

    /**
     * Declares a status with no way out.
     *
     * @param status being declared
     * @return this builder
     * @throws IllegalStateException if the status was already declared
     */
    public Builder<S> terminal(final S status) {
      return declare(status, EnumSet.noneOf(statusType));
    }

    /**
     * Declares an administrative correction status which may move to any status, itself
     * included.
     *
     * @param status being declared
     * @return this builder
     * @throws IllegalStateException if the status was already declared
     */
    public Builder<S> allowAnyFrom(final S status) {
      return declare(status, EnumSet.allOf(statusType));
    }

    /**
     * Creates the table. Every target must be declared itself and every non-terminal status
     * must be able to reach a terminal one.
     *
     * @return a new immutable table
     * @throws IllegalStateException if the declared transitions violate the rules above
     */
    public TransitionTable<S> build() {
      if (transitions.isEmpty()) {
        throw new IllegalStateException(
            "%s transition table is empty".formatted(aggregateType.displayName()));
      }

      for (Map.Entry<S, Set<S>> entry : transitions.entrySet()) {
        for (S target : entry.getValue()) {
          if (!transitions.containsKey(target)) {
            throw new IllegalStateException(
                "%s transition %s -> %s leads to an undeclared status"
                    .formatted(aggregateType.displayName(), entry.getKey(), target));
          }
        }

        if (!entry.getValue().isEmpty() && !reachesTerminal(entry.getKey())) {
          throw new IllegalStateException(
              "%s status %s cannot reach any terminal status"
                  .formatted(aggregateType.displayName(), entry.getKey()));
        }
      }

      final Map<S, Set<S>> copy = new EnumMap<>(statusType);
      transitions.forEach(
          (from, targets) -> copy.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
      return new TransitionTable<>(aggregateType, statusType, Collections.unmodifiableMap(copy));
    }

    private Builder<S> declare(final S from, final Set<S> targets) {
      throwIfNull(from, "Status");

      if (transitions.containsKey(from)) {
        throw new IllegalStateException(
            "%s status %s is already declared".formatted(aggregateType.displayName(), from));
      }

      transitions.put(from, targets);
      return this;
    }

    private boolean reachesTerminal(final S start) {
      final Set<S> visited = EnumSet.of(start);
      final Queue<S> queue = new ArrayDeque<>(visited);

      while (!queue.isEmpty()) {
        final S current = queue.remove();
        final Set<S> next = transitions.getOrDefault(current, Collections.emptySet());
        if (next.isEmpty()) {
          return true;
        }

        for (S candidate : next) {
          if (visited.add(candidate)) {
            queue.add(candidate);
          }
        }
      }

      return false;
    }

    private static <T> T throwIfNull(final T value, final String whatMustNotBeNull) {
      if (value == null) {
        throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
      }

      return value;
    }
  }
}
