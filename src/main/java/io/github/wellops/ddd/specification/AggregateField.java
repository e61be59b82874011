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

import java.util.Collection;
import java.util.HashSet;
import java.util.function.Function;
import org.jooq.Field;

/**
 * Binds a named property of an aggregate to the database column it is persisted in, so that a
 * single condition can be evaluated both against an in-memory object and as a query clause.
 *
 * <p>The value type is shared by the accessor and the column, which is what makes leaf
 * specifications type-correct by construction: a status field only ever accepts constants of its
 * status enum.
 *
 * @param name of the property, used for diagnostics
 * @param accessor reading the property from an aggregate, may return {@code null}
 * @param column holding the property in the persisted store
 * @param <T> the aggregate type
 * @param <V> the value type
 */
public record AggregateField<T, V>(
    String name, Function<? super T, ? extends V> accessor, Field<V> column) {

  /**
   * Default constructor.
   *
   * @throws IllegalArgumentException if any of the components is {@code null}
   */
  public AggregateField {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Field name cannot be blank");
    }

    if (accessor == null) {
      throw new IllegalArgumentException("Field accessor cannot be null");
    }

    if (column == null) {
      throw new IllegalArgumentException("Field column cannot be null");
    }
  }

  /**
   * @param candidate to read the value from
   * @return the value of this field, possibly {@code null}
   */
  public V valueOf(final T candidate) {
    return accessor.apply(candidate);
  }

  /**
   * @param value to compare with
   * @return a specification satisfied by candidates whose value equals the given one
   */
  public Specification<T> eq(final V value) {
    return new FieldSpecification.Equals<>(this, value);
  }

  /**
   * @param values to look for, at least one
   * @return a specification satisfied by candidates whose value is one of the given ones
   */
  public Specification<T> in(final Collection<? extends V> values) {
    return new FieldSpecification.In<>(this, values == null ? null : new HashSet<V>(values));
  }

  @Override
  public String toString() {
    return name;
  }
}
