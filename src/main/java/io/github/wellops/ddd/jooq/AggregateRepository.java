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

package io.github.wellops.ddd.jooq;

import io.github.wellops.ddd.domain.AggregateNotFoundException;
import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.domain.PersistenceException;
import io.github.wellops.ddd.domain.VersionConflictException;
import io.github.wellops.ddd.specification.Specification;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract of one aggregate type.
 *
 * <p>Every aggregate returned by a repository is rehydrated: it carries its exact stored version
 * and no pending domain events. Writes are guarded by optimistic concurrency - the stored version
 * must still be the one the aggregate was loaded with.
 *
 * @param <A> the aggregate type
 */
public interface AggregateRepository<A extends AggregateRoot<?>> {
  /**
   * @param id of the aggregate
   * @return the stored aggregate, or {@link Optional#empty()} if there is none
   * @throws PersistenceException if the store failed
   */
  Optional<A> findById(final UUID id);

  /**
   * @param id of the aggregate
   * @return the stored aggregate
   * @throws AggregateNotFoundException if there is none
   * @throws PersistenceException if the store failed
   */
  A getById(final UUID id);

  /**
   * Inserts a new aggregate or writes the changes of a loaded one. On success the aggregate is
   * marked as persisted at its current version; pending domain events are left untouched.
   *
   * @param aggregate to save
   * @throws VersionConflictException if the stored version differs from the loaded one, or a new
   *     aggregate collides with an existing identifier
   * @throws AggregateNotFoundException if a loaded aggregate is no longer stored
   * @throws PersistenceException if the store failed
   */
  void save(final A aggregate);

  /**
   * @param specification to match
   * @return matching aggregates ordered by identifier, possibly empty
   * @throws PersistenceException if the store failed
   */
  List<A> findBy(final Specification<A> specification);

  /**
   * @param specification to match
   * @return number of matching aggregates
   * @throws PersistenceException if the store failed
   */
  int count(final Specification<A> specification);

  /**
   * Deletes the aggregate if its stored version is still the loaded one.
   *
   * @param aggregate to delete
   * @throws VersionConflictException if the stored version differs from the loaded one
   * @throws AggregateNotFoundException if the aggregate is not stored
   * @throws PersistenceException if the store failed
   */
  void delete(final A aggregate);
}
