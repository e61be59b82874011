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

package io.github.wellops.ddd.cqrs;

import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.UUID;

/**
 * Represents an immutable command which must change an aggregate as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>In terms of 'read-write' {@link DomainCommand} is a 'write' representation, whereas {@link
 * DomainQuery} is its 'read' counterpart.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Approve AFE' instead of 'Set AFE
 * status to APPROVED'.
 *
 * <p>Commands can be queued rather than processed synchronously - this is the reason this class
 * implements {@link DomainMessage} interface which extends {@link Serializable} interface.
 *
 * <p>Aggregates are created, changed through business methods, or deleted - the sealed hierarchy
 * makes every command declare which of the three it is.
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public sealed interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>
permits
  DomainCommand.Create,
  DomainCommand.Update,
  DomainCommand.Delete
{
// @formatter:on

  /** Marker interface, denoting an intent to create a new aggregate. */
  // @formatter:off
  non-sealed interface Create<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {}
  // @formatter:on

  /** Marker interface, denoting an intent to change an existing aggregate. */
  // @formatter:off
  non-sealed interface Update<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return identifier of the aggregate to change
     */
    UUID aggregateId();
  }

  /** Marker interface, denoting an intent to delete an existing aggregate. */
  // @formatter:off
  non-sealed interface Delete<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return identifier of the aggregate to delete
     */
    UUID aggregateId();
  }
}
