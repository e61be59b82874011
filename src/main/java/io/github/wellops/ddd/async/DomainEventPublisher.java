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

package io.github.wellops.ddd.async;

import io.github.wellops.ddd.domain.DomainEvent;

/**
 * Sink accepting {@link DomainEvent}s one at a time once the change they describe was durably
 * persisted.
 *
 * <p>Implementations either accept the event or signal failure by throwing. Nothing beyond
 * "accepted" is assumed about delivery: the caller publishes after the write has been committed,
 * so a crash in between may lose or repeat an event - consumers must be idempotent, for example by
 * deduplicating on {@link DomainEvent#messageId()}.
 */
@FunctionalInterface
public interface DomainEventPublisher {
  /**
   * @return an instance of publisher which does not perform any operations
   */
  static DomainEventPublisher empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Hands the event over for delivery.
   *
   * @param event to publish
   * @throws RuntimeException if the event was not accepted
   */
  void publish(final DomainEvent event);

  /** Default implementation of the fake publisher */
  final class NoOp implements DomainEventPublisher {
    private static final DomainEventPublisher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void publish(final DomainEvent event) {
      // Do nothing
    }
  }
}
