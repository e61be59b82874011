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

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only buffer of pending {@link DomainEvent}s owned by a single aggregate.
 *
 * <p>Reading the buffer never mutates it: the owner of the persistence cycle takes a snapshot
 * with {@link #drain()}, publishes it once the aggregate has been durably written, and only then
 * calls {@link #clear()}. A failed write leaves the buffer as it was, so the events are not lost.
 *
 * <p>Not thread-safe, as aggregates are mutated by one caller at a time.
 */
public final class DomainEventBuffer {
  private final List<DomainEvent> events = new ArrayList<>();

  /**
   * @param event to add at the end of the buffer
   * @throws IllegalArgumentException if the event is {@code null}
   */
  public void append(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Domain event cannot be null");
    }

    events.add(event);
  }

  /**
   * @return an immutable snapshot of the pending events in the order they were appended
   */
  public List<DomainEvent> peek() {
    return List.copyOf(events);
  }

  /**
   * Same as {@link #peek()}; named after its role in the persistence cycle. The buffer is emptied
   * only by {@link #clear()}.
   *
   * @return an immutable snapshot of the pending events in the order they were appended
   */
  public List<DomainEvent> drain() {
    return peek();
  }

  /** Discards every pending event. */
  public void clear() {
    events.clear();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public int size() {
    return events.size();
  }
}
