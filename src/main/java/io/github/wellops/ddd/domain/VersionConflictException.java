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

import java.io.Serial;
import java.util.UUID;

/**
 * Thrown by repositories when the stored version of an aggregate no longer matches the version
 * the in-memory copy was loaded with.
 *
 * <p>This is an expected outcome under contention: the in-memory aggregate is stale and must be
 * discarded, and the business operation retried against a freshly loaded one.
 */
public class VersionConflictException extends DomainException {
  @Serial private static final long serialVersionUID = 2231370915127745862L;

  /** Used as {@link #getActualVersion()} when the stored version could not be determined. */
  public static final long UNKNOWN_VERSION = -1L;

  private final AggregateType aggregateType;
  private final UUID aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * Default constructor.
   *
   * @param aggregateType of the conflicting aggregate
   * @param aggregateId of the conflicting aggregate
   * @param expectedVersion the in-memory aggregate was loaded with
   * @param actualVersion currently stored, or {@link #UNKNOWN_VERSION}
   */
  public VersionConflictException(
      AggregateType aggregateType, UUID aggregateId, long expectedVersion, long actualVersion) {
    super(
        "%s '%s' was modified concurrently: expected version %d, found %s"
            .formatted(
                aggregateType.displayName(),
                aggregateId,
                expectedVersion,
                actualVersion == UNKNOWN_VERSION ? "unknown" : Long.toString(actualVersion)));
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public final AggregateType getAggregateType() {
    return aggregateType;
  }

  public final UUID getAggregateId() {
    return aggregateId;
  }

  public final long getExpectedVersion() {
    return expectedVersion;
  }

  public final long getActualVersion() {
    return actualVersion;
  }

  /**
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 409;
  }
}
