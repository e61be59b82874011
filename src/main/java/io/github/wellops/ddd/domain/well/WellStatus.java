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

package io.github.wellops.ddd.domain.well;

/**
 * Production lifecycle of a well.
 *
 * <p>{@link #ACTIVE} and {@link #INACTIVE} are a legacy pair kept for wells imported before the
 * richer lifecycle was introduced. {@link #UNKNOWN} is the administrative correction status.
 */
public enum WellStatus {
  PLANNED,
  PERMITTED,
  DRILLING,
  COMPLETED,
  PRODUCING,
  SHUT_IN,
  TEMPORARILY_ABANDONED,
  PERMANENTLY_ABANDONED,
  PLUGGED,
  ACTIVE,
  INACTIVE,
  UNKNOWN
}
