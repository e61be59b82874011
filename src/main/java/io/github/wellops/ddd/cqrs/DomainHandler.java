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

import io.github.wellops.ddd.client.DomainClient;
import io.github.wellops.ddd.client.UnauthorizedException;
import java.util.Locale;

/**
 * Defines some of the common functionalities defined for handlers.
 *
 * @param <OPERATION> supported by the current handler
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION extends DomainMessage<?, ?>> extends Suspicious
    permits DomainCommandHandler, DomainQueryHandler {
  /**
   * @param domainClient invoking the handler
   * @return {@code true} if the client can invoke current handler, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return true;
  }

  /**
   * @param operation being invoked
   * @param kind of the operation for the error message
   * @param operationClass for the error message
   * @throws UnauthorizedException if the client of the operation may not use this handler
   */
  final void verifyClient(
      final OPERATION operation, final String kind, final Class<?> operationClass) {
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(operation.domainClient(), "%s's client".formatted(kind));

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' %s"
              .formatted(
                  nonNullDomainClient.domainRole(),
                  operationClass.getSimpleName(),
                  kind.toLowerCase(Locale.ROOT)));
    }
  }
}
