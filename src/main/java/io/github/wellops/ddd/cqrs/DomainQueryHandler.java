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

import io.github.wellops.ddd.client.UnauthorizedException;
import io.github.wellops.ddd.domain.AggregateRoot;
import io.github.wellops.ddd.jooq.AggregateRepository;
import java.util.List;
import java.util.Optional;

/**
 * Class to accept and process the work associated to a specific {@link DomainQuery}:
 *
 * <ul>
 *   <li>Assert that the {@link io.github.wellops.ddd.client.DomainClient} can invoke the {@link
 *       DomainQuery}.
 *   <li>Read aggregates through the {@link AggregateRepository}, typically by a {@link
 *       io.github.wellops.ddd.specification.Specification}.
 * </ul>
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <A> the aggregate type the query reads
 * @param <OUTPUT> the expected output type of the given query, {@link Optional} or {@link List} -
 *     containers which can be empty
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainQueryHandler<
  QUERY extends DomainQuery<?, ?>,
  A extends AggregateRoot<?>,
  OUTPUT
>
extends
        DomainHandler<QUERY>
permits
  DomainQueryHandler.One,
  DomainQueryHandler.Many
{
// @formatter:on
  private final Class<QUERY> queryClass;

  /**
   * Default constructor.
   *
   * @param queryClass this handler is intended for
   */
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    this.queryClass = throwIllegalArgumentIfNull(queryClass, "Query class");
  }

  /**
   * @return specific {@link DomainQuery} class
   */
  public final Class<QUERY> getQueryClass() {
    return queryClass;
  }

  /**
   * Defines business logic of this particular {@link DomainQueryHandler}.
   *
   * @param query being invoked
   * @param repository to read aggregates from
   * @return the answer to the query
   */
  protected abstract OUTPUT run(final QUERY query, final AggregateRepository<A> repository);

  /**
   * General business logic invocation to be used and exposed via {@link BoundedContext}.
   *
   * @param query being invoked
   * @param repository to read aggregates from
   * @return a result of query invocation
   * @throws UnauthorizedException if the client is not authorized to execute the query
   */
  final OUTPUT runInContext(final QUERY query, final AggregateRepository<A> repository) {
    final QUERY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    verifyClient(nonNullQuery, "Query", getQueryClass());

    final AggregateRepository<A> nonNullRepository =
        throwIllegalStateIfNull(repository, "Repository");

    return throwIllegalStateIfNull(run(nonNullQuery, nonNullRepository), "Query handler result");
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.One}.
   *
   * @param <ONE> the type of the particular {@link DomainQuery.One}
   * @param <A> the aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class One<
    ONE extends DomainQuery.One<?, ?>,
    A extends AggregateRoot<?>
  > extends DomainQueryHandler<ONE, A, Optional<A>> {
  // @formatter:on
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /**
   * A variant of the {@link DomainQueryHandler} for {@link DomainQuery.Many}.
   *
   * @param <MANY> the type of the particular {@link DomainQuery.Many}
   * @param <A> the aggregate type
   */
  // @formatter:off
  public abstract static non-sealed class Many<
    MANY extends DomainQuery.Many<?, ?>,
    A extends AggregateRoot<?>
  > extends DomainQueryHandler<MANY, A, List<A>> {
  // @formatter:on
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
