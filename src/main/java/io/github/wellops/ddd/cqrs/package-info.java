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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are a drilling engineer working on a new well:
 *
 * <ul>
 *   <li>We, as an engineer, are a {@link io.github.wellops.ddd.client.DomainClient} - we can plan
 *       wells and inspect their state.
 *   <li>The well is an {@link io.github.wellops.ddd.domain.AggregateRoot}, with a status that can
 *       only move along its {@link io.github.wellops.ddd.domain.TransitionTable}:
 *       <ul>
 *         <li>We can change the well via {@link io.github.wellops.ddd.cqrs.DomainCommand}s:
 *             <ul>
 *               <li>We might send a {@link io.github.wellops.ddd.cqrs.DomainCommand} to {@code
 *                   Start Drilling} which moves the well from {@code PERMITTED} to {@code
 *                   DRILLING}, bumps its version and raises a {@link
 *                   io.github.wellops.ddd.domain.StatusChangedEvent}.
 *             </ul>
 *         <li>We can inspect wells via {@link io.github.wellops.ddd.cqrs.DomainQuery}s:
 *             <ul>
 *               <li>We might send a {@link io.github.wellops.ddd.cqrs.DomainQuery} to {@code List
 *                   Producing Wells} which is answered by a {@link
 *                   io.github.wellops.ddd.specification.Specification} evaluated by the database.
 *             </ul>
 *         <li>Other parts of the business learn about the change via {@link
 *             io.github.wellops.ddd.domain.DomainEvent}s:
 *             <ul>
 *               <li>Once the well is saved, its pending events are handed to a {@link
 *                   io.github.wellops.ddd.async.DomainEventPublisher}, so that accounting can
 *                   open an AFE for the drilling costs.
 *             </ul>
 *       </ul>
 *   <li>The well, combined with actions we can do, forms a {@link
 *       io.github.wellops.ddd.cqrs.BoundedContext} describing possible interactions.
 * </ul>
 */
package io.github.wellops.ddd.cqrs;
