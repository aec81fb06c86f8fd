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
 * Defines general contract rules of the command side.
 *
 * <p>Here is an example to help explain how different objects are related to each other - let's
 * assume that a person opens an account in a bank branch:
 *
 * <ul>
 *   <li>The visit itself is a {@link io.github.suppierk.es.session.Session} - it is opened once at
 *       the entrance, every request made during the visit is done on its behalf, and it is closed
 *       at the exit.
 *   <li>Each request made at the counter is a {@link io.github.suppierk.es.cqrs.DomainCommand}:
 *       <ul>
 *         <li>Entering the branch is a {@link
 *             io.github.suppierk.es.cqrs.DomainCommand.Anonymous} command - there is no visit yet.
 *         <li>Opening an account is a {@link
 *             io.github.suppierk.es.cqrs.DomainCommand.InSession} command - the clerk first checks
 *             that the visit is still going on, which is the job of the {@link
 *             io.github.suppierk.es.cqrs.SessionGuard}.
 *       </ul>
 *   <li>The clerk serving a particular request is a {@link
 *       io.github.suppierk.es.cqrs.DomainCommandHandler}: it looks at the current state of the
 *       accounts and decides which {@link io.github.suppierk.es.cqrs.DomainEvent}s to write into
 *       the ledger.
 *   <li>The branch manager is the {@link io.github.suppierk.es.cqrs.CommandPipeline}: it makes
 *       sure that either all ledger entries of one request are written, or none of them, and that
 *       every answer given to the visitor is a {@link io.github.suppierk.es.cqrs.CommandResult}
 *       rather than a shrug.
 * </ul>
 */
package io.github.suppierk.es.cqrs;
