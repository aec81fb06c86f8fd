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

package io.github.suppierk.es.cqrs;

import java.util.UUID;

/**
 * Represents a transient request to change the system by appending {@link DomainEvent}s.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Deactivate User' instead of 'Set
 * User deactivated flag to true'.
 *
 * <p>Commands are never persisted: they either produce events or produce nothing at all. To make
 * the execution mode of every command explicit, we leverage Java {@code sealed} feature, enforcing
 * users to pick one of the two kinds below rather than defining a command completely on their own.
 */
// @formatter:off
public sealed interface DomainCommand
permits
  DomainCommand.Anonymous, DomainCommand.InSession
{
// @formatter:on

  /**
   * Marker interface, denoting that the command can be executed without a session - the only
   * legitimate example is the creation of a session itself.
   */
  non-sealed interface Anonymous extends DomainCommand {}

  /**
   * Marker interface, denoting that the command must be executed on behalf of an existing, not
   * closed session.
   */
  non-sealed interface InSession extends DomainCommand {
    /**
     * @return the identifier of the acting session, can be {@code null} if the caller did not
     *     supply one
     */
    UUID sessionId();
  }
}
