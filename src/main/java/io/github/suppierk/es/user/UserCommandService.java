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

package io.github.suppierk.es.user;

import io.github.suppierk.es.cqrs.CommandPipeline;
import io.github.suppierk.es.cqrs.CommandResult;
import io.github.suppierk.es.session.Session;

/**
 * Entry points for user commands, one method per command.
 *
 * <p>Each method optionally accepts the acting {@link Session} if the caller already resolved it,
 * which spares the pipeline a query.
 */
public final class UserCommandService {
  private final CommandPipeline commandPipeline;

  public UserCommandService(final CommandPipeline commandPipeline) {
    if (commandPipeline == null) {
      throw new IllegalArgumentException("Command pipeline cannot be null");
    }

    this.commandPipeline = commandPipeline;
  }

  public CommandResult createUser(final CreateUser command) {
    return createUser(command, null);
  }

  public CommandResult createUser(final CreateUser command, final Session actingSession) {
    return commandPipeline.execute(command, actingSession);
  }

  public CommandResult addPasswordAuthentication(final AddPasswordAuthentication command) {
    return addPasswordAuthentication(command, null);
  }

  public CommandResult addPasswordAuthentication(
      final AddPasswordAuthentication command, final Session actingSession) {
    return commandPipeline.execute(command, actingSession);
  }

  public CommandResult deactivateUser(final DeactivateUser command) {
    return deactivateUser(command, null);
  }

  public CommandResult deactivateUser(final DeactivateUser command, final Session actingSession) {
    return commandPipeline.execute(command, actingSession);
  }

  public CommandResult changeUserEmail(final ChangeUserEmail command) {
    return changeUserEmail(command, null);
  }

  public CommandResult changeUserEmail(final ChangeUserEmail command, final Session actingSession) {
    return commandPipeline.execute(command, actingSession);
  }
}
