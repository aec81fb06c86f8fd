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

package io.github.suppierk.es.session;

import io.github.suppierk.es.cqrs.CommandPipeline;
import io.github.suppierk.es.cqrs.CommandResult;
import java.util.UUID;

/** Entry points for session commands, one method per command. */
public final class SessionCommandService {
  private final CommandPipeline commandPipeline;

  public SessionCommandService(final CommandPipeline commandPipeline) {
    if (commandPipeline == null) {
      throw new IllegalArgumentException("Command pipeline cannot be null");
    }

    this.commandPipeline = commandPipeline;
  }

  /**
   * @return successful result with the new session identifier as result data
   */
  public CommandResult createSession() {
    return commandPipeline.execute(new CreateSession());
  }

  /**
   * @param sessionId of the session to end
   * @param reason why the session is ended
   * @return the result of the command
   */
  public CommandResult endSession(final UUID sessionId, final String reason) {
    return commandPipeline.execute(new EndSession(sessionId, reason));
  }
}
