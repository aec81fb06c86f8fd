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

import io.github.suppierk.es.cqrs.CommandResult;
import io.github.suppierk.es.cqrs.DomainCommandHandler;
import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.store.WriteContext;
import java.time.Clock;
import java.util.Optional;

/** Deactivates a user, deactivating an already deactivated user succeeds without new events. */
public final class DeactivateUserHandler extends DomainCommandHandler.InSession<DeactivateUser> {
  private final Clock clock;

  public DeactivateUserHandler(final Clock clock) {
    super(DeactivateUser.class);
    this.clock = requireArgument(clock, "Clock");
  }

  @Override
  protected CommandResult handle(
      final DeactivateUser command, final WriteContext context, final Session session) {
    final Optional<User> user = context.load(User.class, command.userId());

    if (user.isEmpty()) {
      return CommandResult.invalid("User not found");
    }

    if (user.get().deactivated()) {
      return CommandResult.ok();
    }

    context.appendEvents(
        command.userId(),
        new UserDeactivated(session.sessionId(), command.userId(), clock.instant()));

    return CommandResult.ok();
  }
}
