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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Replaces the email of an active user with one nobody else uses. */
public final class ChangeUserEmailHandler extends DomainCommandHandler.InSession<ChangeUserEmail> {
  private final Clock clock;

  public ChangeUserEmailHandler(final Clock clock) {
    super(ChangeUserEmail.class);
    this.clock = requireArgument(clock, "Clock");
  }

  @Override
  protected List<String> validate(final ChangeUserEmail command) {
    final List<String> problems = new ArrayList<>();

    if (command.userId() == null) {
      problems.add("UserId is required");
    }

    UserInputRules.checkEmail(command.newEmail(), false, problems);
    return problems;
  }

  @Override
  protected CommandResult handle(
      final ChangeUserEmail command, final WriteContext context, final Session session) {
    final Optional<User> user = context.load(User.class, command.userId());

    if (user.isEmpty()) {
      return CommandResult.invalid("User not found");
    }

    if (user.get().deactivated()) {
      return CommandResult.invalid("Cannot change email for deactivated user");
    }

    if (user.get().email().equals(command.newEmail())) {
      return CommandResult.invalid("New email is the same as current email");
    }

    if (context
        .findByUniqueKey(User.class, UserProjection.EMAIL_KEY, command.newEmail())
        .isPresent()) {
      return CommandResult.invalid("Email already in use");
    }

    context.appendEvents(
        command.userId(),
        new UserEmailChanged(
            session.sessionId(), command.userId(), command.newEmail(), clock.instant()));

    return CommandResult.ok();
  }
}
