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

/** Sets the password of a user who does not have one yet. */
public final class AddPasswordAuthenticationHandler
    extends DomainCommandHandler.InSession<AddPasswordAuthentication> {
  private final Clock clock;
  private final PasswordHasher passwordHasher;

  public AddPasswordAuthenticationHandler(final Clock clock, final PasswordHasher passwordHasher) {
    super(AddPasswordAuthentication.class);
    this.clock = requireArgument(clock, "Clock");
    this.passwordHasher = requireArgument(passwordHasher, "Password hasher");
  }

  @Override
  protected List<String> validate(final AddPasswordAuthentication command) {
    final List<String> problems = new ArrayList<>();

    if (command.userId() == null) {
      problems.add("UserId is required");
    }

    if (command.password() == null || command.password().isEmpty()) {
      problems.add("Password is required");
    }

    return problems;
  }

  @Override
  protected CommandResult handle(
      final AddPasswordAuthentication command, final WriteContext context, final Session session) {
    final Optional<User> user = context.load(User.class, command.userId());

    if (user.isEmpty()) {
      return CommandResult.invalid("User does not exist");
    }

    if (user.get().passwordHash() != null) {
      return CommandResult.invalid("User already has a password authentication");
    }

    final String passwordHash =
        requireProduced(passwordHasher.hash(command.password()), "a password hash");

    context.appendEvents(
        command.userId(),
        new PasswordAuthenticationAdded(
            session.sessionId(), command.userId(), passwordHash, clock.instant()));

    return CommandResult.ok();
  }
}
