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
import io.github.suppierk.es.cqrs.IdentityProvider;
import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.store.WriteContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Starts a new user stream, result data is the new user identifier.
 *
 * <p>The duplicate pre-check is racy by nature: concurrent duplicates which pass it are rejected by
 * the unique keys of {@link UserProjection} at commit.
 */
public final class CreateUserHandler extends DomainCommandHandler.InSession<CreateUser> {
  private final Clock clock;
  private final IdentityProvider identityProvider;

  public CreateUserHandler(final Clock clock, final IdentityProvider identityProvider) {
    super(CreateUser.class);
    this.clock = requireArgument(clock, "Clock");
    this.identityProvider = requireArgument(identityProvider, "Identity provider");
  }

  @Override
  protected List<String> validate(final CreateUser command) {
    final List<String> problems = new ArrayList<>();
    UserInputRules.checkUserName(command.userName(), problems);
    UserInputRules.checkEmail(command.email(), true, problems);
    return problems;
  }

  @Override
  protected CommandResult handle(
      final CreateUser command, final WriteContext context, final Session session) {
    if (context
        .findByUniqueKey(User.class, UserProjection.USER_NAME_KEY, command.userName())
        .isPresent()) {
      return CommandResult.invalid("Username already exists");
    }

    if (context
        .findByUniqueKey(User.class, UserProjection.EMAIL_KEY, command.email())
        .isPresent()) {
      return CommandResult.invalid("Email already exists");
    }

    final UUID userId = requireProduced(identityProvider.newId(), "a new user id");
    context.startStream(
        User.class,
        userId,
        new UserCreated(
            session.sessionId(), userId, command.userName(), command.email(), clock.instant()));

    return CommandResult.ok(userId);
  }
}
