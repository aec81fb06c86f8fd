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

import io.github.suppierk.es.cqrs.CommandResult;
import io.github.suppierk.es.cqrs.DomainCommandHandler;
import io.github.suppierk.es.cqrs.IdentityProvider;
import io.github.suppierk.es.store.WriteContext;
import java.time.Clock;
import java.util.UUID;

/** Starts a new session stream, result data is the new session identifier. */
public final class CreateSessionHandler extends DomainCommandHandler.Anonymous<CreateSession> {
  private final Clock clock;
  private final IdentityProvider identityProvider;

  public CreateSessionHandler(final Clock clock, final IdentityProvider identityProvider) {
    super(CreateSession.class);
    this.clock = requireArgument(clock, "Clock");
    this.identityProvider = requireArgument(identityProvider, "Identity provider");
  }

  @Override
  protected CommandResult handle(final CreateSession command, final WriteContext context) {
    final UUID sessionId = requireProduced(identityProvider.newId(), "a new session id");

    context.startStream(Session.class, sessionId, new SessionCreated(sessionId, clock.instant()));
    return CommandResult.ok(sessionId);
  }
}
