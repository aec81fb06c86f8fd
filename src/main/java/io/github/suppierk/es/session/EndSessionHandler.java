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
import io.github.suppierk.es.store.WriteContext;
import java.time.Clock;
import java.util.List;

/** Ends the acting session, which the pipeline already verified to be open. */
public final class EndSessionHandler extends DomainCommandHandler.InSession<EndSession> {
  private final Clock clock;

  public EndSessionHandler(final Clock clock) {
    super(EndSession.class);
    this.clock = requireArgument(clock, "Clock");
  }

  @Override
  protected List<String> validate(final EndSession command) {
    if (command.reason() == null || command.reason().isBlank()) {
      return List.of("Reason is required");
    }

    return List.of();
  }

  @Override
  protected CommandResult handle(
      final EndSession command, final WriteContext context, final Session session) {
    context.appendEvents(
        session.sessionId(),
        new SessionEnded(session.sessionId(), command.reason(), clock.instant()));
    return CommandResult.ok();
  }
}
