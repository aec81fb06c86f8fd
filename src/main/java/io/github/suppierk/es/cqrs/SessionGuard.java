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

import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.store.WriteContext;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates that a supplied session identifier refers to an existing, not closed session.
 *
 * <p>Checks are performed through the same {@link WriteContext} the handler is about to write
 * into, and have no side effects beyond a read.
 */
public final class SessionGuard extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(SessionGuard.class);

  /**
   * @param context to read the session through
   * @param sessionId to check, can be {@code null}
   * @return {@code true} if the session exists and is not closed
   */
  public boolean validate(final WriteContext context, final UUID sessionId) {
    return loadActive(context, sessionId, null).active();
  }

  /**
   * @param context to read the session through
   * @param sessionId to check, can be {@code null}
   * @param preResolvedSession loaded earlier by the caller, can be {@code null}, used instead of a
   *     query only when it has the same identifier and is not closed
   * @return the active session or the reason why there is none
   */
  public SessionCheck loadActive(
      final WriteContext context, final UUID sessionId, final Session preResolvedSession) {
    final WriteContext nonNullContext = requireArgument(context, "Write context");

    if (sessionId == null) {
      return SessionCheck.rejected(CommandFailure.MISSING_SESSION_ID);
    }

    if (preResolvedSession != null
        && sessionId.equals(preResolvedSession.sessionId())
        && !preResolvedSession.closed()) {
      LOGGER.debug("Session {} was resolved by the caller", sessionId);
      return SessionCheck.active(preResolvedSession);
    }

    LOGGER.debug("Session {} is queried", sessionId);
    return nonNullContext
        .load(Session.class, sessionId)
        .map(
            session ->
                session.closed()
                    ? SessionCheck.rejected(CommandFailure.SESSION_CLOSED)
                    : SessionCheck.active(session))
        .orElseGet(() -> SessionCheck.rejected(CommandFailure.INVALID_SESSION_ID));
  }

  /**
   * Outcome of {@link #loadActive(WriteContext, UUID, Session)}: exactly one of the components is
   * set.
   *
   * @param session active session
   * @param failure reason of the rejection
   */
  public record SessionCheck(Session session, CommandFailure failure) {
    public SessionCheck {
      if ((session == null) == (failure == null)) {
        throw new IllegalArgumentException("Exactly one of session and failure must be set");
      }
    }

    static SessionCheck active(final Session session) {
      return new SessionCheck(session, null);
    }

    static SessionCheck rejected(final CommandFailure failure) {
      return new SessionCheck(null, failure);
    }

    /**
     * @return {@code true} if the session can be acted on
     */
    public boolean active() {
      return session != null;
    }
  }
}
