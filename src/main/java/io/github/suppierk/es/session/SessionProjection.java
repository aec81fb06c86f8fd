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

import io.github.suppierk.es.projection.SingleStreamProjection;
import java.util.UUID;

/** Folds session streams into {@link Session} documents. */
public final class SessionProjection extends SingleStreamProjection<Session> {
  public static final String NAME = "Session";

  public SessionProjection() {
    super(NAME, Session.class);

    createdBy(
        SessionCreated.class,
        event -> new Session(event.sessionId(), event.createdAt(), event.createdAt(), false));
    applying(
        SessionActivityRecorded.class, (session, event) -> session.accessedAt(event.accessedAt()));
    applying(SessionEnded.class, (session, event) -> session.endedAt(event.endedAt()));
  }

  @Override
  public UUID documentId(final Session session) {
    return session.sessionId();
  }
}
