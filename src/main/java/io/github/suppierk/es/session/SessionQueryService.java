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

import io.github.suppierk.es.store.EventStore;
import java.util.Optional;
import java.util.UUID;

/** Read side of sessions. */
public final class SessionQueryService {
  private final EventStore eventStore;

  public SessionQueryService(final EventStore eventStore) {
    if (eventStore == null) {
      throw new IllegalArgumentException("Event store cannot be null");
    }

    this.eventStore = eventStore;
  }

  /**
   * @param sessionId to look up
   * @return current state of the session, if it exists
   */
  public Optional<Session> findSession(final UUID sessionId) {
    return eventStore.load(Session.class, sessionId);
  }
}
