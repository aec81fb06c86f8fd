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

import java.time.Instant;
import java.util.UUID;

/**
 * Projected state of an authenticated client context.
 *
 * <p>Once closed, a session is never reopened, and its last access time only moves forward.
 *
 * @param sessionId identifier of the session and of its stream
 * @param createdAt when the session was created
 * @param lastAccessedAt when the session was used last, informational only
 * @param closed whether the session was ended
 */
public record Session(UUID sessionId, Instant createdAt, Instant lastAccessedAt, boolean closed) {

  Session accessedAt(final Instant accessedAt) {
    return new Session(sessionId, createdAt, latest(accessedAt), closed);
  }

  Session endedAt(final Instant endedAt) {
    return new Session(sessionId, createdAt, latest(endedAt), true);
  }

  private Instant latest(final Instant candidate) {
    return candidate.isAfter(lastAccessedAt) ? candidate : lastAccessedAt;
  }
}
